/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.flatcase.compile;

import net.hydromatic.flatcase.ast.Ast;
import net.hydromatic.flatcase.ast.Op;
import net.hydromatic.flatcase.ast.Pos;
import net.hydromatic.flatcase.ast.QName;
import net.hydromatic.flatcase.type.ConEntry;
import net.hydromatic.flatcase.util.Pair;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiPredicate;
import javax.annotation.Nullable;

import static net.hydromatic.flatcase.ast.AstBuilder.ast;
import static net.hydromatic.flatcase.util.Static.toImmutableList;

/** Compiles a list of equations into an expression that matches patterns
 * using only flat {@code case} expressions, one constructor at a time.
 *
 * <p>The algorithm is Wadler's, from chapter 5 of Peyton Jones, "The
 * Implementation of Functional Programming Languages" (1987). Given
 * variables {@code x1 ... xn} and equations whose patterns are matched
 * against those variables, it applies the first of the following rules
 * that fits:
 *
 * <ol>
 * <li>If there are no variables, and at least one equation, the result is
 *   the right-hand side of the first equation.
 * <li>If there are no variables and no equations, the result is the
 *   fallback expression.
 * <li>If every equation starts with a variable or wildcard, substitute
 *   {@code x1} for that variable, and match the remaining variables.
 * <li>If every equation starts with a constructor pattern, build a
 *   {@code case} over {@code x1} with one alternative per constructor, and
 *   complete it with alternatives for the constructors not mentioned.
 * <li>Otherwise, split the equations into runs that start with variables
 *   and runs that start with constructors, and match each run, using the
 *   result of the next run as its fallback.
 * </ol> */
public class MatchCompiler {
  private final Environment env;
  private final NameGenerator nameGenerator;
  private final Report report;
  private final boolean trivialCaseCompletion;

  public MatchCompiler(Environment env, NameGenerator nameGenerator,
      Report report, boolean trivialCaseCompletion) {
    this.env = Objects.requireNonNull(env);
    this.nameGenerator = Objects.requireNonNull(nameGenerator);
    this.report = Objects.requireNonNull(report);
    this.trivialCaseCompletion = trivialCaseCompletion;
  }

  public MatchCompiler(Environment env, NameGenerator nameGenerator,
      Report report, Map<Prop, Object> props) {
    this(env, nameGenerator, report,
        Prop.TRIVIAL_CASE_COMPLETION.booleanValue(props));
  }

  /** Compiles equations into an expression.
   *
   * @param pos Position of the declaration or expression being compiled;
   *            used in error messages
   * @param vars Variables to match; every equation must have one pattern
   *             per variable
   * @param eqs Equations, in priority order
   * @param fallback Expression to evaluate if no equation matches
   * @return Expression that matches the equations
   *
   * @throws CompileException if the equations have different numbers of
   *   patterns, or if a constructor is not in the environment
   */
  public Ast.Exp match(Pos pos, List<Ast.IdPat> vars, List<Equation> eqs,
      Ast.Exp fallback) {
    if (vars.isEmpty()) {
      if (eqs.isEmpty()) {
        return fallback;
      }
      final Equation eq = eqs.get(0);
      if (eq.pats.isEmpty()) {
        return eq.exp;
      }
      throw report.reportFatal(Message.error(pos, DIFFERENT_ARITY));
    }
    for (Equation eq : eqs) {
      if (eq.pats.isEmpty()) {
        throw report.reportFatal(Message.error(pos, DIFFERENT_ARITY));
      }
    }
    final Ast.IdPat x = vars.get(0);
    final List<Ast.IdPat> xs = vars.subList(1, vars.size());
    if (eqs.stream().allMatch(eq -> isVarPat(eq.firstPat()))) {
      final List<Equation> eqs2 = eqs.stream()
          .map(eq -> substVar(x, eq))
          .collect(toImmutableList());
      return match(pos, xs, eqs2, fallback);
    }
    if (eqs.stream().noneMatch(eq -> isVarPat(eq.firstPat()))) {
      return makeCase(pos, x, xs, eqs, fallback);
    }
    return matchMixed(pos, vars, eqs, fallback);
  }

  static final String DIFFERENT_ARITY =
      "Equations have different number of arguments.";

  static final String SINGLE_GROUP =
      "Failed to group equations by pattern type. "
          + "All patterns are in the same group.";

  static final String EMPTY_CASE =
      "Could not identify missing constructors: "
          + "Empty case expressions are not supported.";

  /** Applies the mixture rule: partitions the equations into maximal runs
   * that start with variable patterns or start with constructor patterns,
   * and matches each run, last first, each using the result of the next
   * run as its fallback. */
  Ast.Exp matchMixed(Pos pos, List<Ast.IdPat> vars, List<Equation> eqs,
      Ast.Exp fallback) {
    final List<List<Equation>> groups = groupByFirstPatType(eqs);
    if (groups.size() == 1) {
      // Matching the single group would recurse on the same input
      throw report.reportFatal(Message.internal(pos, SINGLE_GROUP));
    }
    Ast.Exp exp = fallback;
    for (List<Equation> group : Lists.reverse(groups)) {
      exp = match(pos, vars, group, exp);
    }
    return exp;
  }

  /** Removes the first pattern (a variable or wildcard) of an equation,
   * replacing the variable it binds with {@code x} in the right-hand
   * side. */
  private static Equation substVar(Ast.IdPat x, Equation eq) {
    final Ast.Pat pat = stripParens(eq.firstPat());
    final Ast.Exp exp;
    if (pat.op == Op.ID_PAT) {
      exp = Subst.single(((Ast.IdPat) pat).name, x.toExp()).apply(eq.exp);
    } else {
      exp = eq.exp;
    }
    return new Equation(eq.pats.subList(1, eq.pats.size()), exp);
  }

  private Ast.Case makeCase(Pos pos, Ast.IdPat x, List<Ast.IdPat> xs,
      List<Equation> eqs, Ast.Exp fallback) {
    final List<Ast.Alt> alts = new ArrayList<>();
    for (List<Equation> group : groupByConstructor(eqs)) {
      alts.add(computeAlt(pos, x, xs, group, fallback));
    }
    final List<ConEntry> missingCons = missingConstructors(pos, alts);
    if (!missingCons.isEmpty()) {
      if (trivialCaseCompletion) {
        alts.add(ast.alt(ast.wildcardPat(), ast.undefined()));
      } else {
        for (ConEntry con : missingCons) {
          alts.add(missingAlt(x, con, fallback));
        }
      }
    }
    return ast.caseOf(pos, x.toExp(), alts);
  }

  /** Creates an alternative for a group of equations whose first patterns
   * have the same constructor.
   *
   * <p>Within the alternative, {@code x} is known to have the shape of the
   * alternative's pattern; the fallback and the result are rewritten to use
   * that shape rather than {@code x}. */
  private Ast.Alt computeAlt(Pos pos, Ast.IdPat x, List<Ast.IdPat> xs,
      List<Equation> group, Ast.Exp fallback) {
    if (group.isEmpty()) {
      throw report.reportFatal(
          Message.internal(pos, "Expected at least one pattern in group."));
    }
    final Pair<Ast.Pat, List<Ast.IdPat>> decomposed =
        decompose(group.get(0).firstPat());
    final Ast.Pat conPat = decomposed.left;
    final List<Equation> eqs2 = group.stream()
        .map(eq ->
            new Equation(
                ImmutableList.<Ast.Pat>builder()
                    .addAll(subPatterns(eq.firstPat()))
                    .addAll(eq.pats.subList(1, eq.pats.size()))
                    .build(),
                eq.exp))
        .collect(toImmutableList());
    final List<Ast.IdPat> vars2 = ImmutableList.<Ast.IdPat>builder()
        .addAll(decomposed.right)
        .addAll(xs)
        .build();
    final Subst subst = Subst.single(x.name, conPat.toExp());
    final Ast.Exp exp = match(pos, vars2, eqs2, subst.apply(fallback));
    return ast.alt(conPat, subst.apply(exp));
  }

  /** Replaces the immediate sub-patterns of a constructor pattern with
   * fresh variables. List and tuple patterns are treated as applications
   * of their constructors. */
  private Pair<Ast.Pat, List<Ast.IdPat>> decompose(Ast.Pat pat) {
    final List<Ast.IdPat> vars = new ArrayList<>();
    switch (pat.op) {
    case CON_PAT:
      final Ast.ConPat conPat = (Ast.ConPat) pat;
      conPat.args.forEach(arg -> vars.add(nameGenerator.pat(arg.pos)));
      return Pair.of(ast.conPat(conPat.pos, conPat.con, vars), vars);

    case INFIX_CON_PAT:
      final Ast.InfixConPat infixConPat = (Ast.InfixConPat) pat;
      vars.add(nameGenerator.pat(infixConPat.p0.pos));
      vars.add(nameGenerator.pat(infixConPat.p1.pos));
      return Pair.of(
          ast.infixConPat(infixConPat.pos, vars.get(0), infixConPat.con,
              vars.get(1)),
          vars);

    case LIST_PAT:
      final Ast.ListPat listPat = (Ast.ListPat) pat;
      if (listPat.args.isEmpty()) {
        return Pair.of(listPat, vars);
      }
      return decompose(consPat(listPat));

    case TUPLE_PAT:
      final Ast.TuplePat tuplePat = (Ast.TuplePat) pat;
      tuplePat.args.forEach(arg -> vars.add(nameGenerator.pat(arg.pos)));
      return Pair.of(ast.tuplePat(tuplePat.pos, vars), vars);

    case PAREN_PAT:
      return decompose(((Ast.ParenPat) pat).pat);

    default:
      throw new AssertionError("not a constructor pattern: " + pat);
    }
  }

  /** Converts a non-empty list pattern "{@code [p1, p2, ...]}" to
   * "{@code p1 : [p2, ...]}". */
  private static Ast.InfixConPat consPat(Ast.ListPat listPat) {
    return ast.infixConPat(listPat.pos, listPat.args.get(0), QName.CONS,
        ast.listPat(listPat.pos,
            listPat.args.subList(1, listPat.args.size())));
  }

  /** Returns the immediate sub-patterns of a constructor pattern; for
   * example, the sub-patterns of "{@code [x, y]}" are "{@code x}" and
   * "{@code [y]}". Variable and wildcard patterns have none. */
  public static List<Ast.Pat> subPatterns(Ast.Pat pat) {
    switch (pat.op) {
    case CON_PAT:
      return ((Ast.ConPat) pat).args;
    case INFIX_CON_PAT:
      final Ast.InfixConPat infixConPat = (Ast.InfixConPat) pat;
      return ImmutableList.of(infixConPat.p0, infixConPat.p1);
    case LIST_PAT:
      final Ast.ListPat listPat = (Ast.ListPat) pat;
      return listPat.args.isEmpty()
          ? ImmutableList.of()
          : subPatterns(consPat(listPat));
    case TUPLE_PAT:
      return ((Ast.TuplePat) pat).args;
    case PAREN_PAT:
      return subPatterns(((Ast.ParenPat) pat).pat);
    case ID_PAT:
    case WILDCARD_PAT:
      return ImmutableList.of();
    default:
      throw new AssertionError("unknown op " + pat.op);
    }
  }

  /** Creates an alternative for a constructor that no equation mentions.
   * The body is the fallback, with {@code x} replaced by the
   * constructor's shape. */
  private Ast.Alt missingAlt(Ast.IdPat x, ConEntry con, Ast.Exp fallback) {
    final List<Ast.IdPat> args = new ArrayList<>();
    for (int i = 0; i < con.arity; i++) {
      args.add(nameGenerator.pat(Pos.ZERO));
    }
    final Ast.Pat conPat = con.infix
        ? ast.infixConPat(x.pos, args.get(0), con.name, args.get(1))
        : ast.conPat(x.pos, con.name, args);
    final Subst subst = Subst.single(x.name, conPat.toExp());
    return ast.alt(conPat, subst.apply(fallback));
  }

  /** Returns the constructors of the type being matched that no
   * alternative matches, in the order the type declares them. */
  List<ConEntry> missingConstructors(Pos pos, List<Ast.Alt> alts) {
    if (alts.isEmpty()) {
      throw report.reportFatal(Message.error(pos, EMPTY_CASE));
    }
    final List<QName> matchedNames = alts.stream()
        .map(alt -> Objects.requireNonNull(conNameOpt(alt.pat)).unqualified())
        .collect(toImmutableList());
    final QName conName = matchedNames.get(0);
    final QName typeName = env.getTypeOpt(conName);
    if (typeName == null) {
      throw report.reportFatal(
          Message.error(pos, "Data constructor not in scope: " + conName));
    }
    final List<ConEntry> constructors = env.getConstructorsOpt(typeName);
    if (constructors == null) {
      throw report.reportFatal(
          Message.error(pos, "Data type not in scope: " + typeName));
    }
    return constructors.stream()
        .filter(c -> !matchedNames.contains(c.name.unqualified()))
        .collect(toImmutableList());
  }

  /** Returns whether a pattern is a variable or wildcard, possibly in
   * parentheses. */
  public static boolean isVarPat(Ast.Pat pat) {
    switch (stripParens(pat).op) {
    case ID_PAT:
    case WILDCARD_PAT:
      return true;
    default:
      return false;
    }
  }

  static Ast.Pat stripParens(Ast.Pat pat) {
    while (pat.op == Op.PAREN_PAT) {
      pat = ((Ast.ParenPat) pat).pat;
    }
    return pat;
  }

  /** Returns the name of the constructor that a pattern matches, or null if
   * the pattern is a variable or wildcard.
   *
   * <p>A list pattern matches "{@code []}" if it is empty and
   * "{@code :}" otherwise; a tuple pattern of n elements matches the n-ary
   * tuple constructor. */
  public static @Nullable QName conNameOpt(Ast.Pat pat) {
    switch (pat.op) {
    case CON_PAT:
      return ((Ast.ConPat) pat).con;
    case INFIX_CON_PAT:
      return ((Ast.InfixConPat) pat).con;
    case LIST_PAT:
      return ((Ast.ListPat) pat).args.isEmpty() ? QName.NIL : QName.CONS;
    case TUPLE_PAT:
      final int arity = ((Ast.TuplePat) pat).args.size();
      return arity == 0 ? QName.UNIT : QName.tuple(arity);
    case PAREN_PAT:
      return conNameOpt(((Ast.ParenPat) pat).pat);
    case ID_PAT:
    case WILDCARD_PAT:
      return null;
    default:
      throw new AssertionError("unknown op " + pat.op);
    }
  }

  /** Returns whether two patterns match the same constructor, or are both
   * variables or wildcards. A module qualifier does not change the
   * constructor that a name refers to. */
  public static boolean sameConstructor(Ast.Pat pat0, Ast.Pat pat1) {
    final QName con0 = conNameOpt(pat0);
    final QName con1 = conNameOpt(pat1);
    if (con0 == null || con1 == null) {
      return con0 == con1;
    }
    return con0.unqualified().equals(con1.unqualified());
  }

  /** Groups equations by the constructor of their first pattern.
   *
   * <p>All equations with the same constructor go into the same group,
   * whether or not they are adjacent. Groups are ordered by their first
   * member, and equations within a group retain their order. */
  public static List<List<Equation>> groupByConstructor(
      List<Equation> eqs) {
    return groupBy(eqs, (eq0, eq1) ->
        sameConstructor(eq0.firstPat(), eq1.firstPat()));
  }

  /** Splits equations into maximal runs of adjacent equations whose first
   * patterns are all variables or all constructors. */
  static List<List<Equation>> groupByFirstPatType(List<Equation> eqs) {
    final List<List<Equation>> groups = new ArrayList<>();
    List<Equation> group = null;
    boolean varFirst = false;
    for (Equation eq : eqs) {
      final boolean varFirst2 = isVarPat(eq.firstPat());
      if (group == null || varFirst2 != varFirst) {
        group = new ArrayList<>();
        groups.add(group);
        varFirst = varFirst2;
      }
      group.add(eq);
    }
    return groups;
  }

  /** Groups elements so that all elements equivalent to the first member of
   * a group are in that group. Stable. */
  static <E> List<List<E>> groupBy(List<E> list, BiPredicate<E, E> equiv) {
    final List<List<E>> groups = new ArrayList<>();
    outer:
    for (E e : list) {
      for (List<E> group : groups) {
        if (equiv.test(group.get(0), e)) {
          group.add(e);
          continue outer;
        }
      }
      final List<E> group = new ArrayList<>();
      group.add(e);
      groups.add(group);
    }
    return groups;
  }

  /** Equation; a list of patterns and the expression to evaluate if all of
   * them match. */
  public static class Equation {
    public final ImmutableList<Ast.Pat> pats;
    public final Ast.Exp exp;

    public Equation(List<? extends Ast.Pat> pats, Ast.Exp exp) {
      this.pats = ImmutableList.copyOf(pats);
      this.exp = Objects.requireNonNull(exp);
    }

    /** Creates an equation. */
    public static Equation of(Ast.Exp exp, Ast.Pat... pats) {
      return new Equation(ImmutableList.copyOf(pats), exp);
    }

    Ast.Pat firstPat() {
      return pats.get(0);
    }

    @Override public String toString() {
      final StringBuilder b = new StringBuilder();
      for (Ast.Pat pat : pats) {
        b.append(pat).append(' ');
      }
      return b.append("-> ").append(exp).toString();
    }
  }
}

// End MatchCompiler.java
