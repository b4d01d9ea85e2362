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
import net.hydromatic.flatcase.ast.Pos;
import net.hydromatic.flatcase.ast.Shuttle;
import net.hydromatic.flatcase.util.Ord;
import net.hydromatic.flatcase.util.Pair;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import javax.annotation.Nullable;

import static net.hydromatic.flatcase.ast.AstBuilder.ast;
import static net.hydromatic.flatcase.util.Static.toImmutableList;

/** Rewrites guarded right-hand sides into unguarded ones.
 *
 * <p>A function whose rules have guards, such as
 *
 * <blockquote><pre>
 * f (Just x) | x &gt; 0 = 1
 * f _ = 2
 * </pre></blockquote>
 *
 * <p>becomes a single rule whose body is a {@code let} with one binding
 * per rule, plus a binding for the case that no rule matches. Each binding
 * matches the rule's patterns with nested {@code case} expressions, and
 * evaluates the guards as a chain of {@code if} expressions; on failure it
 * falls through to the next binding:
 *
 * <blockquote><pre>
 * f a0 = let {
 *     a1 = case a0 of { Just x -&gt; if x &gt; 0 then 1 else a2; _ -&gt; a2 };
 *     a2 = case a0 of { _ -&gt; 2; _ -&gt; a3 };
 *     a3 = undefined }
 *   in a1
 * </pre></blockquote>
 *
 * <p>A {@code case} expression whose alternatives have guards is rewritten
 * in the same way, over a fresh variable. Rules and alternatives with no
 * guards, even in nested expressions, are left unchanged. */
public class GuardEliminator extends Shuttle {
  private final NameGenerator nameGenerator;
  private final Report report;

  public GuardEliminator(NameGenerator nameGenerator, Report report) {
    this.nameGenerator = Objects.requireNonNull(nameGenerator);
    this.report = Objects.requireNonNull(report);
  }

  /** Eliminates guards from every declaration in a module. */
  public Ast.Module eliminate(Ast.Module module) {
    return module.accept(this);
  }

  /** Eliminates guards from a declaration. Declarations other than
   * functions are returned unchanged. */
  public Ast.Decl eliminate(Ast.Decl decl) {
    return decl.accept(this);
  }

  /** Eliminates guards from the {@code case} expressions (and local
   * functions) within an expression. */
  public Ast.Exp eliminate(Ast.Exp exp) {
    return exp.accept(this);
  }

  @Override public Ast.Decl visit(Ast.FunBind funBind) {
    if (funBind.matches.stream().noneMatch(m -> hasGuards(m.rhs))) {
      return super.visit(funBind);
    }
    final Ast.Match first = funBind.matches.get(0);
    for (Ast.Match match : funBind.matches) {
      if (match.pats.size() != first.pats.size()) {
        throw report.reportFatal(
            Message.error(match.pos, MatchCompiler.DIFFERENT_ARITY));
      }
    }
    final List<Ast.IdPat> vars = first.pats.stream()
        .map(pat -> nameGenerator.pat(pat.pos))
        .collect(toImmutableList());
    final List<Clause> clauses = funBind.matches.stream()
        .map(m -> new Clause(m.pos, m.pats, m.rhs, m.binds))
        .collect(toImmutableList());
    final Ast.Exp exp =
        generateLet(funBind.pos, toExps(vars), ast.undefined(), clauses);
    return funBind.copy(
        ImmutableList.of(
            ast.match(funBind.pos, first.name, false, vars,
                ast.unguardedRhs(funBind.pos, exp), null)));
  }

  @Override public Ast.Exp visit(Ast.Case case_) {
    if (case_.alts.stream().noneMatch(alt -> hasGuards(alt.rhs))) {
      return super.visit(case_);
    }
    final Ast.Exp exp = case_.exp.accept(this);
    final Ast.IdPat newVar = nameGenerator.pat(Pos.ZERO);
    final List<Clause> clauses = case_.alts.stream()
        .map(alt ->
            new Clause(alt.pos, ImmutableList.of(alt.pat), alt.rhs,
                alt.binds))
        .collect(toImmutableList());
    final Ast.Exp let =
        generateLet(case_.pos, ImmutableList.of(newVar.toExp()),
            ast.undefined(), clauses);
    return case_.copy(exp,
        ImmutableList.of(
            ast.alt(case_.pos, newVar, ast.unguardedRhs(let.pos, let), null)));
  }

  private static List<Ast.Exp> toExps(List<Ast.IdPat> vars) {
    return vars.stream().map(Ast.IdPat::toExp).collect(toImmutableList());
  }

  /** Generates a {@code let} expression that tries each clause in turn.
   *
   * @param pos Position of the function or case expression
   * @param vars Expressions to match against each clause's patterns
   * @param err Expression to evaluate if no clause matches
   * @param clauses Clauses
   */
  private Ast.Exp generateLet(Pos pos, List<Ast.Exp> vars, Ast.Exp err,
      List<Clause> clauses) {
    final List<String> names = new ArrayList<>();
    for (Clause clause : clauses) {
      names.add(nameGenerator.get());
    }
    names.add(nameGenerator.get());
    final List<Ast.Exp> nextExps = names.subList(1, names.size()).stream()
        .map(ast::id)
        .collect(toImmutableList());

    // Convert guards into "if" and eliminate guards within the result
    final List<Ast.Exp> ifExps = new ArrayList<>();
    Ord.forEach(clauses, (clause, i) ->
        ifExps.add(rhsToIf(clause.rhs, nextExps.get(i)).accept(this)));

    final List<Ast.Decl> decls = new ArrayList<>();
    Ord.forEach(clauses, (clause, i) -> {
      Ast.Exp exp = ifExps.get(i);
      if (clause.binds != null) {
        exp = ast.let(clause.binds.pos, clause.binds.accept(this), exp);
      }
      final List<Pair<Ast.Exp, Ast.Pat>> pairs = new ArrayList<>();
      Pair.forEach(vars, clause.pats, (v, pat) ->
          pairs.add(Pair.of(v, pat)));
      final Ast.Exp cases =
          nestedCases(clause.pos, exp, nextExps.get(i), pairs);
      decls.add(ast.varBind(cases.pos, names.get(i), cases));
    });
    decls.add(ast.varBind(err.pos, Lists.reverse(names).get(0), err));
    return ast.let(pos, ast.binds(pos, decls), ast.id(names.get(0)));
  }

  /** Generates a sequence of nested {@code case} expressions, each of which
   * matches one expression against one pattern, evaluating
   * {@code successExp} if all match and {@code failExp} if any does not. */
  private static Ast.Exp nestedCases(Pos pos, Ast.Exp successExp,
      Ast.Exp failExp, List<Pair<Ast.Exp, Ast.Pat>> pairs) {
    Ast.Exp exp = successExp;
    for (Pair<Ast.Exp, Ast.Pat> pair : Lists.reverse(pairs)) {
      exp = ast.caseOf(pos, pair.left,
          ImmutableList.of(ast.alt(pair.right, exp),
              ast.alt(ast.wildcardPat(), failExp)));
    }
    return exp;
  }

  /** Converts a right-hand side to an expression. Guards become a chain of
   * {@code if} expressions that ends in {@code next}. */
  private static Ast.Exp rhsToIf(Ast.Rhs rhs, Ast.Exp next) {
    switch (rhs.op) {
    case UNGUARDED_RHS:
      return ((Ast.UnguardedRhs) rhs).exp;
    case GUARDED_RHSS:
      Ast.Exp exp = next;
      for (Ast.GuardedRhs g : Lists.reverse(((Ast.GuardedRhss) rhs).guards)) {
        exp = ast.if_(g.pos, g.guard, g.exp, exp);
      }
      return exp;
    default:
      throw new AssertionError("unknown op " + rhs.op);
    }
  }

  /** Returns whether a right-hand side has guards, or contains a
   * {@code case} expression with guards. */
  static boolean hasGuards(Ast.Rhs rhs) {
    switch (rhs.op) {
    case GUARDED_RHSS:
      return true;
    case UNGUARDED_RHS:
      return hasGuards(((Ast.UnguardedRhs) rhs).exp);
    default:
      throw new AssertionError("unknown op " + rhs.op);
    }
  }

  /** Returns whether an expression contains a {@code case} expression with
   * guards. */
  static boolean hasGuards(Ast.Exp exp) {
    switch (exp.op) {
    case ID:
    case CON:
    case LITERAL:
      return false;
    case INFIX_CALL:
      final Ast.InfixCall infixCall = (Ast.InfixCall) exp;
      return hasGuards(infixCall.a0) || hasGuards(infixCall.a1);
    case APPLY:
      final Ast.Apply apply = (Ast.Apply) exp;
      return hasGuards(apply.fn) || hasGuards(apply.arg);
    case NEGATE:
      return hasGuards(((Ast.Negate) exp).exp);
    case FN:
      return hasGuards(((Ast.Fn) exp).exp);
    case LET:
      return hasGuards(((Ast.Let) exp).exp);
    case IF:
      final Ast.If if_ = (Ast.If) exp;
      return hasGuards(if_.condition)
          || hasGuards(if_.ifTrue)
          || hasGuards(if_.ifFalse);
    case CASE:
      final Ast.Case case_ = (Ast.Case) exp;
      return hasGuards(case_.exp)
          || case_.alts.stream().anyMatch(alt -> hasGuards(alt.rhs));
    case TUPLE:
      return ((Ast.Tuple) exp).args.stream()
          .anyMatch(GuardEliminator::hasGuards);
    case LIST:
      return ((Ast.ListExp) exp).args.stream()
          .anyMatch(GuardEliminator::hasGuards);
    case PAREN:
      return hasGuards(((Ast.Paren) exp).exp);
    case ANNOTATED:
      return hasGuards(((Ast.Annotated) exp).exp);
    default:
      throw new AssertionError("unknown op " + exp.op);
    }
  }

  /** Rule of a function or alternative of a case expression, reduced to
   * what guard elimination needs. */
  private static class Clause {
    final Pos pos;
    final List<Ast.Pat> pats;
    final Ast.Rhs rhs;
    final @Nullable Ast.Binds binds;

    Clause(Pos pos, List<Ast.Pat> pats, Ast.Rhs rhs,
        @Nullable Ast.Binds binds) {
      this.pos = pos;
      this.pats = pats;
      this.rhs = rhs;
      this.binds = binds;
    }
  }
}

// End GuardEliminator.java
