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
import net.hydromatic.flatcase.ast.QName;
import net.hydromatic.flatcase.ast.Shuttle;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import javax.annotation.Nullable;

import static net.hydromatic.flatcase.ast.AstBuilder.ast;

/** Removes {@code case} expressions whose outcome is known.
 *
 * <p>A {@code case} is redundant if its scrutinee is a constructor
 * application, such as "{@code case Nothing of ...}" (which the
 * pattern-matching compiler produces when it substitutes a constructor for
 * a variable in a fallback expression), or a variable that an enclosing
 * alternative has already matched, such as the inner {@code case} in
 * "{@code case x of { Just y -> case x of { Just z -> z; _ -> 0 }; ... }}".
 *
 * <p>The redundant {@code case} is replaced with the body of the
 * alternative that would be chosen, its pattern variables replaced with
 * the constructor's arguments. */
public class CaseOptimizer extends Shuttle {
  private static final CaseOptimizer EMPTY =
      new CaseOptimizer(ImmutableMap.of());

  /** What is known about the value of each variable. */
  private final ImmutableMap<QName, Shape> known;

  private CaseOptimizer(ImmutableMap<QName, Shape> known) {
    this.known = Objects.requireNonNull(known);
  }

  public static Ast.Module optimize(Ast.Module module) {
    return module.accept(EMPTY);
  }

  public static Ast.Decl optimize(Ast.Decl decl) {
    return decl.accept(EMPTY);
  }

  public static Ast.Exp optimize(Ast.Exp exp) {
    return exp.accept(EMPTY);
  }

  @Override public Ast.Exp visit(Ast.Case case_) {
    final Ast.Exp exp = case_.exp.accept(this);
    final Shape shape = shapeOf(exp);
    if (shape != null) {
      final Ast.Exp body = select(shape, exp, case_.alts);
      if (body != null) {
        return body.accept(this);
      }
    }
    final List<Ast.Alt> alts = new ArrayList<>();
    for (Ast.Alt alt : case_.alts) {
      final Set<String> bound = boundVars(alt);
      CaseOptimizer optimizer = forget(bound);
      if (exp.op == Op.ID) {
        final QName name = ((Ast.Id) exp).name;
        final Shape altShape = shapeOf(alt.pat);
        if (altShape != null
            && !name.isQualified()
            && !bound.contains(name.name)
            && !altShape.mentionsAny(alt.binds == null
                ? ImmutableSet.<String>of()
                : FreeVars.boundVars(alt.binds))) {
          optimizer = optimizer.withKnown(name, altShape);
        }
      }
      alts.add(optimizer.optimizeAlt(alt));
    }
    return case_.copy(exp, alts);
  }

  @Override public Ast.Exp visit(Ast.Fn fn) {
    return fn.copy(fn.pats, fn.exp.accept(forget(FreeVars.boundVars(fn.pats))));
  }

  @Override public Ast.Exp visit(Ast.Let let) {
    final CaseOptimizer optimizer = forget(FreeVars.boundVars(let.binds));
    return let.copy(let.binds.accept(optimizer), let.exp.accept(optimizer));
  }

  @Override public Ast.Alt visit(Ast.Alt alt) {
    return forget(boundVars(alt)).optimizeAlt(alt);
  }

  @Override public Ast.Match visit(Ast.Match match) {
    final Set<String> bound = new LinkedHashSet<>();
    bound.add(match.name);
    bound.addAll(FreeVars.boundVars(match.pats));
    if (match.binds != null) {
      bound.addAll(FreeVars.boundVars(match.binds));
    }
    final CaseOptimizer optimizer = forget(bound);
    return match.copy(match.name, match.pats, match.rhs.accept(optimizer),
        optimizer.visitOpt(match.binds));
  }

  private Ast.Alt optimizeAlt(Ast.Alt alt) {
    return alt.copy(alt.pat, alt.rhs.accept(this), visitOpt(alt.binds));
  }

  private static Set<String> boundVars(Ast.Alt alt) {
    final Set<String> bound = new LinkedHashSet<>(FreeVars.boundVars(alt.pat));
    if (alt.binds != null) {
      bound.addAll(FreeVars.boundVars(alt.binds));
    }
    return bound;
  }

  /** Returns an optimizer that knows the shape of one more variable. */
  private CaseOptimizer withKnown(QName name, Shape shape) {
    final Map<QName, Shape> map = new LinkedHashMap<>(known);
    map.put(name, shape);
    return new CaseOptimizer(ImmutableMap.copyOf(map));
  }

  /** Returns an optimizer that has forgotten what it knew about variables
   * that are hidden by new variables of the same name. */
  private CaseOptimizer forget(Collection<String> names) {
    if (names.isEmpty() || known.isEmpty()) {
      return this;
    }
    final ImmutableMap.Builder<QName, Shape> map = ImmutableMap.builder();
    known.forEach((name, shape) -> {
      if (!names.contains(name.name) || name.isQualified()) {
        if (!shape.mentionsAny(names)) {
          map.put(name, shape);
        }
      }
    });
    return new CaseOptimizer(map.build());
  }

  /** Chooses the alternative that a value of a given shape would match,
   * and returns its body with the pattern's variables replaced; or returns
   * null if the alternative cannot be determined. */
  private static @Nullable Ast.Exp select(Shape shape, Ast.Exp exp,
      List<Ast.Alt> alts) {
    for (Ast.Alt alt : alts) {
      if (alt.binds != null || alt.rhs.op != Op.UNGUARDED_RHS) {
        return null;
      }
      final Ast.Exp body = ((Ast.UnguardedRhs) alt.rhs).exp;
      final Ast.Pat pat = MatchCompiler.stripParens(alt.pat);
      switch (pat.op) {
      case WILDCARD_PAT:
        return body;

      case ID_PAT:
        if (exp.op != Op.ID) {
          // would duplicate the scrutinee
          return null;
        }
        return Subst.single(((Ast.IdPat) pat).name, exp).apply(body);

      default:
        final QName con = Objects.requireNonNull(MatchCompiler.conNameOpt(pat));
        if (!con.unqualified().equals(shape.con.unqualified())) {
          continue;
        }
        final List<Ast.Pat> subPats = MatchCompiler.subPatterns(pat);
        if (subPats.size() != shape.args.size()) {
          return null;
        }
        final Map<QName, Ast.Exp> map = new LinkedHashMap<>();
        for (int i = 0; i < subPats.size(); i++) {
          final Ast.Pat subPat = MatchCompiler.stripParens(subPats.get(i));
          switch (subPat.op) {
          case WILDCARD_PAT:
            break;
          case ID_PAT:
            final Ast.Exp arg = shape.args.get(i);
            if (arg == null) {
              return null;
            }
            map.put(QName.of(((Ast.IdPat) subPat).name), arg);
            break;
          default:
            return null;
          }
        }
        return Subst.of(map).apply(body);
      }
    }
    return null;
  }

  /** Returns the shape of the value of an expression, if it is a
   * constructor application or a variable whose shape is known. */
  private @Nullable Shape shapeOf(Ast.Exp exp) {
    switch (exp.op) {
    case PAREN:
      return shapeOf(((Ast.Paren) exp).exp);
    case ID:
      return known.get(((Ast.Id) exp).name);
    case CON:
      return new Shape(((Ast.Con) exp).name, ImmutableList.of());
    case APPLY:
      final List<Ast.Exp> args = new ArrayList<>();
      Ast.Exp e = exp;
      while (e.op == Op.APPLY) {
        args.add(0, ((Ast.Apply) e).arg);
        e = ((Ast.Apply) e).fn;
      }
      while (e.op == Op.PAREN) {
        e = ((Ast.Paren) e).exp;
      }
      return e.op == Op.CON ? new Shape(((Ast.Con) e).name, args) : null;
    case INFIX_CALL:
      final Ast.InfixCall infixCall = (Ast.InfixCall) exp;
      return infixCall.isConstructor()
          ? new Shape(infixCall.operatorName(),
              ImmutableList.of(infixCall.a0, infixCall.a1))
          : null;
    case TUPLE:
      final ImmutableList<Ast.Exp> tupleArgs = ((Ast.Tuple) exp).args;
      switch (tupleArgs.size()) {
      case 0:
        return new Shape(QName.UNIT, tupleArgs);
      case 1:
        return shapeOf(tupleArgs.get(0));
      default:
        return new Shape(QName.tuple(tupleArgs.size()), tupleArgs);
      }
    case LIST:
      final Ast.ListExp list = (Ast.ListExp) exp;
      if (list.args.isEmpty()) {
        return new Shape(QName.NIL, ImmutableList.of());
      }
      return new Shape(QName.CONS,
          ImmutableList.of(list.args.get(0),
              ast.list(list.pos, list.args.subList(1, list.args.size()))));
    default:
      return null;
    }
  }

  /** Returns the shape that a value must have to match a flat constructor
   * pattern (one whose arguments are variables or wildcards), or null if
   * the pattern is not flat. */
  private static @Nullable Shape shapeOf(Ast.Pat pat) {
    final QName con = MatchCompiler.conNameOpt(pat);
    if (con == null) {
      return null;
    }
    final List<Ast.Exp> args = new ArrayList<>();
    for (Ast.Pat subPat : MatchCompiler.subPatterns(pat)) {
      final Ast.Pat p = MatchCompiler.stripParens(subPat);
      switch (p.op) {
      case ID_PAT:
        args.add(((Ast.IdPat) p).toExp());
        break;
      case WILDCARD_PAT:
        args.add(null);
        break;
      default:
        return null;
      }
    }
    return new Shape(con, args);
  }

  /** Constructor and arguments of a value. An argument is null if it is
   * not known. */
  private static class Shape {
    final QName con;
    final List<Ast.Exp> args;

    Shape(QName con, List<Ast.Exp> args) {
      this.con = Objects.requireNonNull(con);
      this.args = Collections.unmodifiableList(new ArrayList<>(args));
    }

    /** Returns whether any argument refers to any of the given
     * variables. */
    boolean mentionsAny(Collection<String> names) {
      for (Ast.Exp arg : args) {
        if (arg != null) {
          for (QName name : FreeVars.freeVars(arg)) {
            if (!name.isQualified() && names.contains(name.name)) {
              return true;
            }
          }
        }
      }
      return false;
    }
  }
}

// End CaseOptimizer.java
