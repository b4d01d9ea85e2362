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
import net.hydromatic.flatcase.ast.Shuttle;
import net.hydromatic.flatcase.compile.MatchCompiler.Equation;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import javax.annotation.Nullable;

import static net.hydromatic.flatcase.ast.AstBuilder.ast;
import static net.hydromatic.flatcase.util.Static.toImmutableList;

/** Helpers for compiling modules and expressions.
 *
 * <p>Compilation runs in stages:
 *
 * <ol>
 * <li>add the module's {@code data} declarations to the environment;
 * <li>eliminate guards ({@link GuardEliminator});
 * <li>compile each function with several rules or with non-variable
 *   patterns, each lambda with non-variable patterns, and each
 *   {@code case} expression, into flat {@code case} expressions
 *   ({@link MatchCompiler});
 * <li>if {@link Prop#OPTIMIZE_CASE} is set, remove {@code case}
 *   expressions whose outcome is known ({@link CaseOptimizer}).
 * </ol> */
public abstract class Compiles {
  private Compiles() {}

  /** Compiles a module.
   *
   * @throws CompileException if the module has a fatal error, after
   *   reporting it to {@code report}
   */
  public static Ast.Module transformModule(Ast.Module module,
      Environment env, Map<Prop, Object> props, NameGenerator nameGenerator,
      Report report) {
    final List<Ast.DataDecl> dataDecls = module.decls.stream()
        .filter(decl -> decl.op == Op.DATA_DECL)
        .map(decl -> (Ast.DataDecl) decl)
        .collect(toImmutableList());
    final Environment env2 = Environments.withDataDecls(env, dataDecls);
    final Ast.Module module2 =
        new GuardEliminator(nameGenerator, report).eliminate(module);
    final Ast.Module module3 =
        module2.accept(
            new Flattener(new MatchCompiler(env2, nameGenerator, report, props),
                nameGenerator));
    return Prop.OPTIMIZE_CASE.booleanValue(props)
        ? CaseOptimizer.optimize(module3)
        : module3;
  }

  /** Compiles an expression. */
  public static Ast.Exp transformExp(Ast.Exp exp, Environment env,
      Map<Prop, Object> props, NameGenerator nameGenerator, Report report) {
    final Ast.Exp exp2 =
        new GuardEliminator(nameGenerator, report).eliminate(exp);
    final Ast.Exp exp3 =
        exp2.accept(
            new Flattener(new MatchCompiler(env, nameGenerator, report, props),
                nameGenerator));
    return Prop.OPTIMIZE_CASE.booleanValue(props)
        ? CaseOptimizer.optimize(exp3)
        : exp3;
  }

  /** Returns whether a list of patterns consists only of variables and
   * wildcards, and therefore needs no matching. */
  static boolean allVars(List<Ast.Pat> pats) {
    return pats.stream().allMatch(pat ->
        pat.op == Op.ID_PAT || pat.op == Op.WILDCARD_PAT);
  }

  /** Converts the right-hand side of a rule or alternative, which must have
   * no guards, to an expression. Local bindings become a {@code let}. */
  static Ast.Exp toExp(Ast.Rhs rhs, @Nullable Ast.Binds binds) {
    if (rhs.op != Op.UNGUARDED_RHS) {
      throw new AssertionError("guards should have been eliminated: " + rhs);
    }
    final Ast.Exp exp = ((Ast.UnguardedRhs) rhs).exp;
    return binds == null || binds.decls.isEmpty()
        ? exp
        : ast.let(binds.pos, binds, exp);
  }

  /** Shuttle that converts pattern-matching constructs into flat
   * {@code case} expressions. Works bottom-up, so that the bodies given to
   * the match compiler are already flat. */
  private static class Flattener extends Shuttle {
    private final MatchCompiler matchCompiler;
    private final NameGenerator nameGenerator;

    Flattener(MatchCompiler matchCompiler, NameGenerator nameGenerator) {
      this.matchCompiler = Objects.requireNonNull(matchCompiler);
      this.nameGenerator = Objects.requireNonNull(nameGenerator);
    }

    @Override public Ast.Decl visit(Ast.FunBind funBind) {
      final Ast.FunBind funBind2 = (Ast.FunBind) super.visit(funBind);
      if (funBind2.matches.size() == 1
          && allVars(funBind2.matches.get(0).pats)) {
        return funBind2;
      }
      final Ast.Match first = funBind2.matches.get(0);
      final List<Ast.IdPat> vars = first.pats.stream()
          .map(pat -> nameGenerator.pat(pat.pos))
          .collect(toImmutableList());
      final List<Equation> eqs = funBind2.matches.stream()
          .map(m -> new Equation(m.pats, toExp(m.rhs, m.binds)))
          .collect(toImmutableList());
      final Ast.Exp exp =
          matchCompiler.match(funBind2.pos, vars, eqs, ast.undefined());
      return funBind2.copy(
          ImmutableList.of(
              first.copy(first.name, ImmutableList.<Ast.Pat>copyOf(vars),
                  ast.unguardedRhs(first.rhs.pos, exp), null)));
    }

    @Override public Ast.Exp visit(Ast.Fn fn) {
      final Ast.Fn fn2 = (Ast.Fn) super.visit(fn);
      if (allVars(fn2.pats)) {
        return fn2;
      }
      final List<Ast.IdPat> vars = fn2.pats.stream()
          .map(pat -> nameGenerator.pat(pat.pos))
          .collect(toImmutableList());
      final Ast.Exp exp =
          matchCompiler.match(fn2.pos, vars,
              ImmutableList.of(new Equation(fn2.pats, fn2.exp)),
              ast.undefined());
      return fn2.copy(ImmutableList.<Ast.Pat>copyOf(vars), exp);
    }

    @Override public Ast.Exp visit(Ast.Case case_) {
      final Ast.Case case2 = (Ast.Case) super.visit(case_);
      final List<Equation> eqs = case2.alts.stream()
          .map(alt ->
              new Equation(ImmutableList.of(alt.pat),
                  toExp(alt.rhs, alt.binds)))
          .collect(toImmutableList());
      if (case2.exp.op == Op.ID
          && !((Ast.Id) case2.exp).name.isQualified()) {
        // Match on the variable directly
        final Ast.IdPat v =
            ast.idPat(case2.exp.pos, ((Ast.Id) case2.exp).name.name);
        return matchCompiler.match(case2.pos, ImmutableList.of(v), eqs,
            ast.undefined());
      }
      final Ast.IdPat v = nameGenerator.pat(case2.exp.pos);
      final Ast.Exp exp =
          matchCompiler.match(case2.pos, ImmutableList.of(v), eqs,
              ast.undefined());
      return ast.let(case2.pos,
          ast.binds(case2.pos,
              ImmutableList.of(ast.varBind(case2.exp.pos, v.name, case2.exp))),
          exp);
    }
  }
}

// End Compiles.java
