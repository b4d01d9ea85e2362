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

import com.google.common.collect.ImmutableList;

import org.junit.Test;

import static net.hydromatic.flatcase.ast.AstBuilder.ast;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.fail;

/** Tests for {@link GuardEliminator}. */
public class GuardEliminatorTest {
  private final Diagnostics diagnostics = new Diagnostics();

  private GuardEliminator eliminator() {
    return new GuardEliminator(new NameGenerator(), diagnostics);
  }

  private static Ast.Exp positive(String name) {
    return ast.infixCall(ast.id(name), ">", ast.intLiteral(0));
  }

  /** <pre>
   * f (Just x) | x &gt; 0 = 1
   * f _ = 2
   * </pre> */
  @Test public void testFunction() {
    final Ast.Decl decl =
        ast.funBind(
            ast.match("f",
                ImmutableList.of(ast.conPat("Just", ast.idPat("x"))),
                ast.guardedRhss(
                    ast.guardedRhs(positive("x"), ast.intLiteral(1)))),
            ast.match("f", ImmutableList.of(ast.wildcardPat()),
                ast.intLiteral(2)));
    assertThat(decl.toString(),
        is("f (Just x) | x > 0 = 1; f _ = 2"));
    final Ast.Decl decl2 =
        eliminator().eliminate(decl);
    assertThat(decl2.toString(),
        is("f a0 = let { "
            + "a1 = case a0 of { Just x -> if x > 0 then 1 else a2; _ -> a2 }; "
            + "a2 = case a0 of { _ -> 2; _ -> a3 }; "
            + "a3 = undefined } in a1"));
  }

  /** Several guards become a chain of "if"; the rule's local bindings are
   * in scope in every guard. */
  @Test public void testGuardsWhere() {
    final Ast.Decl decl =
        ast.funBind(
            ast.match(Pos.ZERO, "f", false, ImmutableList.of(ast.idPat("x")),
                ast.guardedRhss(
                    ast.guardedRhs(
                        ast.infixCall(ast.id("x"), ">", ast.id("y")),
                        ast.intLiteral(1)),
                    ast.guardedRhs(ast.id("otherwise"), ast.intLiteral(2))),
                ast.binds(ast.varBind("y", ast.intLiteral(10)))));
    assertThat(decl.toString(),
        is("f x | x > y = 1 | otherwise = 2 where { y = 10 }"));
    final Ast.Decl decl2 =
        eliminator().eliminate(decl);
    assertThat(decl2.toString(),
        is("f a0 = let { "
            + "a1 = case a0 of { x -> let { y = 10 } in "
            + "if x > y then 1 else if otherwise then 2 else a2; _ -> a2 }; "
            + "a2 = undefined } in a1"));
  }

  @Test public void testCase() {
    final Ast.Exp e =
        ast.caseOf(ast.id("m"),
            ast.alt(ast.conPat("Just", ast.idPat("x")),
                ast.guardedRhss(
                    ast.guardedRhs(positive("x"), ast.intLiteral(1)))),
            ast.alt(ast.wildcardPat(), ast.intLiteral(2)));
    assertThat(e.toString(),
        is("case m of { Just x | x > 0 -> 1; _ -> 2 }"));
    final Ast.Exp e2 = eliminator().eliminate(e);
    assertThat(e2.toString(),
        is("case m of { a0 -> let { "
            + "a1 = case a0 of { Just x -> if x > 0 then 1 else a2; _ -> a2 }; "
            + "a2 = case a0 of { _ -> 2; _ -> a3 }; "
            + "a3 = undefined } in a1 }"));
  }

  /** A guarded case inside an unguarded rule is rewritten; the rule is
   * rewritten too, because its body contains guards. */
  @Test public void testNestedCase() {
    final Ast.Exp body =
        ast.caseOf(ast.id("x"),
            ast.alt(ast.idPat("y"),
                ast.guardedRhss(
                    ast.guardedRhs(positive("y"), ast.intLiteral(1)))));
    final Ast.Decl decl =
        ast.funBind(
            ast.match("g", ImmutableList.of(ast.idPat("x")), body));
    assertThat(GuardEliminator.hasGuards(body), is(true));
    final Ast.Decl decl2 =
        eliminator().eliminate(decl);
    assertThat(decl2.toString(),
        is("g a0 = let { "
            + "a1 = case a0 of { x -> case x of { a3 -> let { "
            + "a4 = case a3 of { y -> if y > 0 then 1 else a5; _ -> a5 }; "
            + "a5 = undefined } in a4 }; _ -> a2 }; "
            + "a2 = undefined } in a1"));
  }

  /** <pre>
   * f (Just x) | x &gt; 0 = 1
   * f _ _ = 2
   * </pre>
   *
   * <p>The second rule has an extra argument; the error points at it. */
  @Test public void testDifferentArity() {
    final Pos pos = Pos.of("f.hs", 2, 1, 10);
    final Ast.Decl decl =
        ast.funBind(
            ast.match("f",
                ImmutableList.of(ast.conPat("Just", ast.idPat("x"))),
                ast.guardedRhss(
                    ast.guardedRhs(positive("x"), ast.intLiteral(1)))),
            ast.match(pos, "f", false,
                ImmutableList.of(ast.wildcardPat(), ast.wildcardPat()),
                ast.unguardedRhs(ast.intLiteral(2)), null));
    try {
      final Ast.Decl decl2 = eliminator().eliminate(decl);
      fail("expected error, got " + decl2);
    } catch (CompileException e) {
      assertThat(e.isInternal(), is(false));
      assertThat(e.pos(), is(pos));
      assertThat(e.getMessage(),
          is("f.hs:2.1-10: error: " + MatchCompiler.DIFFERENT_ARITY));
    }
    assertThat(diagnostics.hasErrors(), is(true));
  }

  @Test public void testNoGuards() {
    final Ast.Decl decl =
        ast.funBind(
            ast.match("f", ImmutableList.of(ast.idPat("x")),
                ast.fn(ast.idPat("y"),
                    ast.caseOf(ast.id("y"),
                        ast.alt(ast.wildcardPat(), ast.id("x"))))));
    assertThat(GuardEliminator.hasGuards(
            ((Ast.FunBind) decl).matches.get(0).rhs),
        is(false));
    assertThat(eliminator().eliminate(decl),
        sameInstance(decl));
  }
}

// End GuardEliminatorTest.java
