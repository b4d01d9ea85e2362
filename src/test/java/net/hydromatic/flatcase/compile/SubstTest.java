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
import net.hydromatic.flatcase.ast.QName;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import org.junit.Test;

import static net.hydromatic.flatcase.ast.AstBuilder.ast;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.junit.Assert.assertThat;

/** Tests for {@link Subst}. */
public class SubstTest {
  private static Ast.Exp x() {
    return ast.id("x");
  }

  private static Ast.Exp y() {
    return ast.id("y");
  }

  @Test public void testIdentity() {
    final Ast.Exp e = ast.infixCall(x(), "+", y());
    assertThat(Subst.identity().isIdentity(), is(true));
    assertThat(Subst.identity().apply(e), sameInstance(e));
  }

  @Test public void testReplace() {
    final Ast.Exp e =
        ast.apply(ast.id("f"), x(), ast.tuple(x(), y()), ast.list(x()));
    final Ast.Exp e2 = Subst.single("x", ast.intLiteral(1)).apply(e);
    assertThat(e2.toString(), is("f 1 (1, y) [1]"));
    assertThat(e.toString(), is("f x (x, y) [x]"));
  }

  /** A variable that is bound by the lambda is not replaced. */
  @Test public void testShadow() {
    final Ast.Exp e = ast.fn(ast.idPat("x"), x());
    assertThat(Subst.single("x", ast.intLiteral(1)).apply(e),
        sameInstance(e));
  }

  /** Substituting "y" for "x" in "\y -> x" must not capture "y". */
  @Test public void testCaptureFn() {
    final Ast.Exp e = ast.fn(ast.idPat("y"), x());
    final Ast.Exp e2 = Subst.single("x", y()).apply(e);
    assertThat(e2.toString(), is("\\y_0 -> y"));
  }

  @Test public void testCaptureLet() {
    final Ast.Exp e =
        ast.let(ast.binds(ast.varBind("y", x())),
            ast.infixCall(y(), "+", x()));
    final Ast.Exp e2 = Subst.single("x", y()).apply(e);
    assertThat(e2.toString(), is("let { y_0 = y } in y_0 + y"));
  }

  @Test public void testCaptureAlt() {
    final Ast.Exp e =
        ast.caseOf(ast.id("m"),
            ast.alt(ast.conPat("Just", ast.idPat("y")),
                ast.tuple(x(), y())),
            ast.alt(ast.wildcardPat(), x()));
    final Ast.Exp e2 = Subst.single("x", y()).apply(e);
    assertThat(e2.toString(),
        is("case m of { Just y_0 -> (y, y_0); _ -> y }"));
  }

  /** A binder is renamed only if it would capture a free variable of the
   * replacement. */
  @Test public void testNoCapture() {
    final Ast.Exp e = ast.fn(ast.idPat("z"), ast.apply(x(), ast.id("z")));
    final Ast.Exp e2 = Subst.single("x", y()).apply(e);
    assertThat(e2.toString(), is("\\z -> y z"));
  }

  @Test public void testInfixOperator() {
    final Ast.Exp e = ast.infixCall(x(), "f", y());
    assertThat(e.toString(), is("x `f` y"));
    assertThat(Subst.single("f", ast.id("g")).apply(e).toString(),
        is("x `g` y"));
    assertThat(
        Subst.single("f", ast.apply(ast.id("h"), ast.intLiteral(1)))
            .apply(e).toString(),
        is("h 1 x y"));
  }

  /** The operator of a constructor application is never replaced. */
  @Test public void testInfixConstructor() {
    final Ast.Exp e = ast.infixCall(x(), ":", y());
    final Subst subst =
        Subst.of(
            ImmutableMap.of(QName.CONS, ast.intLiteral(2),
                QName.of("x"), ast.intLiteral(1)));
    assertThat(subst.apply(e).toString(), is("1 : y"));
  }

  @Test public void testExtend() {
    final Subst s2 = Subst.single("x", ast.intLiteral(1));
    final Subst s1 = Subst.single("x", ast.intLiteral(2));
    assertThat(Subst.extend(s2, s1).apply(x()).toString(), is("2"));
    assertThat(Subst.extend(s2, Subst.identity()), sameInstance(s2));
  }

  @Test public void testCompose() {
    final Subst s1 = Subst.single("x", y());
    final Subst s2 = Subst.single("y", ast.id("z"));
    final Subst s = Subst.compose(s2, s1);
    assertThat(s.toString(), is("{y=z, x=z}"));
    final Ast.Exp e = ast.infixCall(x(), "+", y());
    assertThat(s.apply(e).toString(), is(s2.apply(s1.apply(e)).toString()));
    assertThat(s.apply(e).toString(), is("z + z"));

    // The last substitution in the list is applied first
    final Subst s3 = Subst.single("z", ast.intLiteral(3));
    final Subst all = Subst.composeAll(ImmutableList.of(s1, s2, s3));
    assertThat(all.apply(e).toString(),
        is(s1.apply(s2.apply(s3.apply(e))).toString()));
    assertThat(all.apply(e).toString(), is("y + z"));
  }

  @Test public void testFreeVarSet() {
    final Subst s =
        Subst.single("x", ast.apply(ast.id("f"), y(), ast.id("z")));
    assertThat(s.freeVarSet().toString(), is("[f, y, z]"));
    assertThat(s.freeVarSetIn(ast.tuple(x(), ast.id("w"))).toString(),
        is("[f, y, z, x, w]"));
    assertThat(s.freeVarSetIn(ast.id("w")).toString(), is("[w]"));
  }

  @Test public void testFreshName() {
    final ImmutableSet<QName> names =
        ImmutableSet.of(QName.of("y"), QName.of("y_0"), QName.of("+"));
    assertThat(Subst.freshName(names, "z"), is("z"));
    assertThat(Subst.freshName(names, "y"), is("y_1"));
    assertThat(Subst.freshName(names, "y_0"), is("y_1"));
    assertThat(Subst.freshName(names, "+"), is("x_0"));
  }

  @Test public void testRemoveSuffix() {
    assertThat(Subst.removeSuffix("a_12"), is("a"));
    assertThat(Subst.removeSuffix("a_b"), is("a_b"));
    assertThat(Subst.removeSuffix("x1"), is("x1"));
    assertThat(Subst.removeSuffix("a_1_2"), is("a_1"));
  }
}

// End SubstTest.java
