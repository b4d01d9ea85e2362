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
import static org.junit.Assert.assertThat;

/** Tests for {@link FreeVars}. */
public class FreeVarsTest {
  @Test public void testFn() {
    final Ast.Exp e =
        ast.fn(ast.idPat("y"),
            ast.apply(ast.id("f"), ast.id("x"), ast.id("y")));
    assertThat(FreeVars.freeVars(e).toString(), is("[f, x]"));
  }

  /** Names appear in the order they are first seen; constructors and
   * literals are not variables. */
  @Test public void testOrder() {
    final Ast.Exp e =
        ast.tuple(ast.id("b"), ast.con("Nothing"), ast.intLiteral(1),
            ast.list(ast.id("a"), ast.id("b")));
    assertThat(FreeVars.freeVars(e).toString(), is("[b, a]"));
    assertThat(
        FreeVars.freeVars(ImmutableList.of(ast.id("c"), e)).toString(),
        is("[c, b, a]"));
  }

  @Test public void testLet() {
    final Ast.Exp e =
        ast.let(
            ast.binds(
                ast.funBind(
                    ast.match("g", ImmutableList.of(ast.idPat("z")),
                        ast.apply(ast.id("h"), ast.id("z"), ast.id("w"))))),
            ast.apply(ast.id("g"), ast.id("v")));
    assertThat(FreeVars.freeVars(e).toString(), is("[h, w, v]"));
  }

  @Test public void testCaseWhere() {
    final Ast.Exp e =
        ast.caseOf(ast.id("m"),
            ast.alt(Pos.ZERO, ast.conPat("Just", ast.idPat("y")),
                ast.unguardedRhs(ast.infixCall(ast.id("y"), "+", ast.id("k"))),
                ast.binds(ast.varBind("k", ast.id("y")))));
    assertThat(FreeVars.freeVars(e).toString(), is("[m, (+)]"));
  }

  @Test public void testRecursiveModule() {
    final Ast.Module module =
        ast.module(
            ast.funBind(
                ast.match("f", ImmutableList.of(ast.idPat("x")),
                    ast.apply(ast.id("f"),
                        ast.apply(ast.id("g"), ast.id("x"))))));
    assertThat(FreeVars.freeVars(module).toString(), is("[g]"));
  }

  @Test public void testBoundVars() {
    final Ast.Pat pat =
        ast.infixConPat(
            ast.conPat("Just", ast.tuplePat(ast.idPat("x"), ast.wildcardPat())),
            ":", ast.idPat("ys"));
    assertThat(FreeVars.boundVars(pat).toString(), is("[x, ys]"));

    final Ast.Binds binds =
        ast.binds(ast.varBind("f", ast.intLiteral(1)),
            ast.varBind("g", ast.id("f")));
    assertThat(FreeVars.boundVars(binds).toString(), is("[f, g]"));
    assertThat(FreeVars.boundVars(ast.id("x")).isEmpty(), is(true));
  }
}

// End FreeVarsTest.java
