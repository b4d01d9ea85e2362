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
import net.hydromatic.flatcase.ast.QName;
import net.hydromatic.flatcase.compile.MatchCompiler.Equation;
import net.hydromatic.flatcase.type.ConEntry;

import com.google.common.collect.ImmutableList;

import org.junit.Test;

import java.util.List;

import static net.hydromatic.flatcase.Matchers.isCompileException;
import static net.hydromatic.flatcase.Mc.assertError;
import static net.hydromatic.flatcase.ast.AstBuilder.ast;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.fail;

/** Tests for {@link MatchCompiler}. */
public class MatchCompilerTest {
  static final Ast.DataDecl MAYBE =
      ast.dataDecl("Maybe", ast.conDecl("Nothing"), ast.conDecl("Just", "a"));
  static final Ast.DataDecl COLOR =
      ast.dataDecl("Color", ast.conDecl("Red"), ast.conDecl("Green"),
          ast.conDecl("Blue"));

  private final Diagnostics diagnostics = new Diagnostics();

  private MatchCompiler compiler(boolean trivial) {
    final Environment env =
        Environments.withDataDecls(Environments.empty(),
            ImmutableList.of(MAYBE, COLOR));
    return new MatchCompiler(env, new NameGenerator(), diagnostics, trivial);
  }

  private static Ast.IdPat x() {
    return ast.idPat("x");
  }

  private static Ast.Pat just(Ast.Pat pat) {
    return ast.conPat("Just", pat);
  }

  private static Ast.Pat nothing() {
    return ast.conPat("Nothing");
  }

  @Test public void testSameConstructor() {
    assertThat(
        MatchCompiler.sameConstructor(ast.listPat(), ast.listPat()), is(true));
    assertThat(
        MatchCompiler.sameConstructor(ast.listPat(ast.idPat("y")),
            ast.infixConPat(ast.idPat("h"), ":", ast.idPat("t"))),
        is(true));
    assertThat(
        MatchCompiler.sameConstructor(ast.listPat(),
            ast.listPat(ast.wildcardPat())),
        is(false));
    assertThat(
        MatchCompiler.sameConstructor(
            ast.tuplePat(ast.idPat("a"), ast.idPat("b")),
            ast.tuplePat(ast.wildcardPat(), ast.wildcardPat())),
        is(true));
    assertThat(
        MatchCompiler.sameConstructor(
            ast.tuplePat(ast.idPat("a"), ast.idPat("b")),
            ast.tuplePat(ast.idPat("a"), ast.idPat("b"), ast.idPat("c"))),
        is(false));
    assertThat(
        MatchCompiler.sameConstructor(ast.idPat("a"), ast.wildcardPat()),
        is(true));
    assertThat(MatchCompiler.sameConstructor(ast.idPat("a"), nothing()),
        is(false));
    assertThat(
        MatchCompiler.sameConstructor(ast.parenPat(just(ast.idPat("a"))),
            just(nothing())),
        is(true));
  }

  /** Built-in constructors written in prefix form are the same as their
   * bracket forms. */
  @Test public void testSameConstructorPrefix() {
    assertThat(
        MatchCompiler.sameConstructor(ast.listPat(ast.idPat("x")),
            ast.conPat(":", ast.idPat("x"), ast.listPat())),
        is(true));
    assertThat(
        MatchCompiler.sameConstructor(
            ast.tuplePat(ast.idPat("x"), ast.idPat("y")),
            ast.conPat("(,)", ast.idPat("x"), ast.idPat("y"))),
        is(true));
    assertThat(
        MatchCompiler.sameConstructor(ast.conPat("Red"), ast.conPat("Green")),
        is(false));
    assertThat(
        MatchCompiler.sameConstructor(qualifiedJust(ast.idPat("p")),
            just(ast.idPat("q"))),
        is(true));
  }

  private static Ast.Pat qualifiedJust(Ast.Pat pat) {
    return ast.conPat(Pos.ZERO, QName.qualified("M", "Just"),
        ImmutableList.of(pat));
  }

  /** <pre>
   * f (M.Just True) = 1
   * f (Just False) = 2
   * </pre>
   *
   * <p>Both rules are in the same alternative. */
  @Test public void testQualifiedConstructor() {
    final Ast.Exp e =
        compiler(false).match(Pos.ZERO, ImmutableList.of(x()),
            ImmutableList.of(
                Equation.of(ast.intLiteral(1),
                    qualifiedJust(ast.conPat("True"))),
                Equation.of(ast.intLiteral(2), just(ast.conPat("False")))),
            ast.undefined());
    assertThat(e.toString(),
        is("case x of { M.Just a0 -> case a0 of { True -> 1; False -> 2 }; "
            + "Nothing -> undefined }"));
  }

  @Test public void testSubPatterns() {
    assertThat(
        MatchCompiler.subPatterns(
            ast.listPat(ast.idPat("x"), ast.idPat("y"))).toString(),
        is("[x, [y]]"));
    assertThat(MatchCompiler.subPatterns(ast.listPat()).isEmpty(), is(true));
    assertThat(MatchCompiler.subPatterns(just(nothing())).toString(),
        is("[Nothing]"));
  }

  @Test public void testGroupByConstructor() {
    final List<Equation> eqs =
        ImmutableList.of(Equation.of(ast.intLiteral(1), just(ast.idPat("a"))),
            Equation.of(ast.intLiteral(2), nothing()),
            Equation.of(ast.intLiteral(3), just(ast.idPat("b"))));
    assertThat(MatchCompiler.groupByConstructor(eqs).toString(),
        is("[[Just a -> 1, Just b -> 3], [Nothing -> 2]]"));
  }

  @Test public void testGroupByFirstPatType() {
    final List<Equation> eqs =
        ImmutableList.of(Equation.of(ast.intLiteral(1), ast.idPat("x")),
            Equation.of(ast.intLiteral(2), just(ast.idPat("a"))),
            Equation.of(ast.intLiteral(3), nothing()),
            Equation.of(ast.intLiteral(4), ast.wildcardPat()));
    assertThat(MatchCompiler.groupByFirstPatType(eqs).toString(),
        is("[[x -> 1], [Just a -> 2, Nothing -> 3], [_ -> 4]]"));
  }

  @Test public void testNoVariables() {
    final MatchCompiler compiler = compiler(false);
    final Ast.Exp e =
        compiler.match(Pos.ZERO, ImmutableList.of(), ImmutableList.of(),
            ast.id("err"));
    assertThat(e.toString(), is("err"));

    final Ast.Exp e2 =
        compiler.match(Pos.ZERO, ImmutableList.of(),
            ImmutableList.of(Equation.of(ast.intLiteral(1)),
                Equation.of(ast.intLiteral(2))),
            ast.id("err"));
    assertThat(e2.toString(), is("1"));
  }

  /** Variables in the first column are replaced by the variable being
   * matched. */
  @Test public void testAllVariables() {
    final Ast.Exp e =
        compiler(false).match(Pos.ZERO, ImmutableList.of(x()),
            ImmutableList.of(
                Equation.of(ast.apply(ast.id("f"), ast.id("y")),
                    ast.idPat("y")),
                Equation.of(ast.intLiteral(0), ast.wildcardPat())),
            ast.undefined());
    assertThat(e.toString(), is("f x"));
  }

  @Test public void testConstructors() {
    final Ast.Exp e =
        compiler(false).match(Pos.ZERO, ImmutableList.of(x()),
            ImmutableList.of(Equation.of(ast.id("y"), just(ast.idPat("y"))),
                Equation.of(ast.intLiteral(0), nothing())),
            ast.undefined());
    assertThat(e.toString(),
        is("case x of { Just a0 -> a0; Nothing -> 0 }"));
  }

  /** Missing constructors get one alternative each, whose body is the
   * fallback with the variable replaced by the constructor. */
  @Test public void testMissingConstructors() {
    final Ast.Exp e =
        compiler(false).match(Pos.ZERO, ImmutableList.of(x()),
            ImmutableList.of(Equation.of(ast.id("y"), just(ast.idPat("y")))),
            ast.apply(ast.id("f"), ast.id("x")));
    assertThat(e.toString(),
        is("case x of { Just a0 -> a0; Nothing -> f Nothing }"));
  }

  @Test public void testMissingConstructorsTrivial() {
    final Ast.Exp e =
        compiler(true).match(Pos.ZERO, ImmutableList.of(x()),
            ImmutableList.of(Equation.of(ast.id("y"), just(ast.idPat("y")))),
            ast.apply(ast.id("f"), ast.id("x")));
    assertThat(e.toString(),
        is("case x of { Just a0 -> a0; _ -> undefined }"));
  }

  /** Missing constructors are added in the order that the type declares
   * them. */
  @Test public void testMissingConstructorsOrder() {
    final Ast.Exp e =
        compiler(false).match(Pos.ZERO, ImmutableList.of(ast.idPat("c")),
            ImmutableList.of(
                Equation.of(ast.intLiteral(1), ast.conPat("Blue"))),
            ast.intLiteral(0));
    assertThat(e.toString(),
        is("case c of { Blue -> 1; Red -> 0; Green -> 0 }"));
  }

  @Test public void testList() {
    final Ast.Exp e =
        compiler(false).match(Pos.ZERO, ImmutableList.of(ast.idPat("xs")),
            ImmutableList.of(
                Equation.of(ast.intLiteral(0), ast.listPat()),
                Equation.of(
                    ast.infixCall(ast.intLiteral(1), "+",
                        ast.apply(ast.id("len"), ast.id("t"))),
                    ast.infixConPat(ast.idPat("h"), ":", ast.idPat("t")))),
            ast.undefined());
    assertThat(e.toString(),
        is("case xs of { [] -> 0; a0 : a1 -> 1 + len a1 }"));
  }

  @Test public void testNested() {
    final Ast.Exp e =
        compiler(false).match(Pos.ZERO, ImmutableList.of(x()),
            ImmutableList.of(
                Equation.of(ast.intLiteral(0), just(nothing())),
                Equation.of(ast.id("y"), just(just(ast.idPat("y")))),
                Equation.of(ast.intLiteral(2), nothing())),
            ast.undefined());
    assertThat(e.toString(),
        is("case x of { Just a0 -> case a0 of { Nothing -> 0; "
            + "Just a1 -> a1 }; Nothing -> 2 }"));
  }

  /** A constructor run followed by a variable run; the variable run is the
   * fallback of the constructor run. */
  @Test public void testMixed() {
    final Ast.Exp e =
        compiler(false).match(Pos.ZERO, ImmutableList.of(x()),
            ImmutableList.of(Equation.of(ast.id("y"), just(ast.idPat("y"))),
                Equation.of(ast.apply(ast.id("g"), ast.id("n")),
                    ast.idPat("n"))),
            ast.undefined());
    assertThat(e.toString(),
        is("case x of { Just a0 -> a0; Nothing -> g Nothing }"));
  }

  @Test public void testDifferentArity() {
    final MatchCompiler compiler = compiler(false);
    assertError(() ->
            compiler.match(Pos.ZERO, ImmutableList.of(x()),
                ImmutableList.of(Equation.of(ast.intLiteral(1), nothing()),
                    Equation.of(ast.intLiteral(2))),
                ast.undefined()),
        isCompileException(Severity.ERROR, MatchCompiler.DIFFERENT_ARITY));
    assertError(() ->
            compiler.match(Pos.ZERO, ImmutableList.of(),
                ImmutableList.of(Equation.of(ast.intLiteral(1), nothing())),
                ast.undefined()),
        isCompileException(Severity.ERROR, MatchCompiler.DIFFERENT_ARITY));
    assertThat(diagnostics.messages().size(), is(2));
    assertThat(diagnostics.messages().get(0).toString(),
        is("error: " + MatchCompiler.DIFFERENT_ARITY));
  }

  @Test public void testSingleGroup() {
    final MatchCompiler compiler = compiler(false);
    assertError(() ->
            compiler.matchMixed(Pos.ZERO, ImmutableList.of(x()),
                ImmutableList.of(Equation.of(ast.intLiteral(1), nothing())),
                ast.undefined()),
        isCompileException(Severity.INTERNAL, MatchCompiler.SINGLE_GROUP));
    assertThat(diagnostics.hasErrors(), is(true));
    try {
      final Ast.Exp e =
          compiler.matchMixed(Pos.ZERO, ImmutableList.of(x()),
              ImmutableList.of(Equation.of(ast.intLiteral(1), x())),
              ast.undefined());
      fail("expected error, got " + e);
    } catch (CompileException e) {
      assertThat(e.isInternal(), is(true));
    }
  }

  @Test public void testEmptyCase() {
    final MatchCompiler compiler = compiler(false);
    assertError(() ->
            compiler.missingConstructors(Pos.ZERO, ImmutableList.of()),
        isCompileException(Severity.ERROR, MatchCompiler.EMPTY_CASE));
    assertThat(diagnostics.hasErrors(), is(true));
  }

  /** A constructor whose type has no known constructors. */
  @Test public void testUnknownDataType() {
    final Environment env = new Environment() {
      public ImmutableList<ConEntry> getConstructorsOpt(QName typeName) {
        return null;
      }

      public QName getTypeOpt(QName conName) {
        return QName.of("Shape");
      }
    };
    final MatchCompiler compiler =
        new MatchCompiler(env, new NameGenerator(), diagnostics, false);
    assertError(() ->
            compiler.missingConstructors(Pos.ZERO,
                ImmutableList.of(
                    ast.alt(ast.conPat("Circle"), ast.intLiteral(1)))),
        isCompileException(Severity.ERROR, "Data type not in scope: Shape"));
  }

  @Test public void testUnknownConstructor() {
    final MatchCompiler compiler = compiler(false);
    assertError(() ->
            compiler.match(Pos.ZERO, ImmutableList.of(x()),
                ImmutableList.of(
                    Equation.of(ast.intLiteral(1), ast.conPat("Foo"))),
                ast.undefined()),
        isCompileException(Severity.ERROR,
            "Data constructor not in scope: Foo"));
  }
}

// End MatchCompilerTest.java
