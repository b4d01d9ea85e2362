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
package net.hydromatic.flatcase.ast;

import com.google.common.collect.ImmutableList;

import java.math.BigDecimal;
import java.util.List;
import javax.annotation.Nullable;

/** Builds parse tree nodes.
 *
 * <p>Methods without a {@link Pos} argument create nodes at
 * {@link Pos#ZERO}. */
public enum AstBuilder {
  /** The singleton instance of the AST builder.
   * The short name is convenient for use via 'import static',
   * but checkstyle does not approve. */
  // CHECKSTYLE: IGNORE 1
  ast;

  /** Name of the variable that stands for a runtime pattern-match failure. */
  public static final QName UNDEFINED = QName.of("undefined");

  /** Returns whether a name, written in prefix or infix position, refers to
   * a data constructor rather than a variable. Constructors start with an
   * upper-case letter or a colon, or are one of the bracketed built-ins. */
  public static boolean isConName(QName name) {
    final char c = name.name.charAt(0);
    return Character.isUpperCase(c) || c == ':' || name.isBracketed();
  }

  // expressions

  public Ast.Id id(Pos pos, QName name) {
    return new Ast.Id(pos, name);
  }

  public Ast.Id id(QName name) {
    return id(Pos.ZERO, name);
  }

  public Ast.Id id(String name) {
    return id(Pos.ZERO, QName.of(name));
  }

  public Ast.Con con(Pos pos, QName name) {
    return new Ast.Con(pos, name);
  }

  public Ast.Con con(String name) {
    return con(Pos.ZERO, QName.of(name));
  }

  /** Creates a variable or constructor reference, depending on the shape of
   * its name. */
  public Ast.Exp ref(Pos pos, QName name) {
    return isConName(name) ? con(pos, name) : id(pos, name);
  }

  public Ast.Literal literal(Pos pos, Object value) {
    return new Ast.Literal(pos, value);
  }

  public Ast.Literal intLiteral(int value) {
    return literal(Pos.ZERO, BigDecimal.valueOf(value));
  }

  public Ast.Literal stringLiteral(String value) {
    return literal(Pos.ZERO, value);
  }

  /** Creates a reference to {@code undefined}, the expression that fails
   * at run time. */
  public Ast.Id undefined(Pos pos) {
    return id(pos, UNDEFINED);
  }

  public Ast.Id undefined() {
    return undefined(Pos.ZERO);
  }

  public Ast.InfixCall infixCall(Pos pos, Ast.Exp a0, Ast.Exp operator,
      Ast.Exp a1) {
    return new Ast.InfixCall(pos, a0, operator, a1);
  }

  /** Creates a call to an infix operator, e.g.
   * {@code infixCall(x, "+", y)} or {@code infixCall(h, ":", t)}. */
  public Ast.InfixCall infixCall(Ast.Exp a0, String operator, Ast.Exp a1) {
    return infixCall(Pos.ZERO, a0, ref(Pos.ZERO, QName.of(operator)), a1);
  }

  public Ast.Apply apply(Pos pos, Ast.Exp fn, Ast.Exp arg) {
    return new Ast.Apply(pos, fn, arg);
  }

  /** Applies a function to several arguments, one at a time. */
  public Ast.Exp apply(Ast.Exp fn, Ast.Exp... args) {
    Ast.Exp e = fn;
    for (Ast.Exp arg : args) {
      e = apply(Pos.ZERO, e, arg);
    }
    return e;
  }

  public Ast.Negate negate(Pos pos, Ast.Exp exp) {
    return new Ast.Negate(pos, exp);
  }

  public Ast.Fn fn(Pos pos, List<? extends Ast.Pat> pats, Ast.Exp exp) {
    return new Ast.Fn(pos, ImmutableList.copyOf(pats), exp);
  }

  public Ast.Fn fn(Ast.Pat pat, Ast.Exp exp) {
    return fn(Pos.ZERO, ImmutableList.of(pat), exp);
  }

  public Ast.Let let(Pos pos, Ast.Binds binds, Ast.Exp exp) {
    return new Ast.Let(pos, binds, exp);
  }

  public Ast.Let let(Ast.Binds binds, Ast.Exp exp) {
    return let(Pos.ZERO, binds, exp);
  }

  public Ast.If if_(Pos pos, Ast.Exp condition, Ast.Exp ifTrue,
      Ast.Exp ifFalse) {
    return new Ast.If(pos, condition, ifTrue, ifFalse);
  }

  public Ast.If if_(Ast.Exp condition, Ast.Exp ifTrue, Ast.Exp ifFalse) {
    return if_(Pos.ZERO, condition, ifTrue, ifFalse);
  }

  public Ast.Case caseOf(Pos pos, Ast.Exp exp, List<Ast.Alt> alts) {
    return new Ast.Case(pos, exp, ImmutableList.copyOf(alts));
  }

  public Ast.Case caseOf(Ast.Exp exp, Ast.Alt... alts) {
    return caseOf(Pos.ZERO, exp, ImmutableList.copyOf(alts));
  }

  public Ast.Tuple tuple(Pos pos, List<? extends Ast.Exp> args) {
    return new Ast.Tuple(pos, ImmutableList.copyOf(args));
  }

  public Ast.Tuple tuple(Ast.Exp... args) {
    return tuple(Pos.ZERO, ImmutableList.copyOf(args));
  }

  public Ast.ListExp list(Pos pos, List<? extends Ast.Exp> args) {
    return new Ast.ListExp(pos, ImmutableList.copyOf(args));
  }

  public Ast.ListExp list(Ast.Exp... args) {
    return list(Pos.ZERO, ImmutableList.copyOf(args));
  }

  public Ast.Paren paren(Pos pos, Ast.Exp exp) {
    return new Ast.Paren(pos, exp);
  }

  public Ast.Annotated annotated(Pos pos, Ast.Exp exp, String type) {
    return new Ast.Annotated(pos, exp, type);
  }

  // patterns

  public Ast.IdPat idPat(Pos pos, String name) {
    return new Ast.IdPat(pos, name);
  }

  public Ast.IdPat idPat(String name) {
    return idPat(Pos.ZERO, name);
  }

  public Ast.WildcardPat wildcardPat(Pos pos) {
    return new Ast.WildcardPat(pos);
  }

  public Ast.WildcardPat wildcardPat() {
    return wildcardPat(Pos.ZERO);
  }

  public Ast.ConPat conPat(Pos pos, QName con, List<? extends Ast.Pat> args) {
    return new Ast.ConPat(pos, con, ImmutableList.copyOf(args));
  }

  public Ast.ConPat conPat(String con, Ast.Pat... args) {
    return conPat(Pos.ZERO, QName.of(con), ImmutableList.copyOf(args));
  }

  public Ast.InfixConPat infixConPat(Pos pos, Ast.Pat p0, QName con,
      Ast.Pat p1) {
    return new Ast.InfixConPat(pos, p0, con, p1);
  }

  public Ast.InfixConPat infixConPat(Ast.Pat p0, String con, Ast.Pat p1) {
    return infixConPat(Pos.ZERO, p0, QName.of(con), p1);
  }

  public Ast.TuplePat tuplePat(Pos pos, List<? extends Ast.Pat> args) {
    return new Ast.TuplePat(pos, ImmutableList.copyOf(args));
  }

  public Ast.TuplePat tuplePat(Ast.Pat... args) {
    return tuplePat(Pos.ZERO, ImmutableList.copyOf(args));
  }

  public Ast.ListPat listPat(Pos pos, List<? extends Ast.Pat> args) {
    return new Ast.ListPat(pos, ImmutableList.copyOf(args));
  }

  public Ast.ListPat listPat(Ast.Pat... args) {
    return listPat(Pos.ZERO, ImmutableList.copyOf(args));
  }

  public Ast.ParenPat parenPat(Pos pos, Ast.Pat pat) {
    return new Ast.ParenPat(pos, pat);
  }

  public Ast.ParenPat parenPat(Ast.Pat pat) {
    return parenPat(Pos.ZERO, pat);
  }

  // right-hand sides, alternatives and rules

  public Ast.UnguardedRhs unguardedRhs(Pos pos, Ast.Exp exp) {
    return new Ast.UnguardedRhs(pos, exp);
  }

  public Ast.UnguardedRhs unguardedRhs(Ast.Exp exp) {
    return unguardedRhs(exp.pos, exp);
  }

  public Ast.GuardedRhss guardedRhss(Pos pos, List<Ast.GuardedRhs> guards) {
    return new Ast.GuardedRhss(pos, ImmutableList.copyOf(guards));
  }

  public Ast.GuardedRhss guardedRhss(Ast.GuardedRhs... guards) {
    return guardedRhss(Pos.ZERO, ImmutableList.copyOf(guards));
  }

  public Ast.GuardedRhs guardedRhs(Pos pos, Ast.Exp guard, Ast.Exp exp) {
    return new Ast.GuardedRhs(pos, guard, exp);
  }

  public Ast.GuardedRhs guardedRhs(Ast.Exp guard, Ast.Exp exp) {
    return guardedRhs(Pos.ZERO, guard, exp);
  }

  public Ast.Alt alt(Pos pos, Ast.Pat pat, Ast.Rhs rhs,
      @Nullable Ast.Binds binds) {
    return new Ast.Alt(pos, pat, rhs, binds);
  }

  public Ast.Alt alt(Ast.Pat pat, Ast.Exp exp) {
    return alt(pat.pos, pat, unguardedRhs(exp), null);
  }

  public Ast.Alt alt(Ast.Pat pat, Ast.Rhs rhs) {
    return alt(pat.pos, pat, rhs, null);
  }

  public Ast.Match match(Pos pos, String name, boolean infix,
      List<? extends Ast.Pat> pats, Ast.Rhs rhs, @Nullable Ast.Binds binds) {
    return new Ast.Match(pos, name, infix, ImmutableList.copyOf(pats), rhs,
        binds);
  }

  public Ast.Match match(String name, List<? extends Ast.Pat> pats,
      Ast.Rhs rhs) {
    return match(Pos.ZERO, name, false, pats, rhs, null);
  }

  public Ast.Match match(String name, List<? extends Ast.Pat> pats,
      Ast.Exp exp) {
    return match(name, pats, unguardedRhs(exp));
  }

  // declarations

  public Ast.FunBind funBind(Pos pos, List<Ast.Match> matches) {
    return new Ast.FunBind(pos, ImmutableList.copyOf(matches));
  }

  /** Creates a function declaration whose position spans its rules. */
  public Ast.FunBind funBind(Ast.Match... matches) {
    return funBind(matches[0].pos.plus(matches[matches.length - 1].pos),
        ImmutableList.copyOf(matches));
  }

  /** Creates a declaration that binds a variable to an expression,
   * "{@code name = exp}". */
  public Ast.FunBind varBind(Pos pos, String name, Ast.Exp exp) {
    return funBind(pos,
        ImmutableList.of(
            match(pos, name, false, ImmutableList.of(), unguardedRhs(exp),
                null)));
  }

  public Ast.FunBind varBind(String name, Ast.Exp exp) {
    return varBind(Pos.ZERO, name, exp);
  }

  public Ast.DataDecl dataDecl(Pos pos, String name,
      List<Ast.ConDecl> cons) {
    return new Ast.DataDecl(pos, name, ImmutableList.copyOf(cons));
  }

  public Ast.DataDecl dataDecl(String name, Ast.ConDecl... cons) {
    return dataDecl(Pos.ZERO, name, ImmutableList.copyOf(cons));
  }

  public Ast.ConDecl conDecl(Pos pos, String name, boolean infix,
      List<String> argTypes) {
    return new Ast.ConDecl(pos, name, infix, ImmutableList.copyOf(argTypes));
  }

  public Ast.ConDecl conDecl(String name, String... argTypes) {
    return conDecl(Pos.ZERO, name, false, ImmutableList.copyOf(argTypes));
  }

  public Ast.OtherDecl otherDecl(Pos pos, String text) {
    return new Ast.OtherDecl(pos, text);
  }

  public Ast.Binds binds(Pos pos, List<? extends Ast.Decl> decls) {
    return new Ast.Binds(pos, ImmutableList.copyOf(decls));
  }

  public Ast.Binds binds(Ast.Decl... decls) {
    return binds(Pos.ZERO, ImmutableList.copyOf(decls));
  }

  public Ast.Module module(Pos pos, @Nullable String name,
      List<? extends Ast.Decl> decls) {
    return new Ast.Module(pos, name, ImmutableList.copyOf(decls));
  }

  public Ast.Module module(Ast.Decl... decls) {
    return module(Pos.ZERO, null, ImmutableList.copyOf(decls));
  }
}

// End AstBuilder.java
