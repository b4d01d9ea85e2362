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

import java.util.List;
import javax.annotation.Nullable;

/** Visits and transforms syntax trees.
 *
 * <p>Each {@code visit} method visits the children of a node, and returns
 * the node if none of them changed, or a copy of the node with the new
 * children. Sub-classes override the methods for the nodes they wish to
 * rewrite. */
public class Shuttle {
  protected <E extends AstNode> ImmutableList<E> visitList(List<E> nodes) {
    final ImmutableList.Builder<E> list = ImmutableList.builder();
    for (E node : nodes) {
      //noinspection unchecked
      list.add((E) node.accept(this));
    }
    return list.build();
  }

  protected @Nullable Ast.Binds visitOpt(@Nullable Ast.Binds binds) {
    return binds == null ? null : binds.accept(this);
  }

  // expressions

  public Ast.Exp visit(Ast.Id id) {
    return id;
  }

  public Ast.Exp visit(Ast.Con con) {
    return con;
  }

  public Ast.Exp visit(Ast.Literal literal) {
    return literal;
  }

  public Ast.Exp visit(Ast.InfixCall infixCall) {
    return infixCall.copy(infixCall.a0.accept(this),
        infixCall.operator.accept(this), infixCall.a1.accept(this));
  }

  public Ast.Exp visit(Ast.Apply apply) {
    return apply.copy(apply.fn.accept(this), apply.arg.accept(this));
  }

  public Ast.Exp visit(Ast.Negate negate) {
    return negate.copy(negate.exp.accept(this));
  }

  public Ast.Exp visit(Ast.Fn fn) {
    return fn.copy(visitList(fn.pats), fn.exp.accept(this));
  }

  public Ast.Exp visit(Ast.Let let) {
    return let.copy(let.binds.accept(this), let.exp.accept(this));
  }

  public Ast.Exp visit(Ast.If if_) {
    return if_.copy(if_.condition.accept(this), if_.ifTrue.accept(this),
        if_.ifFalse.accept(this));
  }

  public Ast.Exp visit(Ast.Case case_) {
    return case_.copy(case_.exp.accept(this), visitList(case_.alts));
  }

  public Ast.Exp visit(Ast.Tuple tuple) {
    return tuple.copy(visitList(tuple.args));
  }

  public Ast.Exp visit(Ast.ListExp list) {
    return list.copy(visitList(list.args));
  }

  public Ast.Exp visit(Ast.Paren paren) {
    return paren.copy(paren.exp.accept(this));
  }

  public Ast.Exp visit(Ast.Annotated annotated) {
    return annotated.copy(annotated.exp.accept(this));
  }

  // patterns

  public Ast.Pat visit(Ast.IdPat idPat) {
    return idPat;
  }

  public Ast.Pat visit(Ast.WildcardPat wildcardPat) {
    return wildcardPat;
  }

  public Ast.Pat visit(Ast.ConPat conPat) {
    return conPat.copy(visitList(conPat.args));
  }

  public Ast.Pat visit(Ast.InfixConPat infixConPat) {
    return infixConPat.copy(infixConPat.p0.accept(this),
        infixConPat.p1.accept(this));
  }

  public Ast.Pat visit(Ast.TuplePat tuplePat) {
    return tuplePat.copy(visitList(tuplePat.args));
  }

  public Ast.Pat visit(Ast.ListPat listPat) {
    return listPat.copy(visitList(listPat.args));
  }

  public Ast.Pat visit(Ast.ParenPat parenPat) {
    return parenPat.copy(parenPat.pat.accept(this));
  }

  // right-hand sides, alternatives and rules

  public Ast.Rhs visit(Ast.UnguardedRhs rhs) {
    return rhs.copy(rhs.exp.accept(this));
  }

  public Ast.Rhs visit(Ast.GuardedRhss rhs) {
    return rhs.copy(visitList(rhs.guards));
  }

  public Ast.GuardedRhs visit(Ast.GuardedRhs guardedRhs) {
    return guardedRhs.copy(guardedRhs.guard.accept(this),
        guardedRhs.exp.accept(this));
  }

  public Ast.Alt visit(Ast.Alt alt) {
    return alt.copy(alt.pat.accept(this), alt.rhs.accept(this),
        visitOpt(alt.binds));
  }

  public Ast.Match visit(Ast.Match match) {
    return match.copy(match.name, visitList(match.pats),
        match.rhs.accept(this), visitOpt(match.binds));
  }

  // declarations

  public Ast.Decl visit(Ast.FunBind funBind) {
    return funBind.copy(visitList(funBind.matches));
  }

  public Ast.Decl visit(Ast.DataDecl dataDecl) {
    return dataDecl;
  }

  public Ast.ConDecl visit(Ast.ConDecl conDecl) {
    return conDecl;
  }

  public Ast.Decl visit(Ast.OtherDecl otherDecl) {
    return otherDecl;
  }

  public Ast.Binds visit(Ast.Binds binds) {
    return binds.copy(visitList(binds.decls));
  }

  public Ast.Module visit(Ast.Module module) {
    return module.copy(visitList(module.decls));
  }
}

// End Shuttle.java
