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
import net.hydromatic.flatcase.ast.AstNode;
import net.hydromatic.flatcase.ast.QName;

import com.google.common.collect.ImmutableSet;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import javax.annotation.Nullable;

/** Computes the variables that occur free in a syntax tree, and the
 * variables that a binding construct introduces.
 *
 * <p>Both kinds of set are ordered by first occurrence, left to right. */
public abstract class FreeVars {
  private FreeVars() {}

  /** Returns the names of the variables that occur free in a node. */
  public static ImmutableSet<QName> freeVars(AstNode node) {
    return ImmutableSet.copyOf(free(node));
  }

  /** Returns the names of the variables that occur free in any of a list of
   * nodes. */
  public static ImmutableSet<QName> freeVars(List<? extends AstNode> nodes) {
    final Set<QName> set = new LinkedHashSet<>();
    nodes.forEach(node -> set.addAll(free(node)));
    return ImmutableSet.copyOf(set);
  }

  /** Returns the names of the variables bound by a node.
   *
   * <p>A pattern binds its variables; a rule or function declaration binds
   * the function name; a group of declarations binds the names of all of
   * its functions. Other expressions bind nothing. */
  public static ImmutableSet<String> boundVars(AstNode node) {
    final Set<String> set = new LinkedHashSet<>();
    bound(node, set);
    return ImmutableSet.copyOf(set);
  }

  /** Returns the names of the variables bound by a list of nodes. */
  public static ImmutableSet<String> boundVars(List<? extends AstNode> nodes) {
    final Set<String> set = new LinkedHashSet<>();
    nodes.forEach(node -> bound(node, set));
    return ImmutableSet.copyOf(set);
  }

  private static Set<QName> free(AstNode node) {
    final Set<QName> set = new LinkedHashSet<>();
    switch (node.op) {
    case ID:
      set.add(((Ast.Id) node).name);
      break;

    case CON:
    case LITERAL:
      break;

    case INFIX_CALL:
      final Ast.InfixCall infixCall = (Ast.InfixCall) node;
      set.addAll(free(infixCall.a0));
      set.addAll(free(infixCall.operator));
      set.addAll(free(infixCall.a1));
      break;

    case APPLY:
      final Ast.Apply apply = (Ast.Apply) node;
      set.addAll(free(apply.fn));
      set.addAll(free(apply.arg));
      break;

    case NEGATE:
      set.addAll(free(((Ast.Negate) node).exp));
      break;

    case FN:
      final Ast.Fn fn = (Ast.Fn) node;
      set.addAll(free(fn.exp));
      removeAll(set, boundVars(fn.pats));
      break;

    case LET:
      final Ast.Let let = (Ast.Let) node;
      set.addAll(free(let.binds));
      set.addAll(local(let.exp, let.binds));
      break;

    case IF:
      final Ast.If if_ = (Ast.If) node;
      set.addAll(free(if_.condition));
      set.addAll(free(if_.ifTrue));
      set.addAll(free(if_.ifFalse));
      break;

    case CASE:
      final Ast.Case case_ = (Ast.Case) node;
      set.addAll(free(case_.exp));
      case_.alts.forEach(alt -> set.addAll(free(alt)));
      break;

    case TUPLE:
      ((Ast.Tuple) node).args.forEach(arg -> set.addAll(free(arg)));
      break;

    case LIST:
      ((Ast.ListExp) node).args.forEach(arg -> set.addAll(free(arg)));
      break;

    case PAREN:
      set.addAll(free(((Ast.Paren) node).exp));
      break;

    case ANNOTATED:
      set.addAll(free(((Ast.Annotated) node).exp));
      break;

    case ID_PAT:
    case WILDCARD_PAT:
    case CON_PAT:
    case INFIX_CON_PAT:
    case TUPLE_PAT:
    case LIST_PAT:
    case PAREN_PAT:
      // patterns contain no variable references
      break;

    case UNGUARDED_RHS:
      set.addAll(free(((Ast.UnguardedRhs) node).exp));
      break;

    case GUARDED_RHSS:
      ((Ast.GuardedRhss) node).guards.forEach(g -> set.addAll(free(g)));
      break;

    case GUARDED_RHS:
      final Ast.GuardedRhs guardedRhs = (Ast.GuardedRhs) node;
      set.addAll(free(guardedRhs.guard));
      set.addAll(free(guardedRhs.exp));
      break;

    case ALT:
      final Ast.Alt alt = (Ast.Alt) node;
      set.addAll(local(alt.rhs, alt.binds));
      removeAll(set, boundVars(alt.pat));
      break;

    case MATCH:
      final Ast.Match match = (Ast.Match) node;
      set.addAll(local(match.rhs, match.binds));
      removeAll(set, boundVars(match.pats));
      set.remove(QName.of(match.name));
      break;

    case FUN_BIND:
      ((Ast.FunBind) node).matches.forEach(m -> set.addAll(free(m)));
      break;

    case DATA_DECL:
    case CON_DECL:
    case OTHER_DECL:
      break;

    case BINDS:
      final Ast.Binds binds = (Ast.Binds) node;
      binds.decls.forEach(decl -> set.addAll(free(decl)));
      removeAll(set, boundVars(binds.decls));
      break;

    case MODULE:
      final Ast.Module module = (Ast.Module) node;
      module.decls.forEach(decl -> set.addAll(free(decl)));
      removeAll(set, boundVars(module.decls));
      break;

    default:
      throw new AssertionError("unknown op " + node.op);
    }
    return set;
  }

  /** Returns the free variables of a node that is in the scope of some
   * local bindings, followed by those of the bindings themselves. */
  private static Set<QName> local(AstNode node, @Nullable Ast.Binds binds) {
    final Set<QName> set = free(node);
    if (binds != null) {
      removeAll(set, boundVars(binds));
      set.addAll(free(binds));
    }
    return set;
  }

  private static void removeAll(Set<QName> set, Iterable<String> names) {
    for (String name : names) {
      set.remove(QName.of(name));
    }
  }

  private static void bound(AstNode node, Set<String> set) {
    switch (node.op) {
    case ID_PAT:
      set.add(((Ast.IdPat) node).name);
      break;

    case WILDCARD_PAT:
      break;

    case CON_PAT:
      ((Ast.ConPat) node).args.forEach(arg -> bound(arg, set));
      break;

    case INFIX_CON_PAT:
      final Ast.InfixConPat infixConPat = (Ast.InfixConPat) node;
      bound(infixConPat.p0, set);
      bound(infixConPat.p1, set);
      break;

    case TUPLE_PAT:
      ((Ast.TuplePat) node).args.forEach(arg -> bound(arg, set));
      break;

    case LIST_PAT:
      ((Ast.ListPat) node).args.forEach(arg -> bound(arg, set));
      break;

    case PAREN_PAT:
      bound(((Ast.ParenPat) node).pat, set);
      break;

    case MATCH:
      set.add(((Ast.Match) node).name);
      break;

    case FUN_BIND:
      ((Ast.FunBind) node).matches.forEach(m -> bound(m, set));
      break;

    case BINDS:
      ((Ast.Binds) node).decls.forEach(decl -> bound(decl, set));
      break;

    default:
      // expressions and other declarations bind nothing
      break;
    }
  }
}

// End FreeVars.java
