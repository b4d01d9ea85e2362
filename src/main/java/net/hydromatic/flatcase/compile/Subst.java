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
import net.hydromatic.flatcase.ast.Op;
import net.hydromatic.flatcase.ast.QName;
import net.hydromatic.flatcase.ast.Shuttle;

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import javax.annotation.Nullable;

import static net.hydromatic.flatcase.ast.AstBuilder.ast;
import static net.hydromatic.flatcase.util.Static.toImmutableList;

/** Substitution; a mapping from variable names to expressions.
 *
 * <p>Applying a substitution to a syntax tree replaces references to the
 * variables in its domain. Where the tree binds a variable that occurs free
 * in a replacement expression, the binder is renamed (to "{@code y_0}",
 * "{@code y_1}" and so forth) so that the replacement is not captured. */
public class Subst {
  private static final Subst IDENTITY = new Subst(ImmutableMap.of());

  /** Base name used when renaming a variable whose name is a symbol, such
   * as "+". */
  static final String SYMBOL_PREFIX = "x";

  private static final CharMatcher DIGITS = CharMatcher.inRange('0', '9');

  public final ImmutableMap<QName, Ast.Exp> map;

  private Subst(ImmutableMap<QName, Ast.Exp> map) {
    this.map = Objects.requireNonNull(map);
  }

  /** Returns the substitution that changes nothing. */
  public static Subst identity() {
    return IDENTITY;
  }

  /** Creates a substitution that replaces one variable. */
  public static Subst single(QName name, Ast.Exp exp) {
    return new Subst(ImmutableMap.of(name, exp));
  }

  /** Creates a substitution that replaces one unqualified variable. */
  public static Subst single(String name, Ast.Exp exp) {
    return single(QName.of(name), exp);
  }

  /** Creates a substitution from a map. */
  public static Subst of(Map<QName, ? extends Ast.Exp> map) {
    return map.isEmpty() ? IDENTITY : new Subst(ImmutableMap.copyOf(map));
  }

  public boolean isIdentity() {
    return map.isEmpty();
  }

  @Override public String toString() {
    return map.toString();
  }

  /** Creates a substitution that contains the mappings of {@code s2} and
   * {@code s1}, without applying either to the other. If both map the same
   * name, the mapping of {@code s1} wins. */
  public static Subst extend(Subst s2, Subst s1) {
    if (s1.isIdentity()) {
      return s2;
    }
    if (s2.isIdentity()) {
      return s1;
    }
    final Map<QName, Ast.Exp> map = new LinkedHashMap<>(s2.map);
    map.putAll(s1.map);
    return of(map);
  }

  /** Creates a substitution that has the effect of applying {@code s1}
   * then {@code s2}.
   *
   * <p>The result maps each name {@code y} in the domain of {@code s1} to
   * {@code s2} applied to {@code s1(y)}, and each other name {@code x} in
   * the domain of {@code s2} to {@code s2(x)}. */
  public static Subst compose(Subst s2, Subst s1) {
    final Map<QName, Ast.Exp> map = new LinkedHashMap<>();
    s1.map.forEach((name, exp) -> map.put(name, s2.apply(exp)));
    return extend(s2, of(map));
  }

  /** Composes a list of substitutions, from the left. */
  public static Subst composeAll(List<Subst> substs) {
    Subst subst = identity();
    for (Subst s : substs) {
      subst = compose(subst, s);
    }
    return subst;
  }

  /** Returns the variables that occur free in the right-hand sides of this
   * substitution. */
  public ImmutableSet<QName> freeVarSet() {
    return FreeVars.freeVars(map.values().asList());
  }

  /** Returns the variables that occur free in a node, plus the variables
   * that occur free in the right-hand sides of this substitution for those
   * variables. These are the names that a binder inside the node must not
   * capture. */
  public ImmutableSet<QName> freeVarSetIn(AstNode node) {
    final ImmutableSet<QName> freeVars = FreeVars.freeVars(node);
    final Set<QName> set = new LinkedHashSet<>();
    for (QName name : freeVars) {
      final Ast.Exp exp = map.get(name);
      if (exp != null) {
        set.addAll(FreeVars.freeVars(exp));
      }
    }
    set.addAll(freeVars);
    return ImmutableSet.copyOf(set);
  }

  public Ast.Exp apply(Ast.Exp exp) {
    return isIdentity() ? exp : exp.accept(new Substituter(this));
  }

  public Ast.Rhs apply(Ast.Rhs rhs) {
    return isIdentity() ? rhs : rhs.accept(new Substituter(this));
  }

  public Ast.Alt apply(Ast.Alt alt) {
    return isIdentity() ? alt : alt.accept(new Substituter(this));
  }

  public Ast.Match apply(Ast.Match match) {
    return isIdentity() ? match : match.accept(new Substituter(this));
  }

  public Ast.Decl apply(Ast.Decl decl) {
    return isIdentity() ? decl : decl.accept(new Substituter(this));
  }

  public Ast.Binds apply(Ast.Binds binds) {
    return isIdentity() ? binds : binds.accept(new Substituter(this));
  }

  /** Chooses a name for a bound variable so that it does not capture any of
   * a set of names.
   *
   * <p>Returns {@code name} if it is not in {@code protectedNames};
   * otherwise the first of "{@code base_0}", "{@code base_1}", ... that is
   * not, where {@code base} is {@code name} without any "_digits" suffix, or
   * "{@code x}" if {@code name} is a symbol. */
  static String freshName(Set<QName> protectedNames, String name) {
    if (!protectedNames.contains(QName.of(name))) {
      return name;
    }
    final String base =
        QName.isIdentifier(name) ? removeSuffix(name) : SYMBOL_PREFIX;
    // At most protectedNames.size() candidates are taken
    for (int n = 0; n <= protectedNames.size(); n++) {
      final String name2 = base + "_" + n;
      if (!protectedNames.contains(QName.of(name2))) {
        return name2;
      }
    }
    throw new AssertionError("no fresh name for " + name);
  }

  /** Removes a suffix of the form "_N", where N is a number, from an
   * identifier. */
  static String removeSuffix(String name) {
    final int i = name.lastIndexOf('_');
    if (i >= 0 && DIGITS.matchesAllOf(name.substring(i + 1))) {
      return name.substring(0, i);
    }
    return name;
  }

  /** Renames the variables bound by a sequence of binders, each binder
   * avoiding the names protected so far and the names chosen for earlier
   * binders. */
  private static class Renamer {
    final Set<QName> protectedNames;
    final Map<String, String> names = new LinkedHashMap<>();

    Renamer(Set<QName> protectedNames) {
      this.protectedNames = new LinkedHashSet<>(protectedNames);
    }

    private boolean bind(AstNode node) {
      boolean changed = false;
      for (String name : FreeVars.boundVars(node)) {
        final String name2 = freshName(protectedNames, name);
        names.put(name, name2);
        protectedNames.add(QName.of(name2));
        changed |= !name2.equals(name);
      }
      return changed;
    }

    Ast.Pat pat(Ast.Pat pat) {
      if (!bind(pat)) {
        return pat;
      }
      return pat.accept(
          new Shuttle() {
            @Override public Ast.Pat visit(Ast.IdPat idPat) {
              final String name = names.get(idPat.name);
              return name.equals(idPat.name)
                  ? idPat
                  : ast.idPat(idPat.pos, name);
            }
          });
    }

    ImmutableList<Ast.Pat> pats(List<Ast.Pat> pats) {
      return pats.stream().map(this::pat).collect(toImmutableList());
    }

    @Nullable Ast.Binds binds(@Nullable Ast.Binds binds) {
      if (binds == null || !bind(binds)) {
        return binds;
      }
      return binds.copy(
          binds.decls.stream().map(this::renameDecl)
              .collect(toImmutableList()));
    }

    private Ast.Decl renameDecl(Ast.Decl decl) {
      if (decl.op != Op.FUN_BIND) {
        return decl;
      }
      final Ast.FunBind funBind = (Ast.FunBind) decl;
      return funBind.copy(
          funBind.matches.stream()
              .map(m ->
                  m.copy(names.get(m.name), m.pats, m.rhs, m.binds))
              .collect(toImmutableList()));
    }

    /** Returns the substitution to apply within the scope of the binders:
     * bound names are removed from the domain of {@code subst}, and renamed
     * names are mapped to their new names. */
    Subst subst(Subst subst) {
      final Map<QName, Ast.Exp> map = new LinkedHashMap<>(subst.map);
      names.forEach((name, name2) -> {
        final QName qname = QName.of(name);
        if (name.equals(name2)) {
          map.remove(qname);
        } else {
          map.put(qname, ast.id(QName.of(name2)));
        }
      });
      return of(map);
    }
  }

  /** Shuttle that applies a substitution. */
  private static class Substituter extends Shuttle {
    private final Subst subst;

    Substituter(Subst subst) {
      this.subst = subst;
    }

    @Override public Ast.Exp visit(Ast.Id id) {
      final Ast.Exp exp = subst.map.get(id.name);
      return exp == null ? id : exp;
    }

    @Override public Ast.Exp visit(Ast.InfixCall infixCall) {
      final Ast.Exp a0 = infixCall.a0.accept(this);
      final Ast.Exp a1 = infixCall.a1.accept(this);
      if (infixCall.isConstructor()) {
        return infixCall.copy(a0, infixCall.operator, a1);
      }
      final Ast.Exp operator = infixCall.operator.accept(this);
      switch (operator.op) {
      case ID:
      case CON:
        return infixCall.copy(a0, operator, a1);
      default:
        // "a0 `f` a1" becomes "(e a0) a1"
        return ast.apply(infixCall.pos, ast.apply(infixCall.pos, operator, a0),
            a1);
      }
    }

    @Override public Ast.Exp visit(Ast.Fn fn) {
      final Renamer renamer = new Renamer(subst.freeVarSetIn(fn));
      final ImmutableList<Ast.Pat> pats = renamer.pats(fn.pats);
      final Subst subst2 = renamer.subst(subst);
      return fn.copy(pats, subst2.apply(fn.exp));
    }

    @Override public Ast.Exp visit(Ast.Let let) {
      final Renamer renamer = new Renamer(subst.freeVarSetIn(let));
      final Ast.Binds binds = Objects.requireNonNull(renamer.binds(let.binds));
      final Subst subst2 = renamer.subst(subst);
      return let.copy(subst2.apply(binds), subst2.apply(let.exp));
    }

    @Override public Ast.Alt visit(Ast.Alt alt) {
      final Renamer renamer = new Renamer(subst.freeVarSetIn(alt));
      final Ast.Pat pat = renamer.pat(alt.pat);
      final Ast.Binds binds = renamer.binds(alt.binds);
      final Subst subst2 = renamer.subst(subst);
      return alt.copy(pat, subst2.apply(alt.rhs),
          binds == null ? null : subst2.apply(binds));
    }

    @Override public Ast.Match visit(Ast.Match match) {
      final Renamer renamer = new Renamer(subst.freeVarSetIn(match));
      final ImmutableList<Ast.Pat> pats = renamer.pats(match.pats);
      final Ast.Binds binds = renamer.binds(match.binds);
      final Subst subst2 = renamer.subst(subst);
      return match.copy(match.name, pats, subst2.apply(match.rhs),
          binds == null ? null : subst2.apply(binds));
    }
  }
}

// End Subst.java
