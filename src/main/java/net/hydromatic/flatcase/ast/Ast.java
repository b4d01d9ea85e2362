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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;
import javax.annotation.Nullable;

import static net.hydromatic.flatcase.ast.AstBuilder.ast;
import static net.hydromatic.flatcase.util.Static.toImmutableList;

/** Various sub-classes of AST nodes.
 *
 * <p>Every node is immutable. A transformation that changes a node creates a
 * new node; the {@code copy} methods return the node itself if none of the
 * arguments differ. */
public class Ast {
  private Ast() {}

  /** Base class for an expression. */
  public abstract static class Exp extends AstNode {
    Exp(Pos pos, Op op) {
      super(pos, op);
    }

    @Override public abstract Exp accept(Shuttle shuttle);
  }

  /** Parse tree node of a variable reference. */
  public static class Id extends Exp {
    public final QName name;

    Id(Pos pos, QName name) {
      super(pos, Op.ID);
      this.name = Objects.requireNonNull(name);
    }

    AstWriter unparse(AstWriter w, int prec) {
      return w.append(name.toString());
    }

    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }
  }

  /** Parse tree node of a reference to a data constructor. */
  public static class Con extends Exp {
    public final QName name;

    Con(Pos pos, QName name) {
      super(pos, Op.CON);
      this.name = Objects.requireNonNull(name);
    }

    AstWriter unparse(AstWriter w, int prec) {
      return w.append(name.toString());
    }

    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }
  }

  /** Parse tree node of a literal (number, character or string). */
  public static class Literal extends Exp {
    public final Object value;

    Literal(Pos pos, Object value) {
      super(pos, Op.LITERAL);
      this.value = Objects.requireNonNull(value);
    }

    AstWriter unparse(AstWriter w, int prec) {
      return w.appendLiteral(value);
    }

    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }
  }

  /** Call to an infix operator, e.g. "{@code x + y}", "{@code h : t}" or
   * "{@code a `div` b}".
   *
   * <p>The operator is either an {@link Id} or a {@link Con}. */
  public static class InfixCall extends Exp {
    public final Exp a0;
    public final Exp operator;
    public final Exp a1;

    InfixCall(Pos pos, Exp a0, Exp operator, Exp a1) {
      super(pos, Op.INFIX_CALL);
      this.a0 = Objects.requireNonNull(a0);
      this.operator = Objects.requireNonNull(operator);
      this.a1 = Objects.requireNonNull(a1);
      Preconditions.checkArgument(operator.op == Op.ID
          || operator.op == Op.CON, "bad operator %s", operator);
    }

    /** Returns whether the operator is a data constructor. */
    public boolean isConstructor() {
      return operator.op == Op.CON;
    }

    /** Returns the name of the operator. */
    public QName operatorName() {
      return operator.op == Op.CON
          ? ((Con) operator).name
          : ((Id) operator).name;
    }

    AstWriter unparse(AstWriter w, int prec) {
      return w.open(prec, AstWriter.INFIX)
          .append(a0, AstWriter.APPLY)
          .append(" ").append(operatorName().toInfixString()).append(" ")
          .append(a1, AstWriter.APPLY)
          .close(prec, AstWriter.INFIX);
    }

    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    public InfixCall copy(Exp a0, Exp operator, Exp a1) {
      return a0 == this.a0 && operator == this.operator && a1 == this.a1
          ? this
          : new InfixCall(pos, a0, operator, a1);
    }
  }

  /** Application of a function to an argument. */
  public static class Apply extends Exp {
    public final Exp fn;
    public final Exp arg;

    Apply(Pos pos, Exp fn, Exp arg) {
      super(pos, Op.APPLY);
      this.fn = Objects.requireNonNull(fn);
      this.arg = Objects.requireNonNull(arg);
    }

    AstWriter unparse(AstWriter w, int prec) {
      return w.open(prec, AstWriter.APPLY)
          .append(fn, AstWriter.APPLY)
          .append(" ")
          .append(arg, AstWriter.ATOM)
          .close(prec, AstWriter.APPLY);
    }

    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    public Apply copy(Exp fn, Exp arg) {
      return fn == this.fn && arg == this.arg
          ? this
          : new Apply(pos, fn, arg);
    }
  }

  /** Negation, "{@code -e}". */
  public static class Negate extends Exp {
    public final Exp exp;

    Negate(Pos pos, Exp exp) {
      super(pos, Op.NEGATE);
      this.exp = Objects.requireNonNull(exp);
    }

    AstWriter unparse(AstWriter w, int prec) {
      return w.open(prec, AstWriter.APPLY)
          .append("-")
          .append(exp, AstWriter.ATOM)
          .close(prec, AstWriter.APPLY);
    }

    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    public Negate copy(Exp exp) {
      return exp == this.exp ? this : new Negate(pos, exp);
    }
  }

  /** Lambda expression, "{@code \p1 ... pn -> e}". */
  public static class Fn extends Exp {
    public final ImmutableList<Pat> pats;
    public final Exp exp;

    Fn(Pos pos, ImmutableList<Pat> pats, Exp exp) {
      super(pos, Op.FN);
      this.pats = Objects.requireNonNull(pats);
      this.exp = Objects.requireNonNull(exp);
    }

    AstWriter unparse(AstWriter w, int prec) {
      return w.open(prec, AstWriter.OPEN)
          .append("\\")
          .appendAll(pats, " ", AstWriter.ATOM)
          .append(" -> ")
          .append(exp, AstWriter.OPEN)
          .close(prec, AstWriter.OPEN);
    }

    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    public Fn copy(List<Pat> pats, Exp exp) {
      return pats.equals(this.pats) && exp == this.exp
          ? this
          : new Fn(pos, ImmutableList.copyOf(pats), exp);
    }
  }

  /** Let expression, "{@code let decls in e}". */
  public static class Let extends Exp {
    public final Binds binds;
    public final Exp exp;

    Let(Pos pos, Binds binds, Exp exp) {
      super(pos, Op.LET);
      this.binds = Objects.requireNonNull(binds);
      this.exp = Objects.requireNonNull(exp);
    }

    AstWriter unparse(AstWriter w, int prec) {
      return w.open(prec, AstWriter.OPEN)
          .append("let { ")
          .append(binds, AstWriter.OPEN)
          .append(" } in ")
          .append(exp, AstWriter.OPEN)
          .close(prec, AstWriter.OPEN);
    }

    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    public Let copy(Binds binds, Exp exp) {
      return binds == this.binds && exp == this.exp
          ? this
          : new Let(pos, binds, exp);
    }
  }

  /** Conditional, "{@code if c then e1 else e2}". */
  public static class If extends Exp {
    public final Exp condition;
    public final Exp ifTrue;
    public final Exp ifFalse;

    If(Pos pos, Exp condition, Exp ifTrue, Exp ifFalse) {
      super(pos, Op.IF);
      this.condition = Objects.requireNonNull(condition);
      this.ifTrue = Objects.requireNonNull(ifTrue);
      this.ifFalse = Objects.requireNonNull(ifFalse);
    }

    AstWriter unparse(AstWriter w, int prec) {
      return w.open(prec, AstWriter.OPEN)
          .append("if ").append(condition, AstWriter.OPEN)
          .append(" then ").append(ifTrue, AstWriter.OPEN)
          .append(" else ").append(ifFalse, AstWriter.OPEN)
          .close(prec, AstWriter.OPEN);
    }

    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    public If copy(Exp condition, Exp ifTrue, Exp ifFalse) {
      return condition == this.condition
          && ifTrue == this.ifTrue
          && ifFalse == this.ifFalse
          ? this
          : new If(pos, condition, ifTrue, ifFalse);
    }
  }

  /** Case expression, "{@code case e of { p1 -> e1; ... }}". */
  public static class Case extends Exp {
    public final Exp exp;
    public final ImmutableList<Alt> alts;

    Case(Pos pos, Exp exp, ImmutableList<Alt> alts) {
      super(pos, Op.CASE);
      this.exp = Objects.requireNonNull(exp);
      this.alts = Objects.requireNonNull(alts);
    }

    AstWriter unparse(AstWriter w, int prec) {
      return w.open(prec, AstWriter.OPEN)
          .append("case ").append(exp, AstWriter.OPEN)
          .append(" of { ")
          .appendAll(alts, "; ", AstWriter.OPEN)
          .append(" }")
          .close(prec, AstWriter.OPEN);
    }

    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    public Case copy(Exp exp, List<Alt> alts) {
      return exp == this.exp && alts.equals(this.alts)
          ? this
          : new Case(pos, exp, ImmutableList.copyOf(alts));
    }
  }

  /** Tuple expression, "{@code (e1, ..., en)}". */
  public static class Tuple extends Exp {
    public final ImmutableList<Exp> args;

    Tuple(Pos pos, ImmutableList<Exp> args) {
      super(pos, Op.TUPLE);
      this.args = Objects.requireNonNull(args);
    }

    AstWriter unparse(AstWriter w, int prec) {
      return w.append("(")
          .appendAll(args, ", ", AstWriter.OPEN)
          .append(")");
    }

    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    public Tuple copy(List<Exp> args) {
      return args.equals(this.args)
          ? this
          : new Tuple(pos, ImmutableList.copyOf(args));
    }
  }

  /** List expression, "{@code [e1, ..., en]}". */
  public static class ListExp extends Exp {
    public final ImmutableList<Exp> args;

    ListExp(Pos pos, ImmutableList<Exp> args) {
      super(pos, Op.LIST);
      this.args = Objects.requireNonNull(args);
    }

    AstWriter unparse(AstWriter w, int prec) {
      return w.append("[")
          .appendAll(args, ", ", AstWriter.OPEN)
          .append("]");
    }

    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    public ListExp copy(List<Exp> args) {
      return args.equals(this.args)
          ? this
          : new ListExp(pos, ImmutableList.copyOf(args));
    }
  }

  /** Parenthesized expression. */
  public static class Paren extends Exp {
    public final Exp exp;

    Paren(Pos pos, Exp exp) {
      super(pos, Op.PAREN);
      this.exp = Objects.requireNonNull(exp);
    }

    AstWriter unparse(AstWriter w, int prec) {
      return w.append("(").append(exp, AstWriter.OPEN).append(")");
    }

    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    public Paren copy(Exp exp) {
      return exp == this.exp ? this : new Paren(pos, exp);
    }
  }

  /** Expression with a type annotation, "{@code e :: t}".
   *
   * <p>The type is opaque to the compiler and is held as text. */
  public static class Annotated extends Exp {
    public final Exp exp;
    public final String type;

    Annotated(Pos pos, Exp exp, String type) {
      super(pos, Op.ANNOTATED);
      this.exp = Objects.requireNonNull(exp);
      this.type = Objects.requireNonNull(type);
    }

    AstWriter unparse(AstWriter w, int prec) {
      return w.open(prec, AstWriter.OPEN)
          .append(exp, AstWriter.INFIX)
          .append(" :: ").append(type)
          .close(prec, AstWriter.OPEN);
    }

    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    public Annotated copy(Exp exp) {
      return exp == this.exp ? this : new Annotated(pos, exp, type);
    }
  }

  /** Base class for a pattern. */
  public abstract static class Pat extends AstNode {
    Pat(Pos pos, Op op) {
      super(pos, op);
    }

    @Override public abstract Pat accept(Shuttle shuttle);

    /** Converts this pattern to the expression that constructs the value it
     * matches. */
    public abstract Exp toExp();
  }

  /** Variable pattern. */
  public static class IdPat extends Pat {
    public final String name;

    IdPat(Pos pos, String name) {
      super(pos, Op.ID_PAT);
      this.name = Objects.requireNonNull(name);
    }

    AstWriter unparse(AstWriter w, int prec) {
      return w.append(QName.of(name).toString());
    }

    public Pat accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    public Id toExp() {
      return ast.id(pos, QName.of(name));
    }
  }

  /** Wildcard pattern, "{@code _}". */
  public static class WildcardPat extends Pat {
    WildcardPat(Pos pos) {
      super(pos, Op.WILDCARD_PAT);
    }

    AstWriter unparse(AstWriter w, int prec) {
      return w.append("_");
    }

    public Pat accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    /** {@inheritDoc}
     *
     * <p>A wildcard matches any value, so there is no single value to
     * construct; returns {@link AstBuilder#undefined}. */
    public Exp toExp() {
      return ast.undefined(pos);
    }
  }

  /** Pattern that applies a constructor in prefix notation to zero or more
   * patterns, e.g. "{@code Just x}" or "{@code (:) x xs}". */
  public static class ConPat extends Pat {
    public final QName con;
    public final ImmutableList<Pat> args;

    ConPat(Pos pos, QName con, ImmutableList<Pat> args) {
      super(pos, Op.CON_PAT);
      this.con = Objects.requireNonNull(con);
      this.args = Objects.requireNonNull(args);
    }

    AstWriter unparse(AstWriter w, int prec) {
      if (args.isEmpty()) {
        return w.append(con.toString());
      }
      return w.open(prec, AstWriter.APPLY)
          .append(con.toString())
          .append(" ")
          .appendAll(args, " ", AstWriter.ATOM)
          .close(prec, AstWriter.APPLY);
    }

    public Pat accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    public Exp toExp() {
      Exp e = ast.con(pos, con);
      for (Pat arg : args) {
        e = ast.apply(pos, e, arg.toExp());
      }
      return e;
    }

    public ConPat copy(List<Pat> args) {
      return args.equals(this.args)
          ? this
          : new ConPat(pos, con, ImmutableList.copyOf(args));
    }
  }

  /** Pattern that applies an infix constructor, e.g. "{@code x : xs}". */
  public static class InfixConPat extends Pat {
    public final Pat p0;
    public final QName con;
    public final Pat p1;

    InfixConPat(Pos pos, Pat p0, QName con, Pat p1) {
      super(pos, Op.INFIX_CON_PAT);
      this.p0 = Objects.requireNonNull(p0);
      this.con = Objects.requireNonNull(con);
      this.p1 = Objects.requireNonNull(p1);
    }

    AstWriter unparse(AstWriter w, int prec) {
      return w.open(prec, AstWriter.INFIX)
          .append(p0, AstWriter.APPLY)
          .append(" ").append(con.toInfixString()).append(" ")
          .append(p1, AstWriter.APPLY)
          .close(prec, AstWriter.INFIX);
    }

    public Pat accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    public Exp toExp() {
      return ast.infixCall(pos, p0.toExp(), ast.con(pos, con), p1.toExp());
    }

    public InfixConPat copy(Pat p0, Pat p1) {
      return p0 == this.p0 && p1 == this.p1
          ? this
          : new InfixConPat(pos, p0, con, p1);
    }
  }

  /** Tuple pattern, "{@code (p1, ..., pn)}". */
  public static class TuplePat extends Pat {
    public final ImmutableList<Pat> args;

    TuplePat(Pos pos, ImmutableList<Pat> args) {
      super(pos, Op.TUPLE_PAT);
      this.args = Objects.requireNonNull(args);
    }

    AstWriter unparse(AstWriter w, int prec) {
      return w.append("(")
          .appendAll(args, ", ", AstWriter.OPEN)
          .append(")");
    }

    public Pat accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    public Exp toExp() {
      return ast.tuple(pos,
          args.stream().map(Pat::toExp).collect(toImmutableList()));
    }

    public TuplePat copy(List<Pat> args) {
      return args.equals(this.args)
          ? this
          : new TuplePat(pos, ImmutableList.copyOf(args));
    }
  }

  /** List pattern, "{@code [p1, ..., pn]}". */
  public static class ListPat extends Pat {
    public final ImmutableList<Pat> args;

    ListPat(Pos pos, ImmutableList<Pat> args) {
      super(pos, Op.LIST_PAT);
      this.args = Objects.requireNonNull(args);
    }

    AstWriter unparse(AstWriter w, int prec) {
      return w.append("[")
          .appendAll(args, ", ", AstWriter.OPEN)
          .append("]");
    }

    public Pat accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    public Exp toExp() {
      return ast.list(pos,
          args.stream().map(Pat::toExp).collect(toImmutableList()));
    }

    public ListPat copy(List<Pat> args) {
      return args.equals(this.args)
          ? this
          : new ListPat(pos, ImmutableList.copyOf(args));
    }
  }

  /** Parenthesized pattern. */
  public static class ParenPat extends Pat {
    public final Pat pat;

    ParenPat(Pos pos, Pat pat) {
      super(pos, Op.PAREN_PAT);
      this.pat = Objects.requireNonNull(pat);
    }

    AstWriter unparse(AstWriter w, int prec) {
      return w.append("(").append(pat, AstWriter.OPEN).append(")");
    }

    public Pat accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    public Exp toExp() {
      return ast.paren(pos, pat.toExp());
    }

    public ParenPat copy(Pat pat) {
      return pat == this.pat ? this : new ParenPat(pos, pat);
    }
  }

  /** Right-hand side of a function rule or case alternative. */
  public abstract static class Rhs extends AstNode {
    Rhs(Pos pos, Op op) {
      super(pos, op);
    }

    @Override public abstract Rhs accept(Shuttle shuttle);

    AstWriter unparse(AstWriter w, int prec) {
      return unparse(w, "=");
    }

    /** Writes this right-hand side, using "=" (for a function rule) or "->"
     * (for a case alternative) to separate it from what precedes it. */
    abstract AstWriter unparse(AstWriter w, String sep);
  }

  /** Right-hand side without guards. */
  public static class UnguardedRhs extends Rhs {
    public final Exp exp;

    UnguardedRhs(Pos pos, Exp exp) {
      super(pos, Op.UNGUARDED_RHS);
      this.exp = Objects.requireNonNull(exp);
    }

    AstWriter unparse(AstWriter w, String sep) {
      return w.append(" ").append(sep).append(" ")
          .append(exp, AstWriter.OPEN);
    }

    public Rhs accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    public UnguardedRhs copy(Exp exp) {
      return exp == this.exp ? this : new UnguardedRhs(pos, exp);
    }
  }

  /** Right-hand side that consists of one or more guarded expressions. */
  public static class GuardedRhss extends Rhs {
    public final ImmutableList<GuardedRhs> guards;

    GuardedRhss(Pos pos, ImmutableList<GuardedRhs> guards) {
      super(pos, Op.GUARDED_RHSS);
      this.guards = Objects.requireNonNull(guards);
      Preconditions.checkArgument(!guards.isEmpty(), "no guards");
    }

    AstWriter unparse(AstWriter w, String sep) {
      for (GuardedRhs guard : guards) {
        w.append(" | ").append(guard.guard, AstWriter.OPEN)
            .append(" ").append(sep).append(" ")
            .append(guard.exp, AstWriter.OPEN);
      }
      return w;
    }

    public Rhs accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    public GuardedRhss copy(List<GuardedRhs> guards) {
      return guards.equals(this.guards)
          ? this
          : new GuardedRhss(pos, ImmutableList.copyOf(guards));
    }
  }

  /** Guard and the expression it protects, "{@code | g = e}". */
  public static class GuardedRhs extends AstNode {
    public final Exp guard;
    public final Exp exp;

    GuardedRhs(Pos pos, Exp guard, Exp exp) {
      super(pos, Op.GUARDED_RHS);
      this.guard = Objects.requireNonNull(guard);
      this.exp = Objects.requireNonNull(exp);
    }

    AstWriter unparse(AstWriter w, int prec) {
      return w.append("| ").append(guard, AstWriter.OPEN)
          .append(" = ").append(exp, AstWriter.OPEN);
    }

    public GuardedRhs accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    public GuardedRhs copy(Exp guard, Exp exp) {
      return guard == this.guard && exp == this.exp
          ? this
          : new GuardedRhs(pos, guard, exp);
    }
  }

  /** Alternative of a case expression, "{@code p -> e}", with optional local
   * bindings. */
  public static class Alt extends AstNode {
    public final Pat pat;
    public final Rhs rhs;
    public final @Nullable Binds binds;

    Alt(Pos pos, Pat pat, Rhs rhs, @Nullable Binds binds) {
      super(pos, Op.ALT);
      this.pat = Objects.requireNonNull(pat);
      this.rhs = Objects.requireNonNull(rhs);
      this.binds = binds;
    }

    AstWriter unparse(AstWriter w, int prec) {
      w.append(pat, AstWriter.OPEN);
      rhs.unparse(w, "->");
      return w.appendWhere(binds);
    }

    public Alt accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    public Alt copy(Pat pat, Rhs rhs, @Nullable Binds binds) {
      return pat == this.pat && rhs == this.rhs && binds == this.binds
          ? this
          : new Alt(pos, pat, rhs, binds);
    }
  }

  /** One rule of a function declaration, "{@code f p1 ... pn = e}", with
   * optional local bindings. */
  public static class Match extends AstNode {
    public final String name;
    public final boolean infix;
    public final ImmutableList<Pat> pats;
    public final Rhs rhs;
    public final @Nullable Binds binds;

    Match(Pos pos, String name, boolean infix, ImmutableList<Pat> pats,
        Rhs rhs, @Nullable Binds binds) {
      super(pos, Op.MATCH);
      this.name = Objects.requireNonNull(name);
      this.infix = infix;
      this.pats = Objects.requireNonNull(pats);
      this.rhs = Objects.requireNonNull(rhs);
      this.binds = binds;
      Preconditions.checkArgument(!infix || pats.size() >= 2,
          "infix rule needs two patterns");
    }

    AstWriter unparse(AstWriter w, int prec) {
      if (infix) {
        w.append(pats.get(0), AstWriter.APPLY)
            .append(" ").append(QName.of(name).toInfixString()).append(" ")
            .append(pats.get(1), AstWriter.APPLY);
        for (Pat pat : pats.subList(2, pats.size())) {
          w.append(" ").append(pat, AstWriter.ATOM);
        }
      } else {
        w.append(QName.of(name).toString());
        for (Pat pat : pats) {
          w.append(" ").append(pat, AstWriter.ATOM);
        }
      }
      rhs.unparse(w, "=");
      return w.appendWhere(binds);
    }

    public Match accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    public Match copy(String name, List<Pat> pats, Rhs rhs,
        @Nullable Binds binds) {
      return name.equals(this.name)
          && pats.equals(this.pats)
          && rhs == this.rhs
          && binds == this.binds
          ? this
          : new Match(pos, name, infix, ImmutableList.copyOf(pats), rhs,
              binds);
    }
  }

  /** Base class for a declaration. */
  public abstract static class Decl extends AstNode {
    Decl(Pos pos, Op op) {
      super(pos, op);
    }

    @Override public abstract Decl accept(Shuttle shuttle);
  }

  /** Declaration of a function or variable; one or more rules that share a
   * name. */
  public static class FunBind extends Decl {
    public final ImmutableList<Match> matches;

    FunBind(Pos pos, ImmutableList<Match> matches) {
      super(pos, Op.FUN_BIND);
      this.matches = Objects.requireNonNull(matches);
      Preconditions.checkArgument(!matches.isEmpty(), "no rules");
    }

    /** Returns the name of the function. */
    public String name() {
      return matches.get(0).name;
    }

    AstWriter unparse(AstWriter w, int prec) {
      return w.appendAll(matches, "; ", AstWriter.OPEN);
    }

    public Decl accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    public FunBind copy(List<Match> matches) {
      return matches.equals(this.matches)
          ? this
          : new FunBind(pos, ImmutableList.copyOf(matches));
    }
  }

  /** Declaration of an algebraic data type. */
  public static class DataDecl extends Decl {
    public final String name;
    public final ImmutableList<ConDecl> cons;

    DataDecl(Pos pos, String name, ImmutableList<ConDecl> cons) {
      super(pos, Op.DATA_DECL);
      this.name = Objects.requireNonNull(name);
      this.cons = Objects.requireNonNull(cons);
    }

    AstWriter unparse(AstWriter w, int prec) {
      w.append("data ").append(name);
      if (!cons.isEmpty()) {
        w.append(" = ").appendAll(cons, " | ", AstWriter.OPEN);
      }
      return w;
    }

    public Decl accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }
  }

  /** Declaration of a data constructor within a {@link DataDecl}.
   *
   * <p>Argument types are opaque and held as text. */
  public static class ConDecl extends AstNode {
    public final String name;
    public final boolean infix;
    public final ImmutableList<String> argTypes;

    ConDecl(Pos pos, String name, boolean infix,
        ImmutableList<String> argTypes) {
      super(pos, Op.CON_DECL);
      this.name = Objects.requireNonNull(name);
      this.infix = infix;
      this.argTypes = Objects.requireNonNull(argTypes);
      Preconditions.checkArgument(!infix || argTypes.size() == 2,
          "infix constructor needs two arguments");
    }

    public int arity() {
      return argTypes.size();
    }

    AstWriter unparse(AstWriter w, int prec) {
      if (infix) {
        return w.append(argTypes.get(0))
            .append(" ").append(QName.of(name).toInfixString()).append(" ")
            .append(argTypes.get(1));
      }
      w.append(QName.of(name).toString());
      for (String argType : argTypes) {
        w.append(" ").append(argType);
      }
      return w;
    }

    public ConDecl accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }
  }

  /** Declaration that the compiler does not interpret, such as a type
   * signature or an instance declaration. */
  public static class OtherDecl extends Decl {
    public final String text;

    OtherDecl(Pos pos, String text) {
      super(pos, Op.OTHER_DECL);
      this.text = Objects.requireNonNull(text);
    }

    AstWriter unparse(AstWriter w, int prec) {
      return w.append(text);
    }

    public Decl accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }
  }

  /** Group of local declarations, in a {@code let} expression or a
   * {@code where} clause. */
  public static class Binds extends AstNode {
    public final ImmutableList<Decl> decls;

    Binds(Pos pos, ImmutableList<Decl> decls) {
      super(pos, Op.BINDS);
      this.decls = Objects.requireNonNull(decls);
    }

    AstWriter unparse(AstWriter w, int prec) {
      return w.appendAll(decls, "; ", AstWriter.OPEN);
    }

    public Binds accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    public Binds copy(List<Decl> decls) {
      return decls.equals(this.decls)
          ? this
          : new Binds(pos, ImmutableList.copyOf(decls));
    }
  }

  /** Module; an optional name and a list of declarations. */
  public static class Module extends AstNode {
    public final @Nullable String name;
    public final ImmutableList<Decl> decls;

    Module(Pos pos, @Nullable String name, ImmutableList<Decl> decls) {
      super(pos, Op.MODULE);
      this.name = name;
      this.decls = Objects.requireNonNull(decls);
    }

    AstWriter unparse(AstWriter w, int prec) {
      if (name != null) {
        w.append("module ").append(name).append(" where\n");
      }
      return w.appendAll(decls, "\n", AstWriter.OPEN);
    }

    public Module accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    public Module copy(List<Decl> decls) {
      return decls.equals(this.decls)
          ? this
          : new Module(pos, name, ImmutableList.copyOf(decls));
    }
  }
}

// End Ast.java
