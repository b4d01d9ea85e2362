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
import com.google.common.base.Strings;

import java.util.Objects;
import javax.annotation.Nullable;

/** Possibly qualified name of a variable, constructor or type.
 *
 * <p>The built-in constructors with special syntax are names too:
 * {@link #UNIT "()"}, {@link #NIL "[]"}, {@link #CONS ":"} and the tuple
 * constructors "(,)", "(,,)" and so forth (see {@link #tuple(int)}). */
public class QName implements Comparable<QName> {
  /** Name of the unit constructor and type. */
  public static final QName UNIT = new QName(null, "()");

  /** Name of the empty list constructor, and of the list type. */
  public static final QName NIL = new QName(null, "[]");

  /** Name of the list constructor. */
  public static final QName CONS = new QName(null, ":");

  /** Module qualifier, or null. */
  public final @Nullable String qualifier;
  public final String name;

  private QName(@Nullable String qualifier, String name) {
    this.qualifier = qualifier;
    this.name = Objects.requireNonNull(name);
    Preconditions.checkArgument(!name.isEmpty(), "empty name");
  }

  /** Creates an unqualified name. */
  public static QName of(String name) {
    return new QName(null, name);
  }

  /** Creates a name qualified by a module name. */
  public static QName qualified(String qualifier, String name) {
    return new QName(Objects.requireNonNull(qualifier), name);
  }

  /** Returns the name of the tuple constructor of a given arity;
   * for example {@code tuple(3)} is "(,,)". */
  public static QName tuple(int arity) {
    Preconditions.checkArgument(arity >= 2, "tuple arity %s", arity);
    return new QName(null, "(" + Strings.repeat(",", arity - 1) + ")");
  }

  public boolean isQualified() {
    return qualifier != null;
  }

  /** Returns this name without its qualifier. */
  public QName unqualified() {
    return qualifier == null ? this : new QName(null, name);
  }

  /** Returns whether this name is made of letters, digits, underscores and
   * quotes, like "x" or "Just" (as opposed to an operator symbol like "+" or
   * ":"). */
  public boolean isIdentifier() {
    return isIdentifier(name);
  }

  /** Returns whether a name is identifier-shaped. */
  public static boolean isIdentifier(String name) {
    final char c = name.charAt(0);
    return Character.isLetter(c) || c == '_';
  }

  /** Returns whether this is one of the built-in names with bracket syntax:
   * "()", "[]" or a tuple constructor. */
  public boolean isBracketed() {
    return name.startsWith("(") || name.startsWith("[");
  }

  /** Returns whether this is the name of a tuple constructor. */
  public boolean isTuple() {
    return name.length() >= 3
        && name.startsWith("(,")
        && name.endsWith(")");
  }

  /** Returns the arity of a tuple constructor. */
  public int tupleArity() {
    Preconditions.checkState(isTuple(), "not a tuple constructor: %s", this);
    return name.length() - 1;
  }

  @Override public int compareTo(QName o) {
    final int c = Strings.nullToEmpty(qualifier)
        .compareTo(Strings.nullToEmpty(o.qualifier));
    return c != 0 ? c : name.compareTo(o.name);
  }

  @Override public int hashCode() {
    return Objects.hash(qualifier, name);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof QName
        && Objects.equals(((QName) o).qualifier, qualifier)
        && ((QName) o).name.equals(name);
  }

  /** Returns the name as it would be written in prefix position, e.g.
   * "x", "M.x", "(+)" or "[]". */
  @Override public String toString() {
    final String s = qualifier == null ? name : qualifier + "." + name;
    return isIdentifier() || isBracketed() ? s : "(" + s + ")";
  }

  /** Returns the name as it would be written in infix position, e.g.
   * "+", "M.+" or "`div`". */
  public String toInfixString() {
    final String s = qualifier == null ? name : qualifier + "." + name;
    return isIdentifier() ? "`" + s + "`" : s;
  }
}

// End QName.java
