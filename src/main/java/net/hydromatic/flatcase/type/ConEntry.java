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
package net.hydromatic.flatcase.type;

import net.hydromatic.flatcase.ast.QName;

import com.google.common.base.Preconditions;

import java.util.Objects;

/** Data constructor of an algebraic type, as seen by the pattern-matching
 * compiler: its name, how many arguments it takes, whether it is written
 * infix, and the name of the type that owns it. */
public class ConEntry {
  public final QName name;
  public final int arity;
  public final boolean infix;
  public final QName typeName;

  public ConEntry(QName name, int arity, boolean infix, QName typeName) {
    this.name = Objects.requireNonNull(name);
    this.arity = arity;
    this.infix = infix;
    this.typeName = Objects.requireNonNull(typeName);
    Preconditions.checkArgument(arity >= 0, "negative arity");
    Preconditions.checkArgument(!infix || arity == 2,
        "infix constructor %s must have two arguments", name);
  }

  @Override public String toString() {
    return name + "/" + arity;
  }

  @Override public int hashCode() {
    return Objects.hash(name, arity, infix, typeName);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof ConEntry
        && ((ConEntry) o).name.equals(name)
        && ((ConEntry) o).arity == arity
        && ((ConEntry) o).infix == infix
        && ((ConEntry) o).typeName.equals(typeName);
  }
}

// End ConEntry.java
