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

import java.util.Objects;

/** Abstract syntax tree node. */
public abstract class AstNode {
  public final Pos pos;
  public final Op op;

  protected AstNode(Pos pos, Op op) {
    this.pos = Objects.requireNonNull(pos);
    this.op = Objects.requireNonNull(op);
  }

  /** Converts this node into a string.
   *
   * <p>Derived classes <em>may</em> override, but they should use the same
   * formatting as {@link #unparse(AstWriter, int)}. Tests compare trees by
   * comparing their strings. */
  @Override public final String toString() {
    return unparse(new AstWriter(), 0).toString();
  }

  /** Writes this node to a writer.
   *
   * @param w Writer
   * @param prec Binding strength that the context requires; the node
   *             wraps itself in parentheses if it binds less tightly
   * @return Writer
   */
  abstract AstWriter unparse(AstWriter w, int prec);

  /** Accepts a shuttle, returning this node or a copy of it with some
   * descendants replaced. */
  public abstract AstNode accept(Shuttle shuttle);
}

// End AstNode.java
