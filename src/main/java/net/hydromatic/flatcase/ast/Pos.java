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

/** Position of a parse tree node.
 *
 * <p>Nodes created by the compiler rather than read from source carry
 * {@link #ZERO}. */
public class Pos {
  /** Position of generated code. */
  public static final Pos ZERO = new Pos("", 0, 0, 0, 0);

  public final String file;
  public final int startLine;
  public final int startColumn;
  public final int endLine;
  public final int endColumn;

  /** Creates a Pos. */
  public Pos(String file, int startLine, int startColumn, int endLine,
      int endColumn) {
    this.file = Objects.requireNonNull(file);
    this.startLine = startLine;
    this.startColumn = startColumn;
    this.endLine = endLine;
    this.endColumn = endColumn;
  }

  /** Creates a Pos that spans a single line. */
  public static Pos of(String file, int line, int startColumn,
      int endColumn) {
    return new Pos(file, line, startColumn, line, endColumn);
  }

  /** Returns whether this position is the "no span" marker of generated
   * code. */
  public boolean isZero() {
    return this == ZERO || equals(ZERO);
  }

  /** Returns the smallest position that contains both this and another
   * position. */
  public Pos plus(Pos pos) {
    if (isZero()) {
      return pos;
    }
    if (pos.isZero()) {
      return this;
    }
    final boolean startsBefore = startLine < pos.startLine
        || startLine == pos.startLine && startColumn <= pos.startColumn;
    final boolean endsAfter = endLine > pos.endLine
        || endLine == pos.endLine && endColumn >= pos.endColumn;
    return new Pos(file,
        startsBefore ? startLine : pos.startLine,
        startsBefore ? startColumn : pos.startColumn,
        endsAfter ? endLine : pos.endLine,
        endsAfter ? endColumn : pos.endColumn);
  }

  @Override public int hashCode() {
    return Objects.hash(file, startLine, startColumn, endLine, endColumn);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof Pos
        && ((Pos) o).file.equals(file)
        && ((Pos) o).startLine == startLine
        && ((Pos) o).startColumn == startColumn
        && ((Pos) o).endLine == endLine
        && ((Pos) o).endColumn == endColumn;
  }

  @Override public String toString() {
    final StringBuilder b = new StringBuilder();
    if (!file.isEmpty()) {
      b.append(file).append(':');
    }
    b.append(startLine).append('.').append(startColumn);
    if (endLine != startLine || endColumn != startColumn) {
      b.append('-');
      if (endLine != startLine) {
        b.append(endLine).append('.');
      }
      b.append(endColumn);
    }
    return b.toString();
  }
}

// End Pos.java
