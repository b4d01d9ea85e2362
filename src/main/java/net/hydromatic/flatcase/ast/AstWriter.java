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

import java.math.BigDecimal;
import java.util.List;
import javax.annotation.Nullable;

/** Prints AST nodes as source text. */
public class AstWriter {
  /** Binding strength of lambda, let, if, case and annotated expressions. */
  public static final int OPEN = 0;
  /** Binding strength of infix calls. */
  public static final int INFIX = 1;
  /** Binding strength of function application and negation. */
  public static final int APPLY = 2;
  /** Binding strength of atoms. */
  public static final int ATOM = 3;

  private final StringBuilder b = new StringBuilder();

  @Override public String toString() {
    return b.toString();
  }

  /** Appends a string to the output. */
  public AstWriter append(String s) {
    b.append(s);
    return this;
  }

  /** Appends a node, wrapping it in parentheses if it binds less tightly
   * than {@code prec}. */
  public AstWriter append(AstNode node, int prec) {
    return node.unparse(this, prec);
  }

  /** Appends a list of nodes, with a separator between them. */
  public AstWriter appendAll(List<? extends AstNode> nodes, String sep,
      int prec) {
    for (int i = 0; i < nodes.size(); i++) {
      if (i > 0) {
        b.append(sep);
      }
      nodes.get(i).unparse(this, prec);
    }
    return this;
  }

  /** Appends a literal value. */
  public AstWriter appendLiteral(Object value) {
    if (value instanceof String) {
      return appendQuoted((String) value, '"');
    } else if (value instanceof Character) {
      return appendQuoted(value.toString(), '\'');
    } else if (value instanceof BigDecimal) {
      final BigDecimal d = (BigDecimal) value;
      if (d.signum() < 0) {
        b.append('(').append(d.toPlainString()).append(')');
      } else {
        b.append(d.toPlainString());
      }
      return this;
    } else {
      b.append(value);
      return this;
    }
  }

  private AstWriter appendQuoted(String s, char quote) {
    b.append(quote);
    for (int i = 0; i < s.length(); i++) {
      final char c = s.charAt(i);
      switch (c) {
      case '\\':
        b.append("\\\\");
        break;
      case '\n':
        b.append("\\n");
        break;
      case '\t':
        b.append("\\t");
        break;
      default:
        if (c == quote) {
          b.append('\\');
        }
        b.append(c);
      }
    }
    b.append(quote);
    return this;
  }

  /** Appends a {@code where} clause, if there are bindings. */
  AstWriter appendWhere(@Nullable Ast.Binds binds) {
    if (binds == null || binds.decls.isEmpty()) {
      return this;
    }
    return append(" where { ").append(binds, OPEN).append(" }");
  }

  /** Opens a parenthesis if a node of binding strength {@code level} is
   * being written in a context that requires {@code prec}. */
  AstWriter open(int prec, int level) {
    if (prec > level) {
      b.append('(');
    }
    return this;
  }

  /** Closes the parenthesis opened by {@link #open(int, int)}. */
  AstWriter close(int prec, int level) {
    if (prec > level) {
      b.append(')');
    }
    return this;
  }
}

// End AstWriter.java
