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

import net.hydromatic.flatcase.ast.Pos;

import java.util.Objects;

/** Diagnostic message, with a severity and the position of the code it
 * refers to. */
public class Message {
  public final Severity severity;
  public final Pos pos;
  public final String text;

  public Message(Severity severity, Pos pos, String text) {
    this.severity = Objects.requireNonNull(severity);
    this.pos = Objects.requireNonNull(pos);
    this.text = Objects.requireNonNull(text);
  }

  /** Creates a message of severity {@link Severity#ERROR}. */
  public static Message error(Pos pos, String text) {
    return new Message(Severity.ERROR, pos, text);
  }

  /** Creates a message of severity {@link Severity#INTERNAL}. */
  public static Message internal(Pos pos, String text) {
    return new Message(Severity.INTERNAL, pos, text);
  }

  @Override public String toString() {
    final StringBuilder b = new StringBuilder();
    if (!pos.isZero()) {
      b.append(pos).append(": ");
    }
    return b.append(severity.description).append(": ").append(text)
        .toString();
  }

  @Override public int hashCode() {
    return Objects.hash(severity, pos, text);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof Message
        && ((Message) o).severity == severity
        && ((Message) o).pos.equals(pos)
        && ((Message) o).text.equals(text);
  }
}

// End Message.java
