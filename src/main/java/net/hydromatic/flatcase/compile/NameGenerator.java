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
import net.hydromatic.flatcase.ast.Pos;

import static net.hydromatic.flatcase.ast.AstBuilder.ast;

/** Generates unique names.
 *
 * <p>One instance serves one transformation run; all prefixes share the
 * same counter. */
public class NameGenerator {
  /** Prefix of names generated by {@link #get()}. */
  public static final String DEFAULT_PREFIX = "a";

  private int id;

  public NameGenerator() {
    this(0);
  }

  /** Creates a NameGenerator whose first name has a given number. */
  public NameGenerator(int start) {
    this.id = start;
  }

  /** Generates a name with the default prefix, e.g. "a0". */
  public String get() {
    return get(DEFAULT_PREFIX);
  }

  /** Generates a name with a given prefix, e.g. "g3". */
  public String get(String prefix) {
    return prefix + id++;
  }

  /** Generates a variable pattern with a fresh name. */
  public Ast.IdPat pat(String prefix, Pos pos) {
    return ast.idPat(pos, get(prefix));
  }

  /** Generates a variable pattern with a fresh name and the default
   * prefix. */
  public Ast.IdPat pat(Pos pos) {
    return pat(DEFAULT_PREFIX, pos);
  }
}

// End NameGenerator.java
