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

/** Kinds of node in the intermediate syntax tree. */
public enum Op {
  // expressions
  ID,
  CON,
  LITERAL,
  INFIX_CALL,
  APPLY,
  NEGATE,
  FN,
  LET,
  IF,
  CASE,
  TUPLE,
  LIST,
  PAREN,
  ANNOTATED,

  // patterns
  ID_PAT,
  WILDCARD_PAT,
  CON_PAT,
  INFIX_CON_PAT,
  TUPLE_PAT,
  LIST_PAT,
  PAREN_PAT,

  // right-hand sides
  UNGUARDED_RHS,
  GUARDED_RHSS,
  GUARDED_RHS,

  ALT,
  MATCH,

  // declarations
  FUN_BIND,
  DATA_DECL,
  CON_DECL,
  OTHER_DECL,

  BINDS,
  MODULE;

  /** Returns whether this is the kind of a pattern. */
  public boolean isPattern() {
    return compareTo(ID_PAT) >= 0 && compareTo(PAREN_PAT) <= 0;
  }

  /** Returns whether this is the kind of an expression. */
  public boolean isExpression() {
    return compareTo(ANNOTATED) <= 0;
  }
}

// End Op.java
