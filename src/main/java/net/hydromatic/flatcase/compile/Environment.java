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

import net.hydromatic.flatcase.ast.QName;
import net.hydromatic.flatcase.type.ConEntry;

import com.google.common.collect.ImmutableList;

import javax.annotation.Nullable;

/** Environment in which the pattern-matching compiler looks up data types
 * and their constructors.
 *
 * <p>Lookups are deterministic: a type's constructors are always returned
 * in the same order during a transformation. */
public interface Environment {
  /** Returns the constructors of a data type, in declaration order, or null
   * if the type is not known. */
  @Nullable ImmutableList<ConEntry> getConstructorsOpt(QName typeName);

  /** Returns the name of the type that owns a constructor, or null if the
   * constructor is not known. */
  @Nullable QName getTypeOpt(QName conName);
}

// End Environment.java
