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
import com.google.common.collect.ImmutableList;

import java.util.Objects;
import javax.annotation.Nullable;

/** Algebraic type.
 *
 * <p>Constructors are held in declaration order. */
public class DataType {
  public final QName name;
  public final ImmutableList<ConEntry> constructors;

  /** Creates a DataType.
   *
   * <p>Called only from {@link TypeSystem}. */
  DataType(QName name, ImmutableList<ConEntry> constructors) {
    this.name = Objects.requireNonNull(name);
    this.constructors = Objects.requireNonNull(constructors);
    for (ConEntry constructor : constructors) {
      Preconditions.checkArgument(constructor.typeName.equals(name),
          "constructor %s does not belong to %s", constructor, name);
    }
  }

  /** Looks up a constructor by name, returning null if not found.
   *
   * <p>The qualifier of {@code conName}, if any, is ignored. */
  public @Nullable ConEntry lookupOpt(QName conName) {
    final QName name = conName.unqualified();
    for (ConEntry constructor : constructors) {
      if (constructor.name.unqualified().equals(name)) {
        return constructor;
      }
    }
    return null;
  }

  @Override public String toString() {
    return name.toString();
  }
}

// End DataType.java
