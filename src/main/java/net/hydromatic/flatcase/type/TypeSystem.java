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

import net.hydromatic.flatcase.ast.Ast;
import net.hydromatic.flatcase.ast.QName;

import com.google.common.collect.ImmutableList;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;

/** A table that contains all data types in use, indexed by name, and their
 * constructors, indexed by constructor name.
 *
 * <p>A new type system contains the built-in types: lists ({@code []} and
 * {@code :}), unit ({@code ()}) and {@code Bool} ({@code False} and
 * {@code True}). Tuple types of any arity are created on demand. */
public class TypeSystem {
  /** Name of the boolean type. */
  public static final QName BOOL = QName.of("Bool");

  final Map<QName, DataType> typeByName = new LinkedHashMap<>();

  private final Map<QName, ConEntry> conByName = new HashMap<>();

  public TypeSystem() {
    dataType(QName.NIL,
        ImmutableList.of(new ConEntry(QName.NIL, 0, false, QName.NIL),
            new ConEntry(QName.CONS, 2, true, QName.NIL)));
    dataType(QName.UNIT,
        ImmutableList.of(new ConEntry(QName.UNIT, 0, false, QName.UNIT)));
    dataType(BOOL,
        ImmutableList.of(new ConEntry(QName.of("False"), 0, false, BOOL),
            new ConEntry(QName.of("True"), 0, false, BOOL)));
  }

  /** Registers a data type and its constructors. Replaces any previous type
   * of the same name. */
  public DataType dataType(QName name, List<ConEntry> constructors) {
    final DataType dataType =
        new DataType(name, ImmutableList.copyOf(constructors));
    final DataType previous = typeByName.put(name, dataType);
    if (previous != null) {
      previous.constructors.forEach(c -> conByName.remove(c.name));
    }
    constructors.forEach(c -> conByName.put(c.name, c));
    return dataType;
  }

  /** Registers the data type defined by a declaration. */
  public DataType dataType(Ast.DataDecl decl) {
    final QName name = QName.of(decl.name);
    final ImmutableList.Builder<ConEntry> constructors =
        ImmutableList.builder();
    for (Ast.ConDecl con : decl.cons) {
      constructors.add(
          new ConEntry(QName.of(con.name), con.arity(), con.infix, name));
    }
    return dataType(name, constructors.build());
  }

  /** Returns the type of tuples of a given arity, creating it if
   * necessary. Its only constructor has the same name as the type. */
  public DataType tupleType(int arity) {
    final QName name = QName.tuple(arity);
    final DataType dataType = typeByName.get(name);
    if (dataType != null) {
      return dataType;
    }
    return dataType(name,
        ImmutableList.of(new ConEntry(name, arity, false, name)));
  }

  /** Looks up a type by name. */
  public DataType lookup(QName name) {
    final DataType type = lookupOpt(name);
    if (type == null) {
      throw new AssertionError("unknown type: " + name);
    }
    return type;
  }

  /** Looks up a type by name, returning null if not found.
   *
   * <p>A qualified name that is not found is looked up again without its
   * qualifier. */
  public @Nullable DataType lookupOpt(QName name) {
    final DataType type = typeByName.get(name);
    if (type != null) {
      return type;
    }
    if (name.isTuple()) {
      return tupleType(name.tupleArity());
    }
    if (name.isQualified()) {
      return typeByName.get(name.unqualified());
    }
    return null;
  }

  /** Looks up a data constructor by name, returning null if not found. */
  public @Nullable ConEntry lookupConOpt(QName conName) {
    final ConEntry con = conByName.get(conName);
    if (con != null) {
      return con;
    }
    if (conName.isTuple()) {
      return tupleType(conName.tupleArity()).constructors.get(0);
    }
    if (conName.isQualified()) {
      return conByName.get(conName.unqualified());
    }
    return null;
  }

  /** Returns the names of all registered types, in registration order. */
  public List<QName> typeNames() {
    return ImmutableList.copyOf(typeByName.keySet());
  }
}

// End TypeSystem.java
