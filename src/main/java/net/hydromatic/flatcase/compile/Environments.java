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
import net.hydromatic.flatcase.ast.QName;
import net.hydromatic.flatcase.type.ConEntry;
import net.hydromatic.flatcase.type.DataType;
import net.hydromatic.flatcase.type.TypeSystem;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;
import javax.annotation.Nullable;

/** Implementations of {@link Environment}. */
public abstract class Environments {
  private Environments() {}

  /** Creates an environment that contains only the built-in types. */
  public static Environment empty() {
    return env(new TypeSystem());
  }

  /** Creates an environment backed by a type system. */
  public static Environment env(TypeSystem typeSystem) {
    return new TypeSystemEnvironment(typeSystem);
  }

  /** Creates an environment that contains the types declared by some
   * declarations, and otherwise delegates to a parent environment.
   *
   * <p>A type declared in {@code dataDecls} hides a parent type of the same
   * name. */
  public static Environment withDataDecls(Environment parent,
      List<Ast.DataDecl> dataDecls) {
    if (dataDecls.isEmpty()) {
      return parent;
    }
    final TypeSystem typeSystem = new TypeSystem();
    dataDecls.forEach(typeSystem::dataType);
    return new LayeredEnvironment(env(typeSystem), parent);
  }

  /** Environment that reads from a {@link TypeSystem}. */
  private static class TypeSystemEnvironment implements Environment {
    private final TypeSystem typeSystem;

    TypeSystemEnvironment(TypeSystem typeSystem) {
      this.typeSystem = Objects.requireNonNull(typeSystem);
    }

    @Override public @Nullable ImmutableList<ConEntry> getConstructorsOpt(
        QName typeName) {
      final DataType dataType = typeSystem.lookupOpt(typeName);
      return dataType == null ? null : dataType.constructors;
    }

    @Override public @Nullable QName getTypeOpt(QName conName) {
      final ConEntry con = typeSystem.lookupConOpt(conName);
      return con == null ? null : con.typeName;
    }
  }

  /** Environment that looks in one environment, then in another. */
  private static class LayeredEnvironment implements Environment {
    private final Environment env;
    private final Environment parent;

    LayeredEnvironment(Environment env, Environment parent) {
      this.env = Objects.requireNonNull(env);
      this.parent = Objects.requireNonNull(parent);
    }

    @Override public @Nullable ImmutableList<ConEntry> getConstructorsOpt(
        QName typeName) {
      final ImmutableList<ConEntry> constructors =
          env.getConstructorsOpt(typeName);
      return constructors != null
          ? constructors
          : parent.getConstructorsOpt(typeName);
    }

    @Override public @Nullable QName getTypeOpt(QName conName) {
      final QName typeName = env.getTypeOpt(conName);
      return typeName != null ? typeName : parent.getTypeOpt(conName);
    }
  }
}

// End Environments.java
