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
package net.hydromatic.flatcase;

import net.hydromatic.flatcase.ast.Ast;
import net.hydromatic.flatcase.ast.AstNode;
import net.hydromatic.flatcase.compile.Compiles;
import net.hydromatic.flatcase.compile.Diagnostics;
import net.hydromatic.flatcase.compile.Environment;
import net.hydromatic.flatcase.compile.Environments;
import net.hydromatic.flatcase.compile.NameGenerator;
import net.hydromatic.flatcase.compile.Prop;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.hamcrest.Matcher;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static net.hydromatic.flatcase.Matchers.isAst;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.fail;

/** Fluent test helper.
 *
 * <p>Holds a module or an expression, the data types in scope, and
 * compiler properties; each {@code assertXxx} method compiles the node
 * afresh, with a new name generator. */
public class Mc {
  private final AstNode node;
  private final ImmutableList<Ast.DataDecl> dataDecls;
  private final ImmutableMap<Prop, Object> props;

  Mc(AstNode node, List<Ast.DataDecl> dataDecls, Map<Prop, Object> props) {
    this.node = node;
    this.dataDecls = ImmutableList.copyOf(dataDecls);
    this.props = ImmutableMap.copyOf(props);
  }

  /** Creates an {@code Mc} for a module. */
  public static Mc mc(Ast.Module module) {
    return new Mc(module, ImmutableList.of(), ImmutableMap.of());
  }

  /** Creates an {@code Mc} for an expression. */
  public static Mc mc(Ast.Exp exp) {
    return new Mc(exp, ImmutableList.of(), ImmutableMap.of());
  }

  /** Runs a task and checks that it throws an exception.
   *
   * @param runnable Task to run
   * @param matcher Checks whether exception is as expected
   */
  public static void assertError(Runnable runnable,
      Matcher<Throwable> matcher) {
    try {
      runnable.run();
      fail("expected error");
    } catch (Throwable e) {
      assertThat(e, matcher);
    }
  }

  /** Returns a copy with an additional data type in scope. */
  public Mc withDataDecl(Ast.DataDecl dataDecl) {
    return new Mc(node,
        ImmutableList.<Ast.DataDecl>builder().addAll(dataDecls)
            .add(dataDecl).build(),
        props);
  }

  /** Returns a copy with a property set. */
  public Mc with(Prop prop, Object value) {
    final Map<Prop, Object> map = new EnumMap<>(Prop.class);
    map.putAll(props);
    map.put(prop, value);
    return new Mc(node, dataDecls, map);
  }

  /** Checks the string form of the node before compilation. */
  public Mc assertUnparse(String expected) {
    assertThat(node.toString(), is(expected));
    return this;
  }

  private Environment env() {
    return Environments.withDataDecls(Environments.empty(), dataDecls);
  }

  private AstNode transform(Diagnostics diagnostics) {
    final NameGenerator nameGenerator = new NameGenerator();
    if (node instanceof Ast.Module) {
      return Compiles.transformModule((Ast.Module) node, env(), props,
          nameGenerator, diagnostics);
    } else {
      return Compiles.transformExp((Ast.Exp) node, env(), props,
          nameGenerator, diagnostics);
    }
  }

  /** Compiles the node and checks the result. */
  public Mc assertTransform(Matcher<AstNode> matcher) {
    final Diagnostics diagnostics = new Diagnostics();
    final AstNode node2 = transform(diagnostics);
    assertThat(node2, matcher);
    assertThat(diagnostics.hasErrors(), is(false));
    return this;
  }

  /** Compiles the node and checks the string form of the result. */
  public Mc assertTransform(String expected) {
    return assertTransform(isAst(AstNode.class, expected));
  }

  /** Compiles the node and checks that compilation fails, and that the
   * error has been reported. */
  public Mc assertTransformThrows(Matcher<Throwable> matcher) {
    final Diagnostics diagnostics = new Diagnostics();
    assertError(() -> transform(diagnostics), matcher);
    assertThat(diagnostics.hasErrors(), is(true));
    return this;
  }
}

// End Mc.java
