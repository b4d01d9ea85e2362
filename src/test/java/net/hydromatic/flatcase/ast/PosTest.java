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

import net.hydromatic.flatcase.compile.Message;

import org.junit.Test;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.junit.Assert.assertThat;

/** Tests for {@link Pos}. */
public class PosTest {
  @Test public void testToString() {
    assertThat(Pos.of("f.hs", 3, 5, 9).toString(), is("f.hs:3.5-9"));
    assertThat(new Pos("f.hs", 3, 5, 4, 2).toString(), is("f.hs:3.5-4.2"));
    assertThat(new Pos("", 1, 1, 1, 1).toString(), is("1.1"));
  }

  @Test public void testPlus() {
    final Pos p = Pos.of("f.hs", 3, 5, 9);
    final Pos q = Pos.of("f.hs", 4, 1, 6);
    assertThat(p.plus(q).toString(), is("f.hs:3.5-4.6"));
    assertThat(q.plus(p), is(p.plus(q)));
    assertThat(p.plus(Pos.ZERO), sameInstance(p));
    assertThat(Pos.ZERO.plus(p), sameInstance(p));
  }

  @Test public void testMessage() {
    assertThat(Message.error(Pos.of("f.hs", 2, 1, 7), "oops").toString(),
        is("f.hs:2.1-7: error: oops"));
    assertThat(Message.internal(Pos.ZERO, "oops").toString(),
        is("internal error: oops"));
  }
}

// End PosTest.java
