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
package net.hydromatic.flatcase.util;

import java.util.AbstractMap;
import java.util.function.ObjIntConsumer;

/** Pair of an element and an ordinal.
 *
 * @param <E> Element type */
public class Ord<E> extends AbstractMap.SimpleImmutableEntry<Integer, E> {
  public final int i;
  public final E e;

  /** Creates an Ord. */
  public Ord(int i, E e) {
    super(i, e);
    this.i = i;
    this.e = e;
  }

  /** Calls a consumer with each element of an iterable and its ordinal. */
  public static <E> void forEach(Iterable<E> iterable,
      ObjIntConsumer<E> consumer) {
    int i = 0;
    for (E e : iterable) {
      consumer.accept(e, i++);
    }
  }
}

// End Ord.java
