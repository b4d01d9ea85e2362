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

import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiConsumer;

/** Pair of objects.
 *
 * @param <T1> Left-hand type
 * @param <T2> Right-hand type */
public class Pair<T1, T2> implements Map.Entry<T1, T2> {
  public final T1 left;
  public final T2 right;

  /** Creates a Pair. */
  public Pair(T1 left, T2 right) {
    this.left = left;
    this.right = right;
  }

  /** Creates a Pair. */
  public static <T1, T2> Pair<T1, T2> of(T1 left, T2 right) {
    return new Pair<>(left, right);
  }

  /** Calls a consumer with each pair of corresponding elements of two
   * iterables. Stops when either iterable is exhausted. */
  public static <K, V> void forEach(Iterable<K> ks, Iterable<V> vs,
      BiConsumer<K, V> consumer) {
    final Iterator<K> i = ks.iterator();
    final Iterator<V> j = vs.iterator();
    while (i.hasNext() && j.hasNext()) {
      consumer.accept(i.next(), j.next());
    }
  }

  @Override public String toString() {
    return "<" + left + ", " + right + ">";
  }

  @Override public boolean equals(Object obj) {
    return this == obj
        || obj instanceof Pair
        && Objects.equals(left, ((Pair) obj).left)
        && Objects.equals(right, ((Pair) obj).right);
  }

  @Override public int hashCode() {
    return Objects.hashCode(left) ^ Objects.hashCode(right);
  }

  public T1 getKey() {
    return left;
  }

  public T2 getValue() {
    return right;
  }

  public T2 setValue(T2 value) {
    throw new UnsupportedOperationException();
  }
}

// End Pair.java
