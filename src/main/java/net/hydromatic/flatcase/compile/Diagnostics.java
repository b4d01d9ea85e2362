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

import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.List;

/** Implementation of {@link Report} that keeps messages in the order they
 * were reported. */
public class Diagnostics implements Report {
  private final List<Message> messages = new ArrayList<>();

  @Override public void report(Message message) {
    messages.add(message);
  }

  /** Returns the messages reported so far. */
  public ImmutableList<Message> messages() {
    return ImmutableList.copyOf(messages);
  }

  /** Returns whether any message of severity {@link Severity#ERROR} or
   * {@link Severity#INTERNAL} has been reported. */
  public boolean hasErrors() {
    return messages.stream().anyMatch(m ->
        m.severity == Severity.ERROR || m.severity == Severity.INTERNAL);
  }

  @Override public String toString() {
    return messages.toString();
  }
}

// End Diagnostics.java
