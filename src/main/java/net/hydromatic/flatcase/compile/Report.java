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

/** Channel to which the compiler sends diagnostics. */
public interface Report {
  /** Reports a message. Compilation continues. */
  void report(Message message);

  /** Reports a message, and returns an exception that the caller must
   * throw to abort compilation.
   *
   * <p>Typical use:
   *
   * <blockquote><pre>
   * throw report.reportFatal(Message.error(pos, "..."));
   * </pre></blockquote> */
  default CompileException reportFatal(Message message) {
    report(message);
    return new CompileException(message);
  }
}

// End Report.java
