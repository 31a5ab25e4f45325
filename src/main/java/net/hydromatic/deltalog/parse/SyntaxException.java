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
package net.hydromatic.deltalog.parse;

import static java.util.Objects.requireNonNull;

import net.hydromatic.deltalog.ast.Pos;
import net.hydromatic.deltalog.util.DeltalogException;

/**
 * Exception raised by the parser when the input violates the grammar.
 *
 * <p>The position spans the tokens matched by the non-terminal being reduced
 * when the error was detected.
 */
public class SyntaxException extends RuntimeException
    implements DeltalogException {
  private final String reason;
  private final Pos pos;

  public SyntaxException(String reason, Pos pos) {
    super(pos.format(reason));
    this.reason = requireNonNull(reason);
    this.pos = pos;
  }

  /** Returns the message without position information. */
  public String reason() {
    return reason;
  }

  @Override
  public Pos pos() {
    return pos;
  }

  @Override
  public StringBuilder describeTo(StringBuilder buf) {
    return buf.append(getMessage());
  }
}

// End SyntaxException.java
