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

/** Exception raised by the lexer when it meets an unrecognized token. */
public class LexicalException extends RuntimeException
    implements DeltalogException {
  private final String lexeme;
  private final Pos pos;

  public LexicalException(String lexeme, Pos pos) {
    super(pos.format(lexeme));
    this.lexeme = requireNonNull(lexeme);
    this.pos = pos;
  }

  /** Returns the text of the offending token. */
  public String lexeme() {
    return lexeme;
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

// End LexicalException.java
