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
package net.hydromatic.deltalog.compile;

import net.hydromatic.deltalog.ast.Pos;
import net.hydromatic.deltalog.util.DeltalogException;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A program is well-formed but meaningless; for example it has no query, or
 * uses an aggregate as a join argument.
 */
public class SemanticException extends RuntimeException
    implements DeltalogException {
  private final @Nullable Signature signature;
  private final Pos pos;

  public SemanticException(String message) {
    this(message, null, Pos.ZERO);
  }

  public SemanticException(String message, @Nullable Signature signature) {
    this(message, signature, Pos.ZERO);
  }

  public SemanticException(
      String message, @Nullable Signature signature, Pos pos) {
    super(message);
    this.signature = signature;
    this.pos = pos;
  }

  /** Returns the signature of the offending predicate, or null. */
  public @Nullable Signature signature() {
    return signature;
  }

  @Override
  public Pos pos() {
    return pos;
  }

  @Override
  public StringBuilder describeTo(StringBuilder buf) {
    if (pos.equals(Pos.ZERO)) {
      return buf.append(getMessage());
    }
    return buf.append(pos.format(getMessage()));
  }
}

// End SemanticException.java
