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
package net.hydromatic.deltalog.ast;

import static java.util.Objects.requireNonNull;

import java.util.Objects;
import org.apache.calcite.util.mapping.IntPair;

/**
 * Position of a token or non-terminal in a source file.
 *
 * <p>Lines are 1-based. Columns are 0-based character offsets from the start
 * of their line, which is how the lexer reports them.
 */
public class Pos {
  public static final Pos ZERO = new Pos("", 0, 0, 0, 0);

  public final String file;
  public final int startLine;
  public final int startColumn;
  public final int endLine;
  public final int endColumn;

  /** Creates a Pos. */
  public Pos(
      String file, int startLine, int startColumn, int endLine, int endColumn) {
    this.file = requireNonNull(file);
    this.startLine = startLine;
    this.startColumn = startColumn;
    this.endLine = endLine;
    this.endColumn = endColumn;
  }

  /** Creates a Pos from two offsets into a source text. */
  public static Pos of(
      String text, String file, int startOffset, int endOffset) {
    IntPair start = lineCol(text, startOffset);
    IntPair end = lineCol(text, endOffset);
    return new Pos(file, start.source, start.target, end.source, end.target);
  }

  @Override
  public int hashCode() {
    return Objects.hash(file, startLine, startColumn, endLine, endColumn);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Pos
            && this.file.equals(((Pos) o).file)
            && this.startLine == ((Pos) o).startLine
            && this.startColumn == ((Pos) o).startColumn
            && this.endLine == ((Pos) o).endLine
            && this.endColumn == ((Pos) o).endColumn;
  }

  @Override
  public String toString() {
    return describeTo(new StringBuilder()).toString();
  }

  /**
   * Appends a description of this position, for example {@code File "a.dl",
   * line 3, characters 4-9}.
   */
  public StringBuilder describeTo(StringBuilder buf) {
    return buf.append("File \"")
        .append(file)
        .append("\", line ")
        .append(startLine)
        .append(", characters ")
        .append(startColumn)
        .append('-')
        .append(endColumn);
  }

  /**
   * Formats an error message at this position, for example {@code File
   * "a.dl", line 3, characters 4-9: 'unexpected token'}.
   */
  public String format(String message) {
    return describeTo(new StringBuilder())
        .append(": '")
        .append(message)
        .append('\'')
        .toString();
  }

  /** Returns a position spanning this and another position. */
  public Pos plus(Pos pos) {
    int startLine = this.startLine;
    int startColumn = this.startColumn;
    if (pos.startLine < startLine
        || pos.startLine == startLine && pos.startColumn < startColumn) {
      startLine = pos.startLine;
      startColumn = pos.startColumn;
    }
    int endLine = pos.endLine;
    int endColumn = pos.endColumn;
    if (this.endLine > endLine
        || this.endLine == endLine && this.endColumn > endColumn) {
      endLine = this.endLine;
      endColumn = this.endColumn;
    }
    return new Pos(file, startLine, startColumn, endLine, endColumn);
  }

  /** Returns the 1-based line and 0-based column of an offset. */
  private static IntPair lineCol(String s, int offset) {
    if (offset < 0 || offset > s.length()) {
      throw new IllegalArgumentException("offset out of range: " + offset);
    }
    int line = 1;
    int lineStart = 0;
    for (int i = 0; i < offset; i++) {
      if (s.charAt(i) == '\n') {
        ++line;
        lineStart = i + 1;
      }
    }
    return IntPair.of(line, offset - lineStart);
  }
}

// End Pos.java
