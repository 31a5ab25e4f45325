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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.Objects;
import org.apache.calcite.sql.SqlIdentifier;
import org.apache.calcite.sql.parser.SqlParserPos;

/**
 * Reference to a column of one occurrence of a predicate in a rule body.
 *
 * <p>The occurrence is the 0-based position of the atom in the body, so that
 * two uses of the same predicate (a self-join) have distinct references. It
 * is rendered as {@code <name>_a<arity>_<occurrence>.<column>}, for example
 * {@code price_a2_1.amount}, only when the downstream generator asks for it.
 */
public final class ColumnRef {
  public final Signature signature;
  public final int occurrence;
  public final String column;

  private ColumnRef(Signature signature, int occurrence, String column) {
    this.signature = requireNonNull(signature);
    checkArgument(occurrence >= 0, "negative occurrence %s", occurrence);
    this.occurrence = occurrence;
    this.column = requireNonNull(column);
  }

  /** Creates a ColumnRef. */
  public static ColumnRef of(
      Signature signature, int occurrence, String column) {
    return new ColumnRef(signature, occurrence, column);
  }

  /** Returns the alias of the atom occurrence, e.g. {@code price_a2_1}. */
  public String alias() {
    return signature.alias() + "_" + occurrence;
  }

  /** Converts this reference to a compound SQL identifier. */
  public SqlIdentifier toIdentifier() {
    return new SqlIdentifier(
        ImmutableList.of(alias(), column), SqlParserPos.ZERO);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof ColumnRef
            && signature.equals(((ColumnRef) o).signature)
            && occurrence == ((ColumnRef) o).occurrence
            && column.equals(((ColumnRef) o).column);
  }

  @Override
  public int hashCode() {
    return Objects.hash(signature, occurrence, column);
  }

  @Override
  public String toString() {
    return alias() + "." + column;
  }
}

// End ColumnRef.java
