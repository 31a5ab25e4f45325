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

import java.util.Objects;
import net.hydromatic.deltalog.ast.DeltalogAst.Atom;
import net.hydromatic.deltalog.ast.DeltalogAst.Statement;
import net.hydromatic.deltalog.ast.DeltalogAst.StatementKind;

/**
 * Signature of a predicate: its name and arity.
 *
 * <p>Two signatures are equal if and only if {@link Orderings#SIGNATURE}
 * returns zero for them.
 */
public final class Signature implements Comparable<Signature> {
  public final String name;
  public final int arity;

  private Signature(String name, int arity) {
    this.name = requireNonNull(name);
    checkArgument(arity >= 0, "negative arity %s", arity);
    this.arity = arity;
  }

  /** Creates a Signature. */
  public static Signature of(String name, int arity) {
    return new Signature(name, arity);
  }

  /** Returns the signature of the predicate that an atom references. */
  public static Signature of(Atom atom) {
    return new Signature(atom.name, atom.arity());
  }

  /**
   * Returns the signature of the head of a rule.
   *
   * @throws IllegalArgumentException if the statement is not a rule
   */
  public static Signature ofRule(Statement statement) {
    checkArgument(
        statement.kind == StatementKind.RULE,
        "signature of rule called without a rule: %s",
        statement);
    return of(statement.head());
  }

  /**
   * Returns the alias of a relation with this signature, for example {@code
   * price_a2}. Distinguishes predicates with the same name but different
   * arities.
   */
  public String alias() {
    return name + "_a" + arity;
  }

  @Override
  public int compareTo(Signature o) {
    return Orderings.SIGNATURE.compare(this, o);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Signature && compareTo((Signature) o) == 0;
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, arity);
  }

  /** Returns the signature as "name/arity", for example {@code price/2}. */
  @Override
  public String toString() {
    return name + "/" + arity;
  }
}

// End Signature.java
