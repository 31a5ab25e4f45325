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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Ordering;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.NavigableSet;
import java.util.TreeSet;
import net.hydromatic.deltalog.ast.DeltalogAst.Atom;
import net.hydromatic.deltalog.ast.DeltalogAst.Term;

/**
 * Total orders over signatures, variables and atoms, and the deduplicating
 * sets built on them.
 *
 * <p>All tables that need a deterministic order, or need to decide whether
 * two signatures are "the same", use these comparators. Two values are the
 * same if the comparator returns zero.
 */
public class Orderings {
  private Orderings() {}

  /** Orders signatures by name, then by arity. */
  public static final Ordering<Signature> SIGNATURE =
      Ordering.from(
          Comparator.<Signature, String>comparing(s -> s.name)
              .thenComparingInt(s -> s.arity));

  /** Orders variables by their printed form. */
  public static final Ordering<Term> VARIABLE =
      Ordering.from(Comparator.comparing(Term::toString));

  /**
   * Orders atoms by the signature of the predicate they reference. Atoms of
   * different kinds, or with different arguments, compare equal if their
   * signatures do.
   */
  public static final Ordering<Atom> ATOM =
      SIGNATURE.onResultOf((Atom atom) -> Signature.of(atom));

  /** Creates an empty set of signatures. */
  public static NavigableSet<Signature> signatureSet() {
    return new TreeSet<>(SIGNATURE);
  }

  /** Creates an empty set of variables. */
  public static NavigableSet<Term> variableSet() {
    return new TreeSet<>(VARIABLE);
  }

  /** Creates an empty set of atoms, one per signature. */
  public static NavigableSet<Atom> atomSet() {
    return new TreeSet<>(ATOM);
  }

  /** Sorts a collection of signatures and removes repetitions. */
  public static List<Signature> removeRepeatedKeys(
      Collection<Signature> keys) {
    final NavigableSet<Signature> set = signatureSet();
    set.addAll(keys);
    return ImmutableList.copyOf(set);
  }
}

// End Orderings.java
