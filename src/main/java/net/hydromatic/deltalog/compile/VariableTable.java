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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Ordering;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.deltalog.ast.DeltalogAst.Atom;
import net.hydromatic.deltalog.ast.DeltalogAst.Term;
import org.apache.calcite.util.Pair;

/**
 * For one rule, the columns where each variable occurs in the rule's body.
 *
 * <p>Each variable maps to the {@link ColumnRef}s of every argument position
 * it occupies, most recent first. Two references for the same variable imply
 * an equi-join between them.
 *
 * <p>A table belongs to one rule and is not shared.
 */
public class VariableTable {
  private final Map<String, List<ColumnRef>> map;

  private VariableTable(Map<String, List<ColumnRef>> map) {
    this.map = map;
  }

  /** Builds a variable table with the default capacity. */
  public static VariableTable build(ColumnNameTable columns, List<Atom> atoms) {
    return build(
        columns,
        atoms,
        Prop.INITIAL_TABLE_SIZE.intValue(Collections.emptyMap()));
  }

  /**
   * Builds a variable table from the relational atoms of a rule body, in the
   * order they are written.
   *
   * <p>Every atom takes the next occurrence index, starting at 0, even if it
   * references the same predicate as an earlier atom. Constants and the
   * anonymous variable do not take part in joins and are ignored.
   *
   * @throws SemanticException if an argument is an aggregate
   * @throws IllegalArgumentException if an atom's predicate has no column
   *     names, or a different number of column names than arguments
   */
  public static VariableTable build(
      ColumnNameTable columns, List<Atom> atoms, int initialCapacity) {
    final Map<String, List<ColumnRef>> map =
        Maps.newLinkedHashMapWithExpectedSize(initialCapacity);
    int occurrence = 0;
    for (Atom atom : atoms) {
      final Signature key = Signature.of(atom);
      final List<String> names = columns.get(key);
      checkArgument(
          names.size() == atom.arity(),
          "predicate %s has %s column names",
          key,
          names.size());
      for (int i = 0; i < atom.arity(); i++) {
        final Term arg = atom.args.get(i);
        switch (arg.kind) {
          case NAMED:
          case NUMBERED:
            final ColumnRef ref = ColumnRef.of(key, occurrence, names.get(i));
            final String name = arg.toString();
            final List<ColumnRef> refs = map.get(name);
            map.put(
                name,
                refs == null
                    ? ImmutableList.of(ref)
                    : ImmutableList.<ColumnRef>builder()
                        .add(ref)
                        .addAll(refs)
                        .build());
            break;
          case AGGREGATE:
            throw new SemanticException(
                "Goal "
                    + key
                    + " contains an aggregate function as a variable, "
                    + "which is only allowed in rule heads",
                key);
          case CONST:
          case ANON:
            break;
          default:
            throw new AssertionError(arg.kind);
        }
      }
      ++occurrence;
    }
    return new VariableTable(map);
  }

  /** Returns whether a variable occurs in the body. */
  public boolean contains(String name) {
    return map.containsKey(name);
  }

  /**
   * Returns the columns where a variable occurs, most recent first; empty if
   * the variable does not occur.
   */
  public List<ColumnRef> get(String name) {
    final List<ColumnRef> refs = map.get(name);
    return refs == null ? ImmutableList.of() : refs;
  }

  /** Returns the names of the variables, in order of first occurrence. */
  public Set<String> names() {
    return Collections.unmodifiableSet(map.keySet());
  }

  public int size() {
    return map.size();
  }

  /**
   * Returns the equi-join conditions implied by this table.
   *
   * <p>For each variable (in name order) that occurs {@code n > 1} times, the
   * first occurrence is paired with each later occurrence, giving {@code n -
   * 1} conditions.
   */
  public List<Pair<ColumnRef, ColumnRef>> joinConditions() {
    final ImmutableList.Builder<Pair<ColumnRef, ColumnRef>> b =
        ImmutableList.builder();
    for (String name : Ordering.<String>natural().sortedCopy(map.keySet())) {
      final List<ColumnRef> refs = Lists.reverse(map.get(name));
      for (int i = 1; i < refs.size(); i++) {
        b.add(Pair.of(refs.get(0), refs.get(i)));
      }
    }
    return b.build();
  }

  @Override
  public String toString() {
    return map.toString();
  }
}

// End VariableTable.java
