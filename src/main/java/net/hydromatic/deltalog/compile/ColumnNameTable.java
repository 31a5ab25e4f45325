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
import com.google.common.collect.Maps;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.deltalog.ast.DeltalogAst.Rule;
import net.hydromatic.deltalog.ast.DeltalogAst.Term;

/**
 * For each predicate of a program, the names of its columns in argument
 * order.
 *
 * <p>An extensional predicate takes its column names from the variables of
 * its first base fact; for example {@code source price(name, amount)} gives
 * columns {@code [name, amount]}. An intensional predicate that is not also
 * extensional gets positional names {@code col0, col1, ...}.
 */
public class ColumnNameTable {
  private final Map<Signature, List<String>> map;

  private ColumnNameTable(Map<Signature, List<String>> map) {
    this.map = map;
  }

  /** Builds a column name table with the default capacity. */
  public static ColumnNameTable build(
      SymbolTable extensional, SymbolTable intensional) {
    return build(
        extensional,
        intensional,
        Prop.INITIAL_TABLE_SIZE.intValue(Collections.emptyMap()));
  }

  /**
   * Builds a column name table from the extensional and intensional symbol
   * tables of a program. Names derived from base facts take precedence over
   * synthesized names.
   */
  public static ColumnNameTable build(
      SymbolTable extensional, SymbolTable intensional, int initialCapacity) {
    final Map<Signature, List<String>> map =
        Maps.newLinkedHashMapWithExpectedSize(initialCapacity);
    for (Map.Entry<Signature, List<Rule>> entry : extensional.entrySet()) {
      final Rule rule = entry.getValue().get(0);
      final ImmutableList.Builder<String> names = ImmutableList.builder();
      for (Term arg : rule.head.args) {
        names.add(arg.toString());
      }
      map.put(entry.getKey(), names.build());
    }
    for (Signature key : intensional.keySet()) {
      map.computeIfAbsent(key, k -> positionalNames(k.arity));
    }
    return new ColumnNameTable(map);
  }

  /** Returns {@code [col0, col1, ..., col(n - 1)]}. */
  static List<String> positionalNames(int n) {
    final ImmutableList.Builder<String> names = ImmutableList.builder();
    for (int i = 0; i < n; i++) {
      names.add("col" + i);
    }
    return names.build();
  }

  public boolean contains(Signature key) {
    return map.containsKey(key);
  }

  /**
   * Returns the column names of a predicate.
   *
   * @throws IllegalArgumentException if the predicate is not in this table
   */
  public List<String> get(Signature key) {
    final List<String> names = map.get(key);
    checkArgument(names != null, "no column names for predicate %s", key);
    return names;
  }

  /** Returns the signatures in this table; extensional ones first. */
  public Set<Signature> keySet() {
    return Collections.unmodifiableSet(map.keySet());
  }

  public int size() {
    return map.size();
  }

  @Override
  public String toString() {
    return map.toString();
  }
}

// End ColumnNameTable.java
