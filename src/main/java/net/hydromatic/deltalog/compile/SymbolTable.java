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
import net.hydromatic.deltalog.ast.DeltalogAst.Base;
import net.hydromatic.deltalog.ast.DeltalogAst.Program;
import net.hydromatic.deltalog.ast.DeltalogAst.Rule;
import net.hydromatic.deltalog.ast.DeltalogAst.Statement;
import net.hydromatic.deltalog.ast.DeltalogAst.StatementKind;

/**
 * Groups the rules of a program by the signature of their head.
 *
 * <p>Signatures are kept in the order they are first inserted, and the rules
 * of each signature in the order they are inserted. Inserting a second rule
 * with the same signature appends to that signature's list.
 *
 * <p>The intensional table holds rules that derive a relation; the
 * extensional table holds base facts, each converted to a rule with an empty
 * body, so that both tables can be read the same way.
 */
public class SymbolTable {
  private final Map<Signature, List<Rule>> map;

  /** Creates an empty SymbolTable with the default capacity. */
  public SymbolTable() {
    this(Prop.INITIAL_TABLE_SIZE.intValue(Collections.emptyMap()));
  }

  /** Creates an empty SymbolTable. */
  public SymbolTable(int initialCapacity) {
    this.map = Maps.newLinkedHashMapWithExpectedSize(initialCapacity);
  }

  /**
   * Creates a table of the intensional (derived) predicates of a program: one
   * entry per rule whose head is a plain predicate. Rules whose head is a
   * delta, queries and base facts are skipped.
   */
  public static SymbolTable intensional(Program program, int initialCapacity) {
    final SymbolTable table = new SymbolTable(initialCapacity);
    for (Statement statement : program.statements) {
      switch (statement.kind) {
        case RULE:
          if (!statement.head().kind.isDelta()) {
            table.insert(statement);
          }
          break;
        case QUERY:
        case BASE:
          break;
        default:
          throw new AssertionError(statement.kind);
      }
    }
    return table;
  }

  /** As {@link #intensional(Program, int)} with the default capacity. */
  public static SymbolTable intensional(Program program) {
    return intensional(
        program, Prop.INITIAL_TABLE_SIZE.intValue(Collections.emptyMap()));
  }

  /**
   * Creates a table of the extensional (base) predicates of a program. Each
   * base fact becomes a rule with the same head and an empty body.
   */
  public static SymbolTable extensional(Program program, int initialCapacity) {
    final SymbolTable table = new SymbolTable(initialCapacity);
    for (Statement statement : program.statements) {
      switch (statement.kind) {
        case BASE:
          table.insert(new Rule(((Base) statement).atom, ImmutableList.of()));
          break;
        case RULE:
        case QUERY:
          break;
        default:
          throw new AssertionError(statement.kind);
      }
    }
    return table;
  }

  /** As {@link #extensional(Program, int)} with the default capacity. */
  public static SymbolTable extensional(Program program) {
    return extensional(
        program, Prop.INITIAL_TABLE_SIZE.intValue(Collections.emptyMap()));
  }

  /**
   * Adds a rule to this table, after any rules already present for its
   * signature.
   *
   * @throws IllegalArgumentException if the statement is not a rule
   */
  public void insert(Statement statement) {
    checkArgument(
        statement.kind == StatementKind.RULE,
        "symbol table insert called without a rule: %s",
        statement);
    final Rule rule = (Rule) statement;
    final Signature key = Signature.of(rule.head);
    final List<Rule> rules = map.get(key);
    if (rules == null) {
      map.put(key, ImmutableList.of(rule));
    } else {
      map.put(
          key, ImmutableList.<Rule>builder().addAll(rules).add(rule).build());
    }
  }

  /** Returns whether this table has an entry for a signature. */
  public boolean contains(Signature key) {
    return map.containsKey(key);
  }

  /**
   * Returns the rules for a signature, in insertion order; empty if there are
   * none.
   */
  public List<Rule> get(Signature key) {
    final List<Rule> rules = map.get(key);
    return rules == null ? ImmutableList.of() : rules;
  }

  /** Returns the signatures in this table, in order of first insertion. */
  public Set<Signature> keySet() {
    return Collections.unmodifiableSet(map.keySet());
  }

  /** Returns the entries of this table, in order of first insertion. */
  public Set<Map.Entry<Signature, List<Rule>>> entrySet() {
    return Collections.unmodifiableMap(map).entrySet();
  }

  /** Returns the number of signatures in this table. */
  public int size() {
    return map.size();
  }

  public boolean isEmpty() {
    return map.isEmpty();
  }

  /** Returns the printed rules of every signature, one rule per line. */
  @Override
  public String toString() {
    final StringBuilder buf = new StringBuilder();
    for (List<Rule> rules : map.values()) {
      for (Rule rule : rules) {
        buf.append(rule).append('\n');
      }
    }
    return buf.toString();
  }
}

// End SymbolTable.java
