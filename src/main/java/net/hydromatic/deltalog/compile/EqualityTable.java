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

import com.google.common.collect.Maps;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import net.hydromatic.deltalog.ast.DeltalogAst.ConstVar;
import net.hydromatic.deltalog.ast.DeltalogAst.Constant;
import net.hydromatic.deltalog.ast.DeltalogAst.Equality;
import net.hydromatic.deltalog.ast.DeltalogAst.TermKind;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * For one rule, the constants that its equalities bind to variables.
 *
 * <p>Each entry comes from a literal {@code X = c}. The downstream generator
 * calls {@link #extract} once per variable to substitute the constant, which
 * removes the entry so that each equality is applied exactly once.
 *
 * <p>If a rule binds the same variable more than once (say {@code X = 1, X =
 * 2}) all bindings are kept; the most recent shadows the earlier ones, and
 * each call to {@link #extract} removes and returns the most recent remaining
 * binding.
 */
public class EqualityTable {
  private final Map<String, Deque<Constant>> map;

  private EqualityTable(Map<String, Deque<Constant>> map) {
    this.map = map;
  }

  /** Builds an equality table with the default capacity. */
  public static EqualityTable build(List<Equality> equalities) {
    return build(
        equalities, Prop.INITIAL_TABLE_SIZE.intValue(Collections.emptyMap()));
  }

  /**
   * Builds an equality table.
   *
   * <p>PRECONDITION: every equality has the form {@code variable = constant},
   * where the variable is named or numbered. The caller removes aggregate
   * equalities first.
   *
   * @throws IllegalArgumentException if an equality does not have that form
   */
  public static EqualityTable build(
      List<Equality> equalities, int initialCapacity) {
    final Map<String, Deque<Constant>> map =
        Maps.newLinkedHashMapWithExpectedSize(initialCapacity);
    for (Equality equality : equalities) {
      if (equality.right.kind != TermKind.CONST) {
        throw new IllegalArgumentException(
            "equality is not of the form var = const: " + equality);
      }
      final Constant constant = ((ConstVar) equality.right).constant;
      switch (equality.left.kind) {
        case NAMED:
        case NUMBERED:
          map.computeIfAbsent(equality.left.toString(), k -> new ArrayDeque<>())
              .push(constant);
          break;
        default:
          throw new IllegalArgumentException(
              "Trying to build equality table with equalities not of the form"
                  + " var = const: "
                  + equality);
      }
    }
    return new EqualityTable(map);
  }

  /**
   * Removes the binding of a variable, and returns its constant.
   *
   * @throws NoSuchElementException if the variable has no binding
   */
  public Constant extract(String name) {
    final Deque<Constant> constants = map.get(name);
    if (constants == null) {
      throw new NoSuchElementException("no equality for variable " + name);
    }
    final Constant constant = constants.pop();
    if (constants.isEmpty()) {
      map.remove(name);
    }
    return constant;
  }

  /** Returns the constant bound to a variable, or null; does not remove. */
  public @Nullable Constant peek(String name) {
    final Deque<Constant> constants = map.get(name);
    return constants == null ? null : constants.peek();
  }

  /** Returns whether a variable has a binding. */
  public boolean contains(String name) {
    return map.containsKey(name);
  }

  /**
   * Returns the names of the variables that have a binding, in order of first
   * binding.
   */
  public Set<String> names() {
    return Collections.unmodifiableSet(map.keySet());
  }

  public boolean isEmpty() {
    return map.isEmpty();
  }

  @Override
  public String toString() {
    return map.toString();
  }
}

// End EqualityTable.java
