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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.deltalog.ast.DeltalogAst.Atom;
import net.hydromatic.deltalog.ast.DeltalogAst.Equality;
import net.hydromatic.deltalog.ast.DeltalogAst.Literal;
import net.hydromatic.deltalog.ast.DeltalogAst.Rel;
import net.hydromatic.deltalog.ast.DeltalogAst.Rule;
import net.hydromatic.deltalog.ast.DeltalogAst.TermKind;
import net.hydromatic.deltalog.util.DeltalogTrace;
import org.slf4j.Logger;

/**
 * Tables that describe one rule: where each variable occurs in the body, and
 * which variables the body binds to constants.
 *
 * <p>Each RuleAnalysis has its own tables. The equality table is consumed by
 * {@link EqualityTable#extract}, so a RuleAnalysis should be used for one
 * pass of code generation only.
 *
 * <p>An equality between a variable and a constant is a binding, whichever
 * side the constant is on; {@code 1 = X} is recorded as {@code X = 1}. Every
 * other equality (between two variables, between two constants, or defining
 * an aggregate) is not a binding, and is kept in {@link #conditions} for the
 * caller to translate.
 */
public class RuleAnalysis {
  private static final Logger LOGGER = DeltalogTrace.getRuleTracer();

  public final Rule rule;
  public final VariableTable variables;
  public final EqualityTable equalities;
  /** Equalities of the body that are not variable-constant bindings. */
  public final List<Equality> conditions;

  private RuleAnalysis(
      Rule rule,
      VariableTable variables,
      EqualityTable equalities,
      List<Equality> conditions) {
    this.rule = requireNonNull(rule);
    this.variables = requireNonNull(variables);
    this.equalities = requireNonNull(equalities);
    this.conditions = ImmutableList.copyOf(conditions);
  }

  /**
   * Analyzes a rule.
   *
   * <p>The variable table is built from the positive relational literals of
   * the body, in order. The equality table is built from the equalities
   * between a named or numbered variable and a constant, on either side; the
   * other equalities become {@link #conditions}.
   *
   * @throws SemanticException if a relational literal has an aggregate
   *     argument
   */
  public static RuleAnalysis of(
      ColumnNameTable columns, Rule rule, int initialCapacity) {
    final ImmutableList.Builder<Atom> atoms = ImmutableList.builder();
    final ImmutableList.Builder<Equality> equalities = ImmutableList.builder();
    final ImmutableList.Builder<Equality> conditions = ImmutableList.builder();
    for (Literal literal : rule.body) {
      switch (literal.kind) {
        case REL:
          atoms.add(((Rel) literal).atom);
          break;
        case EQUAL:
          final Equality equality = (Equality) literal;
          if (equality.left.isVariable()
              && equality.right.kind == TermKind.CONST) {
            equalities.add(equality);
          } else if (equality.left.kind == TermKind.CONST
              && equality.right.isVariable()) {
            equalities.add(new Equality(equality.right, equality.left));
          } else {
            conditions.add(equality);
          }
          break;
        case NOT:
        case INEQ:
          break;
        default:
          throw new AssertionError(literal.kind);
      }
    }
    final List<Atom> atomList = atoms.build();
    final VariableTable variableTable =
        VariableTable.build(columns, atomList, initialCapacity);
    final EqualityTable equalityTable =
        EqualityTable.build(equalities.build(), initialCapacity);
    final List<Equality> conditionList = conditions.build();
    if (LOGGER.isDebugEnabled()) {
      LOGGER.debug(
          "rule {}: variables {}, equalities {}, conditions {}",
          rule,
          variableTable,
          equalityTable,
          conditionList);
    }
    return new RuleAnalysis(rule, variableTable, equalityTable, conditionList);
  }
}

// End RuleAnalysis.java
