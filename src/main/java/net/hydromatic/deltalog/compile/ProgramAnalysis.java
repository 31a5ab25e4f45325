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

import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.deltalog.ast.DeltalogAst.Atom;
import net.hydromatic.deltalog.ast.DeltalogAst.Program;
import net.hydromatic.deltalog.ast.DeltalogAst.Query;
import net.hydromatic.deltalog.ast.DeltalogAst.Rule;
import net.hydromatic.deltalog.util.DeltalogTrace;
import org.slf4j.Logger;

/**
 * Tables that describe a whole program, for use by a code generator.
 *
 * <p>Building a ProgramAnalysis creates the extensional and intensional
 * symbol tables and the column name table. The query, the delta predicates
 * and the tables of each rule are computed on request, and each request
 * validates its part of the program.
 *
 * <p>Typical use:
 *
 * <pre>{@code
 * ProgramAnalysis analysis = ProgramAnalysis.of(program, props);
 * Query query = analysis.query();
 * for (Atom delta : analysis.deltaPredicates()) {
 *   ...
 * }
 * for (Rule rule : analysis.intensional().get(signature)) {
 *   RuleAnalysis ruleAnalysis = analysis.analyze(rule);
 *   ...
 * }
 * }</pre>
 */
public class ProgramAnalysis {
  private static final Logger LOGGER = DeltalogTrace.getAnalyzerTracer();

  public final Program program;
  private final Map<Prop, Object> props;
  private final SymbolTable extensional;
  private final SymbolTable intensional;
  private final ColumnNameTable columns;

  private ProgramAnalysis(
      Program program,
      Map<Prop, Object> props,
      SymbolTable extensional,
      SymbolTable intensional,
      ColumnNameTable columns) {
    this.program = requireNonNull(program);
    this.props = ImmutableMap.copyOf(props);
    this.extensional = requireNonNull(extensional);
    this.intensional = requireNonNull(intensional);
    this.columns = requireNonNull(columns);
  }

  /** Analyzes a program with default properties. */
  public static ProgramAnalysis of(Program program) {
    return of(program, ImmutableMap.of());
  }

  /** Analyzes a program. */
  public static ProgramAnalysis of(Program program, Map<Prop, Object> props) {
    final int capacity = Prop.INITIAL_TABLE_SIZE.intValue(props);
    final SymbolTable extensional = SymbolTable.extensional(program, capacity);
    final SymbolTable intensional = SymbolTable.intensional(program, capacity);
    final ColumnNameTable columns =
        ColumnNameTable.build(extensional, intensional, capacity);
    if (LOGGER.isDebugEnabled()) {
      LOGGER.debug(
          "{} statements: {} extensional, {} intensional predicates",
          program.statements.size(),
          extensional.size(),
          intensional.size());
      LOGGER.debug("columns: {}", columns);
    }
    return new ProgramAnalysis(
        program, props, extensional, intensional, columns);
  }

  /** Returns the table of base facts. */
  public SymbolTable extensional() {
    return extensional;
  }

  /** Returns the table of rules that derive plain predicates. */
  public SymbolTable intensional() {
    return intensional;
  }

  public ColumnNameTable columns() {
    return columns;
  }

  /**
   * Returns the query of the program.
   *
   * @throws SemanticException if there is not exactly one query
   */
  public Query query() {
    return Programs.getQuery(program);
  }

  /**
   * Returns the update predicates of the program.
   *
   * @throws SemanticException if the program has no update rule
   */
  public List<Atom> deltaPredicates() {
    final List<Atom> deltas = Programs.extractDeltaPredicates(program);
    LOGGER.debug("delta predicates: {}", deltas);
    return deltas;
  }

  /** Builds the variable and equality tables of a rule. */
  public RuleAnalysis analyze(Rule rule) {
    return RuleAnalysis.of(
        columns, rule, Prop.INITIAL_TABLE_SIZE.intValue(props));
  }
}

// End ProgramAnalysis.java
