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

/**
 * Semantic analysis of Deltalog programs.
 *
 * <p>Builds the tables that a relational code generator needs in order to
 * translate rules, facts, queries and delta (insert/delete) rules into
 * queries.
 *
 * <h2>Key Classes</h2>
 *
 * <ul>
 *   <li>{@link net.hydromatic.deltalog.compile.ProgramAnalysis} - Main entry
 *       point. Builds the per-program tables and hands out per-rule ones.
 *   <li>{@link net.hydromatic.deltalog.compile.Signature} and {@link
 *       net.hydromatic.deltalog.compile.Orderings} - Predicate signatures and
 *       the orderings that decide when two signatures, variables or atoms are
 *       the same.
 *   <li>{@link net.hydromatic.deltalog.compile.SymbolTable} - Rules grouped by
 *       head signature; one table for intensional predicates, one for
 *       extensional.
 *   <li>{@link net.hydromatic.deltalog.compile.ColumnNameTable} - Column names
 *       of each predicate.
 *   <li>{@link net.hydromatic.deltalog.compile.VariableTable} - For one rule,
 *       the columns where each variable occurs; the input to join generation.
 *   <li>{@link net.hydromatic.deltalog.compile.EqualityTable} - For one rule,
 *       the constants bound to variables by equalities.
 *   <li>{@link net.hydromatic.deltalog.compile.Programs} - Query extraction,
 *       delta predicate extraction and program rewrites.
 *   <li>{@link net.hydromatic.deltalog.compile.SemanticException} - Thrown
 *       when a program is syntactically valid but meaningless.
 * </ul>
 *
 * <h2>Example</h2>
 *
 * <p>For the program
 *
 * <pre>{@code
 * source price(name, amount).
 * cheap(N) :- price(N, A), A < 10.
 * ?- cheap(N).
 * }</pre>
 *
 * <p>the extensional table has {@code price/2}, the intensional table has
 * {@code cheap/1}, and the column name table maps {@code price/2} to {@code
 * [name, amount]} and {@code cheap/1} to {@code [col0]}. The variable table of
 * the rule maps {@code N} to {@code [price_a2_0.name]} and {@code A} to {@code
 * [price_a2_0.amount]}.
 */
package net.hydromatic.deltalog.compile;

// End package-info.java
