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

import static net.hydromatic.deltalog.ast.DeltalogBuilder.dl;
import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.deltalog.ast.DeltalogAst.Atom;
import net.hydromatic.deltalog.ast.DeltalogAst.Program;
import org.apache.calcite.sql.SqlIdentifier;
import org.apache.calcite.util.Pair;
import org.junit.jupiter.api.Test;

/** Tests for {@link VariableTable} and {@link ColumnRef}. */
public class VariableTableTest {
  /** Source edge(src, dst) and node(id). */
  private static ColumnNameTable graphColumns() {
    final Program program =
        dl.program(
            dl.base(dl.pred("edge", "src", "dst")),
            dl.base(dl.pred("node", "id")),
            dl.rule(
                dl.pred("path", "X", "Z"),
                dl.rel(dl.pred("edge", "X", "Y")),
                dl.rel(dl.pred("edge", "Y", "Z"))));
    return ColumnNameTable.build(
        SymbolTable.extensional(program), SymbolTable.intensional(program));
  }

  @Test
  void testColumnRef() {
    final ColumnRef ref = ColumnRef.of(Signature.of("price", 2), 1, "amount");
    assertThat(ref, hasToString("price_a2_1.amount"));
    assertThat(ref.alias(), is("price_a2_1"));
    assertThat(ref, is(ColumnRef.of(Signature.of("price", 2), 1, "amount")));
    assertThat(
        ref.equals(ColumnRef.of(Signature.of("price", 2), 0, "amount")),
        is(false));
    final SqlIdentifier id = ref.toIdentifier();
    assertThat(id.names, is(ImmutableList.of("price_a2_1", "amount")));
  }

  @Test
  void testSingleAtom() {
    final VariableTable table =
        VariableTable.build(
            graphColumns(), ImmutableList.of(dl.pred("edge", "X", "Y")));
    assertThat(table.names(), hasToString("[X, Y]"));
    assertThat(table.get("X"), hasToString("[edge_a2_0.src]"));
    assertThat(table.get("Y"), hasToString("[edge_a2_0.dst]"));
    assertThat(table.get("Z"), empty());
    assertThat(table.joinConditions(), empty());
  }

  /**
   * A predicate used twice gets a distinct occurrence index each time, and a
   * shared variable has one reference per occurrence.
   */
  @Test
  void testSelfJoin() {
    final List<Atom> atoms =
        ImmutableList.of(
            dl.pred("edge", "X", "Y"), dl.pred("edge", "Y", "Z"));
    final VariableTable table = VariableTable.build(graphColumns(), atoms);
    assertThat(table.size(), is(3));
    assertThat(table.get("X"), hasToString("[edge_a2_0.src]"));
    assertThat(table.get("Y"), hasToString("[edge_a2_1.src, edge_a2_0.dst]"));
    assertThat(table.get("Z"), hasToString("[edge_a2_1.dst]"));

    final List<Pair<ColumnRef, ColumnRef>> joins = table.joinConditions();
    assertThat(joins, hasSize(1));
    assertThat(joins.get(0).left, hasToString("edge_a2_0.dst"));
    assertThat(joins.get(0).right, hasToString("edge_a2_1.src"));
  }

  /** Every atom takes the next index, even for a different predicate. */
  @Test
  void testOccurrenceIndex() {
    final List<Atom> atoms =
        ImmutableList.of(
            dl.pred("node", "X"),
            dl.pred("edge", "X", "Y"),
            dl.pred("node", "Y"),
            dl.pred("edge", "Y", "X"));
    final VariableTable table = VariableTable.build(graphColumns(), atoms);
    assertThat(
        table.get("X"),
        hasToString("[edge_a2_3.dst, edge_a2_1.src, node_a1_0.id]"));
    assertThat(
        table.get("Y"),
        hasToString("[edge_a2_3.src, node_a1_2.id, edge_a2_1.dst]"));

    // X occurs 3 times and Y 3 times, giving 2 + 2 join conditions; each
    // pairs the first occurrence with a later one.
    final List<Pair<ColumnRef, ColumnRef>> joins = table.joinConditions();
    assertThat(joins, hasSize(4));
    assertThat(joins.get(0).left, hasToString("node_a1_0.id"));
    assertThat(joins.get(0).right, hasToString("edge_a2_1.src"));
    assertThat(joins.get(1).left, hasToString("node_a1_0.id"));
    assertThat(joins.get(1).right, hasToString("edge_a2_3.dst"));
    assertThat(joins.get(2).left, hasToString("edge_a2_1.dst"));
  }

  /** Constants and the anonymous variable do not take part in joins. */
  @Test
  void testConstantsIgnored() {
    final List<Atom> atoms =
        ImmutableList.of(
            dl.pred("edge", 1, "Y"),
            dl.pred("edge", "Y", dl.anon()),
            dl.pred("node", dl.var(3)));
    final VariableTable table = VariableTable.build(graphColumns(), atoms);
    assertThat(table.names(), hasToString("[Y, _3]"));
    assertThat(table.get("_3"), hasToString("[node_a1_2.id]"));
    assertThat(table.contains("_"), is(false));
  }

  @Test
  void testAggregateInBody() {
    final List<Atom> atoms =
        ImmutableList.of(
            dl.pred("node", "X"), dl.pred("edge", "X", dl.agg("SUM", "Y")));
    final SemanticException e =
        assertThrows(
            SemanticException.class,
            () -> VariableTable.build(graphColumns(), atoms));
    assertThat(e.getMessage(), containsString("edge/2"));
    assertThat(e.getMessage(), containsString("only allowed in rule heads"));
    assertThat(e.signature(), is(Signature.of("edge", 2)));
  }

  @Test
  void testUnknownPredicate() {
    assertThrows(
        IllegalArgumentException.class,
        () ->
            VariableTable.build(
                graphColumns(), ImmutableList.of(dl.pred("edge", "X"))));
  }

  @Test
  void testEmptyBody() {
    final VariableTable table =
        VariableTable.build(graphColumns(), ImmutableList.of());
    assertThat(table.size(), is(0));
    assertThat(table.joinConditions(), empty());
  }
}

// End VariableTableTest.java
