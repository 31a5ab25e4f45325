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
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import net.hydromatic.deltalog.ast.DeltalogAst.Atom;
import net.hydromatic.deltalog.ast.DeltalogAst.AtomKind;
import net.hydromatic.deltalog.ast.DeltalogAst.CompOp;
import net.hydromatic.deltalog.ast.DeltalogAst.Program;
import net.hydromatic.deltalog.ast.DeltalogAst.Query;
import net.hydromatic.deltalog.ast.DeltalogAst.Statement;
import org.junit.jupiter.api.Test;

/** Tests for {@link Programs}. */
public class ProgramsTest {
  /** A view-update program with inserts and deletes on two relations. */
  private static List<Statement> updateStatements() {
    return ImmutableList.of(
        dl.base(dl.pred("r1", "a", "b")),
        dl.base(dl.pred("r2", "a")),
        dl.rule(
            dl.pred("v", "X", "Y"),
            dl.rel(dl.pred("r1", "X", "Y")),
            dl.rel(dl.pred("r2", "X"))),
        dl.rule(
            dl.delete("r1", "X", "Y"),
            dl.rel(dl.pred("r1", "X", "Y")),
            dl.not(dl.pred("v", "X", "Y"))),
        dl.rule(
            dl.insert("r2", "A"),
            dl.rel(dl.pred("v", "A", "B")),
            dl.not(dl.pred("r2", "A"))),
        dl.rule(
            dl.insert("r1", "P", "Q"),
            dl.rel(dl.pred("v", "P", "Q")),
            dl.not(dl.pred("r1", "P", "Q"))),
        dl.rule(
            dl.delete("r2", "X"),
            dl.rel(dl.pred("r2", "X")),
            dl.ineq(CompOp.GT, "X", 100)),
        dl.query(dl.pred("v", "X", "Y")));
  }

  @Test
  void testGetQuery() {
    final Query query = Programs.getQuery(SymbolTableTest.cheapProgram());
    assertThat(query, hasToString("?- cheap(N)."));
  }

  @Test
  void testGetQueryNone() {
    final Program program =
        dl.program(dl.rule(dl.pred("p", "X"), dl.rel(dl.pred("q", "X"))));
    final SemanticException e =
        assertThrows(SemanticException.class, () -> Programs.getQuery(program));
    assertThat(e.getMessage(), is("The program has no query"));
  }

  @Test
  void testGetQueryAmbiguous() {
    final Program program =
        dl.program(dl.query(dl.pred("p", "X")), dl.query(dl.pred("q", "X")));
    final SemanticException e =
        assertThrows(SemanticException.class, () -> Programs.getQuery(program));
    assertThat(e.getMessage(), is("The program has more than one query"));
  }

  @Test
  void testNoUpdate() {
    final SemanticException e =
        assertThrows(
            SemanticException.class,
            () ->
                Programs.extractDeltaPredicates(
                    SymbolTableTest.cheapProgram()));
    assertThat(e.getMessage(), is("The program has no update"));
  }

  /** ins_price(N, A) :+ price(N, A), A > 5. */
  @Test
  void testSingleDelta() {
    final Program program =
        dl.program(
            dl.base(dl.pred("price", "name", "amount")),
            dl.rule(
                dl.insert("ins_price", "N", "A"),
                dl.rel(dl.pred("price", "N", "A")),
                dl.ineq(CompOp.GT, "A", 5)));
    final List<Atom> deltas = Programs.extractDeltaPredicates(program);
    assertThat(deltas, hasSize(1));
    final Atom delta = deltas.get(0);
    assertThat(delta.kind, is(AtomKind.DELTA_INSERT));
    assertThat(delta.name, is("ins_price"));
    assertThat(delta.args, hasToString("[COL0, COL1]"));
  }

  /**
   * Rules that update the same predicate with different variable names give
   * one entry.
   */
  @Test
  void testCanonicalization() {
    final Program program =
        dl.program(
            dl.rule(dl.insert("p", "X", "Y"), dl.rel(dl.pred("q", "X", "Y"))),
            dl.rule(dl.insert("p", "A", 1), dl.rel(dl.pred("r", "A"))),
            dl.rule(dl.insert("p", "Z"), dl.rel(dl.pred("r", "Z"))));
    final List<Atom> deltas = Programs.extractDeltaPredicates(program);
    assertThat(deltas, hasToString("[+p(COL0), +p(COL0, COL1)]"));
  }

  @Test
  void testDeltasSorted() {
    final List<Atom> deltas =
        Programs.extractDeltaPredicates(dl.program(updateStatements()));
    assertThat(deltas, hasToString("[+r1(COL0, COL1), +r2(COL0)]"));
  }

  /** Permuting the statements of a program does not change its deltas. */
  @Test
  void testDeltasOrderIndependent() {
    final List<Statement> statements = updateStatements();
    final List<Atom> expected =
        Programs.extractDeltaPredicates(dl.program(statements));
    assertThat(
        Programs.extractDeltaPredicates(
            dl.program(Lists.reverse(statements))),
        is(expected));
    final Random random = new Random(42);
    for (int i = 0; i < 20; i++) {
      final List<Statement> shuffled = new ArrayList<>(statements);
      Collections.shuffle(shuffled, random);
      final List<Atom> deltas =
          Programs.extractDeltaPredicates(dl.program(shuffled));
      assertThat(
          ImmutableSet.copyOf(deltas), is(ImmutableSet.copyOf(expected)));
    }
  }

  @Test
  void testDeleteOnly() {
    final Program program =
        dl.program(
            dl.rule(dl.delete("t", "X"), dl.rel(dl.pred("s", "X"))),
            dl.rule(dl.delete("t", "Y"), dl.rel(dl.pred("u", "Y"))));
    assertThat(
        Programs.extractDeltaPredicates(program), hasToString("[-t(COL0)]"));
  }

  @Test
  void testCanonicalize() {
    assertThat(
        Programs.canonicalize(dl.delete("p", "X", 3, dl.anon())),
        hasToString("-p(COL0, COL1, COL2)"));
    assertThat(Programs.canonicalize(dl.pred("p")), hasToString("p()"));
  }

  @Test
  void testDeltaToPredicate() {
    final Program program =
        dl.program(
            dl.base(dl.pred("r", "a")),
            dl.rule(
                dl.insert("r", "X"),
                dl.rel(dl.delete("s", "X")),
                dl.not(dl.insert("r", "X")),
                dl.eq("X", 1)),
            dl.query(dl.pred("r", "X")));
    final Program converted = Programs.deltaToPredicate(program);
    assertThat(
        converted,
        hasToString(
            "source r(a).\n"
                + "r(X) :- s(X), not r(X), X = 1.\n"
                + "?- r(X)."));
    assertThat(converted.statements.get(0), is(program.statements.get(0)));
  }

  @Test
  void testTempAtom() {
    assertThat(
        Programs.tempAtom(dl.insert("p", "X")), hasToString("+__temp__p(X)"));
    assertThat(
        Programs.tempAtom(dl.pred("p", "X", "Y"), "t_"),
        hasToString("t_p(X, Y)"));
  }

  @Test
  void testVariables() {
    assertThat(
        Programs.variables(
            ImmutableList.of(
                dl.rel(dl.pred("p", "X", 1, dl.anon())),
                dl.not(dl.pred("q", "Y", "X")),
                dl.eq("Z", 3),
                dl.ineq(CompOp.LT, "X", "W"),
                dl.eq("S", dl.agg("SUM", "V")),
                dl.rel(dl.pred("r", dl.var(0))))),
        hasToString("[S, SUM(V), W, X, Y, Z, _0]"));
  }
}

// End ProgramsTest.java
