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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.NavigableSet;
import net.hydromatic.deltalog.ast.DeltalogAst.Atom;
import net.hydromatic.deltalog.ast.DeltalogAst.AtomKind;
import net.hydromatic.deltalog.ast.DeltalogAst.Equality;
import net.hydromatic.deltalog.ast.DeltalogAst.Inequality;
import net.hydromatic.deltalog.ast.DeltalogAst.Literal;
import net.hydromatic.deltalog.ast.DeltalogAst.NamedVar;
import net.hydromatic.deltalog.ast.DeltalogAst.Not;
import net.hydromatic.deltalog.ast.DeltalogAst.Program;
import net.hydromatic.deltalog.ast.DeltalogAst.Query;
import net.hydromatic.deltalog.ast.DeltalogAst.Rel;
import net.hydromatic.deltalog.ast.DeltalogAst.Rule;
import net.hydromatic.deltalog.ast.DeltalogAst.Statement;
import net.hydromatic.deltalog.ast.DeltalogAst.StatementKind;
import net.hydromatic.deltalog.ast.DeltalogAst.Term;
import net.hydromatic.deltalog.ast.DeltalogAst.TermKind;

/** Utilities for analyzing and rewriting whole programs. */
public class Programs {
  private Programs() {}

  /**
   * Returns the single query of a program.
   *
   * @throws SemanticException if the program has no query, or more than one
   */
  public static Query getQuery(Program program) {
    final List<Query> queries = new ArrayList<>();
    for (Statement statement : program.statements) {
      if (statement.kind == StatementKind.QUERY) {
        queries.add((Query) statement);
      }
    }
    switch (queries.size()) {
      case 0:
        throw new SemanticException("The program has no query");
      case 1:
        return queries.get(0);
      default:
        throw new SemanticException("The program has more than one query");
    }
  }

  /**
   * Returns the distinct update predicates of a program.
   *
   * <p>Collects the head of every rule whose head is a delta-insert or
   * delta-delete atom, {@link #canonicalize canonicalized} so that only its
   * kind, name and arity remain. There is one element per signature, sorted
   * by {@link Orderings#SIGNATURE}. If a predicate is both inserted into and
   * deleted from, the delta-insert atom represents it, whatever the order of
   * the rules.
   *
   * @throws SemanticException if the program has no update rule
   */
  public static List<Atom> extractDeltaPredicates(Program program) {
    final NavigableSet<Atom> deltas = Orderings.atomSet();
    for (Statement statement : program.statements) {
      if (statement.kind != StatementKind.RULE) {
        continue;
      }
      final Atom head = statement.head();
      if (!head.kind.isDelta()) {
        continue;
      }
      final Atom atom = canonicalize(head);
      if (!deltas.add(atom)) {
        final Atom existing = requireNonNull(deltas.floor(atom));
        if (atom.kind.compareTo(existing.kind) < 0) {
          deltas.remove(existing);
          deltas.add(atom);
        }
      }
    }
    if (deltas.isEmpty()) {
      throw new SemanticException("The program has no update");
    }
    return ImmutableList.copyOf(deltas);
  }

  /**
   * Replaces the arguments of an atom with the placeholder variables {@code
   * COL0}, {@code COL1}, etc., keeping its kind and name.
   */
  public static Atom canonicalize(Atom atom) {
    return atom.withArgs(placeholders(atom.arity()));
  }

  /** Returns the variables {@code [COL0, COL1, ..., COL(n - 1)]}. */
  static List<Term> placeholders(int n) {
    final ImmutableList.Builder<Term> b = ImmutableList.builder();
    for (int i = 0; i < n; i++) {
      b.add(new NamedVar("COL" + i));
    }
    return b.build();
  }

  /**
   * Rewrites every delta atom in the rules of a program, in heads and in
   * positive and negated body literals, to a plain atom with the same name and
   * arguments. Queries and base facts are unchanged.
   */
  public static Program deltaToPredicate(Program program) {
    final ImmutableList.Builder<Statement> statements = ImmutableList.builder();
    for (Statement statement : program.statements) {
      if (statement.kind != StatementKind.RULE) {
        statements.add(statement);
        continue;
      }
      final Rule rule = (Rule) statement;
      final ImmutableList.Builder<Literal> body = ImmutableList.builder();
      for (Literal literal : rule.body) {
        switch (literal.kind) {
          case REL:
            body.add(new Rel(((Rel) literal).atom.withKind(AtomKind.PRED)));
            break;
          case NOT:
            body.add(new Not(((Not) literal).atom.withKind(AtomKind.PRED)));
            break;
          case EQUAL:
          case INEQ:
            body.add(literal);
            break;
          default:
            throw new AssertionError(literal.kind);
        }
      }
      statements.add(new Rule(rule.head.withKind(AtomKind.PRED), body.build()));
    }
    return new Program(statements.build());
  }

  /**
   * Returns an atom whose predicate name has a prefix, for example {@code
   * __temp__p(X)} for {@code p(X)}. Kind and arguments are unchanged.
   */
  public static Atom tempAtom(Atom atom, String prefix) {
    return atom.withName(prefix + atom.name);
  }

  /** As {@link #tempAtom(Atom, String)} with the default prefix. */
  public static Atom tempAtom(Atom atom) {
    return tempAtom(
        atom, Prop.TEMP_PREFIX.stringValue(Collections.emptyMap()));
  }

  /**
   * Returns the variables that occur in a list of literals, without
   * duplicates, sorted by {@link Orderings#VARIABLE}.
   *
   * <p>Named, numbered and aggregate variables count; constants and the
   * anonymous variable do not.
   */
  public static NavigableSet<Term> variables(List<? extends Literal> literals) {
    final NavigableSet<Term> set = Orderings.variableSet();
    for (Literal literal : literals) {
      switch (literal.kind) {
        case REL:
          addVariables(set, ((Rel) literal).atom.args);
          break;
        case NOT:
          addVariables(set, ((Not) literal).atom.args);
          break;
        case EQUAL:
          final Equality equality = (Equality) literal;
          addVariables(set, ImmutableList.of(equality.left, equality.right));
          break;
        case INEQ:
          final Inequality inequality = (Inequality) literal;
          addVariables(
              set, ImmutableList.of(inequality.left, inequality.right));
          break;
        default:
          throw new AssertionError(literal.kind);
      }
    }
    return set;
  }

  private static void addVariables(
      NavigableSet<Term> set, List<? extends Term> terms) {
    for (Term term : terms) {
      if (term.isVariable() || term.kind == TermKind.AGGREGATE) {
        set.add(term);
      }
    }
  }
}

// End Programs.java
