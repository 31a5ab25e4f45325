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
package net.hydromatic.deltalog.ast;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Abstract syntax tree nodes for Deltalog programs.
 *
 * <p>A program is a sequence of statements; each statement is a rule, a query
 * or a base fact. Nodes are immutable.
 */
public class DeltalogAst {
  private DeltalogAst() {
    // Utility class
  }

  /** A complete program. */
  public static class Program {
    public final List<Statement> statements;

    public Program(List<? extends Statement> statements) {
      this.statements = ImmutableList.copyOf(statements);
    }

    @Override
    public String toString() {
      return statements.stream()
          .map(Statement::toString)
          .collect(Collectors.joining("\n"));
    }
  }

  /** Kinds of {@link Statement}. */
  public enum StatementKind {
    RULE,
    QUERY,
    BASE
  }

  /** Base class for all statements in a program. */
  public abstract static class Statement {
    public final StatementKind kind;

    Statement(StatementKind kind) {
      this.kind = requireNonNull(kind);
    }

    /** Returns the atom that this statement defines or asks for. */
    public abstract Atom head();
  }

  /** A rule: {@code head :- body.} */
  public static class Rule extends Statement {
    public final Atom head;
    public final List<Literal> body;

    public Rule(Atom head, List<? extends Literal> body) {
      super(StatementKind.RULE);
      this.head = requireNonNull(head);
      this.body = ImmutableList.copyOf(body);
    }

    @Override
    public Atom head() {
      return head;
    }

    @Override
    public String toString() {
      if (body.isEmpty()) {
        return head + ".";
      }
      return head
          + " :- "
          + body.stream()
              .map(Literal::toString)
              .collect(Collectors.joining(", "))
          + ".";
    }
  }

  /** A query: {@code ?- atom.} Names the output of the program. */
  public static class Query extends Statement {
    public final Atom atom;

    public Query(Atom atom) {
      super(StatementKind.QUERY);
      this.atom = requireNonNull(atom);
    }

    @Override
    public Atom head() {
      return atom;
    }

    @Override
    public String toString() {
      return "?- " + atom + ".";
    }
  }

  /** A base fact: {@code source atom.} Declares an extensional predicate. */
  public static class Base extends Statement {
    public final Atom atom;

    public Base(Atom atom) {
      super(StatementKind.BASE);
      this.atom = requireNonNull(atom);
    }

    @Override
    public Atom head() {
      return atom;
    }

    @Override
    public String toString() {
      return "source " + atom + ".";
    }
  }

  /** Kinds of {@link Atom}. */
  public enum AtomKind {
    /** A steady-state relation, {@code p(X)}. */
    PRED(""),
    /** An insertion into a relation, {@code +p(X)}. */
    DELTA_INSERT("+"),
    /** A deletion from a relation, {@code -p(X)}. */
    DELTA_DELETE("-");

    public final String prefix;

    AtomKind(String prefix) {
      this.prefix = prefix;
    }

    /** Returns whether this kind denotes an update to a relation. */
    public boolean isDelta() {
      return this != PRED;
    }
  }

  /** An atom: {@code name(term, ...)}, optionally marked as a delta. */
  public static class Atom {
    public final AtomKind kind;
    public final String name;
    public final List<Term> args;

    public Atom(AtomKind kind, String name, List<? extends Term> args) {
      this.kind = requireNonNull(kind);
      this.name = requireNonNull(name);
      this.args = ImmutableList.copyOf(args);
    }

    public int arity() {
      return args.size();
    }

    /** Returns an atom of the same kind and name with different arguments. */
    public Atom withArgs(List<? extends Term> args) {
      return new Atom(kind, name, args);
    }

    /** Returns an atom with the same name and arguments but a given kind. */
    public Atom withKind(AtomKind kind) {
      return kind == this.kind ? this : new Atom(kind, name, args);
    }

    /** Returns an atom of the same kind and arguments with another name. */
    public Atom withName(String name) {
      return new Atom(kind, name, args);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Atom
              && kind == ((Atom) o).kind
              && name.equals(((Atom) o).name)
              && args.equals(((Atom) o).args);
    }

    @Override
    public int hashCode() {
      return Objects.hash(kind, name, args);
    }

    @Override
    public String toString() {
      return kind.prefix
          + name
          + args.stream()
              .map(Term::toString)
              .collect(Collectors.joining(", ", "(", ")"));
    }
  }

  /** Kinds of {@link Literal}. */
  public enum LiteralKind {
    REL,
    NOT,
    EQUAL,
    INEQ
  }

  /** Base class for literals in a rule body. */
  public abstract static class Literal {
    public final LiteralKind kind;

    Literal(LiteralKind kind) {
      this.kind = requireNonNull(kind);
    }
  }

  /** A positive use of a predicate. */
  public static class Rel extends Literal {
    public final Atom atom;

    public Rel(Atom atom) {
      super(LiteralKind.REL);
      this.atom = requireNonNull(atom);
    }

    @Override
    public String toString() {
      return atom.toString();
    }
  }

  /** A negated use of a predicate. */
  public static class Not extends Literal {
    public final Atom atom;

    public Not(Atom atom) {
      super(LiteralKind.NOT);
      this.atom = requireNonNull(atom);
    }

    @Override
    public String toString() {
      return "not " + atom;
    }
  }

  /**
   * An equality, {@code left = right}.
   *
   * <p>Usually binds a variable to a constant; if {@code left} is an
   * {@link AggVar} it defines an aggregate, which is only valid for a variable
   * of the rule head.
   */
  public static class Equality extends Literal {
    public final Term left;
    public final Term right;

    public Equality(Term left, Term right) {
      super(LiteralKind.EQUAL);
      this.left = requireNonNull(left);
      this.right = requireNonNull(right);
    }

    @Override
    public String toString() {
      return left + " = " + right;
    }
  }

  /** Comparison operators for inequalities. */
  public enum CompOp {
    NE("<>"),
    LT("<"),
    LE("<="),
    GT(">"),
    GE(">=");

    public final String symbol;

    CompOp(String symbol) {
      this.symbol = symbol;
    }

    @Override
    public String toString() {
      return symbol;
    }
  }

  /** An inequality, {@code left op right}. */
  public static class Inequality extends Literal {
    public final CompOp op;
    public final Term left;
    public final Term right;

    public Inequality(CompOp op, Term left, Term right) {
      super(LiteralKind.INEQ);
      this.op = requireNonNull(op);
      this.left = requireNonNull(left);
      this.right = requireNonNull(right);
    }

    @Override
    public String toString() {
      return left + " " + op + " " + right;
    }
  }

  /** Kinds of {@link Term}. */
  public enum TermKind {
    NAMED,
    NUMBERED,
    CONST,
    ANON,
    AGGREGATE
  }

  /** Base class for arguments of atoms and operands of comparisons. */
  public abstract static class Term {
    public final TermKind kind;

    Term(TermKind kind) {
      this.kind = requireNonNull(kind);
    }

    /**
     * Returns whether this term is a named or numbered variable, the only
     * kinds that take part in joins and equalities.
     */
    public boolean isVariable() {
      return kind == TermKind.NAMED || kind == TermKind.NUMBERED;
    }

    /**
     * {@inheritDoc}
     *
     * <p>Two variables are equal if they print the same, so {@code _0} written
     * as a name equals the numbered variable {@code _0}. Other terms must also
     * be of the same kind.
     */
    @Override
    public boolean equals(Object o) {
      if (o == this) {
        return true;
      }
      if (!(o instanceof Term)) {
        return false;
      }
      final Term term = (Term) o;
      return (kind == term.kind || isVariable() && term.isVariable())
          && toString().equals(term.toString());
    }

    @Override
    public int hashCode() {
      return isVariable()
          ? toString().hashCode()
          : Objects.hash(kind, toString());
    }
  }

  /** A variable named by the user, {@code X}. */
  public static class NamedVar extends Term {
    public final String name;

    public NamedVar(String name) {
      super(TermKind.NAMED);
      this.name = requireNonNull(name);
    }

    @Override
    public String toString() {
      return name;
    }
  }

  /** A positional variable, printed {@code _0}, {@code _1}, etc. */
  public static class NumberedVar extends Term {
    public final int ordinal;

    public NumberedVar(int ordinal) {
      super(TermKind.NUMBERED);
      this.ordinal = ordinal;
    }

    @Override
    public String toString() {
      return "_" + ordinal;
    }
  }

  /** The anonymous variable, {@code _}. */
  public static class AnonVar extends Term {
    public static final AnonVar INSTANCE = new AnonVar();

    private AnonVar() {
      super(TermKind.ANON);
    }

    @Override
    public String toString() {
      return "_";
    }
  }

  /** A constant used in an argument or operand position. */
  public static class ConstVar extends Term {
    public final Constant constant;

    public ConstVar(Constant constant) {
      super(TermKind.CONST);
      this.constant = requireNonNull(constant);
    }

    @Override
    public String toString() {
      return constant.toString();
    }
  }

  /** An aggregate function applied to a variable, {@code SUM(X)}. */
  public static class AggVar extends Term {
    public final String function;
    public final String varName;

    public AggVar(String function, String varName) {
      super(TermKind.AGGREGATE);
      this.function = requireNonNull(function);
      this.varName = requireNonNull(varName);
    }

    @Override
    public String toString() {
      return function + "(" + varName + ")";
    }
  }

  /** Types of {@link Constant}. */
  public enum ConstantType {
    INT,
    REAL,
    STRING,
    BOOL,
    NULL
  }

  /** A constant value. */
  public static class Constant {
    public static final Constant NULL = new Constant("null", ConstantType.NULL);

    public final Object value;
    public final ConstantType type;

    public Constant(Object value, ConstantType type) {
      this.value = requireNonNull(value);
      this.type = requireNonNull(type);
    }

    @Override
    public String toString() {
      if (type == ConstantType.STRING) {
        return "'" + value + "'";
      }
      return value.toString();
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) {
        return true;
      }
      if (!(o instanceof Constant)) {
        return false;
      }
      Constant constant = (Constant) o;
      return value.equals(constant.value) && type == constant.type;
    }

    @Override
    public int hashCode() {
      return Objects.hash(value, type);
    }
  }
}

// End DeltalogAst.java
