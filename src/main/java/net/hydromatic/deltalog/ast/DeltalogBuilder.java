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

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.deltalog.ast.DeltalogAst.AggVar;
import net.hydromatic.deltalog.ast.DeltalogAst.AnonVar;
import net.hydromatic.deltalog.ast.DeltalogAst.Atom;
import net.hydromatic.deltalog.ast.DeltalogAst.AtomKind;
import net.hydromatic.deltalog.ast.DeltalogAst.Base;
import net.hydromatic.deltalog.ast.DeltalogAst.CompOp;
import net.hydromatic.deltalog.ast.DeltalogAst.ConstVar;
import net.hydromatic.deltalog.ast.DeltalogAst.Constant;
import net.hydromatic.deltalog.ast.DeltalogAst.ConstantType;
import net.hydromatic.deltalog.ast.DeltalogAst.Equality;
import net.hydromatic.deltalog.ast.DeltalogAst.Inequality;
import net.hydromatic.deltalog.ast.DeltalogAst.Literal;
import net.hydromatic.deltalog.ast.DeltalogAst.NamedVar;
import net.hydromatic.deltalog.ast.DeltalogAst.Not;
import net.hydromatic.deltalog.ast.DeltalogAst.NumberedVar;
import net.hydromatic.deltalog.ast.DeltalogAst.Program;
import net.hydromatic.deltalog.ast.DeltalogAst.Query;
import net.hydromatic.deltalog.ast.DeltalogAst.Rel;
import net.hydromatic.deltalog.ast.DeltalogAst.Rule;
import net.hydromatic.deltalog.ast.DeltalogAst.Statement;
import net.hydromatic.deltalog.ast.DeltalogAst.Term;

/** Builds Deltalog parse tree nodes. */
public enum DeltalogBuilder {
  /**
   * The singleton instance of the builder. The short name is convenient for
   * use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  dl;

  public Program program(Statement... statements) {
    return new Program(ImmutableList.copyOf(statements));
  }

  public Program program(List<? extends Statement> statements) {
    return new Program(statements);
  }

  public Rule rule(Atom head, Literal... body) {
    return new Rule(head, ImmutableList.copyOf(body));
  }

  public Query query(Atom atom) {
    return new Query(atom);
  }

  public Base base(Atom atom) {
    return new Base(atom);
  }

  /** Creates a plain atom. Strings become named variables. */
  public Atom pred(String name, Object... args) {
    return atom(AtomKind.PRED, name, args);
  }

  /** Creates a delta-insert atom. Strings become named variables. */
  public Atom insert(String name, Object... args) {
    return atom(AtomKind.DELTA_INSERT, name, args);
  }

  /** Creates a delta-delete atom. Strings become named variables. */
  public Atom delete(String name, Object... args) {
    return atom(AtomKind.DELTA_DELETE, name, args);
  }

  public Atom atom(AtomKind kind, String name, Object... args) {
    return new Atom(kind, name, terms(args));
  }

  public Rel rel(Atom atom) {
    return new Rel(atom);
  }

  public Not not(Atom atom) {
    return new Not(atom);
  }

  public Equality eq(Object left, Object right) {
    return new Equality(term(left), term(right));
  }

  public Inequality ineq(CompOp op, Object left, Object right) {
    return new Inequality(op, term(left), term(right));
  }

  public NamedVar var(String name) {
    return new NamedVar(name);
  }

  public NumberedVar var(int ordinal) {
    return new NumberedVar(ordinal);
  }

  public AnonVar anon() {
    return AnonVar.INSTANCE;
  }

  public AggVar agg(String function, String varName) {
    return new AggVar(function, varName);
  }

  public ConstVar intLiteral(int value) {
    return new ConstVar(new Constant(value, ConstantType.INT));
  }

  public ConstVar stringLiteral(String value) {
    return new ConstVar(new Constant(value, ConstantType.STRING));
  }

  /**
   * Converts an object to a term. A term is returned unchanged, a string
   * becomes a named variable, an integer an integer constant, a double a real
   * constant, a boolean a boolean constant, and a constant is wrapped.
   */
  public Term term(Object o) {
    if (o instanceof Term) {
      return (Term) o;
    }
    if (o instanceof String) {
      return var((String) o);
    }
    if (o instanceof Integer || o instanceof Long) {
      return new ConstVar(new Constant(o, ConstantType.INT));
    }
    if (o instanceof Double) {
      return new ConstVar(new Constant(o, ConstantType.REAL));
    }
    if (o instanceof Boolean) {
      return new ConstVar(new Constant(o, ConstantType.BOOL));
    }
    if (o instanceof Constant) {
      return new ConstVar((Constant) o);
    }
    throw new IllegalArgumentException("cannot convert to term: " + o);
  }

  private List<Term> terms(Object[] args) {
    final ImmutableList.Builder<Term> b = ImmutableList.builder();
    for (Object arg : args) {
      b.add(term(arg));
    }
    return b.build();
  }
}

// End DeltalogBuilder.java
