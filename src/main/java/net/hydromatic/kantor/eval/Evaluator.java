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
package net.hydromatic.kantor.eval;

import net.hydromatic.kantor.ast.Ast;
import net.hydromatic.kantor.ast.DeclVisitor;
import net.hydromatic.kantor.ast.Op;
import net.hydromatic.kantor.ast.Pos;
import net.hydromatic.kantor.ast.Visitor;
import net.hydromatic.kantor.type.Binding;
import net.hydromatic.kantor.type.TypeShape;
import net.hydromatic.kantor.util.KantorException.Kind;
import net.hydromatic.kantor.util.Outcome;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Evaluates declarations, one at a time, against an {@link Environment}.
 *
 * <p>Each type declaration adds a shape to the environment; each set
 * declaration evaluates its expression and binds the resulting value.
 * Errors are thrown as {@link EvalException}; a failed declaration leaves
 * the environment as it was.
 */
public class Evaluator implements Visitor<Value>, DeclVisitor<Binding> {
  private final Environment env;
  private final Tracer tracer;
  private final Pretty pretty;
  /** Current scope; the environment itself, or a comprehension scope on
   * top of it. */
  private EvalEnv evalEnv;

  /** Creates an Evaluator. */
  public Evaluator(Environment env, Tracer tracer) {
    this.env = requireNonNull(env);
    this.tracer = requireNonNull(tracer);
    this.pretty = new Pretty(env::getType, -1, -1);
    this.evalEnv = env;
  }

  /** Creates an Evaluator with an empty tracer. */
  public Evaluator(Environment env) {
    this(env, Tracers.empty());
  }

  /** Evaluates every declaration in a program, in order, and returns one
   * binding per declaration.
   *
   * <p>Stops at the first error; bindings made by earlier declarations
   * remain in the environment. */
  public List<Binding> evaluate(Ast.Program program) {
    final ImmutableList.Builder<Binding> bindings = ImmutableList.builder();
    for (Ast.Decl decl : program.decls) {
      bindings.add(evaluate(decl));
    }
    return bindings.build();
  }

  /** Evaluates a declaration. */
  public Binding evaluate(Ast.Decl decl) {
    evalEnv = env;
    final Binding binding = decl.accept(this);
    tracer.onBinding(binding);
    return binding;
  }

  /** Evaluates a declaration, returning a failed outcome rather than
   * throwing if there is an error. */
  public Outcome<Binding> tryEvaluate(Ast.Decl decl) {
    try {
      return Outcome.ok(evaluate(decl));
    } catch (EvalException e) {
      return Outcome.error(e);
    }
  }

  /** Evaluates an expression in the top-level scope. */
  public Value evaluate(Ast.Exp exp) {
    return evaluate(exp, env);
  }

  /** Evaluates an expression in a given scope. */
  public Value evaluate(Ast.Exp exp, EvalEnv evalEnv) {
    final EvalEnv previous = this.evalEnv;
    this.evalEnv = requireNonNull(evalEnv);
    try {
      return exp.accept(this);
    } finally {
      this.evalEnv = previous;
    }
  }

  private List<Value> evalAll(List<Ast.Exp> exps) {
    final List<Value> values = new ArrayList<>(exps.size());
    for (Ast.Exp exp : exps) {
      values.add(exp.accept(this));
    }
    return values;
  }

  // declarations

  @Override public Binding visit(Ast.TypeDecl typeDecl) {
    final TypeShape shape =
        TypeShape.record(
            Lists.transform(typeDecl.fields,
                f -> Maps.immutableEntry(f.name, f.typeName)));
    env.putType(typeDecl.name, shape);
    return Binding.of(typeDecl.name, shape);
  }

  @Override public Binding visit(Ast.SetDecl setDecl) {
    final Value value = setDecl.exp.accept(this);
    if (setDecl.typeName != null) {
      validate(setDecl, value);
    }
    env.putValue(setDecl.name, value, setDecl.typeName);
    return Binding.of(setDecl.name, value, setDecl.typeName);
  }

  /** Checks that every element of a typed set matches the shape of its
   * declared type. A record may have fields beyond those of its shape. */
  private void validate(Ast.SetDecl setDecl, Value value) {
    final String typeName = requireNonNull(setDecl.typeName);
    final TypeShape shape = env.getType(typeName);
    if (shape == null) {
      throw new EvalException(Kind.TYPE,
          "Type '" + typeName + "' not defined for set '" + setDecl.name
              + "'", setDecl.pos);
    }
    if (!(value instanceof Value.SetValue)) {
      throw new EvalException(Kind.TYPE,
          "Set '" + setDecl.name + "' of type '" + typeName
              + "' evaluated to non-set value: " + value.kind().typeName,
          setDecl.exp.pos);
    }
    for (Value element : ((Value.SetValue) value).elements) {
      if (shape instanceof TypeShape.RecordShape) {
        if (!(element instanceof Value.RecordValue)) {
          throw new EvalException(Kind.TYPE,
              "Expected record for type '" + typeName + "', got "
                  + element.kind().typeName + ": " + pretty.format(element),
              setDecl.exp.pos);
        }
        final Value.RecordValue record = (Value.RecordValue) element;
        final List<String> missing = new ArrayList<>();
        for (String fieldName
            : ((TypeShape.RecordShape) shape).fieldNames()) {
          if (record.get(fieldName) == null) {
            missing.add(fieldName);
          }
        }
        if (!missing.isEmpty()) {
          throw new EvalException(Kind.TYPE,
              "Item " + pretty.format(record, typeName)
                  + " missing fields for type '" + typeName + "': "
                  + String.join(", ", missing),
              setDecl.exp.pos);
        }
      } else {
        final int arity = ((TypeShape.TupleShape) shape).arity();
        if (!(element instanceof Value.TupleValue)) {
          throw new EvalException(Kind.TYPE,
              "Expected tuple for type '" + typeName + "', got "
                  + element.kind().typeName + ": " + pretty.format(element),
              setDecl.exp.pos);
        }
        final int size = ((Value.TupleValue) element).size();
        if (size != arity) {
          throw new EvalException(Kind.TYPE,
              "Item " + pretty.format(element)
                  + " has wrong number of fields for type '" + typeName
                  + "': expected " + arity + ", got " + size,
              setDecl.exp.pos);
        }
      }
    }
  }

  // expressions

  @Override public Value visit(Ast.Id id) {
    final Value value = evalEnv.getOpt(id.name);
    if (value != null) {
      return value;
    }
    if (env.getType(id.name) != null) {
      throw new EvalException(Kind.NAME,
          "'" + id.name + "' is a type, not a value", id.pos);
    }
    throw new EvalException(Kind.NAME,
        "Identifier '" + id.name + "' not found", id.pos);
  }

  @Override public Value visit(Ast.Literal literal) {
    switch (literal.op) {
    case INT_LITERAL:
      return Value.of((long) (Long) literal.value);
    case REAL_LITERAL:
      return Value.of((double) (Double) literal.value);
    case STRING_LITERAL:
      return Value.of((String) literal.value);
    default:
      throw new AssertionError("unknown literal " + literal.op);
    }
  }

  @Override public Value visit(Ast.SetLiteral setLiteral) {
    return Value.set(evalAll(setLiteral.args));
  }

  @Override public Value visit(Ast.Tuple tuple) {
    return Value.tuple(evalAll(tuple.args));
  }

  @Override public Value visit(Ast.Record record) {
    final Map<String, Value> fields = new LinkedHashMap<>();
    for (Map.Entry<String, Ast.Exp> arg : record.args) {
      // if a field occurs more than once, the last value wins
      fields.put(arg.getKey(), arg.getValue().accept(this));
    }
    return Value.record(fields);
  }

  @Override public Value visit(Ast.SetOp setOp) {
    final ImmutableSet<Value> left =
        elements(setOp.a0.accept(this), "Left operand of '"
            + setOp.op.symbol + "'", setOp.a0.pos);
    final ImmutableSet<Value> right =
        elements(setOp.a1.accept(this), "Right operand of '"
            + setOp.op.symbol + "'", setOp.a1.pos);
    switch (setOp.op) {
    case UNION:
      return Value.set(Sets.union(left, right));
    case INTERSECT:
      return Value.set(Sets.intersection(left, right));
    case CROSS:
      final List<Value> pairs = new ArrayList<>();
      for (Value a : left) {
        for (Value b : right) {
          pairs.add(Value.tuple(a, b));
        }
      }
      return Value.set(pairs);
    default:
      throw new EvalException(Kind.VALUE,
          "Unknown set operator: " + setOp.op, setOp.pos);
    }
  }

  /** Returns the elements of a set, or the (name, value) pairs of a
   * record; throws if the value is neither. */
  private static ImmutableSet<Value> elements(Value value, String what,
      Pos pos) {
    if (value instanceof Value.SetValue) {
      return ((Value.SetValue) value).elements;
    }
    if (value instanceof Value.RecordValue) {
      return ((Value.RecordValue) value).asPairs().elements;
    }
    throw new EvalException(Kind.TYPE,
        what + " must be a set, got " + value.kind().typeName, pos);
  }

  @Override public Value visit(Ast.Comprehension comprehension) {
    final ImmutableSet<Value> source =
        elements(comprehension.source.accept(this),
            "Set comprehension source", comprehension.source.pos);
    final EvalEnv outerEnv = evalEnv;
    final MutableEvalEnv innerEnv =
        outerEnv.bindMutableArray(comprehension.vars);
    final List<Value> results = new ArrayList<>();
    try {
      evalEnv = innerEnv;
      for (Value element : source) {
        if (!innerEnv.setOpt(element)) {
          tracer.onSkip(comprehension, element);
          continue;
        }
        if (comprehension.predicate != null
            && !comprehension.predicate.accept(this).isTruthy()) {
          continue;
        }
        if (comprehension.outputs.size() == 1) {
          results.add(comprehension.outputs.get(0).accept(this));
        } else {
          results.add(Value.tuple(evalAll(comprehension.outputs)));
        }
      }
    } finally {
      evalEnv = outerEnv;
    }
    return Value.set(results);
  }

  @Override public Value visit(Ast.Select select) {
    final Value value = select.exp.accept(this);
    if (!(value instanceof Value.RecordValue)) {
      throw new EvalException(Kind.TYPE,
          "Cannot access attribute '" + select.field
              + "' on non-record type: " + value.kind().typeName,
          select.pos);
    }
    final Value fieldValue = ((Value.RecordValue) value).get(select.field);
    if (fieldValue == null) {
      throw new EvalException(Kind.ATTRIBUTE,
          "Record " + pretty.format(value) + " has no attribute '"
              + select.field + "'", select.pos);
    }
    return fieldValue;
  }

  @Override public Value visit(Ast.Comparison comparison) {
    final Value left = comparison.a0.accept(this);
    final Value right = comparison.a1.accept(this);
    switch (comparison.op) {
    case EQ:
      return Value.of(left.equals(right));
    case NE:
      return Value.of(!left.equals(right));
    default:
      break;
    }
    if (left instanceof Value.SetValue && right instanceof Value.SetValue
        || left instanceof Value.RecordValue
            && right instanceof Value.RecordValue) {
      return Value.of(
          containment(comparison.op,
              elements(left, "Left operand", comparison.a0.pos),
              elements(right, "Right operand", comparison.a1.pos),
              comparison.pos));
    }
    final int c;
    try {
      c = Comparators.compare(left, right);
    } catch (Comparators.NotOrderedException e) {
      throw new EvalException(Kind.TYPE,
          "'" + comparison.op.symbol + "' not supported between "
              + e.left.kind().typeName + " and " + e.right.kind().typeName,
          comparison.pos);
    }
    return Value.of(compareResult(comparison.op, c, comparison.pos));
  }

  /** Compares two sets by containment: "<" is proper subset, "<=" subset,
   * ">=" superset, ">" proper superset. */
  private static boolean containment(Op op, ImmutableSet<Value> left,
      ImmutableSet<Value> right, Pos pos) {
    switch (op) {
    case LT:
      return left.size() < right.size() && right.containsAll(left);
    case LE:
      return left.size() <= right.size() && right.containsAll(left);
    case GT:
      return left.size() > right.size() && left.containsAll(right);
    case GE:
      return left.size() >= right.size() && left.containsAll(right);
    default:
      throw new EvalException(Kind.VALUE,
          "Unknown comparison operator: " + op, pos);
    }
  }

  private static boolean compareResult(Op op, int c, Pos pos) {
    switch (op) {
    case LT:
      return c < 0;
    case LE:
      return c <= 0;
    case GT:
      return c > 0;
    case GE:
      return c >= 0;
    default:
      throw new EvalException(Kind.VALUE,
          "Unknown comparison operator: " + op, pos);
    }
  }
}

// End Evaluator.java
