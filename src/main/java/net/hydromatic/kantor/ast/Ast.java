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
package net.hydromatic.kantor.ast;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;
import java.util.Map;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;

import static java.util.Objects.requireNonNull;

/** Various sub-classes of AST nodes. */
public class Ast {
  private Ast() {}

  /** Base class of expression ASTs. */
  public abstract static class Exp extends AstNode {
    Exp(Pos pos, Op op) {
      super(pos, op);
    }

    /** Accepts a visitor, calling the {@code visit} method appropriate to
     * the type of this node, and returning the result. */
    public abstract <R> R accept(Visitor<R> visitor);
  }

  /** Parse tree node of an identifier. */
  public static class Id extends Exp {
    public final String name;

    /** Creates an Id. */
    Id(Pos pos, String name) {
      super(pos, Op.ID);
      this.name = requireNonNull(name);
    }

    @Override public int hashCode() {
      return name.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Id
          && this.name.equals(((Id) o).name);
    }

    @Override public <R> R accept(Visitor<R> visitor) {
      return visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(name);
    }
  }

  /** Parse tree node of a literal (constant).
   *
   * <p>The value is a {@link Long} if {@link #op} is
   * {@link Op#INT_LITERAL}, a {@link Double} if {@link Op#REAL_LITERAL},
   * and a {@link String} if {@link Op#STRING_LITERAL}. */
  @SuppressWarnings("rawtypes")
  public static class Literal extends Exp {
    public final Comparable value;

    /** Creates a Literal. */
    Literal(Pos pos, Op op, Comparable value) {
      super(pos, op);
      this.value = requireNonNull(value);
      checkArgument(op == Op.INT_LITERAL && value instanceof Long
          || op == Op.REAL_LITERAL && value instanceof Double
          || op == Op.STRING_LITERAL && value instanceof String,
          "literal %s does not match op %s", value, op);
    }

    @Override public int hashCode() {
      return value.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Literal
          && this.value.equals(((Literal) o).value);
    }

    @Override public <R> R accept(Visitor<R> visitor) {
      return visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      switch (op) {
      case STRING_LITERAL:
        return w.appendString((String) value);
      case REAL_LITERAL:
        return w.append(AstWriter.realToString((Double) value));
      default:
        return w.append(value.toString());
      }
    }
  }

  /** Literal set, "{e1, e2, ...}". */
  public static class SetLiteral extends Exp {
    public final List<Exp> args;

    SetLiteral(Pos pos, ImmutableList<Exp> args) {
      super(pos, Op.SET);
      this.args = requireNonNull(args);
    }

    @Override public <R> R accept(Visitor<R> visitor) {
      return visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.list("{", args, "}");
    }
  }

  /** Tuple, "(e1, e2, ...)". */
  public static class Tuple extends Exp {
    public final List<Exp> args;

    Tuple(Pos pos, ImmutableList<Exp> args) {
      super(pos, Op.TUPLE);
      this.args = requireNonNull(args);
    }

    @Override public <R> R accept(Visitor<R> visitor) {
      return visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      if (args.size() == 1) {
        // Without the trailing comma, it would read back as a
        // parenthesized expression.
        return w.append("(").append(args.get(0), 0, 0).append(",)");
      }
      return w.list("(", args, ")");
    }
  }

  /** Record instance, "(name: e1, age: e2, ...)".
   *
   * <p>Fields are held in the order they were written. If a name occurs
   * more than once, the evaluator uses the last value. */
  public static class Record extends Exp {
    public final List<Map.Entry<String, Exp>> args;

    Record(Pos pos, ImmutableList<Map.Entry<String, Exp>> args) {
      super(pos, Op.RECORD);
      this.args = requireNonNull(args);
    }

    @Override public <R> R accept(Visitor<R> visitor) {
      return visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      w.append("(");
      for (int i = 0; i < args.size(); i++) {
        final Map.Entry<String, Exp> arg = args.get(i);
        w.append(i == 0 ? "" : ", ")
            .append(arg.getKey())
            .append(Op.FIELD.padded)
            .append(arg.getValue(), 0, 0);
      }
      return w.append(")");
    }
  }

  /** Call to a binary set operator: union, intersect or cross product. */
  public static class SetOp extends Exp {
    public final Exp a0;
    public final Exp a1;

    SetOp(Pos pos, Op op, Exp a0, Exp a1) {
      super(pos, op);
      this.a0 = requireNonNull(a0);
      this.a1 = requireNonNull(a1);
      checkArgument(op.isSetOp(), "not a set operator: %s", op);
    }

    @Override public <R> R accept(Visitor<R> visitor) {
      return visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.infix(left, a0, op, a1, right);
    }
  }

  /** Set comprehension, "{out | x of source, predicate}".
   *
   * <p>If there are several {@link #outputs}, each element of the result
   * is a tuple. If there are several {@link #vars}, each element of the
   * source is destructured as a tuple. */
  public static class Comprehension extends Exp {
    public final List<Exp> outputs;
    public final List<String> vars;
    public final Id source;
    public final @Nullable Exp predicate;

    Comprehension(Pos pos, ImmutableList<Exp> outputs,
        ImmutableList<String> vars, Id source, @Nullable Exp predicate) {
      super(pos, Op.FROM);
      this.outputs = requireNonNull(outputs);
      this.vars = requireNonNull(vars);
      this.source = requireNonNull(source);
      this.predicate = predicate;
      checkArgument(!vars.isEmpty(), "comprehension must have a variable");
    }

    @Override public <R> R accept(Visitor<R> visitor) {
      return visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      w.append("{");
      if (outputs.size() == 1) {
        w.append(outputs.get(0), 0, 0);
      } else {
        w.list("(", outputs, ")");
      }
      w.append(" | ");
      if (vars.size() == 1) {
        w.append(vars.get(0));
      } else {
        w.append("(").append(String.join(", ", vars)).append(")");
      }
      w.append(" of ").append(source, 0, 0);
      if (predicate != null) {
        w.append(", ").append(predicate, 0, 0);
      }
      return w.append("}");
    }
  }

  /** Attribute access, "e.field". */
  public static class Select extends Exp {
    public final Exp exp;
    public final String field;

    Select(Pos pos, Exp exp, String field) {
      super(pos, Op.SELECT);
      this.exp = requireNonNull(exp);
      this.field = requireNonNull(field);
    }

    @Override public <R> R accept(Visitor<R> visitor) {
      return visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      if (exp.op == Op.INT_LITERAL || exp.op == Op.REAL_LITERAL) {
        // "5.x" would not lex as a number
        w.append("(").append(exp, 0, 0).append(")");
      } else {
        w.append(exp, left, op.left);
      }
      return w.append(op.padded).append(field);
    }
  }

  /** Comparison, "e1 &lt; e2". */
  public static class Comparison extends Exp {
    public final Exp a0;
    public final Exp a1;

    Comparison(Pos pos, Op op, Exp a0, Exp a1) {
      super(pos, op);
      this.a0 = requireNonNull(a0);
      this.a1 = requireNonNull(a1);
      checkArgument(op.isComparison(), "not a comparison: %s", op);
    }

    @Override public <R> R accept(Visitor<R> visitor) {
      return visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.infix(left, a0, op, a1, right);
    }
  }

  /** Base class for declarations. */
  public abstract static class Decl extends AstNode {
    public final String name;

    Decl(Pos pos, Op op, String name) {
      super(pos, op);
      this.name = requireNonNull(name);
    }

    /** Accepts a visitor, calling the {@code visit} method appropriate to
     * the type of this declaration, and returning the result. */
    public abstract <R> R accept(DeclVisitor<R> visitor);
  }

  /** Field of a record type, "name: string". */
  public static class Field extends AstNode {
    public final String name;
    public final String typeName;

    Field(Pos pos, String name, String typeName) {
      super(pos, Op.FIELD);
      this.name = requireNonNull(name);
      this.typeName = requireNonNull(typeName);
    }

    @Override public int hashCode() {
      return Objects.hash(name, typeName);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Field
          && name.equals(((Field) o).name)
          && typeName.equals(((Field) o).typeName);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(name).append(op.padded).append(typeName);
    }
  }

  /** Type declaration, "type Person: Record(name: string, age: int)". */
  public static class TypeDecl extends Decl {
    public final List<Field> fields;

    TypeDecl(Pos pos, String name, ImmutableList<Field> fields) {
      super(pos, Op.TYPE_DECL, name);
      this.fields = requireNonNull(fields);
    }

    @Override public <R> R accept(DeclVisitor<R> visitor) {
      return visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("type ").append(name).append(": ")
          .list("Record(", fields, ")");
    }
  }

  /** Set declaration, "let Adults: Person = {p | p of Users, p.age &ge; 18}".
   */
  public static class SetDecl extends Decl {
    public final @Nullable String typeName;
    public final Exp exp;

    SetDecl(Pos pos, String name, @Nullable String typeName, Exp exp) {
      super(pos, Op.SET_DECL, name);
      this.typeName = typeName;
      this.exp = requireNonNull(exp);
    }

    @Override public <R> R accept(DeclVisitor<R> visitor) {
      return visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      w.append("let ").append(name);
      if (typeName != null) {
        w.append(": ").append(typeName);
      }
      return w.append(op.padded).append(exp, 0, 0);
    }
  }

  /** A whole program; a list of declarations. */
  public static class Program extends AstNode {
    public final List<Decl> decls;

    Program(Pos pos, ImmutableList<Decl> decls) {
      super(pos, Op.PROGRAM);
      this.decls = requireNonNull(decls);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      for (int i = 0; i < decls.size(); i++) {
        w.append(i == 0 ? "" : "\n").append(decls.get(i), 0, 0);
      }
      return w;
    }
  }
}

// End Ast.java
