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
package net.hydromatic.relinq.ast;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.base.CaseFormat;
import com.google.common.collect.ImmutableList;
import java.lang.reflect.Constructor;
import java.lang.reflect.Member;
import java.lang.reflect.Method;
import java.lang.reflect.Type;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Expressions of the closed kinds.
 *
 * <p>This class functions as a namespace, so that we can keep the class names
 * short. Create instances using {@link ExpressionBuilder#expr}.
 */
public class Expressions {
  private Expressions() {}

  /** Returns the name of an operator when written as a function, e.g.
   * "arrayLength". */
  static String functionName(Op op) {
    return CaseFormat.UPPER_UNDERSCORE.to(CaseFormat.LOWER_CAMEL, op.name());
  }

  /** Expression with one operand, such as "-x" or "convert(x, Long)". */
  public static class Unary extends Expression {
    public final Expression operand;
    /** Method that implements the operator, or null. */
    public final @Nullable Method method;

    Unary(Op op, Type type, Expression operand, @Nullable Method method) {
      super(op, type);
      this.operand = requireNonNull(operand, "operand");
      this.method = method;
      checkArgument(op.isUnary(), "not a unary operator: %s", op);
    }

    @Override
    protected ExpressionWriter unparse(ExpressionWriter w) {
      if (op.padded != null) {
        return w.append("(").append(op.padded).append(operand).append(")");
      }
      w.append(functionName(op)).append("(").append(operand);
      switch (op) {
      case CONVERT:
      case CONVERT_CHECKED:
      case TYPE_AS:
        w.append(", ").append(type);
        break;
      default:
        break;
      }
      return w.append(")");
    }
  }

  /** Expression with two operands, such as "a + b" or "a[i]". */
  public static class Binary extends Expression {
    public final Expression left;
    public final Expression right;
    public final boolean liftToNull;
    /** Method that implements the operator, or null. */
    public final @Nullable Method method;
    /** Conversion applied to the left operand of a
     * {@link Op#COALESCE coalesce}, or null. */
    public final @Nullable Lambda conversion;

    Binary(
        Op op,
        Type type,
        Expression left,
        Expression right,
        boolean liftToNull,
        @Nullable Method method,
        @Nullable Lambda conversion) {
      super(op, type);
      this.left = requireNonNull(left, "left");
      this.right = requireNonNull(right, "right");
      this.liftToNull = liftToNull;
      this.method = method;
      this.conversion = conversion;
      checkArgument(op.isBinary(), "not a binary operator: %s", op);
      checkArgument(
          conversion == null || op == Op.COALESCE,
          "conversion is only valid for COALESCE, not %s",
          op);
    }

    @Override
    protected ExpressionWriter unparse(ExpressionWriter w) {
      if (op == Op.ARRAY_INDEX) {
        return w.append(left).append("[").append(right).append("]");
      }
      return w.infix(left, op, right);
    }
  }

  /** Expression "test ? ifTrue : ifFalse". */
  public static class Conditional extends Expression {
    public final Expression test;
    public final Expression ifTrue;
    public final Expression ifFalse;

    Conditional(
        Type type, Expression test, Expression ifTrue, Expression ifFalse) {
      super(Op.CONDITIONAL, type);
      this.test = requireNonNull(test, "test");
      this.ifTrue = requireNonNull(ifTrue, "ifTrue");
      this.ifFalse = requireNonNull(ifFalse, "ifFalse");
    }

    @Override
    protected ExpressionWriter unparse(ExpressionWriter w) {
      return w.append("(")
          .append(test)
          .append(" ? ")
          .append(ifTrue)
          .append(" : ")
          .append(ifFalse)
          .append(")");
    }
  }

  /** Constant value. */
  public static class Constant extends Expression {
    public final @Nullable Object value;

    Constant(Type type, @Nullable Object value) {
      super(Op.CONSTANT, type);
      this.value = value;
    }

    @Override
    protected ExpressionWriter unparse(ExpressionWriter w) {
      if (value instanceof String) {
        return w.append("\"").append((String) value).append("\"");
      }
      return w.append(String.valueOf(value));
    }
  }

  /** Application of a function-valued expression (typically a
   * {@link Lambda}) to a list of arguments. */
  public static class Invocation extends Expression {
    public final Expression expression;
    public final List<Expression> arguments;

    Invocation(
        Type type, Expression expression, ImmutableList<Expression> arguments) {
      super(Op.INVOKE, type);
      this.expression = requireNonNull(expression, "expression");
      this.arguments = requireNonNull(arguments, "arguments");
    }

    @Override
    protected ExpressionWriter unparse(ExpressionWriter w) {
      return w.append("invoke(")
          .append(expression)
          .append(arguments.isEmpty() ? "" : ", ")
          .appendAll(arguments)
          .append(")");
    }
  }

  /** Function, such as "(x, y) => x + y". */
  public static class Lambda extends Expression {
    public final Expression body;
    public final List<Parameter> parameters;

    Lambda(Type type, Expression body, ImmutableList<Parameter> parameters) {
      super(Op.LAMBDA, type);
      this.body = requireNonNull(body, "body");
      this.parameters = requireNonNull(parameters, "parameters");
    }

    @Override
    protected ExpressionWriter unparse(ExpressionWriter w) {
      return w.append("(")
          .appendAll(parameters)
          .append(") => ")
          .append(body);
    }
  }

  /** Access to a field or property, such as "c.name". */
  public static class MemberAccess extends Expression {
    /** Instance whose member is accessed; null if the member is static. */
    public final @Nullable Expression expression;
    public final Member member;

    MemberAccess(Type type, @Nullable Expression expression, Member member) {
      super(Op.MEMBER_ACCESS, type);
      this.expression = expression;
      this.member = requireNonNull(member, "member");
    }

    @Override
    protected ExpressionWriter unparse(ExpressionWriter w) {
      if (expression == null) {
        w.append(member.getDeclaringClass());
      } else {
        w.append(expression);
      }
      return w.append(".").append(member.getName());
    }
  }

  /** Call to a method, such as "s.substring(1)". */
  public static class MethodCall extends Expression {
    /** Target of the call; null if the method is static. */
    public final @Nullable Expression object;
    public final Method method;
    public final List<Expression> arguments;

    MethodCall(
        Type type,
        @Nullable Expression object,
        Method method,
        ImmutableList<Expression> arguments) {
      super(Op.CALL, type);
      this.object = object;
      this.method = requireNonNull(method, "method");
      this.arguments = requireNonNull(arguments, "arguments");
    }

    @Override
    protected ExpressionWriter unparse(ExpressionWriter w) {
      if (object == null) {
        w.append(method.getDeclaringClass());
      } else {
        w.append(object);
      }
      return w.append(".")
          .append(method.getName())
          .append("(")
          .appendAll(arguments)
          .append(")");
    }
  }

  /** Call to a constructor, such as "new Point(x, y)". */
  public static class New extends Expression {
    public final Constructor<?> constructor;
    public final List<Expression> arguments;
    /** Members initialized by each argument, or null; if not null, has the
     * same length as {@link #arguments}. */
    public final @Nullable List<Member> members;

    New(
        Type type,
        Constructor<?> constructor,
        ImmutableList<Expression> arguments,
        @Nullable ImmutableList<Member> members) {
      super(Op.NEW, type);
      this.constructor = requireNonNull(constructor, "constructor");
      this.arguments = requireNonNull(arguments, "arguments");
      this.members = members;
      checkArgument(
          members == null || members.size() == arguments.size(),
          "members and arguments must have the same length");
    }

    @Override
    protected ExpressionWriter unparse(ExpressionWriter w) {
      w.append("new ").append(type).append("(");
      for (int i = 0; i < arguments.size(); i++) {
        if (i > 0) {
          w.append(", ");
        }
        if (members != null) {
          w.append(members.get(i).getName()).append(" = ");
        }
        w.append(arguments.get(i));
      }
      return w.append(")");
    }
  }

  /** Creation of an array, either from a list of bounds
   * ({@link Op#NEW_ARRAY_BOUNDS}) or from a list of elements
   * ({@link Op#NEW_ARRAY_INIT}). */
  public static class NewArray extends Expression {
    public final Class<?> elementType;
    /** Bounds or elements, depending on {@link #op}. */
    public final List<Expression> expressions;

    NewArray(
        Op op,
        Type type,
        Class<?> elementType,
        ImmutableList<Expression> expressions) {
      super(op, type);
      this.elementType = requireNonNull(elementType, "elementType");
      this.expressions = requireNonNull(expressions, "expressions");
      checkArgument(op == Op.NEW_ARRAY_BOUNDS || op == Op.NEW_ARRAY_INIT);
    }

    @Override
    protected ExpressionWriter unparse(ExpressionWriter w) {
      w.append("new ").append(elementType);
      if (op == Op.NEW_ARRAY_INIT) {
        return w.append("[] {").appendAll(expressions).append("}");
      }
      for (Expression bound : expressions) {
        w.append("[").append(bound).append("]");
      }
      return w;
    }
  }

  /** Call to a constructor followed by initialization of members, such as
   * "new Point() {x = 1, y = 2}". */
  public static class MemberInit extends Expression {
    public final New newExpression;
    public final List<MemberBinding> bindings;

    MemberInit(
        Type type, New newExpression, ImmutableList<MemberBinding> bindings) {
      super(Op.MEMBER_INIT, type);
      this.newExpression = requireNonNull(newExpression, "newExpression");
      this.bindings = requireNonNull(bindings, "bindings");
    }

    @Override
    protected ExpressionWriter unparse(ExpressionWriter w) {
      w.append(newExpression).append(" {");
      MemberBinding.unparseAll(w, bindings);
      return w.append("}");
    }
  }

  /** Call to a constructor followed by calls that add elements to the new
   * collection, such as "new ArrayList() {add(1), add(2)}". */
  public static class ListInit extends Expression {
    public final New newExpression;
    public final List<ElementInit> initializers;

    ListInit(
        Type type, New newExpression, ImmutableList<ElementInit> initializers) {
      super(Op.LIST_INIT, type);
      this.newExpression = requireNonNull(newExpression, "newExpression");
      this.initializers = requireNonNull(initializers, "initializers");
    }

    @Override
    protected ExpressionWriter unparse(ExpressionWriter w) {
      w.append(newExpression).append(" {");
      ElementInit.unparseAll(w, initializers);
      return w.append("}");
    }
  }

  /** Named parameter of a {@link Lambda}.
   *
   * <p>Two parameters with the same name and type are still different
   * parameters. */
  public static class Parameter extends Expression {
    public final String name;

    Parameter(Type type, String name) {
      super(Op.PARAMETER, type);
      this.name = requireNonNull(name, "name");
      checkArgument(!name.isEmpty(), "empty name");
    }

    @Override
    protected ExpressionWriter unparse(ExpressionWriter w) {
      return w.append(name);
    }
  }

  /** Test whether the value of an expression is an instance of a type, such
   * as "x instanceof String". */
  public static class TypeIs extends Expression {
    public final Expression expression;
    public final Type typeOperand;

    TypeIs(Type type, Expression expression, Type typeOperand) {
      super(Op.TYPE_IS, type);
      this.expression = requireNonNull(expression, "expression");
      this.typeOperand = requireNonNull(typeOperand, "typeOperand");
    }

    @Override
    protected ExpressionWriter unparse(ExpressionWriter w) {
      return w.append("(")
          .append(expression)
          .append(" instanceof ")
          .append(typeOperand)
          .append(")");
    }
  }

  /** Default value of a type, such as "default(int)". */
  public static class Default extends Expression {
    Default(Type type) {
      super(Op.DEFAULT, type);
    }

    @Override
    protected ExpressionWriter unparse(ExpressionWriter w) {
      return w.append("default(").append(type).append(")");
    }
  }

  /** Query nested within another query, such as the "from o in c.orders"
   * in "from c in customers where (from o in c.orders).any()".
   *
   * <p>A shuttle treats a sub-query as a leaf; it does not visit
   * {@link #query}. */
  public static class SubQuery extends Expression {
    public final Expression query;

    SubQuery(Type type, Expression query) {
      super(Op.SUB_QUERY, type);
      this.query = requireNonNull(query, "query");
    }

    @Override
    protected ExpressionWriter unparse(ExpressionWriter w) {
      return w.append("{").append(query).append("}");
    }
  }

  /** Reference to the items produced by a {@link QuerySource}, such as the
   * "c" in "select c.name". */
  public static class QuerySourceReference extends Expression {
    public final QuerySource querySource;

    QuerySourceReference(QuerySource querySource) {
      super(Op.QUERY_SOURCE_REFERENCE, querySource.itemType());
      this.querySource = querySource;
    }

    @Override
    protected ExpressionWriter unparse(ExpressionWriter w) {
      return w.append("[").append(querySource.itemName()).append("]");
    }
  }

  /** Initializes a member of an object created by a {@link MemberInit}. */
  public abstract static class MemberBinding {
    public final BindingType bindingType;
    public final Member member;

    MemberBinding(BindingType bindingType, Member member) {
      this.bindingType = requireNonNull(bindingType, "bindingType");
      this.member = requireNonNull(member, "member");
    }

    @Override
    public String toString() {
      return unparse(new ExpressionWriter()).toString();
    }

    abstract ExpressionWriter unparse(ExpressionWriter w);

    static void unparseAll(
        ExpressionWriter w, List<? extends MemberBinding> bindings) {
      for (int i = 0; i < bindings.size(); i++) {
        if (i > 0) {
          w.append(", ");
        }
        bindings.get(i).unparse(w);
      }
    }
  }

  /** Variants of {@link MemberBinding}. */
  public enum BindingType {
    ASSIGNMENT,
    MEMBER_BINDING,
    LIST_BINDING
  }

  /** Binding that assigns the value of an expression to a member, such as
   * "x = 1". */
  public static class MemberAssignment extends MemberBinding {
    public final Expression expression;

    MemberAssignment(Member member, Expression expression) {
      super(BindingType.ASSIGNMENT, member);
      this.expression = requireNonNull(expression, "expression");
    }

    @Override
    ExpressionWriter unparse(ExpressionWriter w) {
      return w.append(member.getName()).append(" = ").append(expression);
    }
  }

  /** Binding that initializes the members of a member, such as
   * "origin = {x = 1, y = 2}". */
  public static class MemberMemberBinding extends MemberBinding {
    public final List<MemberBinding> bindings;

    MemberMemberBinding(Member member, ImmutableList<MemberBinding> bindings) {
      super(BindingType.MEMBER_BINDING, member);
      this.bindings = requireNonNull(bindings, "bindings");
    }

    @Override
    ExpressionWriter unparse(ExpressionWriter w) {
      w.append(member.getName()).append(" = {");
      unparseAll(w, bindings);
      return w.append("}");
    }
  }

  /** Binding that adds elements to a collection-valued member, such as
   * "tags = {add("a"), add("b")}". */
  public static class MemberListBinding extends MemberBinding {
    public final List<ElementInit> initializers;

    MemberListBinding(Member member, ImmutableList<ElementInit> initializers) {
      super(BindingType.LIST_BINDING, member);
      this.initializers = requireNonNull(initializers, "initializers");
    }

    @Override
    ExpressionWriter unparse(ExpressionWriter w) {
      w.append(member.getName()).append(" = {");
      ElementInit.unparseAll(w, initializers);
      return w.append("}");
    }
  }

  /** Call to the method that adds an element to a collection, such as the
   * "add(1)" in "new ArrayList() {add(1), add(2)}". */
  public static class ElementInit {
    public final Method addMethod;
    public final List<Expression> arguments;

    ElementInit(Method addMethod, ImmutableList<Expression> arguments) {
      this.addMethod = requireNonNull(addMethod, "addMethod");
      this.arguments = requireNonNull(arguments, "arguments");
    }

    @Override
    public String toString() {
      return unparse(new ExpressionWriter()).toString();
    }

    ExpressionWriter unparse(ExpressionWriter w) {
      return w.append(addMethod.getName())
          .append("(")
          .appendAll(arguments)
          .append(")");
    }

    static void unparseAll(ExpressionWriter w, List<ElementInit> initializers) {
      for (int i = 0; i < initializers.size(); i++) {
        if (i > 0) {
          w.append(", ");
        }
        initializers.get(i).unparse(w);
      }
    }
  }
}

// End Expressions.java
