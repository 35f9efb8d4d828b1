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

import com.google.common.collect.ImmutableList;
import java.lang.reflect.Array;
import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.GenericArrayType;
import java.lang.reflect.Member;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Builds expressions. */
public enum ExpressionBuilder {
  /**
   * The singleton instance of the expression builder. The short name is
   * convenient for use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  expr;

  // leaves

  /** Creates a constant whose type is the class of its value, or
   * {@code Object} if the value is null. */
  public Expressions.Constant constant(@Nullable Object value) {
    return constant(value, value == null ? Object.class : value.getClass());
  }

  /** Creates a constant with a given type. */
  public Expressions.Constant constant(@Nullable Object value, Type type) {
    return new Expressions.Constant(type, value);
  }

  /** Creates a parameter. */
  public Expressions.Parameter parameter(Type type, String name) {
    return new Expressions.Parameter(type, name);
  }

  /** Creates the default value of a type. */
  public Expressions.Default default_(Type type) {
    return new Expressions.Default(type);
  }

  /** Creates a reference to the items of a query source. */
  public Expressions.QuerySourceReference querySourceReference(
      QuerySource querySource) {
    return new Expressions.QuerySourceReference(
        requireNonNull(querySource, "querySource"));
  }

  /** Creates a sub-query whose type is the type of the query. */
  public Expressions.SubQuery subQuery(Expression query) {
    return new Expressions.SubQuery(query.type, query);
  }

  // operators

  /** Creates a unary expression, specifying its type. */
  public Expressions.Unary makeUnary(
      Op op, Expression operand, Type type, @Nullable Method method) {
    return new Expressions.Unary(op, type, operand, method);
  }

  /** Creates a unary expression, deducing its type from the operand. */
  public Expressions.Unary unary(Op op, Expression operand) {
    final Type type = op == Op.ARRAY_LENGTH ? int.class : operand.type;
    return makeUnary(op, operand, type, null);
  }

  /** Creates a "+x" expression. If there is a method, the type is the
   * method's return type, otherwise the type of the operand. */
  public Expressions.Unary unaryPlus(
      Expression operand, @Nullable Method method) {
    final Type type =
        method != null ? method.getGenericReturnType() : operand.type;
    return makeUnary(Op.UNARY_PLUS, operand, type, method);
  }

  /** Creates an expression that converts a value to a given type. */
  public Expressions.Unary convert(Expression operand, Type type) {
    return makeUnary(Op.CONVERT, operand, type, null);
  }

  /** Creates a "!x" expression. */
  public Expressions.Unary not(Expression operand) {
    return unary(Op.NOT, operand);
  }

  /** Creates a binary expression. */
  public Expressions.Binary makeBinary(
      Op op,
      Expression left,
      Expression right,
      boolean liftToNull,
      @Nullable Method method,
      Expressions.@Nullable Lambda conversion) {
    final Type type = binaryType(op, left, right, method, conversion);
    return makeBinary(op, type, left, right, liftToNull, method, conversion);
  }

  /** Creates a binary expression, specifying its type. */
  public Expressions.Binary makeBinary(
      Op op,
      Type type,
      Expression left,
      Expression right,
      boolean liftToNull,
      @Nullable Method method,
      Expressions.@Nullable Lambda conversion) {
    return new Expressions.Binary(
        op, type, left, right, liftToNull, method, conversion);
  }

  /** Creates a binary expression with no method or conversion. */
  public Expressions.Binary binary(Op op, Expression left, Expression right) {
    return makeBinary(op, left, right, false, null, null);
  }

  /** Creates an "a ?? b" expression. */
  public Expressions.Binary coalesce(
      Expression left,
      Expression right,
      Expressions.@Nullable Lambda conversion) {
    return makeBinary(Op.COALESCE, left, right, false, null, conversion);
  }

  private static Type binaryType(
      Op op,
      Expression left,
      Expression right,
      @Nullable Method method,
      Expressions.@Nullable Lambda conversion) {
    if (op.isPredicate()) {
      return boolean.class;
    }
    if (method != null) {
      return method.getGenericReturnType();
    }
    switch (op) {
    case ARRAY_INDEX:
      return componentType(left.type);
    case COALESCE:
      return conversion != null ? conversion.body.type : right.type;
    default:
      return left.type;
    }
  }

  private static Type componentType(Type arrayType) {
    if (arrayType instanceof Class && ((Class<?>) arrayType).isArray()) {
      return ((Class<?>) arrayType).getComponentType();
    }
    if (arrayType instanceof GenericArrayType) {
      return ((GenericArrayType) arrayType).getGenericComponentType();
    }
    throw new IllegalArgumentException("not an array type: " + arrayType);
  }

  /** Creates a "test ? ifTrue : ifFalse" expression. */
  public Expressions.Conditional condition(
      Expression test, Expression ifTrue, Expression ifFalse) {
    return makeCondition(ifTrue.type, test, ifTrue, ifFalse);
  }

  /** Creates a "test ? ifTrue : ifFalse" expression, specifying its type. */
  public Expressions.Conditional makeCondition(
      Type type, Expression test, Expression ifTrue, Expression ifFalse) {
    return new Expressions.Conditional(type, test, ifTrue, ifFalse);
  }

  /** Creates a test whether an expression is an instance of a type. */
  public Expressions.TypeIs typeIs(Expression expression, Type typeOperand) {
    return new Expressions.TypeIs(boolean.class, expression, typeOperand);
  }

  // functions and calls

  /** Creates a lambda. */
  public Expressions.Lambda lambda(
      Type type,
      Expression body,
      Iterable<? extends Expressions.Parameter> parameters) {
    return new Expressions.Lambda(
        type, body, ImmutableList.copyOf(parameters));
  }

  /** Creates a lambda. */
  public Expressions.Lambda lambda(
      Type type, Expression body, Expressions.Parameter... parameters) {
    return lambda(type, body, ImmutableList.copyOf(parameters));
  }

  /** Creates an application of a function to arguments. If the function is
   * a lambda, the type is the type of the lambda's body. */
  public Expressions.Invocation invoke(
      Expression expression, Iterable<? extends Expression> arguments) {
    final Type type =
        expression instanceof Expressions.Lambda
            ? ((Expressions.Lambda) expression).body.type
            : Object.class;
    return makeInvoke(type, expression, arguments);
  }

  /** Creates an application of a function to arguments, specifying its
   * type. */
  public Expressions.Invocation makeInvoke(
      Type type,
      Expression expression,
      Iterable<? extends Expression> arguments) {
    return new Expressions.Invocation(
        type, expression, ImmutableList.copyOf(arguments));
  }

  /** Creates an application of a function to arguments. */
  public Expressions.Invocation invoke(
      Expression expression, Expression... arguments) {
    return invoke(expression, ImmutableList.copyOf(arguments));
  }

  /** Creates a call to a method. The target must be null if and only if the
   * method is static. */
  public Expressions.MethodCall call(
      @Nullable Expression object,
      Method method,
      Iterable<? extends Expression> arguments) {
    final ImmutableList<Expression> argumentList =
        ImmutableList.copyOf(arguments);
    checkArgument(
        Modifier.isStatic(method.getModifiers()) == (object == null),
        "target must be null if and only if method is static: %s",
        method);
    checkArgument(
        method.isVarArgs()
            || argumentList.size() == method.getParameterCount(),
        "method %s expects %s arguments",
        method,
        method.getParameterCount());
    return new Expressions.MethodCall(
        method.getGenericReturnType(), object, method, argumentList);
  }

  /** Creates a call to a method. */
  public Expressions.MethodCall call(
      @Nullable Expression object, Method method, Expression... arguments) {
    return call(object, method, ImmutableList.copyOf(arguments));
  }

  /** Creates an access to a field, or to a property via its getter method.
   * The instance is null if the member is static. */
  public Expressions.MemberAccess makeMemberAccess(
      @Nullable Expression expression, Member member) {
    return new Expressions.MemberAccess(memberType(member), expression, member);
  }

  private static Type memberType(Member member) {
    if (member instanceof Field) {
      return ((Field) member).getGenericType();
    }
    if (member instanceof Method) {
      return ((Method) member).getGenericReturnType();
    }
    throw new IllegalArgumentException(
        "member must be a field or method: " + member);
  }

  // constructors

  /** Creates a call to a constructor. */
  public Expressions.New new_(
      Constructor<?> constructor, Iterable<? extends Expression> arguments) {
    return new_(constructor, arguments, null);
  }

  /** Creates a call to a constructor. */
  public Expressions.New new_(
      Constructor<?> constructor, Expression... arguments) {
    return new_(constructor, ImmutableList.copyOf(arguments), null);
  }

  /** Creates a call to a constructor, specifying which member each argument
   * initializes. */
  public Expressions.New new_(
      Constructor<?> constructor,
      Iterable<? extends Expression> arguments,
      @Nullable Iterable<? extends Member> members) {
    return new Expressions.New(
        constructor.getDeclaringClass(),
        constructor,
        ImmutableList.copyOf(arguments),
        members == null ? null : ImmutableList.copyOf(members));
  }

  /** Creates a one-dimensional array from a list of elements. */
  public Expressions.NewArray newArrayInit(
      Class<?> elementType, Iterable<? extends Expression> expressions) {
    return new Expressions.NewArray(
        Op.NEW_ARRAY_INIT,
        arrayType(elementType, 1),
        elementType,
        ImmutableList.copyOf(expressions));
  }

  /** Creates a one-dimensional array from a list of elements. */
  public Expressions.NewArray newArrayInit(
      Class<?> elementType, Expression... expressions) {
    return newArrayInit(elementType, ImmutableList.copyOf(expressions));
  }

  /** Creates an array from a list of bounds, one per dimension. */
  public Expressions.NewArray newArrayBounds(
      Class<?> elementType, Iterable<? extends Expression> bounds) {
    final ImmutableList<Expression> boundList = ImmutableList.copyOf(bounds);
    checkArgument(!boundList.isEmpty(), "array must have a bound");
    return new Expressions.NewArray(
        Op.NEW_ARRAY_BOUNDS,
        arrayType(elementType, boundList.size()),
        elementType,
        boundList);
  }

  /** Creates an array from a list of bounds, one per dimension. */
  public Expressions.NewArray newArrayBounds(
      Class<?> elementType, Expression... bounds) {
    return newArrayBounds(elementType, ImmutableList.copyOf(bounds));
  }

  /** Returns the class of an array with a given number of dimensions, e.g.
   * {@code int[][]}. */
  static Class<?> arrayType(Class<?> elementType, int rank) {
    return Array.newInstance(elementType, new int[rank]).getClass();
  }

  /** Creates a call to a constructor followed by member initializations. */
  public Expressions.MemberInit memberInit(
      Expressions.New newExpression,
      Iterable<? extends Expressions.MemberBinding> bindings) {
    requireNonNull(newExpression, "newExpression");
    return new Expressions.MemberInit(
        newExpression.type, newExpression, ImmutableList.copyOf(bindings));
  }

  /** Creates a call to a constructor followed by member initializations. */
  public Expressions.MemberInit memberInit(
      Expressions.New newExpression,
      Expressions.MemberBinding... bindings) {
    return memberInit(newExpression, ImmutableList.copyOf(bindings));
  }

  /** Creates a call to a constructor followed by calls that add elements. */
  public Expressions.ListInit listInit(
      Expressions.New newExpression,
      Iterable<? extends Expressions.ElementInit> initializers) {
    requireNonNull(newExpression, "newExpression");
    final ImmutableList<Expressions.ElementInit> list =
        ImmutableList.copyOf(initializers);
    checkArgument(!list.isEmpty(), "list initializer must not be empty");
    return new Expressions.ListInit(newExpression.type, newExpression, list);
  }

  /** Creates a call to a constructor followed by calls that add elements. */
  public Expressions.ListInit listInit(
      Expressions.New newExpression, Expressions.ElementInit... initializers) {
    return listInit(newExpression, ImmutableList.copyOf(initializers));
  }

  // bindings

  /** Creates a binding that assigns a value to a member. */
  public Expressions.MemberAssignment bind(
      Member member, Expression expression) {
    return new Expressions.MemberAssignment(member, expression);
  }

  /** Creates a binding that initializes the members of a member. */
  public Expressions.MemberMemberBinding memberBind(
      Member member, Iterable<? extends Expressions.MemberBinding> bindings) {
    return new Expressions.MemberMemberBinding(
        member, ImmutableList.copyOf(bindings));
  }

  /** Creates a binding that initializes the members of a member. */
  public Expressions.MemberMemberBinding memberBind(
      Member member, Expressions.MemberBinding... bindings) {
    return memberBind(member, ImmutableList.copyOf(bindings));
  }

  /** Creates a binding that adds elements to a collection-valued member. */
  public Expressions.MemberListBinding listBind(
      Member member, Iterable<? extends Expressions.ElementInit> initializers) {
    return new Expressions.MemberListBinding(
        member, ImmutableList.copyOf(initializers));
  }

  /** Creates a binding that adds elements to a collection-valued member. */
  public Expressions.MemberListBinding listBind(
      Member member, Expressions.ElementInit... initializers) {
    return listBind(member, ImmutableList.copyOf(initializers));
  }

  /** Creates a call to a method that adds an element to a collection. */
  public Expressions.ElementInit elementInit(
      Method addMethod, Iterable<? extends Expression> arguments) {
    final ImmutableList<Expression> argumentList =
        ImmutableList.copyOf(arguments);
    checkArgument(
        argumentList.size() == addMethod.getParameterCount(),
        "method %s expects %s arguments",
        addMethod,
        addMethod.getParameterCount());
    return new Expressions.ElementInit(addMethod, argumentList);
  }

  /** Creates a call to a method that adds an element to a collection. */
  public Expressions.ElementInit elementInit(
      Method addMethod, Expression... arguments) {
    return elementInit(addMethod, ImmutableList.copyOf(arguments));
  }
}

// End ExpressionBuilder.java
