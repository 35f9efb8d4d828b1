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

import static java.util.Objects.requireNonNull;
import static net.hydromatic.relinq.ast.ExpressionBuilder.expr;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.function.Function;
import net.hydromatic.relinq.util.Static;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Visits and transforms expression trees.
 *
 * <p>Each {@code visit} method visits the children of an expression and
 * returns the expression itself if every child came back as the same object;
 * otherwise it returns a new expression of the same kind, with the new
 * children and the original operator, method, member and type information.
 * Unchanged sub-trees are therefore shared between the input and output
 * trees.
 *
 * <p>This class visits every expression but changes nothing; sub-classes
 * override the methods for the kinds of expression they want to transform.
 *
 * <p>A shuttle recurses once per level of the tree, so a very deep tree may
 * exhaust the stack. A shuttle has no state of its own, and may be used by
 * several threads at once unless a sub-class adds state.
 */
public class Shuttle {
  private static final Logger LOGGER = LoggerFactory.getLogger(Shuttle.class);

  /** Creates a Shuttle. */
  public Shuttle() {}

  /**
   * Visits an expression, and returns the expression that should replace it.
   *
   * <p>Returns null if the expression is null. Gives an
   * {@link ExtensionExpression} the chance to handle itself; otherwise calls
   * the {@code visit} method for the expression's {@link Op kind}.
   */
  public @Nullable Expression visitExpression(@Nullable Expression expression) {
    if (expression == null) {
      return null;
    }
    if (expression instanceof ExtensionExpression) {
      return ((ExtensionExpression) expression).accept(this);
    }

    switch (expression.op) {
    case ARRAY_LENGTH:
    case CONVERT:
    case CONVERT_CHECKED:
    case NEGATE:
    case NEGATE_CHECKED:
    case NOT:
    case QUOTE:
    case TYPE_AS:
    case UNARY_PLUS:
      return visit((Expressions.Unary) expression);
    case ADD:
    case ADD_CHECKED:
    case DIVIDE:
    case MODULO:
    case MULTIPLY:
    case MULTIPLY_CHECKED:
    case POWER:
    case SUBTRACT:
    case SUBTRACT_CHECKED:
    case AND:
    case OR:
    case EXCLUSIVE_OR:
    case LEFT_SHIFT:
    case RIGHT_SHIFT:
    case AND_ALSO:
    case OR_ELSE:
    case EQUAL:
    case NOT_EQUAL:
    case GREATER_THAN_OR_EQUAL:
    case GREATER_THAN:
    case LESS_THAN:
    case LESS_THAN_OR_EQUAL:
    case COALESCE:
    case ARRAY_INDEX:
      return visit((Expressions.Binary) expression);
    case CONDITIONAL:
      return visit((Expressions.Conditional) expression);
    case CONSTANT:
      return visit((Expressions.Constant) expression);
    case INVOKE:
      return visit((Expressions.Invocation) expression);
    case LAMBDA:
      return visit((Expressions.Lambda) expression);
    case MEMBER_ACCESS:
      return visit((Expressions.MemberAccess) expression);
    case CALL:
      return visit((Expressions.MethodCall) expression);
    case NEW:
      return visit((Expressions.New) expression);
    case NEW_ARRAY_BOUNDS:
    case NEW_ARRAY_INIT:
      return visit((Expressions.NewArray) expression);
    case MEMBER_INIT:
      return visit((Expressions.MemberInit) expression);
    case LIST_INIT:
      return visit((Expressions.ListInit) expression);
    case PARAMETER:
      return visit((Expressions.Parameter) expression);
    case TYPE_IS:
      return visit((Expressions.TypeIs) expression);
    case SUB_QUERY:
      return visit((Expressions.SubQuery) expression);
    case QUERY_SOURCE_REFERENCE:
      return visit((Expressions.QuerySourceReference) expression);
    default:
      return visitUnknown(expression);
    }
  }

  /** Called by {@link ExtensionExpression#accept(Shuttle)} when the extension
   * has no special handling for this shuttle. */
  protected Expression visitExtension(ExtensionExpression expression) {
    return expression.visitChildren(this);
  }

  /** Called for an expression whose kind this shuttle does not handle. */
  protected Expression visitUnknown(Expression expression) {
    if (expression instanceof ExtensionExpression) {
      return ((ExtensionExpression) expression).visitChildren(this);
    }
    throw new RewriteException.UnsupportedKind(expression.op, getClass());
  }

  /** Returns a rebuilt expression, logging it if tracing is enabled. */
  private static <E> E rebuilt(Object original, E e) {
    if (Static.TRACE_REWRITES) {
      LOGGER.debug("rebuilt {} as {}", original, e);
    }
    return e;
  }

  // leaves

  protected Expression visit(Expressions.Constant constant) {
    return constant; // leaf
  }

  protected Expression visit(Expressions.Parameter parameter) {
    return parameter; // leaf
  }

  /** Visits a sub-query. Returns it unchanged; the query inside is not
   * visited. */
  protected Expression visit(Expressions.SubQuery subQuery) {
    return subQuery;
  }

  protected Expression visit(
      Expressions.QuerySourceReference querySourceReference) {
    return querySourceReference;
  }

  // operators

  protected Expression visit(Expressions.Unary unary) {
    final Expression operand = visitExpression(unary.operand);
    if (operand == unary.operand) {
      return unary;
    }
    if (unary.op == Op.UNARY_PLUS) {
      // Type follows the method or operand, as when the node was created
      return rebuilt(unary, expr.unaryPlus(operand, unary.method));
    }
    return rebuilt(
        unary, expr.makeUnary(unary.op, operand, unary.type, unary.method));
  }

  protected Expression visit(Expressions.Binary binary) {
    final Expression left = visitExpression(binary.left);
    final Expression right = visitExpression(binary.right);
    final Expressions.Lambda conversion =
        binary.conversion == null
            ? null
            : visitAndConvert(
                binary.conversion, Expressions.Lambda.class, "visitBinary");
    if (left == binary.left
        && right == binary.right
        && conversion == binary.conversion) {
      return binary;
    }
    return rebuilt(
        binary,
        expr.makeBinary(
            binary.op,
            binary.type,
            left,
            right,
            binary.liftToNull,
            binary.method,
            conversion));
  }

  protected Expression visit(Expressions.TypeIs typeIs) {
    final Expression expression = visitExpression(typeIs.expression);
    if (expression == typeIs.expression) {
      return typeIs;
    }
    return rebuilt(typeIs, expr.typeIs(expression, typeIs.typeOperand));
  }

  protected Expression visit(Expressions.Conditional conditional) {
    final Expression test = visitExpression(conditional.test);
    final Expression ifTrue = visitExpression(conditional.ifTrue);
    final Expression ifFalse = visitExpression(conditional.ifFalse);
    if (test == conditional.test
        && ifTrue == conditional.ifTrue
        && ifFalse == conditional.ifFalse) {
      return conditional;
    }
    return rebuilt(
        conditional,
        expr.makeCondition(conditional.type, test, ifTrue, ifFalse));
  }

  // functions and calls

  protected Expression visit(Expressions.Lambda lambda) {
    final List<Expressions.Parameter> parameters =
        visitExpressionList(
            lambda.parameters, Expressions.Parameter.class, "visitLambda");
    final Expression body = visitExpression(lambda.body);
    if (body == lambda.body && parameters == lambda.parameters) {
      return lambda;
    }
    return rebuilt(lambda, expr.lambda(lambda.type, body, parameters));
  }

  protected Expression visit(Expressions.MethodCall methodCall) {
    final Expression object = visitExpression(methodCall.object);
    final List<Expression> arguments =
        visitExpressionList(
            methodCall.arguments, Expression.class, "visitMethodCall");
    if (object == methodCall.object && arguments == methodCall.arguments) {
      return methodCall;
    }
    return rebuilt(
        methodCall, expr.call(object, methodCall.method, arguments));
  }

  protected Expression visit(Expressions.Invocation invocation) {
    final Expression expression = visitExpression(invocation.expression);
    final List<Expression> arguments =
        visitExpressionList(
            invocation.arguments, Expression.class, "visitInvocation");
    if (expression == invocation.expression
        && arguments == invocation.arguments) {
      return invocation;
    }
    return rebuilt(
        invocation, expr.makeInvoke(invocation.type, expression, arguments));
  }

  protected Expression visit(Expressions.MemberAccess memberAccess) {
    final Expression expression = visitExpression(memberAccess.expression);
    if (expression == memberAccess.expression) {
      return memberAccess;
    }
    return rebuilt(
        memberAccess, expr.makeMemberAccess(expression, memberAccess.member));
  }

  // constructors

  protected Expression visit(Expressions.New newExpression) {
    final List<Expression> arguments =
        visitExpressionList(
            newExpression.arguments, Expression.class, "visitNew");
    if (arguments == newExpression.arguments) {
      return newExpression;
    }
    return rebuilt(
        newExpression,
        expr.new_(newExpression.constructor, arguments, newExpression.members));
  }

  protected Expression visit(Expressions.NewArray newArray) {
    final List<Expression> expressions =
        visitExpressionList(
            newArray.expressions, Expression.class, "visitNewArray");
    if (expressions == newArray.expressions) {
      return newArray;
    }
    if (newArray.op == Op.NEW_ARRAY_INIT) {
      return rebuilt(
          newArray, expr.newArrayInit(newArray.elementType, expressions));
    } else {
      return rebuilt(
          newArray, expr.newArrayBounds(newArray.elementType, expressions));
    }
  }

  protected Expression visit(Expressions.MemberInit memberInit) {
    final Expressions.New newExpression =
        visitAnchor(memberInit.newExpression, "MemberInit");
    final List<Expressions.MemberBinding> bindings =
        visitMemberBindingList(memberInit.bindings);
    if (newExpression == memberInit.newExpression
        && bindings == memberInit.bindings) {
      return memberInit;
    }
    return rebuilt(memberInit, expr.memberInit(newExpression, bindings));
  }

  protected Expression visit(Expressions.ListInit listInit) {
    final Expressions.New newExpression =
        visitAnchor(listInit.newExpression, "ListInit");
    final List<Expressions.ElementInit> initializers =
        visitElementInitList(listInit.initializers);
    if (newExpression == listInit.newExpression
        && initializers == listInit.initializers) {
      return listInit;
    }
    return rebuilt(listInit, expr.listInit(newExpression, initializers));
  }

  /** Visits the constructor call of a member or list initializer, and checks
   * that it is still a constructor call. */
  private Expressions.New visitAnchor(
      Expressions.New newExpression, String kind) {
    final Expression e = visitExpression(newExpression);
    if (!(e instanceof Expressions.New)) {
      throw new RewriteException.InvariantViolation(
          kind
              + " expressions only support non-null instances of type 'New' "
              + "as their newExpression member.");
    }
    return (Expressions.New) e;
  }

  // bindings and element initializers

  /** Visits a member binding, calling the {@code visit} method for its
   * {@link Expressions.BindingType binding type}. */
  protected Expressions.MemberBinding visitMemberBinding(
      Expressions.MemberBinding binding) {
    requireNonNull(binding, "binding");
    switch (binding.bindingType) {
    case ASSIGNMENT:
      return visit((Expressions.MemberAssignment) binding);
    case MEMBER_BINDING:
      return visit((Expressions.MemberMemberBinding) binding);
    case LIST_BINDING:
      return visit((Expressions.MemberListBinding) binding);
    default:
      throw new AssertionError("unknown binding type " + binding.bindingType);
    }
  }

  protected Expressions.MemberBinding visit(
      Expressions.MemberAssignment assignment) {
    final Expression expression = visitExpression(assignment.expression);
    if (expression == assignment.expression) {
      return assignment;
    }
    return rebuilt(assignment, expr.bind(assignment.member, expression));
  }

  protected Expressions.MemberBinding visit(
      Expressions.MemberMemberBinding binding) {
    final List<Expressions.MemberBinding> bindings =
        visitMemberBindingList(binding.bindings);
    if (bindings == binding.bindings) {
      return binding;
    }
    return rebuilt(binding, expr.memberBind(binding.member, bindings));
  }

  protected Expressions.MemberBinding visit(
      Expressions.MemberListBinding listBinding) {
    final List<Expressions.ElementInit> initializers =
        visitElementInitList(listBinding.initializers);
    if (initializers == listBinding.initializers) {
      return listBinding;
    }
    return rebuilt(
        listBinding, expr.listBind(listBinding.member, initializers));
  }

  protected Expressions.ElementInit visit(
      Expressions.ElementInit elementInit) {
    final List<Expression> arguments =
        visitExpressionList(
            elementInit.arguments, Expression.class, "visitElementInit");
    if (arguments == elementInit.arguments) {
      return elementInit;
    }
    return rebuilt(
        elementInit, expr.elementInit(elementInit.addMethod, arguments));
  }

  // lists

  /**
   * Visits an expression and checks that the result is still an instance of
   * a given class.
   *
   * @param expression Expression to visit
   * @param expressionClass Class that the result must belong to
   * @param callerName Name of the calling method, for error messages
   * @param <E> Expression type
   * @throws RewriteException.CategoryMismatch if the result is null or not an
   *     instance of {@code expressionClass}
   */
  protected <E extends Expression> E visitAndConvert(
      E expression, Class<E> expressionClass, String callerName) {
    requireNonNull(expression, "expression");
    requireNonNull(callerName, "callerName");
    final Expression e = visitExpression(expression);
    if (!expressionClass.isInstance(e)) {
      throw new RewriteException.CategoryMismatch(
          callerName, e, expressionClass);
    }
    return expressionClass.cast(e);
  }

  /** Visits each expression in a list, requiring that each result is an
   * instance of the same class as the list's elements. */
  public <E extends Expression> List<E> visitExpressionList(
      List<E> expressions, Class<E> elementClass, String callerName) {
    return visitList(
        expressions, elementClass, e -> visitAndConvert(e, elementClass,
            callerName));
  }

  protected List<Expressions.MemberBinding> visitMemberBindingList(
      List<Expressions.MemberBinding> bindings) {
    return visitList(
        bindings, Expressions.MemberBinding.class, this::visitMemberBinding);
  }

  protected List<Expressions.ElementInit> visitElementInitList(
      List<Expressions.ElementInit> initializers) {
    return visitList(
        initializers, Expressions.ElementInit.class, e -> visit(e));
  }

  /**
   * Applies a function to each element of a list.
   *
   * <p>Returns the original list if the function returns each element
   * unchanged. Otherwise returns an immutable list of the same length; no
   * list is allocated until the first element that changes.
   *
   * @param list List to visit
   * @param elementClass Class that every element of the result must belong to
   * @param visitMethod Function to apply to each element
   * @param <E> Element type
   * @throws RewriteException.ListElementMismatch if the function returns null,
   *     or an object that is not an instance of {@code elementClass}
   */
  public <E> List<E> visitList(
      List<E> list,
      Class<E> elementClass,
      Function<? super E, ? extends @Nullable E> visitMethod) {
    requireNonNull(list, "list");
    requireNonNull(visitMethod, "visitMethod");
    ImmutableList.Builder<E> newList = null;
    for (int i = 0; i < list.size(); i++) {
      final E element = list.get(i);
      final E newElement = visitMethod.apply(element);
      if (!elementClass.isInstance(newElement)) {
        throw new RewriteException.ListElementMismatch(elementClass, i);
      }
      if (newList == null && newElement != element) {
        newList = ImmutableList.builderWithExpectedSize(list.size());
        newList.addAll(list.subList(0, i));
      }
      if (newList != null) {
        newList.add(newElement);
      }
    }
    return newList == null ? list : newList.build();
  }
}

// End Shuttle.java
