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

import static net.hydromatic.relinq.ast.ExpressionBuilder.expr;
import static net.hydromatic.relinq.ast.Fixtures.LIST_ADD;
import static net.hydromatic.relinq.ast.Fixtures.MATH_NEGATE_EXACT;
import static net.hydromatic.relinq.ast.Fixtures.POINT_DISTANCE;
import static net.hydromatic.relinq.ast.Fixtures.POINT_MIRROR;
import static net.hydromatic.relinq.ast.Fixtures.POINT_NEW;
import static net.hydromatic.relinq.ast.Fixtures.POINT_NEW_XY;
import static net.hydromatic.relinq.ast.Fixtures.POINT_X;
import static net.hydromatic.relinq.ast.Fixtures.POINT_Y;
import static net.hydromatic.relinq.ast.Fixtures.fn;
import static net.hydromatic.relinq.ast.Fixtures.intParam;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.lang.reflect.Constructor;
import java.util.List;
import net.hydromatic.relinq.ast.Fixtures.Point;
import org.junit.jupiter.api.Test;

/** Tests for {@link ExpressionBuilder}. */
public class ExpressionBuilderTest {
  private final Expressions.Parameter a = intParam("a");
  private final Expressions.Parameter b = intParam("b");

  @Test
  void testConstant() {
    assertThat(expr.constant(5).type, is(Integer.class));
    assertThat(expr.constant(null).type, is(Object.class));
    assertThat(expr.constant(null), hasToString("null"));
    assertThat(expr.constant("abc"), hasToString("\"abc\""));
    assertThat(expr.constant(5, long.class).type, is(long.class));
  }

  @Test
  void testParameter() {
    assertThat(a.op, is(Op.PARAMETER));
    assertThat(a, hasToString("a"));
    assertThrows(
        IllegalArgumentException.class, () -> expr.parameter(int.class, ""));
    assertThrows(
        NullPointerException.class, () -> expr.parameter(int.class, null));
  }

  @Test
  void testUnaryType() {
    final Expressions.Parameter array = expr.parameter(int[].class, "array");
    final Expressions.Unary length = expr.unary(Op.ARRAY_LENGTH, array);
    assertThat(length.type, is(int.class));
    assertThat(length, hasToString("arrayLength(array)"));

    final Expressions.Unary convert = expr.convert(a, long.class);
    assertThat(convert.type, is(long.class));
    assertThat(convert, hasToString("convert(a, long)"));

    assertThat(expr.not(expr.constant(true)), hasToString("(!true)"));
    assertThat(expr.unary(Op.NEGATE, a).type, is(int.class));

    assertThat(expr.unaryPlus(a, null).type, is(int.class));
    final Expressions.Unary plus =
        expr.unaryPlus(expr.constant(5L), MATH_NEGATE_EXACT);
    assertThat(plus.type, is(int.class));
    assertThat(plus.method, is(MATH_NEGATE_EXACT));

    final IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class, () -> expr.unary(Op.ADD, a));
    assertThat(e.getMessage(), is("not a unary operator: ADD"));
  }

  @Test
  void testBinaryType() {
    assertThat(expr.binary(Op.ADD, a, b).type, is(int.class));
    assertThat(expr.binary(Op.LESS_THAN, a, b).type, is(boolean.class));
    assertThat(expr.binary(Op.EQUAL, a, b), hasToString("(a == b)"));
    assertThat(
        expr.makeBinary(Op.ADD, a, b, false, MATH_NEGATE_EXACT, null).type,
        is(int.class));

    final Expressions.Parameter array =
        expr.parameter(String[].class, "array");
    final Expressions.Binary index = expr.binary(Op.ARRAY_INDEX, array, a);
    assertThat(index.type, is(String.class));
    assertThat(index, hasToString("array[a]"));
    assertThrows(
        IllegalArgumentException.class,
        () -> expr.binary(Op.ARRAY_INDEX, a, b));

    final IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class, () -> expr.binary(Op.NOT, a, b));
    assertThat(e.getMessage(), is("not a binary operator: NOT"));
  }

  @Test
  void testCoalesce() {
    final Expressions.Parameter s = expr.parameter(String.class, "s");
    final Expressions.Parameter n = expr.parameter(Integer.class, "n");
    assertThat(expr.coalesce(n, a, null).type, is(int.class));
    assertThat(expr.coalesce(n, a, null), hasToString("(n ?? a)"));

    final Expressions.Parameter x = expr.parameter(Integer.class, "x");
    final Expressions.Lambda conversion = fn(expr.convert(x, String.class), x);
    final Expressions.Binary coalesce = expr.coalesce(n, s, conversion);
    assertThat(coalesce.type, is(String.class));
    assertThat(coalesce.conversion, is(conversion));

    final IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class,
            () -> expr.makeBinary(Op.ADD, a, b, false, null, conversion));
    assertThat(
        e.getMessage(), is("conversion is only valid for COALESCE, not ADD"));
  }

  @Test
  void testConditionalAndTypeIs() {
    final Expressions.Conditional conditional =
        expr.condition(expr.constant(true), a, b);
    assertThat(conditional.type, is(int.class));
    assertThat(conditional, hasToString("(true ? a : b)"));

    final Expressions.Parameter o = expr.parameter(Object.class, "o");
    final Expressions.TypeIs typeIs = expr.typeIs(o, String.class);
    assertThat(typeIs.type, is(boolean.class));
    assertThat(typeIs, hasToString("(o instanceof String)"));

    assertThat(expr.default_(int.class), hasToString("default(int)"));
    assertThat(expr.default_(int.class).op, is(Op.DEFAULT));
  }

  @Test
  void testLambdaAndInvoke() {
    final Expressions.Lambda lambda = fn(expr.binary(Op.ADD, a, b), a, b);
    assertThat(lambda, hasToString("(a, b) => (a + b)"));
    assertThat(lambda.parameters, is(ImmutableList.of(a, b)));

    final Expressions.Invocation invocation =
        expr.invoke(lambda, expr.constant(1), expr.constant(2));
    assertThat(invocation.type, is(int.class));
    assertThat(invocation, hasToString("invoke((a, b) => (a + b), 1, 2)"));

    final Expressions.Parameter f = expr.parameter(Runnable.class, "f");
    assertThat(expr.invoke(f).type, is(Object.class));
    assertThat(expr.invoke(f), hasToString("invoke(f)"));
  }

  @Test
  void testCall() {
    final Expressions.Parameter p = expr.parameter(Point.class, "p");
    final Expressions.MethodCall mirror = expr.call(null, POINT_MIRROR, p);
    assertThat(mirror.type, is(Point.class));
    assertThat(mirror, hasToString("Point.mirror(p)"));

    final Expressions.MethodCall distance = expr.call(p, POINT_DISTANCE, p);
    assertThat(distance.type, is(int.class));
    assertThat(distance, hasToString("p.distance(p)"));

    // static method with a target
    assertThrows(
        IllegalArgumentException.class, () -> expr.call(p, POINT_MIRROR, p));
    // instance method without a target
    assertThrows(
        IllegalArgumentException.class,
        () -> expr.call(null, POINT_DISTANCE, p));
    // wrong number of arguments
    final IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class,
            () -> expr.call(p, POINT_DISTANCE, p, p));
    assertThat(
        e.getMessage(),
        is("method " + POINT_DISTANCE + " expects 1 arguments"));
  }

  @Test
  void testMemberAccess() {
    final Expressions.Parameter p = expr.parameter(Point.class, "p");
    final Expressions.MemberAccess x = expr.makeMemberAccess(p, POINT_X);
    assertThat(x.type, is(int.class));
    assertThat(x, hasToString("p.x"));

    final Expressions.MemberAccess max =
        expr.makeMemberAccess(
            null, Fixtures.field(Integer.class, "MAX_VALUE"));
    assertThat(max.type, is(int.class));
    assertThat(max, hasToString("Integer.MAX_VALUE"));

    // a constructor is neither a field nor a method
    final IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class,
            () -> expr.makeMemberAccess(p, POINT_NEW));
    assertThat(
        e.getMessage(), is("member must be a field or method: " + POINT_NEW));
  }

  @Test
  void testNew() {
    final Expressions.New point = expr.new_(POINT_NEW_XY, a, b);
    assertThat(point.type, is(Point.class));
    assertThat(point.members, nullValue());
    assertThat(point, hasToString("new Point(a, b)"));

    final Expressions.New point2 =
        expr.new_(
            POINT_NEW_XY,
            ImmutableList.of(a, b),
            ImmutableList.of(POINT_X, POINT_Y));
    assertThat(point2, hasToString("new Point(x = a, y = b)"));

    final Constructor<?> constructor = POINT_NEW_XY;
    final IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class,
            () ->
                expr.new_(
                    constructor,
                    ImmutableList.of(a, b),
                    ImmutableList.of(POINT_X)));
    assertThat(
        e.getMessage(), is("members and arguments must have the same length"));
  }

  @Test
  void testNewArray() {
    final Expressions.NewArray init = expr.newArrayInit(int.class, a, b);
    assertThat(init.op, is(Op.NEW_ARRAY_INIT));
    assertThat(init.type, is(int[].class));
    assertThat(init, hasToString("new int[] {a, b}"));

    final Expressions.NewArray empty =
        expr.newArrayInit(String.class, ImmutableList.of());
    assertThat(empty.type, is(String[].class));
    assertThat(empty, hasToString("new String[] {}"));

    final Expressions.NewArray bounds = expr.newArrayBounds(int.class, a, b);
    assertThat(bounds.op, is(Op.NEW_ARRAY_BOUNDS));
    assertThat(bounds.type, is(int[][].class));
    assertThat(bounds, hasToString("new int[a][b]"));

    final IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class,
            () -> expr.newArrayBounds(int.class));
    assertThat(e.getMessage(), is("array must have a bound"));
  }

  @Test
  void testInitializers() {
    final Expressions.Parameter s = expr.parameter(String.class, "s");
    final Expressions.MemberInit memberInit =
        expr.memberInit(expr.new_(POINT_NEW), expr.bind(POINT_X, a));
    assertThat(memberInit.type, is(Point.class));
    assertThat(memberInit, hasToString("new Point() {x = a}"));
    assertThat(
        memberInit.bindings.get(0).bindingType,
        is(Expressions.BindingType.ASSIGNMENT));

    final Expressions.ElementInit add = expr.elementInit(LIST_ADD, s);
    assertThat(add, hasToString("add(s)"));
    assertThrows(
        IllegalArgumentException.class,
        () -> expr.elementInit(LIST_ADD, s, s));

    final Expressions.New newList = expr.new_(Fixtures.ARRAY_LIST_NEW);
    final Expressions.ListInit listInit = expr.listInit(newList, add, add);
    assertThat(listInit, hasToString("new ArrayList() {add(s), add(s)}"));
    final List<Expressions.ElementInit> noInitializers = ImmutableList.of();
    final IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class,
            () -> expr.listInit(newList, noInitializers));
    assertThat(e.getMessage(), is("list initializer must not be empty"));
  }
}

// End ExpressionBuilderTest.java
