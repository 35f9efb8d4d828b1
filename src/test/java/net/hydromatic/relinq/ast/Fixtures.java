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

import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/** Classes and reflective members used to build expressions in tests. */
public class Fixtures {
  private Fixtures() {}

  /** Mutable point, for member initializers. */
  public static class Point {
    public int x;
    public int y;
    public Point origin;
    public List<String> tags = new ArrayList<>();

    public Point() {}

    public Point(int x, int y) {
      this.x = x;
      this.y = y;
    }

    public static Point mirror(Point p) {
      return new Point(p.y, p.x);
    }

    public int distance(Point p) {
      return Math.abs(x - p.x) + Math.abs(y - p.y);
    }
  }

  public static final Field POINT_X = field(Point.class, "x");
  public static final Field POINT_Y = field(Point.class, "y");
  public static final Field POINT_ORIGIN = field(Point.class, "origin");
  public static final Field POINT_TAGS = field(Point.class, "tags");
  public static final Constructor<?> POINT_NEW =
      constructor(Point.class);
  public static final Constructor<?> POINT_NEW_XY =
      constructor(Point.class, int.class, int.class);
  public static final Method POINT_MIRROR =
      method(Point.class, "mirror", Point.class);
  public static final Method POINT_DISTANCE =
      method(Point.class, "distance", Point.class);
  public static final Constructor<?> ARRAY_LIST_NEW =
      constructor(ArrayList.class);
  public static final Method LIST_ADD =
      method(List.class, "add", Object.class);
  public static final Method MATH_NEGATE_EXACT =
      method(Math.class, "negateExact", int.class);

  static Field field(Class<?> clazz, String name) {
    try {
      return clazz.getField(name);
    } catch (NoSuchFieldException e) {
      throw new AssertionError(e);
    }
  }

  static Constructor<?> constructor(Class<?> clazz, Class<?>... types) {
    try {
      return clazz.getConstructor(types);
    } catch (NoSuchMethodException e) {
      throw new AssertionError(e);
    }
  }

  static Method method(Class<?> clazz, String name, Class<?>... types) {
    try {
      return clazz.getMethod(name, types);
    } catch (NoSuchMethodException e) {
      throw new AssertionError(e);
    }
  }

  /** Creates a parameter of type {@code int}. */
  public static Expressions.Parameter intParam(String name) {
    return expr.parameter(int.class, name);
  }

  /** Creates a lambda of type {@code Function}. */
  public static Expressions.Lambda fn(
      Expression body, Expressions.Parameter... parameters) {
    return expr.lambda(Function.class, body, parameters);
  }

  /** Query source for tests. */
  public static QuerySource querySource(String name, Class<?> type) {
    return new QuerySource() {
      @Override
      public String itemName() {
        return name;
      }

      @Override
      public Class<?> itemType() {
        return type;
      }
    };
  }

  /** Shuttle that replaces one expression with another, and counts how
   * many expressions it visits. */
  public static class SwapShuttle extends Shuttle {
    final Expression from;
    final Expression to;
    /** Number of non-null expressions visited. */
    public int count;

    public SwapShuttle(Expression from, Expression to) {
      this.from = from;
      this.to = to;
    }

    @Override
    public Expression visitExpression(Expression expression) {
      if (expression != null) {
        ++count;
      }
      if (expression == from) {
        return to;
      }
      return super.visitExpression(expression);
    }
  }
}

// End Fixtures.java
