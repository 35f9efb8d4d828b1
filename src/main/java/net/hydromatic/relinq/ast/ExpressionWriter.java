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

import java.lang.reflect.Type;
import java.util.List;

/**
 * Context for writing an expression out as a string.
 *
 * <p>Compound expressions are always parenthesized; the output is for
 * debugging, not for parsing.
 */
public class ExpressionWriter {
  private final StringBuilder b = new StringBuilder();

  /** Appends a string to the output. */
  public ExpressionWriter append(String s) {
    b.append(s);
    return this;
  }

  /** Appends an expression. */
  public ExpressionWriter append(Expression e) {
    return e.unparse(this);
  }

  /** Appends the short name of a type, e.g. "String" or "int[]". */
  public ExpressionWriter append(Type type) {
    return append(
        type instanceof Class
            ? ((Class<?>) type).getSimpleName()
            : type.getTypeName());
  }

  /** Appends a list of items, separated by commas. */
  public ExpressionWriter appendAll(List<? extends Expression> list) {
    for (int i = 0; i < list.size(); i++) {
      if (i > 0) {
        append(", ");
      }
      append(list.get(i));
    }
    return this;
  }

  /** Appends a call to an infix operator. */
  public ExpressionWriter infix(Expression a0, Op op, Expression a1) {
    return append("(").append(a0).append(op.padded).append(a1).append(")");
  }

  @Override
  public String toString() {
    return b.toString();
  }
}

// End ExpressionWriter.java
