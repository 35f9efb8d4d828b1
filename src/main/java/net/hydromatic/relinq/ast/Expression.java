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

import java.lang.reflect.Type;

/**
 * Node of an expression tree.
 *
 * <p>Expressions are immutable. A {@link Shuttle} that changes an expression
 * creates a new one, sharing every sub-tree that did not change; callers
 * compare expressions by identity to find out whether anything changed.
 * Sub-classes therefore do not override {@link Object#equals(Object)}.
 *
 * <p>The closed set of kinds lives in {@link Expressions}; other kinds
 * extend {@link ExtensionExpression}. The constructor is package-private so
 * that no other class can claim one of the closed kinds.
 */
public abstract class Expression {
  public final Op op;
  /** Static type of the value this expression yields. A rewritten
   * expression must remain assignable wherever this one was used. */
  public final Type type;

  Expression(Op op, Type type) {
    this.op = requireNonNull(op, "op");
    this.type = requireNonNull(type, "type");
  }

  /**
   * Converts this expression into a string.
   *
   * <p>The purpose of this string is debugging. Derived classes override
   * {@link #unparse(ExpressionWriter)}, not this method.
   */
  @Override
  public final String toString() {
    return unparse(new ExpressionWriter()).toString();
  }

  /** Writes this expression to a writer. */
  protected abstract ExpressionWriter unparse(ExpressionWriter w);
}

// End Expression.java
