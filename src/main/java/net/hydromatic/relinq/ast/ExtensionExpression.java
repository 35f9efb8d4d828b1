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

/**
 * Expression whose kind is not one of the closed kinds in {@link Op}.
 *
 * <p>A {@link Shuttle} hands such an expression control of its own traversal
 * by calling {@link #accept(Shuttle)} before it looks at {@link #op}. The
 * default {@code accept} calls back {@link Shuttle#visitExtension}, which in
 * turn calls {@link #visitChildren(Shuttle)}.
 *
 * <p>A sub-class that needs special treatment from a particular shuttle
 * overrides {@code accept}, checks the shuttle's type, and calls the
 * shuttle's own method; for example:
 *
 * <blockquote><pre>{@code
 * @Override public Expression accept(Shuttle shuttle) {
 *   if (shuttle instanceof SqlGeneratingShuttle) {
 *     return ((SqlGeneratingShuttle) shuttle).visitRowNumber(this);
 *   }
 *   return super.accept(shuttle);
 * }
 * }</pre></blockquote>
 *
 * <p>A terminal domain-specific leaf implements {@code visitChildren} by
 * returning {@code this}.
 */
public abstract class ExtensionExpression extends Expression {
  protected ExtensionExpression(Type type) {
    super(Op.EXTENSION, type);
  }

  /** Accepts a shuttle, and returns the expression that should replace this
   * one. */
  public Expression accept(Shuttle shuttle) {
    return shuttle.visitExtension(this);
  }

  /**
   * Visits the children of this expression with a shuttle, and returns this
   * expression if no child changed, otherwise a copy with the new children.
   *
   * <p>Implementations call {@link Shuttle#visitExpression} for each child,
   * and compare the results with the original children by identity.
   */
  protected abstract Expression visitChildren(Shuttle shuttle);
}

// End ExtensionExpression.java
