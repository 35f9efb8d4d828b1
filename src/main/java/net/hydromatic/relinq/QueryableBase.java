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
package net.hydromatic.relinq;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.relinq.ast.ExpressionBuilder.expr;

import com.google.common.reflect.TypeParameter;
import com.google.common.reflect.TypeToken;
import java.util.Iterator;
import net.hydromatic.relinq.ast.Expression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Data source whose items are produced by executing a query.
 *
 * <p>A provider-specific sub-class is the starting point of a query: created
 * with just a provider, its {@link #expression()} is a constant that refers
 * back to the data source itself. Operators that compose a query create new
 * instances around larger trees.
 *
 * @param <T> Type of the items returned by the query
 */
public abstract class QueryableBase<T> implements Iterable<T> {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(QueryableBase.class);

  private final QueryProvider provider;
  private final Class<T> elementType;
  private final Expression expression;

  /** Creates a data source that is the start of a query. */
  protected QueryableBase(QueryProvider provider, Class<T> elementType) {
    this.provider = requireNonNull(provider, "provider");
    this.elementType = requireNonNull(elementType, "elementType");
    this.expression = expr.constant(this);
  }

  /** Creates a data source for a query represented by an expression.
   *
   * @throws IllegalArgumentException if the type of the expression is not
   *     assignable to {@code Iterable<T>}
   */
  protected QueryableBase(
      QueryProvider provider, Class<T> elementType, Expression expression) {
    this.provider = requireNonNull(provider, "provider");
    this.elementType = requireNonNull(elementType, "elementType");
    this.expression = requireNonNull(expression, "expression");
    final TypeToken<Iterable<T>> iterableType = iterableOf(elementType);
    checkArgument(
        iterableType.isSupertypeOf(expression.type),
        "expression of type %s is not assignable to %s",
        expression.type,
        iterableType);
  }

  private static <T> TypeToken<Iterable<T>> iterableOf(Class<T> elementType) {
    return new TypeToken<Iterable<T>>() {}.where(
        new TypeParameter<T>() {}, elementType);
  }

  /** Returns the expression that describes the query represented by this
   * data source. */
  public Expression expression() {
    return expression;
  }

  /** Returns the provider that executes the query. */
  public QueryProvider provider() {
    return provider;
  }

  /** Returns the type of the items returned by the query. */
  public Class<T> elementType() {
    return elementType;
  }

  /** Executes the query via the provider, and returns an iterator over the
   * results. */
  @Override
  public Iterator<T> iterator() {
    LOGGER.debug("executing {}", expression);
    return provider.execute(expression, elementType).iterator();
  }
}

// End QueryableBase.java
