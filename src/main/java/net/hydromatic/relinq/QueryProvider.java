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

import net.hydromatic.relinq.ast.Expression;

/**
 * Executes queries represented as expression trees.
 *
 * <p>A provider typically rewrites the tree using a
 * {@link net.hydromatic.relinq.ast.Shuttle} before translating it for its
 * back end.
 */
public interface QueryProvider {
  /**
   * Executes a query and returns its results.
   *
   * @param expression Expression representing the query; its type is
   *     assignable to {@code Iterable<T>}
   * @param elementType Type of the items returned
   * @param <T> Element type
   */
  <T> Iterable<T> execute(Expression expression, Class<T> elementType);
}

// End QueryProvider.java
