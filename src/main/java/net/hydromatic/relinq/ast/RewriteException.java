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

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A {@link Shuttle} produced, or was asked to visit, a tree that breaks the
 * rules of the expression model.
 *
 * <p>These are programming errors in the shuttle (or in whoever built the
 * tree). The visit is abandoned; no partial result is available.
 */
public class RewriteException extends RuntimeException {
  protected RewriteException(String message) {
    super(message);
  }

  /** The shuttle does not know how to visit expressions of this kind. */
  public static class UnsupportedKind extends RewriteException {
    public final Op op;

    public UnsupportedKind(Op op, Class<?> shuttleClass) {
      super(
          String.format(
              "Expression type %s is not supported by this %s.",
              op, shuttleClass.getSimpleName()));
      this.op = requireNonNull(op);
    }
  }

  /** An element of a rewritten list is null or has the wrong class. */
  public static class ListElementMismatch extends RewriteException {
    public final int index;

    public ListElementMismatch(Class<?> elementClass, int index) {
      super(
          String.format(
              "The current list only supports objects of type '%s' as its "
                  + "elements; element %d is not valid.",
              elementClass.getSimpleName(), index));
      this.index = index;
    }
  }

  /** A rewritten child is no longer of the class its parent requires. */
  public static class CategoryMismatch extends RewriteException {
    public final String callerName;

    public CategoryMismatch(
        String callerName, @Nullable Object actual, Class<?> expectedClass) {
      super(
          String.format(
              "When called from '%s', expressions of type '%s' can only be "
                  + "replaced with other expressions of type '%s'.",
              callerName,
              actual == null ? "null" : actual.getClass().getSimpleName(),
              expectedClass.getSimpleName()));
      this.callerName = requireNonNull(callerName);
    }
  }

  /** A rewritten tree breaks a structural rule, such as the rule that the
   * anchor of a member or list initializer is a constructor call. */
  public static class InvariantViolation extends RewriteException {
    public InvariantViolation(String message) {
      super(message);
    }
  }
}

// End RewriteException.java
