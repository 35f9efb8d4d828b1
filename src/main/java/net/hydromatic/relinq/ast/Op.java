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

import org.checkerframework.checker.nullness.qual.Nullable;

/** Kinds of {@link Expression}. */
public enum Op {
  // unary operators
  ARRAY_LENGTH,
  CONVERT,
  CONVERT_CHECKED,
  NEGATE("-"),
  NEGATE_CHECKED,
  NOT("!"),
  QUOTE,
  TYPE_AS,
  UNARY_PLUS("+"),

  // binary operators
  ADD(" + "),
  ADD_CHECKED(" checked + "),
  DIVIDE(" / "),
  MODULO(" % "),
  MULTIPLY(" * "),
  MULTIPLY_CHECKED(" checked * "),
  POWER(" ** "),
  SUBTRACT(" - "),
  SUBTRACT_CHECKED(" checked - "),
  AND(" & "),
  OR(" | "),
  EXCLUSIVE_OR(" ^ "),
  LEFT_SHIFT(" << "),
  RIGHT_SHIFT(" >> "),
  AND_ALSO(" && "),
  OR_ELSE(" || "),
  EQUAL(" == "),
  NOT_EQUAL(" != "),
  GREATER_THAN_OR_EQUAL(" >= "),
  GREATER_THAN(" > "),
  LESS_THAN(" < "),
  LESS_THAN_OR_EQUAL(" <= "),
  COALESCE(" ?? "),
  ARRAY_INDEX,

  // other closed kinds
  CONDITIONAL,
  CONSTANT,
  INVOKE,
  LAMBDA,
  MEMBER_ACCESS,
  CALL,
  NEW,
  NEW_ARRAY_BOUNDS,
  NEW_ARRAY_INIT,
  MEMBER_INIT,
  LIST_INIT,
  PARAMETER,
  TYPE_IS,
  /** Default value of a type. Representable, but not supported by
   * {@link Shuttle}. */
  DEFAULT,

  // provider-specific leaves
  SUB_QUERY,
  QUERY_SOURCE_REFERENCE,

  /** Any kind outside this enumeration; see {@link ExtensionExpression}. */
  EXTENSION;

  /** Padded name, e.g. " + ", or null if the operator is written as a
   * function call, e.g. "convert(x, Long)". */
  public final @Nullable String padded;

  Op() {
    this(null);
  }

  Op(@Nullable String padded) {
    this.padded = padded;
  }

  /** Returns whether this is the kind of a
   * {@link Expressions.Unary} expression. */
  public boolean isUnary() {
    switch (this) {
    case ARRAY_LENGTH:
    case CONVERT:
    case CONVERT_CHECKED:
    case NEGATE:
    case NEGATE_CHECKED:
    case NOT:
    case QUOTE:
    case TYPE_AS:
    case UNARY_PLUS:
      return true;
    default:
      return false;
    }
  }

  /** Returns whether this is the kind of a
   * {@link Expressions.Binary} expression. */
  public boolean isBinary() {
    return ordinal() >= ADD.ordinal() && ordinal() <= ARRAY_INDEX.ordinal();
  }

  /** Returns whether a binary operator of this kind always yields
   * {@code boolean}. */
  public boolean isPredicate() {
    switch (this) {
    case AND_ALSO:
    case OR_ELSE:
    case EQUAL:
    case NOT_EQUAL:
    case GREATER_THAN_OR_EQUAL:
    case GREATER_THAN:
    case LESS_THAN:
    case LESS_THAN_OR_EQUAL:
      return true;
    default:
      return false;
    }
  }
}

// End Op.java
