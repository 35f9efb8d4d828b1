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
package net.hydromatic.relinq.util;

import java.util.Locale;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Utilities. */
public class Static {
  private Static() {}

  /**
   * Whether to log each expression that a shuttle rebuilds.
   *
   * <p>To enable, add "-Drelinq.traceRewrites" to java's command-line
   * arguments.
   */
  public static final boolean TRACE_REWRITES =
      getBooleanProperty("relinq.traceRewrites", false);

  /**
   * Returns the value of a system property, converted into a boolean value.
   *
   * <p>Values "", "true", "TRUE" and "1" are treated as true; "false", "FALSE"
   * and "0" treated as false; for {@code null} and other values, returns {@code
   * defaultVal}.
   */
  public static boolean getBooleanProperty(String prop, boolean defaultVal) {
    return toBoolean(System.getProperty(prop), defaultVal);
  }

  /** Converts a property value to a boolean; see
   * {@link #getBooleanProperty(String, boolean)}. */
  @SuppressWarnings("SimplifiableConditionalExpression")
  static boolean toBoolean(@Nullable String value, boolean defaultVal) {
    if (value == null) {
      return defaultVal;
    }
    final String low = value.toLowerCase(Locale.ROOT);
    return low.equals("true") || low.equals("1") || low.isEmpty()
        ? true
        : low.equals("false") || low.equals("0") ? false : defaultVal;
  }
}

// End Static.java
