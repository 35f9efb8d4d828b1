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
package net.hydromatic.relinq.rewrite;

import static java.util.Objects.requireNonNull;

import java.util.Map;
import net.hydromatic.relinq.ast.Expression;
import net.hydromatic.relinq.ast.Expressions;
import net.hydromatic.relinq.ast.Shuttle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replaces parameters with expressions.
 *
 * <p>Parameters are matched by identity; a different parameter with the same
 * name is not replaced. The replacements are not themselves visited.
 */
public class Replacer extends Shuttle {
  private static final Logger LOGGER = LoggerFactory.getLogger(Replacer.class);

  protected final Map<Expressions.Parameter, ? extends Expression>
      substitution;

  private Replacer(
      Map<Expressions.Parameter, ? extends Expression> substitution) {
    this.substitution = requireNonNull(substitution);
  }

  /** Replaces parameters in an expression. Returns the expression itself if
   * none of the parameters occur. */
  public static Expression substitute(
      Map<Expressions.Parameter, ? extends Expression> substitution,
      Expression exp) {
    requireNonNull(exp, "exp");
    if (substitution.isEmpty()) {
      return exp;
    }
    LOGGER.debug("substituting {} in {}", substitution, exp);
    final Replacer replacer = new Replacer(substitution);
    return requireNonNull(replacer.visitExpression(exp));
  }

  @Override
  protected Expression visit(Expressions.Parameter parameter) {
    final Expression exp = substitution.get(parameter);
    return exp != null ? exp : parameter;
  }
}

// End Replacer.java
