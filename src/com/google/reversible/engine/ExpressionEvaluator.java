/*
 * Copyright 2024 The Closure Compiler Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.reversible.engine;

import com.google.reversible.ir.Node;

/**
 * Evaluates the read-only expressions of a procedure: right-hand sides, guards, assertions,
 * loop conditions, array indices.
 *
 * <p>Implementations must be pure. They may only observe storage through the given context and
 * must return the same value for the same bindings. The legality checks guarantee that the
 * expressions passed in contain no mutating operator and no call.
 */
public interface ExpressionEvaluator {

  /**
   * @param expr the expression to evaluate
   * @param context the bindings visible to the expression
   * @return the value, where relational and logical operators yield 1 or 0
   * @throws EvaluationException if the expression cannot be evaluated
   */
  long evaluate(Node expr, EvaluationContext context);
}
