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

/**
 * Read-only view of an invocation's bindings handed to an {@link ExpressionEvaluator}.
 *
 * <p>Every read goes through this interface so that the engine knows which slots an expression
 * depended on. Failed reads throw {@link EvaluationException}.
 */
public interface EvaluationContext {

  /** Reads a scalar binding. */
  long read(String name);

  /** Reads element {@code index} of an array binding. */
  long readElement(String name, long index);
}
