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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;

/**
 * Signals that an expression, a storage access or an arithmetic step could not be completed.
 *
 * <p>These carry no location. The statement engine attaches the statement being executed and
 * rethrows them as {@link ReversibleExecutionException}s. {@link ExpressionEvaluator}
 * implementations report their failures with this type.
 */
public final class EvaluationException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final DiagnosticType type;
  private final ImmutableList<String> arguments;

  public EvaluationException(DiagnosticType type, String... arguments) {
    super(type.format(arguments));
    this.type = checkNotNull(type);
    this.arguments = ImmutableList.copyOf(arguments);
  }

  public DiagnosticType getType() {
    return type;
  }

  public ImmutableList<String> getArguments() {
    return arguments;
  }
}
