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

/**
 * Thrown when an invocation fails. The storage the invocation touched is left in an unspecified
 * state and must not be run again, in either direction, until it is restored.
 */
public final class ReversibleExecutionException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final ReversibilityError error;

  ReversibleExecutionException(ReversibilityError error) {
    super(error.toString());
    this.error = checkNotNull(error);
  }

  public ReversibilityError getError() {
    return error;
  }

  public DiagnosticType getType() {
    return error.type();
  }
}
