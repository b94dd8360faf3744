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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

/**
 * Thrown when a procedure definition breaks a legality rule. Nothing from the failed
 * registration is kept.
 */
public final class ProcedureValidationException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final ImmutableList<ReversibilityError> errors;

  ProcedureValidationException(ImmutableList<ReversibilityError> errors) {
    super(Joiner.on('\n').join(errors));
    checkArgument(!errors.isEmpty(), "no errors to report");
    this.errors = errors;
  }

  /** All error-level diagnostics, sorted by location. */
  public ImmutableList<ReversibilityError> getErrors() {
    return errors;
  }

  /** Returns whether any of the errors has the given type. */
  public boolean hasErrorOfType(DiagnosticType type) {
    for (ReversibilityError error : errors) {
      if (error.type().equals(type)) {
        return true;
      }
    }
    return false;
  }
}
