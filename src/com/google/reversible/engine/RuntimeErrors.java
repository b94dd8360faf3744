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
 * Static error constants raised while a procedure runs. Any of these ends the invocation that
 * raised it.
 */
public final class RuntimeErrors {

  public static final DiagnosticType ALIAS_VIOLATION =
      DiagnosticType.error(
          "RV_ALIAS_VIOLATION", "{0} and {1} denote overlapping storage in {2}.");

  public static final DiagnosticType ASSERTION_MISMATCH =
      DiagnosticType.error("RV_ASSERTION_MISMATCH", "{0} evaluated to {1}, expected {2}.");

  public static final DiagnosticType UNBOUND_VARIABLE =
      DiagnosticType.error("RV_UNBOUND_VARIABLE", "{0} is not bound.");

  public static final DiagnosticType ARITHMETIC_OVERFLOW =
      DiagnosticType.error("RV_ARITHMETIC_OVERFLOW", "{0} does not fit the {1} domain.");

  public static final DiagnosticType DELOCAL_MISMATCH =
      DiagnosticType.error(
          "RV_DELOCAL_MISMATCH", "Local {0} holds {1} when it is released, expected {2}.");

  public static final DiagnosticType INDEX_OUT_OF_BOUNDS =
      DiagnosticType.error(
          "RV_INDEX_OUT_OF_BOUNDS", "Index {0} is out of bounds for {1} of length {2}.");

  public static final DiagnosticType SHAPE_MISMATCH =
      DiagnosticType.error("RV_SHAPE_MISMATCH", "{0} is used as {1} but is bound to {2}.");

  public static final DiagnosticType DIVISION_BY_ZERO =
      DiagnosticType.error("RV_DIVISION_BY_ZERO", "Division by zero in {0}.");

  public static final DiagnosticType CALL_DEPTH_EXCEEDED =
      DiagnosticType.error(
          "RV_CALL_DEPTH_EXCEEDED", "Calling {0} exceeds the maximum call depth of {1}.");

  private RuntimeErrors() {}
}
