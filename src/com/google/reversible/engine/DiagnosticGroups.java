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

import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Named groups of DiagnosticTypes exposed by the engine.
 */
public final class DiagnosticGroups {

  private DiagnosticGroups() {}

  private static final Map<String, DiagnosticGroup> groupsByName = new LinkedHashMap<>();

  static DiagnosticGroup registerGroup(String name, DiagnosticType... types) {
    DiagnosticGroup group = new DiagnosticGroup(name, types);
    groupsByName.put(name, group);
    return group;
  }

  static DiagnosticGroup registerGroup(String name, DiagnosticGroup... groups) {
    DiagnosticGroup group = new DiagnosticGroup(name, groups);
    groupsByName.put(name, group);
    return group;
  }

  /** Get the registered diagnostic groups, indexed by name. */
  public static ImmutableMap<String, DiagnosticGroup> getRegisteredGroups() {
    return ImmutableMap.copyOf(groupsByName);
  }

  /** Find the diagnostic group registered under the given name. */
  public static @Nullable DiagnosticGroup forName(String name) {
    return groupsByName.get(name);
  }

  /** The rules that make a procedure invertible. These cannot be downgraded from errors. */
  public static final DiagnosticGroup REVERSIBILITY_RULES =
      registerGroup(
          "reversibilityRules",
          LegalityValidator.ILLEGAL_OPERATOR,
          LegalityValidator.SELF_ALIASED_ASSIGNMENT,
          LegalityValidator.NON_REVERSIBLE_CALL,
          LegalityValidator.ARITY_MISMATCH,
          LegalityValidator.MALFORMED_NODE,
          ProcedureRegistry.DUPLICATE_PROCEDURE);

  public static final DiagnosticGroup LOCALS =
      registerGroup(
          "locals",
          LegalityValidator.UNMATCHED_LOCAL,
          LegalityValidator.DELOCAL_WITHOUT_LOCAL,
          LegalityValidator.DUPLICATE_BINDING,
          LegalityValidator.DUPLICATE_PARAMETER);

  public static final DiagnosticGroup CONSTANT_ASSERTION =
      registerGroup("constantAssertion", LegalityValidator.CONSTANT_ASSERTION);

  public static final DiagnosticGroup VALIDATION =
      registerGroup("validation", REVERSIBILITY_RULES, LOCALS, CONSTANT_ASSERTION);

  public static final DiagnosticGroup ALIASING =
      registerGroup("aliasing", RuntimeErrors.ALIAS_VIOLATION);

  public static final DiagnosticGroup RUNTIME =
      registerGroup(
          "runtime",
          RuntimeErrors.ALIAS_VIOLATION,
          RuntimeErrors.ASSERTION_MISMATCH,
          RuntimeErrors.UNBOUND_VARIABLE,
          RuntimeErrors.ARITHMETIC_OVERFLOW,
          RuntimeErrors.DELOCAL_MISMATCH,
          RuntimeErrors.INDEX_OUT_OF_BOUNDS,
          RuntimeErrors.SHAPE_MISMATCH,
          RuntimeErrors.DIVISION_BY_ZERO,
          RuntimeErrors.CALL_DEPTH_EXCEEDED,
          LegalityValidator.ARITY_MISMATCH);

  /**
   * The diagnostics that are errors whatever the options say. Only the levels of the remaining
   * groups may be changed.
   */
  static final DiagnosticGroup ALWAYS_ERRORS =
      new DiagnosticGroup("alwaysErrors", REVERSIBILITY_RULES, LOCALS, RUNTIME);
}
