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

import static com.google.common.base.Strings.emptyToNull;
import static java.util.Objects.requireNonNull;

import com.google.reversible.ir.Node;
import org.jspecify.annotations.Nullable;

/**
 * A validation or execution error.
 *
 * @param type A type of the error.
 * @param description Description of the error.
 * @param procedureName Name of the procedure the error was found in, if any.
 * @param node The offending statement or expression, if any.
 * @param sourceName Name of the source the node was parsed from.
 * @param lineno One-indexed line number of the error location.
 * @param charno Zero-indexed character number of the error location.
 * @param defaultLevel The default level, before any options are applied.
 */
public record ReversibilityError(
    DiagnosticType type,
    String description,
    @Nullable String procedureName,
    @Nullable Node node,
    @Nullable String sourceName,
    int lineno,
    int charno,
    CheckLevel defaultLevel) {
  public ReversibilityError {
    requireNonNull(type, "type");
    requireNonNull(description, "description");
    requireNonNull(defaultLevel, "defaultLevel");
  }

  /**
   * Creates a ReversibilityError with no location.
   *
   * @param type The DiagnosticType
   * @param arguments Arguments to be incorporated into the message
   */
  public static ReversibilityError make(DiagnosticType type, String... arguments) {
    return new ReversibilityError(
        type, type.format(arguments), null, null, null, -1, -1, type.level);
  }

  /**
   * Creates a ReversibilityError located at a node of a procedure.
   *
   * @param procedureName The procedure the node belongs to
   * @param n Determines the line and char position and source file name
   * @param type The DiagnosticType
   * @param arguments Arguments to be incorporated into the message
   */
  public static ReversibilityError make(
      @Nullable String procedureName, Node n, DiagnosticType type, String... arguments) {
    return new ReversibilityError(
        type,
        type.format(arguments),
        procedureName,
        n,
        n.getSourceFileName(),
        n.getLineno(),
        n.getCharno(),
        type.level);
  }

  /** @return the default rendering of an error as text. */
  @Override
  public String toString() {
    String source = emptyToNull(sourceName) != null ? sourceName : "(unknown source)";
    String line = lineno != -1 ? String.valueOf(lineno) : "(unknown line)";
    String column = charno != -1 ? String.valueOf(charno) : "(unknown column)";
    String where = procedureName != null ? " in " + procedureName : "";

    return type.key
        + ". "
        + description
        + where
        + " at "
        + source
        + " line "
        + line
        + " : "
        + column;
  }
}
