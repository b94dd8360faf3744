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
import static com.google.common.base.Preconditions.checkNotNull;

import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Options for registering and running reversible procedures.
 */
public class EngineOptions implements Serializable {
  private static final long serialVersionUID = 1L;

  /** The domain slot values and update results must fit in. */
  private IntegerDomain integerDomain = IntegerDomain.INT32;

  /** How deeply calls may nest before an invocation fails. */
  private int maxCallDepth = 1000;

  /**
   * Whether a backward conditional re-evaluates its guard after replaying the branch its
   * assertion selected, failing when the two disagree.
   */
  private boolean verifyGuardOnReversal = false;

  /** Whether every executed statement is logged at FINEST. */
  private boolean traceExecution = false;

  // Later entries win.
  private final Map<DiagnosticGroup, CheckLevel> warningLevels = new LinkedHashMap<>();

  public void setIntegerDomain(IntegerDomain integerDomain) {
    this.integerDomain = checkNotNull(integerDomain);
  }

  public IntegerDomain getIntegerDomain() {
    return integerDomain;
  }

  public void setMaxCallDepth(int maxCallDepth) {
    checkArgument(maxCallDepth > 0, "maxCallDepth must be positive: %s", maxCallDepth);
    this.maxCallDepth = maxCallDepth;
  }

  public int getMaxCallDepth() {
    return maxCallDepth;
  }

  public void setVerifyGuardOnReversal(boolean verifyGuardOnReversal) {
    this.verifyGuardOnReversal = verifyGuardOnReversal;
  }

  public boolean shouldVerifyGuardOnReversal() {
    return verifyGuardOnReversal;
  }

  public void setTraceExecution(boolean traceExecution) {
    this.traceExecution = traceExecution;
  }

  public boolean shouldTraceExecution() {
    return traceExecution;
  }

  /**
   * Configures the level diagnostics of a group are reported at. Groups sharing a type with
   * {@link DiagnosticGroups#REVERSIBILITY_RULES}, {@link DiagnosticGroups#LOCALS} or {@link
   * DiagnosticGroups#RUNTIME} may only be set to ERROR.
   */
  public void setWarningLevel(DiagnosticGroup group, CheckLevel level) {
    checkNotNull(group);
    checkNotNull(level);
    checkArgument(
        level == CheckLevel.ERROR || !group.intersects(DiagnosticGroups.ALWAYS_ERRORS),
        "%s contains diagnostics that cannot be reported below ERROR",
        group);
    warningLevels.remove(group);
    warningLevels.put(group, level);
  }

  /** Returns the level a diagnostic of the given type is reported at. */
  CheckLevel getLevel(DiagnosticType type) {
    CheckLevel level = type.level;
    for (Map.Entry<DiagnosticGroup, CheckLevel> entry : warningLevels.entrySet()) {
      if (entry.getKey().matches(type)) {
        level = entry.getValue();
      }
    }
    return level;
  }
}
