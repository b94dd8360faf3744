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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.reversible.ir.Node;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Holds the reversible procedures calls may target. A definition is validated once, when it is
 * registered, and is immutable from then on.
 *
 * <p>Lookups may run concurrently with each other and with registrations.
 */
public final class ProcedureRegistry {

  private static final Logger logger = Logger.getLogger(ProcedureRegistry.class.getName());

  public static final DiagnosticType DUPLICATE_PROCEDURE =
      DiagnosticType.error(
          "RV_DUPLICATE_PROCEDURE", "A procedure named {0} is already registered.");

  private final EngineOptions options;
  private final ConcurrentMap<String, Procedure> procedures = new ConcurrentHashMap<>();

  public ProcedureRegistry(EngineOptions options) {
    this.options = checkNotNull(options);
  }

  /**
   * Validates and registers one procedure.
   *
   * @throws ProcedureValidationException if the definition breaks a legality rule
   */
  @CanIgnoreReturnValue
  public Procedure register(Node definition) {
    return registerAll(definition).get(0);
  }

  /**
   * Validates a group of procedures together, so that they may call each other, and registers
   * all of them or none.
   *
   * @throws ProcedureValidationException if any definition breaks a legality rule
   */
  @CanIgnoreReturnValue
  public synchronized ImmutableList<Procedure> registerAll(Node... definitions) {
    checkArgument(definitions.length > 0, "nothing to register");
    ErrorManager errorManager = new LoggerErrorManager(logger);

    Map<String, Integer> signatures = new HashMap<>();
    for (Procedure procedure : procedures.values()) {
      signatures.put(procedure.name(), procedure.getArity());
    }

    ImmutableList.Builder<Node> copies = ImmutableList.builder();
    Set<String> groupNames = new HashSet<>();
    for (Node definition : definitions) {
      Node copy = definition.cloneTree();
      copies.add(copy);
      if (!hasProcedureHeader(copy)) {
        // Reported by the validator.
        continue;
      }
      String name = copy.getFirstChild().getString();
      if (procedures.containsKey(name) || !groupNames.add(name)) {
        errorManager.report(
            options.getLevel(DUPLICATE_PROCEDURE),
            ReversibilityError.make(name, copy, DUPLICATE_PROCEDURE, name));
      } else {
        signatures.put(name, copy.getSecondChild().getChildCount());
      }
    }

    List<Node> validated = copies.build();
    LegalityValidator validator = new LegalityValidator(errorManager, options, signatures);
    for (Node copy : validated) {
      validator.validate(copy);
    }
    errorManager.generateReport();
    if (errorManager.hasErrors()) {
      throw new ProcedureValidationException(errorManager.getErrors());
    }

    ImmutableList.Builder<Procedure> registered = ImmutableList.builder();
    for (Node copy : validated) {
      Procedure procedure = Procedure.fromDefinition(copy);
      procedures.put(procedure.name(), procedure);
      registered.add(procedure);
      logger.info("Registered " + procedure);
    }
    return registered.build();
  }

  private static boolean hasProcedureHeader(Node n) {
    return n.isProcedure()
        && n.getChildCount() == 3
        && n.getFirstChild().isName()
        && n.getSecondChild().isParamList();
  }

  public boolean isRegistered(String name) {
    return procedures.containsKey(name);
  }

  public @Nullable Procedure getProcedure(String name) {
    return procedures.get(name);
  }

  /** Returns the procedure registered under {@code name}, failing if there is none. */
  Procedure lookup(String name) {
    Procedure procedure = procedures.get(name);
    checkArgument(procedure != null, "No procedure named %s is registered", name);
    return procedure;
  }

  public ImmutableSortedSet<String> getProcedureNames() {
    return ImmutableSortedSet.copyOf(procedures.keySet());
  }
}
