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
import com.google.reversible.ir.Node;

/**
 * The entry point for hosts: registers reversible procedures and runs them forward or backward
 * over slots the host allocated.
 *
 * <pre>{@code
 * ReversibleInterpreter interpreter = new ReversibleInterpreter();
 * interpreter.registerProcedure(fibDefinition);
 * SlotStore store = new SlotStore();
 * SlotHandle x1 = store.allocate(0);
 * ...
 * interpreter.runForward("fib", x1, x2, n);
 * interpreter.runBackward("fib", x1, x2, n);
 * }</pre>
 *
 * <p>Procedures may be run concurrently from several threads as long as the invocations work on
 * disjoint stores. The options must not be changed once the interpreter is created.
 */
public final class ReversibleInterpreter {

  private final EngineOptions options;
  private final ExpressionEvaluator evaluator;
  private final ProcedureRegistry registry;

  public ReversibleInterpreter() {
    this(new EngineOptions());
  }

  public ReversibleInterpreter(EngineOptions options) {
    this(options, new DefaultExpressionEvaluator());
  }

  public ReversibleInterpreter(EngineOptions options, ExpressionEvaluator evaluator) {
    this.options = checkNotNull(options);
    this.evaluator = checkNotNull(evaluator);
    this.registry = new ProcedureRegistry(options);
  }

  /**
   * Validates and registers a procedure definition.
   *
   * @return the name the procedure is run by
   * @throws ProcedureValidationException if the definition breaks a legality rule
   */
  public String registerProcedure(Node definition) {
    return registry.register(definition).name();
  }

  /**
   * Validates and registers mutually recursive procedure definitions, all of them or none.
   *
   * @return the names of the registered procedures, in order
   */
  public ImmutableList<String> registerProcedures(Node... definitions) {
    ImmutableList.Builder<String> names = ImmutableList.builder();
    for (Procedure procedure : registry.registerAll(definitions)) {
      names.add(procedure.name());
    }
    return names.build();
  }

  /**
   * Runs a procedure forward.
   *
   * @throws ReversibleExecutionException if the run fails
   */
  public void runForward(String name, SlotHandle... arguments) {
    newInvocation(name, Direction.FORWARD, arguments).run();
  }

  /**
   * Runs a procedure backward, undoing a forward run over the same slots.
   *
   * @throws ReversibleExecutionException if the run fails
   */
  public void runBackward(String name, SlotHandle... arguments) {
    newInvocation(name, Direction.BACKWARD, arguments).run();
  }

  /** Prepares an invocation without running it. */
  public Invocation newInvocation(String name, Direction direction, SlotHandle... arguments) {
    return new Invocation(
        registry,
        options,
        evaluator,
        registry.lookup(name),
        direction,
        ImmutableList.copyOf(arguments));
  }

  public ProcedureRegistry getRegistry() {
    return registry;
  }

  public EngineOptions getOptions() {
    return options;
  }
}
