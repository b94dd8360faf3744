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
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * One run of a registered procedure over caller-supplied slots, in one direction.
 *
 * <p>An invocation goes from {@link State#READY} through {@link State#RUNNING} to either {@link
 * State#COMPLETED} or {@link State#FAILED}, and runs at most once. Any failure, including an
 * unexpected exception, invalidates every store the arguments live in.
 */
public final class Invocation {

  private static final Logger logger = Logger.getLogger(Invocation.class.getName());

  /** The lifecycle of an invocation. */
  public enum State {
    READY,
    RUNNING,
    COMPLETED,
    FAILED
  }

  private final Procedure procedure;
  private final Direction direction;
  private final ImmutableList<SlotHandle> arguments;
  private final EngineOptions options;
  private final StatementEngine engine;

  private volatile State state = State.READY;
  private volatile @Nullable ReversibleExecutionException failure;

  Invocation(
      ProcedureRegistry registry,
      EngineOptions options,
      ExpressionEvaluator evaluator,
      Procedure procedure,
      Direction direction,
      List<SlotHandle> arguments) {
    this.procedure = checkNotNull(procedure);
    this.direction = checkNotNull(direction);
    this.arguments = ImmutableList.copyOf(arguments);
    this.options = checkNotNull(options);
    this.engine = new StatementEngine(registry, options, evaluator);
  }

  /**
   * Runs the procedure.
   *
   * @throws ReversibleExecutionException if the run fails; the argument stores are then
   *     invalidated
   * @throws IllegalStateException if this invocation already ran, or an argument lives in an
   *     invalidated store
   */
  public void run() {
    checkState(state == State.READY, "%s already ran: %s", this, state);
    for (SlotHandle argument : arguments) {
      checkState(
          !argument.store().isInvalidated(),
          "%s is in a store left unspecified by a failed invocation; restore it first",
          argument);
    }
    state = State.RUNNING;
    logger.log(Level.FINE, "Running {0}", this);

    try {
      checkArguments();
      engine.invoke(procedure, arguments, direction);
    } catch (EvaluationException e) {
      ReversibleExecutionException wrapped =
          new ReversibleExecutionException(
              new ReversibilityError(
                  e.getType(),
                  e.getMessage(),
                  procedure.name(),
                  null,
                  null,
                  -1,
                  -1,
                  e.getType().level));
      wrapped.initCause(e);
      throw fail(wrapped);
    } catch (ReversibleExecutionException e) {
      throw fail(e);
    } catch (RuntimeException | Error e) {
      abort(e);
      throw e;
    }

    state = State.COMPLETED;
    logger.log(Level.FINE, "Completed {0}", this);
  }

  /** Checks the arity, the exclusivity and the domain of the caller's slots. */
  private void checkArguments() {
    if (arguments.size() != procedure.getArity()) {
      throw new EvaluationException(
          LegalityValidator.ARITY_MISMATCH,
          procedure.name(),
          String.valueOf(procedure.getArity()),
          String.valueOf(arguments.size()));
    }
    AliasChecker.checkDisjoint(procedure.parameters(), arguments, procedure.name());
    IntegerDomain domain = options.getIntegerDomain();
    for (SlotHandle argument : arguments) {
      for (long value : argument.store().getAll(argument)) {
        domain.checkRepresentable(value);
      }
    }
  }

  private ReversibleExecutionException fail(ReversibleExecutionException e) {
    failure = e;
    invalidateStores();
    logger.log(Level.WARNING, "Failed " + this + ": " + e.getError(), e);
    return e;
  }

  /** Records a failure that is not a rule violation, such as a stack overflow. */
  private void abort(Throwable t) {
    invalidateStores();
    logger.log(Level.SEVERE, "Aborted " + this, t);
  }

  private void invalidateStores() {
    for (SlotStore store : getStores()) {
      store.invalidate();
    }
    state = State.FAILED;
  }

  private List<SlotStore> getStores() {
    Map<SlotStore, Boolean> stores = new IdentityHashMap<>();
    for (SlotHandle argument : arguments) {
      stores.put(argument.store(), true);
    }
    return new ArrayList<>(stores.keySet());
  }

  public State getState() {
    return state;
  }

  /**
   * Returns the error the invocation failed with, or null if it did not fail or was aborted by
   * an unexpected exception.
   */
  public @Nullable ReversibleExecutionException getFailure() {
    return failure;
  }

  public Procedure getProcedure() {
    return procedure;
  }

  public Direction getDirection() {
    return direction;
  }

  public ImmutableList<SlotHandle> getArguments() {
    return arguments;
  }

  @Override
  public String toString() {
    return direction + " " + procedure.name() + arguments;
  }
}
