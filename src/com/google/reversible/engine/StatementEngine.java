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
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Executes statements in either direction. Running a block backward runs its statements in
 * reverse order, each one inverted.
 *
 * <p>An engine keeps the call depth of one invocation and must not be shared between threads.
 */
final class StatementEngine {

  private static final Logger logger = Logger.getLogger(StatementEngine.class.getName());

  /** The branch of a conditional. */
  private enum Branch {
    THEN,
    ELSE;

    static Branch of(long condition) {
      return condition != 0 ? THEN : ELSE;
    }
  }

  private final ProcedureRegistry registry;
  private final EngineOptions options;
  private final ExpressionEvaluator evaluator;
  private final IntegerDomain domain;

  private int depth = 0;

  StatementEngine(
      ProcedureRegistry registry, EngineOptions options, ExpressionEvaluator evaluator) {
    this.registry = checkNotNull(registry);
    this.options = checkNotNull(options);
    this.evaluator = checkNotNull(evaluator);
    this.domain = options.getIntegerDomain();
  }

  /** Runs {@code procedure} over the given argument slots in a fresh environment. */
  void invoke(Procedure procedure, List<SlotHandle> arguments, Direction direction) {
    if (arguments.size() != procedure.getArity()) {
      throw new EvaluationException(
          LegalityValidator.ARITY_MISMATCH,
          procedure.name(),
          String.valueOf(procedure.getArity()),
          String.valueOf(arguments.size()));
    }
    if (depth >= options.getMaxCallDepth()) {
      throw new EvaluationException(
          RuntimeErrors.CALL_DEPTH_EXCEEDED,
          procedure.name(),
          String.valueOf(options.getMaxCallDepth()));
    }
    depth++;
    try {
      Environment env = new Environment(procedure.name());
      for (int i = 0; i < arguments.size(); i++) {
        env.bind(procedure.parameters().get(i), arguments.get(i));
      }
      executeBlock(procedure.getValidatedBody(), env, direction);
    } finally {
      depth--;
    }
  }

  void executeBlock(Node block, Environment env, Direction direction) {
    if (direction == Direction.FORWARD) {
      for (Node stmt = block.getFirstChild(); stmt != null; stmt = stmt.getNext()) {
        execute(stmt, env, direction);
      }
    } else {
      for (Node stmt = block.getLastChild(); stmt != null; stmt = stmt.getPrevious()) {
        execute(stmt, env, direction);
      }
    }
  }

  /**
   * Executes one statement.
   *
   * @throws ReversibleExecutionException naming the innermost statement that failed
   */
  void execute(Node n, Environment env, Direction direction) {
    if (options.shouldTraceExecution() && logger.isLoggable(Level.FINEST)) {
      logger.log(
          Level.FINEST,
          "{0} {1}: {2}",
          new Object[] {direction, env.getProcedureName(), CodePrinter.toSource(n)});
    }
    try {
      switch (n.getToken()) {
        case ASSIGN_ADD:
        case ASSIGN_SUB:
        case ASSIGN_BITXOR:
          executeAssignment(n, env, direction);
          break;
        case IF:
          executeIf(n, env, direction);
          break;
        case LOOP:
          executeLoop(n, env, direction);
          break;
        case CALL:
          executeCall(n, env, direction);
          break;
        case UNCALL:
          executeCall(n, env, direction.reverse());
          break;
        case SWAP:
          executeSwap(n, env);
          break;
        case LOCAL:
          if (direction == Direction.FORWARD) {
            bindLocal(n.getFirstChild(), n.getFirstChild().getFirstChild(), env);
          } else {
            releaseLocal(n.getFirstChild(), n.getFirstChild().getFirstChild(), env);
          }
          break;
        case DELOCAL:
          if (direction == Direction.FORWARD) {
            releaseLocal(n.getFirstChild(), n.getLastChild(), env);
          } else {
            bindLocal(n.getFirstChild(), n.getLastChild(), env);
          }
          break;
        default:
          throw new IllegalStateException("Unexpected statement " + n.getToken());
      }
    } catch (EvaluationException e) {
      ReversibleExecutionException failure =
          new ReversibleExecutionException(
              ReversibilityError.make(
                  env.getProcedureName(),
                  n,
                  e.getType(),
                  e.getArguments().toArray(new String[0])));
      failure.initCause(e);
      throw failure;
    }
  }

  private void executeAssignment(Node n, Environment env, Direction direction) {
    ReversibleOperator op = checkNotNull(ReversibleOperator.fromToken(n.getToken()));
    if (direction == Direction.BACKWARD) {
      op = op.inverse();
    }
    Node target = n.getFirstChild();
    Environment.ReadContext reads = env.newReadContext();
    SlotHandle slot = resolveScalarTarget(target, reads);
    long operand = evaluator.evaluate(n.getLastChild(), reads);
    AliasChecker.checkNotRead(
        CodePrinter.toSource(target), slot, reads.getReads(), env.getProcedureName());
    env.write(slot, op.apply(domain, env.read(slot), operand));
  }

  private void executeIf(Node n, Environment env, Direction direction) {
    Node guard = n.getFirstChild();
    Node assertion = n.getLastChild();
    if (direction == Direction.FORWARD) {
      Branch taken = Branch.of(evaluate(guard, env));
      executeBlock(getBranch(n, taken), env, direction);
      Branch asserted = Branch.of(evaluate(assertion, env));
      if (asserted != taken) {
        throw mismatch(assertion, taken == Branch.THEN);
      }
    } else {
      Branch taken = Branch.of(evaluate(assertion, env));
      executeBlock(getBranch(n, taken), env, direction);
      if (options.shouldVerifyGuardOnReversal()
          && Branch.of(evaluate(guard, env)) != taken) {
        throw mismatch(guard, taken == Branch.THEN);
      }
    }
  }

  private static Node getBranch(Node ifNode, Branch branch) {
    return branch == Branch.THEN ? ifNode.getSecondChild() : ifNode.getChildAtIndex(2);
  }

  /**
   * Runs {@code from (entry) do ... loop ... until (exit)}. Backward, the roles of the two
   * conditions are exchanged and both blocks run inverted.
   */
  private void executeLoop(Node n, Environment env, Direction direction) {
    Node entry = n.getFirstChild();
    Node exit = n.getLastChild();
    Node doBlock = n.getSecondChild();
    Node loopBlock = n.getChildAtIndex(2);
    if (direction == Direction.BACKWARD) {
      Node swap = entry;
      entry = exit;
      exit = swap;
    }

    requireCondition(entry, true, env);
    executeBlock(doBlock, env, direction);
    while (evaluate(exit, env) == 0) {
      executeBlock(loopBlock, env, direction);
      requireCondition(entry, false, env);
      executeBlock(doBlock, env, direction);
    }
  }

  private void requireCondition(Node condition, boolean expected, Environment env) {
    if ((evaluate(condition, env) != 0) != expected) {
      throw mismatch(condition, expected);
    }
  }

  private static EvaluationException mismatch(Node condition, boolean expected) {
    return new EvaluationException(
        RuntimeErrors.ASSERTION_MISMATCH,
        CodePrinter.toSource(condition),
        String.valueOf(!expected),
        String.valueOf(expected));
  }

  private void executeCall(Node n, Environment env, Direction direction) {
    Procedure callee = registry.lookup(n.getFirstChild().getString());
    Environment.ReadContext reads = env.newReadContext();
    List<String> sources = new ArrayList<>();
    List<SlotHandle> arguments = new ArrayList<>();
    for (Node arg = n.getSecondChild(); arg != null; arg = arg.getNext()) {
      sources.add(CodePrinter.toSource(arg));
      arguments.add(resolveReference(arg, env, reads));
    }
    checkUpdatedSlots(sources, arguments, reads, env);
    invoke(callee, ImmutableList.copyOf(arguments), direction);
  }

  private void executeSwap(Node n, Environment env) {
    Node left = n.getFirstChild();
    Node right = n.getLastChild();
    Environment.ReadContext reads = env.newReadContext();
    SlotHandle a = resolveReference(left, env, reads);
    SlotHandle b = resolveReference(right, env, reads);
    if (a.isArray() != b.isArray() || a.length() != b.length()) {
      throw new EvaluationException(
          RuntimeErrors.SHAPE_MISMATCH,
          CodePrinter.toSource(right),
          "the counterpart of " + describeShape(a),
          describeShape(b));
    }
    checkUpdatedSlots(
        ImmutableList.of(CodePrinter.toSource(left), CodePrinter.toSource(right)),
        ImmutableList.of(a, b),
        reads,
        env);

    if (!a.isArray()) {
      long value = env.read(a);
      env.write(a, env.read(b));
      env.write(b, value);
      return;
    }
    long[] aValues = a.store().getAll(a);
    long[] bValues = b.store().getAll(b);
    for (int i = 0; i < a.length(); i++) {
      env.write(a.element(i), bValues[i]);
      env.write(b.element(i), aValues[i]);
    }
  }

  private static String describeShape(SlotHandle handle) {
    return handle.isArray() ? "an array of length " + handle.length() : "a scalar";
  }

  /**
   * Checks that the slots a statement hands out for update are pairwise disjoint and that none
   * of them was read to compute an index.
   */
  private static void checkUpdatedSlots(
      List<String> sources,
      List<SlotHandle> handles,
      Environment.ReadContext reads,
      Environment env) {
    AliasChecker.checkDisjoint(sources, handles, env.getProcedureName());
    ImmutableList<SlotHandle> indexReads = reads.getReads();
    for (int i = 0; i < handles.size(); i++) {
      AliasChecker.checkNotRead(
          sources.get(i), handles.get(i), indexReads, env.getProcedureName());
    }
  }

  private void bindLocal(Node nameNode, Node value, Environment env) {
    long initial = domain.checkRepresentable(evaluate(value, env));
    env.bindLocal(nameNode.getString(), initial);
  }

  private void releaseLocal(Node nameNode, Node value, Environment env) {
    String name = nameNode.getString();
    long expected = evaluate(value, env);
    long actual = env.read(env.newReadContext().resolveScalar(name));
    if (actual != expected) {
      throw new EvaluationException(
          RuntimeErrors.DELOCAL_MISMATCH,
          name,
          String.valueOf(actual),
          String.valueOf(expected));
    }
    env.unbindLocal(name);
  }

  /** Resolves a scalar update target, recording the reads of its index. */
  private SlotHandle resolveScalarTarget(Node ref, Environment.ReadContext reads) {
    if (ref.isName()) {
      return reads.resolveScalar(ref.getString());
    }
    long index = evaluator.evaluate(ref.getSecondChild(), reads);
    return reads.resolveElement(ref.getFirstChild().getString(), index);
  }

  /** Resolves a reference that may denote a whole array, recording the reads of its index. */
  private SlotHandle resolveReference(Node ref, Environment env, Environment.ReadContext reads) {
    if (ref.isName()) {
      return env.lookup(ref.getString());
    }
    return resolveScalarTarget(ref, reads);
  }

  private long evaluate(Node expr, Environment env) {
    return evaluator.evaluate(expr, env.newReadContext());
  }
}
