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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.reversible.ir.IR;
import com.google.reversible.ir.Node;
import com.google.reversible.ir.Token;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Runs whole procedures through {@link ReversibleInterpreter}, in both directions. */
@RunWith(JUnit4.class)
public final class ReversibleInterpreterTest {

  private EngineOptions options;
  private ReversibleInterpreter interpreter;
  private SlotStore store;

  @Before
  public void setUp() {
    options = new EngineOptions();
    interpreter = new ReversibleInterpreter(options);
    store = new SlotStore();
  }

  private static Node name(String name) {
    return IR.name(name);
  }

  private static Node number(long value) {
    return IR.number(value);
  }

  private static Node elem(String array, Node index) {
    return IR.getelem(IR.name(array), index);
  }

  private static Node procedure(String name, ImmutableList<String> params, Node... statements) {
    return IR.procedure(name, params, IR.block(statements));
  }

  private static Node fib() {
    return procedure(
        "fib",
        ImmutableList.of("x1", "x2", "n"),
        IR.ifNode(
            IR.eq(name("n"), number(0)),
            IR.block(IR.addAssign(name("x1"), number(1)), IR.addAssign(name("x2"), number(1))),
            IR.block(
                IR.subAssign(name("n"), number(1)),
                IR.call(name("fib"), name("x1"), name("x2"), name("n")),
                IR.addAssign(name("x1"), name("x2")),
                IR.swap(name("x1"), name("x2"))),
            IR.eq(name("x1"), name("x2"))));
  }

  private ReversibleExecutionException assertFails(
      DiagnosticType type, String procedure, SlotHandle... args) {
    ReversibleExecutionException e =
        assertThrows(
            ReversibleExecutionException.class, () -> interpreter.runForward(procedure, args));
    assertThat(e.getType()).isEqualTo(type);
    return e;
  }

  @Test
  public void testFibonacci() {
    interpreter.registerProcedure(fib());
    SlotHandle x1 = store.allocate(0);
    SlotHandle x2 = store.allocate(0);
    SlotHandle n = store.allocate(10);

    interpreter.runForward("fib", x1, x2, n);
    assertThat(store.get(x1)).isEqualTo(89);
    assertThat(store.get(x2)).isEqualTo(144);
    assertThat(store.get(n)).isEqualTo(0);

    interpreter.runBackward("fib", x1, x2, n);
    assertThat(store.get(x1)).isEqualTo(0);
    assertThat(store.get(x2)).isEqualTo(0);
    assertThat(store.get(n)).isEqualTo(10);
  }

  @Test
  public void testRoundTrip() {
    interpreter.registerProcedure(
        procedure(
            "mix",
            ImmutableList.of("a", "b", "c"),
            IR.addAssign(name("a"), IR.mul(name("b"), number(3))),
            IR.xorAssign(name("c"), IR.add(name("a"), name("b"))),
            IR.subAssign(name("b"), IR.hook(IR.gt(name("c"), number(10)), name("c"), number(7))),
            IR.addAssign(name("a"), IR.rsh(name("c"), number(1)))));
    SlotHandle a = store.allocate(5);
    SlotHandle b = store.allocate(-12);
    SlotHandle c = store.allocate(99);

    interpreter.runForward("mix", a, b, c);
    long[] after = {store.get(a), store.get(b), store.get(c)};
    assertThat(after).isNotEqualTo(new long[] {5, -12, 99});

    interpreter.runBackward("mix", a, b, c);
    assertThat(store.get(a)).isEqualTo(5);
    assertThat(store.get(b)).isEqualTo(-12);
    assertThat(store.get(c)).isEqualTo(99);
  }

  @Test
  public void testXorIsItsOwnInverse() {
    interpreter.registerProcedure(
        procedure("flip", ImmutableList.of("a", "b"), IR.xorAssign(name("a"), name("b"))));
    SlotHandle a = store.allocate(0b1100);
    SlotHandle b = store.allocate(0b1010);

    interpreter.runForward("flip", a, b);
    assertThat(store.get(a)).isEqualTo(0b0110);
    interpreter.runForward("flip", a, b);
    assertThat(store.get(a)).isEqualTo(0b1100);
  }

  @Test
  public void testBackwardOfForwardIsIdentityForCalls() {
    interpreter.registerProcedure(
        procedure("addOne", ImmutableList.of("a"), IR.addAssign(name("a"), number(1))));
    interpreter.registerProcedure(
        procedure(
            "subTwo",
            ImmutableList.of("a"),
            IR.uncall(name("addOne"), name("a")),
            IR.uncall(name("addOne"), name("a"))));
    SlotHandle a = store.allocate(10);

    interpreter.runForward("subTwo", a);
    assertThat(store.get(a)).isEqualTo(8);
    interpreter.runBackward("subTwo", a);
    assertThat(store.get(a)).isEqualTo(10);
  }

  @Test
  public void testOverflowAtDomainMaximum() {
    interpreter.registerProcedure(
        procedure("add", ImmutableList.of("a", "b"), IR.addAssign(name("a"), name("b"))));
    SlotHandle a = store.allocate(Integer.MAX_VALUE);
    SlotHandle b = store.allocate(1);

    ReversibleExecutionException e = assertFails(RuntimeErrors.ARITHMETIC_OVERFLOW, "add", a, b);
    assertThat(e.getError().procedureName()).isEqualTo("add");
    assertThat(e.getError().node().isEquivalentTo(IR.addAssign(name("a"), name("b")))).isTrue();
    assertThat(store.isInvalidated()).isTrue();
  }

  @Test
  public void testOverflowInNarrowDomain() {
    options.setIntegerDomain(IntegerDomain.UINT8);
    interpreter.registerProcedure(
        procedure("dec", ImmutableList.of("a"), IR.subAssign(name("a"), number(1))));
    assertFails(RuntimeErrors.ARITHMETIC_OVERFLOW, "dec", store.allocate(0));
  }

  @Test
  public void testArgumentOutsideDomain() {
    options.setIntegerDomain(IntegerDomain.INT8);
    interpreter.registerProcedure(
        procedure("inc", ImmutableList.of("a"), IR.addAssign(name("a"), number(1))));
    SlotHandle a = store.allocate(300);

    assertFails(RuntimeErrors.ARITHMETIC_OVERFLOW, "inc", a);
    assertThat(store.get(a)).isEqualTo(300);
  }

  @Test
  public void testAssertionMustMatchBranchTaken() {
    interpreter.registerProcedure(
        procedure(
            "p",
            ImmutableList.of("a", "b"),
            IR.ifNode(
                IR.eq(name("a"), number(0)),
                IR.block(IR.addAssign(name("a"), number(1))),
                IR.eq(name("b"), number(0)))));

    ReversibleExecutionException e =
        assertFails(RuntimeErrors.ASSERTION_MISMATCH, "p", store.allocate(0), store.allocate(1));
    assertThat(e.getError().node().isIf()).isTrue();
    assertThat(e.getError().description()).isEqualTo("b == 0 evaluated to false, expected true.");
  }

  private void registerGuardedIncrement() {
    interpreter.registerProcedure(
        procedure(
            "p",
            ImmutableList.of("a", "b"),
            IR.ifNode(
                IR.eq(name("a"), number(0)),
                IR.block(IR.addAssign(name("b"), number(1))),
                IR.eq(name("b"), number(1)))));
  }

  @Test
  public void testBackwardTrustsAssertion() {
    registerGuardedIncrement();
    SlotHandle a = store.allocate(0);
    SlotHandle b = store.allocate(0);
    interpreter.runForward("p", a, b);
    assertThat(store.get(b)).isEqualTo(1);

    store.set(a, 5);
    interpreter.runBackward("p", a, b);
    assertThat(store.get(b)).isEqualTo(0);
  }

  @Test
  public void testVerifyGuardOnReversal() {
    options.setVerifyGuardOnReversal(true);
    registerGuardedIncrement();
    SlotHandle a = store.allocate(0);
    SlotHandle b = store.allocate(0);
    interpreter.runForward("p", a, b);

    store.set(a, 5);
    ReversibleExecutionException e =
        assertThrows(
            ReversibleExecutionException.class, () -> interpreter.runBackward("p", a, b));
    assertThat(e.getType()).isEqualTo(RuntimeErrors.ASSERTION_MISMATCH);
  }

  @Test
  public void testNonReversibleCallRejectedAtRegistration() {
    ProcedureValidationException e =
        assertThrows(
            ProcedureValidationException.class,
            () ->
                interpreter.registerProcedure(
                    procedure("p", ImmutableList.of("a"), IR.call(name("print"), name("a")))));
    assertThat(e.hasErrorOfType(LegalityValidator.NON_REVERSIBLE_CALL)).isTrue();
    assertThat(interpreter.getRegistry().isRegistered("p")).isFalse();
  }

  @Test
  public void testSelfAliasedAssignmentRejectedAtRegistration() {
    ProcedureValidationException e =
        assertThrows(
            ProcedureValidationException.class,
            () ->
                interpreter.registerProcedure(
                    procedure(
                        "alias", ImmutableList.of("x"), IR.subAssign(name("x"), name("x")))));
    assertThat(e.hasErrorOfType(LegalityValidator.SELF_ALIASED_ASSIGNMENT)).isTrue();
  }

  @Test
  public void testArrayElementAliasDetectedAtRunTime() {
    interpreter.registerProcedure(
        procedure(
            "alias",
            ImmutableList.of("arr"),
            IR.local(name("i"), number(42)),
            IR.subAssign(elem("arr", number(42)), elem("arr", name("i"))),
            IR.delocal(name("i"), number(42))));
    SlotHandle arr = store.allocateArray(100);

    ReversibleExecutionException e = assertFails(RuntimeErrors.ALIAS_VIOLATION, "alias", arr);
    assertThat(e.getError().description()).startsWith("arr[42] and ");
  }

  @Test
  public void testDistinctElementsDoNotAlias() {
    interpreter.registerProcedure(
        procedure(
            "shift",
            ImmutableList.of("arr", "i"),
            IR.addAssign(elem("arr", number(0)), elem("arr", name("i")))));
    SlotHandle arr = store.allocateArray(1, 2, 3);
    SlotHandle i = store.allocate(2);

    interpreter.runForward("shift", arr, i);
    assertThat(store.getAll(arr)).asList().containsExactly(4L, 2L, 3L).inOrder();
  }

  @Test
  public void testAliasedArgumentsRejected() {
    interpreter.registerProcedure(
        procedure("aliasArg", ImmutableList.of("x", "y"), IR.addAssign(name("x"), name("y"))));
    SlotHandle x = store.allocate(1);

    ReversibleExecutionException e = assertFails(RuntimeErrors.ALIAS_VIOLATION, "aliasArg", x, x);
    assertThat(e.getError().description())
        .isEqualTo("x and y denote overlapping storage in aliasArg.");
    assertThat(store.get(x)).isEqualTo(1);
  }

  @Test
  public void testArrayAndItsElementAlias() {
    interpreter.registerProcedure(
        procedure(
            "p",
            ImmutableList.of("arr", "x"),
            IR.addAssign(elem("arr", number(0)), name("x"))));
    SlotHandle arr = store.allocateArray(3);

    assertFails(RuntimeErrors.ALIAS_VIOLATION, "p", arr, arr.element(1));
  }

  @Test
  public void testCallArgumentsMustBeDistinct() {
    interpreter.registerProcedure(
        procedure("add", ImmutableList.of("a", "b"), IR.addAssign(name("a"), name("b"))));
    interpreter.registerProcedure(
        procedure(
            "p",
            ImmutableList.of("arr", "i", "j"),
            IR.call(name("add"), elem("arr", name("i")), elem("arr", name("j")))));
    SlotHandle arr = store.allocateArray(5);

    interpreter.runForward("p", arr, store.allocate(0), store.allocate(1));

    ReversibleExecutionException e =
        assertFails(RuntimeErrors.ALIAS_VIOLATION, "p", arr, store.allocate(2), store.allocate(2));
    assertThat(e.getError().node().isCall()).isTrue();
  }

  @Test
  public void testCallArgumentMayNotBeReadAsIndex() {
    interpreter.registerProcedure(
        procedure("add", ImmutableList.of("a", "b"), IR.addAssign(name("a"), name("b"))));
    interpreter.registerProcedure(
        procedure(
            "p",
            ImmutableList.of("arr", "i"),
            IR.call(name("add"), name("i"), elem("arr", name("i")))));

    assertFails(RuntimeErrors.ALIAS_VIOLATION, "p", store.allocateArray(3), store.allocate(0));
  }

  private static Node scary() {
    return procedure(
        "scary",
        ImmutableList.of("arr", "payload"),
        IR.local(name("i"), number(0)),
        IR.loop(
            IR.eq(name("i"), number(0)),
            IR.block(
                IR.addAssign(elem("arr", name("i")), elem("payload", name("i"))),
                IR.addAssign(name("i"), number(1))),
            IR.eq(name("i"), number(2048))),
        IR.delocal(name("i"), number(2048)));
  }

  @Test
  public void testLoopOverArrays() {
    interpreter.registerProcedure(scary());
    long[] fortyTwos = new long[2048];
    Arrays.fill(fortyTwos, 42);
    SlotHandle arr = store.allocateArray(2048);
    SlotHandle payload = store.allocateArray(fortyTwos);

    interpreter.runForward("scary", arr, payload);
    assertThat(store.getAll(arr)).isEqualTo(fortyTwos);

    interpreter.runBackward("scary", arr, payload);
    assertThat(store.getAll(arr)).isEqualTo(new long[2048]);
    assertThat(store.getAll(payload)).isEqualTo(fortyTwos);
  }

  @Test
  public void testIndexOutOfBounds() {
    interpreter.registerProcedure(scary());
    ReversibleExecutionException e =
        assertFails(
            RuntimeErrors.INDEX_OUT_OF_BOUNDS,
            "scary",
            store.allocateArray(1024),
            store.allocateArray(2048));
    assertThat(e.getError().description())
        .isEqualTo("Index 1024 is out of bounds for arr of length 1024.");
  }

  @Test
  public void testLoopEntryConditionChecked() {
    interpreter.registerProcedure(
        procedure(
            "count",
            ImmutableList.of("i"),
            IR.loop(
                IR.eq(name("i"), number(0)),
                IR.block(IR.addAssign(name("i"), number(1))),
                IR.eq(name("i"), number(3)))));

    assertFails(RuntimeErrors.ASSERTION_MISMATCH, "count", store.allocate(1));
  }

  @Test
  public void testLoopWithDoBlock() {
    // from (i == 0) do { acc += i } loop { i += 1 } until (i == 4)
    interpreter.registerProcedure(
        procedure(
            "sum",
            ImmutableList.of("i", "acc"),
            IR.loop(
                IR.eq(name("i"), number(0)),
                IR.block(IR.addAssign(name("acc"), name("i"))),
                IR.block(IR.addAssign(name("i"), number(1))),
                IR.eq(name("i"), number(4)))));
    SlotHandle i = store.allocate(0);
    SlotHandle acc = store.allocate(0);

    interpreter.runForward("sum", i, acc);
    assertThat(store.get(i)).isEqualTo(4);
    assertThat(store.get(acc)).isEqualTo(10);

    interpreter.runBackward("sum", i, acc);
    assertThat(store.get(i)).isEqualTo(0);
    assertThat(store.get(acc)).isEqualTo(0);
  }

  @Test
  public void testDelocalMismatch() {
    interpreter.registerProcedure(
        procedure(
            "p",
            ImmutableList.of("a"),
            IR.local(name("t"), number(0)),
            IR.addAssign(name("t"), name("a")),
            IR.delocal(name("t"), number(0))));

    interpreter.runForward("p", store.allocate(0));
    ReversibleExecutionException e =
        assertFails(RuntimeErrors.DELOCAL_MISMATCH, "p", new SlotStore().allocate(5));
    assertThat(e.getError().node().isDelocal()).isTrue();
  }

  @Test
  public void testSwapArrays() {
    interpreter.registerProcedure(
        procedure("swap", ImmutableList.of("a", "b"), IR.swap(name("a"), name("b"))));
    SlotHandle a = store.allocateArray(1, 2);
    SlotHandle b = store.allocateArray(3, 4);

    interpreter.runForward("swap", a, b);
    assertThat(store.getAll(a)).asList().containsExactly(3L, 4L).inOrder();
    assertThat(store.getAll(b)).asList().containsExactly(1L, 2L).inOrder();
  }

  @Test
  public void testSwapShapeMismatch() {
    interpreter.registerProcedure(
        procedure("swap", ImmutableList.of("a", "b"), IR.swap(name("a"), name("b"))));
    assertFails(
        RuntimeErrors.SHAPE_MISMATCH, "swap", store.allocate(1), store.allocateArray(1, 2));
  }

  @Test
  public void testIndexingScalar() {
    interpreter.registerProcedure(
        procedure(
            "p", ImmutableList.of("a", "b"), IR.addAssign(elem("a", number(0)), name("b"))));
    assertFails(RuntimeErrors.SHAPE_MISMATCH, "p", store.allocate(1), store.allocate(2));
  }

  @Test
  public void testUnboundVariable() {
    interpreter.registerProcedure(
        procedure("p", ImmutableList.of("a"), IR.addAssign(name("a"), name("missing"))));
    assertFails(RuntimeErrors.UNBOUND_VARIABLE, "p", store.allocate(1));
  }

  @Test
  public void testCallDepthExceeded() {
    options.setMaxCallDepth(5);
    interpreter.registerProcedure(fib());

    ReversibleExecutionException e =
        assertFails(
            RuntimeErrors.CALL_DEPTH_EXCEEDED,
            "fib",
            store.allocate(0),
            store.allocate(0),
            store.allocate(10));
    assertThat(e.getError().node().isCall()).isTrue();
  }

  @Test
  public void testArityMismatchAtRunTime() {
    interpreter.registerProcedure(fib());
    assertFails(LegalityValidator.ARITY_MISMATCH, "fib", store.allocate(0));
  }

  @Test
  public void testUnknownProcedure() {
    assertThrows(IllegalArgumentException.class, () -> interpreter.runForward("nope"));
  }

  @Test
  public void testFailedStoreMustBeRestored() {
    interpreter.registerProcedure(
        procedure(
            "p",
            ImmutableList.of("a", "b"),
            IR.addAssign(name("a"), number(1)),
            IR.addAssign(name("b"), IR.div(number(1), name("a")))));
    SlotHandle a = store.allocate(-1);
    SlotHandle b = store.allocate(0);
    SlotStore.Snapshot snapshot = store.snapshot();

    assertFails(RuntimeErrors.DIVISION_BY_ZERO, "p", a, b);
    assertThrows(IllegalStateException.class, () -> interpreter.runForward("p", a, b));

    store.restore(snapshot);
    store.set(a, 0);
    interpreter.runForward("p", a, b);
    assertThat(store.get(b)).isEqualTo(1);
  }

  @Test
  public void testRegisteredBodyIsNotExposed() {
    interpreter.registerProcedure(
        procedure("p", ImmutableList.of("a"), IR.addAssign(name("a"), number(1))));
    Procedure registered = interpreter.getRegistry().getProcedure("p");
    registered.body().addChildToBack(new Node(Token.ASSIGN_MUL, name("a"), number(2)));
    registered.definition().getLastChild().getFirstChild().detach();

    SlotHandle a = store.allocate(1);
    interpreter.runForward("p", a);
    assertThat(store.get(a)).isEqualTo(2);
    assertThat(registered.body().getChildCount()).isEqualTo(1);
  }

  @Test
  public void testUnexpectedExceptionFailsInvocation() {
    ExpressionEvaluator broken =
        new ExpressionEvaluator() {
          private final ExpressionEvaluator delegate = new DefaultExpressionEvaluator();

          @Override
          public long evaluate(Node expr, EvaluationContext context) {
            if (expr.isNumber() && expr.getNumber() == 99) {
              throw new IllegalStateException("evaluator broke");
            }
            return delegate.evaluate(expr, context);
          }
        };
    interpreter = new ReversibleInterpreter(options, broken);
    interpreter.registerProcedure(
        procedure(
            "p",
            ImmutableList.of("a"),
            IR.addAssign(name("a"), number(1)),
            IR.addAssign(name("a"), number(99))));
    SlotHandle a = store.allocate(0);
    Invocation invocation = interpreter.newInvocation("p", Direction.FORWARD, a);

    IllegalStateException e = assertThrows(IllegalStateException.class, invocation::run);
    assertThat(e).hasMessageThat().isEqualTo("evaluator broke");
    assertThat(invocation.getState()).isEqualTo(Invocation.State.FAILED);
    assertThat(invocation.getFailure()).isNull();
    assertThat(store.isInvalidated()).isTrue();
    assertThrows(IllegalStateException.class, () -> interpreter.runForward("p", a));
  }

  @Test
  public void testLocalsReleasedOutOfOrderInLoop() {
    // from (i == 0) loop { local x = i; local y = 1; i += y; delocal x = i - 1; delocal y = 1 }
    // until (i == 1000)
    interpreter.registerProcedure(
        procedure(
            "count",
            ImmutableList.of("i"),
            IR.loop(
                IR.eq(name("i"), number(0)),
                IR.block(
                    IR.local(name("x"), name("i")),
                    IR.local(name("y"), number(1)),
                    IR.addAssign(name("i"), name("y")),
                    IR.delocal(name("x"), IR.sub(name("i"), number(1))),
                    IR.delocal(name("y"), number(1))),
                IR.eq(name("i"), number(1000)))));
    SlotHandle i = store.allocate(0);

    interpreter.runForward("count", i);
    assertThat(store.get(i)).isEqualTo(1000);
    interpreter.runBackward("count", i);
    assertThat(store.get(i)).isEqualTo(0);
  }

  @Test
  public void testInvocationLifecycle() {
    interpreter.registerProcedure(fib());
    Invocation invocation =
        interpreter.newInvocation(
            "fib", Direction.FORWARD, store.allocate(0), store.allocate(0), store.allocate(3));
    assertThat(invocation.getState()).isEqualTo(Invocation.State.READY);

    invocation.run();
    assertThat(invocation.getState()).isEqualTo(Invocation.State.COMPLETED);
    assertThat(invocation.getFailure()).isNull();
    assertThrows(IllegalStateException.class, invocation::run);
  }

  @Test
  public void testFailedInvocation() {
    interpreter.registerProcedure(fib());
    Invocation invocation =
        interpreter.newInvocation("fib", Direction.BACKWARD, store.allocate(0));
    assertThrows(ReversibleExecutionException.class, invocation::run);
    assertThat(invocation.getState()).isEqualTo(Invocation.State.FAILED);
    assertThat(invocation.getFailure().getType()).isEqualTo(LegalityValidator.ARITY_MISMATCH);
  }

  @Test
  public void testMutualRecursion() {
    Node ping = countdown("ping", "pong", 2);
    Node pong = countdown("pong", "ping", 3);
    assertThrows(
        ProcedureValidationException.class,
        () -> interpreter.registerProcedure(ping.cloneTree()));

    assertThat(interpreter.registerProcedures(ping, pong)).containsExactly("ping", "pong");
    SlotHandle n = store.allocate(4);
    SlotHandle acc = store.allocate(0);

    interpreter.runForward("ping", n, acc);
    assertThat(store.get(n)).isEqualTo(4);
    assertThat(store.get(acc)).isEqualTo(10);
    interpreter.runBackward("ping", n, acc);
    assertThat(store.get(acc)).isEqualTo(0);
  }

  /** Adds {@code step} to acc and hands the rest of the countdown to {@code other}. */
  private static Node countdown(String self, String other, long step) {
    return procedure(
        self,
        ImmutableList.of("n", "acc"),
        IR.ifNode(
            IR.ne(name("n"), number(0)),
            IR.block(
                IR.subAssign(name("n"), number(1)),
                IR.addAssign(name("acc"), number(step)),
                IR.call(name(other), name("n"), name("acc")),
                IR.addAssign(name("n"), number(1))),
            IR.ne(name("n"), number(0))));
  }

  @Test
  public void testFactorization() {
    interpreter.registerProcedures(factor(), zeroI(), nextTry());
    SlotHandle num = store.allocate(840);
    SlotHandle fact = store.allocateArray(20);

    interpreter.runForward("factor", num, fact);
    assertThat(store.get(num)).isEqualTo(0);
    long[] expected = new long[20];
    long[] factors = {2, 2, 2, 3, 5, 7};
    System.arraycopy(factors, 0, expected, 1, factors.length);
    assertThat(store.getAll(fact)).isEqualTo(expected);

    interpreter.runBackward("factor", num, fact);
    assertThat(store.get(num)).isEqualTo(840);
    assertThat(store.getAll(fact)).isEqualTo(new long[20]);
  }

  private static Node factor() {
    Node previous = IR.sub(name("i"), number(1));
    return procedure(
        "factor",
        ImmutableList.of("num", "fact"),
        IR.local(name("tryf"), number(0)),
        IR.local(name("i"), number(0)),
        IR.loop(
            IR.and(IR.eq(name("tryf"), number(0)), IR.gt(name("num"), number(1))),
            IR.block(
                IR.call(name("nextTry"), name("tryf")),
                IR.loop(
                    IR.ne(elem("fact", name("i")), name("tryf")),
                    IR.block(
                        IR.addAssign(name("i"), number(1)),
                        IR.addAssign(elem("fact", name("i")), name("tryf")),
                        IR.local(name("z"), IR.div(name("num"), name("tryf"))),
                        IR.swap(name("z"), name("num")),
                        IR.delocal(name("z"), IR.mul(name("num"), name("tryf")))),
                    IR.ne(IR.mod(name("num"), name("tryf")), number(0)))),
            IR.gt(IR.mul(name("tryf"), name("tryf")), name("num"))),
        IR.ifNode(
            IR.ne(name("num"), number(1)),
            IR.block(
                IR.addAssign(name("i"), number(1)),
                IR.xorAssign(elem("fact", name("i")), name("num")),
                IR.xorAssign(name("num"), elem("fact", name("i"))),
                IR.xorAssign(elem("fact", name("i")), name("num"))),
            IR.block(IR.subAssign(name("num"), number(1))),
            IR.ne(elem("fact", name("i")), elem("fact", previous.cloneTree()))),
        IR.ifNode(
            IR.lt(
                IR.mul(elem("fact", previous.cloneTree()), elem("fact", previous.cloneTree())),
                elem("fact", name("i"))),
            IR.block(
                IR.loop(
                    IR.gt(IR.mul(name("tryf"), name("tryf")), elem("fact", name("i"))),
                    IR.block(IR.uncall(name("nextTry"), name("tryf"))),
                    IR.eq(name("tryf"), number(0)))),
            IR.block(IR.subAssign(name("tryf"), elem("fact", previous.cloneTree()))),
            IR.lt(
                IR.mul(elem("fact", previous.cloneTree()), elem("fact", previous.cloneTree())),
                elem("fact", name("i")))),
        IR.call(name("zeroI"), name("i"), name("fact")),
        IR.delocal(name("i"), number(0)),
        IR.delocal(name("tryf"), number(0)));
  }

  private static Node zeroI() {
    return procedure(
        "zeroI",
        ImmutableList.of("i", "fact"),
        IR.loop(
            IR.eq(elem("fact", IR.add(name("i"), number(1))), number(0)),
            IR.block(IR.subAssign(name("i"), number(1))),
            IR.eq(name("i"), number(0))));
  }

  private static Node nextTry() {
    return procedure(
        "nextTry",
        ImmutableList.of("tryf"),
        IR.addAssign(name("tryf"), number(2)),
        IR.ifNode(
            IR.eq(name("tryf"), number(4)),
            IR.block(IR.subAssign(name("tryf"), number(1))),
            IR.eq(name("tryf"), number(3))));
  }

  @Test
  public void testConcurrentInvocationsOnDisjointStores() throws Exception {
    interpreter.registerProcedure(fib());
    ExecutorService executor = Executors.newFixedThreadPool(4);
    try {
      List<Callable<long[]>> tasks = new ArrayList<>();
      for (int t = 0; t < 16; t++) {
        long n = t % 8;
        tasks.add(
            () -> {
              SlotStore own = new SlotStore();
              SlotHandle x1 = own.allocate(0);
              SlotHandle x2 = own.allocate(0);
              SlotHandle count = own.allocate(n);
              interpreter.runForward("fib", x1, x2, count);
              long[] forward = {own.get(x1), own.get(x2)};
              interpreter.runBackward("fib", x1, x2, count);
              return new long[] {
                forward[0], forward[1], own.get(x1), own.get(x2), own.get(count)
              };
            });
      }
      long[] fibs = {1, 1, 2, 3, 5, 8, 13, 21, 34, 55};
      List<Future<long[]>> results = executor.invokeAll(tasks);
      for (int t = 0; t < results.size(); t++) {
        int n = t % 8;
        assertThat(results.get(t).get())
            .isEqualTo(new long[] {fibs[n], fibs[n + 1], 0, 0, n});
      }
    } finally {
      executor.shutdownNow();
    }
  }
}
