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

import com.google.reversible.ir.Node;
import com.google.reversible.ir.Token;

/**
 * The evaluator for the expression tokens of the intermediate representation.
 *
 * <p>Arithmetic is carried out on 64 bits and checked; truncating division. Booleans are 1 and
 * 0, and any non-zero value is true.
 */
public final class DefaultExpressionEvaluator implements ExpressionEvaluator {

  @Override
  public long evaluate(Node n, EvaluationContext context) {
    switch (n.getToken()) {
      case NUMBER:
        return n.getNumber();
      case NAME:
        return context.read(n.getString());
      case GETELEM:
        return context.readElement(
            n.getFirstChild().getString(), evaluate(n.getSecondChild(), context));
      case HOOK:
        return evaluate(n.getFirstChild(), context) != 0
            ? evaluate(n.getSecondChild(), context)
            : evaluate(n.getLastChild(), context);
      case AND:
        return toLong(
            evaluate(n.getFirstChild(), context) != 0
                && evaluate(n.getLastChild(), context) != 0);
      case OR:
        return toLong(
            evaluate(n.getFirstChild(), context) != 0
                || evaluate(n.getLastChild(), context) != 0);
      case NOT:
        return toLong(evaluate(n.getFirstChild(), context) == 0);
      case NEG:
        return negate(n, evaluate(n.getFirstChild(), context));
      case BITNOT:
        return ~evaluate(n.getFirstChild(), context);
      default:
        break;
    }

    if (n.getToken().operatorArity() != 2) {
      throw new IllegalStateException("Not an expression: " + n);
    }
    long left = evaluate(n.getFirstChild(), context);
    long right = evaluate(n.getLastChild(), context);
    switch (n.getToken()) {
      case EQ:
        return toLong(left == right);
      case NE:
        return toLong(left != right);
      case LT:
        return toLong(left < right);
      case LE:
        return toLong(left <= right);
      case GT:
        return toLong(left > right);
      case GE:
        return toLong(left >= right);
      case BITAND:
        return left & right;
      case BITOR:
        return left | right;
      case BITXOR:
        return left ^ right;
      case ADD:
      case SUB:
      case MUL:
      case LSH:
        return exact(n, left, right);
      case DIV:
      case MOD:
        return divide(n, left, right);
      case RSH:
        return left >> shiftCount(n, right);
      default:
        throw new IllegalStateException("Not an expression: " + n);
    }
  }

  private static long exact(Node n, long left, long right) {
    try {
      switch (n.getToken()) {
        case ADD:
          return Math.addExact(left, right);
        case SUB:
          return Math.subtractExact(left, right);
        case MUL:
          return Math.multiplyExact(left, right);
        case LSH:
          long result = left << shiftCount(n, right);
          if ((result >> right) != left) {
            throw new ArithmeticException("shift overflow");
          }
          return result;
        default:
          throw new IllegalStateException(n.toString());
      }
    } catch (ArithmeticException e) {
      EvaluationException overflow =
          new EvaluationException(
              RuntimeErrors.ARITHMETIC_OVERFLOW, CodePrinter.toSource(n), "64-bit");
      overflow.initCause(e);
      throw overflow;
    }
  }

  private static long divide(Node n, long left, long right) {
    if (right == 0) {
      throw new EvaluationException(RuntimeErrors.DIVISION_BY_ZERO, CodePrinter.toSource(n));
    }
    if (left == Long.MIN_VALUE && right == -1) {
      throw new EvaluationException(
          RuntimeErrors.ARITHMETIC_OVERFLOW, CodePrinter.toSource(n), "64-bit");
    }
    return n.getToken() == Token.DIV ? left / right : left % right;
  }

  private static long negate(Node n, long value) {
    if (value == Long.MIN_VALUE) {
      throw new EvaluationException(
          RuntimeErrors.ARITHMETIC_OVERFLOW, CodePrinter.toSource(n), "64-bit");
    }
    return -value;
  }

  private static int shiftCount(Node n, long count) {
    if (count < 0 || count >= Long.SIZE) {
      throw new EvaluationException(
          RuntimeErrors.ARITHMETIC_OVERFLOW, CodePrinter.toSource(n), "64-bit");
    }
    return (int) count;
  }

  private static long toLong(boolean b) {
    return b ? 1 : 0;
  }
}
