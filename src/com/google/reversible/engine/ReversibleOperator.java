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

import com.google.reversible.ir.Token;
import org.jspecify.annotations.Nullable;

/**
 * The closed set of operators that may mutate storage, with their fixed inverses.
 */
public enum ReversibleOperator {
  ADD("+="),
  SUB("-="),
  XOR("^=");

  private final String symbol;

  ReversibleOperator(String symbol) {
    this.symbol = symbol;
  }

  public ReversibleOperator inverse() {
    switch (this) {
      case ADD:
        return SUB;
      case SUB:
        return ADD;
      case XOR:
        return XOR;
    }
    throw new AssertionError(this);
  }

  /** Applies {@code current op operand} within the given domain. */
  public long apply(IntegerDomain domain, long current, long operand) {
    switch (this) {
      case ADD:
        return domain.add(current, operand);
      case SUB:
        return domain.subtract(current, operand);
      case XOR:
        return domain.xor(current, operand);
    }
    throw new AssertionError(this);
  }

  public String getSymbol() {
    return symbol;
  }

  /** Returns the operator of a legal assignment token, or null for every other token. */
  public static @Nullable ReversibleOperator fromToken(Token token) {
    switch (token) {
      case ASSIGN_ADD:
        return ADD;
      case ASSIGN_SUB:
        return SUB;
      case ASSIGN_BITXOR:
        return XOR;
      default:
        return null;
    }
  }
}
