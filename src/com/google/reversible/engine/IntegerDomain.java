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

import com.google.errorprone.annotations.CanIgnoreReturnValue;

/**
 * The fixed-width integer domain slot values live in.
 *
 * <p>Every update is checked: a result or an operand outside the domain raises {@link
 * RuntimeErrors#ARITHMETIC_OVERFLOW} instead of wrapping.
 */
public enum IntegerDomain {
  INT8(Byte.MIN_VALUE, Byte.MAX_VALUE),
  INT16(Short.MIN_VALUE, Short.MAX_VALUE),
  INT32(Integer.MIN_VALUE, Integer.MAX_VALUE),
  INT64(Long.MIN_VALUE, Long.MAX_VALUE),
  UINT8(0, 0xFFL),
  UINT16(0, 0xFFFFL),
  UINT32(0, 0xFFFFFFFFL);

  private final long minValue;
  private final long maxValue;

  IntegerDomain(long minValue, long maxValue) {
    this.minValue = minValue;
    this.maxValue = maxValue;
  }

  public long getMinValue() {
    return minValue;
  }

  public long getMaxValue() {
    return maxValue;
  }

  public boolean contains(long value) {
    return minValue <= value && value <= maxValue;
  }

  /** Throws if {@code value} is not representable. */
  @CanIgnoreReturnValue
  public long checkRepresentable(long value) {
    if (!contains(value)) {
      throw overflow(String.valueOf(value));
    }
    return value;
  }

  long add(long a, long b) {
    checkRepresentable(b);
    String what = a + " + " + b;
    long result;
    try {
      result = Math.addExact(a, b);
    } catch (ArithmeticException e) {
      throw overflow(what, e);
    }
    return checkResult(result, what);
  }

  long subtract(long a, long b) {
    checkRepresentable(b);
    String what = a + " - " + b;
    long result;
    try {
      result = Math.subtractExact(a, b);
    } catch (ArithmeticException e) {
      throw overflow(what, e);
    }
    return checkResult(result, what);
  }

  long xor(long a, long b) {
    checkRepresentable(b);
    return checkResult(a ^ b, a + " ^ " + b);
  }

  private long checkResult(long result, String what) {
    if (!contains(result)) {
      throw overflow(what);
    }
    return result;
  }

  private EvaluationException overflow(String what) {
    return new EvaluationException(RuntimeErrors.ARITHMETIC_OVERFLOW, what, name());
  }

  private EvaluationException overflow(String what, ArithmeticException cause) {
    EvaluationException e = overflow(what);
    e.initCause(cause);
    return e;
  }
}
