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
import static com.google.common.base.Preconditions.checkState;

import java.util.Arrays;
import java.util.BitSet;

/**
 * An arena of mutable integer slots. A host runtime allocates the storage a procedure works on
 * here and passes the resulting {@link SlotHandle}s to the interpreter; each invocation frame
 * also keeps its locals in a private store.
 *
 * <p>A store is not thread-safe. Invocations running concurrently must work on disjoint stores.
 *
 * <p>A store is invalidated when an invocation using it fails, since the failure leaves it in an
 * unspecified state. Callers needing atomicity take a {@link #snapshot()} before running and
 * {@link #restore} it after a failure.
 */
public final class SlotStore {
  private static final int INITIAL_CAPACITY = 16;

  private long[] values = new long[INITIAL_CAPACITY];
  private int size = 0;
  // Released slots below the top, reclaimed once everything above them is released too.
  private final BitSet released = new BitSet();
  private boolean invalidated = false;

  /** Allocates a scalar slot holding {@code value}. */
  public SlotHandle allocate(long value) {
    int offset = grow(1);
    values[offset] = value;
    return new SlotHandle(this, offset, 1, false);
  }

  /** Allocates an array whose elements hold {@code initialValues}. */
  public SlotHandle allocateArray(long... initialValues) {
    int offset = grow(initialValues.length);
    System.arraycopy(initialValues, 0, values, offset, initialValues.length);
    return new SlotHandle(this, offset, initialValues.length, true);
  }

  /** Allocates an array of {@code length} zeroes. */
  public SlotHandle allocateArray(int length) {
    checkArgument(length >= 0, "negative length %s", length);
    return allocateArray(new long[length]);
  }

  private int grow(int count) {
    int offset = size;
    if (size + count > values.length) {
      values = Arrays.copyOf(values, Math.max(values.length * 2, size + count));
    }
    size += count;
    return offset;
  }

  /**
   * Gives the slots of {@code handle} back. Slots are reclaimed from the top down, so slots
   * released out of order are reclaimed as soon as the slots allocated after them are released.
   */
  void release(SlotHandle handle) {
    checkOwned(handle);
    int end = handle.offset() + handle.length();
    if (end != size) {
      released.set(handle.offset(), end);
      return;
    }
    size = handle.offset();
    while (size > 0 && released.get(size - 1)) {
      size--;
    }
    released.clear(size, end);
  }

  /** Returns the value of a scalar slot. */
  public long get(SlotHandle handle) {
    checkOwned(handle);
    checkArgument(!handle.isArray(), "%s is an array", handle);
    return values[handle.offset()];
  }

  /** Sets the value of a scalar slot. */
  public void set(SlotHandle handle, long value) {
    checkOwned(handle);
    checkArgument(!handle.isArray(), "%s is an array", handle);
    values[handle.offset()] = value;
  }

  /** Returns a copy of the values of an array, or of a scalar as a one element array. */
  public long[] getAll(SlotHandle handle) {
    checkOwned(handle);
    return Arrays.copyOfRange(values, handle.offset(), handle.offset() + handle.length());
  }

  /** Returns the number of live slots. */
  public int size() {
    return size;
  }

  void invalidate() {
    invalidated = true;
  }

  public boolean isInvalidated() {
    return invalidated;
  }

  /** Captures the values of every slot. */
  public Snapshot snapshot() {
    return new Snapshot(this, Arrays.copyOf(values, size));
  }

  /** Puts every slot back to the captured values and makes the store usable again. */
  public void restore(Snapshot snapshot) {
    checkArgument(snapshot.store == this, "snapshot taken from another store");
    checkState(
        size >= snapshot.values.length,
        "slots allocated at the time of the snapshot were released");
    System.arraycopy(snapshot.values, 0, values, 0, snapshot.values.length);
    size = snapshot.values.length;
    released.clear();
    invalidated = false;
  }

  private void checkOwned(SlotHandle handle) {
    checkNotNull(handle);
    checkArgument(handle.store() == this, "%s belongs to another store", handle);
    checkArgument(handle.offset() + handle.length() <= size, "%s was released", handle);
  }

  @Override
  public String toString() {
    return "SlotStore" + Arrays.toString(Arrays.copyOf(values, size));
  }

  /** The values of a store at one point in time. */
  public static final class Snapshot {
    private final SlotStore store;
    private final long[] values;

    private Snapshot(SlotStore store, long[] values) {
      this.store = store;
      this.values = values;
    }
  }
}
