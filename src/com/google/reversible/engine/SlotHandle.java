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
import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A reference to one slot, or to a contiguous run of slots forming an array, in a {@link
 * SlotStore}.
 *
 * <p>Two handles alias exactly when they belong to the same store and their ranges overlap, so
 * aliasing is decided by comparing handles, never by comparing values.
 *
 * @param store The arena the slots live in.
 * @param offset Index of the first slot.
 * @param length Number of slots, always 1 for scalars.
 * @param isArray Whether the handle denotes an array.
 */
public record SlotHandle(SlotStore store, int offset, int length, boolean isArray) {
  public SlotHandle {
    checkNotNull(store, "store");
    checkArgument(offset >= 0, "negative offset %s", offset);
    checkArgument(length >= 0, "negative length %s", length);
    checkArgument(isArray || length == 1, "a scalar handle spans exactly one slot");
  }

  /** Returns the handle of the element at {@code index} of this array. */
  public SlotHandle element(int index) {
    checkArgument(isArray, "%s is not an array", this);
    checkElementIndex(index, length);
    return new SlotHandle(store, offset + index, 1, false);
  }

  /** Whether this handle and {@code other} share at least one slot. */
  public boolean overlaps(SlotHandle other) {
    return store == other.store
        && offset < other.offset + other.length
        && other.offset < offset + length;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof SlotHandle)) {
      return false;
    }
    SlotHandle that = (SlotHandle) o;
    return store == that.store
        && offset == that.offset
        && length == that.length
        && isArray == that.isArray;
  }

  @Override
  public int hashCode() {
    return (System.identityHashCode(store) * 31 + offset) * 31 + length;
  }

  @Override
  public String toString() {
    return isArray ? "slots[" + offset + ".." + (offset + length) + ")" : "slot#" + offset;
  }
}
