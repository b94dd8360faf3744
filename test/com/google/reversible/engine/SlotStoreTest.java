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

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class SlotStoreTest {

  @Test
  public void testAllocateAndAccess() {
    SlotStore store = new SlotStore();
    SlotHandle x = store.allocate(5);
    SlotHandle arr = store.allocateArray(1, 2, 3);

    assertThat(store.get(x)).isEqualTo(5);
    store.set(x, 6);
    assertThat(store.get(x)).isEqualTo(6);
    assertThat(store.getAll(arr)).asList().containsExactly(1L, 2L, 3L).inOrder();
    assertThat(store.get(arr.element(2))).isEqualTo(3);
    assertThat(store.size()).isEqualTo(4);
  }

  @Test
  public void testGrowsPastInitialCapacity() {
    SlotStore store = new SlotStore();
    SlotHandle big = store.allocateArray(100);
    SlotHandle after = store.allocate(9);
    assertThat(big.length()).isEqualTo(100);
    assertThat(store.get(after)).isEqualTo(9);
  }

  @Test
  public void testScalarAccessToArrayFails() {
    SlotStore store = new SlotStore();
    SlotHandle arr = store.allocateArray(2);
    assertThrows(IllegalArgumentException.class, () -> store.get(arr));
  }

  @Test
  public void testForeignHandleFails() {
    SlotStore store = new SlotStore();
    SlotHandle x = new SlotStore().allocate(1);
    assertThrows(IllegalArgumentException.class, () -> store.get(x));
  }

  @Test
  public void testOverlap() {
    SlotStore store = new SlotStore();
    SlotHandle arr = store.allocateArray(4);
    SlotHandle x = store.allocate(0);

    assertThat(arr.overlaps(arr.element(3))).isTrue();
    assertThat(arr.element(1).overlaps(arr.element(1))).isTrue();
    assertThat(arr.element(1).overlaps(arr.element(2))).isFalse();
    assertThat(arr.overlaps(x)).isFalse();
    assertThat(x.overlaps(new SlotStore().allocate(0))).isFalse();
    assertThat(arr.element(1)).isEqualTo(arr.element(1));
  }

  @Test
  public void testReleaseReclaimsTopSlots() {
    SlotStore store = new SlotStore();
    SlotHandle a = store.allocate(1);
    SlotHandle b = store.allocate(2);

    store.release(b);
    assertThat(store.size()).isEqualTo(1);
    assertThrows(IllegalArgumentException.class, () -> store.get(b));
    assertThat(store.get(a)).isEqualTo(1);
  }

  @Test
  public void testReleaseOutOfOrderIsReclaimedWithTheTop() {
    SlotStore store = new SlotStore();
    SlotHandle kept = store.allocate(7);
    SlotHandle a = store.allocate(1);
    SlotHandle b = store.allocate(2);

    store.release(a);
    assertThat(store.size()).isEqualTo(3);
    assertThat(store.get(b)).isEqualTo(2);
    store.release(b);
    assertThat(store.size()).isEqualTo(1);
    assertThat(store.get(kept)).isEqualTo(7);

    SlotHandle c = store.allocate(3);
    assertThat(c.offset()).isEqualTo(1);
    store.release(c);
    assertThat(store.size()).isEqualTo(1);
  }

  @Test
  public void testSnapshotRestoresValuesAndValidity() {
    SlotStore store = new SlotStore();
    SlotHandle x = store.allocate(1);
    SlotStore.Snapshot snapshot = store.snapshot();

    store.set(x, 99);
    store.invalidate();
    assertThat(store.isInvalidated()).isTrue();

    store.restore(snapshot);
    assertThat(store.isInvalidated()).isFalse();
    assertThat(store.get(x)).isEqualTo(1);
  }

  @Test
  public void testRestoreFromOtherStoreFails() {
    SlotStore store = new SlotStore();
    SlotStore.Snapshot snapshot = new SlotStore().snapshot();
    assertThrows(IllegalArgumentException.class, () -> store.restore(snapshot));
  }
}
