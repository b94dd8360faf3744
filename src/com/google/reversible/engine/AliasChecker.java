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

import java.util.List;

/**
 * The aliasing checks that need the slots a statement actually touches, made right before the
 * statement mutates anything.
 */
final class AliasChecker {

  private AliasChecker() {}

  /** Checks that no slot read while evaluating a statement overlaps the slot it updates. */
  static void checkNotRead(
      String targetSource, SlotHandle target, List<SlotHandle> reads, String procedureName) {
    for (SlotHandle read : reads) {
      if (target.overlaps(read)) {
        throw new EvaluationException(
            RuntimeErrors.ALIAS_VIOLATION,
            targetSource,
            "the value read from " + read,
            procedureName);
      }
    }
  }

  /** Checks that the handles are pairwise disjoint. */
  static void checkDisjoint(
      List<String> sources, List<SlotHandle> handles, String procedureName) {
    for (int i = 0; i < handles.size(); i++) {
      for (int j = i + 1; j < handles.size(); j++) {
        if (handles.get(i).overlaps(handles.get(j))) {
          throw new EvaluationException(
              RuntimeErrors.ALIAS_VIOLATION, sources.get(i), sources.get(j), procedureName);
        }
      }
    }
  }
}
