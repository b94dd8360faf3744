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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The bindings of one procedure invocation: parameters bound to the caller's slots, and locals
 * held in a store private to the frame.
 *
 * <p>An environment is confined to the thread running its invocation and is dropped when the
 * invocation returns.
 */
final class Environment {

  private final String procedureName;
  private final Map<String, SlotHandle> bindings = new LinkedHashMap<>();
  private final SlotStore locals = new SlotStore();

  Environment(String procedureName) {
    this.procedureName = checkNotNull(procedureName);
  }

  String getProcedureName() {
    return procedureName;
  }

  void bind(String name, SlotHandle handle) {
    SlotHandle previous = bindings.putIfAbsent(name, checkNotNull(handle));
    checkState(previous == null, "%s is already bound in %s", name, procedureName);
  }

  boolean isBound(String name) {
    return bindings.containsKey(name);
  }

  SlotHandle lookup(String name) {
    SlotHandle handle = bindings.get(name);
    if (handle == null) {
      throw new EvaluationException(RuntimeErrors.UNBOUND_VARIABLE, name);
    }
    return handle;
  }

  /** Binds a new local scalar initialized to {@code value}. */
  SlotHandle bindLocal(String name, long value) {
    SlotHandle handle = locals.allocate(value);
    bind(name, handle);
    return handle;
  }

  /** Drops a local binding and reclaims its slot. */
  void unbindLocal(String name) {
    SlotHandle handle = lookup(name);
    checkState(handle.store() == locals, "%s is not a local of %s", name, procedureName);
    bindings.remove(name);
    locals.release(handle);
  }

  /** Reads a scalar slot. */
  long read(SlotHandle handle) {
    return handle.store().get(handle);
  }

  void write(SlotHandle handle, long value) {
    handle.store().set(handle, value);
  }

  /** Returns a fresh read context that records every slot read through it. */
  ReadContext newReadContext() {
    return new ReadContext();
  }

  /**
   * The view an expression is evaluated against. The recorded reads are what the alias checks
   * compare the mutated slots with.
   */
  final class ReadContext implements EvaluationContext {
    private final List<SlotHandle> reads = new ArrayList<>();

    @Override
    public long read(String name) {
      SlotHandle handle = resolveScalar(name);
      reads.add(handle);
      return Environment.this.read(handle);
    }

    @Override
    public long readElement(String name, long index) {
      SlotHandle element = resolveElement(name, index);
      reads.add(element);
      return Environment.this.read(element);
    }

    /** Resolves a scalar binding without reading it. */
    SlotHandle resolveScalar(String name) {
      SlotHandle handle = lookup(name);
      if (handle.isArray()) {
        throw new EvaluationException(RuntimeErrors.SHAPE_MISMATCH, name, "a scalar", "an array");
      }
      return handle;
    }

    /** Resolves an array element without reading it. */
    SlotHandle resolveElement(String name, long index) {
      SlotHandle array = lookup(name);
      if (!array.isArray()) {
        throw new EvaluationException(RuntimeErrors.SHAPE_MISMATCH, name, "an array", "a scalar");
      }
      if (index < 0 || index >= array.length()) {
        throw new EvaluationException(
            RuntimeErrors.INDEX_OUT_OF_BOUNDS,
            String.valueOf(index),
            name,
            String.valueOf(array.length()));
      }
      return array.element((int) index);
    }

    ImmutableList<SlotHandle> getReads() {
      return ImmutableList.copyOf(reads);
    }
  }
}
