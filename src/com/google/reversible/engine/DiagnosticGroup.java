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

import com.google.common.collect.ImmutableSet;
import java.io.Serializable;
import org.jspecify.annotations.Nullable;

/**
 * Group a set of related diagnostic types together, so that they can be reconfigured as one
 * unit.
 */
public final class DiagnosticGroup implements Serializable {
  private static final long serialVersionUID = 1;

  private final ImmutableSet<DiagnosticType> types;

  // A human-readable name for the group.
  private final @Nullable String name;

  DiagnosticGroup(@Nullable String name, DiagnosticType... types) {
    this.name = name;
    this.types = ImmutableSet.copyOf(types);
  }

  /** Create a group that matches all errors of the given types. */
  public DiagnosticGroup(DiagnosticType... types) {
    this(null, types);
  }

  /** Create a composite group. */
  DiagnosticGroup(@Nullable String name, DiagnosticGroup... groups) {
    ImmutableSet.Builder<DiagnosticType> builder = ImmutableSet.builder();
    for (DiagnosticGroup group : groups) {
      builder.addAll(group.types);
    }
    this.name = name;
    this.types = builder.build();
  }

  /** Create a diagnostic group that matches only the given type. */
  public static DiagnosticGroup forType(DiagnosticType type) {
    return new DiagnosticGroup(type);
  }

  /** Returns whether the given error's type matches a type in this group. */
  public boolean matches(ReversibilityError error) {
    return matches(error.type());
  }

  /** Returns whether the given type matches a type in this group. */
  public boolean matches(DiagnosticType type) {
    return types.contains(type);
  }

  /** Returns whether any of the given group's types are in this group. */
  public boolean intersects(DiagnosticGroup other) {
    for (DiagnosticType type : other.types) {
      if (types.contains(type)) {
        return true;
      }
    }
    return false;
  }

  public ImmutableSet<DiagnosticType> getTypes() {
    return types;
  }

  @Override
  public String toString() {
    return name == null ? types.toString() : "DiagnosticGroup<" + name + ">";
  }
}
