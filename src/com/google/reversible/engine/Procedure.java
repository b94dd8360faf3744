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

import com.google.common.collect.ImmutableList;
import com.google.reversible.ir.Node;

/**
 * A registered reversible procedure. The definition is a private copy of the tree handed to the
 * registry and is never mutated afterwards; {@link #body()} and {@link #definition()} hand out
 * copies of it.
 *
 * @param name The name calls refer to.
 * @param parameters The parameter names, in declaration order.
 * @param body The BLOCK of statements.
 * @param definition The whole PROCEDURE node.
 */
public record Procedure(
    String name, ImmutableList<String> parameters, Node body, Node definition) {
  public Procedure {
    checkNotNull(name, "name");
    checkNotNull(parameters, "parameters");
    checkArgument(body.isBlock(), "body is not a block: %s", body);
    checkArgument(definition.isProcedure(), "not a procedure: %s", definition);
  }

  /** Builds a procedure from a PROCEDURE node that has passed validation. */
  static Procedure fromDefinition(Node definition) {
    ImmutableList.Builder<String> parameters = ImmutableList.builder();
    for (Node param : definition.getSecondChild().children()) {
      parameters.add(param.getString());
    }
    return new Procedure(
        definition.getFirstChild().getString(),
        parameters.build(),
        definition.getLastChild(),
        definition);
  }

  /** Returns a copy of the BLOCK of statements. */
  @Override
  public Node body() {
    return body.cloneTree();
  }

  /** Returns a copy of the whole PROCEDURE node. */
  @Override
  public Node definition() {
    return definition.cloneTree();
  }

  /** Returns the validated statements themselves, for execution. */
  Node getValidatedBody() {
    return body;
  }

  public int getArity() {
    return parameters.size();
  }

  @Override
  public String toString() {
    return CodePrinter.toSource(definition);
  }
}
