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
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Predicate;

/** Static methods for inspecting the intermediate representation. */
public final class NodeUtil {

  private NodeUtil() {}

  /** Whether {@code n} has the shape of a variable reference: {@code x} or {@code a[index]}. */
  public static boolean isVarRef(Node n) {
    if (n.isName()) {
      return !n.hasChildren();
    }
    return n.isGetElem()
        && n.getChildCount() == 2
        && n.getFirstChild().isName()
        && !n.getFirstChild().hasChildren();
  }

  /** Returns the name of the binding a variable reference denotes. */
  public static String getVarRefName(Node ref) {
    return ref.isName() ? ref.getString() : ref.getFirstChild().getString();
  }

  /** Whether any NAME node in the subtree rooted at {@code n} names {@code name}. */
  public static boolean referencesName(Node n, String name) {
    return containsMatching(n, c -> c.isName() && c.getString().equals(name));
  }

  /** Whether the subtree rooted at {@code n} contains a subtree equivalent to {@code target}. */
  public static boolean containsEquivalent(Node n, Node target) {
    return containsMatching(n, c -> c.isEquivalentTo(target));
  }

  private static boolean containsMatching(Node root, Predicate<Node> p) {
    AtomicBoolean found = new AtomicBoolean();
    NodeTraversal.traverse(
        root,
        new NodeTraversal.AbstractPostOrderCallback() {
          @Override
          public void visit(NodeTraversal t, Node n, Node parent) {
            if (p.test(n)) {
              found.set(true);
            }
          }
        });
    return found.get();
  }

  /** Whether a block contains no statement. */
  public static boolean isEmptyBlock(Node block) {
    return block.isBlock() && !block.hasChildren();
  }
}
