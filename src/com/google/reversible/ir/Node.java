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

package com.google.reversible.ir;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.Collections;
import java.util.Iterator;
import java.util.NoSuchElementException;
import org.jspecify.annotations.Nullable;

/**
 * This class implements the root of the intermediate representation.
 *
 * <p>Children are kept in a doubly linked sibling list: {@code first.previous} points at the last
 * child so that appending and reverse iteration are constant time.
 */
public class Node {

  private Token token;

  private @Nullable Node parent;
  private @Nullable Node first;
  private @Nullable Node next;
  private @Nullable Node previous;

  private @Nullable String sourceFileName;
  private int lineno = -1;
  private int charno = -1;

  public Node(Token token) {
    this.token = checkNotNull(token);
  }

  public Node(Token token, Node child) {
    this(token);
    addChildToBack(child);
  }

  public Node(Token token, Node left, Node right) {
    this(token);
    addChildToBack(left);
    addChildToBack(right);
  }

  public Node(Token token, Node left, Node mid, Node right) {
    this(token);
    addChildToBack(left);
    addChildToBack(mid);
    addChildToBack(right);
  }

  public Node(Token token, Node... children) {
    this(token);
    for (Node child : children) {
      addChildToBack(child);
    }
  }

  public static Node newNumber(long number) {
    return new NumberNode(number);
  }

  public static Node newString(Token token, String str) {
    return new StringNode(token, str);
  }

  private static final class NumberNode extends Node {
    private final long number;

    NumberNode(long number) {
      super(Token.NUMBER);
      this.number = number;
    }

    @Override
    public long getNumber() {
      return number;
    }

    @Override
    Node cloneNode() {
      return new NumberNode(number).copySourceInfoFrom(this);
    }

    @Override
    boolean isEquivalentShallow(Node node) {
      return node instanceof NumberNode && ((NumberNode) node).number == number;
    }
  }

  private static final class StringNode extends Node {
    private final String str;

    StringNode(Token token, String str) {
      super(token);
      this.str = checkNotNull(str);
    }

    @Override
    public String getString() {
      return str;
    }

    @Override
    Node cloneNode() {
      return new StringNode(getToken(), str).copySourceInfoFrom(this);
    }

    @Override
    boolean isEquivalentShallow(Node node) {
      return node instanceof StringNode && ((StringNode) node).str.equals(str);
    }
  }

  public final Token getToken() {
    return token;
  }

  /** Returns the payload of a NUMBER node. */
  public long getNumber() {
    throw new IllegalStateException("not a number node: " + this);
  }

  /** Returns the payload of a NAME node. */
  public String getString() {
    throw new IllegalStateException("not a string node: " + this);
  }

  public final boolean hasChildren() {
    return first != null;
  }

  public final boolean hasOneChild() {
    return first != null && first.next == null;
  }

  public final Node getOnlyChild() {
    checkState(hasOneChild(), this);
    return first;
  }

  public final @Nullable Node getFirstChild() {
    return first;
  }

  public final @Nullable Node getSecondChild() {
    return first == null ? null : first.next;
  }

  public final @Nullable Node getLastChild() {
    return first != null ? first.previous : null;
  }

  public final @Nullable Node getNext() {
    return next;
  }

  public final @Nullable Node getPrevious() {
    return parent == null || this == parent.first ? null : previous;
  }

  public final @Nullable Node getParent() {
    return parent;
  }

  /**
   * Gets the ith child, note that this is O(N) where N is the number of children.
   *
   * @param i The index
   * @return The ith child
   */
  public final Node getChildAtIndex(int i) {
    Node n = first;
    while (i > 0) {
      n = n.next;
      i--;
    }
    return n;
  }

  public final int getChildCount() {
    int c = 0;
    for (Node n = first; n != null; n = n.next) {
      c++;
    }
    return c;
  }

  public final void addChildToBack(Node child) {
    checkArgument(
        child.parent == null,
        "Cannot add already-owned child node.\nChild: %s\nExisting parent: %s\nNew parent: %s",
        child,
        child.parent,
        this);
    checkArgument(child.next == null);
    checkArgument(child.previous == null);

    if (first == null) {
      // NOTE: child.next remains null
      child.previous = child;
      first = child;
    } else {
      Node last = first.previous;
      last.next = child;
      child.previous = last;
      first.previous = child;
    }

    child.parent = this;
  }

  /** Removes this node from its parent. */
  public final Node detach() {
    checkNotNull(parent, "Node has no parent: %s", this);
    Node p = parent;
    if (p.first == this) {
      p.first = next;
      if (next != null) {
        next.previous = previous;
      }
    } else {
      previous.next = next;
      if (next != null) {
        next.previous = previous;
      } else {
        p.first.previous = previous;
      }
    }
    parent = null;
    next = null;
    previous = null;
    return this;
  }

  /** Iterates over the direct children, first to last. */
  public final Iterable<Node> children() {
    if (first == null) {
      return Collections.emptySet();
    }
    Node start = first;
    return () -> new SiblingNodeIterator(start);
  }

  private static final class SiblingNodeIterator implements Iterator<Node> {
    private @Nullable Node current;

    SiblingNodeIterator(Node start) {
      this.current = start;
    }

    @Override
    public boolean hasNext() {
      return current != null;
    }

    @Override
    public Node next() {
      if (current == null) {
        throw new NoSuchElementException();
      }
      Node n = current;
      current = current.getNext();
      return n;
    }
  }

  Node cloneNode() {
    return new Node(token).copySourceInfoFrom(this);
  }

  /** Returns a deep copy of this subtree, detached from any parent. */
  public final Node cloneTree() {
    Node result = cloneNode();
    for (Node c = first; c != null; c = c.next) {
      result.addChildToBack(c.cloneTree());
    }
    return result;
  }

  boolean isEquivalentShallow(Node node) {
    return node.getClass() == Node.class;
  }

  /** Returns true if this subtree is structurally identical to the given one. */
  public final boolean isEquivalentTo(Node node) {
    if (token != node.token
        || getChildCount() != node.getChildCount()
        || !isEquivalentShallow(node)) {
      return false;
    }
    for (Node n = first, n2 = node.first; n != null; n = n.next, n2 = n2.next) {
      if (!n.isEquivalentTo(n2)) {
        return false;
      }
    }
    return true;
  }

  // ==========================================================================
  // Source position

  final Node copySourceInfoFrom(Node other) {
    this.sourceFileName = other.sourceFileName;
    this.lineno = other.lineno;
    this.charno = other.charno;
    return this;
  }

  @CanIgnoreReturnValue
  public final Node setSourceFileName(@Nullable String name) {
    this.sourceFileName = name;
    return this;
  }

  public final @Nullable String getSourceFileName() {
    return sourceFileName;
  }

  @CanIgnoreReturnValue
  public final Node setLinenoCharno(int lineno, int charno) {
    this.lineno = lineno;
    this.charno = charno;
    return this;
  }

  public final int getLineno() {
    return lineno;
  }

  public final int getCharno() {
    return charno;
  }

  public final String getLocation() {
    return (sourceFileName == null ? "(unknown source)" : sourceFileName) + ":" + lineno + ":"
        + charno;
  }

  // ==========================================================================
  // Token predicates

  public final boolean isProcedure() {
    return token == Token.PROCEDURE;
  }

  public final boolean isParamList() {
    return token == Token.PARAM_LIST;
  }

  public final boolean isBlock() {
    return token == Token.BLOCK;
  }

  public final boolean isName() {
    return token == Token.NAME;
  }

  public final boolean isNumber() {
    return token == Token.NUMBER;
  }

  public final boolean isGetElem() {
    return token == Token.GETELEM;
  }

  public final boolean isIf() {
    return token == Token.IF;
  }

  public final boolean isLoop() {
    return token == Token.LOOP;
  }

  public final boolean isCall() {
    return token == Token.CALL;
  }

  public final boolean isUncall() {
    return token == Token.UNCALL;
  }

  public final boolean isSwap() {
    return token == Token.SWAP;
  }

  public final boolean isLocal() {
    return token == Token.LOCAL;
  }

  public final boolean isDelocal() {
    return token == Token.DELOCAL;
  }

  // ==========================================================================
  // Printing

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(token);
    if (this instanceof StringNode) {
      sb.append(' ').append(getString());
    } else if (this instanceof NumberNode) {
      sb.append(' ').append(getNumber());
    }
    if (lineno != -1) {
      sb.append(' ').append(lineno).append(':').append(charno);
    }
    return sb.toString();
  }

  public final String toStringTree() {
    StringBuilder sb = new StringBuilder();
    appendStringTree(sb, 0);
    return sb.toString();
  }

  private void appendStringTree(StringBuilder sb, int level) {
    for (int i = 0; i < level; i++) {
      sb.append("    ");
    }
    sb.append(this).append('\n');
    for (Node c = first; c != null; c = c.next) {
      c.appendStringTree(sb, level + 1);
    }
  }
}
