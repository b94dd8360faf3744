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

import com.google.common.collect.ImmutableMap;
import com.google.reversible.ir.Node;
import com.google.reversible.ir.Token;
import org.jspecify.annotations.Nullable;

/**
 * Prints statements and expressions back to a compact source form, for diagnostics and traces.
 * Blocks are elided: a conditional prints as {@code if (guard) ... fi (assertion)}.
 */
public final class CodePrinter {

  private static final ImmutableMap<Token, String> OPERATORS =
      ImmutableMap.<Token, String>builder()
          .put(Token.ASSIGN, "=")
          .put(Token.ASSIGN_ADD, "+=")
          .put(Token.ASSIGN_SUB, "-=")
          .put(Token.ASSIGN_BITXOR, "^=")
          .put(Token.ASSIGN_MUL, "*=")
          .put(Token.ASSIGN_DIV, "/=")
          .put(Token.ASSIGN_MOD, "%=")
          .put(Token.ASSIGN_BITAND, "&=")
          .put(Token.ASSIGN_BITOR, "|=")
          .put(Token.ASSIGN_LSH, "<<=")
          .put(Token.ASSIGN_RSH, ">>=")
          .put(Token.ADD, "+")
          .put(Token.SUB, "-")
          .put(Token.MUL, "*")
          .put(Token.DIV, "/")
          .put(Token.MOD, "%")
          .put(Token.BITAND, "&")
          .put(Token.BITOR, "|")
          .put(Token.BITXOR, "^")
          .put(Token.LSH, "<<")
          .put(Token.RSH, ">>")
          .put(Token.EQ, "==")
          .put(Token.NE, "!=")
          .put(Token.LT, "<")
          .put(Token.LE, "<=")
          .put(Token.GT, ">")
          .put(Token.GE, ">=")
          .put(Token.AND, "&&")
          .put(Token.OR, "||")
          .put(Token.NOT, "!")
          .put(Token.NEG, "-")
          .put(Token.BITNOT, "~")
          .put(Token.INC, "++")
          .put(Token.DEC, "--")
          .buildOrThrow();

  private CodePrinter() {}

  /** Returns the source symbol of an operator token, or the token name for other tokens. */
  public static String getOperatorSymbol(Token token) {
    return OPERATORS.getOrDefault(token, token.toString());
  }

  public static String toSource(Node n) {
    StringBuilder sb = new StringBuilder();
    add(sb, n, false);
    return sb.toString();
  }

  private static void add(StringBuilder sb, Node n, boolean nested) {
    Token token = n.getToken();
    if (token.isAssignmentOp()) {
      add(sb, n.getFirstChild(), false);
      sb.append(' ').append(getOperatorSymbol(token)).append(' ');
      add(sb, n.getLastChild(), false);
      return;
    }
    switch (token) {
      case NAME:
        sb.append(n.getString());
        if (n.hasChildren()) {
          sb.append(" = ");
          add(sb, n.getFirstChild(), false);
        }
        return;
      case NUMBER:
        sb.append(n.getNumber());
        return;
      case GETELEM:
        add(sb, n.getFirstChild(), true);
        sb.append('[');
        add(sb, n.getSecondChild(), false);
        sb.append(']');
        return;
      case PROCEDURE:
        sb.append("procedure ").append(n.getFirstChild().getString());
        addList(sb, n.getSecondChild(), null);
        return;
      case BLOCK:
        sb.append("{...}");
        return;
      case IF:
        sb.append("if (");
        add(sb, n.getFirstChild(), false);
        sb.append(") ... fi (");
        add(sb, n.getLastChild(), false);
        sb.append(')');
        return;
      case LOOP:
        sb.append("from (");
        add(sb, n.getFirstChild(), false);
        sb.append(") ... until (");
        add(sb, n.getLastChild(), false);
        sb.append(')');
        return;
      case CALL:
      case UNCALL:
        sb.append(token == Token.CALL ? "call " : "uncall ");
        sb.append(n.getFirstChild().getString());
        addList(sb, n, n.getFirstChild());
        return;
      case SWAP:
        add(sb, n.getFirstChild(), false);
        sb.append(" <=> ");
        add(sb, n.getLastChild(), false);
        return;
      case LOCAL:
        sb.append("local ");
        add(sb, n.getFirstChild(), false);
        return;
      case DELOCAL:
        sb.append("delocal ");
        add(sb, n.getFirstChild(), false);
        sb.append(" = ");
        add(sb, n.getLastChild(), false);
        return;
      default:
        break;
    }

    switch (token.operatorArity()) {
      case 1:
        sb.append(getOperatorSymbol(token));
        add(sb, n.getFirstChild(), true);
        return;
      case 2:
        if (nested) {
          sb.append('(');
        }
        add(sb, n.getFirstChild(), true);
        sb.append(' ').append(getOperatorSymbol(token)).append(' ');
        add(sb, n.getLastChild(), true);
        if (nested) {
          sb.append(')');
        }
        return;
      case 3:
        if (nested) {
          sb.append('(');
        }
        add(sb, n.getFirstChild(), true);
        sb.append(" ? ");
        add(sb, n.getSecondChild(), true);
        sb.append(" : ");
        add(sb, n.getLastChild(), true);
        if (nested) {
          sb.append(')');
        }
        return;
      default:
        sb.append(token);
    }
  }

  /** Appends the children of {@code parent} that follow {@code skip} as a parenthesized list. */
  private static void addList(StringBuilder sb, Node parent, @Nullable Node skip) {
    sb.append('(');
    boolean first = true;
    for (Node c = skip == null ? parent.getFirstChild() : skip.getNext();
        c != null;
        c = c.getNext()) {
      if (!first) {
        sb.append(", ");
      }
      add(sb, c, false);
      first = false;
    }
    sb.append(')');
  }
}
