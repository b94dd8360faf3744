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

/**
 * The node types of the reversible intermediate representation.
 *
 * <p>Some tokens (the non-reversible compound assignments, {@link #INC}, {@link #DEC}) have no
 * legal use. They exist so that a front end can hand over whatever it parsed and the legality
 * checks can reject it with a precise diagnostic.
 */
public enum Token {
  PROCEDURE,
  PARAM_LIST,
  BLOCK,

  // Statements
  ASSIGN,
  ASSIGN_ADD,
  ASSIGN_SUB,
  ASSIGN_BITXOR,
  ASSIGN_MUL,
  ASSIGN_DIV,
  ASSIGN_MOD,
  ASSIGN_BITAND,
  ASSIGN_BITOR,
  ASSIGN_LSH,
  ASSIGN_RSH,
  IF,
  LOOP,
  CALL,
  UNCALL,
  SWAP,
  LOCAL,
  DELOCAL,

  // Expressions
  NAME,
  NUMBER,
  GETELEM,
  ADD,
  SUB,
  MUL,
  DIV,
  MOD,
  BITAND,
  BITOR,
  BITXOR,
  LSH,
  RSH,
  EQ,
  NE,
  LT,
  LE,
  GT,
  GE,
  AND,
  OR,
  NOT,
  NEG,
  BITNOT,
  HOOK,
  INC,
  DEC;

  /** Returns the arity of operator tokens, or -1 for tokens that are not operators. */
  public int operatorArity() {
    switch (this) {
      case NOT:
      case NEG:
      case BITNOT:
      case INC:
      case DEC:
        return 1;
      case ADD:
      case SUB:
      case MUL:
      case DIV:
      case MOD:
      case BITAND:
      case BITOR:
      case BITXOR:
      case LSH:
      case RSH:
      case EQ:
      case NE:
      case LT:
      case LE:
      case GT:
      case GE:
      case AND:
      case OR:
        return 2;
      case HOOK:
        return 3;
      default:
        return -1;
    }
  }

  /** Whether this token is one of the compound assignments, legal or not. */
  public boolean isAssignmentOp() {
    switch (this) {
      case ASSIGN:
      case ASSIGN_ADD:
      case ASSIGN_SUB:
      case ASSIGN_BITXOR:
      case ASSIGN_MUL:
      case ASSIGN_DIV:
      case ASSIGN_MOD:
      case ASSIGN_BITAND:
      case ASSIGN_BITOR:
      case ASSIGN_LSH:
      case ASSIGN_RSH:
        return true;
      default:
        return false;
    }
  }

  /** Whether a node of this token mutates storage when evaluated. */
  public boolean isMutating() {
    return isAssignmentOp() || this == INC || this == DEC || this == SWAP;
  }

  /** Whether this token names a statement form. */
  public boolean isStatement() {
    if (isAssignmentOp()) {
      return true;
    }
    switch (this) {
      case IF:
      case LOOP:
      case CALL:
      case UNCALL:
      case SWAP:
      case LOCAL:
      case DELOCAL:
        return true;
      default:
        return false;
    }
  }
}
