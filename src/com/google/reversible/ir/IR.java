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
import static com.google.common.base.Preconditions.checkState;

import java.util.List;

/**
 * An AST construction helper class.
 *
 * <p>The helpers check shape only. Whether a tree is a legal reversible program is decided when
 * the procedure is registered, so the illegal forms (for example {@link #assignOp} with
 * {@link Token#ASSIGN_MUL}) can still be built.
 */
public class IR {

  private IR() {}

  public static Node procedure(Node name, Node params, Node body) {
    checkState(name.isName(), name);
    checkState(params.isParamList(), params);
    checkState(body.isBlock(), body);
    return new Node(Token.PROCEDURE, name, params, body);
  }

  public static Node procedure(String name, List<String> params, Node body) {
    Node paramList = paramList();
    for (String param : params) {
      paramList.addChildToBack(name(param));
    }
    return procedure(name(name), paramList, body);
  }

  public static Node paramList(Node... params) {
    Node paramList = new Node(Token.PARAM_LIST);
    for (Node param : params) {
      checkState(param.isName(), param);
      paramList.addChildToBack(param);
    }
    return paramList;
  }

  public static Node block(Node... stmts) {
    Node block = new Node(Token.BLOCK);
    for (Node stmt : stmts) {
      checkState(mayBeStatement(stmt), stmt);
      block.addChildToBack(stmt);
    }
    return block;
  }

  public static Node block(List<Node> stmts) {
    return block(stmts.toArray(new Node[0]));
  }

  // Statements

  public static Node addAssign(Node target, Node expr) {
    return assignOp(Token.ASSIGN_ADD, target, expr);
  }

  public static Node subAssign(Node target, Node expr) {
    return assignOp(Token.ASSIGN_SUB, target, expr);
  }

  public static Node xorAssign(Node target, Node expr) {
    return assignOp(Token.ASSIGN_BITXOR, target, expr);
  }

  public static Node assignOp(Token op, Node target, Node expr) {
    checkArgument(op.isAssignmentOp(), op);
    checkState(mayBeExpression(target), target);
    checkState(mayBeExpression(expr), expr);
    return new Node(op, target, expr);
  }

  public static Node ifNode(Node guard, Node thenBlock, Node elseBlock, Node assertion) {
    checkState(mayBeExpression(guard), guard);
    checkState(thenBlock.isBlock(), thenBlock);
    checkState(elseBlock.isBlock(), elseBlock);
    checkState(mayBeExpression(assertion), assertion);
    return new Node(Token.IF, guard, thenBlock, elseBlock, assertion);
  }

  public static Node ifNode(Node guard, Node thenBlock, Node assertion) {
    return ifNode(guard, thenBlock, block(), assertion);
  }

  public static Node loop(Node from, Node doBlock, Node loopBlock, Node until) {
    checkState(mayBeExpression(from), from);
    checkState(doBlock.isBlock(), doBlock);
    checkState(loopBlock.isBlock(), loopBlock);
    checkState(mayBeExpression(until), until);
    return new Node(Token.LOOP, from, doBlock, loopBlock, until);
  }

  public static Node loop(Node from, Node loopBlock, Node until) {
    return loop(from, block(), loopBlock, until);
  }

  public static Node call(Node callee, Node... args) {
    return invocation(Token.CALL, callee, args);
  }

  public static Node uncall(Node callee, Node... args) {
    return invocation(Token.UNCALL, callee, args);
  }

  private static Node invocation(Token token, Node callee, Node... args) {
    checkState(callee.isName(), callee);
    Node call = new Node(token, callee);
    for (Node arg : args) {
      checkState(mayBeExpression(arg), arg);
      call.addChildToBack(arg);
    }
    return call;
  }

  public static Node swap(Node left, Node right) {
    checkState(mayBeExpression(left), left);
    checkState(mayBeExpression(right), right);
    return new Node(Token.SWAP, left, right);
  }

  /** Introduces the local {@code name} initialized to {@code init}. */
  public static Node local(Node name, Node init) {
    checkState(name.isName() && !name.hasChildren(), name);
    checkState(mayBeExpression(init), init);
    name.addChildToBack(init);
    return new Node(Token.LOCAL, name);
  }

  /** Releases the local {@code name}, which must then hold the value of {@code value}. */
  public static Node delocal(Node name, Node value) {
    checkState(name.isName() && !name.hasChildren(), name);
    checkState(mayBeExpression(value), value);
    return new Node(Token.DELOCAL, name, value);
  }

  // Expressions

  public static Node name(String name) {
    checkArgument(!name.isEmpty(), "empty name");
    return Node.newString(Token.NAME, name);
  }

  public static Node number(long value) {
    return Node.newNumber(value);
  }

  public static Node getelem(Node target, Node index) {
    checkState(target.isName(), target);
    checkState(mayBeExpression(index), index);
    return new Node(Token.GETELEM, target, index);
  }

  public static Node hook(Node cond, Node trueval, Node falseval) {
    return operator(Token.HOOK, cond, trueval, falseval);
  }

  public static Node and(Node expr1, Node expr2) {
    return operator(Token.AND, expr1, expr2);
  }

  public static Node or(Node expr1, Node expr2) {
    return operator(Token.OR, expr1, expr2);
  }

  public static Node not(Node expr1) {
    return operator(Token.NOT, expr1);
  }

  public static Node neg(Node expr1) {
    return operator(Token.NEG, expr1);
  }

  public static Node bitnot(Node expr1) {
    return operator(Token.BITNOT, expr1);
  }

  public static Node eq(Node expr1, Node expr2) {
    return operator(Token.EQ, expr1, expr2);
  }

  public static Node ne(Node expr1, Node expr2) {
    return operator(Token.NE, expr1, expr2);
  }

  public static Node lt(Node expr1, Node expr2) {
    return operator(Token.LT, expr1, expr2);
  }

  public static Node le(Node expr1, Node expr2) {
    return operator(Token.LE, expr1, expr2);
  }

  public static Node gt(Node expr1, Node expr2) {
    return operator(Token.GT, expr1, expr2);
  }

  public static Node ge(Node expr1, Node expr2) {
    return operator(Token.GE, expr1, expr2);
  }

  public static Node add(Node expr1, Node expr2) {
    return operator(Token.ADD, expr1, expr2);
  }

  public static Node sub(Node expr1, Node expr2) {
    return operator(Token.SUB, expr1, expr2);
  }

  public static Node mul(Node expr1, Node expr2) {
    return operator(Token.MUL, expr1, expr2);
  }

  public static Node div(Node expr1, Node expr2) {
    return operator(Token.DIV, expr1, expr2);
  }

  public static Node mod(Node expr1, Node expr2) {
    return operator(Token.MOD, expr1, expr2);
  }

  public static Node bitand(Node expr1, Node expr2) {
    return operator(Token.BITAND, expr1, expr2);
  }

  public static Node bitor(Node expr1, Node expr2) {
    return operator(Token.BITOR, expr1, expr2);
  }

  public static Node bitxor(Node expr1, Node expr2) {
    return operator(Token.BITXOR, expr1, expr2);
  }

  public static Node lsh(Node expr1, Node expr2) {
    return operator(Token.LSH, expr1, expr2);
  }

  public static Node rsh(Node expr1, Node expr2) {
    return operator(Token.RSH, expr1, expr2);
  }

  public static Node inc(Node target) {
    return operator(Token.INC, target);
  }

  public static Node dec(Node target) {
    return operator(Token.DEC, target);
  }

  public static Node operator(Token op, Node... operands) {
    checkArgument(op.operatorArity() == operands.length, "%s takes %s operands", op,
        op.operatorArity());
    for (Node operand : operands) {
      checkState(mayBeExpression(operand), operand);
    }
    return new Node(op, operands);
  }

  /**
   * It isn't possible to always determine if a detached node is an expression, so just reject
   * known structural nodes.
   */
  static boolean mayBeExpression(Node n) {
    switch (n.getToken()) {
      case PROCEDURE:
      case PARAM_LIST:
      case BLOCK:
      case IF:
      case LOOP:
      case UNCALL:
      case SWAP:
      case LOCAL:
      case DELOCAL:
        return false;
      default:
        return n.getParent() == null;
    }
  }

  static boolean mayBeStatement(Node n) {
    return n.getToken().isStatement() && n.getParent() == null;
  }
}
