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

import com.google.common.collect.ImmutableMap;
import com.google.reversible.ir.Node;
import com.google.reversible.ir.Token;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Checks, once per definition, that a procedure only uses statements that have an inverse.
 *
 * <p>The validator walks the whole definition and reports every violation it finds to the
 * {@link ErrorManager} instead of stopping at the first one. Aliasing that depends on the values
 * of index expressions or on the handles passed by a caller can only be seen at run time, see
 * {@link AliasChecker}.
 */
public final class LegalityValidator {

  public static final DiagnosticType ILLEGAL_OPERATOR =
      DiagnosticType.error(
          "RV_ILLEGAL_OPERATOR",
          "Operator {0} has no inverse. Storage may only be updated with +=, -= or ^=.");

  public static final DiagnosticType SELF_ALIASED_ASSIGNMENT =
      DiagnosticType.error(
          "RV_SELF_ALIASED_ASSIGNMENT", "{0} is read by the statement that updates it.");

  public static final DiagnosticType NON_REVERSIBLE_CALL =
      DiagnosticType.error("RV_NON_REVERSIBLE_CALL", "Call to {0} is not reversible: {1}.");

  public static final DiagnosticType ARITY_MISMATCH =
      DiagnosticType.error("RV_ARITY_MISMATCH", "{0} takes {1} argument(s) but is given {2}.");

  public static final DiagnosticType DUPLICATE_PARAMETER =
      DiagnosticType.error("RV_DUPLICATE_PARAMETER", "Parameter {0} is declared more than once.");

  public static final DiagnosticType UNMATCHED_LOCAL =
      DiagnosticType.error(
          "RV_UNMATCHED_LOCAL", "Local {0} is not released by a delocal in the same block.");

  public static final DiagnosticType DELOCAL_WITHOUT_LOCAL =
      DiagnosticType.error(
          "RV_DELOCAL_WITHOUT_LOCAL", "{0} is not a local of the enclosing block.");

  public static final DiagnosticType DUPLICATE_BINDING =
      DiagnosticType.error(
          "RV_DUPLICATE_BINDING", "Local {0} shadows a live binding of the same name.");

  public static final DiagnosticType MALFORMED_NODE =
      DiagnosticType.error("RV_MALFORMED_NODE", "Unexpected {0}: expected {1}.");

  public static final DiagnosticType CONSTANT_ASSERTION =
      DiagnosticType.warning(
          "RV_CONSTANT_ASSERTION",
          "The assertion {0} is constant and cannot tell which branch was taken.");

  private final ErrorManager errorManager;
  private final EngineOptions options;
  private final ImmutableMap<String, Integer> signatures;

  private @Nullable String procedureName;

  /**
   * @param signatures the arity of every procedure a call may target, including the ones being
   *     validated
   */
  public LegalityValidator(
      ErrorManager errorManager, EngineOptions options, Map<String, Integer> signatures) {
    this.errorManager = checkNotNull(errorManager);
    this.options = checkNotNull(options);
    this.signatures = ImmutableMap.copyOf(signatures);
  }

  /** Validates one procedure definition. */
  public void validate(Node definition) {
    procedureName = null;
    if (!definition.isProcedure()
        || definition.getChildCount() != 3
        || !definition.getFirstChild().isName()
        || !definition.getSecondChild().isParamList()
        || !definition.getLastChild().isBlock()) {
      reportMalformed(definition, "procedure(name, params, body)");
      return;
    }
    procedureName = definition.getFirstChild().getString();

    Set<String> live = new HashSet<>();
    for (Node param : definition.getSecondChild().children()) {
      if (!param.isName() || param.hasChildren()) {
        reportMalformed(param, "a parameter name");
      } else if (!live.add(param.getString())) {
        report(param, DUPLICATE_PARAMETER, param.getString());
      }
    }
    validateBlock(definition.getLastChild(), live);
  }

  private void validateBlock(Node block, Set<String> live) {
    List<Node> openLocals = new ArrayList<>();
    for (Node stmt : block.children()) {
      validateStatement(stmt, live, openLocals);
    }
    for (Node local : openLocals) {
      String name = local.getFirstChild().getString();
      report(local, UNMATCHED_LOCAL, name);
      live.remove(name);
    }
  }

  private void validateStatement(Node n, Set<String> live, List<Node> openLocals) {
    Token token = n.getToken();
    if (token.isAssignmentOp()) {
      validateAssignment(n);
      return;
    }
    switch (token) {
      case IF:
        validateIf(n, live);
        return;
      case LOOP:
        validateLoop(n, live);
        return;
      case CALL:
      case UNCALL:
        validateCall(n);
        return;
      case SWAP:
        validateSwap(n);
        return;
      case LOCAL:
        validateLocal(n, live, openLocals);
        return;
      case DELOCAL:
        validateDelocal(n, live, openLocals);
        return;
      default:
        reportMalformed(n, "a statement");
    }
  }

  private void validateAssignment(Node n) {
    if (n.getChildCount() != 2) {
      reportMalformed(n, "an update of a variable reference");
      return;
    }
    if (ReversibleOperator.fromToken(n.getToken()) == null) {
      report(n, ILLEGAL_OPERATOR, CodePrinter.getOperatorSymbol(n.getToken()));
    }
    Node target = n.getFirstChild();
    Node rhs = n.getLastChild();
    boolean validTarget = validateVarRef(target);
    validateExpression(rhs);
    if (validTarget && readsTarget(rhs, target)) {
      report(n, SELF_ALIASED_ASSIGNMENT, CodePrinter.toSource(target));
    }
  }

  /**
   * Whether {@code expr} may read the storage {@code target} denotes. A scalar or whole-array
   * target conflicts with any mention of its name; an element conflicts with the same element.
   * Elements whose indices only differ at run time are left to {@link AliasChecker}.
   */
  private static boolean readsTarget(Node expr, Node target) {
    if (target.isName()) {
      return NodeUtil.referencesName(expr, target.getString());
    }
    return NodeUtil.containsEquivalent(expr, target);
  }

  private void validateIf(Node n, Set<String> live) {
    if (n.getChildCount() != 4
        || !n.getSecondChild().isBlock()
        || !n.getChildAtIndex(2).isBlock()) {
      reportMalformed(n, "if (guard) then else fi (assertion)");
      return;
    }
    Node thenBlock = n.getSecondChild();
    Node elseBlock = n.getChildAtIndex(2);
    Node assertion = n.getLastChild();
    validateExpression(n.getFirstChild());
    validateBlock(thenBlock, live);
    validateBlock(elseBlock, live);
    validateExpression(assertion);

    if (assertion.isNumber()
        && !NodeUtil.isEmptyBlock(thenBlock)
        && !NodeUtil.isEmptyBlock(elseBlock)) {
      report(n, CONSTANT_ASSERTION, CodePrinter.toSource(assertion));
    }
  }

  private void validateLoop(Node n, Set<String> live) {
    if (n.getChildCount() != 4
        || !n.getSecondChild().isBlock()
        || !n.getChildAtIndex(2).isBlock()) {
      reportMalformed(n, "from (entry) do loop until (exit)");
      return;
    }
    validateExpression(n.getFirstChild());
    validateBlock(n.getSecondChild(), live);
    validateBlock(n.getChildAtIndex(2), live);
    validateExpression(n.getLastChild());
  }

  private void validateCall(Node n) {
    Node callee = n.getFirstChild();
    if (callee == null || !callee.isName() || callee.hasChildren()) {
      reportMalformed(n, "a call of a named procedure");
      return;
    }
    String name = callee.getString();
    int argc = n.getChildCount() - 1;
    Integer arity = signatures.get(name);
    if (arity == null) {
      report(n, NON_REVERSIBLE_CALL, name, "no reversible procedure of that name is registered");
    } else if (arity != argc) {
      report(n, ARITY_MISMATCH, name, String.valueOf(arity), String.valueOf(argc));
    }
    for (Node arg = callee.getNext(); arg != null; arg = arg.getNext()) {
      validateVarRef(arg);
    }
  }

  private void validateSwap(Node n) {
    if (n.getChildCount() != 2) {
      reportMalformed(n, "a swap of two variable references");
      return;
    }
    Node left = n.getFirstChild();
    Node right = n.getLastChild();
    boolean valid = validateVarRef(left) & validateVarRef(right);
    if (valid && left.isEquivalentTo(right)) {
      report(n, SELF_ALIASED_ASSIGNMENT, CodePrinter.toSource(left));
    }
  }

  private void validateLocal(Node n, Set<String> live, List<Node> openLocals) {
    Node nameNode = n.getFirstChild();
    if (!n.hasOneChild() || !nameNode.isName() || !nameNode.hasOneChild()) {
      reportMalformed(n, "local name = initializer");
      return;
    }
    String name = nameNode.getString();
    Node init = nameNode.getFirstChild();
    validateExpression(init);
    if (NodeUtil.referencesName(init, name)) {
      report(n, SELF_ALIASED_ASSIGNMENT, name);
    }
    if (live.contains(name)) {
      report(n, DUPLICATE_BINDING, name);
      return;
    }
    live.add(name);
    openLocals.add(n);
  }

  private void validateDelocal(Node n, Set<String> live, List<Node> openLocals) {
    Node nameNode = n.getFirstChild();
    if (n.getChildCount() != 2 || !nameNode.isName() || nameNode.hasChildren()) {
      reportMalformed(n, "delocal name = value");
      return;
    }
    String name = nameNode.getString();
    Node value = n.getLastChild();
    validateExpression(value);
    if (NodeUtil.referencesName(value, name)) {
      report(n, SELF_ALIASED_ASSIGNMENT, name);
    }
    for (Iterator<Node> it = openLocals.iterator(); it.hasNext(); ) {
      if (it.next().getFirstChild().getString().equals(name)) {
        it.remove();
        live.remove(name);
        return;
      }
    }
    report(n, DELOCAL_WITHOUT_LOCAL, name);
  }

  /** Reports and returns false unless {@code n} is a variable reference. */
  private boolean validateVarRef(Node n) {
    if (!NodeUtil.isVarRef(n)) {
      reportMalformed(n, "a variable reference");
      return false;
    }
    if (n.isGetElem()) {
      validateExpression(n.getSecondChild());
    }
    return true;
  }

  private void validateExpression(Node expr) {
    NodeTraversal.traverse(expr, new ExpressionChecker());
  }

  /** Reports every sub-expression that could mutate storage or is not an expression at all. */
  private final class ExpressionChecker implements NodeTraversal.Callback {
    @Override
    public boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent) {
      Token token = n.getToken();
      if (token.isMutating()) {
        report(n, ILLEGAL_OPERATOR, CodePrinter.getOperatorSymbol(token));
        return false;
      }
      switch (token) {
        case CALL:
        case UNCALL:
          Node callee = n.getFirstChild();
          report(
              n,
              NON_REVERSIBLE_CALL,
              callee != null && callee.isName() ? callee.getString() : "<anonymous>",
              "calls may not appear inside an expression");
          return false;
        case NAME:
          if (n.hasChildren()) {
            reportMalformed(n, "a variable name");
          }
          return false;
        case NUMBER:
          return false;
        case GETELEM:
          if (!NodeUtil.isVarRef(n)) {
            reportMalformed(n, "an element of a named array");
            return false;
          }
          return true;
        default:
          int arity = token.operatorArity();
          if (arity < 0) {
            reportMalformed(n, "an expression");
            return false;
          }
          if (n.getChildCount() != arity) {
            reportMalformed(n, "an operator with " + arity + " operand(s)");
            return false;
          }
          return true;
      }
    }

    @Override
    public void visit(NodeTraversal t, Node n, @Nullable Node parent) {}
  }

  private void reportMalformed(Node n, String expected) {
    report(n, MALFORMED_NODE, n.getToken().toString(), expected);
  }

  private void report(Node n, DiagnosticType type, String... arguments) {
    CheckLevel level = options.getLevel(type);
    if (level.isOn()) {
      errorManager.report(level, ReversibilityError.make(procedureName, n, type, arguments));
    }
  }
}
