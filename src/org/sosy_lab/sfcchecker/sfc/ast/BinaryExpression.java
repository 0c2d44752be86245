// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0
package org.sosy_lab.sfcchecker.sfc.ast;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Objects;

public final class BinaryExpression extends SfcExpression {

  public enum OperatorKind {
    ARITHMETIC,
    ORDERING,
    EQUALITY,
    LOGICAL
  }

  public enum BinaryOperator {
    MULTIPLY("*", OperatorKind.ARITHMETIC, 5),
    DIVIDE("/", OperatorKind.ARITHMETIC, 5),
    PLUS("+", OperatorKind.ARITHMETIC, 4),
    MINUS("-", OperatorKind.ARITHMETIC, 4),
    LESS_THAN("<", OperatorKind.ORDERING, 3),
    LESS_EQUAL("<=", OperatorKind.ORDERING, 3),
    GREATER_THAN(">", OperatorKind.ORDERING, 3),
    GREATER_EQUAL(">=", OperatorKind.ORDERING, 3),
    EQUALS("==", OperatorKind.EQUALITY, 3),
    NOT_EQUALS("!=", OperatorKind.EQUALITY, 3),
    AND("and", OperatorKind.LOGICAL, 2),
    OR("or", OperatorKind.LOGICAL, 1);

    private final String op;
    private final OperatorKind kind;
    // higher binds tighter
    private final int precedence;

    BinaryOperator(String pOp, OperatorKind pKind, int pPrecedence) {
      op = pOp;
      kind = pKind;
      precedence = pPrecedence;
    }

    public String getOperator() {
      return op;
    }

    public OperatorKind getKind() {
      return kind;
    }

    public int getPrecedence() {
      return precedence;
    }
  }

  private final SfcExpression operand1;
  private final SfcExpression operand2;
  private final BinaryOperator operator;

  public BinaryExpression(SfcExpression pOperand1, SfcExpression pOperand2, BinaryOperator pOp) {
    operand1 = checkNotNull(pOperand1);
    operand2 = checkNotNull(pOperand2);
    operator = checkNotNull(pOp);
  }

  public SfcExpression getOperand1() {
    return operand1;
  }

  public SfcExpression getOperand2() {
    return operand2;
  }

  public BinaryOperator getOperator() {
    return operator;
  }

  @Override
  public <R, X extends Exception> R accept(SfcExpressionVisitor<R, X> pVisitor) throws X {
    return pVisitor.visit(this);
  }

  @Override
  public int hashCode() {
    return Objects.hash(operand1, operand2, operator);
  }

  @Override
  public boolean equals(Object pObj) {
    if (this == pObj) {
      return true;
    }
    if (!(pObj instanceof BinaryExpression)) {
      return false;
    }
    BinaryExpression other = (BinaryExpression) pObj;
    return operator == other.operator
        && operand1.equals(other.operand1)
        && operand2.equals(other.operand2);
  }
}
