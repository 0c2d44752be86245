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

public final class UnaryExpression extends SfcExpression {

  public enum UnaryOperator {
    NOT("not"),
    MINUS("-");

    private final String op;

    UnaryOperator(String pOp) {
      op = pOp;
    }

    public String getOperator() {
      return op;
    }
  }

  private final SfcExpression operand;
  private final UnaryOperator operator;

  public UnaryExpression(SfcExpression pOperand, UnaryOperator pOperator) {
    operand = checkNotNull(pOperand);
    operator = checkNotNull(pOperator);
  }

  public SfcExpression getOperand() {
    return operand;
  }

  public UnaryOperator getOperator() {
    return operator;
  }

  @Override
  public <R, X extends Exception> R accept(SfcExpressionVisitor<R, X> pVisitor) throws X {
    return pVisitor.visit(this);
  }

  @Override
  public int hashCode() {
    return Objects.hash(operand, operator);
  }

  @Override
  public boolean equals(Object pObj) {
    if (this == pObj) {
      return true;
    }
    if (!(pObj instanceof UnaryExpression)) {
      return false;
    }
    UnaryExpression other = (UnaryExpression) pObj;
    return operator == other.operator && operand.equals(other.operand);
  }
}
