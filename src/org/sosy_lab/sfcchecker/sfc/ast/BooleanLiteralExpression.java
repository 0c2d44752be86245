// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0
package org.sosy_lab.sfcchecker.sfc.ast;

public final class BooleanLiteralExpression extends SfcExpression {

  public static final BooleanLiteralExpression TRUE = new BooleanLiteralExpression(true);
  public static final BooleanLiteralExpression FALSE = new BooleanLiteralExpression(false);

  private final boolean value;

  private BooleanLiteralExpression(boolean pValue) {
    value = pValue;
  }

  public static BooleanLiteralExpression of(boolean pValue) {
    return pValue ? TRUE : FALSE;
  }

  public boolean getValue() {
    return value;
  }

  @Override
  public <R, X extends Exception> R accept(SfcExpressionVisitor<R, X> pVisitor) throws X {
    return pVisitor.visit(this);
  }

  @Override
  public int hashCode() {
    return Boolean.hashCode(value);
  }

  @Override
  public boolean equals(Object pObj) {
    return pObj instanceof BooleanLiteralExpression
        && value == ((BooleanLiteralExpression) pObj).value;
  }
}
