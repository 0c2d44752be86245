// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0
package org.sosy_lab.sfcchecker.sfc.ast;

import static com.google.common.base.Preconditions.checkNotNull;

import java.math.BigInteger;

public final class IntegerLiteralExpression extends SfcExpression {

  private final BigInteger value;

  public IntegerLiteralExpression(BigInteger pValue) {
    value = checkNotNull(pValue);
  }

  public static IntegerLiteralExpression of(long pValue) {
    return new IntegerLiteralExpression(BigInteger.valueOf(pValue));
  }

  public BigInteger getValue() {
    return value;
  }

  @Override
  public <R, X extends Exception> R accept(SfcExpressionVisitor<R, X> pVisitor) throws X {
    return pVisitor.visit(this);
  }

  @Override
  public int hashCode() {
    return value.hashCode();
  }

  @Override
  public boolean equals(Object pObj) {
    if (this == pObj) {
      return true;
    }
    return pObj instanceof IntegerLiteralExpression
        && value.equals(((IntegerLiteralExpression) pObj).value);
  }
}
