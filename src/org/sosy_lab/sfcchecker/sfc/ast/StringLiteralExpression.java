// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0
package org.sosy_lab.sfcchecker.sfc.ast;

import static com.google.common.base.Preconditions.checkNotNull;

public final class StringLiteralExpression extends SfcExpression {

  private final String value;

  public StringLiteralExpression(String pValue) {
    value = checkNotNull(pValue);
  }

  public String getValue() {
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
    return pObj instanceof StringLiteralExpression
        && value.equals(((StringLiteralExpression) pObj).value);
  }
}
