// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0
package org.sosy_lab.sfcchecker.sfc.ast;

import static com.google.common.base.Preconditions.checkArgument;

/** Reference to a declared variable. */
public final class IdExpression extends SfcExpression {

  private final String name;

  public IdExpression(String pName) {
    checkArgument(pName != null && !pName.isEmpty(), "Variable name must not be empty");
    name = pName;
  }

  public String getName() {
    return name;
  }

  @Override
  public <R, X extends Exception> R accept(SfcExpressionVisitor<R, X> pVisitor) throws X {
    return pVisitor.visit(this);
  }

  @Override
  public int hashCode() {
    return name.hashCode();
  }

  @Override
  public boolean equals(Object pObj) {
    if (this == pObj) {
      return true;
    }
    return pObj instanceof IdExpression && name.equals(((IdExpression) pObj).name);
  }
}
