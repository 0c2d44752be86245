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

/** A single action statement {@code var := expr}. */
public final class Assignment {

  private final IdExpression leftHandSide;
  private final SfcExpression rightHandSide;

  public Assignment(IdExpression pLeftHandSide, SfcExpression pRightHandSide) {
    leftHandSide = checkNotNull(pLeftHandSide);
    rightHandSide = checkNotNull(pRightHandSide);
  }

  public IdExpression getLeftHandSide() {
    return leftHandSide;
  }

  public String getVariableName() {
    return leftHandSide.getName();
  }

  public SfcExpression getRightHandSide() {
    return rightHandSide;
  }

  @Override
  public int hashCode() {
    return Objects.hash(leftHandSide, rightHandSide);
  }

  @Override
  public boolean equals(Object pObj) {
    if (this == pObj) {
      return true;
    }
    if (!(pObj instanceof Assignment)) {
      return false;
    }
    Assignment other = (Assignment) pObj;
    return leftHandSide.equals(other.leftHandSide) && rightHandSide.equals(other.rightHandSide);
  }

  @Override
  public String toString() {
    return leftHandSide.getName() + " := " + rightHandSide;
  }
}
