// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0
package org.sosy_lab.sfcchecker.sfc.ast;

/**
 * Immutable node of a guard or action expression. Equality is structural, so two expressions
 * parsed from the same text are equal.
 */
public abstract class SfcExpression {

  SfcExpression() {}

  public abstract <R, X extends Exception> R accept(SfcExpressionVisitor<R, X> pVisitor) throws X;

  @Override
  public String toString() {
    return accept(ExpToStringVisitor.getInstance());
  }
}
