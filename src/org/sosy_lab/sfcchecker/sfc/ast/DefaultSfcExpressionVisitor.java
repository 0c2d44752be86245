// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0
package org.sosy_lab.sfcchecker.sfc.ast;

/** Visitor that delegates every node it does not override to {@link #visitDefault}. */
public abstract class DefaultSfcExpressionVisitor<R, X extends Exception>
    implements SfcExpressionVisitor<R, X> {

  protected abstract R visitDefault(SfcExpression pExp) throws X;

  @Override
  public R visit(IdExpression pE) throws X {
    return visitDefault(pE);
  }

  @Override
  public R visit(IntegerLiteralExpression pE) throws X {
    return visitDefault(pE);
  }

  @Override
  public R visit(BooleanLiteralExpression pE) throws X {
    return visitDefault(pE);
  }

  @Override
  public R visit(StringLiteralExpression pE) throws X {
    return visitDefault(pE);
  }

  @Override
  public R visit(BinaryExpression pE) throws X {
    return visitDefault(pE);
  }

  @Override
  public R visit(UnaryExpression pE) throws X {
    return visitDefault(pE);
  }
}
