// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0
package org.sosy_lab.sfcchecker.sfc.ast;

public interface SfcExpressionVisitor<R, X extends Exception> {

  R visit(IdExpression pE) throws X;

  R visit(IntegerLiteralExpression pE) throws X;

  R visit(BooleanLiteralExpression pE) throws X;

  R visit(StringLiteralExpression pE) throws X;

  R visit(BinaryExpression pE) throws X;

  R visit(UnaryExpression pE) throws X;
}
