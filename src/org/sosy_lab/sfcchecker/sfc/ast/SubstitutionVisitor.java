// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0
package org.sosy_lab.sfcchecker.sfc.ast;

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import org.sosy_lab.sfcchecker.exceptions.NoException;

/**
 * Replaces variables by expressions simultaneously: every {@link IdExpression} whose name is a key
 * of the substitution is replaced by the mapped expression, the replacements themselves are not
 * visited again.
 */
public class SubstitutionVisitor extends DefaultSfcExpressionVisitor<SfcExpression, NoException> {

  private final ImmutableMap<String, SfcExpression> substitution;

  public SubstitutionVisitor(Map<String, ? extends SfcExpression> pSubstitution) {
    substitution = ImmutableMap.copyOf(pSubstitution);
  }

  public SfcExpression substitute(SfcExpression pExp) {
    return substitution.isEmpty() ? pExp : pExp.accept(this);
  }

  @Override
  public SfcExpression visit(IdExpression pE) throws NoException {
    // the bottom expression.
    SfcExpression replacement = substitution.get(pE.getName());
    return replacement != null ? replacement : pE;
  }

  @Override
  public SfcExpression visit(BinaryExpression pE) throws NoException {
    SfcExpression op1 = pE.getOperand1().accept(this), op2 = pE.getOperand2().accept(this);
    if (op1 == pE.getOperand1() && op2 == pE.getOperand2()) {
      return pE;
    }
    return new BinaryExpression(op1, op2, pE.getOperator());
  }

  @Override
  public SfcExpression visit(UnaryExpression pE) throws NoException {
    SfcExpression op = pE.getOperand().accept(this);
    return op == pE.getOperand() ? pE : new UnaryExpression(op, pE.getOperator());
  }

  @Override
  protected SfcExpression visitDefault(SfcExpression pExp) throws NoException {
    // literals are returned unchanged.
    return pExp;
  }
}
