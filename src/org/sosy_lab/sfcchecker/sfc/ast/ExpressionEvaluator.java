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
import java.util.Map;
import org.sosy_lab.sfcchecker.exceptions.EvaluationException;

/**
 * Evaluates expressions on concrete values. Values are {@link Boolean}, {@link BigInteger} or
 * {@link String}. Integer division is Euclidean, like {@code div} in SMT-LIB, so that concrete
 * and symbolic evaluation agree.
 */
public class ExpressionEvaluator implements SfcExpressionVisitor<Object, EvaluationException> {

  private final Map<String, ?> values;

  public ExpressionEvaluator(Map<String, ?> pValues) {
    values = checkNotNull(pValues);
  }

  public boolean evaluateCondition(SfcExpression pExp) throws EvaluationException {
    return asBoolean(pExp.accept(this), pExp);
  }

  public Object evaluate(SfcExpression pExp) throws EvaluationException {
    return pExp.accept(this);
  }

  @Override
  public Object visit(IdExpression pE) throws EvaluationException {
    Object value = values.get(pE.getName());
    if (value == null) {
      throw new EvaluationException("Variable " + pE.getName() + " has no value");
    }
    return value;
  }

  @Override
  public Object visit(IntegerLiteralExpression pE) {
    return pE.getValue();
  }

  @Override
  public Object visit(BooleanLiteralExpression pE) {
    return pE.getValue();
  }

  @Override
  public Object visit(StringLiteralExpression pE) {
    return pE.getValue();
  }

  @Override
  public Object visit(BinaryExpression pE) throws EvaluationException {
    switch (pE.getOperator()) {
      case AND:
        // short-circuit like the controller would
        return asBoolean(pE.getOperand1().accept(this), pE)
            && asBoolean(pE.getOperand2().accept(this), pE);
      case OR:
        return asBoolean(pE.getOperand1().accept(this), pE)
            || asBoolean(pE.getOperand2().accept(this), pE);
      case EQUALS:
        return pE.getOperand1().accept(this).equals(pE.getOperand2().accept(this));
      case NOT_EQUALS:
        return !pE.getOperand1().accept(this).equals(pE.getOperand2().accept(this));
      default:
        break;
    }

    BigInteger op1 = asInteger(pE.getOperand1().accept(this), pE);
    BigInteger op2 = asInteger(pE.getOperand2().accept(this), pE);
    switch (pE.getOperator()) {
      case PLUS:
        return op1.add(op2);
      case MINUS:
        return op1.subtract(op2);
      case MULTIPLY:
        return op1.multiply(op2);
      case DIVIDE:
        return euclideanDivide(op1, op2);
      case LESS_THAN:
        return op1.compareTo(op2) < 0;
      case LESS_EQUAL:
        return op1.compareTo(op2) <= 0;
      case GREATER_THAN:
        return op1.compareTo(op2) > 0;
      case GREATER_EQUAL:
        return op1.compareTo(op2) >= 0;
      default:
        throw new AssertionError("unhandled operator " + pE.getOperator());
    }
  }

  @Override
  public Object visit(UnaryExpression pE) throws EvaluationException {
    Object operand = pE.getOperand().accept(this);
    switch (pE.getOperator()) {
      case NOT:
        return !asBoolean(operand, pE);
      case MINUS:
        return asInteger(operand, pE).negate();
      default:
        throw new AssertionError("unhandled operator " + pE.getOperator());
    }
  }

  static BigInteger euclideanDivide(BigInteger pNumerator, BigInteger pDenominator)
      throws EvaluationException {
    if (pDenominator.signum() == 0) {
      throw new EvaluationException("Division by zero");
    }
    BigInteger[] qr = pNumerator.divideAndRemainder(pDenominator);
    BigInteger quotient = qr[0];
    if (qr[1].signum() < 0) {
      // the remainder has to be non-negative
      quotient =
          pDenominator.signum() > 0
              ? quotient.subtract(BigInteger.ONE)
              : quotient.add(BigInteger.ONE);
    }
    return quotient;
  }

  private static boolean asBoolean(Object pValue, SfcExpression pContext)
      throws EvaluationException {
    if (pValue instanceof Boolean) {
      return (Boolean) pValue;
    }
    throw new EvaluationException(
        "Expected a boolean value in " + pContext + " but got " + pValue);
  }

  private static BigInteger asInteger(Object pValue, SfcExpression pContext)
      throws EvaluationException {
    if (pValue instanceof BigInteger) {
      return (BigInteger) pValue;
    }
    throw new EvaluationException(
        "Expected an integer value in " + pContext + " but got " + pValue);
  }
}
