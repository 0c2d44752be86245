// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0
package org.sosy_lab.sfcchecker.sfc.ast;

import org.sosy_lab.sfcchecker.exceptions.NoException;
import org.sosy_lab.sfcchecker.sfc.ast.BinaryExpression.BinaryOperator;

/**
 * Prints an expression in the concrete guard/action syntax, so that the result can be parsed
 * again. Parentheses are only emitted where operator precedence requires them.
 */
public class ExpToStringVisitor implements SfcExpressionVisitor<String, NoException> {

  private static final int ATOM_PRECEDENCE = 7;
  private static final int UNARY_PRECEDENCE = 6;

  private static ExpToStringVisitor instance;

  public static ExpToStringVisitor getInstance() {
    if (instance == null) {
      instance = new ExpToStringVisitor();
    }
    return instance;
  }

  private ExpToStringVisitor() {}

  @Override
  public String visit(IdExpression pE) throws NoException {
    return pE.getName();
  }

  @Override
  public String visit(IntegerLiteralExpression pE) throws NoException {
    return pE.getValue().toString();
  }

  @Override
  public String visit(BooleanLiteralExpression pE) throws NoException {
    return pE.getValue() ? "True" : "False";
  }

  @Override
  public String visit(StringLiteralExpression pE) throws NoException {
    return "\"" + pE.getValue().replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
  }

  @Override
  public String visit(BinaryExpression pE) throws NoException {
    BinaryOperator opt = pE.getOperator();
    int prec = opt.getPrecedence();
    // the right operand of a left-associative operator needs brackets on equal precedence
    String op1 = wrap(pE.getOperand1(), precedenceOf(pE.getOperand1()) < prec);
    String op2 = wrap(pE.getOperand2(), precedenceOf(pE.getOperand2()) <= prec);
    return op1 + " " + opt.getOperator() + " " + op2;
  }

  @Override
  public String visit(UnaryExpression pE) throws NoException {
    String operand = wrap(pE.getOperand(), precedenceOf(pE.getOperand()) < UNARY_PRECEDENCE);
    switch (pE.getOperator()) {
      case NOT:
        return "not " + operand;
      case MINUS:
        return "-" + operand;
      default:
        throw new AssertionError("unhandled expression " + pE.getOperator());
    }
  }

  private String wrap(SfcExpression pExp, boolean pParenthesize) {
    String rep = pExp.accept(this);
    return pParenthesize ? "(" + rep + ")" : rep;
  }

  private static int precedenceOf(SfcExpression pExp) {
    if (pExp instanceof BinaryExpression) {
      return ((BinaryExpression) pExp).getOperator().getPrecedence();
    } else if (pExp instanceof UnaryExpression) {
      return UNARY_PRECEDENCE;
    }
    return ATOM_PRECEDENCE;
  }
}
