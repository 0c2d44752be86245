// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0
package org.sosy_lab.sfcchecker.solver;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.BiMap;
import com.google.common.collect.HashBiMap;
import com.google.common.collect.ImmutableMap;
import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.java_smt.api.BooleanFormula;
import org.sosy_lab.java_smt.api.BooleanFormulaManager;
import org.sosy_lab.java_smt.api.Formula;
import org.sosy_lab.java_smt.api.FormulaManager;
import org.sosy_lab.java_smt.api.IntegerFormulaManager;
import org.sosy_lab.java_smt.api.Model;
import org.sosy_lab.java_smt.api.NumeralFormula.IntegerFormula;
import org.sosy_lab.sfcchecker.exceptions.NoException;
import org.sosy_lab.sfcchecker.sfc.VariableDomain;
import org.sosy_lab.sfcchecker.sfc.ast.BinaryExpression;
import org.sosy_lab.sfcchecker.sfc.ast.BinaryExpression.BinaryOperator;
import org.sosy_lab.sfcchecker.sfc.ast.BooleanLiteralExpression;
import org.sosy_lab.sfcchecker.sfc.ast.IdExpression;
import org.sosy_lab.sfcchecker.sfc.ast.IntegerLiteralExpression;
import org.sosy_lab.sfcchecker.sfc.ast.SfcExpression;
import org.sosy_lab.sfcchecker.sfc.ast.SfcExpressionVisitor;
import org.sosy_lab.sfcchecker.sfc.ast.StringLiteralExpression;
import org.sosy_lab.sfcchecker.sfc.ast.UnaryExpression;

/**
 * Translates chart expressions into formulas of one solver context. Integer and string variables
 * become integer formulas, string literals are interned as distinct integers. The encoder is
 * bound to its context and must not outlive it.
 */
public class FormulaEncoder implements SfcExpressionVisitor<Formula, NoException> {

  static final String VARIABLE_PREFIX = "v_";

  private final BooleanFormulaManager bmgr;
  private final IntegerFormulaManager imgr;
  private final ImmutableMap<String, VariableDomain> domains;

  private final Map<String, Formula> variables = new LinkedHashMap<>();
  private final BiMap<String, Integer> strings = HashBiMap.create();

  FormulaEncoder(FormulaManager pFmgr, Map<String, VariableDomain> pDomains) {
    bmgr = pFmgr.getBooleanFormulaManager();
    imgr = pFmgr.getIntegerFormulaManager();
    domains = ImmutableMap.copyOf(pDomains);
  }

  public BooleanFormulaManager getBooleanFormulaManager() {
    return bmgr;
  }

  public Formula encode(SfcExpression pExp) {
    return pExp.accept(this);
  }

  public BooleanFormula encodeCondition(SfcExpression pExp) {
    Formula f = encode(pExp);
    checkArgument(f instanceof BooleanFormula, "Not a condition: %s", pExp);
    return (BooleanFormula) f;
  }

  /** Equality of two encoded values of the same domain. */
  public BooleanFormula makeEqual(Formula pF1, Formula pF2) {
    if (pF1 instanceof BooleanFormula && pF2 instanceof BooleanFormula) {
      return bmgr.equivalence((BooleanFormula) pF1, (BooleanFormula) pF2);
    }
    return imgr.equal(asInteger(pF1), asInteger(pF2));
  }

  /** The variables encoded so far, by chart variable name. */
  public ImmutableMap<String, Formula> getVariables() {
    return ImmutableMap.copyOf(variables);
  }

  /**
   * Reads the value of an encoded variable from a model and converts it back to a chart value.
   *
   * @return a {@link Boolean}, {@link BigInteger} or {@link String}, or null if the model does
   *     not assign the variable.
   */
  public @Nullable Object decode(String pVariable, Model pModel) {
    Formula f = checkNotNull(variables.get(pVariable), "Variable %s was not encoded", pVariable);
    if (f instanceof BooleanFormula) {
      return pModel.evaluate((BooleanFormula) f);
    }
    BigInteger value = pModel.evaluate((IntegerFormula) f);
    if (value == null || domains.get(pVariable) != VariableDomain.STRING) {
      return value;
    }
    return decodeString(value);
  }

  private String decodeString(BigInteger pValue) {
    if (pValue.bitLength() < Integer.SIZE) {
      String literal = strings.inverse().get(pValue.intValue());
      if (literal != null) {
        return literal;
      }
    }
    // any string that differs from every literal of the query
    String fresh = "#" + pValue;
    while (strings.containsKey(fresh)) {
      fresh = "#" + fresh;
    }
    return fresh;
  }

  private int intern(String pLiteral) {
    Integer id = strings.get(pLiteral);
    if (id == null) {
      id = strings.size();
      strings.put(pLiteral, id);
    }
    return id;
  }

  private IntegerFormula asInteger(Formula pF) {
    checkArgument(pF instanceof IntegerFormula, "Expected an integer value: %s", pF);
    return (IntegerFormula) pF;
  }

  private BooleanFormula asBoolean(Formula pF) {
    checkArgument(pF instanceof BooleanFormula, "Expected a boolean value: %s", pF);
    return (BooleanFormula) pF;
  }

  @Override
  public Formula visit(IdExpression pE) {
    String name = pE.getName();
    Formula f = variables.get(name);
    if (f == null) {
      VariableDomain domain =
          checkNotNull(domains.get(name), "No domain for variable %s", name);
      f =
          domain == VariableDomain.BOOLEAN
              ? bmgr.makeVariable(VARIABLE_PREFIX + name)
              : imgr.makeVariable(VARIABLE_PREFIX + name);
      variables.put(name, f);
    }
    return f;
  }

  @Override
  public Formula visit(IntegerLiteralExpression pE) {
    return imgr.makeNumber(pE.getValue());
  }

  @Override
  public Formula visit(BooleanLiteralExpression pE) {
    return bmgr.makeBoolean(pE.getValue());
  }

  @Override
  public Formula visit(StringLiteralExpression pE) {
    return imgr.makeNumber(intern(pE.getValue()));
  }

  @Override
  public Formula visit(BinaryExpression pE) {
    Formula op1 = encode(pE.getOperand1());
    Formula op2 = encode(pE.getOperand2());
    BinaryOperator operator = pE.getOperator();
    switch (operator) {
      case MULTIPLY:
        return imgr.multiply(asInteger(op1), asInteger(op2));
      case DIVIDE:
        return imgr.divide(asInteger(op1), asInteger(op2));
      case PLUS:
        return imgr.add(asInteger(op1), asInteger(op2));
      case MINUS:
        return imgr.subtract(asInteger(op1), asInteger(op2));
      case LESS_THAN:
        return imgr.lessThan(asInteger(op1), asInteger(op2));
      case LESS_EQUAL:
        return imgr.lessOrEquals(asInteger(op1), asInteger(op2));
      case GREATER_THAN:
        return imgr.greaterThan(asInteger(op1), asInteger(op2));
      case GREATER_EQUAL:
        return imgr.greaterOrEquals(asInteger(op1), asInteger(op2));
      case EQUALS:
        return makeEqual(op1, op2);
      case NOT_EQUALS:
        return bmgr.not(makeEqual(op1, op2));
      case AND:
        return bmgr.and(asBoolean(op1), asBoolean(op2));
      case OR:
        return bmgr.or(asBoolean(op1), asBoolean(op2));
      default:
        throw new AssertionError("Unhandled operator " + operator);
    }
  }

  @Override
  public Formula visit(UnaryExpression pE) {
    Formula operand = encode(pE.getOperand());
    switch (pE.getOperator()) {
      case NOT:
        return bmgr.not(asBoolean(operand));
      case MINUS:
        return imgr.negate(asInteger(operand));
      default:
        throw new AssertionError("Unhandled operator " + pE.getOperator());
    }
  }
}
