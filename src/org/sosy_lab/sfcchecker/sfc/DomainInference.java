// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0
package org.sosy_lab.sfcchecker.sfc;

import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.sfcchecker.exceptions.ValidationException;
import org.sosy_lab.sfcchecker.sfc.ast.Assignment;
import org.sosy_lab.sfcchecker.sfc.ast.BinaryExpression;
import org.sosy_lab.sfcchecker.sfc.ast.BooleanLiteralExpression;
import org.sosy_lab.sfcchecker.sfc.ast.IdExpression;
import org.sosy_lab.sfcchecker.sfc.ast.IntegerLiteralExpression;
import org.sosy_lab.sfcchecker.sfc.ast.SfcExpression;
import org.sosy_lab.sfcchecker.sfc.ast.SfcExpressionVisitor;
import org.sosy_lab.sfcchecker.sfc.ast.StringLiteralExpression;
import org.sosy_lab.sfcchecker.sfc.ast.UnaryExpression;

/**
 * Infers the domain of every variable from its uses in guards and actions. The inference pushes
 * expected domains down to the variables and repeats until nothing changes; variables whose
 * domain is still unknown afterwards are integers.
 */
class DomainInference {

  private final Map<String, @Nullable VariableDomain> domains = new LinkedHashMap<>();
  private boolean changed;

  DomainInference(Map<String, @Nullable VariableDomain> pDeclared) {
    domains.putAll(pDeclared);
  }

  ImmutableMap<String, VariableDomain> infer(
      List<SfcExpression> pGuards, List<Assignment> pAssignments) throws ValidationException {
    do {
      changed = false;
      for (SfcExpression guard : pGuards) {
        check(guard, VariableDomain.BOOLEAN);
      }
      for (Assignment assignment : pAssignments) {
        String lhs = assignment.getVariableName();
        VariableDomain rhs = check(assignment.getRightHandSide(), domains.get(lhs));
        if (rhs != null) {
          unify(lhs, rhs);
        }
      }
    } while (changed);

    ImmutableMap.Builder<String, VariableDomain> result = ImmutableMap.builder();
    for (Map.Entry<String, @Nullable VariableDomain> entry : domains.entrySet()) {
      VariableDomain domain = entry.getValue();
      result.put(entry.getKey(), domain != null ? domain : VariableDomain.INTEGER);
    }
    return result.buildOrThrow();
  }

  private @Nullable VariableDomain check(SfcExpression pExp, @Nullable VariableDomain pExpected)
      throws ValidationException {
    VariableDomain actual = pExp.accept(new DomainVisitor(pExpected));
    if (pExpected != null && actual != null && pExpected != actual) {
      throw new ValidationException(
          "Expression " + pExp + " has domain " + actual + " where " + pExpected + " is required");
    }
    return actual != null ? actual : pExpected;
  }

  private void unify(String pVariable, VariableDomain pDomain) throws ValidationException {
    VariableDomain known = domains.get(pVariable);
    if (known == null) {
      domains.put(pVariable, pDomain);
      changed = true;
    } else if (known != pDomain) {
      throw new ValidationException(
          "Variable " + pVariable + " is used both as " + known + " and as " + pDomain);
    }
  }

  private class DomainVisitor
      implements SfcExpressionVisitor<@Nullable VariableDomain, ValidationException> {

    private final @Nullable VariableDomain expected;

    private DomainVisitor(@Nullable VariableDomain pExpected) {
      expected = pExpected;
    }

    @Override
    public @Nullable VariableDomain visit(IdExpression pE) throws ValidationException {
      if (expected != null) {
        unify(pE.getName(), expected);
      }
      return domains.get(pE.getName());
    }

    @Override
    public VariableDomain visit(IntegerLiteralExpression pE) {
      return VariableDomain.INTEGER;
    }

    @Override
    public VariableDomain visit(BooleanLiteralExpression pE) {
      return VariableDomain.BOOLEAN;
    }

    @Override
    public VariableDomain visit(StringLiteralExpression pE) {
      return VariableDomain.STRING;
    }

    @Override
    public VariableDomain visit(BinaryExpression pE) throws ValidationException {
      switch (pE.getOperator().getKind()) {
        case ARITHMETIC:
          check(pE.getOperand1(), VariableDomain.INTEGER);
          check(pE.getOperand2(), VariableDomain.INTEGER);
          return VariableDomain.INTEGER;
        case ORDERING:
          check(pE.getOperand1(), VariableDomain.INTEGER);
          check(pE.getOperand2(), VariableDomain.INTEGER);
          return VariableDomain.BOOLEAN;
        case EQUALITY:
          VariableDomain left = check(pE.getOperand1(), null);
          VariableDomain right = check(pE.getOperand2(), left);
          if (left == null && right != null) {
            check(pE.getOperand1(), right);
          }
          return VariableDomain.BOOLEAN;
        case LOGICAL:
          check(pE.getOperand1(), VariableDomain.BOOLEAN);
          check(pE.getOperand2(), VariableDomain.BOOLEAN);
          return VariableDomain.BOOLEAN;
        default:
          throw new AssertionError("unhandled operator " + pE.getOperator());
      }
    }

    @Override
    public VariableDomain visit(UnaryExpression pE) throws ValidationException {
      switch (pE.getOperator()) {
        case NOT:
          check(pE.getOperand(), VariableDomain.BOOLEAN);
          return VariableDomain.BOOLEAN;
        case MINUS:
          check(pE.getOperand(), VariableDomain.INTEGER);
          return VariableDomain.INTEGER;
        default:
          throw new AssertionError("unhandled operator " + pE.getOperator());
      }
    }
  }
}
