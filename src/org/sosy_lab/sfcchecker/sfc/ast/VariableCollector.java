// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0
package org.sosy_lab.sfcchecker.sfc.ast;

import com.google.common.collect.ImmutableSet;
import java.util.Set;
import org.sosy_lab.sfcchecker.exceptions.NoException;

/** Collects the names of all variables an expression reads, in order of first occurrence. */
public class VariableCollector extends DefaultSfcExpressionVisitor<Void, NoException> {

  private final ImmutableSet.Builder<String> variables = ImmutableSet.builder();

  public static ImmutableSet<String> collect(SfcExpression pExp) {
    VariableCollector collector = new VariableCollector();
    pExp.accept(collector);
    return collector.variables.build();
  }

  public static ImmutableSet<String> collect(Iterable<? extends SfcExpression> pExps) {
    VariableCollector collector = new VariableCollector();
    for (SfcExpression exp : pExps) {
      exp.accept(collector);
    }
    return collector.variables.build();
  }

  /** The written variable and all variables read by the right-hand side. */
  public static Set<String> collect(Assignment pAssignment) {
    VariableCollector collector = new VariableCollector();
    collector.variables.add(pAssignment.getVariableName());
    pAssignment.getRightHandSide().accept(collector);
    return collector.variables.build();
  }

  private VariableCollector() {}

  @Override
  public Void visit(IdExpression pE) throws NoException {
    variables.add(pE.getName());
    return null;
  }

  @Override
  public Void visit(BinaryExpression pE) throws NoException {
    pE.getOperand1().accept(this);
    pE.getOperand2().accept(this);
    return null;
  }

  @Override
  public Void visit(UnaryExpression pE) throws NoException {
    pE.getOperand().accept(this);
    return null;
  }

  @Override
  protected Void visitDefault(SfcExpression pExp) throws NoException {
    return null;
  }
}
