// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0
package org.sosy_lab.sfcchecker.path;

import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.sosy_lab.sfcchecker.sfc.ast.Assignment;
import org.sosy_lab.sfcchecker.sfc.ast.IdExpression;
import org.sosy_lab.sfcchecker.sfc.ast.SfcExpression;
import org.sosy_lab.sfcchecker.sfc.ast.SubstitutionVisitor;

/**
 * Values of the variables in terms of the entry values of a path. A variable without entry in
 * the map still has its entry value.
 */
final class SymbolicState {

  private static final SymbolicState IDENTITY = new SymbolicState(ImmutableMap.of());

  private final ImmutableMap<String, SfcExpression> values;

  private SymbolicState(ImmutableMap<String, SfcExpression> pValues) {
    values = pValues;
  }

  static SymbolicState identity() {
    return IDENTITY;
  }

  /** Rewrite an expression over the current values into one over the entry values. */
  SfcExpression evaluate(SfcExpression pExp) {
    return new SubstitutionVisitor(values).substitute(pExp);
  }

  /** Execute the assignments in order, each right-hand side sees the earlier ones. */
  SymbolicState execute(List<Assignment> pActions) {
    if (pActions.isEmpty()) {
      return this;
    }
    Map<String, SfcExpression> next = new LinkedHashMap<>(values);
    for (Assignment action : pActions) {
      SfcExpression value = new SubstitutionVisitor(next).substitute(action.getRightHandSide());
      if (value.equals(new IdExpression(action.getVariableName()))) {
        // x := x leaves the entry value
        next.remove(action.getVariableName());
      } else {
        next.put(action.getVariableName(), value);
      }
    }
    return new SymbolicState(ImmutableMap.copyOf(next));
  }

  ImmutableMap<String, SfcExpression> asMap() {
    return values;
  }
}
