// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0
package org.sosy_lab.sfcchecker.petrinet;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import org.sosy_lab.sfcchecker.sfc.SfcTransition;
import org.sosy_lab.sfcchecker.sfc.ast.Assignment;
import org.sosy_lab.sfcchecker.sfc.ast.SfcExpression;

/**
 * A net transition with exactly one input and one output place. Besides the arcs it keeps the
 * guard of the chart transition and, as firing effect, the entry actions of the target step.
 */
public final class NetTransition {

  private final SfcTransition sfcTransition;
  private final Place input;
  private final Place output;

  NetTransition(SfcTransition pSfcTransition, Place pInput, Place pOutput) {
    sfcTransition = checkNotNull(pSfcTransition);
    input = checkNotNull(pInput);
    output = checkNotNull(pOutput);
  }

  public String getName() {
    return sfcTransition.getName();
  }

  public int getIndex() {
    return sfcTransition.getIndex();
  }

  public Place getInput() {
    return input;
  }

  public Place getOutput() {
    return output;
  }

  public SfcExpression getGuard() {
    return sfcTransition.getGuard();
  }

  public ImmutableList<Assignment> getEffect() {
    return output.getEntryActions();
  }

  public SfcTransition getSfcTransition() {
    return sfcTransition;
  }

  @Override
  public String toString() {
    return getName() + ": " + input.getName() + " -> " + output.getName() + " [" + getGuard() + "]";
  }
}
