// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0
package org.sosy_lab.sfcchecker.sfc;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import org.sosy_lab.sfcchecker.sfc.ast.Assignment;

/**
 * A step of a chart. Its actions are executed in order whenever the step is entered. Steps are
 * identified by their name, which is unique within a chart.
 */
public final class Step {

  private final String name;
  private final int index;
  private final String actionText;
  private final ImmutableList<Assignment> actions;

  Step(String pName, int pIndex, String pActionText, ImmutableList<Assignment> pActions) {
    name = checkNotNull(pName);
    index = pIndex;
    actionText = checkNotNull(pActionText);
    actions = checkNotNull(pActions);
  }

  public String getName() {
    return name;
  }

  /** Position of the step in declaration order. */
  public int getIndex() {
    return index;
  }

  public String getActionText() {
    return actionText;
  }

  public ImmutableList<Assignment> getActions() {
    return actions;
  }

  @Override
  public String toString() {
    return name;
  }
}
