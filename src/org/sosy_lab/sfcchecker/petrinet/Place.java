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
import org.sosy_lab.sfcchecker.sfc.Step;
import org.sosy_lab.sfcchecker.sfc.ast.Assignment;

/** A place of the net; it corresponds one-to-one to a step of the chart. */
public final class Place {

  private final Step step;

  Place(Step pStep) {
    step = checkNotNull(pStep);
  }

  public String getName() {
    return step.getName();
  }

  public int getIndex() {
    return step.getIndex();
  }

  public Step getStep() {
    return step;
  }

  /** The actions executed when a token enters this place. */
  public ImmutableList<Assignment> getEntryActions() {
    return step.getActions();
  }

  @Override
  public String toString() {
    return "p(" + step.getName() + ")";
  }
}
