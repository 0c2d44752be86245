// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0
package org.sosy_lab.sfcchecker.sfc;

import static com.google.common.base.Preconditions.checkNotNull;

import org.sosy_lab.sfcchecker.sfc.ast.SfcExpression;

/** A guarded transition between two steps of the same chart. */
public final class SfcTransition {

  private final int index;
  private final Step source;
  private final Step target;
  private final String guardText;
  private final SfcExpression guard;

  SfcTransition(int pIndex, Step pSource, Step pTarget, String pGuardText, SfcExpression pGuard) {
    index = pIndex;
    source = checkNotNull(pSource);
    target = checkNotNull(pTarget);
    guardText = checkNotNull(pGuardText);
    guard = checkNotNull(pGuard);
  }

  /** Position of the transition in declaration order. */
  public int getIndex() {
    return index;
  }

  public String getName() {
    return "t" + index;
  }

  public Step getSource() {
    return source;
  }

  public Step getTarget() {
    return target;
  }

  public String getGuardText() {
    return guardText;
  }

  public SfcExpression getGuard() {
    return guard;
  }

  @Override
  public String toString() {
    return source.getName() + " -> " + target.getName() + " [" + guard + "]";
  }
}
