// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0
package org.sosy_lab.sfcchecker.cutpoint;

/** Reasons why a step is a segment boundary. A step may have several. */
public enum CutPointKind {
  /** The initial step. */
  INITIAL,
  /** A step without outgoing transitions. */
  TERMINAL,
  /** More than one outgoing transition. */
  BRANCH,
  /** More than one incoming transition. */
  JOIN,
  /** Added to align the segmentation with another chart. */
  ANCHOR
}
