// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0
package org.sosy_lab.sfcchecker.containment;

public enum PathVerdict {
  CONTAINED,
  NOT_CONTAINED,
  UNKNOWN,
  /** The path guard is unsatisfiable, the path does not take part in the overall verdict. */
  UNREACHABLE_PATH
}
