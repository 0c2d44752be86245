// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0
package org.sosy_lab.sfcchecker.path;

/** Result of the satisfiability probe on a path guard. */
public enum Reachability {
  REACHABLE,
  /** The guard is unsatisfiable, no execution takes this path. */
  UNREACHABLE,
  /** The solver could not decide the guard. */
  UNKNOWN,
  NOT_CHECKED
}
