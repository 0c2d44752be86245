// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0
package org.sosy_lab.sfcchecker.solver;

import org.sosy_lab.sfcchecker.exceptions.ErrorKind;

/** Why a solver query did not produce a definite answer. */
public enum UnknownReason {
  SOLVER_TIMEOUT(ErrorKind.SOLVER_TIMEOUT),
  SOLVER_UNKNOWN(ErrorKind.SOLVER_UNKNOWN),
  /** The solver found a model that does not reproduce the violation on concrete values. */
  SPURIOUS_MODEL(ErrorKind.SOLVER_UNKNOWN);

  private final ErrorKind errorKind;

  UnknownReason(ErrorKind pErrorKind) {
    errorKind = pErrorKind;
  }

  public ErrorKind toErrorKind() {
    return errorKind;
  }
}
