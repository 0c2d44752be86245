// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.sfcchecker.exceptions;

/** The kinds of failure a caller of the verification core has to distinguish. */
public enum ErrorKind {
  VALIDATION_ERROR(true),
  EXPRESSION_PARSE_ERROR(true),
  MAPPING_ERROR(true),
  NOT_FOUND(true),
  SOLVER_TIMEOUT(false),
  SOLVER_UNKNOWN(false);

  private final boolean fatal;

  ErrorKind(boolean pFatal) {
    fatal = pFatal;
  }

  /** Fatal kinds abort the operation that detected them, the others are per-path results. */
  public boolean isFatal() {
    return fatal;
  }
}
