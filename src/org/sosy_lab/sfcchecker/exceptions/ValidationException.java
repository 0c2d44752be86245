// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.sfcchecker.exceptions;

/**
 * Signals a structurally invalid chart: dangling step references, duplicate step names, a missing
 * initial step, undeclared or inconsistently typed variables, or a cycle that is not broken by a
 * cut point.
 */
public class ValidationException extends SfcException {

  private static final long serialVersionUID = -2954026364912717040L;

  public ValidationException(String pMessage) {
    super(ErrorKind.VALIDATION_ERROR, pMessage);
  }

  public ValidationException(String pMessage, Throwable pCause) {
    super(ErrorKind.VALIDATION_ERROR, pMessage, pCause);
  }
}
