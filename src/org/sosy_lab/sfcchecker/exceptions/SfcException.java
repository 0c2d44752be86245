// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.sfcchecker.exceptions;

import static com.google.common.base.Preconditions.checkNotNull;

/** Super class of all checked exceptions raised while analyzing a sequential function chart. */
public abstract class SfcException extends Exception {

  private static final long serialVersionUID = 4218519472315103187L;

  private final ErrorKind kind;

  protected SfcException(ErrorKind pKind, String pMessage) {
    super(checkNotNull(pMessage));
    kind = checkNotNull(pKind);
  }

  protected SfcException(ErrorKind pKind, String pMessage, Throwable pCause) {
    super(checkNotNull(pMessage), pCause);
    kind = checkNotNull(pKind);
  }

  public ErrorKind getKind() {
    return kind;
  }
}
