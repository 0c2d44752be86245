// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.sfcchecker.exceptions;

public class StepNotFoundException extends SfcException {

  private static final long serialVersionUID = -6035920117480356926L;

  private final String stepName;

  public StepNotFoundException(String pStepName) {
    super(ErrorKind.NOT_FOUND, "Unknown step " + pStepName);
    stepName = pStepName;
  }

  public String getStepName() {
    return stepName;
  }
}
