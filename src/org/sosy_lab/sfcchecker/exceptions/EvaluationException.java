// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0
package org.sosy_lab.sfcchecker.exceptions;

/**
 * Concrete evaluation of an expression failed, e.g. because a variable has no value, a value has
 * the wrong type or an integer is divided by zero.
 */
public class EvaluationException extends Exception {

  private static final long serialVersionUID = -8170214400964219583L;

  public EvaluationException(String pMessage) {
    super(pMessage);
  }
}
