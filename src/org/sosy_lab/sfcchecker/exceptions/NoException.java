// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0
package org.sosy_lab.sfcchecker.exceptions;

/** Type parameter for visitors that throw no checked exception. It is never instantiated. */
public final class NoException extends RuntimeException {

  private static final long serialVersionUID = 3092578215536097712L;

  private NoException() {}
}
