// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.sfcchecker.exceptions;

/** The cut points of two charts cannot be aligned with each other. */
public class MappingException extends SfcException {

  private static final long serialVersionUID = 1846502217735594417L;

  public MappingException(String pMessage) {
    super(ErrorKind.MAPPING_ERROR, pMessage);
  }
}
