// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.sfcchecker.exceptions;

/** Guard or action text that is outside the supported expression grammar. */
public class ExpressionParseException extends SfcException {

  private static final long serialVersionUID = 7730411958211694305L;

  private final String text;
  private final int offset;

  public ExpressionParseException(String pText, int pOffset, String pReason) {
    super(
        ErrorKind.EXPRESSION_PARSE_ERROR,
        String.format("%s at offset %d in \"%s\"", pReason, pOffset, pText));
    text = pText;
    offset = pOffset;
  }

  /** The complete text that failed to parse. */
  public String getText() {
    return text;
  }

  public int getOffset() {
    return offset;
  }
}
