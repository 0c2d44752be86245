// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0
package org.sosy_lab.sfcchecker;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import java.util.Optional;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.sfcchecker.exceptions.ErrorKind;
import org.sosy_lab.sfcchecker.exceptions.SfcException;

/**
 * Either the value of a successful operation or the kind and message of the error that stopped
 * it.
 *
 * @param <T> type of the value
 */
public final class Outcome<T> {

  private final @Nullable T value;
  private final @Nullable ErrorKind errorKind;
  private final String message;

  private Outcome(@Nullable T pValue, @Nullable ErrorKind pErrorKind, String pMessage) {
    value = pValue;
    errorKind = pErrorKind;
    message = pMessage;
  }

  public static <T> Outcome<T> success(T pValue) {
    return new Outcome<>(checkNotNull(pValue), null, "");
  }

  public static <T> Outcome<T> failure(ErrorKind pErrorKind, String pMessage) {
    return new Outcome<>(null, checkNotNull(pErrorKind), checkNotNull(pMessage));
  }

  public static <T> Outcome<T> failure(SfcException pException) {
    return failure(pException.getKind(), String.valueOf(pException.getMessage()));
  }

  public boolean isSuccess() {
    return errorKind == null;
  }

  /** The value of a successful outcome. */
  public T getValue() {
    checkState(value != null, "Outcome is a failure: %s %s", errorKind, message);
    return value;
  }

  public Optional<T> toOptional() {
    return Optional.ofNullable(value);
  }

  /** The kind of error of a failed outcome. */
  public ErrorKind getErrorKind() {
    checkState(errorKind != null, "Outcome is a success");
    return errorKind;
  }

  public String getMessage() {
    return message;
  }

  @Override
  public String toString() {
    return isSuccess() ? "Success(" + value + ")" : "Failure(" + errorKind + ": " + message + ")";
  }
}
