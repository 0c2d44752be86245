// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0
package org.sosy_lab.sfcchecker.solver;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.MoreObjects;
import java.util.Optional;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.sfcchecker.sfc.Valuation;

/** Answer of a single satisfiability check. */
public final class QueryResult {

  public enum Status {
    SAT,
    UNSAT,
    UNKNOWN
  }

  private static final QueryResult UNSAT_RESULT = new QueryResult(Status.UNSAT, null, null, "");

  private final Status status;
  private final @Nullable Valuation model;
  private final @Nullable UnknownReason reason;
  private final String message;

  private QueryResult(
      Status pStatus,
      @Nullable Valuation pModel,
      @Nullable UnknownReason pReason,
      String pMessage) {
    status = pStatus;
    model = pModel;
    reason = pReason;
    message = pMessage;
  }

  public static QueryResult sat(Valuation pModel) {
    return new QueryResult(Status.SAT, checkNotNull(pModel), null, "");
  }

  public static QueryResult unsat() {
    return UNSAT_RESULT;
  }

  public static QueryResult unknown(UnknownReason pReason, String pMessage) {
    return new QueryResult(Status.UNKNOWN, null, checkNotNull(pReason), checkNotNull(pMessage));
  }

  public Status getStatus() {
    return status;
  }

  public boolean isSat() {
    return status == Status.SAT;
  }

  public boolean isUnsat() {
    return status == Status.UNSAT;
  }

  /** The satisfying assignment of the query variables, in terms of chart values. */
  public Valuation getModel() {
    checkState(model != null, "No model for %s result", status);
    return model;
  }

  public Optional<UnknownReason> getReason() {
    return Optional.ofNullable(reason);
  }

  public String getMessage() {
    return message;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .omitNullValues()
        .add("status", status)
        .add("model", model)
        .add("reason", reason)
        .toString();
  }
}
