// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0
package org.sosy_lab.sfcchecker.containment;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Optional;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.sfcchecker.path.Path;
import org.sosy_lab.sfcchecker.sfc.Valuation;

/**
 * Concrete values at the source cut point for which the revised chart does not reproduce the
 * behavior of the original one. The values have been checked on the concrete semantics.
 */
public final class Counterexample {

  public enum Violation {
    /** The original path fires, but no aligned path of the revision ends in the same state. */
    BEHAVIOR,
    /** An aligned path of the revision fires where no original path of the segment does. */
    GUARD
  }

  private final Valuation entryState;
  private final Violation violation;
  private final Path path;
  private final @Nullable Path witness;

  Counterexample(Valuation pEntryState, Violation pViolation, Path pPath, @Nullable Path pWitness) {
    entryState = checkNotNull(pEntryState);
    violation = checkNotNull(pViolation);
    path = checkNotNull(pPath);
    witness = pWitness;
  }

  /** Values of the variables of both charts when the token is at the source cut point. */
  public Valuation getEntryState() {
    return entryState;
  }

  public @Nullable Object getValue(String pVariable) {
    return entryState.get(pVariable);
  }

  public Violation getViolation() {
    return violation;
  }

  /** The path of the original chart the counterexample belongs to. */
  public Path getPath() {
    return path;
  }

  /** For a guard violation, the path of the revision that fires. */
  public Optional<Path> getWitness() {
    return Optional.ofNullable(witness);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(violation).append(" violation of ").append(path).append(" at ").append(entryState);
    if (witness != null) {
      sb.append(", revision takes ").append(witness);
    }
    return sb.toString();
  }
}
