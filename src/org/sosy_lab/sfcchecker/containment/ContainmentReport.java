// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0
package org.sosy_lab.sfcchecker.containment;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.FluentIterable;
import com.google.common.collect.ImmutableList;
import java.util.Optional;
import org.sosy_lab.sfcchecker.path.Path;
import org.sosy_lab.sfcchecker.petrinet.PetriNet;

/**
 * Result of one containment check. The report owns no solver resources and stays valid after
 * the verifier is closed.
 */
public final class ContainmentReport {

  private final PetriNet net1;
  private final PetriNet net2;
  private final CutPointAlignment alignment;
  private final ImmutableList<PathResult> results;
  private final boolean complete;

  ContainmentReport(
      PetriNet pNet1,
      PetriNet pNet2,
      CutPointAlignment pAlignment,
      ImmutableList<PathResult> pResults,
      boolean pComplete) {
    net1 = checkNotNull(pNet1);
    net2 = checkNotNull(pNet2);
    alignment = checkNotNull(pAlignment);
    results = checkNotNull(pResults);
    complete = pComplete;
  }

  /**
   * NOT_CONTAINED if some path is not contained, otherwise UNKNOWN if some path is unknown or
   * the check was cancelled, otherwise CONTAINED. Unreachable paths are ignored.
   */
  public Verdict getVerdict() {
    boolean unknown = !complete;
    for (PathResult result : results) {
      switch (result.getVerdict()) {
        case NOT_CONTAINED:
          return Verdict.NOT_CONTAINED;
        case UNKNOWN:
          unknown = true;
          break;
        default:
          break;
      }
    }
    return unknown ? Verdict.UNKNOWN : Verdict.CONTAINED;
  }

  /** Per-path results in path extraction order. A cancelled check lists the finished ones. */
  public ImmutableList<PathResult> getResults() {
    return results;
  }

  /** Results that are not contained or unknown. */
  public ImmutableList<PathResult> getFailures() {
    return FluentIterable.from(results)
        .filter(
            r ->
                r.getVerdict() == PathVerdict.NOT_CONTAINED
                    || r.getVerdict() == PathVerdict.UNKNOWN)
        .toList();
  }

  public Optional<PathResult> getResult(Path pPath) {
    return FluentIterable.from(results).firstMatch(r -> r.getPath() == pPath).toJavaUtil();
  }

  /** The results of the paths from one step of the original chart to another. */
  public ImmutableList<PathResult> getResults(String pSource, String pTarget) {
    return FluentIterable.from(results)
        .filter(
            r ->
                !r.getPath().isInitialization()
                    && r.getPath().getSourceName().equals(pSource)
                    && r.getPath().getTargetName().equals(pTarget))
        .toList();
  }

  public boolean isComplete() {
    return complete;
  }

  public PetriNet getNet1() {
    return net1;
  }

  public PetriNet getNet2() {
    return net2;
  }

  public CutPointAlignment getAlignment() {
    return alignment;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append("Containment: ").append(getVerdict());
    if (!complete) {
      sb.append(" (incomplete)");
    }
    for (PathResult result : results) {
      sb.append("\n  ").append(result);
    }
    return sb.toString();
  }
}
