// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0
package org.sosy_lab.sfcchecker.containment;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import java.util.Optional;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.sfcchecker.path.Path;
import org.sosy_lab.sfcchecker.solver.UnknownReason;

/** Verdict for one path of the original chart. */
public final class PathResult {

  private final Path path;
  private final PathVerdict verdict;
  private final ImmutableList<Path> matchingPaths;
  private final @Nullable Counterexample counterexample;
  private final @Nullable UnknownReason unknownReason;
  private final String message;

  private PathResult(
      Path pPath,
      PathVerdict pVerdict,
      ImmutableList<Path> pMatchingPaths,
      @Nullable Counterexample pCounterexample,
      @Nullable UnknownReason pUnknownReason,
      String pMessage) {
    path = checkNotNull(pPath);
    verdict = checkNotNull(pVerdict);
    matchingPaths = checkNotNull(pMatchingPaths);
    counterexample = pCounterexample;
    unknownReason = pUnknownReason;
    message = checkNotNull(pMessage);
  }

  static PathResult contained(Path pPath, ImmutableList<Path> pMatchingPaths) {
    return new PathResult(pPath, PathVerdict.CONTAINED, pMatchingPaths, null, null, "");
  }

  static PathResult notContained(
      Path pPath, ImmutableList<Path> pMatchingPaths, Counterexample pCounterexample) {
    checkArgument(pCounterexample.getPath() == pPath);
    return new PathResult(
        pPath,
        PathVerdict.NOT_CONTAINED,
        pMatchingPaths,
        pCounterexample,
        null,
        pCounterexample.toString());
  }

  static PathResult unknown(
      Path pPath, ImmutableList<Path> pMatchingPaths, UnknownReason pReason, String pMessage) {
    return new PathResult(
        pPath, PathVerdict.UNKNOWN, pMatchingPaths, null, checkNotNull(pReason), pMessage);
  }

  static PathResult unreachable(Path pPath) {
    return new PathResult(
        pPath, PathVerdict.UNREACHABLE_PATH, ImmutableList.of(), null, null, "guard unsatisfiable");
  }

  public Path getPath() {
    return path;
  }

  public PathVerdict getVerdict() {
    return verdict;
  }

  /** The aligned paths of the revision the path was checked against. */
  public ImmutableList<Path> getMatchingPaths() {
    return matchingPaths;
  }

  public Optional<Counterexample> getCounterexample() {
    return Optional.ofNullable(counterexample);
  }

  public Optional<UnknownReason> getUnknownReason() {
    return Optional.ofNullable(unknownReason);
  }

  public String getMessage() {
    return message;
  }

  @Override
  public String toString() {
    return path + ": " + verdict + (message.isEmpty() ? "" : " (" + message + ")");
  }
}
