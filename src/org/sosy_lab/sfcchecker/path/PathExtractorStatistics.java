// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0
package org.sosy_lab.sfcchecker.path;

import java.io.PrintStream;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.LongAdder;

/** Updated by concurrent extractions, so all values are adders. */
public class PathExtractorStatistics {

  // timer.
  final LongAdder extractionNanos = new LongAdder();
  final LongAdder reachabilityNanos = new LongAdder();

  // counter.
  final LongAdder segments = new LongAdder();
  final LongAdder paths = new LongAdder();
  final LongAdder reachabilityQueries = new LongAdder();
  final LongAdder unreachablePaths = new LongAdder();
  final LongAdder undecidedPaths = new LongAdder();

  public void printStatistics(PrintStream pOut) {
    pOut.println("Path extraction statistics");
    pOut.println("--------------------------");
    pOut.println("Time for path extraction:            " + millis(extractionNanos));
    pOut.println("  Time for reachability probes:      " + millis(reachabilityNanos));
    pOut.println("Number of extracted paths:           " + paths.sum());
    pOut.println("  Segments walked:                   " + segments.sum());
    pOut.println("  Reachability queries:              " + reachabilityQueries.sum());
    pOut.println("  Unreachable paths:                 " + unreachablePaths.sum());
    pOut.println("  Paths with undecided reachability: " + undecidedPaths.sum());
  }

  private static String millis(LongAdder pNanos) {
    return TimeUnit.NANOSECONDS.toMillis(pNanos.sum()) + "ms";
  }

  public long getPathCount() {
    return paths.sum();
  }

  public long getUnreachablePathCount() {
    return unreachablePaths.sum();
  }
}
