// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0
package org.sosy_lab.sfcchecker.containment;

import java.io.PrintStream;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.LongAdder;

/** Updated by the query workers and by concurrent calls, so all values are adders. */
public class ContainmentStatistics {

  // timer.
  final LongAdder totalNanos = new LongAdder();
  final LongAdder queryTimeNanos = new LongAdder();

  // counter.
  final LongAdder checks = new LongAdder();
  final LongAdder queries = new LongAdder();
  final LongAdder contained = new LongAdder();
  final LongAdder notContained = new LongAdder();
  final LongAdder unknown = new LongAdder();
  final LongAdder timeouts = new LongAdder();
  final LongAdder spuriousModels = new LongAdder();
  final LongAdder unreachable = new LongAdder();
  final LongAdder cancelled = new LongAdder();

  public void printStatistics(PrintStream pOut) {
    pOut.println("Containment statistics");
    pOut.println("----------------------");
    pOut.println("Number of containment checks: " + checks.sum());
    pOut.println("Time for containment checks:  " + millis(totalNanos));
    pOut.println("  Time in solver queries:     " + millis(queryTimeNanos));
    pOut.println("Number of solver queries:     " + queries.sum());
    pOut.println("  Contained:                  " + contained.sum());
    pOut.println("  Not contained:              " + notContained.sum());
    pOut.println("  Unknown:                    " + unknown.sum());
    pOut.println("    Timeouts:                 " + timeouts.sum());
    pOut.println("    Spurious models:          " + spuriousModels.sum());
    pOut.println("Unreachable paths skipped:    " + unreachable.sum());
    pOut.println("Queries dropped by shutdown:  " + cancelled.sum());
  }

  private static String millis(LongAdder pNanos) {
    return TimeUnit.NANOSECONDS.toMillis(pNanos.sum()) + "ms";
  }

  public long getCheckCount() {
    return checks.sum();
  }

  public long getQueryCount() {
    return queries.sum();
  }
}
