// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0
package org.sosy_lab.sfcchecker;

import com.google.common.collect.ImmutableList;
import org.sosy_lab.sfcchecker.exceptions.SfcException;
import org.sosy_lab.sfcchecker.sfc.Sfc;

/** Charts shared by the tests. */
public final class SfcExamples {

  private SfcExamples() {}

  /** Start, Check, Multiply, Increment, End computing {@code fact = n!}. */
  public static Sfc.Builder factorialBuilder() {
    return Sfc.builder()
        .addVariables(ImmutableList.of("init", "n", "i", "fact"))
        .addStep("Start", "i := 1; fact := 1")
        .addStep("Check")
        .addStep("Multiply", "fact := fact * i")
        .addStep("Increment", "i := i + 1")
        .addStep("End")
        .addTransition("Start", "Check", "init")
        .addTransition("Check", "Multiply", "i <= n")
        .addTransition("Multiply", "Increment", "True")
        .addTransition("Increment", "Check", "True")
        .addTransition("Check", "End", "i > n")
        .setInitialStep("Start");
  }

  public static Sfc factorial() throws SfcException {
    return factorialBuilder().build();
  }

  /**
   * The factorial chart with an auxiliary counter {@code temp} and a Cleanup step after End.
   *
   * @param pEndName name of the step after the loop
   * @param pExitGuard guard of the transition from Check to the end step
   */
  public static Sfc factorialWithCleanup(String pEndName, String pExitGuard)
      throws SfcException {
    return Sfc.builder()
        .addVariables(ImmutableList.of("init", "n", "i", "fact", "temp"))
        .addStep("Start", "i := 1; fact := 1; temp := 0")
        .addStep("Check")
        .addStep("Multiply", "fact := fact * i")
        .addStep("Increment", "i := i + 1; temp := temp + 1")
        .addStep(pEndName)
        .addStep("Cleanup", "temp := 0")
        .addTransition("Start", "Check", "init")
        .addTransition("Check", "Multiply", "i <= n")
        .addTransition("Multiply", "Increment", "True")
        .addTransition("Increment", "Check", "True")
        .addTransition("Check", pEndName, pExitGuard)
        .addTransition(pEndName, "Cleanup", "True")
        .setInitialStep("Start")
        .build();
  }

  public static Sfc factorialWithCleanup() throws SfcException {
    return factorialWithCleanup("End", "i > n");
  }
}
