// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0
package org.sosy_lab.sfcchecker;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.sosy_lab.common.ShutdownNotifier;
import org.sosy_lab.common.configuration.Configuration;
import org.sosy_lab.common.log.LogManager;
import org.sosy_lab.sfcchecker.containment.ContainmentReport;
import org.sosy_lab.sfcchecker.containment.Verdict;
import org.sosy_lab.sfcchecker.cutpoint.CutPointSet;
import org.sosy_lab.sfcchecker.exceptions.ErrorKind;
import org.sosy_lab.sfcchecker.path.Path;
import org.sosy_lab.sfcchecker.petrinet.PetriNet;
import org.sosy_lab.sfcchecker.sfc.Sfc;

@RunWith(JUnit4.class)
public class SfcVerifierTest {

  private SfcVerifier verifier;

  @Before
  public void setUp() throws Exception {
    Configuration config =
        Configuration.builder()
            .loadFromFile(Paths.get("config", "containment.properties"))
            .build();
    verifier =
        new SfcVerifier(config, LogManager.createTestLogManager(), ShutdownNotifier.createDummy());
  }

  @After
  public void tearDown() {
    verifier.close();
  }

  @Test
  public void pipeline() throws Exception {
    Outcome<Sfc> sfc = verifier.buildSfc(SfcExamples.factorialBuilder());
    assertThat(sfc.isSuccess()).isTrue();

    Outcome<PetriNet> net = verifier.build(sfc.getValue());
    Outcome<CutPointSet> cutPoints = verifier.findCutPoints(net.getValue());
    assertThat(cutPoints.getValue().getStepNames()).containsExactly("Start", "Check", "End");

    Outcome<ImmutableList<Path>> paths = verifier.paths(net.getValue(), cutPoints.getValue());
    assertThat(paths.getValue()).hasSize(4);

    Outcome<ContainmentReport> report =
        verifier.checkContainment(sfc.getValue(), SfcExamples.factorialWithCleanup());
    assertThat(report.getValue().getVerdict()).isEqualTo(Verdict.CONTAINED);
  }

  @Test
  public void invalidChart() {
    Outcome<Sfc> outcome =
        verifier.buildSfc(
            Sfc.builder().addStep("A").addTransition("A", "B", "True").setInitialStep("A"));
    assertThat(outcome.isSuccess()).isFalse();
    assertThat(outcome.getErrorKind()).isEqualTo(ErrorKind.VALIDATION_ERROR);
    assertThat(outcome.getMessage()).contains("B");
    assertThat(outcome.toOptional()).isEmpty();
  }

  @Test
  public void malformedGuard() {
    Outcome<Sfc> outcome =
        verifier.buildSfc(
            Sfc.builder()
                .addVariable("x")
                .addStep("A")
                .addStep("B")
                .addTransition("A", "B", "x >")
                .setInitialStep("A"));
    assertThat(outcome.getErrorKind()).isEqualTo(ErrorKind.EXPRESSION_PARSE_ERROR);
  }

  @Test
  public void missingCounterpart() throws Exception {
    Outcome<ContainmentReport> outcome =
        verifier.checkContainment(
            SfcExamples.factorial(), SfcExamples.factorialWithCleanup("Finish", "i > n"));
    assertThat(outcome.getErrorKind()).isEqualTo(ErrorKind.MAPPING_ERROR);
    assertThat(outcome.getErrorKind().isFatal()).isTrue();

    outcome =
        verifier.checkContainment(
            SfcExamples.factorial(),
            SfcExamples.factorialWithCleanup("Finish", "i > n"),
            ImmutableMap.of("End", "Finish"));
    assertThat(outcome.getValue().isComplete()).isTrue();
  }

  @Test
  public void statistics() throws Exception {
    Sfc sfc = SfcExamples.factorial();
    verifier.checkContainment(sfc, sfc);

    ByteArrayOutputStream out = new ByteArrayOutputStream();
    verifier.printStatistics(new PrintStream(out, true, StandardCharsets.UTF_8));
    assertThat(out.toString(StandardCharsets.UTF_8)).isNotEmpty();
  }
}
