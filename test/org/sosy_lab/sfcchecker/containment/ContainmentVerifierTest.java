// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0
package org.sosy_lab.sfcchecker.containment;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.sosy_lab.common.ShutdownManager;
import org.sosy_lab.common.ShutdownNotifier;
import org.sosy_lab.common.configuration.Configuration;
import org.sosy_lab.common.log.LogManager;
import org.sosy_lab.sfcchecker.SfcExamples;
import org.sosy_lab.sfcchecker.containment.Counterexample.Violation;
import org.sosy_lab.sfcchecker.cutpoint.CutPointKind;
import org.sosy_lab.sfcchecker.exceptions.MappingException;
import org.sosy_lab.sfcchecker.path.Path;
import org.sosy_lab.sfcchecker.sfc.Sfc;
import org.sosy_lab.sfcchecker.sfc.VariableDomain;
import org.sosy_lab.sfcchecker.solver.SolverSessionFactory;
import org.sosy_lab.sfcchecker.solver.UnknownReason;

@RunWith(JUnit4.class)
public class ContainmentVerifierTest {

  private LogManager logger;
  private SolverSessionFactory solverFactory;

  @Before
  public void setUp() throws Exception {
    logger = LogManager.createTestLogManager();
    solverFactory = new SolverSessionFactory(Configuration.defaultConfiguration(), logger);
  }

  @After
  public void tearDown() {
    solverFactory.close();
  }

  private ContainmentVerifier verifier(Configuration pConfig, ShutdownNotifier pNotifier)
      throws Exception {
    return new ContainmentVerifier(pConfig, logger, pNotifier, solverFactory);
  }

  private ContainmentVerifier verifier() throws Exception {
    return verifier(Configuration.defaultConfiguration(), ShutdownNotifier.createDummy());
  }

  @Test
  public void reflexivity() throws Exception {
    Sfc sfc = SfcExamples.factorial();
    ContainmentReport report = verifier().checkContainment(sfc, sfc);
    assertThat(report.getVerdict()).isEqualTo(Verdict.CONTAINED);
    assertThat(report.isComplete()).isTrue();
    assertThat(report.getResults()).hasSize(4);
    for (PathResult result : report.getResults()) {
      assertThat(result.getVerdict()).isEqualTo(PathVerdict.CONTAINED);
      assertThat(result.getMatchingPaths()).hasSize(1);
    }
    assertThat(report.getFailures()).isEmpty();
  }

  @Test
  public void factorialEvolutionIsContained() throws Exception {
    ContainmentReport report =
        verifier().checkContainment(SfcExamples.factorial(), SfcExamples.factorialWithCleanup());
    assertThat(report.getVerdict()).isEqualTo(Verdict.CONTAINED);
    // one result per path of the original, the Cleanup path of the revision has none
    assertThat(report.getResults()).hasSize(4);
    for (PathResult result : report.getResults()) {
      assertThat(result.getVerdict()).isEqualTo(PathVerdict.CONTAINED);
      for (Path match : result.getMatchingPaths()) {
        assertThat(match.getTargetName()).isNotEqualTo("Cleanup");
      }
    }
    // End is no cut point of the revision, it is added to align the exit path
    assertThat(report.getAlignment().getCutPoints2().get("End").orElseThrow().getKinds())
        .containsExactly(CutPointKind.ANCHOR);
  }

  @Test
  public void divergentGuardIsNotContained() throws Exception {
    Sfc original = SfcExamples.factorial();
    Sfc revision = SfcExamples.factorialWithCleanup("End", "i >= n");
    ContainmentReport report = verifier().checkContainment(original, revision);

    assertThat(report.getVerdict()).isEqualTo(Verdict.NOT_CONTAINED);
    ImmutableList<PathResult> exit = report.getResults("Check", "End");
    assertThat(exit).hasSize(1);
    PathResult result = exit.get(0);
    assertThat(result.getVerdict()).isEqualTo(PathVerdict.NOT_CONTAINED);

    Counterexample counterexample = result.getCounterexample().orElseThrow();
    assertThat(counterexample.getViolation()).isEqualTo(Violation.GUARD);
    assertThat(counterexample.getValue("i")).isNotNull();
    assertThat(counterexample.getValue("i")).isEqualTo(counterexample.getValue("n"));
    assertThat(counterexample.getWitness().orElseThrow().getGuard().toString())
        .isEqualTo("i >= n");

    // the loop itself is unchanged
    assertThat(report.getResults("Check", "Check").get(0).getVerdict())
        .isEqualTo(PathVerdict.CONTAINED);
    assertThat(report.getFailures()).containsExactly(result);
  }

  @Test
  public void divergentGuardWithoutGuardPreservation() throws Exception {
    Configuration config =
        Configuration.builder().setOption("containment.checkGuardPreservation", "false").build();
    ContainmentReport report =
        verifier(config, ShutdownNotifier.createDummy())
            .checkContainment(
                SfcExamples.factorial(), SfcExamples.factorialWithCleanup("End", "i >= n"));
    // every run of the original is still possible in the revision
    assertThat(report.getVerdict()).isEqualTo(Verdict.CONTAINED);
  }

  @Test
  public void renamedCutPointNeedsMapping() throws Exception {
    Sfc original = SfcExamples.factorial();
    Sfc revision = SfcExamples.factorialWithCleanup("Finish", "i > n");
    ContainmentVerifier verifier = verifier();

    MappingException e =
        assertThrows(MappingException.class, () -> verifier.checkContainment(original, revision));
    assertThat(e).hasMessageThat().contains("End");

    ContainmentReport report =
        verifier.checkContainment(original, revision, ImmutableMap.of("End", "Finish"));
    assertThat(report.getVerdict()).isEqualTo(Verdict.CONTAINED);
    assertThat(report.getAlignment().getImage("End")).hasValue("Finish");
  }

  @Test
  public void mappingToMissingStep() throws Exception {
    Sfc sfc = SfcExamples.factorial();
    ContainmentVerifier verifier = verifier();
    assertThrows(
        MappingException.class,
        () -> verifier.checkContainment(sfc, sfc, ImmutableMap.of("End", "Nowhere")));
    assertThrows(
        MappingException.class,
        () -> verifier.checkContainment(sfc, sfc, ImmutableMap.of("Nowhere", "End")));
  }

  @Test
  public void sharedVariableWithDifferentDomain() throws Exception {
    Sfc original =
        Sfc.builder()
            .addVariable("x", VariableDomain.INTEGER)
            .addStep("A", "x := 1")
            .setInitialStep("A")
            .build();
    Sfc revision =
        Sfc.builder()
            .addVariable("x", VariableDomain.BOOLEAN)
            .addStep("A", "x := True")
            .setInitialStep("A")
            .build();
    ContainmentVerifier verifier = verifier();
    assertThrows(MappingException.class, () -> verifier.checkContainment(original, revision));
  }

  @Test
  public void changedStringAssignment() throws Exception {
    Sfc original = modeChart("run");
    Sfc revision = modeChart("running");
    ContainmentReport report = verifier().checkContainment(original, revision);

    assertThat(report.getVerdict()).isEqualTo(Verdict.NOT_CONTAINED);
    ImmutableList<PathResult> results = report.getResults("Idle", "Run");
    assertThat(results).hasSize(1);
    PathResult result = results.get(0);
    assertThat(result.getVerdict()).isEqualTo(PathVerdict.NOT_CONTAINED);
    Counterexample counterexample = result.getCounterexample().orElseThrow();
    assertThat(counterexample.getViolation()).isEqualTo(Violation.BEHAVIOR);
    assertThat(counterexample.getValue("mode")).isEqualTo("idle");
    assertThat(counterexample.getValue("start")).isEqualTo(true);

    assertThat(verifier().checkContainment(original, original).getVerdict())
        .isEqualTo(Verdict.CONTAINED);
  }

  private static Sfc modeChart(String pRunMode) throws Exception {
    return Sfc.builder()
        .addVariable("mode")
        .addVariable("start")
        .addStep("Idle", "mode := 'idle'")
        .addStep("Run", "mode := '" + pRunMode + "'")
        .addTransition("Idle", "Run", "mode == 'idle' and start")
        .setInitialStep("Idle")
        .build();
  }

  @Test
  public void changedInitializationIsNotContained() throws Exception {
    Sfc original = SfcExamples.factorial();
    Sfc revision =
        SfcExamples.factorialBuilder()
            .addStep("Cleanup")
            .addTransition("End", "Cleanup", "")
            .build();
    assertThat(verifier().checkContainment(original, revision).getVerdict())
        .isEqualTo(Verdict.CONTAINED);

    Sfc changedStart =
        Sfc.builder()
            .addVariables(ImmutableList.of("init", "n", "i", "fact"))
            .addStep("Start", "i := 0; fact := 1")
            .addStep("Check")
            .addStep("Multiply", "fact := fact * i")
            .addStep("Increment", "i := i + 1")
            .addStep("End")
            .addTransition("Start", "Check", "init")
            .addTransition("Check", "Multiply", "i <= n")
            .addTransition("Multiply", "Increment", "True")
            .addTransition("Increment", "Check", "True")
            .addTransition("Check", "End", "i > n")
            .setInitialStep("Start")
            .build();
    ContainmentReport report = verifier().checkContainment(original, changedStart);
    assertThat(report.getVerdict()).isEqualTo(Verdict.NOT_CONTAINED);
    PathResult init = report.getResults().get(0);
    assertThat(init.getPath().isInitialization()).isTrue();
    assertThat(init.getVerdict()).isEqualTo(PathVerdict.NOT_CONTAINED);
  }

  @Test
  public void unreachablePathsDoNotCount() throws Exception {
    Sfc sfc =
        Sfc.builder()
            .addVariable("i")
            .addVariable("n")
            .addStep("A")
            .addStep("B", "i := i + 1")
            .addStep("C")
            .addTransition("A", "B", "i > n")
            .addTransition("B", "C", "i <= n - 1")
            .addTransition("A", "C", "")
            .setInitialStep("A")
            .build();
    ContainmentReport report = verifier().checkContainment(sfc, sfc);
    assertThat(report.getVerdict()).isEqualTo(Verdict.CONTAINED);
    PathResult unreachable = report.getResults("A", "C").get(0);
    assertThat(report.getResult(unreachable.getPath())).hasValue(unreachable);
    assertThat(unreachable.getVerdict()).isEqualTo(PathVerdict.UNREACHABLE_PATH);
    assertThat(unreachable.getCounterexample()).isEmpty();
    assertThat(report.getResults("A", "C").get(1).getVerdict()).isEqualTo(PathVerdict.CONTAINED);
  }

  @Test
  public void solverTimeoutIsUnknown() throws Exception {
    Configuration config =
        Configuration.builder().setOption("containment.solverTimeout", "1ms").build();
    solverFactory.close();
    solverFactory = new SolverSessionFactory(config, logger);
    Sfc sfc =
        Sfc.builder()
            .addVariables(ImmutableList.of("a", "b", "c", "d"))
            .addStep("Start")
            .addStep("Mix", "a := a * b - c * d; b := a * a * c + b * d * d; c := a * b * c")
            .addTransition("Start", "Mix", "a * b * c > d * d + a * c and b * d * d < a * a * c")
            .setInitialStep("Start")
            .build();

    ContainmentReport report =
        verifier(config, ShutdownNotifier.createDummy()).checkContainment(sfc, sfc);
    assertThat(report.isComplete()).isTrue();
    assertThat(report.getVerdict()).isEqualTo(Verdict.UNKNOWN);
    PathResult mix = report.getResults("Start", "Mix").get(0);
    assertThat(mix.getVerdict()).isEqualTo(PathVerdict.UNKNOWN);
    assertThat(mix.getUnknownReason()).hasValue(UnknownReason.SOLVER_TIMEOUT);
    assertThat(mix.getCounterexample()).isEmpty();
    assertThat(report.getFailures()).contains(mix);
  }

  @Test
  public void approximatedModelIsNotACounterexample() throws Exception {
    // x * y is uninterpreted for the solver, so it finds 2 * 2 == 5
    Sfc original =
        Sfc.builder()
            .addVariables(ImmutableList.of("x", "y"))
            .addStep("A")
            .addStep("B")
            .addTransition("A", "B", "x * y == 5 and x == 2 and y == 2")
            .setInitialStep("A")
            .build();
    Sfc revision =
        Sfc.builder()
            .addVariables(ImmutableList.of("x", "y"))
            .addStep("A")
            .addStep("B")
            .addTransition("A", "B", "x * y == 5 and x == 2 and y == 2 and x > 2")
            .setInitialStep("A")
            .build();

    ContainmentReport report = verifier().checkContainment(original, revision);
    PathResult result = report.getResults("A", "B").get(0);
    assertThat(result.getVerdict()).isEqualTo(PathVerdict.UNKNOWN);
    assertThat(result.getUnknownReason()).hasValue(UnknownReason.SPURIOUS_MODEL);
    assertThat(report.getVerdict()).isEqualTo(Verdict.UNKNOWN);
  }

  @Test
  public void parallelQueriesGiveSameResults() throws Exception {
    Configuration config =
        Configuration.builder().setOption("containment.parallelQueries", "3").build();
    ContainmentReport report =
        verifier(config, ShutdownNotifier.createDummy())
            .checkContainment(
                SfcExamples.factorial(), SfcExamples.factorialWithCleanup("End", "i >= n"));
    assertThat(report.getVerdict()).isEqualTo(Verdict.NOT_CONTAINED);
    assertThat(report.getResults()).hasSize(4);
    assertThat(report.getResults().get(0).getPath().isInitialization()).isTrue();
  }

  @Test
  public void concurrentChecksShareOneVerifier() throws Exception {
    ContainmentVerifier verifier = verifier();
    Sfc original = SfcExamples.factorial();
    Sfc revision = SfcExamples.factorialWithCleanup();
    ListeningExecutorService executor =
        MoreExecutors.listeningDecorator(Executors.newFixedThreadPool(4));
    try {
      List<ListenableFuture<ContainmentReport>> futures = new ArrayList<>();
      for (int i = 0; i < 12; i++) {
        futures.add(executor.submit(() -> verifier.checkContainment(original, revision)));
      }
      for (ContainmentReport report : Futures.allAsList(futures).get()) {
        assertThat(report.getVerdict()).isEqualTo(Verdict.CONTAINED);
      }
    } finally {
      executor.shutdownNow();
    }
    assertThat(verifier.getStatistics().getCheckCount()).isEqualTo(12L);
    assertThat(verifier.getPathExtractor().getStatistics().getPathCount()).isEqualTo(12L * 9);
  }

  @Test
  public void cancelledCheckIsIncomplete() throws Exception {
    ShutdownManager shutdownManager = ShutdownManager.create();
    shutdownManager.requestShutdown("test");
    Configuration config =
        Configuration.builder().setOption("paths.checkReachability", "false").build();
    ContainmentVerifier verifier = verifier(config, shutdownManager.getNotifier());

    Sfc sfc = SfcExamples.factorial();
    ContainmentReport report = verifier.checkContainment(sfc, sfc);
    assertThat(report.isComplete()).isFalse();
    assertThat(report.getResults()).isEmpty();
    assertThat(report.getVerdict()).isEqualTo(Verdict.UNKNOWN);
  }

  @Test
  public void statisticsCountQueries() throws Exception {
    ContainmentVerifier verifier = verifier();
    Sfc sfc = SfcExamples.factorial();
    verifier.checkContainment(sfc, sfc);
    assertThat(verifier.getStatistics().getQueryCount()).isEqualTo(4L);
  }
}
