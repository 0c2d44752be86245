// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0
package org.sosy_lab.sfcchecker.path;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.FluentIterable;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;
import java.util.HashSet;
import java.util.Set;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.sosy_lab.common.ShutdownNotifier;
import org.sosy_lab.common.configuration.Configuration;
import org.sosy_lab.common.log.LogManager;
import org.sosy_lab.sfcchecker.SfcExamples;
import org.sosy_lab.sfcchecker.cutpoint.CutPointAnalyzer;
import org.sosy_lab.sfcchecker.exceptions.ValidationException;
import org.sosy_lab.sfcchecker.petrinet.NetTransition;
import org.sosy_lab.sfcchecker.petrinet.PetriNet;
import org.sosy_lab.sfcchecker.petrinet.PetriNetBuilder;
import org.sosy_lab.sfcchecker.sfc.Sfc;
import org.sosy_lab.sfcchecker.solver.SolverSessionFactory;

@RunWith(JUnit4.class)
public class PathExtractorTest {

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

  private ImmutableList<Path> extract(Sfc pSfc, Configuration pConfig) throws Exception {
    PetriNet net = new PetriNetBuilder(logger).build(pSfc);
    PathExtractor extractor =
        new PathExtractor(pConfig, logger, solverFactory, ShutdownNotifier.createDummy());
    return extractor.paths(net, new CutPointAnalyzer(logger).findCutPoints(net));
  }

  private ImmutableList<Path> extract(Sfc pSfc) throws Exception {
    return extract(pSfc, Configuration.defaultConfiguration());
  }

  private static ImmutableList<String> describe(Iterable<Path> pPaths) {
    return FluentIterable.from(pPaths).transform(Path::toString).toList();
  }

  @Test
  public void factorialPaths() throws Exception {
    ImmutableList<Path> paths = extract(SfcExamples.factorial());
    assertThat(describe(paths))
        .containsExactly(
            "init Start",
            "Start -> Check via [t0]",
            "Check -> Check via [t1, t2, t3]",
            "Check -> End via [t4]")
        .inOrder();
    for (Path path : paths) {
      assertThat(path.getReachability()).isEqualTo(Reachability.REACHABLE);
    }
  }

  @Test
  public void pathsPartitionTransitions() throws Exception {
    Sfc sfc = SfcExamples.factorialWithCleanup();
    PetriNet net = new PetriNetBuilder(logger).build(sfc);
    PathExtractor extractor =
        new PathExtractor(
            Configuration.defaultConfiguration(),
            logger,
            solverFactory,
            ShutdownNotifier.createDummy());
    ImmutableList<Path> paths =
        extractor.paths(net, new CutPointAnalyzer(logger).findCutPoints(net));

    Set<NetTransition> seen = new HashSet<>();
    for (Path path : paths) {
      for (NetTransition transition : path.getTransitions()) {
        assertThat(seen.add(transition)).isTrue();
      }
    }
    assertThat(seen).containsExactlyElementsIn(net.getTransitions());
    assertThat(extractor.getStatistics().getPathCount()).isEqualTo((long) paths.size());
  }

  @Test
  public void initializationPath() throws Exception {
    Path init = extract(SfcExamples.factorial()).get(0);
    assertThat(init.isInitialization()).isTrue();
    assertThat(init.getSourceName()).isEqualTo("Start");
    assertThat(init.getGuard().toString()).isEqualTo("True");
    assertThat(Maps.transformValues(init.getUpdate(), Object::toString))
        .containsExactly("i", "1", "fact", "1")
        .inOrder();
  }

  @Test
  public void loopUpdateIsComposed() throws Exception {
    Path loop = extract(SfcExamples.factorial()).get(2);
    assertThat(loop.getGuard().toString()).isEqualTo("i <= n");
    assertThat(Maps.transformValues(loop.getUpdate(), Object::toString))
        .containsExactly("fact", "fact * i", "i", "i + 1")
        .inOrder();
    assertThat(loop.getFinalValue("n").toString()).isEqualTo("n");
  }

  @Test
  public void guardsSeeEarlierEffects() throws Exception {
    Sfc sfc =
        Sfc.builder()
            .addVariable("x")
            .addVariable("y")
            .addStep("A")
            .addStep("B", "x := x + 1; y := x * 2")
            .addStep("C", "x := y - x")
            .addTransition("A", "B", "")
            .addTransition("B", "C", "x > 5")
            .setInitialStep("A")
            .build();
    Path path = extract(sfc).get(1);
    assertThat(path.toString()).isEqualTo("A -> C via [t0, t1]");
    assertThat(path.getGuard().toString()).isEqualTo("x + 1 > 5");
    assertThat(Maps.transformValues(path.getUpdate(), Object::toString))
        .containsExactly("x", "(x + 1) * 2 - (x + 1)", "y", "(x + 1) * 2");
  }

  @Test
  public void contradictoryGuardsAreUnreachable() throws Exception {
    Sfc sfc =
        Sfc.builder()
            .addVariable("i")
            .addVariable("n")
            .addStep("A")
            .addStep("B")
            .addStep("C")
            .addTransition("A", "B", "i > n")
            .addTransition("B", "C", "i <= n")
            .addTransition("A", "C", "")
            .setInitialStep("A")
            .build();
    ImmutableList<Path> paths = extract(sfc);
    assertThat(describe(paths))
        .containsExactly("init A", "A -> C via [t0, t1]", "A -> C via [t2]")
        .inOrder();
    assertThat(paths.get(1).getGuard().toString()).isEqualTo("i > n and i <= n");
    assertThat(paths.get(1).getReachability()).isEqualTo(Reachability.UNREACHABLE);
    assertThat(paths.get(2).getReachability()).isEqualTo(Reachability.REACHABLE);
  }

  @Test
  public void reachabilityProbeCanBeDisabled() throws Exception {
    Configuration config =
        Configuration.builder().setOption("paths.checkReachability", "false").build();
    ImmutableList<Path> paths = extract(SfcExamples.factorial(), config);
    assertThat(paths.get(2).getReachability()).isEqualTo(Reachability.NOT_CHECKED);
  }

  @Test
  public void overlongSegment() throws Exception {
    Configuration config =
        Configuration.builder().setOption("paths.maxSegmentLength", "2").build();
    Sfc sfc = SfcExamples.factorial();
    assertThrows(ValidationException.class, () -> extract(sfc, config));
  }
}
