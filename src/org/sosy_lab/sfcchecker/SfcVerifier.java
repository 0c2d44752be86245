// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0
package org.sosy_lab.sfcchecker;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.io.PrintStream;
import java.util.Map;
import org.sosy_lab.common.ShutdownNotifier;
import org.sosy_lab.common.configuration.Configuration;
import org.sosy_lab.common.configuration.InvalidConfigurationException;
import org.sosy_lab.common.log.LogManager;
import org.sosy_lab.sfcchecker.containment.ContainmentReport;
import org.sosy_lab.sfcchecker.containment.ContainmentVerifier;
import org.sosy_lab.sfcchecker.cutpoint.CutPointSet;
import org.sosy_lab.sfcchecker.exceptions.SfcException;
import org.sosy_lab.sfcchecker.path.Path;
import org.sosy_lab.sfcchecker.petrinet.PetriNet;
import org.sosy_lab.sfcchecker.sfc.Sfc;
import org.sosy_lab.sfcchecker.solver.SolverSessionFactory;

/**
 * Entry point of the verification core. Every operation returns an {@link Outcome} instead of
 * throwing, so that callers can tell fatal input errors from results. Only interruption of the
 * calling thread is reported as an exception.
 *
 * <p>The verifier owns a solver factory and has to be closed.
 */
public class SfcVerifier implements AutoCloseable {

  private final SolverSessionFactory solverFactory;
  private final ContainmentVerifier verifier;

  public SfcVerifier(Configuration pConfig, LogManager pLogger, ShutdownNotifier pShutdownNotifier)
      throws InvalidConfigurationException {
    solverFactory = new SolverSessionFactory(pConfig, pLogger);
    verifier = new ContainmentVerifier(pConfig, pLogger, pShutdownNotifier, solverFactory);
  }

  /** Validate a chart. */
  public Outcome<Sfc> buildSfc(Sfc.Builder pBuilder) {
    try {
      return Outcome.success(pBuilder.build());
    } catch (SfcException e) {
      return Outcome.failure(e);
    }
  }

  public Outcome<PetriNet> build(Sfc pSfc) {
    return Outcome.success(verifier.getNetBuilder().build(pSfc));
  }

  public Outcome<CutPointSet> findCutPoints(PetriNet pNet) {
    try {
      return Outcome.success(verifier.getCutPointAnalyzer().findCutPoints(pNet));
    } catch (SfcException e) {
      return Outcome.failure(e);
    }
  }

  public Outcome<ImmutableList<Path>> paths(PetriNet pNet, CutPointSet pCutPoints)
      throws InterruptedException {
    try {
      return Outcome.success(verifier.getPathExtractor().paths(pNet, pCutPoints));
    } catch (SfcException e) {
      return Outcome.failure(e);
    }
  }

  public Outcome<ContainmentReport> checkContainment(Sfc pSfc1, Sfc pSfc2)
      throws InterruptedException {
    return checkContainment(pSfc1, pSfc2, ImmutableMap.of());
  }

  public Outcome<ContainmentReport> checkContainment(
      Sfc pSfc1, Sfc pSfc2, Map<String, String> pMapping) throws InterruptedException {
    try {
      return Outcome.success(verifier.checkContainment(pSfc1, pSfc2, pMapping));
    } catch (SfcException e) {
      return Outcome.failure(e);
    }
  }

  public void printStatistics(PrintStream pOut) {
    verifier.getPathExtractor().getStatistics().printStatistics(pOut);
    pOut.println();
    verifier.getStatistics().printStatistics(pOut);
  }

  @Override
  public void close() {
    solverFactory.close();
  }
}
