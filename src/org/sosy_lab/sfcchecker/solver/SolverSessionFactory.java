// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0
package org.sosy_lab.sfcchecker.solver;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.common.ShutdownManager;
import org.sosy_lab.common.ShutdownNotifier;
import org.sosy_lab.common.configuration.Configuration;
import org.sosy_lab.common.configuration.InvalidConfigurationException;
import org.sosy_lab.common.configuration.Option;
import org.sosy_lab.common.configuration.Options;
import org.sosy_lab.common.configuration.TimeSpanOption;
import org.sosy_lab.common.log.LogManager;
import org.sosy_lab.common.time.TimeSpan;
import org.sosy_lab.java_smt.SolverContextFactory;
import org.sosy_lab.java_smt.SolverContextFactory.Solvers;
import org.sosy_lab.java_smt.api.SolverContext;
import org.sosy_lab.sfcchecker.sfc.VariableDomain;

/**
 * Creates one {@link SolverSession} per query. Every session owns a fresh solver context and a
 * shutdown manager below the caller's notifier, so no assertion or solver state is shared
 * between queries and a timeout only stops its own query.
 */
@Options(prefix = "containment")
public class SolverSessionFactory implements AutoCloseable {

  @Option(secure = true, description = "SMT solver used for path queries.")
  private Solvers solver = Solvers.SMTINTERPOL;

  @Option(
      secure = true,
      description = "Time limit for a single solver query (use 0 to disable the limit).")
  @TimeSpanOption(codeUnit = TimeUnit.MILLISECONDS, defaultUserUnit = TimeUnit.SECONDS, min = 0)
  private TimeSpan solverTimeout = TimeSpan.ofSeconds(10);

  @Option(
      secure = true,
      description =
          "Approximate non-linear integer arithmetic with uninterpreted functions"
              + " if the solver does not support it.")
  private boolean approximateNonLinear = true;

  private final Configuration solverConfig;
  private final LogManager logger;
  private final ScheduledExecutorService timeoutScheduler;

  public SolverSessionFactory(Configuration pConfig, LogManager pLogger)
      throws InvalidConfigurationException {
    pConfig.inject(this);
    logger = checkNotNull(pLogger);
    if (approximateNonLinear) {
      solverConfig =
          Configuration.builder()
              .copyFrom(pConfig)
              .setOption("solver.nonLinearArithmetic", "APPROXIMATE_FALLBACK")
              .build();
    } else {
      solverConfig = pConfig;
    }

    // fail early if the solver cannot be loaded
    try (SolverContext probe = createContext(ShutdownNotifier.createDummy())) {
      logger.log(Level.FINE, "Using solver", probe.getSolverName(), probe.getVersion());
    }

    timeoutScheduler =
        Executors.newSingleThreadScheduledExecutor(
            new ThreadFactoryBuilder().setNameFormat("solver-timeout-%d").setDaemon(true).build());
  }

  private SolverContext createContext(ShutdownNotifier pNotifier)
      throws InvalidConfigurationException {
    try {
      return SolverContextFactory.createSolverContext(solverConfig, logger, pNotifier, solver);
    } catch (UnsatisfiedLinkError e) {
      throw new InvalidConfigurationException(
          "Solver " + solver + " is not available on this system: " + e.getMessage(), e);
    }
  }

  /**
   * Open a session for one query.
   *
   * @param pDomains The domains of all variables the query may mention.
   * @param pParentNotifier Shutdown requests of the caller, they abort the session.
   */
  public SolverSession openSession(
      Map<String, VariableDomain> pDomains, ShutdownNotifier pParentNotifier)
      throws InvalidConfigurationException {
    ShutdownManager shutdownManager = ShutdownManager.createWithParent(pParentNotifier);
    SolverContext context = createContext(shutdownManager.getNotifier());
    @Nullable ScheduledFuture<?> timeoutTask = null;
    if (!solverTimeout.isEmpty()) {
      timeoutTask =
          timeoutScheduler.schedule(
              () -> shutdownManager.requestShutdown("Solver timeout of " + solverTimeout),
              solverTimeout.asMillis(),
              TimeUnit.MILLISECONDS);
    }
    return new SolverSession(
        context,
        new FormulaEncoder(context.getFormulaManager(), pDomains),
        shutdownManager,
        pParentNotifier,
        timeoutTask,
        logger);
  }

  public Solvers getSolver() {
    return solver;
  }

  public TimeSpan getSolverTimeout() {
    return solverTimeout;
  }

  @Override
  public void close() {
    timeoutScheduler.shutdownNow();
  }
}
