// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0
package org.sosy_lab.sfcchecker.solver;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ScheduledFuture;
import java.util.logging.Level;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.common.ShutdownManager;
import org.sosy_lab.common.ShutdownNotifier;
import org.sosy_lab.common.log.LogManager;
import org.sosy_lab.java_smt.api.BooleanFormula;
import org.sosy_lab.java_smt.api.Model;
import org.sosy_lab.java_smt.api.ProverEnvironment;
import org.sosy_lab.java_smt.api.SolverContext;
import org.sosy_lab.java_smt.api.SolverContext.ProverOptions;
import org.sosy_lab.java_smt.api.SolverException;
import org.sosy_lab.sfcchecker.sfc.Valuation;

/**
 * A solver context used for exactly one query. Closing the session releases the context and
 * cancels its timeout.
 */
public class SolverSession implements AutoCloseable {

  private final SolverContext context;
  private final FormulaEncoder encoder;
  private final ShutdownManager shutdownManager;
  private final ShutdownNotifier parentNotifier;
  private final @Nullable ScheduledFuture<?> timeoutTask;
  private final LogManager logger;

  SolverSession(
      SolverContext pContext,
      FormulaEncoder pEncoder,
      ShutdownManager pShutdownManager,
      ShutdownNotifier pParentNotifier,
      @Nullable ScheduledFuture<?> pTimeoutTask,
      LogManager pLogger) {
    context = pContext;
    encoder = pEncoder;
    shutdownManager = pShutdownManager;
    parentNotifier = pParentNotifier;
    timeoutTask = pTimeoutTask;
    logger = pLogger;
  }

  public FormulaEncoder getEncoder() {
    return encoder;
  }

  /**
   * Check satisfiability of the formula. Solver failures and timeouts are reported as an unknown
   * result.
   *
   * @throws InterruptedException if the caller requested a shutdown.
   */
  public QueryResult check(BooleanFormula pFormula) throws InterruptedException {
    try (ProverEnvironment prover = context.newProverEnvironment(ProverOptions.GENERATE_MODELS)) {
      prover.addConstraint(pFormula);
      if (prover.isUnsat()) {
        return QueryResult.unsat();
      }
      try (Model model = prover.getModel()) {
        return QueryResult.sat(extractValuation(model));
      }
    } catch (InterruptedException e) {
      if (parentNotifier.shouldShutdown()) {
        throw e;
      }
      logger.log(Level.WARNING, "Solver query timed out:", shutdownReason());
      return QueryResult.unknown(UnknownReason.SOLVER_TIMEOUT, shutdownReason());
    } catch (SolverException e) {
      if (shutdownManager.getNotifier().shouldShutdown() && !parentNotifier.shouldShutdown()) {
        logger.log(Level.WARNING, "Solver query timed out:", shutdownReason());
        return QueryResult.unknown(UnknownReason.SOLVER_TIMEOUT, shutdownReason());
      }
      logger.logDebugException(e, "Solver failed");
      logger.log(Level.WARNING, "Solver could not decide query:", e.getMessage());
      return QueryResult.unknown(UnknownReason.SOLVER_UNKNOWN, String.valueOf(e.getMessage()));
    }
  }

  private String shutdownReason() {
    return shutdownManager.getNotifier().shouldShutdown()
        ? shutdownManager.getNotifier().getReason()
        : "timeout";
  }

  private Valuation extractValuation(Model pModel) {
    Map<String, Object> values = new LinkedHashMap<>();
    for (String variable : encoder.getVariables().keySet()) {
      Object value = encoder.decode(variable, pModel);
      if (value != null) {
        values.put(variable, value);
      }
    }
    return Valuation.of(values);
  }

  @Override
  public void close() {
    if (timeoutTask != null) {
      timeoutTask.cancel(false);
    }
    context.close();
  }
}
