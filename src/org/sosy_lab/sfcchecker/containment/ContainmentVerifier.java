// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0
package org.sosy_lab.sfcchecker.containment;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Stopwatch;
import com.google.common.base.Throwables;
import com.google.common.collect.FluentIterable;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.common.ShutdownNotifier;
import org.sosy_lab.common.configuration.Configuration;
import org.sosy_lab.common.configuration.IntegerOption;
import org.sosy_lab.common.configuration.InvalidConfigurationException;
import org.sosy_lab.common.configuration.Option;
import org.sosy_lab.common.configuration.Options;
import org.sosy_lab.common.log.LogManager;
import org.sosy_lab.java_smt.api.BooleanFormula;
import org.sosy_lab.java_smt.api.BooleanFormulaManager;
import org.sosy_lab.sfcchecker.containment.Counterexample.Violation;
import org.sosy_lab.sfcchecker.cutpoint.CutPointAnalyzer;
import org.sosy_lab.sfcchecker.cutpoint.CutPointSet;
import org.sosy_lab.sfcchecker.exceptions.EvaluationException;
import org.sosy_lab.sfcchecker.exceptions.MappingException;
import org.sosy_lab.sfcchecker.exceptions.ValidationException;
import org.sosy_lab.sfcchecker.path.Path;
import org.sosy_lab.sfcchecker.path.PathExtractor;
import org.sosy_lab.sfcchecker.petrinet.PetriNet;
import org.sosy_lab.sfcchecker.petrinet.PetriNetBuilder;
import org.sosy_lab.sfcchecker.sfc.Sfc;
import org.sosy_lab.sfcchecker.sfc.Valuation;
import org.sosy_lab.sfcchecker.sfc.Variable;
import org.sosy_lab.sfcchecker.sfc.VariableDomain;
import org.sosy_lab.sfcchecker.sfc.ast.ExpressionEvaluator;
import org.sosy_lab.sfcchecker.solver.FormulaEncoder;
import org.sosy_lab.sfcchecker.solver.QueryResult;
import org.sosy_lab.sfcchecker.solver.SolverSession;
import org.sosy_lab.sfcchecker.solver.SolverSessionFactory;
import org.sosy_lab.sfcchecker.solver.UnknownReason;

/**
 * Checks that a revised chart contains the behavior of an original chart.
 *
 * <p>For every path P1 of the original between the aligned boundaries C and D, the paths of the
 * revision from the image of C to the image of D must cover it: whenever P1 fires, one of them
 * fires as well and ends with the same values of all variables both charts declare. With guard
 * preservation enabled, no such path of the revision may fire where no path of the original from
 * C to D fires. Each path is decided by one solver query in a context of its own.
 */
@Options(prefix = "containment")
public class ContainmentVerifier {

  @Option(secure = true, description = "Number of solver queries to run in parallel.")
  @IntegerOption(min = 1)
  private int parallelQueries = 1;

  @Option(
      secure = true,
      description =
          "Also require that the aligned paths of the revision do not fire"
              + " where the original segment does not fire.")
  private boolean checkGuardPreservation = true;

  private final LogManager logger;
  private final ShutdownNotifier shutdownNotifier;
  private final SolverSessionFactory solverFactory;
  private final PetriNetBuilder netBuilder;
  private final CutPointAnalyzer cutPointAnalyzer;
  private final PathExtractor pathExtractor;
  private final ContainmentStatistics statistics = new ContainmentStatistics();

  public ContainmentVerifier(
      Configuration pConfig,
      LogManager pLogger,
      ShutdownNotifier pShutdownNotifier,
      SolverSessionFactory pSolverFactory)
      throws InvalidConfigurationException {
    pConfig.inject(this);
    logger = checkNotNull(pLogger);
    shutdownNotifier = checkNotNull(pShutdownNotifier);
    solverFactory = checkNotNull(pSolverFactory);
    netBuilder = new PetriNetBuilder(pLogger);
    cutPointAnalyzer = new CutPointAnalyzer(pLogger);
    pathExtractor = new PathExtractor(pConfig, pLogger, pSolverFactory, pShutdownNotifier);
  }

  public PetriNetBuilder getNetBuilder() {
    return netBuilder;
  }

  public CutPointAnalyzer getCutPointAnalyzer() {
    return cutPointAnalyzer;
  }

  public PathExtractor getPathExtractor() {
    return pathExtractor;
  }

  public ContainmentStatistics getStatistics() {
    return statistics;
  }

  public ContainmentReport checkContainment(Sfc pSfc1, Sfc pSfc2)
      throws ValidationException, MappingException, InterruptedException {
    return checkContainment(pSfc1, pSfc2, ImmutableMap.of());
  }

  /**
   * Check whether the revision contains the behavior of the original.
   *
   * @param pSfc1 The original chart.
   * @param pSfc2 The revision.
   * @param pMapping Explicit step correspondences from the original to the revision. Steps
   *     without entry correspond to the step of the same name.
   * @return The report. If a shutdown is requested, the report contains the paths decided so far
   *     and is marked incomplete.
   * @throws MappingException if the cut points cannot be aligned or a shared variable has
   *     different domains.
   * @throws ValidationException if a chart cannot be segmented.
   * @throws InterruptedException if the calling thread is interrupted.
   */
  public ContainmentReport checkContainment(
      Sfc pSfc1, Sfc pSfc2, Map<String, String> pMapping)
      throws ValidationException, MappingException, InterruptedException {
    Stopwatch totalTime = Stopwatch.createStarted();
    statistics.checks.increment();
    try {
      ImmutableMap<String, VariableDomain> domains = mergeDomains(pSfc1, pSfc2);
      ImmutableSet<String> sharedVariables =
          Sets.intersection(pSfc1.getVariables().keySet(), pSfc2.getVariables().keySet())
              .immutableCopy();

      PetriNet net1 = netBuilder.build(pSfc1);
      PetriNet net2 = netBuilder.build(pSfc2);
      CutPointSet cutPoints1 = cutPointAnalyzer.findCutPoints(net1);
      CutPointSet cutPoints2 = cutPointAnalyzer.findCutPoints(net2);
      CutPointAlignment alignment =
          CutPointAlignment.align(net1, cutPoints1, net2, cutPoints2, pMapping);
      logger.log(Level.FINE, "Aligned segment boundaries:", alignment);

      ImmutableList<Path> paths1;
      ImmutableList<Path> paths2;
      try {
        paths1 = pathExtractor.paths(net1, alignment.getCutPoints1());
        paths2 = pathExtractor.paths(net2, alignment.getCutPoints2());
      } catch (InterruptedException e) {
        if (!shutdownNotifier.shouldShutdown()) {
          throw e;
        }
        logger.log(Level.WARNING, "Containment check cancelled during path extraction");
        return new ContainmentReport(net1, net2, alignment, ImmutableList.of(), false);
      }

      List<Obligation> obligations = buildObligations(net1, net2, alignment, paths1, paths2);
      logger.log(Level.FINE, "Checking", obligations.size(), "paths of the original chart");

      List<Optional<PathResult>> results = discharge(obligations, domains, sharedVariables);
      ImmutableList<PathResult> decided =
          FluentIterable.from(results)
              .filter(Optional::isPresent)
              .transform(Optional::get)
              .toList();
      boolean complete = decided.size() == obligations.size();
      if (!complete) {
        logger.log(
            Level.WARNING,
            "Containment check cancelled,",
            obligations.size() - decided.size(),
            "paths undecided");
      }

      ContainmentReport report = new ContainmentReport(net1, net2, alignment, decided, complete);
      logger.log(Level.FINE, "Containment verdict:", report.getVerdict());
      return report;
    } finally {
      statistics.totalNanos.add(totalTime.elapsed(TimeUnit.NANOSECONDS));
    }
  }

  private static ImmutableMap<String, VariableDomain> mergeDomains(Sfc pSfc1, Sfc pSfc2)
      throws MappingException {
    Map<String, VariableDomain> domains = new LinkedHashMap<>();
    for (Variable variable : pSfc1.getVariables().values()) {
      domains.put(variable.getName(), variable.getDomain());
    }
    for (Variable variable : pSfc2.getVariables().values()) {
      VariableDomain previous = domains.putIfAbsent(variable.getName(), variable.getDomain());
      if (previous != null && previous != variable.getDomain()) {
        throw new MappingException(
            "Variable "
                + variable.getName()
                + " is "
                + previous
                + " in the original chart but "
                + variable.getDomain()
                + " in the revision");
      }
    }
    return ImmutableMap.copyOf(domains);
  }

  /** One path of the original with the paths it is compared to. */
  private static final class Obligation {
    private final Path path;
    private final ImmutableList<Path> siblings;
    private final ImmutableList<Path> matches;

    private Obligation(Path pPath, ImmutableList<Path> pSiblings, ImmutableList<Path> pMatches) {
      path = pPath;
      siblings = pSiblings;
      matches = pMatches;
    }
  }

  private static List<Obligation> buildObligations(
      PetriNet pNet1,
      PetriNet pNet2,
      CutPointAlignment pAlignment,
      List<Path> pPaths1,
      List<Path> pPaths2) {
    ImmutableListMultimap<String, Path> bySource1 =
        FluentIterable.from(pPaths1)
            .filter(p -> !p.isInitialization())
            .index(Path::getSourceName);
    ImmutableListMultimap<String, Path> bySource2 =
        FluentIterable.from(pPaths2)
            .filter(p -> !p.isInitialization())
            .index(Path::getSourceName);
    Path init2 = FluentIterable.from(pPaths2).firstMatch(Path::isInitialization).get();

    List<Obligation> obligations = new ArrayList<>();
    for (Path path : pPaths1) {
      if (path.isInitialization()) {
        boolean initialAligned =
            pAlignment
                .getImage(pNet1.getInitialPlace().getName())
                .map(pNet2.getInitialPlace().getName()::equals)
                .orElse(false);
        obligations.add(
            new Obligation(
                path,
                ImmutableList.of(path),
                initialAligned ? ImmutableList.of(init2) : ImmutableList.of()));
        continue;
      }
      String source2 = pAlignment.getImage(path.getSourceName()).orElseThrow();
      String target2 = pAlignment.getImage(path.getTargetName()).orElseThrow();
      obligations.add(
          new Obligation(
              path,
              between(bySource1, path.getSourceName(), path.getTargetName()),
              between(bySource2, source2, target2)));
    }
    return obligations;
  }

  private static ImmutableList<Path> between(
      ImmutableListMultimap<String, Path> pBySource, String pSource, String pTarget) {
    return FluentIterable.from(pBySource.get(pSource))
        .filter(p -> p.getTargetName().equals(pTarget))
        .toList();
  }

  private List<Optional<PathResult>> discharge(
      List<Obligation> pObligations,
      Map<String, VariableDomain> pDomains,
      ImmutableSet<String> pSharedVariables)
      throws InterruptedException {
    ListeningExecutorService executor =
        parallelQueries > 1
            ? MoreExecutors.listeningDecorator(
                Executors.newFixedThreadPool(
                    parallelQueries,
                    new ThreadFactoryBuilder()
                        .setNameFormat("containment-query-%d")
                        .setDaemon(true)
                        .build()))
            : MoreExecutors.newDirectExecutorService();
    try {
      List<ListenableFuture<Optional<PathResult>>> futures = new ArrayList<>();
      for (Obligation obligation : pObligations) {
        futures.add(executor.submit(() -> verifyPath(obligation, pDomains, pSharedVariables)));
      }
      return Futures.allAsList(futures).get();
    } catch (ExecutionException e) {
      Throwables.throwIfUnchecked(e.getCause());
      throw new AssertionError("Unexpected checked exception", e.getCause());
    } finally {
      executor.shutdownNow();
    }
  }

  /** Decide one obligation. Empty if the check was cancelled before a result was available. */
  private Optional<PathResult> verifyPath(
      Obligation pObligation,
      Map<String, VariableDomain> pDomains,
      ImmutableSet<String> pSharedVariables) {
    Path path = pObligation.path;
    if (path.isUnreachable()) {
      statistics.unreachable.increment();
      return Optional.of(PathResult.unreachable(path));
    }
    if (shutdownNotifier.shouldShutdown()) {
      statistics.cancelled.increment();
      return Optional.empty();
    }

    statistics.queries.increment();
    Stopwatch stopwatch = Stopwatch.createStarted();
    try (SolverSession session = solverFactory.openSession(pDomains, shutdownNotifier)) {
      BooleanFormula query = encodeQuery(session.getEncoder(), pObligation, pSharedVariables);
      QueryResult result = session.check(query);
      PathResult pathResult = interpret(pObligation, result, pSharedVariables);
      logger.log(Level.FINER, "Path", path, "is", pathResult.getVerdict());
      return Optional.of(pathResult);
    } catch (InterruptedException e) {
      statistics.cancelled.increment();
      logger.log(Level.FINER, "Query for", path, "cancelled");
      return Optional.empty();
    } catch (InvalidConfigurationException e) {
      logger.logUserException(Level.WARNING, e, "Could not create solver for " + path);
      statistics.unknown.increment();
      return Optional.of(
          PathResult.unknown(
              path, pObligation.matches, UnknownReason.SOLVER_UNKNOWN, e.getMessage()));
    } finally {
      statistics.queryTimeNanos.add(stopwatch.elapsed(TimeUnit.NANOSECONDS));
    }
  }

  private BooleanFormula encodeQuery(
      FormulaEncoder pEncoder, Obligation pObligation, ImmutableSet<String> pSharedVariables) {
    BooleanFormulaManager bmgr = pEncoder.getBooleanFormulaManager();
    Path path = pObligation.path;

    List<BooleanFormula> preserving = new ArrayList<>();
    for (Path match : pObligation.matches) {
      List<BooleanFormula> conjuncts = new ArrayList<>();
      conjuncts.add(pEncoder.encodeCondition(match.getGuard()));
      for (String variable : changedVariables(path, match, pSharedVariables)) {
        conjuncts.add(
            pEncoder.makeEqual(
                pEncoder.encode(path.getFinalValue(variable)),
                pEncoder.encode(match.getFinalValue(variable))));
      }
      preserving.add(bmgr.and(conjuncts));
    }
    BooleanFormula query =
        bmgr.and(pEncoder.encodeCondition(path.getGuard()), bmgr.not(bmgr.or(preserving)));

    if (checkGuardPreservation && !pObligation.matches.isEmpty()) {
      List<BooleanFormula> guards2 = new ArrayList<>();
      for (Path match : pObligation.matches) {
        guards2.add(pEncoder.encodeCondition(match.getGuard()));
      }
      List<BooleanFormula> guards1 = new ArrayList<>();
      for (Path sibling : pObligation.siblings) {
        guards1.add(pEncoder.encodeCondition(sibling.getGuard()));
      }
      query = bmgr.or(query, bmgr.and(bmgr.or(guards2), bmgr.not(bmgr.or(guards1))));
    }
    return query;
  }

  /** Shared variables one of the two paths assigns; the others keep their common entry value. */
  private static ImmutableSet<String> changedVariables(
      Path pPath1, Path pPath2, ImmutableSet<String> pSharedVariables) {
    return FluentIterable.from(pSharedVariables)
        .filter(v -> pPath1.getUpdate().containsKey(v) || pPath2.getUpdate().containsKey(v))
        .toSet();
  }

  private PathResult interpret(
      Obligation pObligation, QueryResult pResult, ImmutableSet<String> pSharedVariables) {
    Path path = pObligation.path;
    switch (pResult.getStatus()) {
      case UNSAT:
        statistics.contained.increment();
        return PathResult.contained(path, pObligation.matches);
      case UNKNOWN:
        statistics.unknown.increment();
        UnknownReason reason = pResult.getReason().orElseThrow();
        if (reason == UnknownReason.SOLVER_TIMEOUT) {
          statistics.timeouts.increment();
        }
        return PathResult.unknown(path, pObligation.matches, reason, pResult.getMessage());
      case SAT:
        Optional<Counterexample> counterexample =
            confirm(pObligation, pResult.getModel(), pSharedVariables);
        if (counterexample.isPresent()) {
          statistics.notContained.increment();
          return PathResult.notContained(path, pObligation.matches, counterexample.orElseThrow());
        }
        statistics.unknown.increment();
        statistics.spuriousModels.increment();
        logger.log(Level.WARNING, "Solver model for", path, "does not reproduce a violation");
        return PathResult.unknown(
            path,
            pObligation.matches,
            UnknownReason.SPURIOUS_MODEL,
            "model " + pResult.getModel() + " is not a concrete violation");
      default:
        throw new AssertionError("Unhandled status " + pResult.getStatus());
    }
  }

  /** Re-check a solver model on the concrete semantics. */
  private Optional<Counterexample> confirm(
      Obligation pObligation, Valuation pModel, ImmutableSet<String> pSharedVariables) {
    ExpressionEvaluator evaluator = new ExpressionEvaluator(pModel.asMap());
    Path path = pObligation.path;
    try {
      if (evaluator.evaluateCondition(path.getGuard())
          && !preservedBySomeMatch(evaluator, pObligation, pSharedVariables)) {
        return Optional.of(new Counterexample(pModel, Violation.BEHAVIOR, path, null));
      }
      if (checkGuardPreservation && !anyFires(evaluator, pObligation.siblings)) {
        for (Path match : pObligation.matches) {
          if (evaluator.evaluateCondition(match.getGuard())) {
            return Optional.of(new Counterexample(pModel, Violation.GUARD, path, match));
          }
        }
      }
    } catch (EvaluationException e) {
      logger.logDebugException(e, "Model cannot be evaluated concretely");
    }
    return Optional.empty();
  }

  private static boolean preservedBySomeMatch(
      ExpressionEvaluator pEvaluator, Obligation pObligation, ImmutableSet<String> pShared)
      throws EvaluationException {
    for (Path match : pObligation.matches) {
      if (pEvaluator.evaluateCondition(match.getGuard())
          && sameFinalValues(pEvaluator, pObligation.path, match, pShared)) {
        return true;
      }
    }
    return false;
  }

  private static boolean sameFinalValues(
      ExpressionEvaluator pEvaluator, Path pPath1, Path pPath2, ImmutableSet<String> pShared)
      throws EvaluationException {
    for (String variable : changedVariables(pPath1, pPath2, pShared)) {
      @Nullable Object value1 = pEvaluator.evaluate(pPath1.getFinalValue(variable));
      @Nullable Object value2 = pEvaluator.evaluate(pPath2.getFinalValue(variable));
      if (!Objects.equals(value1, value2)) {
        return false;
      }
    }
    return true;
  }

  private static boolean anyFires(ExpressionEvaluator pEvaluator, List<Path> pPaths)
      throws EvaluationException {
    for (Path path : pPaths) {
      if (pEvaluator.evaluateCondition(path.getGuard())) {
        return true;
      }
    }
    return false;
  }
}
