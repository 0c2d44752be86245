// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0
package org.sosy_lab.sfcchecker.path;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import org.sosy_lab.common.ShutdownNotifier;
import org.sosy_lab.common.configuration.Configuration;
import org.sosy_lab.common.configuration.IntegerOption;
import org.sosy_lab.common.configuration.InvalidConfigurationException;
import org.sosy_lab.common.configuration.Option;
import org.sosy_lab.common.configuration.Options;
import org.sosy_lab.common.log.LogManager;
import org.sosy_lab.sfcchecker.cutpoint.CutPoint;
import org.sosy_lab.sfcchecker.cutpoint.CutPointSet;
import org.sosy_lab.sfcchecker.exceptions.ValidationException;
import org.sosy_lab.sfcchecker.petrinet.NetTransition;
import org.sosy_lab.sfcchecker.petrinet.PetriNet;
import org.sosy_lab.sfcchecker.petrinet.Place;
import org.sosy_lab.sfcchecker.sfc.Variable;
import org.sosy_lab.sfcchecker.sfc.VariableDomain;
import org.sosy_lab.sfcchecker.sfc.ast.BinaryExpression;
import org.sosy_lab.sfcchecker.sfc.ast.BinaryExpression.BinaryOperator;
import org.sosy_lab.sfcchecker.sfc.ast.BooleanLiteralExpression;
import org.sosy_lab.sfcchecker.sfc.ast.SfcExpression;
import org.sosy_lab.sfcchecker.solver.QueryResult;
import org.sosy_lab.sfcchecker.solver.SolverSession;
import org.sosy_lab.sfcchecker.solver.SolverSessionFactory;

/**
 * Enumerates the symbolic paths between consecutive cut points of a net.
 *
 * <p>Every transition leaving a cut point starts a segment walk that stops at the first cut point
 * it reaches. Along the walk the entry actions of every reached step are executed symbolically,
 * so the path guard and update only mention the values at the source cut point.
 */
@Options(prefix = "paths")
public class PathExtractor {

  @Option(
      secure = true,
      description = "Check every path guard for satisfiability and mark unsatisfiable paths.")
  private boolean checkReachability = true;

  @Option(
      secure = true,
      description =
          "Maximal number of transitions in one segment. A longer walk is reported as malformed"
              + " input.")
  @IntegerOption(min = 1)
  private int maxSegmentLength = 10000;

  private final LogManager logger;
  private final SolverSessionFactory solverFactory;
  private final ShutdownNotifier shutdownNotifier;
  private final PathExtractorStatistics statistics = new PathExtractorStatistics();

  public PathExtractor(
      Configuration pConfig,
      LogManager pLogger,
      SolverSessionFactory pSolverFactory,
      ShutdownNotifier pShutdownNotifier)
      throws InvalidConfigurationException {
    pConfig.inject(this);
    logger = checkNotNull(pLogger);
    solverFactory = checkNotNull(pSolverFactory);
    shutdownNotifier = checkNotNull(pShutdownNotifier);
  }

  /**
   * Extract all paths of the net. The first path is the initialization path of the initial step,
   * the others follow the order of their source cut points and of the transitions leaving them.
   *
   * @param pNet The net.
   * @param pCutPoints Cut points of this net, possibly extended by anchors.
   * @return The paths; every transition of the net belongs to exactly one of them.
   * @throws ValidationException if a walk runs into a cycle or a dead end before reaching a cut
   *     point, or exceeds the maximal segment length.
   * @throws InterruptedException if a shutdown was requested during a reachability probe.
   */
  public ImmutableList<Path> paths(PetriNet pNet, CutPointSet pCutPoints)
      throws ValidationException, InterruptedException {
    for (CutPoint cutPoint : pCutPoints.asList()) {
      checkArgument(
          pNet.getPlaces().contains(cutPoint.getPlace()),
          "Cut point %s does not belong to the net",
          cutPoint);
    }
    checkArgument(
        pCutPoints.contains(pNet.getInitialPlace()), "The initial step must be a cut point");

    Stopwatch stopwatch = Stopwatch.createStarted();
    try {
      ImmutableList.Builder<Path> paths = ImmutableList.builder();
      Place initial = pNet.getInitialPlace();
      paths.add(
          new Path(
              initial,
              initial,
              ImmutableList.of(),
              BooleanLiteralExpression.TRUE,
              SymbolicState.identity().execute(initial.getEntryActions()).asMap(),
              Reachability.REACHABLE));

      for (CutPoint cutPoint : pCutPoints.asList()) {
        for (NetTransition first : pNet.getOutgoing(cutPoint.getPlace())) {
          statistics.segments.increment();
          walkSegment(pNet, pCutPoints, first, paths);
        }
      }

      ImmutableList<Path> result = probeReachability(pNet, paths.build());
      statistics.paths.add(result.size());
      logger.log(
          Level.FINE, "Extracted", result.size(), "paths between", pCutPoints.size(), "cut points");
      return result;
    } finally {
      statistics.extractionNanos.add(stopwatch.elapsed(TimeUnit.NANOSECONDS));
    }
  }

  /** Depth-first walk from one transition leaving a cut point to all cut points it reaches. */
  private void walkSegment(
      PetriNet pNet,
      CutPointSet pCutPoints,
      NetTransition pFirst,
      ImmutableList.Builder<Path> pPaths)
      throws ValidationException {
    Place source = pFirst.getInput();
    Deque<List<NetTransition>> waitlist = new ArrayDeque<>();
    waitlist.push(ImmutableList.of(pFirst));

    while (!waitlist.isEmpty()) {
      List<NetTransition> prefix = waitlist.pop();
      Place reached = prefix.get(prefix.size() - 1).getOutput();
      if (pCutPoints.contains(reached)) {
        pPaths.add(buildPath(source, reached, prefix));
        continue;
      }
      if (prefix.size() >= maxSegmentLength) {
        throw new ValidationException(
            "Segment starting at "
                + source.getName()
                + " exceeds "
                + maxSegmentLength
                + " transitions");
      }
      ImmutableList<NetTransition> next = pNet.getOutgoing(reached);
      if (next.isEmpty()) {
        throw new ValidationException(
            "Step " + reached.getName() + " has no successor but is not a cut point");
      }
      // push in reverse so that declaration order is kept
      for (NetTransition transition : next.reverse()) {
        Place target = transition.getOutput();
        if (!pCutPoints.contains(target)) {
          for (NetTransition visited : prefix) {
            if (visited.getInput() == target) {
              throw new ValidationException(
                  "Cycle through " + target.getName() + " does not pass a cut point");
            }
          }
        }
        List<NetTransition> extended = new ArrayList<>(prefix);
        extended.add(transition);
        waitlist.push(extended);
      }
    }
  }

  private static Path buildPath(Place pSource, Place pTarget, List<NetTransition> pTransitions) {
    SymbolicState state = SymbolicState.identity();
    List<SfcExpression> conjuncts = new ArrayList<>();
    for (NetTransition transition : pTransitions) {
      SfcExpression guard = state.evaluate(transition.getGuard());
      if (!guard.equals(BooleanLiteralExpression.TRUE)) {
        conjuncts.add(guard);
      }
      state = state.execute(transition.getEffect());
    }
    return new Path(
        pSource,
        pTarget,
        ImmutableList.copyOf(pTransitions),
        conjunction(conjuncts),
        state.asMap(),
        Reachability.NOT_CHECKED);
  }

  private static SfcExpression conjunction(List<SfcExpression> pConjuncts) {
    if (pConjuncts.isEmpty()) {
      return BooleanLiteralExpression.TRUE;
    }
    SfcExpression result = pConjuncts.get(0);
    for (SfcExpression conjunct : pConjuncts.subList(1, pConjuncts.size())) {
      result = new BinaryExpression(result, conjunct, BinaryOperator.AND);
    }
    return result;
  }

  private ImmutableList<Path> probeReachability(PetriNet pNet, ImmutableList<Path> pPaths)
      throws InterruptedException {
    if (!checkReachability) {
      return pPaths;
    }
    Map<String, VariableDomain> domains =
        Maps.transformValues(pNet.getSfc().getVariables(), Variable::getDomain);

    ImmutableList.Builder<Path> result = ImmutableList.builder();
    for (Path path : pPaths) {
      if (path.getReachability() != Reachability.NOT_CHECKED) {
        result.add(path);
        continue;
      }
      Reachability reachability = probe(path, domains);
      if (reachability == Reachability.UNREACHABLE) {
        statistics.unreachablePaths.increment();
        logger.log(Level.FINER, "Path", path, "is unreachable, guard", path.getGuard());
      } else if (reachability == Reachability.UNKNOWN) {
        statistics.undecidedPaths.increment();
      }
      result.add(path.withReachability(reachability));
    }
    return result.build();
  }

  private Reachability probe(Path pPath, Map<String, VariableDomain> pDomains)
      throws InterruptedException {
    SfcExpression guard = pPath.getGuard();
    if (guard.equals(BooleanLiteralExpression.TRUE)) {
      return Reachability.REACHABLE;
    }
    if (guard.equals(BooleanLiteralExpression.FALSE)) {
      return Reachability.UNREACHABLE;
    }

    Stopwatch stopwatch = Stopwatch.createStarted();
    statistics.reachabilityQueries.increment();
    try (SolverSession session =
        solverFactory.openSession(ImmutableMap.copyOf(pDomains), shutdownNotifier)) {
      QueryResult result = session.check(session.getEncoder().encodeCondition(guard));
      switch (result.getStatus()) {
        case UNSAT:
          return Reachability.UNREACHABLE;
        case SAT:
          return Reachability.REACHABLE;
        default:
          return Reachability.UNKNOWN;
      }
    } catch (InvalidConfigurationException e) {
      logger.logUserException(Level.WARNING, e, "Could not probe reachability of " + pPath);
      return Reachability.UNKNOWN;
    } finally {
      statistics.reachabilityNanos.add(stopwatch.elapsed(TimeUnit.NANOSECONDS));
    }
  }

  public PathExtractorStatistics getStatistics() {
    return statistics;
  }
}
