// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0
package org.sosy_lab.sfcchecker.cutpoint;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import org.sosy_lab.common.log.LogManager;
import org.sosy_lab.sfcchecker.exceptions.ValidationException;
import org.sosy_lab.sfcchecker.petrinet.NetTransition;
import org.sosy_lab.sfcchecker.petrinet.PetriNet;
import org.sosy_lab.sfcchecker.petrinet.Place;

/**
 * Computes the segmentation boundaries of a net from the in- and out-degrees of its places.
 *
 * <p>A self-loop counts for both degrees, so a step with a self-loop and any other incoming
 * transition is a join. Results are cached per net instance.
 */
public class CutPointAnalyzer {

  private final LogManager logger;

  // nets are immutable, keys are compared by identity.
  private final Cache<PetriNet, CutPointSet> cache = CacheBuilder.newBuilder().weakKeys().build();

  public CutPointAnalyzer(LogManager pLogger) {
    logger = checkNotNull(pLogger);
  }

  /**
   * Determine the cut points of the net.
   *
   * @param pNet The net to analyze.
   * @return The cut points in step declaration order.
   * @throws ValidationException if some cycle of the net passes through no cut point.
   */
  public CutPointSet findCutPoints(PetriNet pNet) throws ValidationException {
    CutPointSet cached = cache.getIfPresent(pNet);
    if (cached != null) {
      return cached;
    }

    List<CutPoint> cutPoints = new ArrayList<>();
    Set<Place> boundaries = new HashSet<>();
    for (Place place : pNet.getPlaces()) {
      Set<CutPointKind> kinds = classify(pNet, place);
      if (!kinds.isEmpty()) {
        cutPoints.add(new CutPoint(place, kinds));
        boundaries.add(place);
      }
    }
    checkCycles(pNet, boundaries);

    CutPointSet result = new CutPointSet(cutPoints);
    logger.log(Level.FINE, "Found", result.size(), "cut points:", result);
    cache.put(pNet, result);
    return result;
  }

  private static Set<CutPointKind> classify(PetriNet pNet, Place pPlace) {
    Set<CutPointKind> kinds = EnumSet.noneOf(CutPointKind.class);
    int outDegree = pNet.getOutgoing(pPlace).size();
    int inDegree = pNet.getIncoming(pPlace).size();
    if (pPlace == pNet.getInitialPlace()) {
      kinds.add(CutPointKind.INITIAL);
    }
    if (outDegree == 0) {
      kinds.add(CutPointKind.TERMINAL);
    }
    if (outDegree > 1) {
      kinds.add(CutPointKind.BRANCH);
    }
    if (inDegree > 1) {
      kinds.add(CutPointKind.JOIN);
    }
    return kinds;
  }

  /**
   * Every place that is not a cut point has exactly one outgoing transition. Following these
   * from a non-cut place must reach a cut point, otherwise the place lies on a cycle that the
   * segmentation cannot break.
   */
  private static void checkCycles(PetriNet pNet, Set<Place> pBoundaries)
      throws ValidationException {
    Set<Place> leadsToBoundary = new HashSet<>(pBoundaries);
    for (Place start : pNet.getPlaces()) {
      if (leadsToBoundary.contains(start)) {
        continue;
      }
      List<Place> chain = new ArrayList<>();
      Set<Place> onChain = new HashSet<>();
      Place current = start;
      while (!leadsToBoundary.contains(current)) {
        if (!onChain.add(current)) {
          throw new ValidationException(
              "Step "
                  + current.getName()
                  + " lies on a cycle without cut point, add a branch or join at the loop header");
        }
        chain.add(current);
        NetTransition next = pNet.getOutgoing(current).get(0);
        current = next.getOutput();
      }
      leadsToBoundary.addAll(chain);
    }
  }
}
