// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0
package org.sosy_lab.sfcchecker.petrinet;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.logging.Level;
import org.sosy_lab.common.log.LogManager;
import org.sosy_lab.sfcchecker.sfc.Sfc;
import org.sosy_lab.sfcchecker.sfc.SfcTransition;
import org.sosy_lab.sfcchecker.sfc.Step;

/** Factory for creating a {@link PetriNet} from a validated {@link Sfc}. */
public class PetriNetBuilder {

  private final LogManager logger;

  public PetriNetBuilder(LogManager pLogger) {
    logger = checkNotNull(pLogger);
  }

  /**
   * This function maps every step to a place and every chart transition to a net transition whose
   * single input place is the source step and whose single output place is the target step.
   *
   * @param pSfc The chart, already validated by {@link Sfc.Builder#build()}.
   * @return The net. Building is deterministic and total over valid charts.
   */
  public PetriNet build(Sfc pSfc) {
    ImmutableMap.Builder<String, Place> places = ImmutableMap.builder();
    for (Step step : pSfc.getSteps()) {
      places.put(step.getName(), new Place(step));
    }
    ImmutableMap<String, Place> placeMap = places.buildOrThrow();

    ImmutableList.Builder<NetTransition> transitions = ImmutableList.builder();
    for (SfcTransition transition : pSfc.getTransitions()) {
      transitions.add(
          new NetTransition(
              transition,
              placeMap.get(transition.getSource().getName()),
              placeMap.get(transition.getTarget().getName())));
    }

    PetriNet net =
        new PetriNet(
            pSfc, placeMap, transitions.build(), placeMap.get(pSfc.getInitialStep().getName()));
    logger.log(
        Level.FINE,
        "Built Petri net with",
        net.getPlaces().size(),
        "places and",
        net.getTransitions().size(),
        "transitions");
    return net;
  }
}
