// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0
package org.sosy_lab.sfcchecker.petrinet;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import org.sosy_lab.sfcchecker.exceptions.StepNotFoundException;
import org.sosy_lab.sfcchecker.sfc.Sfc;
import org.sosy_lab.sfcchecker.sfc.Valuation;

/**
 * Data-augmented Petri net of a chart. Places and transitions keep the declaration order of the
 * steps and transitions they are created from. The net is immutable.
 */
public final class PetriNet {

  private final Sfc sfc;
  private final ImmutableMap<String, Place> places;
  private final ImmutableList<NetTransition> transitions;
  private final Place initialPlace;
  private final ImmutableListMultimap<Place, NetTransition> postset;
  private final ImmutableListMultimap<Place, NetTransition> preset;

  PetriNet(
      Sfc pSfc,
      ImmutableMap<String, Place> pPlaces,
      ImmutableList<NetTransition> pTransitions,
      Place pInitialPlace) {
    sfc = pSfc;
    places = pPlaces;
    transitions = pTransitions;
    initialPlace = pInitialPlace;

    ImmutableListMultimap.Builder<Place, NetTransition> post = ImmutableListMultimap.builder();
    ImmutableListMultimap.Builder<Place, NetTransition> pre = ImmutableListMultimap.builder();
    for (NetTransition t : transitions) {
      post.put(t.getInput(), t);
      pre.put(t.getOutput(), t);
    }
    postset = post.build();
    preset = pre.build();
  }

  /** The chart this net was built from. */
  public Sfc getSfc() {
    return sfc;
  }

  public ImmutableList<Place> getPlaces() {
    return places.values().asList();
  }

  public ImmutableSet<String> getPlaceNames() {
    return places.keySet();
  }

  public Place getPlace(String pName) throws StepNotFoundException {
    Place place = places.get(pName);
    if (place == null) {
      throw new StepNotFoundException(pName);
    }
    return place;
  }

  public boolean hasPlace(String pName) {
    return places.containsKey(pName);
  }

  public ImmutableList<NetTransition> getTransitions() {
    return transitions;
  }

  public Place getInitialPlace() {
    return initialPlace;
  }

  /** The transitions consuming from the given place, in declaration order. */
  public ImmutableList<NetTransition> getOutgoing(Place pPlace) {
    checkArgument(places.get(pPlace.getName()) == pPlace, "%s is not a place of this net", pPlace);
    return postset.get(pPlace);
  }

  /** The transitions producing into the given place, in declaration order. */
  public ImmutableList<NetTransition> getIncoming(Place pPlace) {
    checkArgument(places.get(pPlace.getName()) == pPlace, "%s is not a place of this net", pPlace);
    return preset.get(pPlace);
  }

  /**
   * The initial marking: a single token on the initial place whose variables are all
   * unconstrained.
   */
  public Token getInitialMarking() {
    return new Token(initialPlace, Valuation.empty());
  }

  @Override
  public String toString() {
    return "PetriNet(places=" + places.keySet() + ", transitions=" + transitions + ")";
  }
}
