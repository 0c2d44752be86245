// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0
package org.sosy_lab.sfcchecker.cutpoint;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.sosy_lab.sfcchecker.petrinet.Place;

/** Immutable set of cut points of one net, ordered by step declaration order. */
public final class CutPointSet {

  private final ImmutableMap<String, CutPoint> cutPoints;

  CutPointSet(Collection<CutPoint> pCutPoints) {
    List<CutPoint> sorted = new ArrayList<>(pCutPoints);
    sorted.sort(Comparator.comparingInt(c -> c.getPlace().getIndex()));
    ImmutableMap.Builder<String, CutPoint> builder = ImmutableMap.builder();
    for (CutPoint cutPoint : sorted) {
      builder.put(cutPoint.getStepName(), cutPoint);
    }
    cutPoints = builder.buildOrThrow();
  }

  public boolean contains(String pStepName) {
    return cutPoints.containsKey(pStepName);
  }

  public boolean contains(Place pPlace) {
    CutPoint cutPoint = cutPoints.get(pPlace.getName());
    return cutPoint != null && cutPoint.getPlace() == pPlace;
  }

  public Optional<CutPoint> get(String pStepName) {
    return Optional.ofNullable(cutPoints.get(pStepName));
  }

  public ImmutableList<CutPoint> asList() {
    return cutPoints.values().asList();
  }

  public ImmutableSet<String> getStepNames() {
    return cutPoints.keySet();
  }

  public int size() {
    return cutPoints.size();
  }

  /**
   * Returns a set that additionally treats the given places as cut points of kind {@link
   * CutPointKind#ANCHOR}. Places that already are cut points keep their kinds.
   */
  public CutPointSet withAnchors(Collection<Place> pAnchors) {
    Map<String, CutPoint> extended = new LinkedHashMap<>(cutPoints);
    for (Place anchor : pAnchors) {
      if (!extended.containsKey(anchor.getName())) {
        extended.put(anchor.getName(), new CutPoint(anchor, EnumSet.of(CutPointKind.ANCHOR)));
      }
    }
    return extended.size() == cutPoints.size() ? this : new CutPointSet(extended.values());
  }

  @Override
  public int hashCode() {
    return cutPoints.hashCode();
  }

  @Override
  public boolean equals(Object pObj) {
    return pObj instanceof CutPointSet
        && ImmutableList.copyOf(cutPoints.values())
            .equals(ImmutableList.copyOf(((CutPointSet) pObj).cutPoints.values()));
  }

  @Override
  public String toString() {
    return cutPoints.values().toString();
  }
}
