// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0
package org.sosy_lab.sfcchecker.cutpoint;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import java.util.Objects;
import java.util.Set;
import org.sosy_lab.sfcchecker.petrinet.Place;

public final class CutPoint {

  private final Place place;
  private final ImmutableSet<CutPointKind> kinds;

  CutPoint(Place pPlace, Set<CutPointKind> pKinds) {
    checkArgument(!pKinds.isEmpty(), "A cut point needs a reason");
    place = checkNotNull(pPlace);
    kinds = Sets.immutableEnumSet(pKinds);
  }

  public Place getPlace() {
    return place;
  }

  public String getStepName() {
    return place.getName();
  }

  public ImmutableSet<CutPointKind> getKinds() {
    return kinds;
  }

  public boolean is(CutPointKind pKind) {
    return kinds.contains(pKind);
  }

  @Override
  public int hashCode() {
    return Objects.hash(place.getName(), kinds);
  }

  @Override
  public boolean equals(Object pObj) {
    if (this == pObj) {
      return true;
    }
    if (!(pObj instanceof CutPoint)) {
      return false;
    }
    CutPoint other = (CutPoint) pObj;
    return place == other.place && kinds.equals(other.kinds);
  }

  @Override
  public String toString() {
    return place.getName() + kinds;
  }
}
