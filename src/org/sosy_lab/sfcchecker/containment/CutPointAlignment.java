// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0
package org.sosy_lab.sfcchecker.containment;

import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.sosy_lab.sfcchecker.cutpoint.CutPoint;
import org.sosy_lab.sfcchecker.cutpoint.CutPointSet;
import org.sosy_lab.sfcchecker.exceptions.MappingException;
import org.sosy_lab.sfcchecker.exceptions.StepNotFoundException;
import org.sosy_lab.sfcchecker.petrinet.PetriNet;
import org.sosy_lab.sfcchecker.petrinet.Place;

/**
 * Correspondence between the steps of an original chart and its revision, together with the
 * cut point sets both charts are segmented at.
 *
 * <p>A step of the original is mapped by an explicit mapping entry, otherwise to the step of the
 * revision with the same name. The original is segmented at its cut points and at every step
 * whose image is a cut point of the revision; the revision is segmented at its cut points and at
 * the images of all segment boundaries of the original.
 */
public final class CutPointAlignment {

  private final ImmutableMap<String, String> stepMap;
  private final CutPointSet cutPoints1;
  private final CutPointSet cutPoints2;

  private CutPointAlignment(
      ImmutableMap<String, String> pStepMap, CutPointSet pCutPoints1, CutPointSet pCutPoints2) {
    stepMap = pStepMap;
    cutPoints1 = pCutPoints1;
    cutPoints2 = pCutPoints2;
  }

  static CutPointAlignment align(
      PetriNet pNet1,
      CutPointSet pCutPoints1,
      PetriNet pNet2,
      CutPointSet pCutPoints2,
      Map<String, String> pMapping)
      throws MappingException {
    for (Map.Entry<String, String> entry : pMapping.entrySet()) {
      if (!pNet1.hasPlace(entry.getKey())) {
        throw new MappingException(
            "Mapping names step " + entry.getKey() + " that does not exist in the original chart");
      }
      if (!pNet2.hasPlace(entry.getValue())) {
        throw new MappingException(
            "Mapping names step " + entry.getValue() + " that does not exist in the revision");
      }
    }

    ImmutableMap.Builder<String, String> stepMap = ImmutableMap.builder();
    for (Place place : pNet1.getPlaces()) {
      String image = pMapping.getOrDefault(place.getName(), place.getName());
      if (pNet2.hasPlace(image)) {
        stepMap.put(place.getName(), image);
      }
    }
    ImmutableMap<String, String> map = stepMap.buildOrThrow();

    for (CutPoint cutPoint : pCutPoints1.asList()) {
      if (!map.containsKey(cutPoint.getStepName())) {
        throw new MappingException(
            "Cut point "
                + cutPoint.getStepName()
                + " of the original chart has no counterpart in the revision");
      }
    }

    try {
      List<Place> anchors1 = new ArrayList<>();
      for (Map.Entry<String, String> entry : map.entrySet()) {
        if (pCutPoints2.contains(entry.getValue())) {
          anchors1.add(pNet1.getPlace(entry.getKey()));
        }
      }
      CutPointSet cutPoints1 = pCutPoints1.withAnchors(anchors1);

      List<Place> anchors2 = new ArrayList<>();
      for (CutPoint cutPoint : cutPoints1.asList()) {
        anchors2.add(pNet2.getPlace(map.get(cutPoint.getStepName())));
      }
      CutPointSet cutPoints2 = pCutPoints2.withAnchors(anchors2);
      return new CutPointAlignment(map, cutPoints1, cutPoints2);
    } catch (StepNotFoundException e) {
      throw new AssertionError("Aligned step vanished", e);
    }
  }

  /** The step of the revision the given step of the original corresponds to. */
  public Optional<String> getImage(String pStep1) {
    return Optional.ofNullable(stepMap.get(pStep1));
  }

  /** All steps of the original that have a counterpart, with that counterpart. */
  public ImmutableMap<String, String> asMap() {
    return stepMap;
  }

  /** Segment boundaries of the original chart. */
  public CutPointSet getCutPoints1() {
    return cutPoints1;
  }

  /** Segment boundaries of the revision. */
  public CutPointSet getCutPoints2() {
    return cutPoints2;
  }

  @Override
  public String toString() {
    return "CutPointAlignment("
        + cutPoints1.getStepNames()
        + " -> "
        + cutPoints2.getStepNames()
        + ")";
  }
}
