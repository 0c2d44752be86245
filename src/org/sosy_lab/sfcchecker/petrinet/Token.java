// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0
package org.sosy_lab.sfcchecker.petrinet;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Objects;
import org.sosy_lab.sfcchecker.sfc.Valuation;

/** A token of the data-augmented net: a control position plus a variable valuation. */
public final class Token {

  private final Place place;
  private final Valuation valuation;

  public Token(Place pPlace, Valuation pValuation) {
    place = checkNotNull(pPlace);
    valuation = checkNotNull(pValuation);
  }

  public Place getPlace() {
    return place;
  }

  public Valuation getValuation() {
    return valuation;
  }

  @Override
  public int hashCode() {
    return Objects.hash(place.getName(), valuation);
  }

  @Override
  public boolean equals(Object pObj) {
    if (this == pObj) {
      return true;
    }
    if (!(pObj instanceof Token)) {
      return false;
    }
    Token other = (Token) pObj;
    return place == other.place && valuation.equals(other.valuation);
  }

  @Override
  public String toString() {
    return place.getName() + valuation;
  }
}
