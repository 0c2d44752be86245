// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0
package org.sosy_lab.sfcchecker.sfc;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Objects;

/** A chart variable together with its (declared or inferred) domain. */
public final class Variable {

  private final String name;
  private final VariableDomain domain;

  public Variable(String pName, VariableDomain pDomain) {
    name = checkNotNull(pName);
    domain = checkNotNull(pDomain);
  }

  public String getName() {
    return name;
  }

  public VariableDomain getDomain() {
    return domain;
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, domain);
  }

  @Override
  public boolean equals(Object pObj) {
    if (this == pObj) {
      return true;
    }

    if (pObj instanceof Variable) {
      Variable other = (Variable) pObj;
      return name.equals(other.name) && domain == other.domain;
    }

    return false;
  }

  @Override
  public String toString() {
    return name + ": " + domain;
  }
}
