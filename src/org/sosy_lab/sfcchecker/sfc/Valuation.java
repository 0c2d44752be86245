// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0
package org.sosy_lab.sfcchecker.sfc;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableMap;
import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Immutable assignment of concrete values to chart variables. Values are {@link Boolean}, {@link
 * BigInteger} or {@link String}; a variable without value is unconstrained.
 */
public final class Valuation {

  private static final Valuation EMPTY = new Valuation(ImmutableMap.of());

  private final ImmutableMap<String, Object> values;

  private Valuation(ImmutableMap<String, Object> pValues) {
    values = pValues;
  }

  public static Valuation empty() {
    return EMPTY;
  }

  public static Valuation of(Map<String, ?> pValues) {
    ImmutableMap.Builder<String, Object> builder = ImmutableMap.builder();
    for (Map.Entry<String, ?> entry : pValues.entrySet()) {
      builder.put(entry.getKey(), normalize(entry.getValue()));
    }
    return new Valuation(builder.buildOrThrow());
  }

  public Valuation with(String pVariable, Object pValue) {
    Map<String, Object> copy = new LinkedHashMap<>(values);
    copy.put(checkNotNull(pVariable), normalize(pValue));
    return new Valuation(ImmutableMap.copyOf(copy));
  }

  public @Nullable Object get(String pVariable) {
    return values.get(pVariable);
  }

  public boolean isAssigned(String pVariable) {
    return values.containsKey(pVariable);
  }

  public ImmutableMap<String, Object> asMap() {
    return values;
  }

  private static Object normalize(Object pValue) {
    checkNotNull(pValue);
    if (pValue instanceof Integer || pValue instanceof Long || pValue instanceof Short) {
      return BigInteger.valueOf(((Number) pValue).longValue());
    }
    checkArgument(
        pValue instanceof BigInteger || pValue instanceof Boolean || pValue instanceof String,
        "Unsupported value %s of %s",
        pValue,
        pValue.getClass());
    return pValue;
  }

  @Override
  public int hashCode() {
    return values.hashCode();
  }

  @Override
  public boolean equals(Object pObj) {
    return pObj instanceof Valuation && values.equals(((Valuation) pObj).values);
  }

  @Override
  public String toString() {
    return values.toString();
  }
}
