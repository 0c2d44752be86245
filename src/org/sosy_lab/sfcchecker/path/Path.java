// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0
package org.sosy_lab.sfcchecker.path;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.FluentIterable;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.sosy_lab.sfcchecker.petrinet.NetTransition;
import org.sosy_lab.sfcchecker.petrinet.Place;
import org.sosy_lab.sfcchecker.sfc.ast.IdExpression;
import org.sosy_lab.sfcchecker.sfc.ast.SfcExpression;

/**
 * A transition sequence between two consecutive cut points together with its symbolic effect.
 *
 * <p>Guard and update are expressed over the values the variables have when the token arrives at
 * the source cut point, that is after the entry actions of the source step. The initialization
 * path has no transitions: its source and target are the initial step and its update are the
 * initial step's entry actions applied to the input values.
 */
public final class Path {

  private final Place source;
  private final Place target;
  private final ImmutableList<NetTransition> transitions;
  private final SfcExpression guard;
  private final ImmutableMap<String, SfcExpression> update;
  private final Reachability reachability;

  Path(
      Place pSource,
      Place pTarget,
      ImmutableList<NetTransition> pTransitions,
      SfcExpression pGuard,
      ImmutableMap<String, SfcExpression> pUpdate,
      Reachability pReachability) {
    source = checkNotNull(pSource);
    target = checkNotNull(pTarget);
    transitions = checkNotNull(pTransitions);
    guard = checkNotNull(pGuard);
    update = checkNotNull(pUpdate);
    reachability = checkNotNull(pReachability);
  }

  Path withReachability(Reachability pReachability) {
    return new Path(source, target, transitions, guard, update, pReachability);
  }

  public Place getSource() {
    return source;
  }

  public String getSourceName() {
    return source.getName();
  }

  public Place getTarget() {
    return target;
  }

  public String getTargetName() {
    return target.getName();
  }

  public ImmutableList<NetTransition> getTransitions() {
    return transitions;
  }

  public ImmutableList<String> getTransitionNames() {
    return FluentIterable.from(transitions).transform(NetTransition::getName).toList();
  }

  /** Conjunction of the transition guards, each evaluated in the state reached before it. */
  public SfcExpression getGuard() {
    return guard;
  }

  /** Final value of every variable the path changes, in terms of the entry values. */
  public ImmutableMap<String, SfcExpression> getUpdate() {
    return update;
  }

  /** Final value of the variable, which is its entry value if the path does not change it. */
  public SfcExpression getFinalValue(String pVariable) {
    SfcExpression value = update.get(pVariable);
    return value != null ? value : new IdExpression(pVariable);
  }

  public Reachability getReachability() {
    return reachability;
  }

  public boolean isUnreachable() {
    return reachability == Reachability.UNREACHABLE;
  }

  public boolean isInitialization() {
    return transitions.isEmpty();
  }

  @Override
  public String toString() {
    if (isInitialization()) {
      return "init " + source.getName();
    }
    return source.getName() + " -> " + target.getName() + " via " + getTransitionNames();
  }
}
