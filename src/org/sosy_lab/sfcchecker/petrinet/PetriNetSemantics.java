// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0
package org.sosy_lab.sfcchecker.petrinet;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.sosy_lab.sfcchecker.exceptions.EvaluationException;
import org.sosy_lab.sfcchecker.sfc.Valuation;
import org.sosy_lab.sfcchecker.sfc.ast.Assignment;
import org.sosy_lab.sfcchecker.sfc.ast.ExpressionEvaluator;

/**
 * Concrete firing semantics of a {@link PetriNet}. A transition is enabled for a token on its
 * input place if its guard holds for the token's valuation; firing consumes the token, executes
 * the entry actions of the output place on the consumed valuation and produces a token on the
 * output place.
 */
public class PetriNetSemantics {

  private final PetriNet net;

  public PetriNetSemantics(PetriNet pNet) {
    net = checkNotNull(pNet);
  }

  /** Puts a token with the given inputs on the initial place and executes its entry actions. */
  public Token enterInitialPlace(Valuation pInputs) throws EvaluationException {
    Place initial = net.getInitialPlace();
    return new Token(initial, execute(initial.getEntryActions(), pInputs));
  }

  public boolean isEnabled(NetTransition pTransition, Token pToken) throws EvaluationException {
    if (pTransition.getInput() != pToken.getPlace()) {
      return false;
    }
    return new ExpressionEvaluator(pToken.getValuation().asMap())
        .evaluateCondition(pTransition.getGuard());
  }

  /** All transitions enabled for the token, in declaration order. */
  public ImmutableList<NetTransition> getEnabled(Token pToken) throws EvaluationException {
    ImmutableList.Builder<NetTransition> enabled = ImmutableList.builder();
    for (NetTransition transition : net.getOutgoing(pToken.getPlace())) {
      if (isEnabled(transition, pToken)) {
        enabled.add(transition);
      }
    }
    return enabled.build();
  }

  public Token fire(NetTransition pTransition, Token pToken) throws EvaluationException {
    checkArgument(
        isEnabled(pTransition, pToken), "%s is not enabled for %s", pTransition, pToken);
    return new Token(
        pTransition.getOutput(), execute(pTransition.getEffect(), pToken.getValuation()));
  }

  /**
   * Runs the net from the initial place, always firing the first enabled transition in
   * declaration order, until no transition is enabled or the bound is reached.
   *
   * @return The sequence of visited tokens, starting with the initial one.
   */
  public List<Token> simulate(Valuation pInputs, int pMaxFirings) throws EvaluationException {
    List<Token> trace = new ArrayList<>();
    Token current = enterInitialPlace(pInputs);
    trace.add(current);
    for (int i = 0; i < pMaxFirings; i++) {
      ImmutableList<NetTransition> enabled = getEnabled(current);
      if (enabled.isEmpty()) {
        break;
      }
      current = fire(enabled.get(0), current);
      trace.add(current);
    }
    return trace;
  }

  /** Executes the actions in order; later actions see the effect of earlier ones. */
  public static Valuation execute(List<Assignment> pActions, Valuation pValuation)
      throws EvaluationException {
    Valuation result = pValuation;
    for (Assignment action : pActions) {
      Map<String, Object> current = result.asMap();
      Object value = new ExpressionEvaluator(current).evaluate(action.getRightHandSide());
      result = result.with(action.getVariableName(), value);
    }
    return result;
  }
}
