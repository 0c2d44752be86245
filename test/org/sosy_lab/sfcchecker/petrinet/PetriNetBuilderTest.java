// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0
package org.sosy_lab.sfcchecker.petrinet;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.math.BigInteger;
import java.util.List;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.sosy_lab.common.log.LogManager;
import org.sosy_lab.sfcchecker.SfcExamples;
import org.sosy_lab.sfcchecker.exceptions.StepNotFoundException;
import org.sosy_lab.sfcchecker.sfc.Sfc;
import org.sosy_lab.sfcchecker.sfc.SfcTransition;
import org.sosy_lab.sfcchecker.sfc.Valuation;

@RunWith(JUnit4.class)
public class PetriNetBuilderTest {

  private Sfc sfc;
  private PetriNet net;

  @Before
  public void setUp() throws Exception {
    sfc = SfcExamples.factorial();
    net = new PetriNetBuilder(LogManager.createTestLogManager()).build(sfc);
  }

  @Test
  public void placesAreSteps() {
    assertThat(net.getPlaceNames()).containsExactlyElementsIn(sfc.getStepNames()).inOrder();
    assertThat(net.getInitialPlace().getName()).isEqualTo("Start");
    assertThat(net.getSfc()).isSameInstanceAs(sfc);
  }

  @Test
  public void transitionsAreChartTransitions() {
    ImmutableList.Builder<List<String>> expected = ImmutableList.builder();
    for (SfcTransition t : sfc.getTransitions()) {
      expected.add(
          ImmutableList.of(
              t.getSource().getName(), t.getTarget().getName(), t.getGuard().toString()));
    }
    ImmutableList.Builder<List<String>> actual = ImmutableList.builder();
    for (NetTransition t : net.getTransitions()) {
      actual.add(
          ImmutableList.of(
              t.getInput().getName(), t.getOutput().getName(), t.getGuard().toString()));
    }
    assertThat(actual.build()).containsExactlyElementsIn(expected.build()).inOrder();
  }

  @Test
  public void effectIsTargetEntryActions() throws Exception {
    NetTransition toMultiply = net.getOutgoing(net.getPlace("Check")).get(0);
    assertThat(toMultiply.getOutput().getName()).isEqualTo("Multiply");
    assertThat(toMultiply.getEffect()).isEqualTo(sfc.lookup("Multiply").getActions());
    assertThat(net.getIncoming(net.getPlace("Check"))).hasSize(2);
    assertThrows(StepNotFoundException.class, () -> net.getPlace("Nowhere"));
  }

  @Test
  public void initialMarking() {
    Token token = net.getInitialMarking();
    assertThat(token.getPlace()).isSameInstanceAs(net.getInitialPlace());
    assertThat(token.getValuation().asMap()).isEmpty();
  }

  @Test
  public void simulateFactorial() throws Exception {
    PetriNetSemantics semantics = new PetriNetSemantics(net);
    List<Token> trace =
        semantics.simulate(Valuation.of(ImmutableMap.of("init", true, "n", 3)), 100);

    Token last = trace.get(trace.size() - 1);
    assertThat(last.getPlace().getName()).isEqualTo("End");
    assertThat(last.getValuation().get("fact")).isEqualTo(BigInteger.valueOf(6));
    assertThat(last.getValuation().get("i")).isEqualTo(BigInteger.valueOf(4));
    // initial token plus one firing into Check, three loop iterations and the exit
    assertThat(trace).hasSize(1 + 1 + 3 * 3 + 1);
  }

  @Test
  public void disabledGuardStopsSimulation() throws Exception {
    PetriNetSemantics semantics = new PetriNetSemantics(net);
    List<Token> trace =
        semantics.simulate(Valuation.of(ImmutableMap.of("init", false, "n", 3)), 100);
    assertThat(trace).hasSize(1);
    assertThat(semantics.getEnabled(trace.get(0))).isEmpty();
  }

  @Test
  public void fireRequiresEnabledTransition() throws Exception {
    PetriNetSemantics semantics = new PetriNetSemantics(net);
    Token start = semantics.enterInitialPlace(Valuation.of(ImmutableMap.of("init", false)));
    NetTransition first = net.getOutgoing(start.getPlace()).get(0);
    assertThat(semantics.isEnabled(first, start)).isFalse();
    assertThrows(IllegalArgumentException.class, () -> semantics.fire(first, start));
  }
}
