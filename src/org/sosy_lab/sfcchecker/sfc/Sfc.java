// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0
package org.sosy_lab.sfcchecker.sfc;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Ascii;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.sfcchecker.exceptions.ExpressionParseException;
import org.sosy_lab.sfcchecker.exceptions.StepNotFoundException;
import org.sosy_lab.sfcchecker.exceptions.ValidationException;
import org.sosy_lab.sfcchecker.sfc.ast.Assignment;
import org.sosy_lab.sfcchecker.sfc.ast.BooleanLiteralExpression;
import org.sosy_lab.sfcchecker.sfc.ast.ExpressionParser;
import org.sosy_lab.sfcchecker.sfc.ast.SfcExpression;
import org.sosy_lab.sfcchecker.sfc.ast.VariableCollector;

/**
 * A validated, immutable sequential function chart: steps with entry actions, guarded transitions
 * between them, the declared variables and the initial step.
 *
 * <p>Instances are created with {@link #builder()}; all structural checks happen once in {@link
 * Builder#build()}.
 */
public final class Sfc {

  private final ImmutableMap<String, Step> steps;
  private final ImmutableList<SfcTransition> transitions;
  private final ImmutableMap<String, Variable> variables;
  private final Step initialStep;
  private final ImmutableListMultimap<Step, SfcTransition> outgoing;
  private final ImmutableListMultimap<Step, SfcTransition> incoming;

  private Sfc(
      ImmutableMap<String, Step> pSteps,
      ImmutableList<SfcTransition> pTransitions,
      ImmutableMap<String, Variable> pVariables,
      Step pInitialStep) {
    steps = pSteps;
    transitions = pTransitions;
    variables = pVariables;
    initialStep = pInitialStep;

    ImmutableListMultimap.Builder<Step, SfcTransition> out = ImmutableListMultimap.builder();
    ImmutableListMultimap.Builder<Step, SfcTransition> in = ImmutableListMultimap.builder();
    for (SfcTransition transition : transitions) {
      out.put(transition.getSource(), transition);
      in.put(transition.getTarget(), transition);
    }
    outgoing = out.build();
    incoming = in.build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /** All steps in declaration order. */
  public ImmutableList<Step> getSteps() {
    return steps.values().asList();
  }

  public ImmutableSet<String> getStepNames() {
    return steps.keySet();
  }

  public ImmutableList<SfcTransition> getTransitions() {
    return transitions;
  }

  public ImmutableMap<String, Variable> getVariables() {
    return variables;
  }

  public Step getInitialStep() {
    return initialStep;
  }

  public Step lookup(String pName) throws StepNotFoundException {
    Step step = steps.get(pName);
    if (step == null) {
      throw new StepNotFoundException(pName);
    }
    return step;
  }

  public Optional<Step> findStep(String pName) {
    return Optional.ofNullable(steps.get(pName));
  }

  /**
   * The transitions leaving the given step in declaration order. The order is only relevant for
   * presentation: all transitions whose guard holds are enabled at the same time.
   */
  public ImmutableList<SfcTransition> successors(Step pStep) {
    return outgoing.get(pStep);
  }

  public ImmutableList<SfcTransition> predecessors(Step pStep) {
    return incoming.get(pStep);
  }

  @Override
  public String toString() {
    return "SFC(initial="
        + initialStep
        + ", steps="
        + steps.keySet()
        + ", transitions="
        + transitions
        + ")";
  }

  /**
   * Collects the raw chart records as produced by a chart reader. Guards and actions are given as
   * text and parsed in {@link #build()}.
   */
  public static final class Builder {

    private static final ImmutableSet<String> RESERVED_WORDS =
        ImmutableSet.of("and", "or", "not", "true", "false");

    private final List<String[]> stepRecords = new ArrayList<>();
    private final List<String[]> transitionRecords = new ArrayList<>();
    private final List<String> variableNames = new ArrayList<>();
    private final Map<String, VariableDomain> declaredDomains = new LinkedHashMap<>();
    private @Nullable String initialStepName = null;

    private Builder() {}

    /** Adds a step whose entry actions are given as {@code ;}-separated assignments. */
    public Builder addStep(String pName, String pActions) {
      stepRecords.add(new String[] {checkNotNull(pName), Strings.nullToEmpty(pActions)});
      return this;
    }

    public Builder addStep(String pName) {
      return addStep(pName, "");
    }

    /** Adds a transition; an empty guard stands for {@code True}. */
    public Builder addTransition(String pSource, String pTarget, String pGuard) {
      transitionRecords.add(
          new String[] {checkNotNull(pSource), checkNotNull(pTarget), Strings.nullToEmpty(pGuard)});
      return this;
    }

    /** Declares a variable whose domain is inferred from its uses. */
    public Builder addVariable(String pName) {
      variableNames.add(checkNotNull(pName));
      return this;
    }

    public Builder addVariable(String pName, VariableDomain pDomain) {
      variableNames.add(checkNotNull(pName));
      declaredDomains.put(pName, checkNotNull(pDomain));
      return this;
    }

    public Builder addVariables(Iterable<String> pNames) {
      for (String name : pNames) {
        addVariable(name);
      }
      return this;
    }

    public Builder setInitialStep(String pName) {
      initialStepName = checkNotNull(pName);
      return this;
    }

    /**
     * Validates the records and creates the chart.
     *
     * @throws ValidationException if a step name is duplicated, a transition references an unknown
     *     step, the initial step is missing, a variable is undeclared, declared twice or used
     *     inconsistently, or a step is unreachable from the initial step.
     * @throws ExpressionParseException if a guard or action is outside the supported grammar.
     */
    public Sfc build() throws ValidationException, ExpressionParseException {
      Map<String, @Nullable VariableDomain> declared = declareVariables();

      // steps.
      Map<String, Step> steps = new LinkedHashMap<>();
      List<Assignment> allAssignments = new ArrayList<>();
      for (String[] record : stepRecords) {
        String name = record[0];
        if (steps.containsKey(name)) {
          throw new ValidationException("Duplicate step name " + name);
        }
        ImmutableList<Assignment> actions = ExpressionParser.parseActions(record[1]);
        for (Assignment action : actions) {
          checkDeclared(VariableCollector.collect(action), declared, "action of step " + name);
        }
        allAssignments.addAll(actions);
        steps.put(name, new Step(name, steps.size(), record[1], actions));
      }

      if (initialStepName == null) {
        throw new ValidationException("No initial step given");
      }
      Step initial = steps.get(initialStepName);
      if (initial == null) {
        throw new ValidationException("Initial step " + initialStepName + " is not a step");
      }

      // transitions.
      ImmutableList.Builder<SfcTransition> transitions = ImmutableList.builder();
      List<SfcExpression> guards = new ArrayList<>();
      int index = 0;
      for (String[] record : transitionRecords) {
        Step source = steps.get(record[0]);
        Step target = steps.get(record[1]);
        if (source == null || target == null) {
          throw new ValidationException(
              String.format(
                  "Transition %s -> %s references unknown step %s",
                  record[0], record[1], source == null ? record[0] : record[1]));
        }
        SfcExpression guard =
            record[2].trim().isEmpty()
                ? BooleanLiteralExpression.TRUE
                : ExpressionParser.parseExpression(record[2]);
        checkDeclared(
            VariableCollector.collect(guard),
            declared,
            "guard of transition " + record[0] + " -> " + record[1]);
        guards.add(guard);
        transitions.add(new SfcTransition(index++, source, target, record[2], guard));
      }

      ImmutableMap<String, VariableDomain> domains =
          new DomainInference(declared).infer(guards, allAssignments);
      ImmutableMap.Builder<String, Variable> variables = ImmutableMap.builder();
      for (String name : variableNames) {
        variables.put(name, new Variable(name, domains.get(name)));
      }

      Sfc sfc =
          new Sfc(
              ImmutableMap.copyOf(steps), transitions.build(), variables.buildOrThrow(), initial);
      checkReachability(sfc);
      return sfc;
    }

    private Map<String, @Nullable VariableDomain> declareVariables() throws ValidationException {
      Map<String, @Nullable VariableDomain> declared = new LinkedHashMap<>();
      for (String name : variableNames) {
        if (declared.containsKey(name)) {
          throw new ValidationException("Variable " + name + " is declared twice");
        }
        if (!name.matches("[A-Za-z_][A-Za-z0-9_]*")
            || RESERVED_WORDS.contains(Ascii.toLowerCase(name))) {
          throw new ValidationException("Invalid variable name '" + name + "'");
        }
        declared.put(name, declaredDomains.get(name));
      }
      return declared;
    }

    private static void checkDeclared(
        Set<String> pUsed, Map<String, @Nullable VariableDomain> pDeclared, String pLocation)
        throws ValidationException {
      for (String variable : pUsed) {
        if (!pDeclared.containsKey(variable)) {
          throw new ValidationException(
              "Undeclared variable " + variable + " in " + pLocation);
        }
      }
    }

    private static void checkReachability(Sfc pSfc) throws ValidationException {
      Set<Step> reached = new HashSet<>();
      Queue<Step> waitlist = new ArrayDeque<>();
      reached.add(pSfc.initialStep);
      waitlist.add(pSfc.initialStep);
      while (!waitlist.isEmpty()) {
        Step step = waitlist.remove();
        for (SfcTransition transition : pSfc.successors(step)) {
          if (reached.add(transition.getTarget())) {
            waitlist.add(transition.getTarget());
          }
        }
      }
      if (reached.size() != pSfc.steps.size()) {
        List<String> unreachable = new ArrayList<>();
        for (Step step : pSfc.steps.values()) {
          if (!reached.contains(step)) {
            unreachable.add(step.getName());
          }
        }
        throw new ValidationException(
            "Steps " + unreachable + " are not reachable from initial step " + pSfc.initialStep);
      }
    }
  }
}
