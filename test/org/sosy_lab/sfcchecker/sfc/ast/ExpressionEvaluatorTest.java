// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0
package org.sosy_lab.sfcchecker.sfc.ast;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableMap;
import java.math.BigInteger;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.sosy_lab.sfcchecker.exceptions.EvaluationException;

@RunWith(JUnit4.class)
public class ExpressionEvaluatorTest {

  private final ExpressionEvaluator evaluator =
      new ExpressionEvaluator(
          ImmutableMap.of(
              "i", BigInteger.valueOf(3),
              "n", BigInteger.valueOf(5),
              "on", true,
              "mode", "idle"));

  private Object eval(String pText) throws Exception {
    return evaluator.evaluate(ExpressionParser.parseExpression(pText));
  }

  @Test
  public void arithmetic() throws Exception {
    assertThat(eval("i * n - 2")).isEqualTo(BigInteger.valueOf(13));
    assertThat(eval("-i + 1")).isEqualTo(BigInteger.valueOf(-2));
    assertThat(eval("n / i")).isEqualTo(BigInteger.ONE);
  }

  @Test
  public void euclideanDivision() throws Exception {
    assertThat(ExpressionEvaluator.euclideanDivide(BigInteger.valueOf(-7), BigInteger.valueOf(2)))
        .isEqualTo(BigInteger.valueOf(-4));
    assertThat(ExpressionEvaluator.euclideanDivide(BigInteger.valueOf(-7), BigInteger.valueOf(-2)))
        .isEqualTo(BigInteger.valueOf(4));
    assertThat(ExpressionEvaluator.euclideanDivide(BigInteger.valueOf(7), BigInteger.valueOf(-2)))
        .isEqualTo(BigInteger.valueOf(-3));
    assertThat(ExpressionEvaluator.euclideanDivide(BigInteger.valueOf(7), BigInteger.valueOf(2)))
        .isEqualTo(BigInteger.valueOf(3));
  }

  @Test
  public void conditions() throws Exception {
    assertThat(evaluator.evaluateCondition(ExpressionParser.parseExpression("i <= n and on")))
        .isTrue();
    assertThat(evaluator.evaluateCondition(ExpressionParser.parseExpression("i > n or not on")))
        .isFalse();
    assertThat(eval("mode == 'idle'")).isEqualTo(true);
    assertThat(eval("mode != \"idle\"")).isEqualTo(false);
    assertThat(eval("on == False")).isEqualTo(false);
  }

  @Test
  public void shortCircuit() throws Exception {
    // the right operand would fail
    assertThat(eval("False and missing > 1")).isEqualTo(false);
    assertThat(eval("True or missing > 1")).isEqualTo(true);
  }

  @Test
  public void failures() {
    assertThrows(EvaluationException.class, () -> eval("missing + 1"));
    assertThrows(EvaluationException.class, () -> eval("n / (i - 3)"));
    assertThrows(EvaluationException.class, () -> eval("on + 1"));
    assertThrows(EvaluationException.class, () -> eval("i and on"));
  }
}
