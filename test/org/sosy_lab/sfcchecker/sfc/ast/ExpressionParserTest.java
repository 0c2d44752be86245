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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.sosy_lab.sfcchecker.exceptions.ErrorKind;
import org.sosy_lab.sfcchecker.exceptions.ExpressionParseException;
import org.sosy_lab.sfcchecker.sfc.ast.BinaryExpression.BinaryOperator;

@RunWith(JUnit4.class)
public class ExpressionParserTest {

  private static String reprint(String pText) throws ExpressionParseException {
    return ExpressionParser.parseExpression(pText).toString();
  }

  @Test
  public void precedence() throws Exception {
    SfcExpression exp = ExpressionParser.parseExpression("a + b * c");
    assertThat(exp).isInstanceOf(BinaryExpression.class);
    BinaryExpression sum = (BinaryExpression) exp;
    assertThat(sum.getOperator()).isEqualTo(BinaryOperator.PLUS);
    assertThat(sum.getOperand2()).isInstanceOf(BinaryExpression.class);
    assertThat(((BinaryExpression) sum.getOperand2()).getOperator())
        .isEqualTo(BinaryOperator.MULTIPLY);

    assertThat(reprint("x > 1 or y and not z")).isEqualTo("x > 1 or y and not z");
    assertThat(reprint("(x > 1 or y) and not z")).isEqualTo("(x > 1 or y) and not z");
  }

  @Test
  public void printerKeepsRequiredParentheses() throws Exception {
    assertThat(reprint("(a + b) * c")).isEqualTo("(a + b) * c");
    assertThat(reprint("a - (b - c)")).isEqualTo("a - (b - c)");
    assertThat(reprint("(a - b) - c")).isEqualTo("a - b - c");
    assertThat(reprint("((x))")).isEqualTo("x");
    assertThat(reprint("-(a + 1)")).isEqualTo("-(a + 1)");
    assertThat(reprint("not (a and b)")).isEqualTo("not (a and b)");
  }

  @Test
  public void keywordsAreCaseInsensitive() throws Exception {
    assertThat(reprint("TRUE AND x OR Not y")).isEqualTo("True and x or not y");
    assertThat(ExpressionParser.parseExpression("false"))
        .isEqualTo(BooleanLiteralExpression.FALSE);
  }

  @Test
  public void stringLiterals() throws Exception {
    assertThat(ExpressionParser.parseExpression("'on'"))
        .isEqualTo(new StringLiteralExpression("on"));
    assertThat(ExpressionParser.parseExpression("\"a\\\"b\""))
        .isEqualTo(new StringLiteralExpression("a\"b"));
    assertThat(reprint("mode == 'idle'")).isEqualTo("mode == \"idle\"");
  }

  @Test
  public void actions() throws Exception {
    ImmutableList<Assignment> actions = ExpressionParser.parseActions("x := 1; y := x + 2;");
    assertThat(actions).hasSize(2);
    assertThat(actions.get(0).getVariableName()).isEqualTo("x");
    assertThat(actions.get(1).toString()).isEqualTo("y := x + 2");
    assertThat(ExpressionParser.parseActions("")).isEmpty();
    assertThat(ExpressionParser.parseActions("  ; ")).isEmpty();
  }

  @Test
  public void singleEqualsIsRejected() {
    ExpressionParseException e =
        assertThrows(
            ExpressionParseException.class, () -> ExpressionParser.parseExpression("x = 1"));
    assertThat(e.getOffset()).isEqualTo(2);
    assertThat(e.getText()).isEqualTo("x = 1");
    assertThat(e.getKind()).isEqualTo(ErrorKind.EXPRESSION_PARSE_ERROR);
  }

  @Test
  public void malformedExpressions() {
    for (String text : ImmutableList.of("(a + b", "a +", "a b", "'open", "1x", "a # b", "")) {
      assertThrows(ExpressionParseException.class, () -> ExpressionParser.parseExpression(text));
    }
  }

  @Test
  public void malformedActions() {
    for (String text : ImmutableList.of("and := 1", "x := 1 y := 2", "x == 1", "1 := x")) {
      assertThrows(ExpressionParseException.class, () -> ExpressionParser.parseActions(text));
    }
  }

  @Test
  public void substitutionIsSimultaneous() throws Exception {
    SfcExpression exp = ExpressionParser.parseExpression("x + y");
    SfcExpression swapped =
        new SubstitutionVisitor(
                ImmutableMap.of("x", new IdExpression("y"), "y", new IdExpression("x")))
            .substitute(exp);
    assertThat(swapped.toString()).isEqualTo("y + x");
  }

  @Test
  public void variablesInOrderOfOccurrence() throws Exception {
    assertThat(VariableCollector.collect(ExpressionParser.parseExpression("b + a * b > c")))
        .containsExactly("b", "a", "c")
        .inOrder();
  }
}
