// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2022 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0
package org.sosy_lab.sfcchecker.sfc.ast;

import com.google.common.base.Ascii;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.sfcchecker.exceptions.ExpressionParseException;
import org.sosy_lab.sfcchecker.sfc.ast.BinaryExpression.BinaryOperator;
import org.sosy_lab.sfcchecker.sfc.ast.UnaryExpression.UnaryOperator;

/**
 * Recursive-descent parser for the guard and action grammar shared with the chart readers.
 *
 * <pre>
 * actions    := [ assignment { ';' assignment } [ ';' ] ]
 * assignment := IDENT ':=' expr
 * expr       := and { 'or' and }
 * and        := unary { 'and' unary }
 * unary      := 'not' unary | comparison
 * comparison := sum { ('==' | '!=' | '<' | '<=' | '>' | '>=') sum }
 * sum        := product { ('+' | '-') product }
 * product    := sign { ('*' | '/') sign }
 * sign       := '-' sign | atom
 * atom       := INT | STRING | 'True' | 'False' | IDENT | '(' expr ')'
 * </pre>
 *
 * Keywords are case-insensitive. All binary operators associate to the left.
 */
public final class ExpressionParser {

  private enum TokenKind {
    IDENTIFIER,
    INTEGER,
    STRING,
    OPERATOR,
    END
  }

  private static final class Token {
    private final TokenKind kind;
    private final String text;
    private final int offset;

    private Token(TokenKind pKind, String pText, int pOffset) {
      kind = pKind;
      text = pText;
      offset = pOffset;
    }

    private boolean is(String pOperator) {
      return kind == TokenKind.OPERATOR && text.equals(pOperator);
    }

    private boolean isKeyword(String pKeyword) {
      return kind == TokenKind.IDENTIFIER && Ascii.equalsIgnoreCase(text, pKeyword);
    }

    @Override
    public String toString() {
      return kind == TokenKind.END ? "end of input" : "'" + text + "'";
    }
  }

  private static final ImmutableList<String> OPERATORS =
      ImmutableList.of(
          ":=", "==", "!=", "<=", ">=", "<", ">", "+", "-", "*", "/", "(", ")", ";");

  private static final ImmutableMap<String, BinaryOperator> COMPARISONS =
      ImmutableMap.<String, BinaryOperator>builder()
          .put("==", BinaryOperator.EQUALS)
          .put("!=", BinaryOperator.NOT_EQUALS)
          .put("<", BinaryOperator.LESS_THAN)
          .put("<=", BinaryOperator.LESS_EQUAL)
          .put(">", BinaryOperator.GREATER_THAN)
          .put(">=", BinaryOperator.GREATER_EQUAL)
          .buildOrThrow();

  private static final ImmutableList<String> KEYWORDS =
      ImmutableList.of("and", "or", "not", "true", "false");

  private final String text;
  private final List<Token> tokens;
  private int pos = 0;

  private ExpressionParser(String pText) throws ExpressionParseException {
    text = pText;
    tokens = tokenize(pText);
  }

  /** Parses a guard or a right-hand side; the complete text has to be a single expression. */
  public static SfcExpression parseExpression(String pText) throws ExpressionParseException {
    ExpressionParser parser = new ExpressionParser(pText);
    SfcExpression result = parser.parseOr();
    parser.expectEnd();
    return result;
  }

  /** Parses a possibly empty list of {@code ;}-separated assignments. */
  public static ImmutableList<Assignment> parseActions(String pText)
      throws ExpressionParseException {
    ExpressionParser parser = new ExpressionParser(pText);
    ImmutableList.Builder<Assignment> actions = ImmutableList.builder();
    while (parser.peek().kind != TokenKind.END) {
      if (parser.peek().is(";")) {
        // empty statement
        parser.next();
        continue;
      }
      actions.add(parser.parseAssignment());
      if (parser.peek().kind != TokenKind.END) {
        parser.expect(";");
      }
    }
    return actions.build();
  }

  private Assignment parseAssignment() throws ExpressionParseException {
    Token target = next();
    if (target.kind != TokenKind.IDENTIFIER || isKeyword(target)) {
      throw error(target, "Expected variable name but found " + target);
    }
    expect(":=");
    return new Assignment(new IdExpression(target.text), parseOr());
  }

  private SfcExpression parseOr() throws ExpressionParseException {
    SfcExpression result = parseAnd();
    while (peek().isKeyword("or")) {
      next();
      result = new BinaryExpression(result, parseAnd(), BinaryOperator.OR);
    }
    return result;
  }

  private SfcExpression parseAnd() throws ExpressionParseException {
    SfcExpression result = parseNot();
    while (peek().isKeyword("and")) {
      next();
      result = new BinaryExpression(result, parseNot(), BinaryOperator.AND);
    }
    return result;
  }

  private SfcExpression parseNot() throws ExpressionParseException {
    if (peek().isKeyword("not")) {
      next();
      return new UnaryExpression(parseNot(), UnaryOperator.NOT);
    }
    return parseComparison();
  }

  private SfcExpression parseComparison() throws ExpressionParseException {
    SfcExpression result = parseSum();
    while (peek().kind == TokenKind.OPERATOR && COMPARISONS.containsKey(peek().text)) {
      BinaryOperator op = COMPARISONS.get(next().text);
      result = new BinaryExpression(result, parseSum(), op);
    }
    return result;
  }

  private SfcExpression parseSum() throws ExpressionParseException {
    SfcExpression result = parseProduct();
    while (peek().is("+") || peek().is("-")) {
      BinaryOperator op = next().is("+") ? BinaryOperator.PLUS : BinaryOperator.MINUS;
      result = new BinaryExpression(result, parseProduct(), op);
    }
    return result;
  }

  private SfcExpression parseProduct() throws ExpressionParseException {
    SfcExpression result = parseSign();
    while (peek().is("*") || peek().is("/")) {
      BinaryOperator op = next().is("*") ? BinaryOperator.MULTIPLY : BinaryOperator.DIVIDE;
      result = new BinaryExpression(result, parseSign(), op);
    }
    return result;
  }

  private SfcExpression parseSign() throws ExpressionParseException {
    if (peek().is("-")) {
      next();
      return new UnaryExpression(parseSign(), UnaryOperator.MINUS);
    }
    return parseAtom();
  }

  private SfcExpression parseAtom() throws ExpressionParseException {
    Token token = next();
    switch (token.kind) {
      case INTEGER:
        return new IntegerLiteralExpression(new BigInteger(token.text));
      case STRING:
        return new StringLiteralExpression(token.text);
      case IDENTIFIER:
        if (token.isKeyword("true")) {
          return BooleanLiteralExpression.TRUE;
        } else if (token.isKeyword("false")) {
          return BooleanLiteralExpression.FALSE;
        } else if (isKeyword(token)) {
          throw error(token, "Unexpected keyword " + token);
        }
        return new IdExpression(token.text);
      case OPERATOR:
        if (token.is("(")) {
          SfcExpression inner = parseOr();
          expect(")");
          return inner;
        }
        throw error(token, "Unexpected " + token);
      default:
        throw error(token, "Unexpected end of input");
    }
  }

  private Token peek() {
    return tokens.get(pos);
  }

  private Token next() {
    Token token = tokens.get(pos);
    if (token.kind != TokenKind.END) {
      pos++;
    }
    return token;
  }

  private void expect(String pOperator) throws ExpressionParseException {
    Token token = next();
    if (!token.is(pOperator)) {
      throw error(token, "Expected '" + pOperator + "' but found " + token);
    }
  }

  private void expectEnd() throws ExpressionParseException {
    Token token = peek();
    if (token.kind != TokenKind.END) {
      throw error(token, "Unexpected " + token);
    }
  }

  private ExpressionParseException error(Token pToken, String pReason) {
    return new ExpressionParseException(text, pToken.offset, pReason);
  }

  private static boolean isKeyword(Token pToken) {
    return KEYWORDS.contains(Ascii.toLowerCase(pToken.text));
  }

  private static List<Token> tokenize(String pText) throws ExpressionParseException {
    List<Token> result = new ArrayList<>();
    int i = 0;
    final int length = pText.length();
    while (i < length) {
      char c = pText.charAt(i);
      if (Character.isWhitespace(c)) {
        i++;
      } else if (Character.isLetter(c) || c == '_') {
        int start = i;
        while (i < length
            && (Character.isLetterOrDigit(pText.charAt(i)) || pText.charAt(i) == '_')) {
          i++;
        }
        result.add(new Token(TokenKind.IDENTIFIER, pText.substring(start, i), start));
      } else if (Character.isDigit(c)) {
        int start = i;
        while (i < length && Character.isDigit(pText.charAt(i))) {
          i++;
        }
        if (i < length && (Character.isLetter(pText.charAt(i)) || pText.charAt(i) == '_')) {
          throw new ExpressionParseException(pText, i, "Malformed number");
        }
        result.add(new Token(TokenKind.INTEGER, pText.substring(start, i), start));
      } else if (c == '"' || c == '\'') {
        i = readString(pText, i, result);
      } else {
        String op = matchOperator(pText, i);
        if (op == null) {
          throw new ExpressionParseException(pText, i, "Unsupported character '" + c + "'");
        }
        result.add(new Token(TokenKind.OPERATOR, op, i));
        i += op.length();
      }
    }
    result.add(new Token(TokenKind.END, "", length));
    return result;
  }

  private static int readString(String pText, int pStart, List<Token> pTokens)
      throws ExpressionParseException {
    char quote = pText.charAt(pStart);
    StringBuilder value = new StringBuilder();
    int i = pStart + 1;
    while (i < pText.length()) {
      char c = pText.charAt(i);
      if (c == quote) {
        pTokens.add(new Token(TokenKind.STRING, value.toString(), pStart));
        return i + 1;
      } else if (c == '\\' && i + 1 < pText.length()) {
        value.append(pText.charAt(i + 1));
        i += 2;
      } else {
        value.append(c);
        i++;
      }
    }
    throw new ExpressionParseException(pText, pStart, "Unterminated string literal");
  }

  private static @Nullable String matchOperator(String pText, int pIndex) {
    for (String op : OPERATORS) {
      if (pText.startsWith(op, pIndex)) {
        return op;
      }
    }
    return null;
  }
}
