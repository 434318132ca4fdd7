/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.fireflyframework.sage.metric.consistency.expression;

import org.fireflyframework.sage.exception.ConfigurationException;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Recursive-descent parser for row conditions such as
 * {@code age >= 18 and not (`is adult` == False)}.
 *
 * <pre>
 *   expression := or
 *   or         := and (("or" | "|") and)*
 *   and        := not (("and" | "&amp;") not)*
 *   not        := ("not" | "~") not | primary
 *   primary    := "(" expression ")" | operand [comparator operand]
 *   operand    := identifier | `quoted name` | number | 'string' | "string" | True | False
 * </pre>
 *
 * <p>Keywords are case-insensitive. A column reference on its own is read as
 * {@code column == True}. Any syntax error raises {@link ConfigurationException}.</p>
 */
public final class ConditionParser {

    private final String source;
    private final List<Token> tokens;
    private int position;

    private ConditionParser(String source) {
        this.source = source;
        this.tokens = tokenize(source);
    }

    /**
     * Parses an expression.
     *
     * @param expression the expression text
     * @return the condition tree
     * @throws ConfigurationException if the expression is blank or malformed
     */
    public static Condition parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new ConfigurationException("Condition expression must not be empty");
        }
        ConditionParser parser = new ConditionParser(expression);
        Condition condition = parser.parseOr();
        if (parser.peek().type() != TokenType.END) {
            throw parser.error("Unexpected '" + parser.peek().text() + "'");
        }
        return condition;
    }

    private Condition parseOr() {
        Condition left = parseAnd();
        while (peek().type() == TokenType.OR) {
            next();
            left = new Condition.Or(left, parseAnd());
        }
        return left;
    }

    private Condition parseAnd() {
        Condition left = parseNot();
        while (peek().type() == TokenType.AND) {
            next();
            left = new Condition.And(left, parseNot());
        }
        return left;
    }

    private Condition parseNot() {
        if (peek().type() == TokenType.NOT) {
            next();
            return new Condition.Not(parseNot());
        }
        return parsePrimary();
    }

    private Condition parsePrimary() {
        if (peek().type() == TokenType.LPAREN) {
            next();
            Condition inner = parseOr();
            expect(TokenType.RPAREN, "Expected ')'");
            return inner;
        }
        Operand left = parseOperand();
        if (peek().type() == TokenType.COMPARATOR) {
            ComparisonOperator operator = ComparisonOperator.fromSymbol(next().text());
            Operand right = parseOperand();
            return new Condition.Compare(left, operator, right);
        }
        if (left instanceof Operand.ColumnRef) {
            return new Condition.Compare(left, ComparisonOperator.EQUAL, new Operand.Literal(Boolean.TRUE));
        }
        throw error("Expected a comparison after " + left);
    }

    private Operand parseOperand() {
        Token token = next();
        switch (token.type()) {
            case IDENTIFIER:
                return new Operand.ColumnRef(token.text());
            case NUMBER:
                return new Operand.Literal(parseNumber(token.text()));
            case STRING:
                return new Operand.Literal(token.text());
            case BOOLEAN:
                return new Operand.Literal(Boolean.valueOf(token.text()));
            case END:
                throw error("Unexpected end of expression");
            default:
                throw error("Unexpected '" + token.text() + "'");
        }
    }

    private static Number parseNumber(String text) {
        BigDecimal value = new BigDecimal(text);
        if (value.scale() <= 0) {
            try {
                return value.longValueExact();
            } catch (ArithmeticException tooLarge) {
                return value;
            }
        }
        return value;
    }

    private Token peek() {
        return tokens.get(position);
    }

    private Token next() {
        Token token = tokens.get(position);
        if (token.type() != TokenType.END) {
            position++;
        }
        return token;
    }

    private void expect(TokenType type, String message) {
        if (peek().type() != type) {
            throw error(message);
        }
        next();
    }

    private ConfigurationException error(String message) {
        return new ConfigurationException("Invalid condition '" + source + "': " + message);
    }

    private List<Token> tokenize(String text) {
        List<Token> result = new ArrayList<>();
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (c == '(') {
                result.add(new Token(TokenType.LPAREN, "("));
                i++;
            } else if (c == ')') {
                result.add(new Token(TokenType.RPAREN, ")"));
                i++;
            } else if (c == '&') {
                result.add(new Token(TokenType.AND, "&"));
                i++;
            } else if (c == '|') {
                result.add(new Token(TokenType.OR, "|"));
                i++;
            } else if (c == '~') {
                result.add(new Token(TokenType.NOT, "~"));
                i++;
            } else if (c == '<' || c == '>' || c == '=' || c == '!') {
                boolean twoChar = i + 1 < text.length() && text.charAt(i + 1) == '=';
                String symbol = twoChar ? text.substring(i, i + 2) : String.valueOf(c);
                if (symbol.equals("=") || symbol.equals("!")) {
                    throw error("Unsupported operator '" + symbol + "' at position " + i);
                }
                result.add(new Token(TokenType.COMPARATOR, symbol));
                i += symbol.length();
            } else if (c == '\'' || c == '"') {
                int end = text.indexOf(c, i + 1);
                if (end < 0) {
                    throw error("Unterminated string at position " + i);
                }
                result.add(new Token(TokenType.STRING, text.substring(i + 1, end)));
                i = end + 1;
            } else if (c == '`') {
                int end = text.indexOf('`', i + 1);
                if (end < 0 || end == i + 1) {
                    throw error("Unterminated column name at position " + i);
                }
                result.add(new Token(TokenType.IDENTIFIER, text.substring(i + 1, end)));
                i = end + 1;
            } else if (Character.isDigit(c) || isSignedNumber(text, i) || isFraction(text, i)) {
                int start = i++;
                while (i < text.length() && (Character.isDigit(text.charAt(i)) || text.charAt(i) == '.')) {
                    i++;
                }
                String number = text.substring(start, i);
                try {
                    new BigDecimal(number);
                } catch (NumberFormatException e) {
                    throw error("Invalid number '" + number + "'");
                }
                result.add(new Token(TokenType.NUMBER, number));
            } else if (Character.isLetter(c) || c == '_') {
                int start = i;
                while (i < text.length() && (Character.isLetterOrDigit(text.charAt(i)) || text.charAt(i) == '_')) {
                    i++;
                }
                result.add(word(text.substring(start, i)));
            } else {
                throw error("Unexpected character '" + c + "' at position " + i);
            }
        }
        result.add(new Token(TokenType.END, "<end>"));
        return result;
    }

    // a sign is part of a number only where an operand is expected
    private boolean isSignedNumber(String text, int i) {
        if (text.charAt(i) != '-' || i + 1 >= text.length()) {
            return false;
        }
        char following = text.charAt(i + 1);
        return (Character.isDigit(following) || following == '.') && expectsOperand(text, i);
    }

    private static boolean isFraction(String text, int i) {
        return text.charAt(i) == '.' && i + 1 < text.length() && Character.isDigit(text.charAt(i + 1));
    }

    private static boolean expectsOperand(String text, int i) {
        int j = i - 1;
        while (j >= 0 && Character.isWhitespace(text.charAt(j))) {
            j--;
        }
        if (j < 0) {
            return true;
        }
        char previous = text.charAt(j);
        return "(<>=!&|~".indexOf(previous) >= 0 || Character.isLetter(previous) && endsWithKeyword(text, j);
    }

    private static boolean endsWithKeyword(String text, int end) {
        int start = end;
        while (start > 0 && Character.isLetter(text.charAt(start - 1))) {
            start--;
        }
        String word = text.substring(start, end + 1).toLowerCase(Locale.ROOT);
        return word.equals("and") || word.equals("or") || word.equals("not");
    }

    private static Token word(String text) {
        switch (text.toLowerCase(Locale.ROOT)) {
            case "and":
                return new Token(TokenType.AND, text);
            case "or":
                return new Token(TokenType.OR, text);
            case "not":
                return new Token(TokenType.NOT, text);
            case "true":
                return new Token(TokenType.BOOLEAN, "true");
            case "false":
                return new Token(TokenType.BOOLEAN, "false");
            default:
                return new Token(TokenType.IDENTIFIER, text);
        }
    }

    private enum TokenType {
        LPAREN, RPAREN, AND, OR, NOT, COMPARATOR, IDENTIFIER, NUMBER, STRING, BOOLEAN, END
    }

    private record Token(TokenType type, String text) {}
}
