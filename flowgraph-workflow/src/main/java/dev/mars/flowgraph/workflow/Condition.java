/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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

package dev.mars.flowgraph.workflow;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Boolean expression over the shared variables of a run, used to guard edges and drive loops.
 * <p>
 * Supported forms: {@code score > 5}, {@code status == 'done'}, {@code tags contains urgent},
 * {@code name matches '^A.*'}, {@code status in ['done', 'skipped']}, {@code review exists}, {@code !approved}, combined with
 * {@code &&}/{@code and}, {@code ||}/{@code or}, {@code !}/{@code not} and parentheses.
 * Dotted paths walk into nested maps. A condition is parsed once; its source text is both its
 * serialized form and its identity.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class Condition {

    private final String expression;
    private final Expr root;

    private Condition(String expression, Expr root) {
        this.expression = expression;
        this.root = root;
    }

    /**
     * Parses an expression.
     *
     * @throws ConditionSyntaxException if the expression is blank or malformed
     */
    public static Condition parse(String expression) throws ConditionSyntaxException {
        if (expression == null || expression.trim().isEmpty()) {
            throw new ConditionSyntaxException("Condition expression cannot be empty");
        }
        String source = expression.trim();
        Parser parser = new Parser(source, tokenize(source));
        Expr root = parser.parseExpression();
        parser.expectEnd();
        return new Condition(source, root);
    }

    public String getExpression() {
        return expression;
    }

    public boolean evaluate(Map<String, Object> variables) {
        return root.test(variables != null ? variables : Map.of());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Condition that = (Condition) o;
        return expression.equals(that.expression);
    }

    @Override
    public int hashCode() {
        return expression.hashCode();
    }

    @Override
    public String toString() {
        return expression;
    }

    // ========== Evaluation ==========

    private interface Expr {
        boolean test(Map<String, Object> variables);
    }

    private enum Operator {
        EQ("=="), NE("!="), GT(">"), LT("<"), GE(">="), LE("<="),
        CONTAINS("contains"), NOT_CONTAINS("not_contains"), MATCHES("matches"), IN("in");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        static Operator fromSymbol(String symbol) {
            for (Operator operator : values()) {
                if (operator.symbol.equals(symbol)) {
                    return operator;
                }
            }
            return null;
        }
    }

    private static final class Comparison implements Expr {
        private final String path;
        private final Operator operator;
        private final Object expected;
        private final Pattern pattern;

        Comparison(String path, Operator operator, Object expected, Pattern pattern) {
            this.path = path;
            this.operator = operator;
            this.expected = expected;
            this.pattern = pattern;
        }

        @Override
        public boolean test(Map<String, Object> variables) {
            Object actual = VariableResolver.lookup(variables, path);
            if (expected == null && (operator == Operator.EQ || operator == Operator.NE)) {
                return (actual == null) == (operator == Operator.EQ);
            }
            if (actual == null) {
                return operator == Operator.NE;
            }
            switch (operator) {
                case EQ:
                    return looseEquals(actual, expected);
                case NE:
                    return !looseEquals(actual, expected);
                case GT:
                    return compare(actual, expected) > 0;
                case LT:
                    return compare(actual, expected) < 0;
                case GE:
                    return compare(actual, expected) >= 0;
                case LE:
                    return compare(actual, expected) <= 0;
                case CONTAINS:
                    return contains(actual, expected);
                case NOT_CONTAINS:
                    return !contains(actual, expected);
                case MATCHES:
                    return pattern.matcher(String.valueOf(actual)).find();
                case IN:
                    return contains(expected, actual);
                default:
                    throw new IllegalStateException("Unhandled operator: " + operator);
            }
        }
    }

    private static boolean looseEquals(Object actual, Object expected) {
        Double left = toNumber(actual);
        Double right = toNumber(expected);
        if (left != null && right != null) {
            return Double.compare(left, right) == 0;
        }
        return String.valueOf(actual).equals(String.valueOf(expected));
    }

    private static int compare(Object actual, Object expected) {
        Double left = toNumber(actual);
        Double right = toNumber(expected);
        if (left != null && right != null) {
            return Double.compare(left, right);
        }
        return String.valueOf(actual).compareTo(String.valueOf(expected));
    }

    private static boolean contains(Object actual, Object expected) {
        if (actual instanceof Collection) {
            for (Object item : (Collection<?>) actual) {
                if (item != null && looseEquals(item, expected)) {
                    return true;
                }
            }
            return false;
        }
        if (actual instanceof Map) {
            return ((Map<?, ?>) actual).containsKey(String.valueOf(expected));
        }
        return String.valueOf(actual).contains(String.valueOf(expected));
    }

    private static Double toNumber(Object value) {
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof String) {
            String text = ((String) value).trim();
            if (text.matches("-?\\d+(\\.\\d+)?")) {
                return Double.parseDouble(text);
            }
        }
        return null;
    }

    static boolean isTruthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue() != 0.0;
        }
        if (value instanceof String) {
            return !((String) value).isEmpty();
        }
        if (value instanceof Collection) {
            return !((Collection<?>) value).isEmpty();
        }
        if (value instanceof Map) {
            return !((Map<?, ?>) value).isEmpty();
        }
        return true;
    }

    // ========== Tokenizer ==========

    private enum TokenType {
        LPAREN, RPAREN, LBRACKET, RBRACKET, COMMA, OR, AND, NOT, OPERATOR, STRING, NUMBER, WORD, END
    }

    private static final class Token {
        final TokenType type;
        final String text;
        final int position;

        Token(TokenType type, String text, int position) {
            this.type = type;
            this.text = text;
            this.position = position;
        }
    }

    private static List<Token> tokenize(String source) {
        List<Token> tokens = new ArrayList<>();
        int i = 0;
        while (i < source.length()) {
            char c = source.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (c == '(') {
                tokens.add(new Token(TokenType.LPAREN, "(", i++));
            } else if (c == ')') {
                tokens.add(new Token(TokenType.RPAREN, ")", i++));
            } else if (c == '[') {
                tokens.add(new Token(TokenType.LBRACKET, "[", i++));
            } else if (c == ']') {
                tokens.add(new Token(TokenType.RBRACKET, "]", i++));
            } else if (c == ',') {
                tokens.add(new Token(TokenType.COMMA, ",", i++));
            } else if (source.startsWith("||", i)) {
                tokens.add(new Token(TokenType.OR, "||", i));
                i += 2;
            } else if (source.startsWith("&&", i)) {
                tokens.add(new Token(TokenType.AND, "&&", i));
                i += 2;
            } else if (source.startsWith("==", i) || source.startsWith("!=", i)
                    || source.startsWith(">=", i) || source.startsWith("<=", i)) {
                tokens.add(new Token(TokenType.OPERATOR, source.substring(i, i + 2), i));
                i += 2;
            } else if (c == '>' || c == '<') {
                tokens.add(new Token(TokenType.OPERATOR, String.valueOf(c), i++));
            } else if (c == '!') {
                tokens.add(new Token(TokenType.NOT, "!", i++));
            } else if (c == '\'' || c == '"') {
                int start = i++;
                StringBuilder text = new StringBuilder();
                while (i < source.length() && source.charAt(i) != c) {
                    if (source.charAt(i) == '\\' && i + 1 < source.length()) {
                        i++;
                    }
                    text.append(source.charAt(i++));
                }
                if (i >= source.length()) {
                    throw new ConditionSyntaxException("Unterminated string starting at position " + start + " in: " + source);
                }
                i++;
                tokens.add(new Token(TokenType.STRING, text.toString(), start));
            } else if (Character.isDigit(c) || (c == '-' && i + 1 < source.length() && Character.isDigit(source.charAt(i + 1)))) {
                int start = i++;
                while (i < source.length() && (Character.isDigit(source.charAt(i)) || source.charAt(i) == '.')) {
                    i++;
                }
                tokens.add(new Token(TokenType.NUMBER, source.substring(start, i), start));
            } else if (Character.isLetter(c) || c == '_') {
                int start = i++;
                while (i < source.length() && isWordPart(source.charAt(i))) {
                    i++;
                }
                String word = source.substring(start, i);
                tokens.add(new Token(keywordType(word), word, start));
            } else {
                throw new ConditionSyntaxException("Unexpected character '" + c + "' at position " + i + " in: " + source);
            }
        }
        tokens.add(new Token(TokenType.END, "", source.length()));
        return tokens;
    }

    private static boolean isWordPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '.' || c == '-';
    }

    private static TokenType keywordType(String word) {
        switch (word) {
            case "or":
                return TokenType.OR;
            case "and":
                return TokenType.AND;
            case "not":
                return TokenType.NOT;
            case "contains":
            case "not_contains":
            case "matches":
            case "in":
                return TokenType.OPERATOR;
            default:
                return TokenType.WORD;
        }
    }

    // ========== Parser ==========

    private static final class Parser {
        private final String source;
        private final List<Token> tokens;
        private int index;

        Parser(String source, List<Token> tokens) {
            this.source = source;
            this.tokens = tokens;
        }

        Expr parseExpression() {
            Expr left = parseAnd();
            while (peek().type == TokenType.OR) {
                next();
                Expr lhs = left;
                Expr rhs = parseAnd();
                left = variables -> lhs.test(variables) || rhs.test(variables);
            }
            return left;
        }

        private Expr parseAnd() {
            Expr left = parseUnary();
            while (peek().type == TokenType.AND) {
                next();
                Expr lhs = left;
                Expr rhs = parseUnary();
                left = variables -> lhs.test(variables) && rhs.test(variables);
            }
            return left;
        }

        private Expr parseUnary() {
            if (peek().type == TokenType.NOT) {
                next();
                Expr operand = parseUnary();
                return variables -> !operand.test(variables);
            }
            return parsePrimary();
        }

        private Expr parsePrimary() {
            Token token = next();
            if (token.type == TokenType.LPAREN) {
                Expr inner = parseExpression();
                Token closing = next();
                if (closing.type != TokenType.RPAREN) {
                    throw error("Expected ')'", closing);
                }
                return inner;
            }
            if (token.type != TokenType.WORD) {
                throw error("Expected a variable name", token);
            }

            Token following = peek();
            if (following.type == TokenType.OPERATOR) {
                next();
                Operator operator = Operator.fromSymbol(following.text);
                Object expected = operator == Operator.IN ? parseList() : parseLiteral();
                Pattern pattern = null;
                if (operator == Operator.MATCHES) {
                    try {
                        pattern = Pattern.compile(String.valueOf(expected));
                    } catch (PatternSyntaxException e) {
                        throw new ConditionSyntaxException("Invalid pattern '" + expected + "' in: " + source, e);
                    }
                }
                return new Comparison(token.text, operator, expected, pattern);
            }
            if (following.type == TokenType.WORD && ("exists".equals(following.text) || "not_exists".equals(following.text))) {
                next();
                boolean shouldExist = "exists".equals(following.text);
                String path = token.text;
                return variables -> (VariableResolver.lookup(variables, path) != null) == shouldExist;
            }
            if ("true".equals(token.text) || "false".equals(token.text)) {
                boolean constant = Boolean.parseBoolean(token.text);
                return variables -> constant;
            }
            String path = token.text;
            return variables -> isTruthy(VariableResolver.lookup(variables, path));
        }

        private Object parseLiteral() {
            Token token = next();
            switch (token.type) {
                case STRING:
                    return token.text;
                case NUMBER:
                    try {
                        if (token.text.contains(".")) {
                            return Double.parseDouble(token.text);
                        }
                        return Long.parseLong(token.text);
                    } catch (NumberFormatException e) {
                        throw error("Malformed number '" + token.text + "'", token);
                    }
                case WORD:
                    if ("true".equals(token.text) || "false".equals(token.text)) {
                        return Boolean.parseBoolean(token.text);
                    }
                    if ("null".equals(token.text)) {
                        return null;
                    }
                    return token.text;
                default:
                    throw error("Expected a value", token);
            }
        }

        private List<Object> parseList() {
            Token opening = next();
            if (opening.type != TokenType.LBRACKET) {
                throw error("Expected '[' after 'in'", opening);
            }
            List<Object> items = new ArrayList<>();
            if (peek().type == TokenType.RBRACKET) {
                next();
                return items;
            }
            while (true) {
                items.add(parseLiteral());
                Token separator = next();
                if (separator.type == TokenType.RBRACKET) {
                    return items;
                }
                if (separator.type != TokenType.COMMA) {
                    throw error("Expected ',' or ']'", separator);
                }
            }
        }

        void expectEnd() {
            Token token = peek();
            if (token.type != TokenType.END) {
                throw error("Unexpected '" + token.text + "'", token);
            }
        }

        private Token peek() {
            return tokens.get(index);
        }

        private Token next() {
            Token token = tokens.get(index);
            if (token.type != TokenType.END) {
                index++;
            }
            return token;
        }

        private ConditionSyntaxException error(String message, Token token) {
            String where = token.type == TokenType.END ? "end of expression" : "position " + token.position;
            return new ConditionSyntaxException(message + " at " + where + " in: " + source);
        }
    }

    /**
     * Thrown when a condition expression cannot be parsed.
     */
    public static class ConditionSyntaxException extends IllegalArgumentException {
        public ConditionSyntaxException(String message) {
            super(message);
        }

        public ConditionSyntaxException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
