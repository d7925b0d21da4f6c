package org.csu.qlang.engine;

import org.csu.qlang.common.exception.ParameterEvaluationException;

import java.util.OptionalDouble;

/**
 * 参数表达式求值器。
 * 负责计算旋转门参数中的受限算术表达式, 文法:
 * <pre>
 * expr    := term (('+' | '-') term)*
 * term    := unary (('*' | '/') unary)*
 * unary   := ('+' | '-') unary | primary
 * primary := NUMBER | 'π' | 'pi' | '(' expr ')'
 * </pre>
 */
public class ParameterEvaluator {

    // 括号最大嵌套层数
    private static final int MAX_NESTING_DEPTH = 256;

    private final String expression;
    private int position = 0;
    private int depth = 0;

    private ParameterEvaluator(String expression) {
        this.expression = expression;
    }

    /**
     * @return 表达式的值
     * @throws ParameterEvaluationException 语法错误、除零或结果不是有限数
     */
    public static double evaluate(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new ParameterEvaluationException(String.valueOf(expression), "empty expression");
        }
        ParameterEvaluator evaluator = new ParameterEvaluator(expression);
        double value = evaluator.parseExpression();
        evaluator.skipWhitespace();
        if (!evaluator.isAtEnd()) {
            throw evaluator.error("unexpected '" + evaluator.peek() + "'");
        }
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new ParameterEvaluationException(expression, "result is not a finite number");
        }
        return value;
    }

    /**
     * 不抛异常的版本, 无法求值时返回空。
     */
    public static OptionalDouble tryEvaluate(String expression) {
        try {
            return OptionalDouble.of(evaluate(expression));
        } catch (ParameterEvaluationException e) {
            return OptionalDouble.empty();
        }
    }

    private double parseExpression() {
        double left = parseTerm();
        while (true) {
            skipWhitespace();
            if (match('+')) {
                left = left + parseTerm();
            } else if (match('-')) {
                left = left - parseTerm();
            } else {
                return left;
            }
        }
    }

    private double parseTerm() {
        double left = parseUnary();
        while (true) {
            skipWhitespace();
            if (match('*')) {
                left = left * parseUnary();
            } else if (match('/')) {
                double right = parseUnary();
                if (right == 0.0) {
                    throw error("division by zero");
                }
                left = left / right;
            } else {
                return left;
            }
        }
    }

    // 连续的正负号逐个折叠, 不递归
    private double parseUnary() {
        boolean negate = false;
        while (true) {
            skipWhitespace();
            if (match('-')) {
                negate = !negate;
            } else if (!match('+')) {
                break;
            }
        }
        double value = parsePrimary();
        return negate ? -value : value;
    }

    private double parsePrimary() {
        skipWhitespace();
        if (isAtEnd()) {
            throw error("unexpected end of expression");
        }
        char ch = peek();
        if (ch == '(') {
            if (++depth > MAX_NESTING_DEPTH) {
                throw error("expression nested too deeply");
            }
            position++;
            double value = parseExpression();
            skipWhitespace();
            if (!match(')')) {
                throw error("missing ')'");
            }
            depth--;
            return value;
        }
        if (ch == 'π') {
            position++;
            return Math.PI;
        }
        if (expression.startsWith("pi", position)) {
            position += 2;
            return Math.PI;
        }
        if (Character.isDigit(ch) || ch == '.') {
            return readNumber();
        }
        throw error("unexpected '" + ch + "'");
    }

    private double readNumber() {
        int start = position;
        while (!isAtEnd() && Character.isDigit(peek())) {
            position++;
        }
        if (!isAtEnd() && peek() == '.') {
            position++;
            while (!isAtEnd() && Character.isDigit(peek())) {
                position++;
            }
        }
        // 科学计数法, e.g., 1.5e-3
        if (!isAtEnd() && (peek() == 'e' || peek() == 'E')) {
            int mark = position;
            position++;
            if (!isAtEnd() && (peek() == '+' || peek() == '-')) {
                position++;
            }
            if (isAtEnd() || !Character.isDigit(peek())) {
                position = mark;
            } else {
                while (!isAtEnd() && Character.isDigit(peek())) {
                    position++;
                }
            }
        }
        String literal = expression.substring(start, position);
        try {
            return Double.parseDouble(literal);
        } catch (NumberFormatException e) {
            throw error("malformed number '" + literal + "'");
        }
    }

    private boolean match(char expected) {
        if (!isAtEnd() && peek() == expected) {
            position++;
            return true;
        }
        return false;
    }

    private void skipWhitespace() {
        while (!isAtEnd() && Character.isWhitespace(peek())) {
            position++;
        }
    }

    private boolean isAtEnd() {
        return position >= expression.length();
    }

    private char peek() {
        return expression.charAt(position);
    }

    private ParameterEvaluationException error(String reason) {
        return new ParameterEvaluationException(expression, reason);
    }
}
