package com.equationforge.generator;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;
import java.util.regex.Pattern;

/**
 * Evaluates the left-hand side of a candidate equation.
 * <p>
 * Multiplication and division bind tighter than addition and subtraction and are
 * applied left to right with exact fractions. Only the final sum has to be a whole
 * number, so {@code 8/10*5} evaluates to 4.
 */
public final class ExpressionEvaluator {

    private static final Pattern ILLEGAL_CHARACTER = Pattern.compile("[^0-9+\\-*/]");
    private static final Pattern ADJACENT_OPERATORS = Pattern.compile("[+\\-*/]{2}");
    private static final Pattern LEADING_ZERO = Pattern.compile("^0");
    // Any operand after the first starting with 0: a bare zero or a zero-padded number.
    private static final Pattern ZERO_OPERAND = Pattern.compile("[^0-9]0");
    private static final Pattern DANGLING_OPERATOR = Pattern.compile("^[+\\-*/]|[+\\-*/]$");

    private ExpressionEvaluator() {
    }

    public static OptionalLong evaluate(String expression) {
        if (!isWellFormed(expression)) {
            return OptionalLong.empty();
        }
        try {
            return reduce(tokenize(expression));
        } catch (ArithmeticException ex) {
            return OptionalLong.empty();
        }
    }

    static boolean isWellFormed(String expression) {
        if (expression == null || expression.isEmpty()) {
            return false;
        }
        return !ILLEGAL_CHARACTER.matcher(expression).find()
                && !ADJACENT_OPERATORS.matcher(expression).find()
                && !LEADING_ZERO.matcher(expression).find()
                && !ZERO_OPERAND.matcher(expression).find()
                && !DANGLING_OPERATOR.matcher(expression).find();
    }

    // Folds each + or - into the sign of the number that follows it.
    static List<Token> tokenize(String expression) {
        List<Token> tokens = new ArrayList<>();
        long sign = 1;
        int i = 0;
        while (i < expression.length()) {
            char ch = expression.charAt(i);
            if (Character.isDigit(ch)) {
                long value = 0;
                while (i < expression.length() && Character.isDigit(expression.charAt(i))) {
                    value = Math.addExact(Math.multiplyExact(value, 10), expression.charAt(i) - '0');
                    i++;
                }
                tokens.add(Token.number(sign * value));
                sign = 1;
                continue;
            }
            switch (ch) {
                case '+' -> sign = 1;
                case '-' -> sign = -1;
                case '*' -> tokens.add(Token.multiply());
                case '/' -> tokens.add(Token.divide());
                default -> throw new IllegalArgumentException("Unexpected character '" + ch + "' in expression");
            }
            i++;
        }
        return List.copyOf(tokens);
    }

    private static OptionalLong reduce(List<Token> tokens) {
        Rational sum = Rational.ZERO;
        Rational term = null;
        Token pending = null;
        for (Token token : tokens) {
            if (!token.isNumber()) {
                pending = token;
                continue;
            }
            if (pending == null) {
                if (term != null) {
                    sum = sum.add(term);
                }
                term = Rational.of(token.value());
            } else if (pending.type() == Token.Type.MULTIPLY) {
                term = term.multiply(token.value());
                pending = null;
            } else {
                if (token.value() == 0) {
                    return OptionalLong.empty();
                }
                term = term.divide(token.value());
                pending = null;
            }
        }
        if (term == null || pending != null) {
            return OptionalLong.empty();
        }
        sum = sum.add(term);
        return sum.isWhole() ? OptionalLong.of(sum.numerator()) : OptionalLong.empty();
    }
}
