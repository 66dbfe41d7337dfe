package com.purchasingpower.researchflow.util;

/**
 * Recursive-descent evaluator for arithmetic expressions.
 *
 * <pre>
 * expression := term (('+' | '-') term)*
 * term       := unary (('*' | '/' | '%') unary)*
 * unary      := ('+' | '-') unary | power
 * power      := primary (('^' | '**') unary)?
 * primary    := number | '(' expression ')'
 * </pre>
 *
 * Power is right-associative and binds tighter than unary minus, so
 * {@code -2^2} is {@code -4}. Modulo is floored, so the result takes the sign of
 * the divisor ({@code -7 % 3} is {@code 2}). Nothing but numbers and operators is
 * accepted, and signs and parentheses nest at most {@value #MAX_DEPTH} levels deep.
 */
public final class ExpressionEvaluator {

    static final int MAX_DEPTH = 256;

    private final String input;
    private int position;
    private int depth;

    private ExpressionEvaluator(String input) {
        this.input = input;
    }

    /**
     * @throws IllegalArgumentException on a syntax error
     * @throws ArithmeticException      on division by zero or a non-finite result
     */
    public static double evaluate(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("empty expression");
        }
        ExpressionEvaluator evaluator = new ExpressionEvaluator(expression);
        double value = evaluator.parseExpression();
        evaluator.skipWhitespace();
        if (evaluator.position < evaluator.input.length()) {
            throw new IllegalArgumentException(
                    "unexpected '" + evaluator.input.charAt(evaluator.position) + "' at position " + evaluator.position);
        }
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new ArithmeticException("result is not a finite number");
        }
        return value;
    }

    /**
     * Integral values print without a fraction ("42"), others as Java doubles.
     */
    public static String format(double value) {
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }

    private double parseExpression() {
        double value = parseTerm();
        while (true) {
            if (consume('+')) {
                value += parseTerm();
            } else if (consume('-')) {
                value -= parseTerm();
            } else {
                return value;
            }
        }
    }

    private double parseTerm() {
        double value = parseUnary();
        while (true) {
            if (consume('*')) {
                value *= parseUnary();
            } else if (consume('/')) {
                double divisor = parseUnary();
                if (divisor == 0) {
                    throw new ArithmeticException("division by zero");
                }
                value /= divisor;
            } else if (consume('%')) {
                double divisor = parseUnary();
                if (divisor == 0) {
                    throw new ArithmeticException("modulo by zero");
                }
                value = value - divisor * Math.floor(value / divisor);
            } else {
                return value;
            }
        }
    }

    private double parseUnary() {
        if (consume('-')) {
            enter();
            try {
                return -parseUnary();
            } finally {
                depth--;
            }
        }
        if (consume('+')) {
            enter();
            try {
                return parseUnary();
            } finally {
                depth--;
            }
        }
        return parsePower();
    }

    private double parsePower() {
        double base = parsePrimary();
        skipWhitespace();
        if (peekIs("**")) {
            position += 2;
            return Math.pow(base, parseExponent());
        } else if (consume('^')) {
            return Math.pow(base, parseExponent());
        }
        return base;
    }

    private double parseExponent() {
        enter();
        try {
            return parseUnary();
        } finally {
            depth--;
        }
    }

    private double parsePrimary() {
        if (consume('(')) {
            enter();
            try {
                double value = parseExpression();
                if (!consume(')')) {
                    throw new IllegalArgumentException("missing ')' at position " + position);
                }
                return value;
            } finally {
                depth--;
            }
        }

        skipWhitespace();
        int start = position;
        while (position < input.length()
                && (Character.isDigit(input.charAt(position)) || input.charAt(position) == '.')) {
            position++;
        }
        if (start == position) {
            if (position >= input.length()) {
                throw new IllegalArgumentException("unexpected end of expression");
            }
            throw new IllegalArgumentException(
                    "unexpected '" + input.charAt(position) + "' at position " + position);
        }
        String number = input.substring(start, position);
        try {
            return Double.parseDouble(number);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid number '" + number + "'", e);
        }
    }

    private void enter() {
        if (++depth > MAX_DEPTH) {
            throw new IllegalArgumentException("expression nested too deeply at position " + position);
        }
    }

    private boolean consume(char expected) {
        skipWhitespace();
        if (position < input.length() && input.charAt(position) == expected) {
            position++;
            return true;
        }
        return false;
    }

    private boolean peekIs(String token) {
        skipWhitespace();
        return input.startsWith(token, position);
    }

    private void skipWhitespace() {
        while (position < input.length() && Character.isWhitespace(input.charAt(position))) {
            position++;
        }
    }
}
