package com.equationforge.generator;

import java.util.Objects;
import java.util.OptionalLong;

/**
 * Accepts candidates whose expression and result evaluate to the same whole number.
 * <p>
 * Not thread safe: each worker owns its own filter and merges {@link #tally()} at the end.
 */
public final class EquationFilter {

    private final EquationSink sink;
    private long accepted;
    private long examined;

    private String lastExpression;
    private OptionalLong lastValue = OptionalLong.empty();

    public EquationFilter(EquationSink sink) {
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    public boolean test(String candidate) {
        examined++;
        int split = candidate == null ? -1 : candidate.indexOf(PositionAlphabet.EQUALS);
        if (split < 0) {
            return false;
        }
        String expression = candidate.substring(0, split);
        String result = candidate.substring(split + 1);

        OptionalLong left = evaluateCached(expression);
        if (left.isEmpty()) {
            return false;
        }
        OptionalLong right = ResultValidator.parseResult(result);
        if (right.isEmpty() || left.getAsLong() != right.getAsLong()) {
            return false;
        }
        accepted++;
        sink.accept(candidate);
        return true;
    }

    public long accepted() {
        return accepted;
    }

    public long examined() {
        return examined;
    }

    public Tally tally() {
        return new Tally(accepted, examined);
    }

    // Candidates arrive with the result side varying fastest, so the expression repeats.
    private OptionalLong evaluateCached(String expression) {
        if (!expression.equals(lastExpression)) {
            lastExpression = expression;
            lastValue = ExpressionEvaluator.evaluate(expression);
        }
        return lastValue;
    }

    public record Tally(long accepted, long examined) {

        public static final Tally EMPTY = new Tally(0, 0);

        public Tally {
            if (accepted < 0 || examined < 0 || accepted > examined) {
                throw new IllegalArgumentException("Invalid tally " + accepted + "/" + examined);
            }
        }

        public Tally plus(Tally other) {
            return new Tally(accepted + other.accepted, examined + other.examined);
        }
    }
}
