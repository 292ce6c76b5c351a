package com.equationforge.generator;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Builds the position alphabets for every admissible equal-sign placement of a mode.
 * <p>
 * The result side holds between one and {@code elementCount / 2 - 1} characters, the
 * expression side takes the rest. Patterns are ordered by increasing expression length.
 */
public final class PatternGenerator {

    static final int MIN_EXPRESSION_LENGTH = 3;

    private static final ConcurrentMap<GameMode, List<EquationPattern>> CACHE = new ConcurrentHashMap<>();

    private PatternGenerator() {
    }

    public static List<EquationPattern> patternsFor(GameMode mode) {
        Objects.requireNonNull(mode, "mode");
        return CACHE.computeIfAbsent(mode, PatternGenerator::buildPatterns);
    }

    private static List<EquationPattern> buildPatterns(GameMode mode) {
        List<EquationPattern> patterns = new ArrayList<>();
        for (List<PositionAlphabet> layout : layouts(mode.elementCount())) {
            patterns.add(new EquationPattern(mode, layout));
        }
        return List.copyOf(patterns);
    }

    static List<List<PositionAlphabet>> layouts(int elementCount) {
        List<List<PositionAlphabet>> layouts = new ArrayList<>();
        for (int resultLength = elementCount / 2 - 1; resultLength >= 1; resultLength--) {
            int expressionLength = elementCount - 1 - resultLength;
            if (expressionLength < MIN_EXPRESSION_LENGTH) {
                continue;
            }
            layouts.add(layout(expressionLength, resultLength));
        }
        if (layouts.isEmpty()) {
            throw new IllegalStateException("Element count " + elementCount + " admits no equal sign position");
        }
        return layouts;
    }

    private static List<PositionAlphabet> layout(int expressionLength, int resultLength) {
        List<PositionAlphabet> positions = new ArrayList<>(expressionLength + 1 + resultLength);
        positions.add(PositionAlphabet.nonZeroDigits());
        for (int i = 1; i < expressionLength - 1; i++) {
            positions.add(PositionAlphabet.digitsAndOperators());
        }
        positions.add(PositionAlphabet.digits());
        positions.add(PositionAlphabet.equalsSign());
        if (resultLength == 1) {
            positions.add(PositionAlphabet.digits());
        } else {
            positions.add(PositionAlphabet.nonZeroDigits());
            for (int i = 1; i < resultLength; i++) {
                positions.add(PositionAlphabet.digits());
            }
        }
        return positions;
    }
}
