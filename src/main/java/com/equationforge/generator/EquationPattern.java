package com.equationforge.generator;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

public final class EquationPattern {

    private final GameMode mode;
    private final List<PositionAlphabet> positions;
    private final int equalsIndex;

    public EquationPattern(GameMode mode, List<PositionAlphabet> positions) {
        this.mode = Objects.requireNonNull(mode, "mode");
        this.positions = List.copyOf(Objects.requireNonNull(positions, "positions"));
        if (this.positions.size() != mode.elementCount()) {
            throw new IllegalArgumentException("Pattern for " + mode + " must have " + mode.elementCount()
                    + " positions but has " + this.positions.size());
        }
        int found = -1;
        for (int i = 0; i < this.positions.size(); i++) {
            if (this.positions.get(i).isEqualsSign()) {
                if (found >= 0) {
                    throw new IllegalArgumentException("Pattern has more than one equal sign position");
                }
                found = i;
            }
        }
        if (found < 0) {
            throw new IllegalArgumentException("Pattern has no equal sign position");
        }
        this.equalsIndex = found;
    }

    public GameMode mode() {
        return mode;
    }

    public List<PositionAlphabet> positions() {
        return positions;
    }

    public int length() {
        return positions.size();
    }

    public int equalsIndex() {
        return equalsIndex;
    }

    public int expressionLength() {
        return equalsIndex;
    }

    public int resultLength() {
        return positions.size() - equalsIndex - 1;
    }

    public long candidateCount() {
        long count = 1;
        for (PositionAlphabet alphabet : positions) {
            count = Math.multiplyExact(count, alphabet.size());
        }
        return count;
    }

    public EquationPattern withFirstSymbol(char symbol) {
        PositionAlphabet first = positions.get(0);
        if (!first.contains(symbol)) {
            throw new IllegalArgumentException("Symbol '" + symbol + "' is not allowed at position 1 of " + label());
        }
        List<PositionAlphabet> narrowed = new ArrayList<>(positions);
        narrowed.set(0, PositionAlphabet.single(symbol));
        return new EquationPattern(mode, narrowed);
    }

    public String label() {
        return positions.stream().map(PositionAlphabet::toString).collect(Collectors.joining());
    }

    @Override
    public String toString() {
        return label();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof EquationPattern other)) {
            return false;
        }
        return mode == other.mode && positions.equals(other.positions);
    }

    @Override
    public int hashCode() {
        return 31 * mode.hashCode() + positions.hashCode();
    }
}
