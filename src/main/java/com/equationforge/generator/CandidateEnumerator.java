package com.equationforge.generator;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

public final class CandidateEnumerator implements Iterable<String> {

    private final EquationPattern pattern;

    public CandidateEnumerator(EquationPattern pattern) {
        this.pattern = Objects.requireNonNull(pattern, "pattern");
    }

    public EquationPattern pattern() {
        return pattern;
    }

    public long count() {
        return pattern.candidateCount();
    }

    @Override
    public Iterator<String> iterator() {
        return new OdometerIterator(pattern.positions());
    }

    private static final class OdometerIterator implements Iterator<String> {
        private final List<PositionAlphabet> alphabets;
        private final int[] indices;
        private final char[] current;
        private boolean hasNext = true;

        private OdometerIterator(List<PositionAlphabet> alphabets) {
            this.alphabets = alphabets;
            this.indices = new int[alphabets.size()];
            this.current = new char[alphabets.size()];
            for (int i = 0; i < alphabets.size(); i++) {
                PositionAlphabet alphabet = alphabets.get(i);
                if (alphabet.size() == 0) {
                    hasNext = false;
                    return;
                }
                current[i] = alphabet.symbolAt(0);
            }
        }

        @Override
        public boolean hasNext() {
            return hasNext;
        }

        @Override
        public String next() {
            if (!hasNext) {
                throw new NoSuchElementException();
            }
            String candidate = new String(current);
            advance();
            return candidate;
        }

        private void advance() {
            for (int position = indices.length - 1; position >= 0; position--) {
                PositionAlphabet alphabet = alphabets.get(position);
                int next = indices[position] + 1;
                if (next < alphabet.size()) {
                    indices[position] = next;
                    current[position] = alphabet.symbolAt(next);
                    return;
                }
                indices[position] = 0;
                current[position] = alphabet.symbolAt(0);
            }
            hasNext = false;
        }
    }
}
