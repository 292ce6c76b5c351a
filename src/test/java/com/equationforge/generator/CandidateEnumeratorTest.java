package com.equationforge.generator;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import org.junit.jupiter.api.Test;

class CandidateEnumeratorTest {

    @Test
    void producesEveryCandidateOfEachMiniPattern() {
        for (EquationPattern pattern : PatternGenerator.patternsFor(GameMode.MINI)) {
            CandidateEnumerator enumerator = new CandidateEnumerator(pattern);
            long produced = 0;
            for (String candidate : enumerator) {
                assertEquals(6, candidate.length());
                assertEquals('=', candidate.charAt(pattern.equalsIndex()));
                produced++;
            }
            assertEquals(enumerator.count(), produced);
        }
    }

    @Test
    void leftmostPositionVariesSlowest() {
        EquationPattern pattern = PatternGenerator.patternsFor(GameMode.MINI).get(1);
        Iterator<String> iterator = new CandidateEnumerator(pattern).iterator();
        assertEquals("1000=0", iterator.next());
        assertEquals("1000=1", iterator.next());
        for (int i = 0; i < 8; i++) {
            iterator.next();
        }
        assertEquals("1001=0", iterator.next());
    }

    @Test
    void lastCandidateUsesLastSymbols() {
        EquationPattern pattern = PatternGenerator.patternsFor(GameMode.MINI).get(0);
        String last = null;
        for (String candidate : new CandidateEnumerator(pattern)) {
            last = candidate;
        }
        assertEquals("9/9=99", last);
    }

    @Test
    void iterationRestarts() {
        EquationPattern pattern = PatternGenerator.patternsFor(GameMode.MINI).get(0).withFirstSymbol('3');
        CandidateEnumerator enumerator = new CandidateEnumerator(pattern);
        List<String> first = new ArrayList<>();
        enumerator.forEach(first::add);
        List<String> second = new ArrayList<>();
        enumerator.forEach(second::add);
        assertEquals(first, second);
        assertEquals(enumerator.count(), first.size());
    }

    @Test
    void exhaustedIteratorThrows() {
        EquationPattern pattern = new EquationPattern(GameMode.MINI, List.of(
                PositionAlphabet.single('1'),
                PositionAlphabet.single('+'),
                PositionAlphabet.single('1'),
                PositionAlphabet.equalsSign(),
                PositionAlphabet.single('0'),
                PositionAlphabet.single('2')));
        Iterator<String> iterator = new CandidateEnumerator(pattern).iterator();
        assertEquals("1+1=02", iterator.next());
        assertFalse(iterator.hasNext());
        assertThrows(NoSuchElementException.class, iterator::next);
    }
}
