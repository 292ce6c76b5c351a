package com.equationforge.generator;

import static org.junit.jupiter.api.Assertions.*;

import java.util.OptionalLong;
import org.junit.jupiter.api.Test;

class ResultValidatorTest {

    @Test
    void rejectsZeroPaddedResults() {
        assertTrue(ResultValidator.parseResult("05").isEmpty());
        assertTrue(ResultValidator.parseResult("006").isEmpty());
    }

    @Test
    void acceptsPlainNumbers() {
        assertEquals(OptionalLong.of(0), ResultValidator.parseResult("0"));
        assertEquals(OptionalLong.of(500), ResultValidator.parseResult("500"));
        assertEquals(OptionalLong.of(7), ResultValidator.parseResult("7"));
    }

    @Test
    void rejectsNonNumericResults() {
        assertTrue(ResultValidator.parseResult("").isEmpty());
        assertTrue(ResultValidator.parseResult(null).isEmpty());
        assertTrue(ResultValidator.parseResult("1+2").isEmpty());
        assertTrue(ResultValidator.parseResult("-4").isEmpty());
    }
}
