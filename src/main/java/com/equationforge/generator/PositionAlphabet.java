package com.equationforge.generator;

import java.util.Arrays;

public final class PositionAlphabet {

    public static final String OPERATORS = "+-*/";
    public static final char EQUALS = '=';

    private static final PositionAlphabet DIGITS = new PositionAlphabet("0-9", "0123456789");
    private static final PositionAlphabet NON_ZERO_DIGITS = new PositionAlphabet("1-9", "123456789");
    private static final PositionAlphabet DIGITS_AND_OPERATORS = new PositionAlphabet("0-9" + OPERATORS, "0123456789" + OPERATORS);
    private static final PositionAlphabet EQUALS_SIGN = new PositionAlphabet("=", String.valueOf(EQUALS));

    private final String label;
    private final char[] symbols;

    private PositionAlphabet(String label, String symbols) {
        this.label = label;
        this.symbols = symbols.toCharArray();
    }

    public static PositionAlphabet digits() {
        return DIGITS;
    }

    public static PositionAlphabet nonZeroDigits() {
        return NON_ZERO_DIGITS;
    }

    public static PositionAlphabet digitsAndOperators() {
        return DIGITS_AND_OPERATORS;
    }

    public static PositionAlphabet equalsSign() {
        return EQUALS_SIGN;
    }

    public static PositionAlphabet single(char symbol) {
        return new PositionAlphabet(String.valueOf(symbol), String.valueOf(symbol));
    }

    public int size() {
        return symbols.length;
    }

    public char symbolAt(int index) {
        return symbols[index];
    }

    public boolean contains(char ch) {
        for (char symbol : symbols) {
            if (symbol == ch) {
                return true;
            }
        }
        return false;
    }

    public boolean isEqualsSign() {
        return symbols.length == 1 && symbols[0] == EQUALS;
    }

    @Override
    public String toString() {
        return isEqualsSign() ? label : "[" + label + "]";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof PositionAlphabet other)) {
            return false;
        }
        return Arrays.equals(symbols, other.symbols);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(symbols);
    }
}
