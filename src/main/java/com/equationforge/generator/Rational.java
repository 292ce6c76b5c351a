package com.equationforge.generator;

record Rational(long numerator, long denominator) {

    static final Rational ZERO = new Rational(0, 1);

    Rational {
        if (denominator == 0) {
            throw new ArithmeticException("Denominator is zero");
        }
        if (denominator < 0) {
            numerator = Math.negateExact(numerator);
            denominator = Math.negateExact(denominator);
        }
        long gcd = gcd(Math.abs(numerator), denominator);
        if (gcd > 1) {
            numerator /= gcd;
            denominator /= gcd;
        }
    }

    static Rational of(long value) {
        return new Rational(value, 1);
    }

    Rational add(Rational other) {
        long left = Math.multiplyExact(numerator, other.denominator);
        long right = Math.multiplyExact(other.numerator, denominator);
        return new Rational(Math.addExact(left, right), Math.multiplyExact(denominator, other.denominator));
    }

    Rational multiply(long factor) {
        return new Rational(Math.multiplyExact(numerator, factor), denominator);
    }

    Rational divide(long divisor) {
        return new Rational(numerator, Math.multiplyExact(denominator, divisor));
    }

    boolean isWhole() {
        return denominator == 1;
    }

    private static long gcd(long a, long b) {
        while (b != 0) {
            long t = a % b;
            a = b;
            b = t;
        }
        return a;
    }

    @Override
    public String toString() {
        return denominator == 1 ? Long.toString(numerator) : numerator + "/" + denominator;
    }
}
