package com.equationforge.generator;

public record Token(Type type, long value) {

    public enum Type {
        NUMBER,
        MULTIPLY,
        DIVIDE
    }

    private static final Token MULTIPLY = new Token(Type.MULTIPLY, 0);
    private static final Token DIVIDE = new Token(Type.DIVIDE, 0);

    public static Token number(long value) {
        return new Token(Type.NUMBER, value);
    }

    public static Token multiply() {
        return MULTIPLY;
    }

    public static Token divide() {
        return DIVIDE;
    }

    public boolean isNumber() {
        return type == Type.NUMBER;
    }

    @Override
    public String toString() {
        return switch (type) {
            case NUMBER -> Long.toString(value);
            case MULTIPLY -> "*";
            case DIVIDE -> "/";
        };
    }
}
