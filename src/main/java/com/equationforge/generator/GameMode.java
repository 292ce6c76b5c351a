package com.equationforge.generator;

import java.util.Locale;

public enum GameMode {
    MINI(6, 6),
    REGULAR(8, 6);

    private final int elementCount;
    private final int attempts;

    GameMode(int elementCount, int attempts) {
        this.elementCount = elementCount;
        this.attempts = attempts;
    }

    public int elementCount() {
        return elementCount;
    }

    public int attempts() {
        return attempts;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static GameMode parse(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            throw new IllegalArgumentException("Game mode is empty");
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        try {
            return GameMode.valueOf(normalized);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported game mode: " + raw.trim(), ex);
        }
    }
}
