package com.equationforge.generator;

import java.time.Duration;
import java.util.List;
import java.util.Locale;

public record GenerationResult(
        GameMode mode,
        List<String> equations,
        long accepted,
        long examined,
        long totalCandidates,
        int patternCount,
        Duration elapsed
) {
    public GenerationResult {
        equations = List.copyOf(equations);
    }

    public double acceptanceRate() {
        return examined == 0 ? 0.0 : accepted * 100.0 / examined;
    }

    public boolean complete() {
        return examined == totalCandidates;
    }

    /**
     * Human readable outcome, e.g.
     * {@code 206 valid expressions generated out of 289,800 total expressions - (0.071%)}.
     */
    public String summary() {
        return String.format(Locale.US, "%,d valid expressions generated out of %,d total expressions - (%.3f%%)",
                accepted, examined, acceptanceRate());
    }
}
