package com.equationforge.web;

import java.util.List;

public record GenerateResponse(
        String mode,
        int elementCount,
        int attempts,
        int patternCount,
        long accepted,
        long examined,
        long totalCandidates,
        boolean complete,
        String summary,
        long elapsedMillis,
        String savedPath,
        List<String> sampleEquations
) {
}
