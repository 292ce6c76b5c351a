package com.equationforge.web;

public record PatternResponse(
        String label,
        int expressionLength,
        int resultLength,
        long candidateCount
) {
}
