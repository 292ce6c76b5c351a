package com.equationforge.web;

public record GenerateRequest(
        String mode,
        Integer parallelism,
        Long candidateLimit
) {
}
