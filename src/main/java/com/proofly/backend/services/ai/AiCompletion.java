package com.proofly.backend.services.ai;

public record AiCompletion(
        String text,
        long inputTokens,
        long outputTokens,
        long totalTokens,
        String model,
        long latencyMs
) {}
