package com.proofly.backend.services.ai;

/**
 * One prompt pair for the AI service. Null model/temperature/maxTokens fall back to configuration.
 */
public record AiCompletionRequest(
        String systemPrompt,
        String userPrompt,
        String model,
        Double temperature,
        Integer maxTokens
) {
    public static AiCompletionRequest of(String systemPrompt, String userPrompt) {
        return new AiCompletionRequest(systemPrompt, userPrompt, null, null, null);
    }

    public AiCompletionRequest withMaxTokens(int tokens) {
        return new AiCompletionRequest(systemPrompt, userPrompt, model, temperature, tokens);
    }
}
