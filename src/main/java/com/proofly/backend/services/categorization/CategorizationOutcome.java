package com.proofly.backend.services.categorization;

import java.util.List;

import com.proofly.backend.services.ai.AiCompletion;

public record CategorizationOutcome(
        List<CategorizationResult> results,
        AiCompletion completion
) {
    public CategorizationOutcome {
        results = results == null ? List.of() : List.copyOf(results);
    }
}
