package com.proofly.backend.services.categorization;

import java.util.List;

import org.springframework.stereotype.Service;

import com.proofly.backend.entities.FinancialTransaction;
import com.proofly.backend.exceptions.AiServiceException;
import com.proofly.backend.services.ai.AiCompletion;
import com.proofly.backend.services.ai.AiCompletionClient;
import com.proofly.backend.services.ai.AiCompletionRequest;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Sends one batch to the AI service in a single request and parses the verdicts.
 * Batches are not split here; callers keep them to a few hundred rows.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransactionCategorizationService {

    private final AiCompletionClient aiClient;
    private final CategorizationPromptBuilder promptBuilder;
    private final CategorizationResponseParser responseParser;

    public CategorizationOutcome categorize(List<FinancialTransaction> transactions) {
        if (transactions == null || transactions.isEmpty()) {
            return new CategorizationOutcome(List.of(), null);
        }
        if (!aiClient.isConfigured()) {
            throw new AiServiceException("AI service is not configured");
        }

        AiCompletionRequest request = AiCompletionRequest.of(
                promptBuilder.systemPrompt(),
                promptBuilder.userPrompt(transactions)
        );
        AiCompletion completion = aiClient.complete(request);
        List<CategorizationResult> results = responseParser.parse(completion.text());

        log.info("[Categorization] submitted={} returned={} tokens={}",
                transactions.size(), results.size(), completion.totalTokens());
        return new CategorizationOutcome(results, completion);
    }
}
