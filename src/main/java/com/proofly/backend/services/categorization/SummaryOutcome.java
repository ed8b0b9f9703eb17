package com.proofly.backend.services.categorization;

import java.util.Map;

import com.proofly.backend.services.ai.AiCompletion;

public record SummaryOutcome(String summary, Map<String, Object> statistics, AiCompletion completion) {}
