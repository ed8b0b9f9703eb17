package com.proofly.backend.services.categorization;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.springframework.stereotype.Service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.proofly.backend.config.CategorizationProperties;
import com.proofly.backend.entities.FinancialTransaction;
import com.proofly.backend.enums.TransactionType;
import com.proofly.backend.exceptions.AiServiceException;
import com.proofly.backend.services.ai.AiCompletion;
import com.proofly.backend.services.ai.AiCompletionClient;
import com.proofly.backend.services.ai.AiCompletionRequest;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Narrative summary of a period for formal applications. Basic statistics are computed here;
 * only the first transactions of the period are sent to the AI service as context.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FinancialSummaryService {

    static final String SYSTEM_PROMPT = """
            You write financial summaries for informal earners in the Philippines. Analyze the \
            transaction data and produce a clear, professional summary suitable for loan applications, \
            government subsidies or other financial services.

            Cover:
            1. Overview of financial activity during the period
            2. Income sources and patterns
            3. Major expense categories
            4. Financial stability indicators
            5. Notable trends

            Use a professional tone and Philippine Peso amounts. Keep it concise.""";

    private final AiCompletionClient aiClient;
    private final ObjectMapper objectMapper;
    private final CategorizationProperties properties;

    public SummaryOutcome summarize(List<FinancialTransaction> transactions, LocalDate from, LocalDate to) {
        if (!aiClient.isConfigured()) {
            throw new AiServiceException("AI service is not configured");
        }
        Map<String, Object> stats = statistics(transactions);

        AiCompletionRequest request = AiCompletionRequest.of(SYSTEM_PROMPT, userPrompt(transactions, stats, from, to))
                .withMaxTokens(properties.summaryMaxTokens());
        AiCompletion completion = aiClient.complete(request);

        log.info("[FinancialSummary] transactions={} tokens={}", transactions.size(), completion.totalTokens());
        return new SummaryOutcome(completion.text(), stats, completion);
    }

    static Map<String, Object> statistics(List<FinancialTransaction> transactions) {
        BigDecimal income = BigDecimal.ZERO;
        BigDecimal expenses = BigDecimal.ZERO;
        int incomeCount = 0;
        int expenseCount = 0;
        for (FinancialTransaction t : transactions) {
            if (t.getAmount() == null) continue;
            if (t.getTransactionType() == TransactionType.INCOME) {
                income = income.add(t.getAmount());
                incomeCount++;
            } else if (t.getTransactionType() == TransactionType.EXPENSE) {
                expenses = expenses.add(t.getAmount());
                expenseCount++;
            }
        }

        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("total_income", income.setScale(2, RoundingMode.HALF_UP));
        stats.put("total_expenses", expenses.setScale(2, RoundingMode.HALF_UP));
        stats.put("net_income", income.subtract(expenses).setScale(2, RoundingMode.HALF_UP));
        stats.put("transaction_count", transactions.size());
        stats.put("income_count", incomeCount);
        stats.put("expense_count", expenseCount);
        return stats;
    }

    private String userPrompt(List<FinancialTransaction> transactions, Map<String, Object> stats,
                              LocalDate from, LocalDate to) {
        List<Map<String, Object>> context = new ArrayList<>();
        for (FinancialTransaction t : transactions.subList(0, Math.min(transactions.size(), properties.summaryContextLimit()))) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("date", t.getTransactionDate() != null ? t.getTransactionDate().toLocalDate().toString() : null);
            item.put("amount", t.getAmount());
            item.put("description", t.getDescription());
            item.put("transaction_type", t.getTransactionType() != null ? t.getTransactionType().getCode() : null);
            item.put("category", t.getCategory() != null ? t.getCategory().getCode() : null);
            item.put("counterparty", t.getCounterparty());
            context.add(item);
        }

        String json;
        try {
            json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(context);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize transactions for the summary prompt", e);
        }

        return String.format(Locale.ROOT, """
                Generate a financial summary for the following data.

                PERIOD: %s to %s

                STATISTICS:
                - Total income: PHP %,.2f
                - Total expenses: PHP %,.2f
                - Net income: PHP %,.2f
                - Total transactions: %d

                TRANSACTION DATA (first %d):
                %s
                """,
                from, to,
                (BigDecimal) stats.get("total_income"),
                (BigDecimal) stats.get("total_expenses"),
                (BigDecimal) stats.get("net_income"),
                transactions.size(),
                context.size(),
                json);
    }
}
