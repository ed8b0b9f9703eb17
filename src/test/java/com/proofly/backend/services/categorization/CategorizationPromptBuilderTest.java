package com.proofly.backend.services.categorization;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.proofly.backend.entities.FinancialTransaction;
import com.proofly.backend.enums.TransactionCategory;
import com.proofly.backend.enums.TransactionType;

class CategorizationPromptBuilderTest {

    private final CategorizationPromptBuilder builder = new CategorizationPromptBuilder(new ObjectMapper());

    @Test
    void systemPrompt_listsEveryCategoryCode() {
        String prompt = builder.systemPrompt();

        for (TransactionCategory c : TransactionCategory.values()) {
            assertThat(prompt).contains(c.getCode());
        }
        assertThat(prompt).contains("JSON array");
    }

    @Test
    void userPrompt_carriesStableIdsAndBatchIndex() {
        UUID first = UUID.randomUUID();
        UUID second = UUID.randomUUID();

        String prompt = builder.userPrompt(List.of(tx(first, "Upwork payout"), tx(second, "Meralco")));

        assertThat(prompt).startsWith("Categorize these 2 transactions.");
        assertThat(prompt).contains(first.toString(), second.toString());
        assertThat(prompt).contains("\"index\" : 1");
        assertThat(prompt).contains("\"current_direction\" : \"income\"");
    }

    private static FinancialTransaction tx(UUID id, String description) {
        return FinancialTransaction.builder()
                .id(id)
                .transactionDate(LocalDateTime.of(2024, 1, 15, 0, 0))
                .amount(new BigDecimal("100"))
                .description(description)
                .transactionType(TransactionType.INCOME)
                .sourcePlatform("gcash")
                .build();
    }
}
