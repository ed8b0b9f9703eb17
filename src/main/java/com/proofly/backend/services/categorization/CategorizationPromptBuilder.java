package com.proofly.backend.services.categorization;

import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.proofly.backend.entities.FinancialTransaction;
import com.proofly.backend.enums.CategoryGroup;
import com.proofly.backend.enums.ConfidenceLevel;
import com.proofly.backend.enums.TransactionCategory;
import com.proofly.backend.enums.TransactionType;

/**
 * Builds the categorization prompt pair. The taxonomy is generated from the enums so the
 * prompt and the parser always agree on codes.
 */
@Component
public class CategorizationPromptBuilder {

    private final ObjectMapper objectMapper;
    private final String systemPrompt;

    public CategorizationPromptBuilder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.systemPrompt = buildSystemPrompt();
    }

    public String systemPrompt() {
        return systemPrompt;
    }

    /**
     * One JSON object per transaction, keyed by its stable id. The model must echo the id back.
     */
    public String userPrompt(List<FinancialTransaction> transactions) {
        List<Map<String, Object>> items = new ArrayList<>(transactions.size());
        int index = 0;
        for (FinancialTransaction tx : transactions) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("id", tx.getId() != null ? tx.getId().toString() : null);
            item.put("index", index++);
            item.put("date", tx.getTransactionDate() != null ? tx.getTransactionDate().toLocalDate().toString() : null);
            item.put("amount", tx.getAmount() != null ? tx.getAmount().setScale(2, RoundingMode.HALF_UP) : null);
            item.put("currency", tx.getCurrency());
            item.put("description", tx.getDescription());
            item.put("reference", tx.getReferenceNumber());
            item.put("counterparty", tx.getCounterparty());
            item.put("current_direction", tx.getTransactionType() != null ? tx.getTransactionType().getCode() : null);
            item.put("source", tx.getSourcePlatform());
            items.add(item);
        }

        try {
            return "Categorize these " + items.size() + " transactions. "
                    + "Return one result per transaction, echoing its \"id\" exactly.\n\n"
                    + objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(items);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize transactions for the prompt", e);
        }
    }

    private static String buildSystemPrompt() {
        StringBuilder sb = new StringBuilder();
        sb.append("You are a financial analyst helping informal workers and freelancers in the Philippines ")
                .append("document their income. Categorize each transaction from GCash, PayMaya, bank statements ")
                .append("and similar sources.\n\n");

        sb.append("TRANSACTION TYPES:\n");
        for (TransactionType type : TransactionType.values()) {
            sb.append("- ").append(type.getCode()).append('\n');
        }

        appendGroup(sb, "INCOME CATEGORIES", CategoryGroup.INCOME);
        appendGroup(sb, "EXPENSE CATEGORIES", CategoryGroup.EXPENSE);
        appendGroup(sb, "TRANSFER CATEGORIES", CategoryGroup.TRANSFER);
        appendGroup(sb, "FEE CATEGORIES", CategoryGroup.FEE);
        appendGroup(sb, "OTHER", CategoryGroup.OTHER);

        String confidence = Arrays.stream(ConfidenceLevel.values())
                .filter(c -> c != ConfidenceLevel.NONE)
                .map(ConfidenceLevel::getCode)
                .collect(Collectors.joining(", "));

        sb.append("\nCONFIDENCE LEVELS: ").append(confidence).append("\n\n");
        sb.append("Respond ONLY with a JSON array, no prose. Each element:\n")
                .append("{\"id\": \"<id from input>\", \"transaction_type\": \"<type>\", \"category\": \"<category>\", ")
                .append("\"confidence\": \"<level>\", \"reasoning\": \"<one short sentence>\"}\n");
        return sb.toString();
    }

    private static void appendGroup(StringBuilder sb, String title, CategoryGroup group) {
        sb.append('\n').append(title).append(":\n");
        for (TransactionCategory c : TransactionCategory.ofGroup(group)) {
            sb.append("- ").append(c.getCode()).append(": ").append(c.getDescription()).append('\n');
        }
    }
}
