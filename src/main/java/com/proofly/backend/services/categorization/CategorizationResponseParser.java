package com.proofly.backend.services.categorization;

import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.proofly.backend.enums.ConfidenceLevel;
import com.proofly.backend.enums.TransactionCategory;
import com.proofly.backend.enums.TransactionType;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Reads the model's answer as a JSON array. When the text is not a bare array, the first
 * balanced {@code [...]} in it is tried. Anything else yields an empty list.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CategorizationResponseParser {

    private final ObjectMapper objectMapper;

    public List<CategorizationResult> parse(String raw) {
        if (raw == null || raw.isBlank()) return List.of();
        String text = stripCodeFences(raw);

        JsonNode array = readArray(text);
        if (array == null) {
            String candidate = firstBalancedArray(text);
            if (candidate != null) {
                array = readArray(candidate);
            }
        }
        if (array == null) {
            log.warn("[CategorizationParser] response is not a JSON array (length={})", raw.length());
            return List.of();
        }

        List<CategorizationResult> results = new ArrayList<>();
        for (JsonNode node : array) {
            if (node == null || !node.isObject()) continue;
            String id = text(node, "id");
            Integer index = node.hasNonNull("index") && node.get("index").canConvertToInt()
                    ? node.get("index").asInt()
                    : null;
            if (id == null && index == null) continue;

            String categoryCode = text(node, "category");
            TransactionCategory category = TransactionCategory.fromCode(categoryCode);
            if (category == null && categoryCode != null) {
                category = TransactionCategory.OTHER;
            }

            results.add(new CategorizationResult(
                    id,
                    index,
                    TransactionType.fromCode(text(node, "transaction_type")),
                    category,
                    ConfidenceLevel.fromCode(text(node, "confidence"), ConfidenceLevel.MEDIUM),
                    text(node, "reasoning")
            ));
        }
        return results;
    }

    private JsonNode readArray(String text) {
        try {
            JsonNode node = objectMapper.readTree(text);
            return node != null && node.isArray() ? node : null;
        } catch (Exception e) {
            return null;
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode v = node.get(field);
        if (v == null || v.isNull()) return null;
        String s = v.asText();
        return s == null || s.isBlank() ? null : s.trim();
    }

    static String stripCodeFences(String raw) {
        String s = raw.trim();
        if (s.startsWith("```")) {
            int firstNewline = s.indexOf('\n');
            if (firstNewline >= 0) {
                s = s.substring(firstNewline + 1);
            }
            int lastFence = s.lastIndexOf("```");
            if (lastFence >= 0) {
                s = s.substring(0, lastFence);
            }
        }
        return s.trim();
    }

    /**
     * First {@code [...]} whose brackets balance, ignoring brackets inside JSON strings.
     */
    static String firstBalancedArray(String text) {
        int start = text.indexOf('[');
        while (start >= 0) {
            int depth = 0;
            boolean inString = false;
            boolean escaped = false;
            for (int i = start; i < text.length(); i++) {
                char c = text.charAt(i);
                if (inString) {
                    if (escaped) {
                        escaped = false;
                    } else if (c == '\\') {
                        escaped = true;
                    } else if (c == '"') {
                        inString = false;
                    }
                    continue;
                }
                if (c == '"') {
                    inString = true;
                } else if (c == '[') {
                    depth++;
                } else if (c == ']') {
                    depth--;
                    if (depth == 0) {
                        return text.substring(start, i + 1);
                    }
                }
            }
            start = text.indexOf('[', start + 1);
        }
        return null;
    }
}
