package com.proofly.backend.services.ingestion.text;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

/**
 * Finds statement-style transaction lines in free text, e.g.
 * {@code 2024-01-15  Freelance Payment  5,000.00  CR  12,300.00}.
 * Each match becomes a row keyed like a table export so the normalizer treats it the same way.
 */
@Component
public class TextLineTransactionParser {

    private static final String DATE =
            "(?<date>\\d{4}-\\d{2}-\\d{2}(?:[ T]\\d{2}:\\d{2}(?::\\d{2})?)?|\\d{1,2}/\\d{1,2}/\\d{4})";
    private static final String AMOUNT = "\\(?[-+]?(?:₱|PHP\\s?|P(?=\\d))?[-+]?\\d[\\d,]*(?:\\.\\d{1,2})?\\)?-?";

    private static final Pattern LINE = Pattern.compile(
            "^" + DATE
                    + "\\s+(?<desc>.+?)"
                    + "\\s+(?<amount>" + AMOUNT + ")"
                    + "(?:\\s+(?<dir>CR|DR|CREDIT|DEBIT))?"
                    + "(?:\\s+(?<balance>" + AMOUNT + "))?"
                    + "\\s*$",
            Pattern.CASE_INSENSITIVE);

    public List<Map<String, String>> parse(List<String> lines) {
        List<Map<String, String>> rows = new ArrayList<>();
        if (lines == null) return rows;

        for (String line : lines) {
            if (line == null) continue;
            Matcher m = LINE.matcher(line.trim());
            if (!m.matches()) continue;

            String description = m.group("desc").trim();
            if (description.isEmpty()) continue;

            Map<String, String> row = new LinkedHashMap<>();
            row.put("date", m.group("date"));
            row.put("description", description);
            row.put("amount", m.group("amount"));
            String dir = m.group("dir");
            if (dir != null) {
                String d = dir.toLowerCase(Locale.ROOT);
                row.put("type", d.startsWith("c") ? "credit" : "debit");
            }
            rows.add(row);
        }
        return rows;
    }
}
