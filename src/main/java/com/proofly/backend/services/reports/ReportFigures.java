package com.proofly.backend.services.reports;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Computed content of an income report for one user and date range.
 * {@code netIncome} is always {@code totalIncome - totalExpenses}.
 */
public record ReportFigures(
        BigDecimal totalIncome,
        BigDecimal totalExpenses,
        BigDecimal netIncome,
        BigDecimal averageMonthlyIncome,
        int transactionCount,
        int incomeCount,
        int uncategorizedCount,
        Map<String, BigDecimal> incomeBreakdown,
        Map<String, BigDecimal> expenseBreakdown,
        Map<String, Map<String, BigDecimal>> monthlyTrends,
        List<String> dataSources,
        int confidenceScore,
        List<String> anomalies
) {
    public boolean isEmpty() {
        return transactionCount == 0;
    }

    public static ReportFigures empty() {
        BigDecimal zero = BigDecimal.ZERO.setScale(2);
        return new ReportFigures(zero, zero, zero, zero, 0, 0, 0,
                Map.of(), Map.of(), Map.of(), List.of(), 0, List.of());
    }
}
