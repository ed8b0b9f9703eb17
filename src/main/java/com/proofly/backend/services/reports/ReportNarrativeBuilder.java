package com.proofly.backend.services.reports;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Rule-based insights and the default narrative summary printed on a report.
 */
public final class ReportNarrativeBuilder {

    private ReportNarrativeBuilder() {}

    public static List<String> insights(ReportFigures figures, LocalDate from, LocalDate to) {
        List<String> out = new ArrayList<>();

        int confidence = figures.confidenceScore();
        if (confidence > 85) {
            out.add("High confidence in income data accuracy and consistency");
        } else if (confidence > 70) {
            out.add("Moderate confidence in income data with some variations");
        } else {
            out.add("Lower confidence score suggests irregular income patterns");
        }

        BigDecimal savingsRate = savingsRate(figures);
        String rate = String.format(Locale.ROOT, "%.1f%%", savingsRate.doubleValue());
        if (savingsRate.compareTo(BigDecimal.valueOf(20)) > 0) {
            out.add("Excellent savings rate of " + rate + " demonstrates strong financial discipline");
        } else if (savingsRate.compareTo(BigDecimal.TEN) > 0) {
            out.add("Good savings rate of " + rate + " shows healthy financial management");
        } else if (savingsRate.signum() > 0) {
            out.add("Modest savings rate of " + rate + " with room for improvement");
        } else {
            out.add("Savings rate of " + rate + " indicates expenses match or exceed income");
        }

        int incomeStreams = figures.incomeBreakdown().size();
        if (incomeStreams > 3) {
            out.add("Diverse income sources provide good financial stability");
        } else if (incomeStreams >= 2) {
            out.add("Multiple income sources offer moderate financial security");
        } else {
            out.add("Single income source increases financial vulnerability");
        }

        long days = ChronoUnit.DAYS.between(from, to);
        double perDay = days > 0 ? (double) figures.transactionCount() / days : 0.0;
        if (perDay > 5) {
            out.add("High transaction frequency indicates active financial management");
        } else if (perDay > 2) {
            out.add("Moderate transaction activity shows regular financial activity");
        } else {
            out.add("Lower transaction frequency may indicate simplified financial habits");
        }

        if (figures.dataSources().size() > 2) {
            out.add("Multiple data sources enhance report reliability and completeness");
        } else {
            out.add("Limited data sources may affect comprehensive financial overview");
        }
        return out;
    }

    public static String defaultSummary(ReportFigures figures, LocalDate from, LocalDate to, String currency) {
        long days = ChronoUnit.DAYS.between(from, to) + 1;
        String position = figures.netIncome().signum() > 0 ? "positive"
                : figures.netIncome().signum() < 0 ? "negative" : "balanced";
        String stability = figures.confidenceScore() > 80 ? "stable" : "variable";
        return String.format(Locale.ROOT,
                "This report covers financial activity from %s to %s (%d days). Documented income was %s %s "
                        + "and expenses were %s %s, for a %s net income of %s %s. Average monthly income was "
                        + "%s %s, indicating %s income patterns. The analysis is based on %d transactions from "
                        + "%d data sources with a confidence score of %d%%.",
                from, to, days,
                currency, figures.totalIncome().toPlainString(),
                currency, figures.totalExpenses().toPlainString(),
                position, currency, figures.netIncome().toPlainString(),
                currency, figures.averageMonthlyIncome().toPlainString(), stability,
                figures.transactionCount(), figures.dataSources().size(), figures.confidenceScore());
    }

    static BigDecimal savingsRate(ReportFigures figures) {
        if (figures.totalIncome().signum() <= 0) {
            return BigDecimal.ZERO;
        }
        return figures.netIncome()
                .multiply(BigDecimal.valueOf(100))
                .divide(figures.totalIncome(), 2, RoundingMode.HALF_UP);
    }
}
