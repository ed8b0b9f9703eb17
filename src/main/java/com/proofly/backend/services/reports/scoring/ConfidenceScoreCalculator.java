package com.proofly.backend.services.reports.scoring;

/**
 * Data-quality score of a report, 0 to 100. Starts at 100 and subtracts fixed penalties for
 * thin data, a single data source, uncategorized rows and missing income.
 */
public final class ConfidenceScoreCalculator {

    public static final int MAX_SCORE = 100;

    private ConfidenceScoreCalculator() {}

    public static int score(int transactionCount, int distinctSources, int uncategorizedCount, int incomeCount) {
        int score = MAX_SCORE;

        if (transactionCount < 10) {
            score -= 30;
        } else if (transactionCount < 50) {
            score -= 15;
        }

        if (distinctSources < 2) {
            score -= 15;
        }

        double uncategorizedPct = transactionCount > 0 ? uncategorizedCount * 100.0 / transactionCount : 0.0;
        if (uncategorizedPct > 50.0) {
            score -= 20;
        } else if (uncategorizedPct > 20.0) {
            score -= 10;
        }

        if (incomeCount == 0) {
            score -= 40;
        }

        return Math.max(score, 0);
    }
}
