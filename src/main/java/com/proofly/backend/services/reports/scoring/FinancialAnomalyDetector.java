package com.proofly.backend.services.reports.scoring;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

import com.proofly.backend.entities.FinancialTransaction;
import com.proofly.backend.enums.TransactionType;

/**
 * Report-level anomaly summary. Within income and within expenses separately, counts the
 * transactions whose amount is strictly greater than three times that direction's mean.
 */
public final class FinancialAnomalyDetector {

    static final BigDecimal MEAN_MULTIPLIER = BigDecimal.valueOf(3);

    private FinancialAnomalyDetector() {}

    public static List<String> summarize(List<FinancialTransaction> transactions) {
        List<BigDecimal> income = amountsOf(transactions, TransactionType.INCOME);
        List<BigDecimal> expenses = amountsOf(transactions, TransactionType.EXPENSE);

        List<String> out = new ArrayList<>();
        long largeIncome = countAboveThreshold(income);
        if (largeIncome > 0) {
            out.add(largeIncome + " unusually large income transactions detected");
        }
        long largeExpense = countAboveThreshold(expenses);
        if (largeExpense > 0) {
            out.add(largeExpense + " unusually large expense transactions detected");
        }
        return out;
    }

    /** Number of amounts strictly above {@code 3 x mean}; amounts equal to it are not counted. */
    public static long countAboveThreshold(List<BigDecimal> amounts) {
        if (amounts == null || amounts.isEmpty()) return 0;
        BigDecimal threshold = mean(amounts).multiply(MEAN_MULTIPLIER);
        return amounts.stream().filter(a -> a.compareTo(threshold) > 0).count();
    }

    static BigDecimal mean(List<BigDecimal> amounts) {
        BigDecimal sum = amounts.stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        return sum.divide(BigDecimal.valueOf(amounts.size()), 10, RoundingMode.HALF_UP);
    }

    private static List<BigDecimal> amountsOf(List<FinancialTransaction> transactions, TransactionType type) {
        return transactions.stream()
                .filter(t -> t.getTransactionType() == type && t.getAmount() != null)
                .map(FinancialTransaction::getAmount)
                .toList();
    }
}
