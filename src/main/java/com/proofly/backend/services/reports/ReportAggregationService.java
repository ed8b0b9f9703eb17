package com.proofly.backend.services.reports;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.UUID;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.proofly.backend.entities.FinancialTransaction;
import com.proofly.backend.enums.TransactionCategory;
import com.proofly.backend.enums.TransactionType;
import com.proofly.backend.repositories.FinancialTransactionRepository;
import com.proofly.backend.services.reports.scoring.ConfidenceScoreCalculator;
import com.proofly.backend.services.reports.scoring.FinancialAnomalyDetector;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Service
@RequiredArgsConstructor
@Slf4j
public class ReportAggregationService {

    public static final String UNCATEGORIZED = "Uncategorized";

    static final BigDecimal DAYS_PER_MONTH = new BigDecimal("30.44");
    static final BigDecimal MIN_MONTHS = new BigDecimal("0.1");

    private final FinancialTransactionRepository transactionRepository;

    @Transactional(readOnly = true)
    public ReportFigures compute(UUID userId, LocalDate from, LocalDate to) {
        List<FinancialTransaction> transactions = transactionRepository
                .findByUserIdAndTransactionDateBetweenOrderByTransactionDateAsc(
                        userId, from.atStartOfDay(), to.atTime(LocalTime.MAX));
        ReportFigures figures = aggregate(transactions, from, to);
        if (figures.isEmpty()) {
            log.warn("[ReportAggregation] userId={} no transactions between {} and {}", userId, from, to);
        } else {
            log.info("[ReportAggregation] userId={} count={} income={} expenses={} confidence={}",
                    userId, figures.transactionCount(), figures.totalIncome(), figures.totalExpenses(),
                    figures.confidenceScore());
        }
        return figures;
    }

    /** Pure aggregation over transactions already restricted to {@code [from, to]}. */
    public static ReportFigures aggregate(List<FinancialTransaction> transactions, LocalDate from, LocalDate to) {
        if (transactions == null || transactions.isEmpty()) {
            return ReportFigures.empty();
        }

        BigDecimal income = BigDecimal.ZERO;
        BigDecimal expenses = BigDecimal.ZERO;
        int incomeCount = 0;
        int uncategorized = 0;
        Map<String, BigDecimal> incomeBreakdown = new TreeMap<>();
        Map<String, BigDecimal> expenseBreakdown = new TreeMap<>();
        Map<String, Map<String, BigDecimal>> trends = new TreeMap<>();
        TreeSet<String> sources = new TreeSet<>();

        for (FinancialTransaction t : transactions) {
            BigDecimal amount = t.getAmount() == null ? BigDecimal.ZERO : t.getAmount().abs();
            String monthKey = YearMonth.from(t.getTransactionDate()).toString();
            Map<String, BigDecimal> month = trends.computeIfAbsent(monthKey, k -> newTrendBucket());

            if (t.getTransactionType() == TransactionType.INCOME) {
                income = income.add(amount);
                incomeCount++;
                incomeBreakdown.merge(categoryKey(t), amount, BigDecimal::add);
                month.merge("income", amount, BigDecimal::add);
            } else if (t.getTransactionType() == TransactionType.EXPENSE) {
                expenses = expenses.add(amount);
                expenseBreakdown.merge(categoryKey(t), amount, BigDecimal::add);
                month.merge("expenses", amount, BigDecimal::add);
            }

            if (isUncategorized(t)) uncategorized++;
            if (t.getSourcePlatform() != null && !t.getSourcePlatform().isBlank()) {
                sources.add(t.getSourcePlatform());
            }
        }

        BigDecimal totalIncome = money(income);
        BigDecimal totalExpenses = money(expenses);
        List<String> dataSources = List.copyOf(sources);
        int score = ConfidenceScoreCalculator.score(transactions.size(), dataSources.size(), uncategorized, incomeCount);

        return new ReportFigures(
                totalIncome,
                totalExpenses,
                totalIncome.subtract(totalExpenses),
                averageMonthly(income, from, to),
                transactions.size(),
                incomeCount,
                uncategorized,
                scaled(incomeBreakdown),
                scaled(expenseBreakdown),
                scaledTrends(trends),
                dataSources,
                score,
                FinancialAnomalyDetector.summarize(transactions)
        );
    }

    /** {@code income / max(days / 30.44, 0.1)} with both range ends inclusive. */
    static BigDecimal averageMonthly(BigDecimal income, LocalDate from, LocalDate to) {
        long days = ChronoUnit.DAYS.between(from, to) + 1;
        BigDecimal months = BigDecimal.valueOf(days).divide(DAYS_PER_MONTH, 10, RoundingMode.HALF_UP);
        if (months.compareTo(MIN_MONTHS) < 0) {
            months = MIN_MONTHS;
        }
        return income.divide(months, 2, RoundingMode.HALF_UP);
    }

    /** Null category, or the default OTHER that nobody (AI or human) has confirmed. */
    static boolean isUncategorized(FinancialTransaction t) {
        if (t.getCategory() == null) return true;
        return t.getCategory() == TransactionCategory.OTHER && !t.isAiCategorized() && !t.isManuallyVerified();
    }

    /** Breakdown key; rows counted as uncategorized for the score share the same bucket. */
    private static String categoryKey(FinancialTransaction t) {
        return isUncategorized(t) ? UNCATEGORIZED : t.getCategory().getCode();
    }

    private static Map<String, BigDecimal> newTrendBucket() {
        Map<String, BigDecimal> bucket = new LinkedHashMap<>();
        bucket.put("income", BigDecimal.ZERO);
        bucket.put("expenses", BigDecimal.ZERO);
        return bucket;
    }

    private static Map<String, BigDecimal> scaled(Map<String, BigDecimal> in) {
        Map<String, BigDecimal> out = new LinkedHashMap<>();
        in.forEach((k, v) -> out.put(k, money(v)));
        return out;
    }

    private static Map<String, Map<String, BigDecimal>> scaledTrends(Map<String, Map<String, BigDecimal>> in) {
        Map<String, Map<String, BigDecimal>> out = new LinkedHashMap<>();
        in.forEach((k, v) -> out.put(k, scaled(v)));
        return out;
    }

    private static BigDecimal money(BigDecimal v) {
        return v.setScale(2, RoundingMode.HALF_UP);
    }
}
