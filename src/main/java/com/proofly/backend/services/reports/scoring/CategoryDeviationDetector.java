package com.proofly.backend.services.reports.scoring;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.proofly.backend.entities.FinancialTransaction;
import com.proofly.backend.enums.TransactionCategory;

/**
 * Per-transaction anomaly check used by bulk detection. A transaction is flagged when its
 * amount deviates from its category's average by more than 200%.
 */
public final class CategoryDeviationDetector {

    static final BigDecimal DEVIATION_THRESHOLD = BigDecimal.valueOf(2);

    private CategoryDeviationDetector() {}

    public record Deviation(
            FinancialTransaction transaction,
            BigDecimal categoryAverage,
            BigDecimal deviationPercentage
    ) {
        public String reason() {
            return String.format(Locale.ROOT, "Amount deviation: %.1f%% from category average",
                    deviationPercentage.doubleValue());
        }
    }

    public static List<Deviation> detect(List<FinancialTransaction> transactions) {
        Map<TransactionCategory, BigDecimal> sums = new HashMap<>();
        Map<TransactionCategory, Integer> counts = new HashMap<>();
        for (FinancialTransaction t : transactions) {
            if (t.getAmount() == null) continue;
            sums.merge(t.getCategory(), t.getAmount(), BigDecimal::add);
            counts.merge(t.getCategory(), 1, Integer::sum);
        }

        Map<TransactionCategory, BigDecimal> averages = new HashMap<>();
        sums.forEach((category, sum) -> averages.put(category,
                sum.divide(BigDecimal.valueOf(counts.get(category)), 10, RoundingMode.HALF_UP)));

        List<Deviation> flagged = new ArrayList<>();
        for (FinancialTransaction t : transactions) {
            if (t.getAmount() == null) continue;
            BigDecimal avg = averages.get(t.getCategory());
            if (avg == null || avg.signum() <= 0) continue;

            BigDecimal deviation = t.getAmount().subtract(avg).abs().divide(avg, 10, RoundingMode.HALF_UP);
            if (deviation.compareTo(DEVIATION_THRESHOLD) > 0) {
                flagged.add(new Deviation(
                        t,
                        avg.setScale(2, RoundingMode.HALF_UP),
                        deviation.multiply(BigDecimal.valueOf(100)).setScale(4, RoundingMode.HALF_UP)
                ));
            }
        }
        return flagged;
    }
}
