package com.proofly.backend.services.reports.scoring;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.proofly.backend.entities.FinancialTransaction;
import com.proofly.backend.enums.TransactionCategory;
import com.proofly.backend.services.reports.scoring.CategoryDeviationDetector.Deviation;

class CategoryDeviationDetectorTest {

    @Test
    void detect_flagsAmountMoreThanTwiceAwayFromCategoryAverage() {
        List<FinancialTransaction> txs = new ArrayList<>();
        for (int i = 0; i < 9; i++) {
            txs.add(tx(TransactionCategory.FOOD, "100"));
        }
        FinancialTransaction outlier = tx(TransactionCategory.FOOD, "2000");
        txs.add(outlier);
        txs.add(tx(TransactionCategory.RENT, "8000"));

        List<Deviation> flagged = CategoryDeviationDetector.detect(txs);

        assertThat(flagged).singleElement().satisfies(d -> {
            assertThat(d.transaction()).isSameAs(outlier);
            assertThat(d.categoryAverage()).isEqualByComparingTo("290.00");
            assertThat(d.reason()).startsWith("Amount deviation: 589.7%");
        });
    }

    @Test
    void detect_singleTransactionCategory_isNeverFlagged() {
        assertThat(CategoryDeviationDetector.detect(List.of(tx(TransactionCategory.RENT, "8000")))).isEmpty();
    }

    private static FinancialTransaction tx(TransactionCategory category, String amount) {
        return FinancialTransaction.builder().category(category).amount(new BigDecimal(amount)).build();
    }
}
