package com.proofly.backend.services.normalization;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;

import org.junit.jupiter.api.Test;

import com.proofly.backend.enums.TransactionType;

class DirectionInferenceTest {

    @Test
    void fromHint_recognizesCommonTokens() {
        assertThat(DirectionInference.fromHint("DR")).contains(TransactionType.EXPENSE);
        assertThat(DirectionInference.fromHint("Credit")).contains(TransactionType.INCOME);
        assertThat(DirectionInference.fromHint("money out")).contains(TransactionType.EXPENSE);
        assertThat(DirectionInference.fromHint("???")).isEmpty();
    }

    @Test
    void fromKeywords_ignoresKeywordsListedOnBothSides() {
        assertThat(DirectionInference.fromKeywords("Freelance Payment")).isEmpty();
        assertThat(DirectionInference.fromKeywords("Salary March")).contains(TransactionType.INCOME);
        assertThat(DirectionInference.fromKeywords("Electric bill")).contains(TransactionType.EXPENSE);
    }

    @Test
    void fromSign_zeroCountsAsIncome() {
        assertThat(DirectionInference.fromSign(BigDecimal.ZERO)).isEqualTo(TransactionType.INCOME);
        assertThat(DirectionInference.fromSign(new BigDecimal("-1"))).isEqualTo(TransactionType.EXPENSE);
    }
}
