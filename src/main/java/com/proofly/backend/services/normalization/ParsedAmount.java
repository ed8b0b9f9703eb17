package com.proofly.backend.services.normalization;

import java.math.BigDecimal;

/**
 * Result of parsing a money string. {@code value} keeps the sign found in the text;
 * {@code parsed} is false when the text was unreadable and {@code value} defaulted to zero.
 */
public record ParsedAmount(BigDecimal value, String currency, boolean parsed) {

    public boolean isNegative() {
        return value.signum() < 0;
    }

    public BigDecimal magnitude() {
        return value.abs();
    }
}
