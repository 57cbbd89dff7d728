package com.flagship.banking_ledger.ledger;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Flat monthly interest: balance * annualRatePercent / 100 / 12, rounded half away from
 * zero to a whole minor unit. Balances are never negative, so HALF_UP is the same rounding.
 */
public final class InterestCalculator {

    private static final BigDecimal PERCENT_MONTHS = BigDecimal.valueOf(1200);

    private InterestCalculator() {
    }

    public static long monthlyInterest(long balance, BigDecimal annualRatePercent) {
        return BigDecimal.valueOf(balance)
            .multiply(annualRatePercent)
            .divide(PERCENT_MONTHS, 0, RoundingMode.HALF_UP)
            .longValueExact();
    }
}
