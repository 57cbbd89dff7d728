package com.flagship.banking_ledger.ledger;

import com.flagship.banking_ledger.ledger.exception.InvalidAmountException;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * The one place a major-unit amount becomes minor units.
 *
 * Rounds to the nearest minor unit, half away from zero: 10.005 becomes 1001 and
 * -10.005 becomes -1001. The sign is kept; amount validation happens in the engine.
 */
public final class MoneyConverter {

    private static final int MINOR_DIGITS = 2;

    private MoneyConverter() {
    }

    public static long toMinorUnits(BigDecimal majorUnits) {
        if (majorUnits == null) {
            throw new InvalidAmountException("Amount is required");
        }
        try {
            return majorUnits.movePointRight(MINOR_DIGITS)
                .setScale(0, RoundingMode.HALF_UP)
                .longValueExact();
        } catch (ArithmeticException e) {
            throw new InvalidAmountException("Amount out of range: " + majorUnits.toPlainString(), e);
        }
    }

    public static BigDecimal toMajorUnits(long minorUnits) {
        return BigDecimal.valueOf(minorUnits, MINOR_DIGITS);
    }
}
