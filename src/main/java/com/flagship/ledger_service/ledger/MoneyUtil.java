package com.flagship.ledger_service.ledger;

import java.math.BigDecimal;
import java.math.RoundingMode;

public final class MoneyUtil {

    public static final int SCALE = 2;
    public static final RoundingMode ROUNDING = RoundingMode.HALF_UP;

    private MoneyUtil() {
    }

    public static BigDecimal format(BigDecimal amount) {
        if (amount == null) return BigDecimal.ZERO.setScale(SCALE);
        return amount.setScale(SCALE, ROUNDING);
    }

    /**
     * Normalizes a requested amount and rejects anything that is not strictly positive.
     */
    public static BigDecimal requirePositive(BigDecimal amount, String what) {
        if (amount == null) {
            throw new IllegalArgumentException(what + " amount is required");
        }
        BigDecimal normalized = format(amount);
        if (normalized.signum() <= 0) {
            throw new IllegalArgumentException(what + " amount must be positive");
        }
        return normalized;
    }
}
