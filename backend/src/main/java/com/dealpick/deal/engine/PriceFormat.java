package com.dealpick.deal.engine;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Two-decimal price text. Rounds the exact binary value half-to-even, so a stored 1.125 prints as
 * 1.12 and a stored 2.675 (really 2.67499...) prints as 2.67.
 */
public final class PriceFormat {

    private PriceFormat() {
    }

    public static String twoDecimals(double value) {
        if (Double.isNaN(value)) {
            return "nan";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "inf" : "-inf";
        }
        return new BigDecimal(value).setScale(2, RoundingMode.HALF_EVEN).toPlainString();
    }

    public static String money(double value) {
        return "$" + twoDecimals(value);
    }
}
