package com.guildauction.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Short display form for amounts: 250000 -> "250K", 2500000 -> "2.5M".
 */
public final class AmountFormat {

    private static final long THOUSAND = 1_000L;
    private static final long MILLION = 1_000_000L;
    private static final long BILLION = 1_000_000_000L;
    private static final long TRILLION = 1_000_000_000_000L;

    private AmountFormat() {
    }

    public static String format(Long amount) {
        if (amount == null || amount == 0) {
            return "0";
        }
        boolean negative = amount < 0;
        long abs = Math.abs(amount);

        String text;
        if (abs >= TRILLION) {
            text = scaled(abs, TRILLION) + "T";
        } else if (abs >= BILLION) {
            text = scaled(abs, BILLION) + "B";
        } else if (abs >= MILLION) {
            text = scaled(abs, MILLION) + "M";
        } else if (abs >= THOUSAND) {
            text = scaled(abs, THOUSAND) + "K";
        } else {
            text = Long.toString(abs);
        }
        return negative ? "-" + text : text;
    }

    /** Signed difference, "+50K", "-50K" or "±0". */
    public static String formatDelta(long delta) {
        if (delta == 0) {
            return "±0";
        }
        return delta > 0 ? "+" + format(delta) : format(delta);
    }

    private static String scaled(long amount, long unit) {
        return BigDecimal.valueOf(amount)
                .divide(BigDecimal.valueOf(unit), 2, RoundingMode.HALF_UP)
                .stripTrailingZeros()
                .toPlainString();
    }
}
