package com.catmepim.chartsync.chart;

import java.math.BigDecimal;

/**
 * Number rendering shared by chart caches and worksheet cells: the shortest plain decimal,
 * no exponent, no trailing zeros ({@code 6}, {@code 2.5}, {@code 0.001}).
 */
public final class Numbers {

    private Numbers() {
    }

    public static String format(double value) {
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    /**
     * Lenient parse used on the read path.
     *
     * @return the parsed value, or null if the text is not a number
     */
    public static Double parseOrNull(String text) {
        if (text == null) {
            return null;
        }
        String clean = text.trim();
        if (clean.isEmpty()) {
            return null;
        }
        try {
            return Double.valueOf(clean);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
