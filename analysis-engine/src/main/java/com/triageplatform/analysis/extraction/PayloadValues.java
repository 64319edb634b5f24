package com.triageplatform.analysis.extraction;

import java.util.Locale;
import java.util.Map;

/**
 * Helpers for reading loosely-typed JSON payload values (metrics and config maps).
 */
final class PayloadValues {

    private PayloadValues() {}

    /** Numeric value of {@code key}, or {@code null} when absent or not a number. Booleans are not numbers. */
    static Double number(Map<String, Object> map, String key) {
        if (map == null) return null;
        return asNumber(map.get(key));
    }

    static Double asNumber(Object value) {
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        return null;
    }

    static double round(double value, int decimals) {
        double scale = Math.pow(10, decimals);
        return Math.round(value * scale) / scale;
    }

    /** Formats a ratio as a whole percentage, e.g. {@code 0.25 → "25%"}. */
    static String percent(double ratio) {
        return String.format(Locale.ROOT, "%.0f%%", ratio * 100);
    }

    /** Integral numbers print without a fraction ({@code 5} not {@code 5.0}). */
    static String plain(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value)) {
            return String.valueOf((long) value);
        }
        return String.valueOf(value);
    }
}
