package com.ember.script.expr;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.regex.Pattern;

/** Number and truth-value conversions shared by the evaluator and the runtime. */
public final class Numbers {

    private static final Pattern NUMBER = Pattern.compile("[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?");

    private Numbers() {}

    /** {@code 2.0 -> "2"}, {@code 6.5 -> "6.5"}. */
    public static String format(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) return Double.toString(value);
        if (value == Math.rint(value) && Math.abs(value) < 1e15) return Long.toString((long) value);
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    /** Like {@link #format(double)} but rounded to at most two decimals. */
    public static String formatRounded(double value) {
        return format(BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue());
    }

    /** Parsed number, or null when {@code text} is not numeric. */
    public static Double parse(String text) {
        if (text == null) return null;
        String t = text.trim();
        if (!NUMBER.matcher(t).matches()) return null;
        return Double.valueOf(t);
    }

    /**
     * {@code true/yes/on/1/+} and {@code false/no/off/0/-}, case-insensitive; null for anything else.
     */
    public static Boolean toBool(String text) {
        if (text == null) return null;
        switch (text.trim().toLowerCase(Locale.ROOT)) {
            case "true": case "yes": case "on": case "1": case "+":
                return Boolean.TRUE;
            case "false": case "no": case "off": case "0": case "-":
                return Boolean.FALSE;
            default:
                return null;
        }
    }
}
