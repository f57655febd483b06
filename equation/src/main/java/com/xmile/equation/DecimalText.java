package com.xmile.equation;

import java.math.BigDecimal;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Locale-neutral conversion between doubles and the decimal text used in equations and XMILE
 * attributes. Values without a fractional part are written as integers ({@code 4}, not {@code 4.0})
 * and exponents are expanded so the output always reads back through the equation lexer.
 */
public final class DecimalText {

    private static final Pattern DECIMAL =
            Pattern.compile("[+-]?(?:\\d+(?:\\.\\d*)?|\\.\\d+)(?:[eE][+-]?\\d+)?");
    private static final Pattern INFINITY = Pattern.compile("(?i)([+-]?)inf(?:inity)?");

    private DecimalText() {}

    /**
     * Parses a decimal string. Returns {@code null} for null/blank input. Throws
     * {@link NumberFormatException} for grouping separators, locale commas or trailing garbage.
     */
    public static Double parse(String text) {
        if (text == null) {
            return null;
        }
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        if (DECIMAL.matcher(trimmed).matches()) {
            return Double.parseDouble(trimmed);
        }
        if (trimmed.equalsIgnoreCase("nan")) {
            return Double.NaN;
        }
        Matcher infinity = INFINITY.matcher(trimmed);
        if (infinity.matches()) {
            return "-".equals(infinity.group(1)) ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
        }
        throw new NumberFormatException("Invalid decimal: " + text);
    }

    public static String format(double value) {
        if (Double.isNaN(value)) {
            return "NaN";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "INF" : "-INF";
        }
        if (value == 0.0) {
            return "0";
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
