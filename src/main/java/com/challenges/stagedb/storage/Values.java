package com.challenges.stagedb.storage;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Literal inference and rendering for stored values.
 */
public final class Values {
    private static final Pattern INTEGER = Pattern.compile("-?\\d+");
    private static final Pattern DECIMAL = Pattern.compile("-?\\d+\\.\\d+");
    private static final Pattern NUMERIC_TEXT = Pattern.compile("\\s*[-+]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][-+]?\\d+)?\\s*");

    public static final String NULL_MARKER = "NULL";

    private Values() {
    }

    /**
     * Infers a value from a literal token: {@code NULL}, a signed integer, a decimal, a
     * quoted string (quotes stripped, doubled quotes unescaped) or the raw token as text.
     */
    public static Object parseLiteral(String token) {
        String trimmed = token.trim();
        if (trimmed.toUpperCase(Locale.ROOT).equals(NULL_MARKER)) {
            return null;
        }
        if (isQuoted(trimmed)) {
            return unquote(trimmed);
        }
        if (INTEGER.matcher(trimmed).matches()) {
            try {
                return Long.parseLong(trimmed);
            } catch (NumberFormatException e) {
                return finiteOrText(trimmed);
            }
        }
        if (DECIMAL.matcher(trimmed).matches()) {
            return finiteOrText(trimmed);
        }
        return trimmed;
    }

    /**
     * Literals beyond the double range stay text; they still compare numerically.
     */
    private static Object finiteOrText(String literal) {
        double d = Double.parseDouble(literal);
        return Double.isFinite(d) ? (Object) d : literal;
    }

    public static boolean isQuoted(String token) {
        if (token.length() < 2) {
            return false;
        }
        char first = token.charAt(0);
        return (first == '\'' || first == '"') && token.charAt(token.length() - 1) == first;
    }

    public static String unquote(String token) {
        char quote = token.charAt(0);
        String inner = token.substring(1, token.length() - 1);
        return inner.replace(String.valueOf(quote) + quote, String.valueOf(quote));
    }

    /**
     * True for longs, finite doubles and text that reads as a representable decimal.
     */
    public static boolean isNumeric(Object value) {
        if (value instanceof Long) {
            return true;
        }
        if (value instanceof Double d) {
            return Double.isFinite(d);
        }
        return value instanceof String s && NUMERIC_TEXT.matcher(s).matches() && parseDecimal(s) != null;
    }

    /**
     * Exact decimal view of a value for which {@link #isNumeric} holds.
     */
    public static BigDecimal toDecimal(Object value) {
        if (value instanceof Double d) {
            return BigDecimal.valueOf(d);
        }
        if (value instanceof Long l) {
            return BigDecimal.valueOf(l);
        }
        BigDecimal decimal = parseDecimal(value.toString());
        if (decimal == null) {
            throw new IllegalArgumentException("Not a numeric value: " + value);
        }
        return decimal;
    }

    // null when the exponent is out of BigDecimal's range
    private static BigDecimal parseDecimal(String text) {
        try {
            return new BigDecimal(text.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public static String render(Object value) {
        if (value == null) {
            return NULL_MARKER;
        }
        if (value instanceof Double d && d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) < 1e15) {
            return Long.toString(d.longValue());
        }
        return value.toString();
    }
}
