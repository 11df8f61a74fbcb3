package com.finforecast.facts;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns one raw fact encoding into a double. Unrecognized or unparseable input gives {@code null};
 * nothing here throws.
 * <ul>
 *     <li>plain number</li>
 *     <li>scaled pair {@code {value|val, decimals}} meaning {@code value * 10^decimals}</li>
 *     <li>string with thousands separators, currency symbols, or parentheses for a negative amount</li>
 * </ul>
 */
public final class ValueNormalizer {
    private static final Pattern NOISE = Pattern.compile("[\\s,$€£¥]");
    // beyond this a double is already 0 or infinite
    private static final int MAX_EXPONENT = 400;

    private ValueNormalizer() {
    }

    public static Double normalize(FactNode node) {
        if (node == null) {
            return null;
        }
        if (node instanceof ScalarNode) {
            return normalizeRaw(((ScalarNode) node).value);
        }
        if (node instanceof MappingNode) {
            return normalizeScaled((MappingNode) node);
        }
        return null;
    }

    public static Double normalizeRaw(Object raw) {
        if (raw instanceof FactNode) {
            return normalize((FactNode) raw);
        }
        if (raw instanceof Map<?, ?>) {
            return normalize(FactNodes.of(raw));
        }
        return toDouble(toDecimal(raw));
    }

    static Double normalizeScaled(MappingNode record) {
        FactNode base = record.get("value");
        if (base == null) {
            base = record.get("val");
        }
        if (!(base instanceof ScalarNode)) {
            return null;
        }
        BigDecimal decimal = toDecimal(((ScalarNode) base).value);
        if (decimal == null) {
            return null;
        }
        Integer exponent = exponent(record.get("decimals"));
        if (exponent == null || Math.abs(exponent) > MAX_EXPONENT) {
            return null;
        }
        return toDouble(decimal.scaleByPowerOfTen(exponent));
    }

    private static Integer exponent(FactNode node) {
        if (node == null) {
            return 0;
        }
        if (!(node instanceof ScalarNode)) {
            return null;
        }
        Object raw = ((ScalarNode) node).value;
        if (raw == null) {
            return 0;
        }
        if (raw instanceof String && "INF".equals(((String) raw).trim().toUpperCase(Locale.ROOT))) {
            return 0;
        }
        BigDecimal decimal = toDecimal(raw);
        if (decimal == null) {
            return null;
        }
        try {
            return decimal.intValueExact();
        } catch (ArithmeticException e) {
            return null;
        }
    }

    private static BigDecimal toDecimal(Object raw) {
        if (raw == null || raw instanceof Boolean) {
            return null;
        }
        if (raw instanceof BigDecimal) {
            return (BigDecimal) raw;
        }
        if (raw instanceof BigInteger) {
            return new BigDecimal((BigInteger) raw);
        }
        if (raw instanceof Double || raw instanceof Float) {
            double d = ((Number) raw).doubleValue();
            return Double.isFinite(d) ? BigDecimal.valueOf(d) : null;
        }
        if (raw instanceof Number) {
            return BigDecimal.valueOf(((Number) raw).longValue());
        }
        if (raw instanceof String) {
            return parseText((String) raw);
        }
        return null;
    }

    private static BigDecimal parseText(String text) {
        String cleaned = NOISE.matcher(text).replaceAll("");
        if (cleaned.isEmpty()) {
            return null;
        }
        boolean negative = false;
        if (cleaned.startsWith("(") && cleaned.endsWith(")") && cleaned.length() > 2) {
            negative = true;
            cleaned = cleaned.substring(1, cleaned.length() - 1);
        }
        try {
            BigDecimal parsed = new BigDecimal(cleaned);
            return negative ? parsed.negate() : parsed;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Double toDouble(BigDecimal decimal) {
        if (decimal == null) {
            return null;
        }
        double d = decimal.doubleValue();
        return Double.isFinite(d) ? d : null;
    }
}
