package com.finforecast.metrics;

/**
 * Arithmetic where a missing operand gives a missing result.
 */
public final class NullSafe {
    private NullSafe() {
    }

    public static Double add(Double a, Double b) {
        return a == null || b == null ? null : a + b;
    }

    public static Double subtract(Double a, Double b) {
        return a == null || b == null ? null : a - b;
    }

    public static Double multiply(Double a, Double b) {
        return a == null || b == null ? null : a * b;
    }

    public static Double multiply(Double a, double b) {
        return a == null ? null : a * b;
    }

    /**
     * {@code numerator / denominator}, defined only for a positive denominator.
     */
    public static Double ratio(Double numerator, Double denominator) {
        if (numerator == null || denominator == null || denominator <= 0.0) {
            return null;
        }
        return numerator / denominator;
    }

    public static Double finite(Double value) {
        return value == null || !Double.isFinite(value) ? null : value;
    }
}
