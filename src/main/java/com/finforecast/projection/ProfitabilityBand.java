package com.finforecast.projection;

/**
 * Growth at or above {@code minGrowth} maps to this target net margin and convergence horizon.
 */
public final class ProfitabilityBand {
    public final double minGrowth;
    public final double targetNetMargin;
    public final int horizonYears;

    public ProfitabilityBand(double minGrowth, double targetNetMargin, int horizonYears) {
        if (horizonYears < 0) {
            throw new IllegalArgumentException("horizon must be >= 0, got " + horizonYears);
        }
        this.minGrowth = minGrowth;
        this.targetNetMargin = targetNetMargin;
        this.horizonYears = horizonYears;
    }

    @Override
    public String toString() {
        return "ProfitabilityBand{growth>=" + minGrowth + ", margin=" + targetNetMargin + ", horizon=" + horizonYears + "}";
    }
}
