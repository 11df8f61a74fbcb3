package com.finforecast.projection;

/**
 * Target net margin and the number of years to reach it. {@code targetNetMargin == null} means the
 * entity is extrapolated without a convergence path.
 */
public final class ProfitabilityAssumption {
    private static final ProfitabilityAssumption NONE = new ProfitabilityAssumption(null, 0);

    public final Double targetNetMargin;
    public final int horizonYears;

    public ProfitabilityAssumption(Double targetNetMargin, int horizonYears) {
        this.targetNetMargin = targetNetMargin;
        this.horizonYears = Math.max(0, horizonYears);
    }

    public static ProfitabilityAssumption none() {
        return NONE;
    }

    public boolean converges() {
        return targetNetMargin != null;
    }

    @Override
    public String toString() {
        return converges()
                ? "ProfitabilityAssumption{target=" + targetNetMargin + ", horizon=" + horizonYears + "}"
                : "ProfitabilityAssumption{none}";
    }
}
