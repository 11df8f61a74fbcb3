package com.finforecast.projection;

/**
 * Inputs that differ between scenarios. {@code targetNetMargin} and {@code yearsToProfitability}
 * are optional; when absent they are inferred for unprofitable entities.
 */
public final class ScenarioInputs {
    public static final double DEFAULT_CAPEX_PCT = 0.03;

    public final double revenueGrowth;
    public final double capexPct;
    public final double peMultiple;
    public final Double targetNetMargin;
    public final Integer yearsToProfitability;

    public ScenarioInputs(
            double revenueGrowth,
            double capexPct,
            double peMultiple,
            Double targetNetMargin,
            Integer yearsToProfitability
    ) {
        this.revenueGrowth = revenueGrowth;
        this.capexPct = capexPct;
        this.peMultiple = peMultiple;
        this.targetNetMargin = targetNetMargin;
        this.yearsToProfitability = yearsToProfitability;
    }

    public static ScenarioInputs defaults(Scenario scenario) {
        return new ScenarioInputs(scenario.defaultGrowth, DEFAULT_CAPEX_PCT, scenario.defaultPeMultiple, null, null);
    }

    public ScenarioInputs withGrowth(double growth) {
        return new ScenarioInputs(growth, capexPct, peMultiple, targetNetMargin, yearsToProfitability);
    }

    public ScenarioInputs withProfitabilityTarget(Double targetNetMargin, Integer yearsToProfitability) {
        return new ScenarioInputs(revenueGrowth, capexPct, peMultiple, targetNetMargin, yearsToProfitability);
    }

    @Override
    public String toString() {
        return "ScenarioInputs{growth=" + revenueGrowth
                + ", capexPct=" + capexPct
                + ", pe=" + peMultiple
                + ", targetNetMargin=" + targetNetMargin
                + ", yearsToProfitability=" + yearsToProfitability + "}";
    }
}
