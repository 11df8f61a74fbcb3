package com.finforecast.projection;

/**
 * Fixed ratios used by the projector. The defaults reproduce the reference model; every value can be
 * overridden from configuration.
 */
public final class ModelAssumptions {
    public final double taxRate;
    public final double depreciationPct;
    public final double workingCapitalPct;
    public final double cogsEfficiencyStep;
    public final double defaultCogsRatio;
    public final double rdGrowthLeverage;
    public final double sgaGrowthLeverage;

    public ModelAssumptions(
            double taxRate,
            double depreciationPct,
            double workingCapitalPct,
            double cogsEfficiencyStep,
            double defaultCogsRatio,
            double rdGrowthLeverage,
            double sgaGrowthLeverage
    ) {
        if (taxRate < 0.0 || taxRate >= 1.0) {
            throw new IllegalArgumentException("tax rate must be in [0, 1), got " + taxRate);
        }
        this.taxRate = taxRate;
        this.depreciationPct = depreciationPct;
        this.workingCapitalPct = workingCapitalPct;
        this.cogsEfficiencyStep = cogsEfficiencyStep;
        this.defaultCogsRatio = defaultCogsRatio;
        this.rdGrowthLeverage = rdGrowthLeverage;
        this.sgaGrowthLeverage = sgaGrowthLeverage;
    }

    public static ModelAssumptions defaults() {
        return new ModelAssumptions(0.25, 0.02, 0.01, 0.005, 0.6, 0.8, 0.6);
    }
}
