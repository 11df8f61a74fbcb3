package com.finforecast.projection;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Band table and near-breakeven shortening rule used to infer a profitability path.
 * Bands are held in descending growth order; the fallback applies below the lowest threshold.
 */
public final class ProfitabilityPolicy {
    public final List<ProfitabilityBand> bands;
    public final ProfitabilityBand fallback;
    public final double nearBreakevenMargin;
    public final int nearBreakevenReduction;
    public final int nearBreakevenMinHorizon;
    public final double closeToBreakevenMargin;
    public final int closeToBreakevenReduction;
    public final int closeToBreakevenMinHorizon;

    public ProfitabilityPolicy(
            List<ProfitabilityBand> bands,
            ProfitabilityBand fallback,
            double nearBreakevenMargin,
            int nearBreakevenReduction,
            int nearBreakevenMinHorizon,
            double closeToBreakevenMargin,
            int closeToBreakevenReduction,
            int closeToBreakevenMinHorizon
    ) {
        if (fallback == null) {
            throw new IllegalArgumentException("fallback band is required");
        }
        List<ProfitabilityBand> sorted = new ArrayList<>(bands == null ? List.of() : bands);
        sorted.sort(Comparator.comparingDouble((ProfitabilityBand b) -> b.minGrowth).reversed());
        this.bands = List.copyOf(sorted);
        this.fallback = fallback;
        this.nearBreakevenMargin = nearBreakevenMargin;
        this.nearBreakevenReduction = nearBreakevenReduction;
        this.nearBreakevenMinHorizon = nearBreakevenMinHorizon;
        this.closeToBreakevenMargin = closeToBreakevenMargin;
        this.closeToBreakevenReduction = closeToBreakevenReduction;
        this.closeToBreakevenMinHorizon = closeToBreakevenMinHorizon;
    }

    public static ProfitabilityPolicy defaults() {
        return new ProfitabilityPolicy(
                List.of(
                        new ProfitabilityBand(0.20, 0.10, 7),
                        new ProfitabilityBand(0.15, 0.12, 6),
                        new ProfitabilityBand(0.08, 0.15, 5),
                        new ProfitabilityBand(0.05, 0.18, 4)
                ),
                new ProfitabilityBand(Double.NEGATIVE_INFINITY, 0.20, 3),
                -0.05, 2, 2,
                -0.10, 1, 3
        );
    }

    public ProfitabilityBand bandFor(double growth) {
        for (ProfitabilityBand band : bands) {
            if (growth >= band.minGrowth) {
                return band;
            }
        }
        return fallback;
    }

    /**
     * Shortens a horizon when the trailing operating margin is already close to breakeven.
     */
    public int adjustHorizon(int horizon, Double trailingOperatingMargin) {
        if (trailingOperatingMargin == null) {
            return horizon;
        }
        if (trailingOperatingMargin > nearBreakevenMargin) {
            return Math.max(nearBreakevenMinHorizon, horizon - nearBreakevenReduction);
        }
        if (trailingOperatingMargin > closeToBreakevenMargin) {
            return Math.max(closeToBreakevenMinHorizon, horizon - closeToBreakevenReduction);
        }
        return horizon;
    }
}
