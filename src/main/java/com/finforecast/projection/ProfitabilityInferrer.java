package com.finforecast.projection;

import com.finforecast.metrics.Metric;
import com.finforecast.metrics.MetricRecord;
import com.finforecast.metrics.NullSafe;

/**
 * Picks a target net margin and convergence horizon for an entity that is not profitable yet.
 */
public final class ProfitabilityInferrer {
    private final ProfitabilityPolicy policy;

    public ProfitabilityInferrer() {
        this(ProfitabilityPolicy.defaults());
    }

    public ProfitabilityInferrer(ProfitabilityPolicy policy) {
        this.policy = policy;
    }

    public ProfitabilityAssumption infer(double growth, MetricRecord trailing) {
        if (isProfitable(trailing)) {
            return ProfitabilityAssumption.none();
        }
        ProfitabilityBand band = policy.bandFor(growth);
        int horizon = policy.adjustHorizon(band.horizonYears, trailingOperatingMargin(trailing));
        return new ProfitabilityAssumption(band.targetNetMargin, horizon);
    }

    /**
     * Inference with caller values taking precedence field by field.
     */
    public ProfitabilityAssumption resolve(double growth, MetricRecord trailing, Double explicitMargin, Integer explicitHorizon) {
        if (isProfitable(trailing)) {
            return ProfitabilityAssumption.none();
        }
        ProfitabilityAssumption inferred = infer(growth, trailing);
        return new ProfitabilityAssumption(
                explicitMargin != null ? explicitMargin : inferred.targetNetMargin,
                explicitHorizon != null ? explicitHorizon : inferred.horizonYears
        );
    }

    public static boolean isProfitable(MetricRecord trailing) {
        Double netIncome = trailing == null ? null : trailing.get(Metric.NET_INCOME);
        return netIncome != null && netIncome > 0.0;
    }

    static Double trailingOperatingMargin(MetricRecord trailing) {
        if (trailing == null) {
            return null;
        }
        Double margin = trailing.get(Metric.OPERATING_MARGIN);
        if (margin != null) {
            return margin;
        }
        return NullSafe.ratio(trailing.get(Metric.OPERATING_INCOME), trailing.get(Metric.REVENUE));
    }
}
