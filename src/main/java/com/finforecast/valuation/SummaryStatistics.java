package com.finforecast.valuation;

import com.finforecast.metrics.Metric;
import com.finforecast.metrics.MetricsTable;
import com.finforecast.projection.ProjectedMetricsTable;
import com.finforecast.projection.Scenario;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public final class SummaryStatistics {
    public final Map<Scenario, Double> revenueCagr;
    public final Double averageNetMargin;
    public final Double averageFcfMargin;

    public SummaryStatistics(Map<Scenario, Double> revenueCagr, Double averageNetMargin, Double averageFcfMargin) {
        EnumMap<Scenario, Double> copy = new EnumMap<>(Scenario.class);
        if (revenueCagr != null) {
            copy.putAll(revenueCagr);
        }
        this.revenueCagr = Collections.unmodifiableMap(copy);
        this.averageNetMargin = averageNetMargin;
        this.averageFcfMargin = averageFcfMargin;
    }

    public static SummaryStatistics compute(MetricsTable history, Map<Scenario, ProjectedMetricsTable> projections) {
        EnumMap<Scenario, Double> cagr = new EnumMap<>(Scenario.class);
        if (projections != null) {
            for (Map.Entry<Scenario, ProjectedMetricsTable> e : projections.entrySet()) {
                cagr.put(e.getKey(), revenueCagr(e.getValue().projected));
            }
        }
        return new SummaryStatistics(
                cagr,
                average(history.column(Metric.NET_MARGIN)),
                average(history.column(Metric.FCF_MARGIN))
        );
    }

    /**
     * Compound annual growth between the first and last revenue of a table; {@code null} with
     * fewer than two years or a non-positive first revenue.
     */
    public static Double revenueCagr(MetricsTable table) {
        List<Double> revenue = table.column(Metric.REVENUE);
        int n = revenue.size();
        if (n < 2) {
            return null;
        }
        Double first = revenue.get(0);
        Double last = revenue.get(n - 1);
        if (first == null || last == null || first <= 0.0 || last < 0.0) {
            return null;
        }
        return Math.pow(last / first, 1.0 / (n - 1)) - 1.0;
    }

    public static Double average(List<Double> values) {
        double sum = 0.0;
        int count = 0;
        for (Double v : values) {
            if (v != null) {
                sum += v;
                count++;
            }
        }
        return count == 0 ? null : sum / count;
    }
}
