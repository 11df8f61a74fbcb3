package com.finforecast.model;

import com.finforecast.core.diagnostics.Outcome;
import com.finforecast.metrics.MetricsTable;
import com.finforecast.projection.ProjectedMetricsTable;
import com.finforecast.projection.Scenario;
import com.finforecast.valuation.SummaryStatistics;
import com.finforecast.valuation.ValuationSummary;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Everything one full run produced: the history, one projection per scenario, and each scenario's
 * valuation (which may have failed on its own).
 */
public final class ForecastRun {
    public final MetricsTable history;
    public final Map<Scenario, ProjectedMetricsTable> projections;
    public final Map<Scenario, Outcome<ValuationSummary>> valuations;
    public final SummaryStatistics statistics;

    public ForecastRun(
            MetricsTable history,
            Map<Scenario, ProjectedMetricsTable> projections,
            Map<Scenario, Outcome<ValuationSummary>> valuations,
            SummaryStatistics statistics
    ) {
        this.history = history;
        this.projections = Collections.unmodifiableMap(new EnumMap<>(projections));
        this.valuations = Collections.unmodifiableMap(new EnumMap<>(valuations));
        this.statistics = statistics;
    }

    public ProjectedMetricsTable projection(Scenario scenario) {
        return projections.get(scenario);
    }

    public ValuationSummary valuation(Scenario scenario) {
        Outcome<ValuationSummary> outcome = valuations.get(scenario);
        return outcome == null || !outcome.success ? null : outcome.value;
    }
}
