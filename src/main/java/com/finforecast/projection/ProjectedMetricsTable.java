package com.finforecast.projection;

import com.finforecast.metrics.MetricsTable;

/**
 * History a scenario started from plus the rows projected from it.
 */
public final class ProjectedMetricsTable {
    public final Scenario scenario;
    public final ScenarioInputs inputs;
    public final ProfitabilityAssumption profitability;
    public final MetricsTable history;
    public final MetricsTable projected;

    public ProjectedMetricsTable(
            Scenario scenario,
            ScenarioInputs inputs,
            ProfitabilityAssumption profitability,
            MetricsTable history,
            MetricsTable projected
    ) {
        this.scenario = scenario;
        this.inputs = inputs;
        this.profitability = profitability;
        this.history = history;
        this.projected = projected;
    }

    public MetricsTable combined() {
        return history.concat(projected);
    }

    @Override
    public String toString() {
        return "ProjectedMetricsTable{scenario=" + scenario + ", history=" + history.years()
                + ", projected=" + projected.years() + "}";
    }
}
