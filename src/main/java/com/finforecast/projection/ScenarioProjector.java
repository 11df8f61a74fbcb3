package com.finforecast.projection;

import com.finforecast.core.diagnostics.CauseCode;
import com.finforecast.core.diagnostics.Outcome;
import com.finforecast.metrics.DerivedMetrics;
import com.finforecast.metrics.Metric;
import com.finforecast.metrics.MetricRecord;
import com.finforecast.metrics.MetricsTable;
import com.finforecast.metrics.NullSafe;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Map;

/**
 * Projects one scenario forward from the last historical row, one year at a time. Each year is
 * computed only from the previous year's row, so the loop is a left-to-right fold over immutable
 * records.
 */
public final class ScenarioProjector {
    private static final Logger LOG = LogManager.getLogger(ScenarioProjector.class);
    private static final String OWNER = "projection.scenario";

    private final ModelAssumptions assumptions;
    private final ProfitabilityInferrer inferrer;

    public ScenarioProjector() {
        this(ModelAssumptions.defaults(), new ProfitabilityInferrer());
    }

    public ScenarioProjector(ModelAssumptions assumptions, ProfitabilityInferrer inferrer) {
        this.assumptions = assumptions;
        this.inferrer = inferrer;
    }

    public Outcome<ProjectedMetricsTable> project(MetricsTable history, ProjectionParams params, String scenarioName) {
        Scenario scenario = Scenario.fromName(scenarioName);
        if (scenario == null) {
            return Outcome.failure(CauseCode.UNKNOWN_SCENARIO, OWNER,
                    Map.of("scenario", String.valueOf(scenarioName)));
        }
        return project(history, params, scenario);
    }

    public Outcome<ProjectedMetricsTable> project(MetricsTable history, ProjectionParams params, Scenario scenario) {
        List<String> problems = params.problems();
        if (!problems.isEmpty()) {
            return Outcome.failure(CauseCode.INVALID_PARAMETERS, OWNER, Map.of("problems", problems));
        }
        ScenarioInputs inputs = params.inputs(scenario);
        MetricRecord trailing = history.lastRow();
        if (params.years == 0) {
            return Outcome.success(new ProjectedMetricsTable(
                    scenario, inputs, ProfitabilityAssumption.none(), history, MetricsTable.empty()), OWNER);
        }
        if (trailing == null) {
            return Outcome.failure(CauseCode.EMPTY_HISTORY, OWNER, Map.of("scenario", scenario.key));
        }
        int startYear = params.startYear == null ? trailing.fiscalYear + 1 : params.startYear;
        if (startYear <= trailing.fiscalYear) {
            return Outcome.failure(CauseCode.INVALID_PARAMETERS, OWNER, Map.of(
                    "start_year", startYear,
                    "last_historical_year", trailing.fiscalYear
            ));
        }

        ProfitabilityAssumption profitability = inferrer.resolve(
                inputs.revenueGrowth, trailing, inputs.targetNetMargin, inputs.yearsToProfitability);
        ProfitabilityPath path = ProfitabilityPath.from(trailing, profitability, assumptions.taxRate);
        LOG.info("projecting scenario={} growth={} years={} start={} profitability={}",
                scenario.key, inputs.revenueGrowth, params.years, startYear, profitability);

        MetricsTable projected = MetricsTable.empty();
        MetricRecord previous = trailing;
        for (int i = 0; i < params.years; i++) {
            MetricRecord next = step(previous, startYear + i, i, inputs, params.shareDilution, path);
            projected = projected.append(next);
            previous = next;
        }
        return Outcome.success(new ProjectedMetricsTable(scenario, inputs, profitability, history, projected), OWNER);
    }

    MetricRecord step(
            MetricRecord previous,
            int year,
            int index,
            ScenarioInputs inputs,
            double dilution,
            ProfitabilityPath path
    ) {
        double growth = inputs.revenueGrowth;
        Double previousRevenue = previous.get(Metric.REVENUE);
        Double revenue = NullSafe.multiply(previousRevenue, 1.0 + growth);

        Double cogs = null;
        Double rd = null;
        Double sga = null;
        if (revenue != null) {
            Double ratio = NullSafe.ratio(previous.get(Metric.COGS), previousRevenue);
            double cogsRatio = (ratio == null ? assumptions.defaultCogsRatio : ratio)
                    * (1.0 - assumptions.cogsEfficiencyStep * index);
            cogs = revenue * cogsRatio;
            rd = orZero(previous.get(Metric.RD_EXPENSE)) * (1.0 + assumptions.rdGrowthLeverage * growth);
            sga = orZero(previous.get(Metric.SGA_EXPENSE)) * (1.0 + assumptions.sgaGrowthLeverage * growth);
        }

        Double grossProfit = NullSafe.subtract(revenue, cogs);
        Double operatingIncome = NullSafe.subtract(NullSafe.subtract(grossProfit, rd), sga);
        Double floorMargin = path == null ? null : path.marginAt(index + 1);
        Double adjustment = null;
        if (operatingIncome != null && floorMargin != null && floorMargin * revenue > operatingIncome) {
            adjustment = floorMargin * revenue - operatingIncome;
            operatingIncome = floorMargin * revenue;
        }

        Double netIncome = operatingIncome;
        if (operatingIncome != null && operatingIncome > 0.0) {
            netIncome = operatingIncome * (1.0 - assumptions.taxRate);
        }

        Double depreciation = NullSafe.multiply(revenue, assumptions.depreciationPct);
        Double workingCapital = NullSafe.multiply(revenue, assumptions.workingCapitalPct);
        Double cfo = NullSafe.subtract(NullSafe.add(netIncome, depreciation), workingCapital);
        Double capex = NullSafe.multiply(revenue, -inputs.capexPct);
        Double shares = NullSafe.multiply(previous.get(Metric.SHARES_DILUTED), 1.0 + dilution);

        MetricRecord.Builder row = MetricRecord.builder(year)
                .put(Metric.REVENUE, revenue)
                .put(Metric.COGS, cogs)
                .put(Metric.RD_EXPENSE, rd)
                .put(Metric.SGA_EXPENSE, sga)
                .put(Metric.PROFITABILITY_ADJUSTMENT, adjustment)
                .put(Metric.OPERATING_INCOME, operatingIncome)
                .put(Metric.NET_INCOME, netIncome)
                .put(Metric.CFO, cfo)
                .put(Metric.CAPEX, capex)
                .put(Metric.SHARES_DILUTED, shares);
        return DerivedMetrics.apply(row).build();
    }

    private static double orZero(Double value) {
        return value == null ? 0.0 : value;
    }

    /**
     * Operating margin floor that moves linearly from the trailing margin to the target.
     */
    static final class ProfitabilityPath {
        final double startMargin;
        final double targetOperatingMargin;
        final int horizon;

        ProfitabilityPath(double startMargin, double targetOperatingMargin, int horizon) {
            this.startMargin = startMargin;
            this.targetOperatingMargin = targetOperatingMargin;
            this.horizon = horizon;
        }

        static ProfitabilityPath from(MetricRecord trailing, ProfitabilityAssumption assumption, double taxRate) {
            if (!assumption.converges()) {
                return null;
            }
            Double start = ProfitabilityInferrer.trailingOperatingMargin(trailing);
            if (start == null) {
                start = NullSafe.ratio(trailing.get(Metric.NET_INCOME), trailing.get(Metric.REVENUE));
            }
            if (start == null) {
                return null;
            }
            return new ProfitabilityPath(start, assumption.targetNetMargin / (1.0 - taxRate), assumption.horizonYears);
        }

        double marginAt(int yearNumber) {
            if (horizon <= 0) {
                return targetOperatingMargin;
            }
            double progress = Math.min((double) yearNumber / horizon, 1.0);
            return startMargin + (targetOperatingMargin - startMargin) * progress;
        }
    }
}
