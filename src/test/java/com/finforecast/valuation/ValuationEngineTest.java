package com.finforecast.valuation;

import com.finforecast.core.diagnostics.CauseCode;
import com.finforecast.core.diagnostics.Outcome;
import com.finforecast.metrics.Metric;
import com.finforecast.metrics.MetricRecord;
import com.finforecast.metrics.MetricsTable;
import com.finforecast.projection.ProfitabilityAssumption;
import com.finforecast.projection.ProjectedMetricsTable;
import com.finforecast.projection.Scenario;
import com.finforecast.projection.ScenarioInputs;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ValuationEngineTest {
    private final ValuationEngine engine = new ValuationEngine();

    @Test
    void flatCashFlowsShouldDiscountToKnownValue() {
        Outcome<Double> value = engine.dcfValue(List.of(100.0, 100.0, 100.0), 0.10, 0.025);

        assertTrue(value.success);
        assertEquals(1275.482094, value.value, 1e-5);
    }

    @Test
    void missingCashFlowsShouldBeSkipped() {
        Outcome<Double> withGap = engine.dcfValue(Arrays.asList(100.0, null, 100.0), 0.10, 0.025);
        Outcome<Double> compact = engine.dcfValue(List.of(100.0, 100.0), 0.10, 0.025);

        assertEquals(compact.value, withGap.value, 1e-9);
    }

    @Test
    void discountRateMustExceedTerminalGrowth() {
        Outcome<Double> equal = engine.dcfValue(List.of(100.0), 0.05, 0.05);
        Outcome<Double> below = engine.dcfValue(List.of(100.0), 0.03, 0.05);

        assertFalse(equal.success);
        assertEquals(CauseCode.DISCOUNT_NOT_ABOVE_GROWTH, equal.causeCode);
        assertEquals(CauseCode.DISCOUNT_NOT_ABOVE_GROWTH, below.causeCode);
    }

    @Test
    void emptySeriesShouldFail() {
        assertEquals(CauseCode.EMPTY_FCF_SERIES, engine.dcfValue(List.of(), 0.10, 0.025).causeCode);
        assertEquals(CauseCode.EMPTY_FCF_SERIES, engine.dcfValue(Arrays.asList(null, null), 0.10, 0.025).causeCode);
    }

    @Test
    void valuateShouldSplitValueAndUseFinalYear() {
        MetricsTable projected = MetricsTable.of(List.of(
                MetricRecord.builder(2024).put(Metric.FCF, 100.0).put(Metric.NET_INCOME, 80.0).build(),
                MetricRecord.builder(2025).put(Metric.FCF, 100.0).put(Metric.NET_INCOME, 90.0).build(),
                MetricRecord.builder(2026)
                        .put(Metric.FCF, 100.0)
                        .put(Metric.NET_INCOME, 100.0)
                        .put(Metric.EPS, 2.0)
                        .put(Metric.SHARES_DILUTED, 50.0)
                        .build()
        ));

        ValuationSummary summary = engine.valuate(table(projected), 0.10, 0.025, 15.0).orElseThrow();

        assertEquals(Scenario.BASE, summary.scenario);
        assertEquals(248.685199, summary.pvCashFlows, 1e-5);
        assertEquals(1026.796895, summary.pvTerminalValue, 1e-5);
        assertEquals(summary.pvCashFlows + summary.pvTerminalValue, summary.dcfValue, 1e-9);
        assertEquals(1500.0, summary.earningsValue, 1e-9);
        assertEquals(2.0, summary.finalEps, 1e-9);
        assertEquals(100.0, summary.finalFcf, 1e-9);
        assertEquals(summary.dcfValue / 50.0, summary.dcfPerShare, 1e-9);
    }

    @Test
    void finalFcfShouldBeLastCapitalizedCashFlow() {
        MetricsTable projected = MetricsTable.of(List.of(
                MetricRecord.builder(2024).put(Metric.FCF, 100.0).build(),
                MetricRecord.builder(2025).put(Metric.FCF, 120.0).build(),
                MetricRecord.builder(2026).put(Metric.NET_INCOME, 50.0).build()
        ));

        ValuationSummary summary = engine.valuate(table(projected), 0.10, 0.025, 15.0).orElseThrow();

        assertEquals(120.0, summary.finalFcf, 1e-9);
        assertEquals(engine.dcfValue(List.of(100.0, 120.0), 0.10, 0.025).value, summary.dcfValue, 1e-9);
        assertEquals(750.0, summary.earningsValue, 1e-9);
    }

    @Test
    void valuateWithoutNetIncomeShouldLeaveEarningsValueEmpty() {
        MetricsTable projected = MetricsTable.of(List.of(MetricRecord.builder(2024).put(Metric.FCF, 10.0).build()));

        ValuationSummary summary = engine.valuate(table(projected), 0.10, 0.025, 15.0).orElseThrow();

        assertNull(summary.earningsValue);
        assertNull(summary.dcfPerShare);
    }

    @Test
    void valuateShouldFailWhenProjectionHasNoCashFlow() {
        MetricsTable projected = MetricsTable.of(List.of(MetricRecord.builder(2024).put(Metric.NET_INCOME, 10.0).build()));

        Outcome<ValuationSummary> outcome = engine.valuate(table(projected), 0.10, 0.025, 15.0);

        assertEquals(CauseCode.EMPTY_FCF_SERIES, outcome.causeCode);
    }

    private static ProjectedMetricsTable table(MetricsTable projected) {
        return new ProjectedMetricsTable(Scenario.BASE, ScenarioInputs.defaults(Scenario.BASE),
                ProfitabilityAssumption.none(), MetricsTable.empty(), projected);
    }
}
