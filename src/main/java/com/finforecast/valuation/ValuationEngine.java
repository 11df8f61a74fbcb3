package com.finforecast.valuation;

import com.finforecast.core.diagnostics.CauseCode;
import com.finforecast.core.diagnostics.Outcome;
import com.finforecast.metrics.Metric;
import com.finforecast.metrics.MetricRecord;
import com.finforecast.metrics.NullSafe;
import com.finforecast.projection.ProjectedMetricsTable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Discounted cash flow with a growing-perpetuity terminal value, plus an earnings-multiple value.
 */
public final class ValuationEngine {
    private static final Logger LOG = LogManager.getLogger(ValuationEngine.class);
    private static final String OWNER = "valuation.dcf";

    public Outcome<ValuationSummary> valuate(
            ProjectedMetricsTable projected,
            double discountRate,
            double terminalGrowth,
            double peMultiple
    ) {
        List<Double> fcf = definedValues(projected.projected.column(Metric.FCF));
        Outcome<double[]> dcf = discount(fcf, discountRate, terminalGrowth);
        if (!dcf.success) {
            LOG.warn("valuation failed scenario={} reason={}", projected.scenario, dcf.describe());
            return dcf.propagate();
        }
        MetricRecord last = projected.projected.lastRow();
        Double netIncome = last.get(Metric.NET_INCOME);
        double pvCashFlows = dcf.value[0];
        double pvTerminal = dcf.value[1];
        ValuationSummary summary = new ValuationSummary(
                projected.scenario,
                pvCashFlows,
                pvTerminal,
                NullSafe.multiply(netIncome, peMultiple),
                peMultiple,
                last.get(Metric.EPS),
                fcf.get(fcf.size() - 1),
                NullSafe.ratio(pvCashFlows + pvTerminal, last.get(Metric.SHARES_DILUTED)),
                discountRate,
                terminalGrowth
        );
        LOG.info("valuation scenario={} dcf={} earnings={}", projected.scenario, summary.dcfValue, summary.earningsValue);
        return Outcome.success(summary, OWNER);
    }

    /**
     * Total DCF value of a free-cash-flow series.
     */
    public Outcome<Double> dcfValue(List<Double> fcf, double discountRate, double terminalGrowth) {
        return discount(definedValues(fcf), discountRate, terminalGrowth).map(parts -> parts[0] + parts[1]);
    }

    // [present value of the series, discounted terminal value]
    private static Outcome<double[]> discount(List<Double> fcf, double r, double g) {
        if (fcf.isEmpty()) {
            return Outcome.failure(CauseCode.EMPTY_FCF_SERIES, OWNER);
        }
        if (r <= g) {
            return Outcome.failure(CauseCode.DISCOUNT_NOT_ABOVE_GROWTH, OWNER, Map.of(
                    "discount_rate", r,
                    "terminal_growth", g
            ));
        }
        double pv = 0.0;
        for (int i = 0; i < fcf.size(); i++) {
            pv += fcf.get(i) / Math.pow(1.0 + r, i + 1);
        }
        int n = fcf.size();
        double terminal = fcf.get(n - 1) * (1.0 + g) / (r - g);
        double pvTerminal = terminal / Math.pow(1.0 + r, n);
        return Outcome.success(new double[]{pv, pvTerminal}, OWNER);
    }

    private static List<Double> definedValues(List<Double> values) {
        List<Double> out = new ArrayList<>();
        if (values == null) {
            return out;
        }
        for (Double v : values) {
            if (v != null && Double.isFinite(v)) {
                out.add(v);
            }
        }
        return out;
    }
}
