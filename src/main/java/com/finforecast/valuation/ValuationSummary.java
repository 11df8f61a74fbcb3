package com.finforecast.valuation;

import com.finforecast.projection.Scenario;

/**
 * Valuation of one projected scenario. Values that could not be computed are {@code null}.
 */
public final class ValuationSummary {
    public final Scenario scenario;
    public final double dcfValue;
    public final double pvCashFlows;
    public final double pvTerminalValue;
    public final Double earningsValue;
    public final double peMultiple;
    public final Double finalEps;
    public final Double finalFcf;
    public final Double dcfPerShare;
    public final double discountRate;
    public final double terminalGrowth;

    public ValuationSummary(
            Scenario scenario,
            double pvCashFlows,
            double pvTerminalValue,
            Double earningsValue,
            double peMultiple,
            Double finalEps,
            Double finalFcf,
            Double dcfPerShare,
            double discountRate,
            double terminalGrowth
    ) {
        this.scenario = scenario;
        this.dcfValue = pvCashFlows + pvTerminalValue;
        this.pvCashFlows = pvCashFlows;
        this.pvTerminalValue = pvTerminalValue;
        this.earningsValue = earningsValue;
        this.peMultiple = peMultiple;
        this.finalEps = finalEps;
        this.finalFcf = finalFcf;
        this.dcfPerShare = dcfPerShare;
        this.discountRate = discountRate;
        this.terminalGrowth = terminalGrowth;
    }

    @Override
    public String toString() {
        return "ValuationSummary{scenario=" + scenario
                + ", dcf=" + dcfValue
                + ", earnings=" + earningsValue
                + ", pe=" + peMultiple
                + ", finalEps=" + finalEps
                + ", finalFcf=" + finalFcf + "}";
    }
}
