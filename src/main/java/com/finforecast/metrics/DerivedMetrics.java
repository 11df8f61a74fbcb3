package com.finforecast.metrics;

/**
 * Fills derived columns from reported ones, in dependency order.
 */
public final class DerivedMetrics {
    private DerivedMetrics() {
    }

    public static MetricRecord.Builder apply(MetricRecord.Builder row) {
        Double revenue = row.get(Metric.REVENUE);
        Double grossProfit = NullSafe.subtract(revenue, row.get(Metric.COGS));
        row.put(Metric.GROSS_PROFIT, grossProfit);
        row.put(Metric.GROSS_MARGIN, NullSafe.ratio(grossProfit, revenue));
        row.put(Metric.OPERATING_MARGIN, NullSafe.ratio(row.get(Metric.OPERATING_INCOME), revenue));
        row.put(Metric.NET_MARGIN, NullSafe.ratio(row.get(Metric.NET_INCOME), revenue));

        Double capex = row.get(Metric.CAPEX);
        Double fcf = NullSafe.subtract(row.get(Metric.CFO), capex == null ? null : Math.abs(capex));
        row.put(Metric.FCF, fcf);
        row.put(Metric.FCF_MARGIN, NullSafe.ratio(fcf, revenue));

        if (row.get(Metric.EPS) == null) {
            row.put(Metric.EPS, NullSafe.ratio(row.get(Metric.NET_INCOME), row.get(Metric.SHARES_DILUTED)));
        }

        Double debt = row.get(Metric.TOTAL_DEBT);
        row.put(Metric.NET_DEBT, NullSafe.subtract(debt, row.get(Metric.CASH)));
        row.put(Metric.DEBT_TO_EQUITY, NullSafe.ratio(debt, row.get(Metric.BOOK_VALUE)));
        return row;
    }

    public static MetricRecord apply(MetricRecord row) {
        return apply(row.toBuilder()).build();
    }
}
