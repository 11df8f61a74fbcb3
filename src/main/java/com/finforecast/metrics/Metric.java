package com.finforecast.metrics;

import java.util.Locale;

/**
 * Columns of a metrics table, in output order.
 */
public enum Metric {
    REVENUE("revenue", false),
    COGS("cogs", false),
    GROSS_PROFIT("gross_profit", true),
    RD_EXPENSE("rd_expense", false),
    SGA_EXPENSE("sga_expense", false),
    // projected rows only: operating income added by the profitability path on top of
    // gross_profit - rd_expense - sga_expense
    PROFITABILITY_ADJUSTMENT("profitability_adjustment", false),
    OPERATING_INCOME("operating_income", false),
    NET_INCOME("net_income", false),
    EPS("eps", false),
    SHARES_DILUTED("shares_diluted", false),
    CFO("cfo", false),
    CAPEX("capex", false),
    FCF("fcf", true),
    TOTAL_DEBT("total_debt", false),
    CASH("cash", false),
    BOOK_VALUE("book_value", false),
    NET_DEBT("net_debt", true),
    GROSS_MARGIN("gross_margin", true),
    OPERATING_MARGIN("operating_margin", true),
    NET_MARGIN("net_margin", true),
    FCF_MARGIN("fcf_margin", true),
    DEBT_TO_EQUITY("debt_to_equity", true);

    public final String key;
    public final boolean derived;

    Metric(String key, boolean derived) {
        this.key = key;
        this.derived = derived;
    }

    public static Metric fromKey(String key) {
        if (key == null) {
            return null;
        }
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        for (Metric metric : values()) {
            if (metric.key.equals(normalized)) {
                return metric;
            }
        }
        return null;
    }
}
