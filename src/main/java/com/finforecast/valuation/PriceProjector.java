package com.finforecast.valuation;

import com.finforecast.metrics.Metric;
import com.finforecast.metrics.MetricRecord;
import com.finforecast.metrics.MetricsTable;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Implied share price per year from EPS and a P/E multiple. Years with negative EPS move linearly
 * from the previous price toward a small positive price over the years to profitability.
 */
public final class PriceProjector {
    private final double peMultiple;
    private final int currentYear;
    private final double currentPrice;
    private final double targetPe;
    private final int yearsToProfitability;

    public PriceProjector(double peMultiple, int currentYear, double currentPrice, Double targetPe, int yearsToProfitability) {
        this.peMultiple = peMultiple;
        this.currentYear = currentYear;
        this.currentPrice = currentPrice;
        this.targetPe = targetPe == null ? peMultiple : targetPe;
        this.yearsToProfitability = yearsToProfitability;
    }

    public Map<Integer, Double> project(MetricsTable table) {
        Map<Integer, Double> prices = new LinkedHashMap<>();
        int currentIndex = table.years().indexOf(currentYear);
        if (currentIndex < 0) {
            currentIndex = 0;
        }
        Double previous = null;
        int index = 0;
        for (MetricRecord row : table.rows()) {
            Double price = priceFor(row, index - currentIndex, previous);
            prices.put(row.fiscalYear, price);
            previous = price;
            index++;
        }
        return prices;
    }

    private Double priceFor(MetricRecord row, int yearsFromCurrent, Double previous) {
        if (row.fiscalYear == currentYear) {
            return currentPrice;
        }
        Double eps = row.get(Metric.EPS);
        if (eps == null) {
            return null;
        }
        if (eps > 0.0) {
            return roundCents(eps * peMultiple);
        }
        if (yearsFromCurrent <= 0) {
            return null;
        }
        double target = targetPe * 0.01;
        double start = previous == null ? currentPrice : previous;
        double progress = yearsToProfitability <= 0
                ? 1.0
                : Math.min((double) yearsFromCurrent / yearsToProfitability, 1.0);
        return roundCents(start + (target - start) * progress);
    }

    private static double roundCents(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
