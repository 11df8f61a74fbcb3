package com.finforecast.output;

import com.finforecast.core.diagnostics.Outcome;
import com.finforecast.metrics.Metric;
import com.finforecast.metrics.MetricRecord;
import com.finforecast.metrics.MetricsTable;
import com.finforecast.model.ForecastRun;
import com.finforecast.projection.ProjectedMetricsTable;
import com.finforecast.projection.Scenario;
import com.finforecast.valuation.PriceProjector;
import com.finforecast.valuation.SummaryStatistics;
import com.finforecast.valuation.ValuationSummary;
import org.json.JSONObject;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Writes a run under {@code <out>/<TICKER>_analysis/}: one CSV per table (metrics as rows, years as
 * columns) plus the valuations and summary statistics as JSON.
 */
public class ProjectionExporter {

    public Path export(String ticker, ForecastRun run, Path outputsDir) throws IOException {
        return export(ticker, run, outputsDir, null);
    }

    /**
     * Same as {@link #export(String, ForecastRun, Path)}; with a current share price it also writes
     * the implied price path of every scenario to {@code <T>_prices.json}.
     */
    public Path export(String ticker, ForecastRun run, Path outputsDir, Double currentPrice) throws IOException {
        String t = ticker.toUpperCase(Locale.ROOT);
        Path dir = outputsDir.resolve(t + "_analysis");
        Files.createDirectories(dir);

        writeCsv(dir.resolve(t + "_historical.csv"), run.history);
        for (Scenario scenario : Scenario.values()) {
            ProjectedMetricsTable projected = run.projection(scenario);
            if (projected != null) {
                writeCsv(dir.resolve(t + "_" + scenario.key + ".csv"), projected.projected);
            }
        }
        Files.writeString(dir.resolve(t + "_valuations.json"), valuationsJson(run).toString(2), StandardCharsets.UTF_8);
        Files.writeString(dir.resolve(t + "_summary.json"), summaryJson(t, run).toString(2), StandardCharsets.UTF_8);
        if (currentPrice != null) {
            Files.writeString(dir.resolve(t + "_prices.json"), pricesJson(run, currentPrice).toString(2), StandardCharsets.UTF_8);
        }
        return dir;
    }

    public void writeCsv(Path out, MetricsTable table) throws IOException {
        Files.writeString(out, toCsv(table), StandardCharsets.UTF_8);
    }

    public String toCsv(MetricsTable table) {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("metric");
        for (Integer year : table.years()) {
            sb.append(',').append(year);
        }
        sb.append('\n');
        for (Metric metric : Metric.values()) {
            sb.append(metric.key);
            for (MetricRecord row : table.rows()) {
                sb.append(',').append(fmt(row.get(metric)));
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    JSONObject valuationsJson(ForecastRun run) {
        JSONObject root = new JSONObject();
        for (Map.Entry<Scenario, Outcome<ValuationSummary>> e : run.valuations.entrySet()) {
            Outcome<ValuationSummary> outcome = e.getValue();
            JSONObject node = new JSONObject();
            if (outcome.success) {
                ValuationSummary v = outcome.value;
                node.put("dcf_value", v.dcfValue);
                node.put("pv_cash_flows", v.pvCashFlows);
                node.put("pv_terminal_value", v.pvTerminalValue);
                node.put("earnings_value", orNull(v.earningsValue));
                node.put("pe_multiple", v.peMultiple);
                node.put("final_eps", orNull(v.finalEps));
                node.put("final_fcf", orNull(v.finalFcf));
                node.put("dcf_per_share", orNull(v.dcfPerShare));
                node.put("discount_rate", v.discountRate);
                node.put("terminal_growth", v.terminalGrowth);
            } else {
                node.put("error", outcome.causeCode.name());
                node.put("detail", outcome.describe());
            }
            root.put(e.getKey().key, node);
        }
        return root;
    }

    JSONObject summaryJson(String ticker, ForecastRun run) {
        SummaryStatistics stats = run.statistics;
        JSONObject root = new JSONObject();
        root.put("ticker", ticker);
        root.put("historical_years", run.history.years());
        List<Integer> projectedYears = new ArrayList<>();
        ProjectedMetricsTable base = run.projection(Scenario.BASE);
        if (base != null) {
            projectedYears.addAll(base.projected.years());
        }
        root.put("projected_years", projectedYears);
        JSONObject cagr = new JSONObject();
        JSONObject profitability = new JSONObject();
        for (Scenario scenario : Scenario.values()) {
            cagr.put(scenario.key, orNull(stats.revenueCagr.get(scenario)));
            ProjectedMetricsTable table = run.projection(scenario);
            if (table != null) {
                JSONObject p = new JSONObject();
                p.put("growth", table.inputs.revenueGrowth);
                p.put("target_net_margin", orNull(table.profitability.targetNetMargin));
                p.put("years_to_profitability", table.profitability.horizonYears);
                profitability.put(scenario.key, p);
            }
        }
        root.put("revenue_cagr", cagr);
        root.put("avg_net_margin", orNull(stats.averageNetMargin));
        root.put("avg_fcf_margin", orNull(stats.averageFcfMargin));
        root.put("scenarios", profitability);
        return root;
    }

    // the last historical year carries the current price
    JSONObject pricesJson(ForecastRun run, double currentPrice) {
        JSONObject root = new JSONObject();
        MetricRecord last = run.history.lastRow();
        if (last == null) {
            return root;
        }
        for (Scenario scenario : Scenario.values()) {
            ProjectedMetricsTable table = run.projection(scenario);
            if (table == null) {
                continue;
            }
            int horizon = table.profitability.converges() ? table.profitability.horizonYears : 0;
            PriceProjector projector = new PriceProjector(
                    table.inputs.peMultiple, last.fiscalYear, currentPrice, null, horizon);
            JSONObject prices = new JSONObject();
            for (Map.Entry<Integer, Double> e : projector.project(table.combined()).entrySet()) {
                prices.put(String.valueOf(e.getKey()), orNull(e.getValue()));
            }
            root.put(scenario.key, prices);
        }
        return root;
    }

    private static Object orNull(Double value) {
        return value == null ? JSONObject.NULL : value;
    }

    private static String fmt(Double value) {
        if (value == null) {
            return "";
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
