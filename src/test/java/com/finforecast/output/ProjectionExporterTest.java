package com.finforecast.output;

import com.finforecast.metrics.Metric;
import com.finforecast.metrics.MetricRecord;
import com.finforecast.metrics.MetricsTable;
import com.finforecast.model.ForecastRun;
import com.finforecast.model.ForecastService;
import com.finforecast.projection.ProjectionParams;
import com.finforecast.projection.Scenario;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProjectionExporterTest {
    private final ProjectionExporter exporter = new ProjectionExporter();

    @Test
    void csvShouldListMetricsAsRowsAndYearsAsColumns() {
        MetricsTable table = MetricsTable.of(List.of(
                MetricRecord.builder(2022).put(Metric.REVENUE, 1200.0).put(Metric.EPS, 1.25).build(),
                MetricRecord.builder(2023).put(Metric.REVENUE, 1500.0).build()
        ));

        List<String> lines = List.of(exporter.toCsv(table).split("\n"));

        assertEquals("metric,2022,2023", lines.get(0));
        assertEquals("revenue,1200,1500", lines.get(1));
        assertTrue(lines.contains("eps,1.25,"));
        assertEquals(Metric.values().length + 1, lines.size());
    }

    @Test
    void exportShouldWriteAnalysisDirectory(@TempDir Path dir) throws Exception {
        MetricsTable history = MetricsTable.of(List.of(MetricRecord.builder(2023)
                .put(Metric.REVENUE, 1000.0)
                .put(Metric.COGS, 600.0)
                .put(Metric.NET_INCOME, 100.0)
                .build()));
        ForecastRun run = new ForecastService().run(history, ProjectionParams.builder().years(2).build()).orElseThrow();

        Path out = exporter.export("acme", run, dir);

        assertEquals(dir.resolve("ACME_analysis"), out);
        for (String name : List.of("ACME_historical.csv", "ACME_bear.csv", "ACME_base.csv", "ACME_bull.csv",
                "ACME_valuations.json", "ACME_summary.json")) {
            assertTrue(Files.isRegularFile(out.resolve(name)), name);
        }
        String base = Files.readString(out.resolve("ACME_base.csv"), StandardCharsets.UTF_8);
        assertTrue(base.startsWith("metric,2024,2025\n"));

        JSONObject valuations = new JSONObject(Files.readString(out.resolve("ACME_valuations.json"), StandardCharsets.UTF_8));
        assertEquals(15.0, valuations.getJSONObject("base").getDouble("pe_multiple"), 1e-12);

        JSONObject summary = new JSONObject(Files.readString(out.resolve("ACME_summary.json"), StandardCharsets.UTF_8));
        assertEquals("ACME", summary.getString("ticker"));
        assertEquals(2, summary.getJSONArray("projected_years").length());
        assertEquals(0.05, summary.getJSONObject("revenue_cagr").getDouble("base"), 1e-9);
    }

    @Test
    void currentPriceShouldAddImpliedPricePaths(@TempDir Path dir) throws Exception {
        MetricsTable history = MetricsTable.of(List.of(MetricRecord.builder(2023)
                .put(Metric.REVENUE, 1000.0)
                .put(Metric.COGS, 600.0)
                .put(Metric.NET_INCOME, 100.0)
                .put(Metric.SHARES_DILUTED, 100.0)
                .build()));
        ForecastRun run = new ForecastService().run(history, ProjectionParams.builder().years(1).build()).orElseThrow();

        Path out = exporter.export("ACME", run, dir, 42.0);

        JSONObject prices = new JSONObject(Files.readString(out.resolve("ACME_prices.json"), StandardCharsets.UTF_8));
        JSONObject base = prices.getJSONObject("base");
        assertEquals(42.0, base.getDouble("2023"), 1e-12);
        double eps = run.projection(Scenario.BASE).projected.lastRow().get(Metric.EPS);
        assertEquals(Math.round(eps * 15.0 * 100.0) / 100.0, base.getDouble("2024"), 1e-9);
        assertTrue(Files.notExists(exporter.export("BETA", run, dir).resolve("BETA_prices.json")));
    }

    @Test
    void failedValuationShouldBeReportedWithCause() {
        MetricsTable history = MetricsTable.of(List.of(MetricRecord.builder(2023).put(Metric.REVENUE, 10.0).build()));
        ProjectionParams params = ProjectionParams.builder().discountRate(0.02).terminalGrowth(0.02).build();
        ForecastRun run = new ForecastService().run(history, params).orElseThrow();

        JSONObject bull = exporter.valuationsJson(run).getJSONObject("bull");

        assertEquals("DISCOUNT_NOT_ABOVE_GROWTH", bull.getString("error"));
    }
}
