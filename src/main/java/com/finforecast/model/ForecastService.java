package com.finforecast.model;

import com.finforecast.config.Config;
import com.finforecast.core.diagnostics.CauseCode;
import com.finforecast.core.diagnostics.Outcome;
import com.finforecast.facts.FactNode;
import com.finforecast.metrics.HistoryBuilder;
import com.finforecast.metrics.MetricRecord;
import com.finforecast.metrics.MetricsExtractor;
import com.finforecast.metrics.MetricsTable;
import com.finforecast.projection.ProfitabilityInferrer;
import com.finforecast.projection.ProjectedMetricsTable;
import com.finforecast.projection.ProjectionParams;
import com.finforecast.projection.Scenario;
import com.finforecast.projection.ScenarioProjector;
import com.finforecast.valuation.SummaryStatistics;
import com.finforecast.valuation.ValuationEngine;
import com.finforecast.valuation.ValuationSummary;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Entry point to the forecasting pipeline: extraction, history, projection and valuation.
 */
public final class ForecastService {
    private static final Logger LOG = LogManager.getLogger(ForecastService.class);
    private static final String OWNER = "forecast.run";

    private final MetricsExtractor extractor;
    private final HistoryBuilder historyBuilder;
    private final ScenarioProjector projector;
    private final ValuationEngine valuationEngine;
    private final int projectionThreads;

    public ForecastService() {
        this(new MetricsExtractor(), new ScenarioProjector(), new ValuationEngine(), 1, 3);
    }

    public ForecastService(
            MetricsExtractor extractor,
            ScenarioProjector projector,
            ValuationEngine valuationEngine,
            int extractThreads,
            int projectionThreads
    ) {
        this.extractor = extractor;
        this.historyBuilder = new HistoryBuilder(extractor, extractThreads);
        this.projector = projector;
        this.valuationEngine = valuationEngine;
        this.projectionThreads = Math.max(1, projectionThreads);
    }

    public static ForecastService fromConfig(Config config) {
        return new ForecastService(
                new MetricsExtractor(),
                new ScenarioProjector(ForecastSettings.modelAssumptions(config), new ProfitabilityInferrer()),
                new ValuationEngine(),
                config.getInt("extract.threads", 1),
                config.getInt("projection.threads", 3)
        );
    }

    public Outcome<MetricRecord> extractYear(FactNode document, int fiscalYear) {
        return extractor.extractYear(document, fiscalYear);
    }

    public MetricsTable buildHistory(Map<Integer, ? extends FactNode> documentsByYear) {
        return historyBuilder.build(documentsByYear);
    }

    public Outcome<ProjectedMetricsTable> project(MetricsTable history, ProjectionParams params, String scenarioName) {
        return projector.project(history, params, scenarioName);
    }

    public Outcome<ValuationSummary> valuate(
            ProjectedMetricsTable projected,
            double discountRate,
            double terminalGrowth,
            double peMultiple
    ) {
        return valuationEngine.valuate(projected, discountRate, terminalGrowth, peMultiple);
    }

    public Outcome<ForecastRun> run(Map<Integer, ? extends FactNode> documentsByYear, ProjectionParams params) {
        return run(buildHistory(documentsByYear), params);
    }

    /**
     * Projects and values all three scenarios. A projection failure fails the run; a valuation
     * failure is kept per scenario.
     */
    public Outcome<ForecastRun> run(MetricsTable history, ProjectionParams params) {
        if (history.isEmpty()) {
            return Outcome.failure(CauseCode.EMPTY_HISTORY, OWNER);
        }
        Map<Scenario, Outcome<ProjectedMetricsTable>> projected = projectAll(history, params);
        Map<Scenario, ProjectedMetricsTable> tables = new EnumMap<>(Scenario.class);
        Map<Scenario, Outcome<ValuationSummary>> valuations = new EnumMap<>(Scenario.class);
        for (Scenario scenario : Scenario.values()) {
            Outcome<ProjectedMetricsTable> outcome = projected.get(scenario);
            if (!outcome.success) {
                LOG.warn("projection failed scenario={} reason={}", scenario.key, outcome.describe());
                return outcome.propagate();
            }
            tables.put(scenario, outcome.value);
            valuations.put(scenario, valuate(
                    outcome.value,
                    params.discountRate,
                    params.terminalGrowth,
                    params.inputs(scenario).peMultiple
            ));
        }
        SummaryStatistics statistics = SummaryStatistics.compute(history, tables);
        return Outcome.success(new ForecastRun(history, tables, valuations, statistics), OWNER);
    }

    private Map<Scenario, Outcome<ProjectedMetricsTable>> projectAll(MetricsTable history, ProjectionParams params) {
        Map<Scenario, Outcome<ProjectedMetricsTable>> out = new EnumMap<>(Scenario.class);
        if (projectionThreads == 1) {
            for (Scenario scenario : Scenario.values()) {
                out.put(scenario, projector.project(history, params, scenario));
            }
            return out;
        }
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(projectionThreads, Scenario.values().length));
        Map<Scenario, Future<Outcome<ProjectedMetricsTable>>> futures = new EnumMap<>(Scenario.class);
        try {
            for (Scenario scenario : Scenario.values()) {
                futures.put(scenario, pool.submit(() -> projector.project(history, params, scenario)));
            }
            for (Map.Entry<Scenario, Future<Outcome<ProjectedMetricsTable>>> e : futures.entrySet()) {
                try {
                    out.put(e.getKey(), e.getValue().get());
                } catch (ExecutionException ex) {
                    Throwable cause = ex.getCause() == null ? ex : ex.getCause();
                    out.put(e.getKey(), Outcome.failure(CauseCode.RUNTIME_ERROR, OWNER,
                            Map.of("scenario", e.getKey().key, "error", String.valueOf(cause.getMessage()))));
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            for (Scenario scenario : Scenario.values()) {
                out.putIfAbsent(scenario, Outcome.failure(CauseCode.RUNTIME_ERROR, OWNER,
                        Map.of("scenario", scenario.key, "error", "interrupted")));
            }
        } finally {
            pool.shutdown();
        }
        return out;
    }
}
