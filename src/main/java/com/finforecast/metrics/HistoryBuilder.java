package com.finforecast.metrics;

import com.finforecast.core.diagnostics.Outcome;
import com.finforecast.facts.FactNode;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Extracts every year of a document set into a historical table. A year that fails is logged and
 * left out; it never aborts the others.
 */
public final class HistoryBuilder {
    private static final Logger LOG = LogManager.getLogger(HistoryBuilder.class);

    private final MetricsExtractor extractor;
    private final int threads;

    public HistoryBuilder(MetricsExtractor extractor) {
        this(extractor, 1);
    }

    public HistoryBuilder(MetricsExtractor extractor, int threads) {
        this.extractor = extractor;
        this.threads = Math.max(1, threads);
    }

    public MetricsTable build(Map<Integer, ? extends FactNode> documentsByYear) {
        if (documentsByYear == null || documentsByYear.isEmpty()) {
            return MetricsTable.empty();
        }
        Map<Integer, FactNode> ordered = new TreeMap<>(documentsByYear);
        List<MetricRecord> rows = threads == 1 || ordered.size() == 1
                ? extractSequential(ordered)
                : extractParallel(ordered);
        MetricsTable table = MetricsTable.of(rows);
        LOG.info("history built years={} skipped={}", table.years(), ordered.size() - table.size());
        return table;
    }

    private List<MetricRecord> extractSequential(Map<Integer, FactNode> ordered) {
        List<MetricRecord> rows = new ArrayList<>();
        for (Map.Entry<Integer, FactNode> e : ordered.entrySet()) {
            MetricRecord row = extractOne(e.getKey(), e.getValue());
            if (row != null) {
                rows.add(row);
            }
        }
        return rows;
    }

    private List<MetricRecord> extractParallel(Map<Integer, FactNode> ordered) {
        int poolSize = Math.min(threads, ordered.size());
        ExecutorService pool = Executors.newFixedThreadPool(poolSize);
        CompletionService<MetricRecord> completion = new ExecutorCompletionService<>(pool);
        List<MetricRecord> rows = new ArrayList<>();
        int submitted = 0;
        try {
            for (Map.Entry<Integer, FactNode> e : ordered.entrySet()) {
                int year = e.getKey();
                FactNode document = e.getValue();
                completion.submit(() -> extractOne(year, document));
                submitted++;
            }
            for (int i = 0; i < submitted; i++) {
                Future<MetricRecord> future = completion.take();
                try {
                    MetricRecord row = future.get();
                    if (row != null) {
                        rows.add(row);
                    }
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() == null ? e : e.getCause();
                    LOG.warn("year extraction task failed err={}", cause.getMessage());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("history extraction interrupted after {} rows", rows.size());
        } finally {
            pool.shutdown();
        }
        return rows;
    }

    private MetricRecord extractOne(int year, FactNode document) {
        try {
            Outcome<MetricRecord> outcome = extractor.extractYear(document, year);
            if (!outcome.success) {
                LOG.warn("skipping year={} reason={}", year, outcome.describe());
                return null;
            }
            return outcome.value;
        } catch (RuntimeException e) {
            LOG.warn("skipping year={} err={}", year, e.toString());
            return null;
        }
    }
}
