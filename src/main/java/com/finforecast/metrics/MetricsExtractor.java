package com.finforecast.metrics;

import com.finforecast.core.diagnostics.CauseCode;
import com.finforecast.core.diagnostics.Outcome;
import com.finforecast.facts.ConceptResolver;
import com.finforecast.facts.FactNode;
import com.finforecast.facts.MappingNode;
import com.finforecast.facts.ValueNormalizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Map;
import java.util.Set;

/**
 * Builds one year's metric row from one fact document. Stateless; safe to share across threads.
 */
public class MetricsExtractor {
    private static final Logger LOG = LogManager.getLogger(MetricsExtractor.class);
    private static final String OWNER = "metrics.extract";

    public static final int MIN_FISCAL_YEAR = 1900;
    public static final int MAX_FISCAL_YEAR = 2100;

    private final ConceptResolver resolver;
    private final Set<String> knownSections;

    public MetricsExtractor() {
        this(new ConceptResolver());
    }

    public MetricsExtractor(ConceptResolver resolver) {
        this.resolver = resolver;
        this.knownSections = CanonicalMetric.knownSections();
    }

    public Outcome<MetricRecord> extractYear(FactNode document, int fiscalYear) {
        if (fiscalYear < MIN_FISCAL_YEAR || fiscalYear > MAX_FISCAL_YEAR) {
            return Outcome.failure(CauseCode.FISCAL_YEAR_OUT_OF_RANGE, OWNER, Map.of(
                    "fiscal_year", fiscalYear,
                    "min", MIN_FISCAL_YEAR,
                    "max", MAX_FISCAL_YEAR
            ));
        }
        if (!(document instanceof MappingNode)) {
            return Outcome.failure(CauseCode.DOCUMENT_NOT_MAPPING, OWNER, Map.of(
                    "fiscal_year", fiscalYear,
                    "document", document == null ? "null" : document.getClass().getSimpleName()
            ));
        }
        MappingNode doc = (MappingNode) document;
        DocumentShape shape = DocumentShape.detect(doc, resolver, knownSections);
        MetricRecord.Builder row = MetricRecord.builder(fiscalYear);
        for (CanonicalMetric metric : CanonicalMetric.values()) {
            row.put(metric.metric, lookup(shape, doc, metric, fiscalYear));
        }
        DerivedMetrics.apply(row);
        MetricRecord record = row.build();
        LOG.debug("extracted year={} shape={} metrics={}", fiscalYear, shape, record.values().size());
        return Outcome.success(record, OWNER);
    }

    private Double lookup(DocumentShape shape, MappingNode doc, CanonicalMetric metric, int fiscalYear) {
        switch (shape) {
            case FLAT_NUMERIC:
                return flatLookup(doc, metric);
            case TAGGED_SERIES:
                return resolver.resolveTopLevel(doc, metric.aliases, fiscalYear);
            default:
                return resolver.resolve(doc, metric.aliases, fiscalYear, metric.prioritySections);
        }
    }

    private static Double flatLookup(MappingNode doc, CanonicalMetric metric) {
        for (String alias : metric.aliases) {
            FactNode node = doc.get(alias);
            if (node != null) {
                return ValueNormalizer.normalize(node);
            }
        }
        return null;
    }
}
