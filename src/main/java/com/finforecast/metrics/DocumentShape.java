package com.finforecast.metrics;

import com.finforecast.facts.ConceptResolver;
import com.finforecast.facts.FactNode;
import com.finforecast.facts.MappingNode;
import com.finforecast.facts.ScalarNode;

import java.util.Collection;

/**
 * How a fact document is laid out, which decides the lookup strategy.
 */
public enum DocumentShape {
    /** Every top-level value is a plain number keyed by tag. */
    FLAT_NUMERIC,
    /** Tags at the top level, each holding candidate records. */
    TAGGED_SERIES,
    /** Statement sections holding nested tags. */
    SECTIONED;

    public static DocumentShape detect(MappingNode document, ConceptResolver resolver, Collection<String> knownSections) {
        boolean allNumbers = true;
        for (FactNode value : document.entries.values()) {
            if (!(value instanceof ScalarNode) || !((ScalarNode) value).isNumber()) {
                allNumbers = false;
                break;
            }
        }
        if (allNumbers) {
            return FLAT_NUMERIC;
        }
        if (!resolver.hasStatementSections(document, knownSections)) {
            return TAGGED_SERIES;
        }
        return SECTIONED;
    }
}
