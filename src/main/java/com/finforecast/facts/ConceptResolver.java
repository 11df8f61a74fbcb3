package com.finforecast.facts;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Finds the value of one canonical metric for one fiscal year inside a nested fact document.
 * <p>
 * Priority sections are searched first, then every top-level section whose name starts with a
 * statement-like prefix. Within a section, aliases are tried in the caller's order and the first
 * alias that yields a value wins. A metric that is not found resolves to {@code null}.
 */
public final class ConceptResolver {
    private static final Logger LOG = LogManager.getLogger(ConceptResolver.class);

    public static final List<String> DEFAULT_SECTION_PREFIXES = List.of(
            "Statements",
            "Revenue",
            "EarningsPerShare",
            "CashFlow",
            "BalanceSheet"
    );

    private final List<String> sectionPrefixes;

    public ConceptResolver() {
        this(DEFAULT_SECTION_PREFIXES);
    }

    public ConceptResolver(List<String> sectionPrefixes) {
        this.sectionPrefixes = sectionPrefixes == null ? List.of() : List.copyOf(sectionPrefixes);
    }

    public Double resolve(MappingNode document, List<String> aliases, int fiscalYear, List<String> prioritySections) {
        if (document == null || aliases == null || aliases.isEmpty()) {
            return null;
        }
        if (prioritySections != null) {
            for (String section : prioritySections) {
                FactNode sectionNode = document.get(section);
                if (sectionNode == null) {
                    continue;
                }
                Double found = searchSection(sectionNode, aliases, fiscalYear);
                if (found != null) {
                    LOG.debug("resolved aliases={} year={} section={} value={}", aliases.get(0), fiscalYear, section, found);
                    return found;
                }
            }
        }
        for (Map.Entry<String, FactNode> e : document.entries.entrySet()) {
            if (!isStatementSection(e.getKey())) {
                continue;
            }
            Double found = searchSection(e.getValue(), aliases, fiscalYear);
            if (found != null) {
                LOG.debug("resolved aliases={} year={} fallback_section={} value={}", aliases.get(0), fiscalYear, e.getKey(), found);
                return found;
            }
        }
        LOG.debug("not found aliases={} year={}", aliases, fiscalYear);
        return null;
    }

    /**
     * Lookup for documents whose top level is the concept tags themselves.
     */
    public Double resolveTopLevel(MappingNode document, List<String> aliases, int fiscalYear) {
        if (document == null || aliases == null) {
            return null;
        }
        for (String alias : aliases) {
            for (Map.Entry<String, FactNode> e : document.entries.entrySet()) {
                if (!matchesAlias(e.getKey(), alias)) {
                    continue;
                }
                Double found = valueOf(e.getValue(), fiscalYear);
                if (found != null) {
                    return found;
                }
            }
        }
        return null;
    }

    public boolean isStatementSection(String name) {
        if (name == null) {
            return false;
        }
        for (String prefix : sectionPrefixes) {
            if (name.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    public boolean hasStatementSections(MappingNode document, Collection<String> knownSections) {
        for (Map.Entry<String, FactNode> e : document.entries.entrySet()) {
            if (!e.getValue().isContainer()) {
                continue;
            }
            if (knownSections.contains(e.getKey()) || isStatementSection(e.getKey())) {
                return true;
            }
        }
        return false;
    }

    private Double searchSection(FactNode section, List<String> aliases, int fiscalYear) {
        for (String alias : aliases) {
            Double found = FactTreeSearch.findFirst(
                    section,
                    key -> matchesAlias(key, alias),
                    child -> valueOf(child, fiscalYear)
            );
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    /**
     * Value held under a matched tag. Lists and dated records go through period selection; a bare
     * scalar or an undated {@code value/val} record is taken as is. Anything else is {@code null},
     * which lets the search descend further.
     */
    static Double valueOf(FactNode child, int fiscalYear) {
        if (child instanceof ListNode) {
            return PeriodSelector.select(child, fiscalYear);
        }
        if (child instanceof ScalarNode) {
            return ValueNormalizer.normalize(child);
        }
        if (child instanceof MappingNode && PeriodSelector.isRecord((MappingNode) child)) {
            MappingNode record = (MappingNode) child;
            return isDated(record) ? PeriodSelector.select(record, fiscalYear) : ValueNormalizer.normalize(record);
        }
        return null;
    }

    private static boolean isDated(MappingNode record) {
        return record.has("period") || record.has("start") || record.has("end") || record.has("instant");
    }

    /**
     * Exact tag name, or the tag with a namespace prefix such as {@code us-gaap:Revenues}.
     */
    public static boolean matchesAlias(String key, String alias) {
        if (key == null || alias == null) {
            return false;
        }
        return key.equals(alias) || key.endsWith(":" + alias);
    }
}
