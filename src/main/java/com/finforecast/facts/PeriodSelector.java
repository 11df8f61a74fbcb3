package com.finforecast.facts;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Picks the annual figure for one fiscal year out of the candidates tagged for a concept.
 * Filings carry quarterly and multi-year disclosures under the same tag, so candidates are
 * narrowed to the target end year and a duration of at most one year, then ranked by shortest
 * duration and most recent filing.
 */
public final class PeriodSelector {
    static final int MAX_DURATION_YEARS = 1;

    private static final Comparator<CandidateFact> RANKING = Comparator
            .comparingInt(CandidateFact::durationYears)
            .thenComparing(c -> c.filed, Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(c -> c.endDate, Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparingInt(c -> c.ordinal);

    private PeriodSelector() {
    }

    /**
     * Accepts a list of records or a single record mapping. Anything else has no candidates.
     */
    public static Double select(FactNode candidates, int targetYear) {
        CandidateFact best = best(parse(candidates), targetYear);
        return best == null ? null : best.value;
    }

    public static CandidateFact best(List<CandidateFact> candidates, int targetYear) {
        CandidateFact best = null;
        for (CandidateFact c : candidates) {
            if (!c.usable() || c.endYear != targetYear || c.durationYears() > MAX_DURATION_YEARS) {
                continue;
            }
            if (best == null || RANKING.compare(c, best) < 0) {
                best = c;
            }
        }
        return best;
    }

    static List<CandidateFact> parse(FactNode node) {
        List<CandidateFact> out = new ArrayList<>();
        if (node instanceof MappingNode) {
            MappingNode record = (MappingNode) node;
            if (isRecord(record)) {
                out.add(CandidateFact.fromRecord(record, 0));
            }
            return out;
        }
        if (!(node instanceof ListNode)) {
            return out;
        }
        int ordinal = 0;
        for (FactNode item : ((ListNode) node).items) {
            if (item instanceof MappingNode && isRecord((MappingNode) item)) {
                out.add(CandidateFact.fromRecord((MappingNode) item, ordinal));
            }
            ordinal++;
        }
        return out;
    }

    static boolean isRecord(MappingNode node) {
        return node.has("value") || node.has("val");
    }
}
