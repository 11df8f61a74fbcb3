package com.finforecast.facts;

import java.util.Map;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Depth-first search over a fact tree. A key accepted by {@code keyMatch} has its child handed to
 * {@code resolver}; the first non-null result ends the search. Containers that did not resolve are
 * searched further. Each step descends into a child, so the walk ends after at most one visit per
 * node.
 */
public final class FactTreeSearch implements FactNodeVisitor<Double> {
    private final Predicate<String> keyMatch;
    private final Function<FactNode, Double> resolver;

    private FactTreeSearch(Predicate<String> keyMatch, Function<FactNode, Double> resolver) {
        this.keyMatch = keyMatch;
        this.resolver = resolver;
    }

    public static Double findFirst(FactNode root, Predicate<String> keyMatch, Function<FactNode, Double> resolver) {
        if (root == null) {
            return null;
        }
        return root.accept(new FactTreeSearch(keyMatch, resolver));
    }

    @Override
    public Double visitScalar(ScalarNode node) {
        return null;
    }

    @Override
    public Double visitList(ListNode node) {
        for (FactNode item : node.items) {
            if (!item.isContainer()) {
                continue;
            }
            Double found = item.accept(this);
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    @Override
    public Double visitMapping(MappingNode node) {
        for (Map.Entry<String, FactNode> e : node.entries.entrySet()) {
            FactNode child = e.getValue();
            if (keyMatch.test(e.getKey())) {
                Double resolved = resolver.apply(child);
                if (resolved != null) {
                    return resolved;
                }
            }
            if (child.isContainer()) {
                Double found = child.accept(this);
                if (found != null) {
                    return found;
                }
            }
        }
        return null;
    }
}
