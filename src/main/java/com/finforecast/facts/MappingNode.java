package com.finforecast.facts;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Keyed children in document order.
 */
public final class MappingNode implements FactNode {
    public final Map<String, FactNode> entries;

    public MappingNode(Map<String, FactNode> entries) {
        Map<String, FactNode> copy = new LinkedHashMap<>();
        if (entries != null) {
            for (Map.Entry<String, FactNode> e : entries.entrySet()) {
                if (e.getKey() == null) {
                    continue;
                }
                copy.put(e.getKey(), e.getValue() == null ? ScalarNode.of(null) : e.getValue());
            }
        }
        this.entries = Collections.unmodifiableMap(copy);
    }

    public FactNode get(String key) {
        return entries.get(key);
    }

    public boolean has(String key) {
        return entries.containsKey(key);
    }

    public Set<String> keys() {
        return entries.keySet();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * Text of a scalar child, or {@code null} when the child is absent, null or not a scalar.
     */
    public String text(String key) {
        FactNode node = entries.get(key);
        if (!(node instanceof ScalarNode)) {
            return null;
        }
        Object value = ((ScalarNode) node).value;
        if (value == null) {
            return null;
        }
        String s = value.toString().trim();
        return s.isEmpty() ? null : s;
    }

    @Override
    public boolean isContainer() {
        return true;
    }

    @Override
    public <R> R accept(FactNodeVisitor<R> visitor) {
        return visitor.visitMapping(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof MappingNode && entries.equals(((MappingNode) o).entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return entries.toString();
    }
}
