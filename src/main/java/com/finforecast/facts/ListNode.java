package com.finforecast.facts;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class ListNode implements FactNode {
    public final List<FactNode> items;

    public ListNode(List<FactNode> items) {
        List<FactNode> copy = new ArrayList<>();
        if (items != null) {
            for (FactNode item : items) {
                copy.add(item == null ? ScalarNode.of(null) : item);
            }
        }
        this.items = Collections.unmodifiableList(copy);
    }

    public int size() {
        return items.size();
    }

    @Override
    public boolean isContainer() {
        return true;
    }

    @Override
    public <R> R accept(FactNodeVisitor<R> visitor) {
        return visitor.visitList(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ListNode && items.equals(((ListNode) o).items);
    }

    @Override
    public int hashCode() {
        return items.hashCode();
    }

    @Override
    public String toString() {
        return items.toString();
    }
}
