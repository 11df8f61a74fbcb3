package com.finforecast.facts;

/**
 * One node of a fact document: a {@link ScalarNode}, a {@link ListNode} or a {@link MappingNode}.
 * Trees are built once and never mutated, so every child is strictly smaller than its parent.
 */
public interface FactNode {

    <R> R accept(FactNodeVisitor<R> visitor);

    default boolean isContainer() {
        return false;
    }
}
