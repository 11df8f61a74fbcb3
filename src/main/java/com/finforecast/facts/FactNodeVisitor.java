package com.finforecast.facts;

public interface FactNodeVisitor<R> {

    R visitScalar(ScalarNode node);

    R visitList(ListNode node);

    R visitMapping(MappingNode node);
}
