package com.purchasingpower.codegraph.model.graph;

/**
 * Node and relationship totals of the store.
 */
public record GraphStatistics(long nodeCount, long relationshipCount) {
}
