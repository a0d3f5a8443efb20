package com.purchasingpower.codegraph.storage;

import java.util.List;

/**
 * A named property index created alongside the managed constraints.
 * Indexes only speed up queries over the graph, so none of them is required.
 */
public record IndexDefinition(String name, String cypher) {

    private static final List<IndexDefinition> PROPERTY_INDEXES = List.of(
            of("class_estimated_lines", "FOR (c:Class) ON (c.estimated_lines)"),
            of("interface_method_count", "FOR (i:Interface) ON (i.method_count)"),
            of("method_estimated_lines", "FOR (m:Method) ON (m.estimated_lines)"),
            of("method_is_public", "FOR (m:Method) ON (m.is_public)"),
            of("method_is_static", "FOR (m:Method) ON (m.is_static)"),
            of("method_is_abstract", "FOR (m:Method) ON (m.is_abstract)"));

    public static List<IndexDefinition> propertyIndexes() {
        return PROPERTY_INDEXES;
    }

    private static IndexDefinition of(String name, String body) {
        return new IndexDefinition(name, "CREATE INDEX " + name + " IF NOT EXISTS " + body);
    }
}
