package com.purchasingpower.codegraph.configuration;

import lombok.Data;

@Data
public class SchemaProperties {

    /**
     * Also manage property existence constraints. Requires Neo4j Enterprise.
     */
    private boolean existenceConstraints;
}
