package com.purchasingpower.codegraph.storage;

import java.util.List;

/**
 * Preflight check of the graph schema. Runs before the first data write.
 */
public interface SchemaGuard {

    /**
     * Verify the managed constraints, creating the full set once if any is
     * absent.
     *
     * @throws com.purchasingpower.codegraph.exception.SchemaConstraintMissingException
     *         when constraints are still missing after the repair
     */
    void ensureSchema();

    /**
     * Names of managed constraints the store does not currently have.
     */
    List<String> missingConstraints();

    List<ConstraintDefinition> managedConstraints();
}
