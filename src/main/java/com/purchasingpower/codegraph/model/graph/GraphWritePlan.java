package com.purchasingpower.codegraph.model.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered statements of a write run. Statements with no rows are not kept.
 */
public class GraphWritePlan {

    private final List<PlannedStatement> statements = new ArrayList<>();

    public void add(PlannedStatement statement) {
        if (!statement.rows().isEmpty()) {
            statements.add(statement);
        }
    }

    public List<PlannedStatement> getStatements() {
        return Collections.unmodifiableList(statements);
    }

    public PlannedStatement find(String step) {
        return statements.stream()
                .filter(s -> s.step().equals(step))
                .findFirst()
                .orElse(null);
    }

    public int totalRows() {
        return statements.stream().mapToInt(s -> s.rows().size()).sum();
    }
}
