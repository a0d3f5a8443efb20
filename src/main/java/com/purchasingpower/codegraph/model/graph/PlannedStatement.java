package com.purchasingpower.codegraph.model.graph;

import java.util.List;
import java.util.Map;

/**
 * One UNWIND statement of the write phase and all rows it applies to.
 * The writer splits {@code rows} into batches.
 *
 * @param step name used in logs and reports
 * @param cypher statement reading its rows from {@code $rows}
 * @param rows parameter maps, one per node or relationship
 * @param carriesEmbeddings whether rows hold vectors, which selects the smaller batch size
 */
public record PlannedStatement(String step, String cypher, List<Map<String, Object>> rows, boolean carriesEmbeddings) {
}
