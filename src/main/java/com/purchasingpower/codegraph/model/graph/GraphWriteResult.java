package com.purchasingpower.codegraph.model.graph;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * What the writer sent to the store.
 */
@Value
@Builder
public class GraphWriteResult {
    int batchesWritten;
    int rowsWritten;
    Map<String, Integer> rowsByStep;
    long durationMs;
}
