package com.purchasingpower.codegraph.storage;

import com.purchasingpower.codegraph.model.graph.EmbeddingSet;
import com.purchasingpower.codegraph.model.graph.GraphStatistics;
import com.purchasingpower.codegraph.model.graph.GraphWriteResult;
import com.purchasingpower.codegraph.model.source.FileRecord;

import java.util.List;
import java.util.Map;

/**
 * Writes extracted files into the graph store with idempotent, batched upserts.
 */
public interface GraphWriter {

    /**
     * Validate, check the schema, then write every node and relationship.
     * Nothing is written when validation or the schema check fails. Store
     * failures propagate without retry.
     *
     * @param files extracted files, in the order embeddings are aligned with
     * @param versions coordinate to version map of the tree
     * @param embeddings optional vectors for files and methods
     */
    GraphWriteResult write(List<FileRecord> files, Map<String, String> versions, EmbeddingSet embeddings);

    /**
     * Node and relationship totals currently in the store.
     */
    GraphStatistics countGraph();
}
