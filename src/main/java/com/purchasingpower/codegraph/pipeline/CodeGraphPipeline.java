package com.purchasingpower.codegraph.pipeline;

import com.purchasingpower.codegraph.model.graph.EmbeddingSet;

import java.nio.file.Path;

/**
 * End-to-end graph build: walk, extract, read manifests, write.
 */
public interface CodeGraphPipeline {

    /**
     * Build the graph for a source tree.
     *
     * @param root source tree root
     * @param embeddings vectors aligned with the extracted files and methods, may be empty
     * @return counts of the run; a failed schema or record check yields a failure report
     */
    PipelineReport run(Path root, EmbeddingSet embeddings);

    /**
     * Write a graph from artifacts saved by an earlier extraction.
     */
    PipelineReport writeFromArtifacts(Path artifactDirectory);
}
