package com.purchasingpower.codegraph.model.graph;

import java.util.List;

/**
 * Externally produced vectors. {@code fileVectors} is index-aligned with the
 * file list, {@code methodVectors} with the flattened method list. Either may
 * be empty.
 */
public record EmbeddingSet(List<List<Float>> fileVectors, List<List<Float>> methodVectors) {

    public EmbeddingSet {
        fileVectors = fileVectors == null ? List.of() : fileVectors;
        methodVectors = methodVectors == null ? List.of() : methodVectors;
    }

    public static EmbeddingSet empty() {
        return new EmbeddingSet(List.of(), List.of());
    }

    public boolean isEmpty() {
        return fileVectors.isEmpty() && methodVectors.isEmpty();
    }
}
