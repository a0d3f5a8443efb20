package com.purchasingpower.codegraph.model.extraction;

import com.purchasingpower.codegraph.model.source.FileRecord;
import com.purchasingpower.codegraph.model.source.MethodRecord;

import java.util.List;

/**
 * Aggregated extraction output. Files are ordered by path; embedding arrays
 * are index-aligned with {@link #files()} and {@link #flattenedMethods()}.
 */
public record ExtractionResult(List<FileRecord> files, ExtractionErrors errors, int filesDiscovered) {

    public List<MethodRecord> flattenedMethods() {
        return files.stream()
                .flatMap(file -> file.getMethods().stream())
                .toList();
    }
}
