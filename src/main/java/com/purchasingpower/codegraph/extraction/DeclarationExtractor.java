package com.purchasingpower.codegraph.extraction;

import com.purchasingpower.codegraph.model.extraction.FileOutcome;

/**
 * Parses one source file into a {@link com.purchasingpower.codegraph.model.source.FileRecord}.
 *
 * <p>Implementations are pure functions of their input and hold no state
 * between calls, so one instance is shared by all extraction workers.
 */
public interface DeclarationExtractor {

    /**
     * Extract declarations, imports, calls, docs and metrics from a file.
     *
     * @param relativePath Path relative to the source root, '/' separated
     * @param source Raw file content
     * @return Parsed record, or a parse error that names the path
     */
    FileOutcome extract(String relativePath, String source);
}
