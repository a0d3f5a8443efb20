package com.purchasingpower.codegraph.extraction;

import com.purchasingpower.codegraph.model.extraction.ExtractionResult;

import java.nio.file.Path;
import java.util.List;

/**
 * Runs the declaration extractor over many files in parallel.
 */
public interface ExtractionService {

    /**
     * Extract every Java source file under a root.
     *
     * @param root Source tree root
     * @return Records ordered by path plus the soft errors of the run
     */
    ExtractionResult extractAll(Path root);

    /**
     * Extract the given files.
     *
     * @param root Source tree root the files live under
     * @param files Absolute file paths
     */
    ExtractionResult extractFiles(Path root, List<Path> files);
}
