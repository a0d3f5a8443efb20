package com.purchasingpower.codegraph.dependency;

import com.purchasingpower.codegraph.model.dependency.DependencyCatalog;
import com.purchasingpower.codegraph.model.extraction.ExtractionErrors;

import java.nio.file.Path;
import java.util.List;

/**
 * Reads dependency coordinates and versions from build manifests.
 */
public interface DependencyCoordinateExtractor {

    /**
     * Scan every supported manifest under a root.
     *
     * @param root Source tree root
     * @param errors Sink for manifests that cannot be read
     * @return Catalog with Maven manifests taking precedence over Gradle ones
     */
    DependencyCatalog extract(Path root, ExtractionErrors errors);

    /**
     * Scan the given manifests.
     *
     * @param root Source tree root, used for error paths
     * @param manifests Manifest files, in any order
     * @param errors Sink for manifests that cannot be read
     */
    DependencyCatalog extract(Path root, List<Path> manifests, ExtractionErrors errors);
}
