package com.purchasingpower.codegraph.extraction;

import java.nio.file.Path;
import java.util.List;

/**
 * Enumerates the inputs of a run under a source root.
 *
 * <p>Both lists are ordered by path relative to the root, so repeated walks
 * of an unchanged tree return identical lists.
 */
public interface SourceWalker {

    /**
     * List Java source files under the root.
     *
     * @param root Source tree root
     * @return Absolute paths, ordered by relative path
     */
    List<Path> listSourceFiles(Path root);

    /**
     * List supported build manifests (pom.xml, build.gradle, build.gradle.kts).
     *
     * @param root Source tree root
     * @return Absolute paths, ordered by relative path
     */
    List<Path> listBuildManifests(Path root);

    /**
     * Path of a file relative to the root, '/' separated on every platform.
     */
    static String relativePath(Path root, Path file) {
        return root.relativize(file).toString().replace('\\', '/');
    }
}
