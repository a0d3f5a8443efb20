package com.purchasingpower.codegraph.extraction.impl;

import com.purchasingpower.codegraph.configuration.CodeGraphProperties;
import com.purchasingpower.codegraph.extraction.SourceWalker;
import com.purchasingpower.codegraph.model.dependency.ManifestFormat;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * File system walker. Skips excluded directory names at any depth.
 */
@Slf4j
@Service
public class SourceWalkerImpl implements SourceWalker {

    private static final Set<String> SKIPPED_SOURCES = Set.of("package-info.java", "module-info.java");

    private final Set<String> excludedDirs;

    @Autowired
    public SourceWalkerImpl(CodeGraphProperties properties) {
        this(properties.getExtraction().getExcludeDirs());
    }

    public SourceWalkerImpl(List<String> excludedDirs) {
        this.excludedDirs = Set.copyOf(excludedDirs);
    }

    @Override
    public List<Path> listSourceFiles(Path root) {
        List<Path> files = walk(root, p -> {
            String name = p.getFileName().toString();
            return name.endsWith(".java") && !SKIPPED_SOURCES.contains(name);
        });
        log.info("Found {} Java files under {}", files.size(), root);
        return files;
    }

    @Override
    public List<Path> listBuildManifests(Path root) {
        List<Path> manifests = walk(root, p -> ManifestFormat.of(p.getFileName().toString()) != null);
        log.info("Found {} build manifests under {}", manifests.size(), root);
        return manifests;
    }

    private List<Path> walk(Path root, Predicate<Path> accept) {
        if (!Files.isDirectory(root)) {
            throw new IllegalArgumentException("Source root is not a directory: " + root);
        }
        try (Stream<Path> walk = Files.walk(root)) {
            return walk
                    .filter(Files::isRegularFile)
                    .filter(p -> !isExcluded(root, p))
                    .filter(accept)
                    .sorted(Comparator.comparing(p -> SourceWalker.relativePath(root, p)))
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to walk " + root, e);
        }
    }

    private boolean isExcluded(Path root, Path file) {
        Path relative = root.relativize(file).getParent();
        if (relative == null) {
            return false;
        }
        for (Path segment : relative) {
            if (excludedDirs.contains(segment.toString())) {
                return true;
            }
        }
        return false;
    }
}
