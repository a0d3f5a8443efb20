package com.purchasingpower.codegraph.dependency.impl;

import com.purchasingpower.codegraph.dependency.DependencyCoordinateExtractor;
import com.purchasingpower.codegraph.dependency.ManifestParser;
import com.purchasingpower.codegraph.exception.ManifestParseException;
import com.purchasingpower.codegraph.extraction.SourceWalker;
import com.purchasingpower.codegraph.model.dependency.Coordinate;
import com.purchasingpower.codegraph.model.dependency.DependencyCatalog;
import com.purchasingpower.codegraph.model.dependency.ManifestFormat;
import com.purchasingpower.codegraph.model.extraction.ExtractionErrors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Merges all manifests of a tree into one catalog.
 *
 * <p>Precedence is fixed: every Maven manifest is read before any Gradle
 * manifest, each format in path order, and the first version recorded for a
 * key is kept. The outcome does not depend on file system traversal order.
 */
@Slf4j
@Service
public class DependencyCoordinateExtractorImpl implements DependencyCoordinateExtractor {

    private final SourceWalker sourceWalker;
    private final Map<ManifestFormat, ManifestParser> parsers = new EnumMap<>(ManifestFormat.class);

    public DependencyCoordinateExtractorImpl(SourceWalker sourceWalker, List<ManifestParser> parsers) {
        this.sourceWalker = sourceWalker;
        parsers.forEach(parser -> this.parsers.put(parser.format(), parser));
    }

    @Override
    public DependencyCatalog extract(Path root, ExtractionErrors errors) {
        return extract(root, sourceWalker.listBuildManifests(root), errors);
    }

    @Override
    public DependencyCatalog extract(Path root, List<Path> manifests, ExtractionErrors errors) {
        DependencyCatalog catalog = new DependencyCatalog();

        List<Path> ordered = manifests.stream()
                .filter(path -> formatOf(path) != null)
                .sorted(Comparator.comparing((Path path) -> formatOf(path))
                        .thenComparing(path -> SourceWalker.relativePath(root, path)))
                .toList();

        for (Path manifest : ordered) {
            String relativePath = SourceWalker.relativePath(root, manifest);
            ManifestFormat format = formatOf(manifest);
            ManifestParser parser = parsers.get(format);
            if (parser == null) {
                log.warn("⚠️  No parser registered for {} manifests, skipping {}", format, relativePath);
                continue;
            }
            try {
                String content = Files.readString(manifest, StandardCharsets.UTF_8);
                List<Coordinate> coordinates = parser.parse(relativePath, content);
                catalog.addAll(coordinates, format);
                log.debug("{}: {} coordinates ({})", relativePath, coordinates.size(), format);
            } catch (IOException e) {
                log.warn("⚠️  Failed to read manifest {}: {}", relativePath, e.getMessage());
                errors.record(relativePath, "Failed to read manifest: " + e.getMessage());
            } catch (ManifestParseException e) {
                log.warn("⚠️  {}", e.getMessage());
                errors.record(relativePath, e.getMessage());
            }
        }

        log.info("📦 Dependency catalog: {} coordinates, {} keys from {} manifests",
                catalog.getCoordinates().size(), catalog.size(), ordered.size());
        return catalog;
    }

    private static ManifestFormat formatOf(Path manifest) {
        return ManifestFormat.of(manifest.getFileName().toString());
    }
}
