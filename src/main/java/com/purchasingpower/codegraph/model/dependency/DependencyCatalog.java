package com.purchasingpower.codegraph.model.dependency;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Coordinate to version map built from every manifest of a tree.
 *
 * <p>Keys come in the granularities {@code group.artifact},
 * {@code group:artifact} and {@code group:artifact:version}; Gradle
 * coordinates also contribute their bare group. The first value recorded for
 * a key wins, so callers control precedence by the order they add manifests.
 */
public class DependencyCatalog {

    private final Map<String, String> versions = new LinkedHashMap<>();
    private final List<Coordinate> coordinates = new ArrayList<>();

    public void add(Coordinate coordinate, ManifestFormat format) {
        if (!coordinate.hasVersion()) {
            return;
        }
        coordinates.add(coordinate);
        String version = coordinate.version();
        versions.putIfAbsent(coordinate.packageKey(), version);
        versions.putIfAbsent(coordinate.groupArtifactKey(), version);
        versions.putIfAbsent(coordinate.gavKey(), version);
        if (format == ManifestFormat.GRADLE) {
            versions.putIfAbsent(coordinate.group(), version);
        }
    }

    public void addAll(List<Coordinate> found, ManifestFormat format) {
        found.forEach(coordinate -> add(coordinate, format));
    }

    public List<Coordinate> getCoordinates() {
        return Collections.unmodifiableList(coordinates);
    }

    /**
     * Flat map in the serialized artifact shape.
     */
    public Map<String, String> toVersionMap() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(versions));
    }

    public int size() {
        return versions.size();
    }
}
