package com.purchasingpower.codegraph.dependency;

import com.purchasingpower.codegraph.model.dependency.Coordinate;
import com.purchasingpower.codegraph.model.dependency.ResolvedDependency;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Maps an import to the external dependency that provides it.
 *
 * <p>Works on the flat coordinate-to-version map so it can run on a map loaded
 * from a dependency artifact. Keys are tried from most to least specific: full
 * {@code group:artifact:version}, then {@code group:artifact}, then dotted
 * package keys. Within a level the longest matching group wins, and among
 * artifacts of one group the one named after a package segment of the import.
 *
 * <p>Some libraries publish packages outside their group
 * ({@code com.fasterxml.jackson.databind} ships as
 * {@code com.fasterxml.jackson.core:jackson-databind}). A coordinate whose group
 * sits below the import's base package matches when its artifact names one of
 * the import's package segments. After that a table of well-known libraries maps
 * package prefixes to their coordinates. Imports that match nothing still get a
 * dependency package (its first three segments) but no version.
 */
public class DependencyResolver {

    private static final int FALLBACK_SEGMENTS = 3;

    /** Ordered most specific first. */
    private static final List<KnownLibrary> KNOWN_LIBRARIES = List.of(
            new KnownLibrary("com.fasterxml.jackson.core", "com.fasterxml.jackson.core", "jackson-core"),
            new KnownLibrary("com.fasterxml.jackson.databind", "com.fasterxml.jackson.core", "jackson-databind"),
            new KnownLibrary("com.fasterxml.jackson.annotation", "com.fasterxml.jackson.core", "jackson-annotations"),
            new KnownLibrary("org.apache.kafka.clients", "org.apache.kafka", "kafka-clients"),
            new KnownLibrary("org.apache.kafka.common", "org.apache.kafka", "kafka-clients"),
            new KnownLibrary("org.slf4j", "org.slf4j", "slf4j-api"),
            new KnownLibrary("org.springframework.boot.autoconfigure", "org.springframework.boot", "spring-boot-autoconfigure"),
            new KnownLibrary("org.springframework.boot", "org.springframework.boot", "spring-boot"),
            new KnownLibrary("org.springframework.context", "org.springframework", "spring-context"),
            new KnownLibrary("org.springframework.stereotype", "org.springframework", "spring-context"),
            new KnownLibrary("org.springframework.beans", "org.springframework", "spring-beans"),
            new KnownLibrary("org.springframework.kafka", "org.springframework.kafka", "spring-kafka"),
            new KnownLibrary("com.salesforce.emp", "com.pontusvision.salesforce", "emp-connector"),
            new KnownLibrary("org.cometd", "org.cometd.java", "cometd-java-client"),
            new KnownLibrary("org.HdrHistogram", "org.hdrhistogram", "HdrHistogram"),
            new KnownLibrary("org.opentest4j", "org.opentest4j", "opentest4j"),
            new KnownLibrary("org.junitpioneer", "org.junit-pioneer", "junit-pioneer"));

    private final List<Coordinate> fullCoordinates = new ArrayList<>();
    private final List<Coordinate> groupArtifacts = new ArrayList<>();
    private final Map<String, String> packageKeys = new TreeMap<>();

    public DependencyResolver(Map<String, String> versionMap) {
        // sorted keys keep tie-breaking independent of map iteration order
        new TreeMap<>(versionMap).forEach((key, version) -> {
            long colons = key.chars().filter(c -> c == ':').count();
            if (colons == 2) {
                fullCoordinates.add(Coordinate.parse(key, version));
            } else if (colons == 1) {
                groupArtifacts.add(Coordinate.parse(key, version));
            } else if (colons == 0) {
                packageKeys.put(key, version);
            }
        });
    }

    /**
     * Resolve the dependency for an import path.
     *
     * @param importPath Imported name, e.g. {@code com.fasterxml.jackson.core.JsonFactory}
     */
    public ResolvedDependency resolve(String importPath) {
        String pkg = packageOf(importPath);

        Optional<Coordinate> full = longestGroupMatch(fullCoordinates, pkg);
        if (full.isPresent()) {
            Coordinate c = full.get();
            return new ResolvedDependency(c.group(), c.group(), c.artifact(), c.version());
        }

        Optional<Coordinate> groupArtifact = longestGroupMatch(groupArtifacts, pkg);
        if (groupArtifact.isPresent()) {
            Coordinate c = groupArtifact.get();
            return new ResolvedDependency(c.group(), c.group(), c.artifact(), c.version());
        }

        Optional<Coordinate> related = artifactMatch(fullCoordinates, pkg).or(() -> artifactMatch(groupArtifacts, pkg));
        if (related.isPresent()) {
            Coordinate c = related.get();
            return new ResolvedDependency(c.group(), c.group(), c.artifact(), c.version());
        }

        String bestKey = null;
        for (String key : packageKeys.keySet()) {
            if (isPackagePrefix(key, pkg) && (bestKey == null || key.length() > bestKey.length())) {
                bestKey = key;
            }
        }
        if (bestKey != null) {
            return new ResolvedDependency(bestKey, null, null, packageKeys.get(bestKey));
        }

        for (KnownLibrary library : KNOWN_LIBRARIES) {
            if (isPackagePrefix(library.packagePrefix(), pkg)) {
                return new ResolvedDependency(library.group(), library.group(), library.artifact(),
                        versionOf(library.group(), library.artifact()));
            }
        }

        return new ResolvedDependency(fallbackPackage(pkg), null, null, null);
    }

    /**
     * Package part of an import: segments before the first capitalized one.
     */
    public static String packageOf(String importPath) {
        String[] segments = importPath.split("\\.");
        StringBuilder pkg = new StringBuilder();
        for (String segment : segments) {
            if (segment.isEmpty() || Character.isUpperCase(segment.charAt(0)) || "*".equals(segment)) {
                break;
            }
            if (pkg.length() > 0) {
                pkg.append('.');
            }
            pkg.append(segment);
        }
        return pkg.length() == 0 ? importPath : pkg.toString();
    }

    private static String fallbackPackage(String pkg) {
        String[] segments = pkg.split("\\.");
        if (segments.length <= FALLBACK_SEGMENTS) {
            return pkg;
        }
        return String.join(".", Arrays.copyOf(segments, FALLBACK_SEGMENTS));
    }

    private String versionOf(String group, String artifact) {
        return fullCoordinates.stream()
                .filter(c -> c.group().equals(group) && c.artifact().equals(artifact))
                .findFirst()
                .or(() -> groupArtifacts.stream()
                        .filter(c -> c.group().equals(group) && c.artifact().equals(artifact))
                        .findFirst())
                .map(Coordinate::version)
                .orElse(null);
    }

    private static Optional<Coordinate> longestGroupMatch(List<Coordinate> coordinates, String pkg) {
        return coordinates.stream()
                .filter(c -> isPackagePrefix(c.group(), pkg))
                .max(Comparator.comparingInt((Coordinate c) -> c.group().length())
                        .thenComparing(c -> pkg.startsWith(c.group() + "." + c.artifact()))
                        .thenComparing(c -> namesPackageSegment(c.artifact(), pkg)));
    }

    /**
     * Coordinates whose group lies below the import's base package and whose
     * artifact names one of the import's deeper package segments.
     */
    private static Optional<Coordinate> artifactMatch(List<Coordinate> coordinates, String pkg) {
        String base = fallbackPackage(pkg);
        return coordinates.stream()
                .filter(c -> isPackagePrefix(base, c.group()) && namesPackageSegment(c.artifact(), pkg))
                .max(Comparator.comparingInt((Coordinate c) -> c.group().length()));
    }

    /**
     * Whether the artifact name contains a package segment past the first three,
     * e.g. {@code jackson-databind} for {@code com.fasterxml.jackson.databind}.
     */
    static boolean namesPackageSegment(String artifact, String pkg) {
        String[] segments = pkg.split("\\.");
        String name = artifact.toLowerCase(Locale.ROOT);
        for (int i = FALLBACK_SEGMENTS; i < segments.length; i++) {
            if (name.contains(segments[i].toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    /**
     * Whether {@code prefix} equals {@code pkg} or is one of its leading package segments.
     */
    static boolean isPackagePrefix(String prefix, String pkg) {
        return pkg.equals(prefix) || pkg.startsWith(prefix + ".");
    }

    private record KnownLibrary(String packagePrefix, String group, String artifact) {
    }
}
