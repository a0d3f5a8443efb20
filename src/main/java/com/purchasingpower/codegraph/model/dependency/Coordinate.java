package com.purchasingpower.codegraph.model.dependency;

import java.util.Objects;

/**
 * A (group, artifact, version) coordinate read from a build manifest.
 */
public record Coordinate(String group, String artifact, String version) {

    public Coordinate {
        Objects.requireNonNull(group, "group");
        Objects.requireNonNull(artifact, "artifact");
    }

    /**
     * {@code group:artifact:version}
     */
    public String gavKey() {
        return group + ":" + artifact + ":" + version;
    }

    /**
     * {@code group:artifact}
     */
    public String groupArtifactKey() {
        return group + ":" + artifact;
    }

    /**
     * {@code group.artifact}, the base package granularity.
     */
    public String packageKey() {
        return group + "." + artifact;
    }

    public boolean hasVersion() {
        return version != null && !version.isBlank();
    }

    /**
     * Parses {@code group:artifact[:version]}; returns null for anything else.
     */
    public static Coordinate parse(String key, String version) {
        String[] parts = key.split(":");
        if (parts.length == 3) {
            return new Coordinate(parts[0], parts[1], parts[2]);
        }
        if (parts.length == 2) {
            return new Coordinate(parts[0], parts[1], version);
        }
        return null;
    }
}
