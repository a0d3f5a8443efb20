package com.purchasingpower.codegraph.model.dependency;

/**
 * The external dependency an import belongs to.
 *
 * @param packageName natural key of the ExternalDependency node
 * @param groupId group when a coordinate key matched, else null
 * @param artifactId artifact when a coordinate key matched, else null
 * @param version resolved version, null when no key matched
 */
public record ResolvedDependency(String packageName, String groupId, String artifactId, String version) {

    public boolean isVersioned() {
        return version != null;
    }
}
