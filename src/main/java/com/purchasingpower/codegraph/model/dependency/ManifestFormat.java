package com.purchasingpower.codegraph.model.dependency;

/**
 * Supported build manifest formats, in precedence order.
 */
public enum ManifestFormat {
    MAVEN,
    GRADLE;

    public static ManifestFormat of(String fileName) {
        if ("pom.xml".equals(fileName)) {
            return MAVEN;
        }
        if ("build.gradle".equals(fileName) || "build.gradle.kts".equals(fileName)) {
            return GRADLE;
        }
        return null;
    }
}
