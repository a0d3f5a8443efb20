package com.purchasingpower.codegraph.dependency.impl;

import com.purchasingpower.codegraph.extraction.impl.SourceWalkerImpl;
import com.purchasingpower.codegraph.model.dependency.DependencyCatalog;
import com.purchasingpower.codegraph.model.extraction.ExtractionErrors;
import com.purchasingpower.codegraph.model.extraction.ParseError;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Dependency Coordinate Extractor Tests")
class DependencyCoordinateExtractorImplTest {

    @TempDir
    Path root;

    private DependencyCoordinateExtractorImpl extractor;

    @BeforeEach
    void setUp() {
        extractor = new DependencyCoordinateExtractorImpl(new SourceWalkerImpl(List.of("target")),
                List.of(new GradleManifestParser(), new MavenManifestParser()));
    }

    @Test
    @DisplayName("Should emit all key granularities, plus the bare group for Gradle")
    void testExtract_KeyGranularities() throws IOException {
        // Given
        write("pom.xml", pom("com.fasterxml.jackson.core", "jackson-databind", "2.15.0"));
        write("app/build.gradle", "implementation 'org.slf4j:slf4j-api:2.0.9'\n");

        // When
        Map<String, String> versions = extractor.extract(root, new ExtractionErrors()).toVersionMap();

        // Then
        assertEquals("2.15.0", versions.get("com.fasterxml.jackson.core.jackson-databind"));
        assertEquals("2.15.0", versions.get("com.fasterxml.jackson.core:jackson-databind"));
        assertEquals("2.15.0", versions.get("com.fasterxml.jackson.core:jackson-databind:2.15.0"));
        assertFalse(versions.containsKey("com.fasterxml.jackson.core"));
        assertEquals("2.0.9", versions.get("org.slf4j.slf4j-api"));
        assertEquals("2.0.9", versions.get("org.slf4j:slf4j-api"));
        assertEquals("2.0.9", versions.get("org.slf4j:slf4j-api:2.0.9"));
        assertEquals("2.0.9", versions.get("org.slf4j"));
    }

    @Test
    @DisplayName("Maven versions win over Gradle, and earlier paths over later ones")
    void testExtract_Precedence() throws IOException {
        write("z/build.gradle", "implementation 'org.slf4j:slf4j-api:1.7.36'\n");
        write("b/pom.xml", pom("org.slf4j", "slf4j-api", "2.0.7"));
        write("a/pom.xml", pom("org.slf4j", "slf4j-api", "2.0.9"));

        DependencyCatalog catalog = extractor.extract(root, new ExtractionErrors());

        assertEquals("2.0.9", catalog.toVersionMap().get("org.slf4j:slf4j-api"));
        assertEquals("2.0.9", catalog.toVersionMap().get("org.slf4j.slf4j-api"));
        assertEquals("1.7.36", catalog.toVersionMap().get("org.slf4j"));
        assertEquals(3, catalog.getCoordinates().size());
    }

    @Test
    @DisplayName("Should record a malformed manifest and keep reading the others")
    void testExtract_MalformedManifest() throws IOException {
        write("broken/pom.xml", "<project><dependencies>");
        write("pom.xml", pom("org.slf4j", "slf4j-api", "2.0.9"));
        ExtractionErrors errors = new ExtractionErrors();

        DependencyCatalog catalog = extractor.extract(root, errors);

        assertEquals("2.0.9", catalog.toVersionMap().get("org.slf4j:slf4j-api"));
        List<ParseError> recorded = errors.asList();
        assertEquals(1, recorded.size());
        assertEquals("broken/pom.xml", recorded.get(0).path());
    }

    private void write(String relative, String content) throws IOException {
        Path file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }

    private static String pom(String group, String artifact, String version) {
        return """
                <project xmlns="http://maven.apache.org/POM/4.0.0">
                  <dependencies>
                    <dependency>
                      <groupId>%s</groupId>
                      <artifactId>%s</artifactId>
                      <version>%s</version>
                    </dependency>
                  </dependencies>
                </project>
                """.formatted(group, artifact, version);
    }
}
