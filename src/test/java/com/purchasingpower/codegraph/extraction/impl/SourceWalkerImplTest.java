package com.purchasingpower.codegraph.extraction.impl;

import com.purchasingpower.codegraph.extraction.SourceWalker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Source Walker Tests")
class SourceWalkerImplTest {

    @TempDir
    Path root;

    private SourceWalkerImpl walker;

    @BeforeEach
    void setUp() throws IOException {
        walker = new SourceWalkerImpl(List.of(".git", "target", "build"));

        write("src/main/java/b/B.java");
        write("src/main/java/a/A.java");
        write("src/main/java/a/package-info.java");
        write("module-info.java");
        write("Root.java");
        write("target/generated/Gen.java");
        write("module/build/Out.java");
        write("README.md");
        write("pom.xml");
        write("module/build.gradle");
        write("app/build.gradle.kts");
        write("target/pom.xml");
    }

    @Test
    @DisplayName("Should list Java sources sorted by relative path, skipping excluded directories")
    void testListSourceFiles() {
        List<String> files = walker.listSourceFiles(root).stream()
                .map(p -> SourceWalker.relativePath(root, p))
                .toList();

        assertEquals(List.of("Root.java", "src/main/java/a/A.java", "src/main/java/b/B.java"), files);
    }

    @Test
    @DisplayName("Should list Maven and Gradle manifests")
    void testListBuildManifests() {
        List<String> manifests = walker.listBuildManifests(root).stream()
                .map(p -> SourceWalker.relativePath(root, p))
                .toList();

        assertEquals(List.of("app/build.gradle.kts", "module/build.gradle", "pom.xml"), manifests);
    }

    @Test
    @DisplayName("Should reject a root that is not a directory")
    void testListSourceFiles_NotADirectory() {
        assertThrows(IllegalArgumentException.class, () -> walker.listSourceFiles(root.resolve("Root.java")));
    }

    private void write(String relative) throws IOException {
        Path file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, "");
    }
}
