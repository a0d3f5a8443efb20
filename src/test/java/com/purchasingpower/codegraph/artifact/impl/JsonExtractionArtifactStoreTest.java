package com.purchasingpower.codegraph.artifact.impl;

import com.purchasingpower.codegraph.artifact.ExtractionArtifactStore;
import com.purchasingpower.codegraph.exception.ArtifactIOException;
import com.purchasingpower.codegraph.model.extraction.ParseError;
import com.purchasingpower.codegraph.model.graph.EmbeddingSet;
import com.purchasingpower.codegraph.model.source.CallKind;
import com.purchasingpower.codegraph.model.source.CallSite;
import com.purchasingpower.codegraph.model.source.ClassDeclaration;
import com.purchasingpower.codegraph.model.source.FileRecord;
import com.purchasingpower.codegraph.model.source.MethodRecord;
import com.purchasingpower.codegraph.model.source.ParameterRecord;
import com.purchasingpower.codegraph.model.source.TypeKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("JSON Extraction Artifact Store Tests")
class JsonExtractionArtifactStoreTest {

    @TempDir
    Path tempDir;

    private JsonExtractionArtifactStore store;

    @BeforeEach
    void setUp() {
        store = new JsonExtractionArtifactStore();
    }

    @Test
    @DisplayName("File records are written with snake_case field names")
    void testWriteFiles_SnakeCase() throws IOException {
        // Given
        Path directory = tempDir.resolve("out/run-1");

        // When
        store.writeFiles(directory, List.of(sampleFile()));

        // Then
        String json = Files.readString(directory.resolve(ExtractionArtifactStore.FILES_DATA));
        assertTrue(json.contains("\"method_signature\""));
        assertTrue(json.contains("\"is_static\""));
        assertTrue(json.contains("\"total_lines\""));
        assertTrue(json.contains("\"package\""));
        assertTrue(json.contains("\"call_type\""));
        assertFalse(json.contains("methodSignature"));
        assertFalse(json.contains("packageName"));
    }

    @Test
    @DisplayName("File records survive a write and read")
    void testReadFiles_RoundTrip() {
        FileRecord original = sampleFile();

        store.writeFiles(tempDir, List.of(original));
        List<FileRecord> loaded = store.readFiles(tempDir);

        assertEquals(1, loaded.size());
        assertEquals(original, loaded.get(0));
        assertTrue(loaded.get(0).getMethods().get(0).isStatic());
        assertEquals(CallKind.SAME_CLASS, loaded.get(0).getMethods().get(0).getCalls().get(0).getCallType());
    }

    @Test
    @DisplayName("Dependencies and parse errors are stored beside the files")
    void testDependenciesAndErrors() {
        Map<String, String> versions = new LinkedHashMap<>();
        versions.put("org.slf4j", "2.0.9");
        versions.put("org.slf4j:slf4j-api", "2.0.9");
        List<ParseError> errors = List.of(new ParseError("src/Broken.java", "Parse error at line 3"));

        store.writeDependencies(tempDir, versions);
        store.writeParseErrors(tempDir, errors);

        assertEquals(versions, store.readDependencies(tempDir));
        assertEquals(errors, store.readParseErrors(tempDir));
    }

    @Test
    @DisplayName("Missing optional artifacts read as empty")
    void testMissingArtifacts() {
        assertTrue(store.readDependencies(tempDir).isEmpty());
        assertTrue(store.readParseErrors(tempDir).isEmpty());
        assertTrue(store.readEmbeddings(tempDir).isEmpty());
    }

    @Test
    @DisplayName("Embedding vectors are read per side")
    void testReadEmbeddings() throws IOException {
        Files.writeString(tempDir.resolve(ExtractionArtifactStore.FILE_EMBEDDINGS), "[[0.5, 1.0], [0.25, 0.0]]");

        EmbeddingSet embeddings = store.readEmbeddings(tempDir);

        assertEquals(List.of(List.of(0.5f, 1.0f), List.of(0.25f, 0.0f)), embeddings.fileVectors());
        assertTrue(embeddings.methodVectors().isEmpty());
    }

    @Test
    @DisplayName("A missing files artifact is an artifact error")
    void testReadFiles_Missing() {
        ArtifactIOException e = assertThrows(ArtifactIOException.class, () -> store.readFiles(tempDir));
        assertTrue(e.getMessage().contains(ExtractionArtifactStore.FILES_DATA));
    }

    private FileRecord sampleFile() {
        MethodRecord method = MethodRecord.builder()
                .name("of")
                .className("Money")
                .containingType(TypeKind.CLASS)
                .line(5)
                .endLine(7)
                .code("public static Money of(long cents) {\n    return validate(cents);\n}")
                .file("src/billing/Money.java")
                .estimatedLines(3)
                .parameters(new ArrayList<>(List.of(ParameterRecord.builder().name("cents").type("long").build())))
                .modifiers(new ArrayList<>(List.of("public", "static")))
                .isStatic(true)
                .isPublic(true)
                .returnType("Money")
                .calls(new ArrayList<>(List.of(CallSite.builder()
                        .methodName("validate")
                        .targetClass("Money")
                        .callType(CallKind.SAME_CLASS)
                        .build())))
                .methodSignature("billing.Money#of(long):Money")
                .build();
        return FileRecord.builder()
                .path("src/billing/Money.java")
                .packageName("billing")
                .code("package billing;")
                .methods(new ArrayList<>(List.of(method)))
                .classes(new ArrayList<>(List.of(ClassDeclaration.builder()
                        .name("Money")
                        .file("src/billing/Money.java")
                        .packageName("billing")
                        .line(3)
                        .modifiers(new ArrayList<>(List.of("public", "final")))
                        .isFinal(true)
                        .estimatedLines(10)
                        .build())))
                .totalLines(12)
                .codeLines(10)
                .methodCount(1)
                .classCount(1)
                .build();
    }
}
