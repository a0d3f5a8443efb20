package com.purchasingpower.codegraph.artifact.impl;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.purchasingpower.codegraph.artifact.ExtractionArtifactStore;
import com.purchasingpower.codegraph.exception.ArtifactIOException;
import com.purchasingpower.codegraph.model.extraction.ParseError;
import com.purchasingpower.codegraph.model.graph.EmbeddingSet;
import com.purchasingpower.codegraph.model.source.FileRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Jackson implementation of {@link ExtractionArtifactStore}.
 *
 * <p>Uses its own mapper: fields are serialized directly in snake_case
 * ({@code is_static}, {@code method_signature}), independent of accessor names.
 */
@Slf4j
@Service
public class JsonExtractionArtifactStore implements ExtractionArtifactStore {

    private static final TypeReference<List<FileRecord>> FILE_LIST = new TypeReference<>() {
    };
    private static final TypeReference<LinkedHashMap<String, String>> VERSION_MAP = new TypeReference<>() {
    };
    private static final TypeReference<List<ParseError>> ERROR_LIST = new TypeReference<>() {
    };
    private static final TypeReference<List<List<Float>>> VECTORS = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public JsonExtractionArtifactStore() {
        this.objectMapper = new ObjectMapper()
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .setVisibility(PropertyAccessor.ALL, JsonAutoDetect.Visibility.NONE)
                .setVisibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.ANY)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    public void writeFiles(Path directory, List<FileRecord> files) {
        write(directory.resolve(FILES_DATA), files);
        log.info("💾 Wrote {} file records to {}", files.size(), directory.resolve(FILES_DATA));
    }

    @Override
    public List<FileRecord> readFiles(Path directory) {
        List<FileRecord> files = read(directory.resolve(FILES_DATA), FILE_LIST);
        log.info("📂 Loaded {} file records from {}", files.size(), directory.resolve(FILES_DATA));
        return files;
    }

    @Override
    public void writeDependencies(Path directory, Map<String, String> versions) {
        write(directory.resolve(DEPENDENCIES), versions);
    }

    @Override
    public Map<String, String> readDependencies(Path directory) {
        Path file = directory.resolve(DEPENDENCIES);
        if (!Files.exists(file)) {
            log.debug("No {} in {}", DEPENDENCIES, directory);
            return Map.of();
        }
        return read(file, VERSION_MAP);
    }

    @Override
    public void writeParseErrors(Path directory, List<ParseError> errors) {
        write(directory.resolve(PARSE_ERRORS), errors);
    }

    @Override
    public List<ParseError> readParseErrors(Path directory) {
        Path file = directory.resolve(PARSE_ERRORS);
        return Files.exists(file) ? read(file, ERROR_LIST) : List.of();
    }

    @Override
    public EmbeddingSet readEmbeddings(Path directory) {
        return new EmbeddingSet(readVectors(directory.resolve(FILE_EMBEDDINGS)),
                readVectors(directory.resolve(METHOD_EMBEDDINGS)));
    }

    private List<List<Float>> readVectors(Path file) {
        return Files.exists(file) ? read(file, VECTORS) : List.of();
    }

    private void write(Path file, Object value) {
        try {
            Files.createDirectories(file.getParent());
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), value);
        } catch (IOException e) {
            throw new ArtifactIOException("Failed to write " + file, e);
        }
    }

    private <T> T read(Path file, TypeReference<T> type) {
        try {
            return objectMapper.readValue(file.toFile(), type);
        } catch (IOException e) {
            throw new ArtifactIOException("Failed to read " + file, e);
        }
    }
}
