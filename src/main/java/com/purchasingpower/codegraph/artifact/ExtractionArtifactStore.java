package com.purchasingpower.codegraph.artifact;

import com.purchasingpower.codegraph.model.extraction.ParseError;
import com.purchasingpower.codegraph.model.graph.EmbeddingSet;
import com.purchasingpower.codegraph.model.source.FileRecord;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Serialized extraction output, so extraction and graph writing can run
 * separately. All artifacts of a run live in one directory.
 */
public interface ExtractionArtifactStore {

    String FILES_DATA = "files_data.json";
    String DEPENDENCIES = "dependencies.json";
    String PARSE_ERRORS = "parse_errors.json";
    String FILE_EMBEDDINGS = "file_embeddings.json";
    String METHOD_EMBEDDINGS = "method_embeddings.json";

    void writeFiles(Path directory, List<FileRecord> files);

    List<FileRecord> readFiles(Path directory);

    void writeDependencies(Path directory, Map<String, String> versions);

    /**
     * Empty when the directory has no dependency artifact.
     */
    Map<String, String> readDependencies(Path directory);

    void writeParseErrors(Path directory, List<ParseError> errors);

    List<ParseError> readParseErrors(Path directory);

    /**
     * Vectors produced by the embedding collaborator. A missing file yields an
     * empty list for that side.
     */
    EmbeddingSet readEmbeddings(Path directory);
}
