package com.purchasingpower.codegraph.pipeline.impl;

import com.purchasingpower.codegraph.artifact.ExtractionArtifactStore;
import com.purchasingpower.codegraph.configuration.CodeGraphProperties;
import com.purchasingpower.codegraph.dependency.DependencyCoordinateExtractor;
import com.purchasingpower.codegraph.exception.GraphConstraintViolationException;
import com.purchasingpower.codegraph.exception.SchemaConstraintMissingException;
import com.purchasingpower.codegraph.extraction.ExtractionService;
import com.purchasingpower.codegraph.model.dependency.DependencyCatalog;
import com.purchasingpower.codegraph.model.extraction.ExtractionErrors;
import com.purchasingpower.codegraph.model.extraction.ExtractionResult;
import com.purchasingpower.codegraph.model.extraction.ParseError;
import com.purchasingpower.codegraph.model.graph.EmbeddingSet;
import com.purchasingpower.codegraph.model.graph.GraphStatistics;
import com.purchasingpower.codegraph.model.graph.GraphWriteResult;
import com.purchasingpower.codegraph.model.source.FileRecord;
import com.purchasingpower.codegraph.pipeline.CodeGraphPipeline;
import com.purchasingpower.codegraph.pipeline.PipelineReport;
import com.purchasingpower.codegraph.storage.GraphWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Default {@link CodeGraphPipeline}.
 *
 * <p>Schema and record-identity failures end the run before any write and are
 * reported as a failed run. Store failures propagate to the caller, which owns
 * retries.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CodeGraphPipelineImpl implements CodeGraphPipeline {

    private final ExtractionService extractionService;
    private final DependencyCoordinateExtractor dependencyExtractor;
    private final GraphWriter graphWriter;
    private final ExtractionArtifactStore artifactStore;
    private final CodeGraphProperties properties;

    @Override
    public PipelineReport run(Path root, EmbeddingSet embeddings) {
        long startTime = System.currentTimeMillis();
        log.info("🚀 Building code graph for {}", root);

        ExtractionResult extraction = extractionService.extractAll(root);
        ExtractionErrors errors = new ExtractionErrors().merge(extraction.errors());
        DependencyCatalog catalog = dependencyExtractor.extract(root, errors);
        Map<String, String> versions = catalog.toVersionMap();
        List<ParseError> parseErrors = errors.asList();

        saveArtifacts(extraction.files(), versions, parseErrors);

        return write(extraction.files(), versions, embeddings, extraction.filesDiscovered(), parseErrors, startTime);
    }

    @Override
    public PipelineReport writeFromArtifacts(Path artifactDirectory) {
        long startTime = System.currentTimeMillis();
        log.info("🚀 Building code graph from artifacts in {}", artifactDirectory);

        List<FileRecord> files = artifactStore.readFiles(artifactDirectory);
        Map<String, String> versions = artifactStore.readDependencies(artifactDirectory);
        List<ParseError> parseErrors = artifactStore.readParseErrors(artifactDirectory);
        EmbeddingSet embeddings = artifactStore.readEmbeddings(artifactDirectory);

        return write(files, versions, embeddings, files.size() + parseErrors.size(), parseErrors, startTime);
    }

    private PipelineReport write(List<FileRecord> files, Map<String, String> versions, EmbeddingSet embeddings,
                                 int filesDiscovered, List<ParseError> parseErrors, long startTime) {
        GraphWriteResult written;
        try {
            written = graphWriter.write(files, versions, embeddings);
        } catch (SchemaConstraintMissingException | GraphConstraintViolationException e) {
            log.error("❌ Graph build aborted before writing: {}", e.getMessage());
            return PipelineReport.failure(e.getMessage(), System.currentTimeMillis() - startTime);
        }
        GraphStatistics statistics = graphWriter.countGraph();

        PipelineReport report = PipelineReport.builder()
                .success(true)
                .filesDiscovered(filesDiscovered)
                .filesParsed(files.size())
                .parseFailures(parseErrors.size())
                .batchesWritten(written.getBatchesWritten())
                .rowsWritten(written.getRowsWritten())
                .nodeCount(statistics.nodeCount())
                .relationshipCount(statistics.relationshipCount())
                .dependencyKeys(versions.size())
                .durationMs(System.currentTimeMillis() - startTime)
                .errors(PipelineReport.describe(parseErrors))
                .build();

        log.info("✅ Code graph built: {} files parsed, {} failures, {} batches, {} nodes, {} relationships ({}ms)",
                report.getFilesParsed(), report.getParseFailures(), report.getBatchesWritten(),
                report.getNodeCount(), report.getRelationshipCount(), report.getDurationMs());
        return report;
    }

    private void saveArtifacts(List<FileRecord> files, Map<String, String> versions, List<ParseError> parseErrors) {
        String directory = properties.getArtifacts().getDirectory();
        if (directory == null || directory.isBlank()) {
            return;
        }
        Path target = Path.of(directory);
        artifactStore.writeFiles(target, files);
        artifactStore.writeDependencies(target, versions);
        artifactStore.writeParseErrors(target, parseErrors);
    }
}
