package com.purchasingpower.codegraph.pipeline;

import com.purchasingpower.codegraph.artifact.ExtractionArtifactStore;
import com.purchasingpower.codegraph.configuration.CodeGraphProperties;
import com.purchasingpower.codegraph.model.graph.EmbeddingSet;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Runs the pipeline once at startup for {@code codegraph.source-root}.
 * Embeddings are picked up from the artifact directory when one is configured.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "codegraph", name = "run-on-startup", havingValue = "true")
public class PipelineRunner implements ApplicationRunner {

    private final CodeGraphPipeline pipeline;
    private final ExtractionArtifactStore artifactStore;
    private final CodeGraphProperties properties;

    @Override
    public void run(ApplicationArguments args) {
        String sourceRoot = properties.getSourceRoot();
        if (sourceRoot == null || sourceRoot.isBlank()) {
            log.warn("⚠️  codegraph.run-on-startup is set but codegraph.source-root is empty, nothing to do");
            return;
        }

        String artifacts = properties.getArtifacts().getDirectory();
        EmbeddingSet embeddings = artifacts == null || artifacts.isBlank()
                ? EmbeddingSet.empty()
                : artifactStore.readEmbeddings(Path.of(artifacts));

        PipelineReport report = pipeline.run(Path.of(sourceRoot), embeddings);
        if (!report.isSuccess()) {
            log.error("❌ Code graph build failed: {}", report.getErrors());
        }
    }
}
