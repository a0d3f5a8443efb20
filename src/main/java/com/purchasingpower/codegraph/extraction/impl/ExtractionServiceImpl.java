package com.purchasingpower.codegraph.extraction.impl;

import com.purchasingpower.codegraph.configuration.CodeGraphProperties;
import com.purchasingpower.codegraph.configuration.ExtractionExecutorConfig;
import com.purchasingpower.codegraph.extraction.DeclarationExtractor;
import com.purchasingpower.codegraph.extraction.ExtractionService;
import com.purchasingpower.codegraph.extraction.SourceWalker;
import com.purchasingpower.codegraph.model.extraction.ExtractionErrors;
import com.purchasingpower.codegraph.model.extraction.ExtractionResult;
import com.purchasingpower.codegraph.model.extraction.FileOutcome;
import com.purchasingpower.codegraph.model.source.FileRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Parallel extraction over a worker pool.
 *
 * <p>Each worker parses one file and publishes a {@link FileOutcome} into a
 * bounded channel; the calling thread is the single collector draining it. The
 * channel is the only state shared between workers. Workers stop publishing
 * once the collector gives up, so an interrupted run leaves no blocked threads.
 */
@Slf4j
@Service
public class ExtractionServiceImpl implements ExtractionService {

    private static final long PUBLISH_POLL_MS = 100;

    private final SourceWalker sourceWalker;
    private final DeclarationExtractor declarationExtractor;
    private final Executor executor;
    private final int channelCapacity;

    @Autowired
    public ExtractionServiceImpl(SourceWalker sourceWalker,
                                 DeclarationExtractor declarationExtractor,
                                 @Qualifier(ExtractionExecutorConfig.EXTRACTION_EXECUTOR) Executor executor,
                                 CodeGraphProperties properties) {
        this(sourceWalker, declarationExtractor, executor, properties.getExtraction().getChannelCapacity());
    }

    public ExtractionServiceImpl(SourceWalker sourceWalker,
                                 DeclarationExtractor declarationExtractor,
                                 Executor executor,
                                 int channelCapacity) {
        this.sourceWalker = sourceWalker;
        this.declarationExtractor = declarationExtractor;
        this.executor = executor;
        this.channelCapacity = channelCapacity;
    }

    @Override
    public ExtractionResult extractAll(Path root) {
        return extractFiles(root, sourceWalker.listSourceFiles(root));
    }

    @Override
    public ExtractionResult extractFiles(Path root, List<Path> files) {
        ExtractionErrors errors = new ExtractionErrors();
        if (files.isEmpty()) {
            log.info("No source files to extract under {}", root);
            return new ExtractionResult(List.of(), errors, 0);
        }

        log.info("📂 Extracting {} files (channel capacity {})", files.size(), channelCapacity);
        long startTime = System.currentTimeMillis();

        BlockingQueue<FileOutcome> channel = new ArrayBlockingQueue<>(channelCapacity);
        AtomicBoolean cancelled = new AtomicBoolean(false);

        for (Path file : files) {
            executor.execute(() -> {
                if (cancelled.get()) {
                    return;
                }
                FileOutcome outcome = null;
                try {
                    outcome = extractOne(root, file);
                } finally {
                    // The collector counts one outcome per file, whatever the worker died of
                    publish(channel, cancelled, outcome != null ? outcome
                            : FileOutcome.failed(SourceWalker.relativePath(root, file), "Worker terminated abnormally"));
                }
            });
        }

        List<FileRecord> records = new ArrayList<>(files.size());
        try {
            for (int received = 0; received < files.size(); received++) {
                FileOutcome outcome = channel.take();
                if (outcome instanceof FileOutcome.Parsed parsed) {
                    records.add(parsed.record());
                } else if (outcome instanceof FileOutcome.Failed failed) {
                    errors.record(failed.error());
                }
            }
        } catch (InterruptedException e) {
            cancelled.set(true);
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Extraction interrupted after " + records.size() + " files", e);
        }

        records.sort(Comparator.comparing(FileRecord::getPath));

        long duration = System.currentTimeMillis() - startTime;
        log.info("✅ Successfully parsed {}/{} files in {}ms", records.size(), files.size(), duration);
        if (!errors.isEmpty()) {
            log.warn("❌ Failed files ({}): {}", errors.size(), errors.asList().stream()
                    .map(error -> error.path())
                    .toList());
        }

        return new ExtractionResult(records, errors, files.size());
    }

    private FileOutcome extractOne(Path root, Path file) {
        String relativePath = SourceWalker.relativePath(root, file);
        try {
            // Undecodable bytes become replacement characters instead of failing the file
            String source = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
            return declarationExtractor.extract(relativePath, source);
        } catch (IOException e) {
            log.warn("⚠️  Failed to read {}: {}", relativePath, e.getMessage());
            return FileOutcome.failed(relativePath, "Failed to read file: " + e.getMessage());
        } catch (StackOverflowError e) {
            log.warn("⚠️  Failed to extract {}: nesting too deep to parse", relativePath);
            return FileOutcome.failed(relativePath, "StackOverflowError: nesting too deep to parse");
        } catch (RuntimeException e) {
            log.warn("⚠️  Failed to extract {}: {}", relativePath, e.getMessage(), e);
            return FileOutcome.failed(relativePath, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private void publish(BlockingQueue<FileOutcome> channel, AtomicBoolean cancelled, FileOutcome outcome) {
        try {
            while (!cancelled.get()) {
                if (channel.offer(outcome, PUBLISH_POLL_MS, TimeUnit.MILLISECONDS)) {
                    return;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Worker interrupted while publishing {}", outcome.path());
        }
    }
}
