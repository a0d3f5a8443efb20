package com.purchasingpower.codegraph.configuration;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Worker pool for per-file extraction.
 *
 * Pool size is fixed; pending files wait in the executor's queue while parsed
 * results go through the bounded channel owned by the extraction service.
 */
@Slf4j
@Configuration
public class ExtractionExecutorConfig {

    public static final String EXTRACTION_EXECUTOR = "extractionExecutor";

    @Bean(name = EXTRACTION_EXECUTOR)
    public ThreadPoolTaskExecutor extractionExecutor(CodeGraphProperties properties) {
        int workers = properties.getExtraction().getWorkers();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers);

        // Thread name prefix for debugging
        executor.setThreadNamePrefix("extract-");

        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);

        executor.initialize();

        log.info("✅ Extraction executor configured: workers={}", workers);

        return executor;
    }
}
