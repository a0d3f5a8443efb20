package com.purchasingpower.codegraph.pipeline;

import com.purchasingpower.codegraph.model.extraction.ParseError;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one pipeline run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PipelineReport {

    private boolean success;
    private int filesDiscovered;
    private int filesParsed;
    private int parseFailures;
    private int batchesWritten;
    private int rowsWritten;
    private long nodeCount;
    private long relationshipCount;
    private int dependencyKeys;
    private long durationMs;

    /**
     * Soft errors as "path: message", or the fatal error of a failed run.
     */
    @Builder.Default
    private List<String> errors = new ArrayList<>();

    public static List<String> describe(List<ParseError> parseErrors) {
        return parseErrors.stream()
                .map(error -> error.path() + ": " + error.message())
                .toList();
    }

    public static PipelineReport failure(String error, long durationMs) {
        return PipelineReport.builder()
                .success(false)
                .errors(List.of(error))
                .durationMs(durationMs)
                .build();
    }
}
