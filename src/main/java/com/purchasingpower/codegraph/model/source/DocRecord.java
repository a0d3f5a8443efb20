package com.purchasingpower.codegraph.model.source;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A documentation span. Identified by its file and line span.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocRecord {
    private DocKind kind;
    private DocScope scope;
    private String text;
    private int startLine;
    private int endLine;
    private String file;

    /**
     * Type name for class and interface docs, method signature for method docs,
     * null for file docs.
     */
    private String owner;
}
