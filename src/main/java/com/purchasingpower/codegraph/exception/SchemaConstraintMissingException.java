package com.purchasingpower.codegraph.exception;

import lombok.Getter;

import java.util.List;

/**
 * Required graph constraints are still absent after the one-time repair.
 * Thrown before any data is written.
 */
@Getter
public class SchemaConstraintMissingException extends RuntimeException {

    private final List<String> missingConstraints;

    public SchemaConstraintMissingException(List<String> missingConstraints) {
        super("Schema constraints missing: " + missingConstraints);
        this.missingConstraints = List.copyOf(missingConstraints);
    }
}
