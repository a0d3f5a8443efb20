package com.purchasingpower.codegraph.exception;

public class ArtifactIOException extends RuntimeException {

    public ArtifactIOException(String message, Throwable cause) {
        super(message, cause);
    }
}
