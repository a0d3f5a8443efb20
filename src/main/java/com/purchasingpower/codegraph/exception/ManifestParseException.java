package com.purchasingpower.codegraph.exception;

import lombok.Getter;

@Getter
public class ManifestParseException extends RuntimeException {

    private final String manifestPath;

    public ManifestParseException(String manifestPath, String message, Throwable cause) {
        super(message, cause);
        this.manifestPath = manifestPath;
    }
}
