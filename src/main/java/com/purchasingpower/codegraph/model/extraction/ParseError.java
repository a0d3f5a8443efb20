package com.purchasingpower.codegraph.model.extraction;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A soft failure for one input file. The run continues without the file.
 *
 * @param path path relative to the source root
 * @param message what went wrong
 */
public record ParseError(String path, String message) {

    @JsonCreator
    public ParseError(@JsonProperty("path") String path, @JsonProperty("message") String message) {
        this.path = path;
        this.message = message;
    }
}
