package com.purchasingpower.codegraph.model.source;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum DocKind {
    JAVADOC("javadoc"),
    LINE_COMMENT("line_comment"),
    BLOCK_COMMENT("block_comment");

    private final String wireName;

    DocKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static DocKind fromWireName(String value) {
        for (DocKind kind : values()) {
            if (kind.wireName.equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown doc kind: " + value);
    }
}
