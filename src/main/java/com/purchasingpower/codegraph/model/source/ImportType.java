package com.purchasingpower.codegraph.model.source;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Classification tag of an import declaration.
 */
public enum ImportType {
    STANDARD("standard"),
    INTERNAL("internal"),
    EXTERNAL("external");

    private final String wireName;

    ImportType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static ImportType fromWireName(String value) {
        for (ImportType type : values()) {
            if (type.wireName.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown import type: " + value);
    }
}
