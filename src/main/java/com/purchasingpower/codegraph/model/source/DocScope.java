package com.purchasingpower.codegraph.model.source;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Owner of a documentation span.
 */
public enum DocScope {
    FILE("file"),
    CLASS("class"),
    INTERFACE("interface"),
    METHOD("method");

    private final String wireName;

    DocScope(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public static DocScope of(TypeKind kind) {
        return kind == TypeKind.INTERFACE ? INTERFACE : CLASS;
    }

    @JsonCreator
    public static DocScope fromWireName(String value) {
        for (DocScope scope : values()) {
            if (scope.wireName.equalsIgnoreCase(value)) {
                return scope;
            }
        }
        throw new IllegalArgumentException("Unknown doc scope: " + value);
    }
}
