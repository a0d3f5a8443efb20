package com.purchasingpower.codegraph.model.source;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Classification of an invocation found in a method body.
 */
public enum CallKind {
    SAME_CLASS("same_class"),
    THIS("this"),
    SUPER("super"),
    STATIC("static"),
    INSTANCE("instance"),
    CONSTRUCTOR("constructor");

    private final String wireName;

    CallKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static CallKind fromWireName(String value) {
        for (CallKind kind : values()) {
            if (kind.wireName.equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown call kind: " + value);
    }
}
