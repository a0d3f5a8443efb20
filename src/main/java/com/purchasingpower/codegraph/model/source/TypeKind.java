package com.purchasingpower.codegraph.model.source;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of a declared type. Also the graph label the declaration is written under.
 */
public enum TypeKind {
    CLASS("class", "Class"),
    INTERFACE("interface", "Interface");

    private final String wireName;
    private final String label;

    TypeKind(String wireName, String label) {
        this.wireName = wireName;
        this.label = label;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public String getLabel() {
        return label;
    }

    @JsonCreator
    public static TypeKind fromWireName(String value) {
        for (TypeKind kind : values()) {
            if (kind.wireName.equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown type kind: " + value);
    }
}
