package com.purchasingpower.codegraph.model.source;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A parsed interface.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public final class InterfaceDeclaration implements TypeDeclaration {

    private String name;
    private String file;

    @JsonProperty("package")
    private String packageName;

    private int line;

    @Builder.Default
    private List<String> modifiers = new ArrayList<>();

    @JsonProperty("extends")
    @Builder.Default
    private List<String> extendsTypes = new ArrayList<>();

    /**
     * Number of methods whose enclosing type is this interface.
     */
    private int methodCount;

    private int estimatedLines;

    @Override
    public TypeKind kind() {
        return TypeKind.INTERFACE;
    }
}
