package com.purchasingpower.codegraph.model.source;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A parsed class. Enums and records are recorded as implicitly final classes.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public final class ClassDeclaration implements TypeDeclaration {

    private String name;
    private String file;

    @JsonProperty("package")
    private String packageName;

    private int line;

    @Builder.Default
    private List<String> modifiers = new ArrayList<>();

    /**
     * Superclass as written in source, null when none.
     */
    @JsonProperty("extends")
    private String extendsType;

    @JsonProperty("implements")
    @Builder.Default
    private List<String> implementsTypes = new ArrayList<>();

    private boolean isAbstract;
    private boolean isFinal;
    private int estimatedLines;

    @Override
    public TypeKind kind() {
        return TypeKind.CLASS;
    }
}
