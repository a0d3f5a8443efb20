package com.purchasingpower.codegraph.model.source;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A parsed method declaration. {@code methodSignature} is its identity.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MethodRecord {

    private String name;
    private String className;
    private TypeKind containingType;
    private int line;
    private int endLine;
    private String code;
    private String file;
    private int estimatedLines;

    @Builder.Default
    private List<ParameterRecord> parameters = new ArrayList<>();

    @Builder.Default
    private List<String> modifiers = new ArrayList<>();

    private boolean isStatic;
    private boolean isAbstract;
    private boolean isFinal;
    private boolean isPrivate;
    private boolean isPublic;
    private String returnType;

    @Builder.Default
    private List<CallSite> calls = new ArrayList<>();

    private String methodSignature;
}
