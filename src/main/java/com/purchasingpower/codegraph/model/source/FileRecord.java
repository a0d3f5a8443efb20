package com.purchasingpower.codegraph.model.source;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Everything extracted from one source file. This is the unit of the
 * serialized extraction artifact.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FileRecord {

    public static final String LANGUAGE_JAVA = "java";
    public static final String ECOSYSTEM_MAVEN = "maven";

    /**
     * Path relative to the source root, '/' separated.
     */
    private String path;

    @JsonProperty("package")
    private String packageName;

    private String code;

    @Builder.Default
    private List<MethodRecord> methods = new ArrayList<>();

    @Builder.Default
    private List<ClassDeclaration> classes = new ArrayList<>();

    @Builder.Default
    private List<InterfaceDeclaration> interfaces = new ArrayList<>();

    @Builder.Default
    private List<ImportRecord> imports = new ArrayList<>();

    @Builder.Default
    private List<DocRecord> docs = new ArrayList<>();

    @Builder.Default
    private String language = LANGUAGE_JAVA;

    @Builder.Default
    private String ecosystem = ECOSYSTEM_MAVEN;

    private int totalLines;
    private int codeLines;
    private int methodCount;
    private int classCount;
    private int interfaceCount;

    /**
     * Classes followed by interfaces, in declaration order within each group.
     */
    public List<TypeDeclaration> typeDeclarations() {
        List<TypeDeclaration> types = new ArrayList<>(classes.size() + interfaces.size());
        types.addAll(classes);
        types.addAll(interfaces);
        return types;
    }

    /**
     * Directory part of {@link #path}, "" for files at the root.
     */
    public String directory() {
        int slash = path.lastIndexOf('/');
        return slash < 0 ? "" : path.substring(0, slash);
    }
}
