package com.purchasingpower.codegraph.storage;

import com.purchasingpower.codegraph.configuration.CodeGraphProperties;
import com.purchasingpower.codegraph.dependency.DependencyResolver;
import com.purchasingpower.codegraph.exception.GraphConstraintViolationException;
import com.purchasingpower.codegraph.model.dependency.ResolvedDependency;
import com.purchasingpower.codegraph.model.graph.EmbeddingSet;
import com.purchasingpower.codegraph.model.graph.GraphWritePlan;
import com.purchasingpower.codegraph.model.graph.PlannedStatement;
import com.purchasingpower.codegraph.model.source.CallKind;
import com.purchasingpower.codegraph.model.source.CallSite;
import com.purchasingpower.codegraph.model.source.ClassDeclaration;
import com.purchasingpower.codegraph.model.source.DocRecord;
import com.purchasingpower.codegraph.model.source.FileRecord;
import com.purchasingpower.codegraph.model.source.ImportRecord;
import com.purchasingpower.codegraph.model.source.ImportType;
import com.purchasingpower.codegraph.model.source.InterfaceDeclaration;
import com.purchasingpower.codegraph.model.source.MethodRecord;
import com.purchasingpower.codegraph.model.source.ParameterRecord;
import com.purchasingpower.codegraph.model.source.TypeKind;
import com.purchasingpower.codegraph.storage.TypeIndex.TypeRef;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Turns extracted files into the ordered statements of one write run.
 *
 * <p>All cross-file decisions happen here, once every declaration is known:
 * inheritance targets, parameter types, call targets and dependency versions.
 * Each of them either resolves to exactly one node or produces no row. The
 * plan is a pure function of its input, so writing the same input twice sends
 * the same statements.
 */
@Slf4j
@Component
public class GraphWritePlanner {

    public static final String STEP_DIRECTORIES = "directories";
    public static final String STEP_DIRECTORY_HIERARCHY = "directory_hierarchy";
    public static final String STEP_FILES = "files";
    public static final String STEP_CLASSES = "classes";
    public static final String STEP_INTERFACES = "interfaces";
    public static final String STEP_CLASS_EXTENDS = "class_extends";
    public static final String STEP_INTERFACE_EXTENDS = "interface_extends";
    public static final String STEP_CLASS_IMPLEMENTS = "class_implements";
    public static final String STEP_METHODS = "methods";
    public static final String STEP_FILE_DECLARES_METHOD = "file_declares_method";
    public static final String STEP_CLASS_CONTAINS_METHOD = "class_contains_method";
    public static final String STEP_INTERFACE_CONTAINS_METHOD = "interface_contains_method";
    public static final String STEP_PARAMETERS = "parameters";
    public static final String STEP_PARAMETER_CLASS_TYPE = "parameter_class_type";
    public static final String STEP_PARAMETER_INTERFACE_TYPE = "parameter_interface_type";
    public static final String STEP_IMPORTS = "imports";
    public static final String STEP_DEPENDENCIES = "dependencies";
    public static final String STEP_CALLS = "calls";
    public static final String STEP_INSTANTIATES = "instantiates";
    public static final String STEP_DOCS = "docs";
    public static final String STEP_FILE_DOCS = "file_docs";
    public static final String STEP_CLASS_DOCS = "class_docs";
    public static final String STEP_INTERFACE_DOCS = "interface_docs";
    public static final String STEP_METHOD_DOCS = "method_docs";

    private final String embeddingProperty;
    private final String embeddingType;

    @Autowired
    public GraphWritePlanner(CodeGraphProperties properties) {
        this(properties.getWriter().getEmbeddingProperty(), properties.getWriter().getEmbeddingType());
    }

    public GraphWritePlanner(String embeddingProperty, String embeddingType) {
        this.embeddingProperty = embeddingProperty;
        this.embeddingType = embeddingType;
    }

    /**
     * Build the plan. Rejects the whole input before anything is planned when a
     * method has no signature.
     *
     * @param files extracted files; embeddings are index-aligned with this order
     * @param versions coordinate to version map
     * @param embeddings optional vectors, ignored when their length does not match
     */
    public GraphWritePlan plan(List<FileRecord> files, Map<String, String> versions, EmbeddingSet embeddings) {
        List<MethodRecord> methods = files.stream()
                .flatMap(file -> file.getMethods().stream())
                .toList();
        validateSignatures(methods);

        EmbeddingSet vectors = embeddings == null ? EmbeddingSet.empty() : embeddings;
        List<List<Float>> fileVectors = aligned(vectors.fileVectors(), files.size(), "file");
        List<List<Float>> methodVectors = aligned(vectors.methodVectors(), methods.size(), "method");

        TypeIndex types = new TypeIndex(files);
        MethodIndex methodIndex = new MethodIndex(files);

        GraphWritePlan plan = new GraphWritePlan();
        planDirectories(files, plan);
        planFiles(files, fileVectors, plan);
        planTypes(files, plan);
        planInheritance(files, types, plan);
        planMethods(methods, methodVectors, plan);
        planParameters(methods, types, plan);
        planImports(files, versions, plan);
        planCalls(methods, types, methodIndex, plan);
        planDocs(files, plan);

        log.info("🗺️  Write plan: {} statements, {} rows ({} files, {} methods)",
                plan.getStatements().size(), plan.totalRows(), files.size(), methods.size());
        return plan;
    }

    private void validateSignatures(List<MethodRecord> methods) {
        for (MethodRecord method : methods) {
            String signature = method.getMethodSignature();
            if (signature == null || signature.isBlank()) {
                throw new GraphConstraintViolationException("method_signature_exists",
                        "Method " + method.getName() + " in " + method.getFile() + " has no method_signature");
            }
        }
    }

    private List<List<Float>> aligned(List<List<Float>> vectors, int expected, String kind) {
        if (vectors.isEmpty()) {
            return null;
        }
        if (vectors.size() != expected) {
            log.warn("⚠️  Ignoring {} embeddings: got {} vectors for {} {}s", kind, vectors.size(), expected, kind);
            return null;
        }
        return vectors;
    }

    private void planDirectories(List<FileRecord> files, GraphWritePlan plan) {
        Set<String> paths = new TreeSet<>();
        for (FileRecord file : files) {
            String directory = file.directory();
            paths.add(directory);
            while (!directory.isEmpty()) {
                directory = parentOf(directory);
                paths.add(directory);
            }
        }

        List<Map<String, Object>> directories = new ArrayList<>();
        List<Map<String, Object>> hierarchy = new ArrayList<>();
        for (String path : paths) {
            directories.add(row("path", path, "name", path.substring(path.lastIndexOf('/') + 1)));
            if (!path.isEmpty()) {
                hierarchy.add(row("parent", parentOf(path), "path", path));
            }
        }
        plan.add(statement(STEP_DIRECTORIES, CypherStatements.DIRECTORIES, directories));
        plan.add(statement(STEP_DIRECTORY_HIERARCHY, CypherStatements.DIRECTORY_HIERARCHY, hierarchy));
    }

    private void planFiles(List<FileRecord> files, List<List<Float>> vectors, GraphWritePlan plan) {
        List<Map<String, Object>> rows = new ArrayList<>(files.size());
        for (int i = 0; i < files.size(); i++) {
            FileRecord file = files.get(i);
            rows.add(row(
                    "path", file.getPath(),
                    "name", file.getPath().substring(file.getPath().lastIndexOf('/') + 1),
                    "directory", file.directory(),
                    "package", file.getPackageName(),
                    "language", file.getLanguage(),
                    "ecosystem", file.getEcosystem(),
                    "total_lines", file.getTotalLines(),
                    "code_lines", file.getCodeLines(),
                    "method_count", file.getMethodCount(),
                    "class_count", file.getClassCount(),
                    "interface_count", file.getInterfaceCount(),
                    "embedding", vectors == null ? null : vectors.get(i),
                    "embedding_type", vectors == null ? null : embeddingType));
        }
        plan.add(new PlannedStatement(STEP_FILES, CypherStatements.files(embeddingProperty), rows, vectors != null));
    }

    private void planTypes(List<FileRecord> files, GraphWritePlan plan) {
        List<Map<String, Object>> classes = new ArrayList<>();
        List<Map<String, Object>> interfaces = new ArrayList<>();
        for (FileRecord file : files) {
            for (ClassDeclaration cls : file.getClasses()) {
                classes.add(row(
                        "name", cls.getName(),
                        "file", cls.getFile(),
                        "package", cls.getPackageName(),
                        "line", cls.getLine(),
                        "modifiers", cls.getModifiers(),
                        "is_abstract", cls.isAbstract(),
                        "is_final", cls.isFinal(),
                        "estimated_lines", cls.getEstimatedLines()));
            }
            for (InterfaceDeclaration iface : file.getInterfaces()) {
                interfaces.add(row(
                        "name", iface.getName(),
                        "file", iface.getFile(),
                        "package", iface.getPackageName(),
                        "line", iface.getLine(),
                        "modifiers", iface.getModifiers(),
                        "method_count", iface.getMethodCount(),
                        "estimated_lines", iface.getEstimatedLines()));
            }
        }
        plan.add(statement(STEP_CLASSES, CypherStatements.CLASSES, classes));
        plan.add(statement(STEP_INTERFACES, CypherStatements.INTERFACES, interfaces));
    }

    private void planInheritance(List<FileRecord> files, TypeIndex types, GraphWritePlan plan) {
        List<Map<String, Object>> classExtends = new ArrayList<>();
        List<Map<String, Object>> interfaceExtends = new ArrayList<>();
        List<Map<String, Object>> implementsRows = new ArrayList<>();

        for (FileRecord file : files) {
            for (ClassDeclaration cls : file.getClasses()) {
                if (cls.getExtendsType() != null) {
                    inheritanceRow(cls.getName(), cls.getFile(), cls.getExtendsType(), TypeKind.CLASS, types)
                            .ifPresent(classExtends::add);
                }
                for (String iface : cls.getImplementsTypes()) {
                    inheritanceRow(cls.getName(), cls.getFile(), iface, TypeKind.INTERFACE, types)
                            .ifPresent(implementsRows::add);
                }
            }
            for (InterfaceDeclaration iface : file.getInterfaces()) {
                for (String parent : iface.getExtendsTypes()) {
                    inheritanceRow(iface.getName(), iface.getFile(), parent, TypeKind.INTERFACE, types)
                            .ifPresent(interfaceExtends::add);
                }
            }
        }

        plan.add(statement(STEP_CLASS_EXTENDS, CypherStatements.CLASS_EXTENDS, classExtends));
        plan.add(statement(STEP_INTERFACE_EXTENDS, CypherStatements.INTERFACE_EXTENDS, interfaceExtends));
        plan.add(statement(STEP_CLASS_IMPLEMENTS, CypherStatements.CLASS_IMPLEMENTS, implementsRows));
    }

    private Optional<Map<String, Object>> inheritanceRow(String name, String file, String target,
                                                         TypeKind targetKind, TypeIndex types) {
        Optional<TypeRef> resolved = types.resolveFrom(target, file)
                .filter(ref -> ref.kind() == targetKind)
                .filter(ref -> !(ref.name().equals(name) && ref.file().equals(file)));
        if (resolved.isEmpty()) {
            log.debug("No unique {} for '{}' referenced by {} in {}", targetKind.getLabel(), target, name, file);
        }
        return resolved.map(ref -> row("name", name, "file", file, "target_name", ref.name(), "target_file", ref.file()));
    }

    private void planMethods(List<MethodRecord> methods, List<List<Float>> vectors, GraphWritePlan plan) {
        List<Map<String, Object>> rows = new ArrayList<>(methods.size());
        List<Map<String, Object>> declares = new ArrayList<>(methods.size());
        List<Map<String, Object>> classContains = new ArrayList<>();
        List<Map<String, Object>> interfaceContains = new ArrayList<>();

        for (int i = 0; i < methods.size(); i++) {
            MethodRecord method = methods.get(i);
            rows.add(row(
                    "method_signature", method.getMethodSignature(),
                    "name", method.getName(),
                    "file", method.getFile(),
                    "line", method.getLine(),
                    "end_line", method.getEndLine(),
                    "class_name", method.getClassName(),
                    "containing_type", method.getContainingType() == null ? null : method.getContainingType().getWireName(),
                    "modifiers", method.getModifiers(),
                    "is_static", method.isStatic(),
                    "is_abstract", method.isAbstract(),
                    "is_final", method.isFinal(),
                    "is_private", method.isPrivate(),
                    "is_public", method.isPublic(),
                    "return_type", method.getReturnType(),
                    "estimated_lines", method.getEstimatedLines(),
                    "embedding", vectors == null ? null : vectors.get(i),
                    "embedding_type", vectors == null ? null : embeddingType));

            declares.add(row("file", method.getFile(), "method_signature", method.getMethodSignature()));
            if (method.getClassName() != null) {
                Map<String, Object> owner = row(
                        "class_name", method.getClassName(),
                        "file", method.getFile(),
                        "method_signature", method.getMethodSignature());
                if (method.getContainingType() == TypeKind.INTERFACE) {
                    interfaceContains.add(owner);
                } else {
                    classContains.add(owner);
                }
            }
        }

        plan.add(new PlannedStatement(STEP_METHODS, CypherStatements.methods(embeddingProperty), rows, vectors != null));
        plan.add(statement(STEP_FILE_DECLARES_METHOD, CypherStatements.FILE_DECLARES_METHOD, declares));
        plan.add(statement(STEP_CLASS_CONTAINS_METHOD, CypherStatements.CLASS_CONTAINS_METHOD, classContains));
        plan.add(statement(STEP_INTERFACE_CONTAINS_METHOD, CypherStatements.INTERFACE_CONTAINS_METHOD, interfaceContains));
    }

    private void planParameters(List<MethodRecord> methods, TypeIndex types, GraphWritePlan plan) {
        List<Map<String, Object>> parameters = new ArrayList<>();
        List<Map<String, Object>> classTypes = new ArrayList<>();
        List<Map<String, Object>> interfaceTypes = new ArrayList<>();

        for (MethodRecord method : methods) {
            List<ParameterRecord> params = method.getParameters();
            for (int index = 0; index < params.size(); index++) {
                ParameterRecord param = params.get(index);
                parameters.add(row(
                        "method_signature", method.getMethodSignature(),
                        "index", index,
                        "name", param.getName(),
                        "type", param.getType()));

                Optional<TypeRef> type = types.resolveUnique(param.getType());
                if (type.isEmpty()) {
                    continue;
                }
                Map<String, Object> edge = row(
                        "method_signature", method.getMethodSignature(),
                        "index", index,
                        "type_name", type.get().name(),
                        "type_file", type.get().file());
                if (type.get().kind() == TypeKind.INTERFACE) {
                    interfaceTypes.add(edge);
                } else {
                    classTypes.add(edge);
                }
            }
        }

        plan.add(statement(STEP_PARAMETERS, CypherStatements.PARAMETERS, parameters));
        plan.add(statement(STEP_PARAMETER_CLASS_TYPE, CypherStatements.PARAMETER_CLASS_TYPE, classTypes));
        plan.add(statement(STEP_PARAMETER_INTERFACE_TYPE, CypherStatements.PARAMETER_INTERFACE_TYPE, interfaceTypes));
    }

    private void planImports(List<FileRecord> files, Map<String, String> versions, GraphWritePlan plan) {
        DependencyResolver resolver = new DependencyResolver(versions == null ? Map.of() : versions);
        List<Map<String, Object>> imports = new ArrayList<>();
        Map<String, Map<String, Object>> dependencies = new LinkedHashMap<>();
        Set<String> declaredPackages = files.stream()
                .map(FileRecord::getPackageName)
                .filter(pkg -> pkg != null && !pkg.isBlank())
                .collect(Collectors.toSet());

        for (FileRecord file : files) {
            for (ImportRecord imp : file.getImports()) {
                ImportType importType = importTypeOf(imp, declaredPackages);
                imports.add(row(
                        "import_path", imp.getImportPath(),
                        "file", file.getPath(),
                        "is_static", imp.isStatic(),
                        "is_wildcard", imp.isWildcard(),
                        "import_type", importType == null ? null : importType.getWireName()));

                if (importType != ImportType.EXTERNAL || dependencies.containsKey(imp.getImportPath())) {
                    continue;
                }
                ResolvedDependency dependency = resolver.resolve(imp.getImportPath());
                if (!dependency.isVersioned()) {
                    log.debug("No version for {} (package {})", imp.getImportPath(), dependency.packageName());
                }
                dependencies.put(imp.getImportPath(), row(
                        "import_path", imp.getImportPath(),
                        "package", dependency.packageName(),
                        "group_id", dependency.groupId(),
                        "artifact_id", dependency.artifactId(),
                        "version", dependency.version(),
                        "language", file.getLanguage(),
                        "ecosystem", file.getEcosystem()));
            }
        }

        plan.add(statement(STEP_IMPORTS, CypherStatements.IMPORTS, imports));
        plan.add(statement(STEP_DEPENDENCIES, CypherStatements.DEPENDENCIES, new ArrayList<>(dependencies.values())));
    }

    /**
     * Imports of a package declared by a file of this run are internal,
     * whatever prefixes were configured at extraction time.
     */
    static ImportType importTypeOf(ImportRecord imp, Set<String> declaredPackages) {
        if (imp.getImportType() == ImportType.EXTERNAL
                && declaredPackages.contains(DependencyResolver.packageOf(imp.getImportPath()))) {
            return ImportType.INTERNAL;
        }
        return imp.getImportType();
    }

    private void planCalls(List<MethodRecord> methods, TypeIndex types, MethodIndex methodIndex, GraphWritePlan plan) {
        Map<String, Map<String, Object>> calls = new LinkedHashMap<>();
        Set<String> instantiations = new LinkedHashSet<>();
        List<Map<String, Object>> instantiates = new ArrayList<>();
        int unresolved = 0;

        for (MethodRecord caller : methods) {
            for (CallSite call : caller.getCalls()) {
                if (call.getCallType() == CallKind.CONSTRUCTOR) {
                    Optional<TypeRef> target = types.resolveFrom(call.getTargetClass(), caller.getFile())
                            .filter(ref -> ref.kind() == TypeKind.CLASS);
                    if (target.isEmpty()) {
                        unresolved++;
                        continue;
                    }
                    String key = caller.getMethodSignature() + "->" + target.get().file() + "::" + target.get().name();
                    if (instantiations.add(key)) {
                        instantiates.add(row(
                                "caller", caller.getMethodSignature(),
                                "class_name", target.get().name(),
                                "class_file", target.get().file()));
                    }
                    continue;
                }

                Optional<String> callee = resolveCallee(caller, call, types, methodIndex);
                if (callee.isEmpty()) {
                    unresolved++;
                    continue;
                }
                String type = call.getCallType().getWireName();
                calls.putIfAbsent(caller.getMethodSignature() + "->" + callee.get() + "|" + type, row(
                        "caller", caller.getMethodSignature(),
                        "callee", callee.get(),
                        "type", type,
                        "qualifier", call.getQualifier()));
            }
        }

        log.debug("Call resolution: {} CALLS, {} INSTANTIATES, {} call sites left unlinked",
                calls.size(), instantiates.size(), unresolved);
        plan.add(statement(STEP_CALLS, CypherStatements.CALLS, new ArrayList<>(calls.values())));
        plan.add(statement(STEP_INSTANTIATES, CypherStatements.INSTANTIATES, instantiates));
    }

    private Optional<String> resolveCallee(MethodRecord caller, CallSite call, TypeIndex types, MethodIndex methodIndex) {
        String file = caller.getFile();
        String name = call.getMethodName();

        return switch (call.getCallType()) {
            case SAME_CLASS, THIS -> methodIndex.uniqueSignature(caller.getClassName(), file, name);
            case SUPER -> superclassOf(caller, types)
                    .flatMap(parent -> types.resolveFrom(parent, file))
                    .filter(ref -> ref.kind() == TypeKind.CLASS)
                    .flatMap(ref -> methodIndex.uniqueSignature(ref.name(), ref.file(), name));
            case STATIC -> types.resolveFrom(call.getTargetClass(), file)
                    .flatMap(ref -> methodIndex.uniqueSignature(ref.name(), ref.file(), name, MethodRecord::isStatic));
            case INSTANCE -> receiverType(caller, call.getQualifier())
                    .flatMap(receiver -> types.resolveFrom(receiver, file))
                    .flatMap(ref -> methodIndex.uniqueSignature(ref.name(), ref.file(), name));
            case CONSTRUCTOR -> Optional.empty();
        };
    }

    private Optional<String> superclassOf(MethodRecord caller, TypeIndex types) {
        return types.declaration(caller.getClassName(), caller.getFile())
                .filter(ClassDeclaration.class::isInstance)
                .map(declaration -> ((ClassDeclaration) declaration).getExtendsType());
    }

    /**
     * Declared type of a same-named parameter, else the qualifier capitalized
     * ({@code userService} to {@code UserService}). Chained calls have no
     * qualifier and no receiver.
     */
    private Optional<String> receiverType(MethodRecord caller, String qualifier) {
        if (qualifier == null || qualifier.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(caller.getParameters().stream()
                .filter(param -> qualifier.equals(param.getName()) && param.getType() != null)
                .map(ParameterRecord::getType)
                .findFirst()
                .orElse(Character.toUpperCase(qualifier.charAt(0)) + qualifier.substring(1)));
    }

    private void planDocs(List<FileRecord> files, GraphWritePlan plan) {
        Map<String, Map<String, Object>> docs = new LinkedHashMap<>();
        List<Map<String, Object>> fileDocs = new ArrayList<>();
        List<Map<String, Object>> classDocs = new ArrayList<>();
        List<Map<String, Object>> interfaceDocs = new ArrayList<>();
        List<Map<String, Object>> methodDocs = new ArrayList<>();

        for (FileRecord file : files) {
            for (DocRecord doc : file.getDocs()) {
                String docFile = doc.getFile() == null ? file.getPath() : doc.getFile();
                docs.putIfAbsent(docFile + ":" + doc.getStartLine() + ":" + doc.getEndLine(), row(
                        "file", docFile,
                        "start_line", doc.getStartLine(),
                        "end_line", doc.getEndLine(),
                        "kind", doc.getKind() == null ? null : doc.getKind().getWireName(),
                        "scope", doc.getScope() == null ? null : doc.getScope().getWireName(),
                        "text", doc.getText()));

                if (doc.getScope() == null) {
                    continue;
                }
                Map<String, Object> edge = row(
                        "file", docFile,
                        "start_line", doc.getStartLine(),
                        "end_line", doc.getEndLine(),
                        "owner", doc.getOwner());
                switch (doc.getScope()) {
                    case FILE -> fileDocs.add(edge);
                    case CLASS -> classDocs.add(edge);
                    case INTERFACE -> interfaceDocs.add(edge);
                    case METHOD -> methodDocs.add(edge);
                }
            }
        }

        plan.add(statement(STEP_DOCS, CypherStatements.DOCS, new ArrayList<>(docs.values())));
        plan.add(statement(STEP_FILE_DOCS, CypherStatements.FILE_HAS_DOC, fileDocs));
        plan.add(statement(STEP_CLASS_DOCS, CypherStatements.CLASS_HAS_DOC, classDocs));
        plan.add(statement(STEP_INTERFACE_DOCS, CypherStatements.INTERFACE_HAS_DOC, interfaceDocs));
        plan.add(statement(STEP_METHOD_DOCS, CypherStatements.METHOD_HAS_DOC, methodDocs));
    }

    private static PlannedStatement statement(String step, String cypher, List<Map<String, Object>> rows) {
        return new PlannedStatement(step, cypher, rows, false);
    }

    private static String parentOf(String path) {
        int slash = path.lastIndexOf('/');
        return slash < 0 ? "" : path.substring(0, slash);
    }

    /**
     * Row parameters from alternating keys and values. Values may be null, so
     * {@link Map#of} is not usable here.
     */
    static Map<String, Object> row(Object... keyValues) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            row.put((String) keyValues[i], keyValues[i + 1]);
        }
        return row;
    }
}
