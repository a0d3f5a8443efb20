package com.purchasingpower.codegraph.storage;

import com.purchasingpower.codegraph.model.source.FileRecord;
import com.purchasingpower.codegraph.model.source.ImportRecord;
import com.purchasingpower.codegraph.model.source.TypeDeclaration;
import com.purchasingpower.codegraph.model.source.TypeKind;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Every Class and Interface of a run, indexed for name resolution.
 *
 * <p>Resolution is a bounded heuristic, not a type checker. A lookup that
 * yields zero or several candidates returns empty and the caller writes no
 * edge.
 */
public class TypeIndex {

    private static final Pattern ANNOTATION = Pattern.compile("@[\\w.]+(\\([^)]*\\))?\\s*");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /**
     * Identity of a type node plus what resolution needs.
     */
    public record TypeRef(String name, String file, String packageName, TypeKind kind) {

        public String qualifiedName() {
            return packageName == null || packageName.isBlank() ? name : packageName + "." + name;
        }
    }

    private final Map<String, List<TypeRef>> byQualifiedName = new HashMap<>();
    private final Map<String, List<TypeRef>> bySimpleName = new HashMap<>();
    private final Map<String, TypeDeclaration> declarations = new HashMap<>();
    private final Map<String, FileRecord> filesByPath = new HashMap<>();

    public TypeIndex(List<FileRecord> files) {
        for (FileRecord file : files) {
            filesByPath.putIfAbsent(file.getPath(), file);
            for (TypeDeclaration type : file.typeDeclarations()) {
                TypeRef ref = new TypeRef(type.getName(), type.getFile(), type.getPackageName(), type.kind());
                if (declarations.putIfAbsent(identity(ref.name(), ref.file()), type) != null) {
                    continue;
                }
                byQualifiedName.computeIfAbsent(ref.qualifiedName(), k -> new ArrayList<>()).add(ref);
                bySimpleName.computeIfAbsent(ref.name(), k -> new ArrayList<>()).add(ref);
            }
        }
    }

    /**
     * The declaration named {@code name} in {@code file}.
     */
    public Optional<TypeDeclaration> declaration(String name, String file) {
        return Optional.ofNullable(declarations.get(identity(name, file)));
    }

    /**
     * Strict global rule: a qualified name must match exactly one declaration by
     * fully qualified name, a simple name exactly one declaration in the whole
     * graph.
     */
    public Optional<TypeRef> resolveUnique(String typeName) {
        String name = normalize(typeName);
        if (name == null) {
            return Optional.empty();
        }
        if (name.indexOf('.') >= 0) {
            return single(byQualifiedName.get(name));
        }
        return single(bySimpleName.get(name));
    }

    /**
     * Resolve a type name as written in {@code fromFile}.
     *
     * <p>Order: exact qualified name; single-type import of that file; the
     * file's own package; wildcard imports of that file; global uniqueness.
     * An explicit import of a type the graph does not contain resolves to
     * nothing rather than to a same-named type elsewhere.
     */
    public Optional<TypeRef> resolveFrom(String typeName, String fromFile) {
        String name = normalize(typeName);
        if (name == null) {
            return Optional.empty();
        }

        if (name.indexOf('.') >= 0) {
            Optional<TypeRef> exact = single(byQualifiedName.get(name));
            if (exact.isPresent() || !Character.isUpperCase(name.charAt(0))) {
                return exact;
            }
            // Outer.Inner: nested types are indexed by their own simple name
            name = name.substring(name.lastIndexOf('.') + 1);
        }

        List<TypeRef> candidates = bySimpleName.getOrDefault(name, List.of());
        if (candidates.isEmpty()) {
            return Optional.empty();
        }

        FileRecord file = filesByPath.get(fromFile);
        if (file == null) {
            return single(candidates);
        }

        List<String> wildcardPackages = new ArrayList<>();
        for (ImportRecord imp : file.getImports()) {
            if (imp.isStatic()) {
                continue;
            }
            if (imp.isWildcard()) {
                wildcardPackages.add(imp.getImportPath());
            } else if (simpleName(imp.getImportPath()).equals(name)) {
                return single(byQualifiedName.get(imp.getImportPath()));
            }
        }

        List<TypeRef> samePackage = candidates.stream()
                .filter(ref -> Objects.equals(blankToNull(ref.packageName()), blankToNull(file.getPackageName())))
                .toList();
        if (!samePackage.isEmpty()) {
            return single(samePackage);
        }

        List<TypeRef> imported = candidates.stream()
                .filter(ref -> ref.packageName() != null && wildcardPackages.contains(ref.packageName()))
                .toList();
        if (!imported.isEmpty()) {
            return single(imported);
        }

        return single(candidates);
    }

    /**
     * Reduce a declared type to the name that identifies a declaration: drops
     * annotations, type arguments, array and varargs markers. Returns null for
     * blank input.
     */
    public static String normalize(String typeName) {
        if (typeName == null) {
            return null;
        }
        String name = ANNOTATION.matcher(typeName).replaceAll("");
        name = stripTypeArguments(name);
        name = name.replace("...", "").replace("[]", "");
        name = WHITESPACE.matcher(name).replaceAll("");
        if (name.startsWith("?extends")) {
            name = name.substring("?extends".length());
        } else if (name.startsWith("?super")) {
            name = name.substring("?super".length());
        }
        return name.isEmpty() || "?".equals(name) ? null : name;
    }

    private static String stripTypeArguments(String name) {
        StringBuilder out = new StringBuilder(name.length());
        int depth = 0;
        for (char c : name.toCharArray()) {
            if (c == '<') {
                depth++;
            } else if (c == '>') {
                depth = Math.max(0, depth - 1);
            } else if (depth == 0) {
                out.append(c);
            }
        }
        return out.toString();
    }

    private static Optional<TypeRef> single(List<TypeRef> candidates) {
        return candidates != null && candidates.size() == 1 ? Optional.of(candidates.get(0)) : Optional.empty();
    }

    private static String simpleName(String qualifiedName) {
        return qualifiedName.substring(qualifiedName.lastIndexOf('.') + 1);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    private static String identity(String name, String file) {
        return file + "::" + name;
    }
}
