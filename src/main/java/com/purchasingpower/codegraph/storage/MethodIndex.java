package com.purchasingpower.codegraph.storage;

import com.purchasingpower.codegraph.model.source.FileRecord;
import com.purchasingpower.codegraph.model.source.MethodRecord;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Methods grouped by their declaring type, identified as (type name, file).
 */
public class MethodIndex {

    private final Map<String, List<MethodRecord>> byOwner = new HashMap<>();

    public MethodIndex(List<FileRecord> files) {
        for (FileRecord file : files) {
            for (MethodRecord method : file.getMethods()) {
                byOwner.computeIfAbsent(owner(method.getClassName(), method.getFile()), k -> new ArrayList<>())
                        .add(method);
            }
        }
    }

    /**
     * Signature of the only method named {@code name} in the given type that
     * passes {@code filter}. Overloads count as distinct candidates, so an
     * overloaded name resolves to nothing.
     */
    public Optional<String> uniqueSignature(String typeName, String file, String name, Predicate<MethodRecord> filter) {
        Set<String> signatures = new LinkedHashSet<>();
        for (MethodRecord method : byOwner.getOrDefault(owner(typeName, file), List.of())) {
            if (method.getName().equals(name) && filter.test(method)) {
                signatures.add(method.getMethodSignature());
            }
        }
        return signatures.size() == 1 ? Optional.of(signatures.iterator().next()) : Optional.empty();
    }

    public Optional<String> uniqueSignature(String typeName, String file, String name) {
        return uniqueSignature(typeName, file, name, method -> true);
    }

    private static String owner(String typeName, String file) {
        return file + "::" + typeName;
    }
}
