package com.purchasingpower.codegraph.storage;

import java.util.List;
import java.util.stream.Stream;

/**
 * A named constraint of the managed schema.
 */
public record ConstraintDefinition(String name, String cypher) {

    public static final String METHOD_SIGNATURE_EXISTS = "method_signature_exists";

    private static final List<ConstraintDefinition> UNIQUENESS = List.of(
            of("directory_path", "FOR (d:Directory) REQUIRE d.path IS UNIQUE"),
            of("file_path", "FOR (f:File) REQUIRE f.path IS UNIQUE"),
            of("class_name_file", "FOR (c:Class) REQUIRE (c.name, c.file) IS UNIQUE"),
            of("interface_name_file", "FOR (i:Interface) REQUIRE (i.name, i.file) IS UNIQUE"),
            of("method_signature_unique", "FOR (m:Method) REQUIRE m.method_signature IS UNIQUE"),
            of("parameter_method_index", "FOR (p:Parameter) REQUIRE (p.method_signature, p.index) IS UNIQUE"),
            of("import_path", "FOR (i:Import) REQUIRE i.import_path IS UNIQUE"),
            of("external_dependency_package", "FOR (e:ExternalDependency) REQUIRE e.package IS UNIQUE"),
            of("doc_span", "FOR (d:Doc) REQUIRE (d.file, d.start_line, d.end_line) IS UNIQUE"));

    private static final ConstraintDefinition SIGNATURE_EXISTS =
            of(METHOD_SIGNATURE_EXISTS, "FOR (m:Method) REQUIRE m.method_signature IS NOT NULL");

    /**
     * Managed constraints in creation order. The existence constraint needs
     * Neo4j Enterprise and is only included on request.
     */
    public static List<ConstraintDefinition> managed(boolean includeExistence) {
        if (!includeExistence) {
            return UNIQUENESS;
        }
        return Stream.concat(UNIQUENESS.stream(), Stream.of(SIGNATURE_EXISTS)).toList();
    }

    private static ConstraintDefinition of(String name, String body) {
        return new ConstraintDefinition(name, "CREATE CONSTRAINT " + name + " IF NOT EXISTS " + body);
    }
}
