package com.purchasingpower.codegraph.storage;

/**
 * UNWIND statements of the write phase. Every statement upserts by natural key
 * with MERGE and reads its rows from {@code $rows}.
 */
public final class CypherStatements {

    private CypherStatements() {
    }

    public static final String DIRECTORIES = """
            UNWIND $rows AS row
            MERGE (d:Directory {path: row.path})
            SET d.name = row.name
            """;

    public static final String DIRECTORY_HIERARCHY = """
            UNWIND $rows AS row
            MATCH (parent:Directory {path: row.parent})
            MATCH (child:Directory {path: row.path})
            MERGE (parent)-[:CONTAINS]->(child)
            """;

    private static final String FILES = """
            UNWIND $rows AS row
            MERGE (f:File {path: row.path})
            SET f.name = row.name,
                f.package = row.package,
                f.language = row.language,
                f.ecosystem = row.ecosystem,
                f.total_lines = row.total_lines,
                f.code_lines = row.code_lines,
                f.method_count = row.method_count,
                f.class_count = row.class_count,
                f.interface_count = row.interface_count
            FOREACH (_ IN CASE WHEN row.embedding IS NULL THEN [] ELSE [1] END |
                SET f.%s = row.embedding, f.embedding_type = row.embedding_type)
            WITH f, row
            MATCH (d:Directory {path: row.directory})
            MERGE (d)-[:CONTAINS]->(f)
            """;

    public static final String CLASSES = """
            UNWIND $rows AS row
            MERGE (c:Class {name: row.name, file: row.file})
            SET c.package = row.package,
                c.line = row.line,
                c.modifiers = row.modifiers,
                c.is_abstract = row.is_abstract,
                c.is_final = row.is_final,
                c.estimated_lines = row.estimated_lines
            WITH c, row
            MATCH (f:File {path: row.file})
            MERGE (f)-[:DEFINES]->(c)
            """;

    public static final String INTERFACES = """
            UNWIND $rows AS row
            MERGE (i:Interface {name: row.name, file: row.file})
            SET i.package = row.package,
                i.line = row.line,
                i.modifiers = row.modifiers,
                i.method_count = row.method_count,
                i.estimated_lines = row.estimated_lines
            WITH i, row
            MATCH (f:File {path: row.file})
            MERGE (f)-[:DEFINES]->(i)
            """;

    public static final String CLASS_EXTENDS = """
            UNWIND $rows AS row
            MATCH (child:Class {name: row.name, file: row.file})
            MATCH (parent:Class {name: row.target_name, file: row.target_file})
            MERGE (child)-[:EXTENDS]->(parent)
            """;

    public static final String INTERFACE_EXTENDS = """
            UNWIND $rows AS row
            MATCH (child:Interface {name: row.name, file: row.file})
            MATCH (parent:Interface {name: row.target_name, file: row.target_file})
            MERGE (child)-[:EXTENDS]->(parent)
            """;

    public static final String CLASS_IMPLEMENTS = """
            UNWIND $rows AS row
            MATCH (c:Class {name: row.name, file: row.file})
            MATCH (i:Interface {name: row.target_name, file: row.target_file})
            MERGE (c)-[:IMPLEMENTS]->(i)
            """;

    private static final String METHODS = """
            UNWIND $rows AS row
            MERGE (m:Method {method_signature: row.method_signature})
            SET m.id = row.method_signature,
                m.name = row.name,
                m.file = row.file,
                m.line = row.line,
                m.end_line = row.end_line,
                m.class_name = row.class_name,
                m.containing_type = row.containing_type,
                m.modifiers = row.modifiers,
                m.is_static = row.is_static,
                m.is_abstract = row.is_abstract,
                m.is_final = row.is_final,
                m.is_private = row.is_private,
                m.is_public = row.is_public,
                m.return_type = row.return_type,
                m.estimated_lines = row.estimated_lines
            FOREACH (_ IN CASE WHEN row.embedding IS NULL THEN [] ELSE [1] END |
                SET m.%s = row.embedding, m.embedding_type = row.embedding_type)
            """;

    public static final String FILE_DECLARES_METHOD = """
            UNWIND $rows AS row
            MATCH (f:File {path: row.file})
            MATCH (m:Method {method_signature: row.method_signature})
            MERGE (f)-[:DECLARES]->(m)
            """;

    public static final String CLASS_CONTAINS_METHOD = """
            UNWIND $rows AS row
            MATCH (t:Class {name: row.class_name, file: row.file})
            MATCH (m:Method {method_signature: row.method_signature})
            MERGE (t)-[:CONTAINS_METHOD]->(m)
            """;

    public static final String INTERFACE_CONTAINS_METHOD = """
            UNWIND $rows AS row
            MATCH (t:Interface {name: row.class_name, file: row.file})
            MATCH (m:Method {method_signature: row.method_signature})
            MERGE (t)-[:CONTAINS_METHOD]->(m)
            """;

    public static final String PARAMETERS = """
            UNWIND $rows AS row
            MATCH (m:Method {method_signature: row.method_signature})
            MERGE (p:Parameter {method_signature: row.method_signature, index: row.index})
            SET p.name = row.name,
                p.type = row.type
            MERGE (m)-[:HAS_PARAMETER]->(p)
            """;

    public static final String PARAMETER_CLASS_TYPE = """
            UNWIND $rows AS row
            MATCH (p:Parameter {method_signature: row.method_signature, index: row.index})
            MATCH (t:Class {name: row.type_name, file: row.type_file})
            MERGE (p)-[:OF_TYPE]->(t)
            """;

    public static final String PARAMETER_INTERFACE_TYPE = """
            UNWIND $rows AS row
            MATCH (p:Parameter {method_signature: row.method_signature, index: row.index})
            MATCH (t:Interface {name: row.type_name, file: row.type_file})
            MERGE (p)-[:OF_TYPE]->(t)
            """;

    public static final String IMPORTS = """
            UNWIND $rows AS row
            MERGE (i:Import {import_path: row.import_path})
            SET i.is_static = row.is_static,
                i.is_wildcard = row.is_wildcard,
                i.import_type = row.import_type
            WITH i, row
            MATCH (f:File {path: row.file})
            MERGE (f)-[:IMPORTS]->(i)
            """;

    // coalesce keeps a version another import already resolved
    public static final String DEPENDENCIES = """
            UNWIND $rows AS row
            MERGE (e:ExternalDependency {package: row.package})
            SET e.language = row.language,
                e.ecosystem = row.ecosystem,
                e.group_id = coalesce(row.group_id, e.group_id),
                e.artifact_id = coalesce(row.artifact_id, e.artifact_id),
                e.version = coalesce(row.version, e.version)
            WITH e, row
            MATCH (i:Import {import_path: row.import_path})
            MERGE (i)-[:DEPENDS_ON]->(e)
            """;

    public static final String CALLS = """
            UNWIND $rows AS row
            MATCH (caller:Method {method_signature: row.caller})
            MATCH (callee:Method {method_signature: row.callee})
            MERGE (caller)-[r:CALLS {type: row.type}]->(callee)
            SET r.qualifier = row.qualifier
            """;

    public static final String INSTANTIATES = """
            UNWIND $rows AS row
            MATCH (m:Method {method_signature: row.caller})
            MATCH (c:Class {name: row.class_name, file: row.class_file})
            MERGE (m)-[:INSTANTIATES]->(c)
            """;

    public static final String DOCS = """
            UNWIND $rows AS row
            MERGE (d:Doc {file: row.file, start_line: row.start_line, end_line: row.end_line})
            SET d.kind = row.kind,
                d.scope = row.scope,
                d.text = row.text
            """;

    public static final String FILE_HAS_DOC = """
            UNWIND $rows AS row
            MATCH (o:File {path: row.file})
            MATCH (d:Doc {file: row.file, start_line: row.start_line, end_line: row.end_line})
            MERGE (o)-[:HAS_DOC]->(d)
            """;

    public static final String CLASS_HAS_DOC = """
            UNWIND $rows AS row
            MATCH (o:Class {name: row.owner, file: row.file})
            MATCH (d:Doc {file: row.file, start_line: row.start_line, end_line: row.end_line})
            MERGE (o)-[:HAS_DOC]->(d)
            """;

    public static final String INTERFACE_HAS_DOC = """
            UNWIND $rows AS row
            MATCH (o:Interface {name: row.owner, file: row.file})
            MATCH (d:Doc {file: row.file, start_line: row.start_line, end_line: row.end_line})
            MERGE (o)-[:HAS_DOC]->(d)
            """;

    public static final String METHOD_HAS_DOC = """
            UNWIND $rows AS row
            MATCH (o:Method {method_signature: row.owner})
            MATCH (d:Doc {file: row.file, start_line: row.start_line, end_line: row.end_line})
            MERGE (o)-[:HAS_DOC]->(d)
            """;

    public static final String SHOW_CONSTRAINTS = "SHOW CONSTRAINTS YIELD name RETURN name";

    public static final String COUNT_NODES = "MATCH (n) RETURN count(n) AS count";

    public static final String COUNT_RELATIONSHIPS = "MATCH ()-[r]->() RETURN count(r) AS count";

    /**
     * File upsert writing vectors to {@code embeddingProperty}. The name must be
     * a plain identifier; it is validated at configuration binding.
     */
    public static String files(String embeddingProperty) {
        return FILES.formatted(embeddingProperty);
    }

    public static String methods(String embeddingProperty) {
        return METHODS.formatted(embeddingProperty);
    }
}
