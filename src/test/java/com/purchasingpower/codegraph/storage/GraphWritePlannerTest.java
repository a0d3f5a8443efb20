package com.purchasingpower.codegraph.storage;

import com.purchasingpower.codegraph.exception.GraphConstraintViolationException;
import com.purchasingpower.codegraph.extraction.CallResolver;
import com.purchasingpower.codegraph.extraction.ImportClassifier;
import com.purchasingpower.codegraph.extraction.impl.JavaDeclarationExtractor;
import com.purchasingpower.codegraph.model.extraction.FileOutcome;
import com.purchasingpower.codegraph.model.graph.EmbeddingSet;
import com.purchasingpower.codegraph.model.graph.GraphWritePlan;
import com.purchasingpower.codegraph.model.graph.PlannedStatement;
import com.purchasingpower.codegraph.model.source.FileRecord;
import com.purchasingpower.codegraph.model.source.MethodRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Graph Write Planner Tests")
class GraphWritePlannerTest {

    private JavaDeclarationExtractor extractor;
    private GraphWritePlanner planner;

    @BeforeEach
    void setUp() {
        extractor = new JavaDeclarationExtractor(new CallResolver(), new ImportClassifier(List.of("com.acme.")));
        planner = new GraphWritePlanner("embedding", "unixcoder");
    }

    @Test
    @DisplayName("Bare call to a method of the same class becomes a same_class CALLS row")
    void testPlan_SameClassCall() {
        // Given
        FileRecord file = extract("A.java", """
                class A {
                    void a() {
                        b();
                    }

                    void b() {
                    }
                }
                """);

        // When
        GraphWritePlan plan = planner.plan(List.of(file), Map.of(), EmbeddingSet.empty());

        // Then
        List<Map<String, Object>> calls = rows(plan, GraphWritePlanner.STEP_CALLS);
        assertEquals(1, calls.size());
        assertEquals("A#a():void", calls.get(0).get("caller"));
        assertEquals("A#b():void", calls.get(0).get("callee"));
        assertEquals("same_class", calls.get(0).get("type"));
        assertNull(calls.get(0).get("qualifier"));
    }

    @Test
    @DisplayName("Parameter of an ambiguous simple type gets a node but no type edge")
    void testPlan_AmbiguousParameterType() {
        // Given: Z declared in two packages, parameter typed Z without qualifier
        FileRecord za = extract("a/Z.java", "package a;\npublic class Z { }\n");
        FileRecord zb = extract("b/Z.java", "package b;\npublic class Z { }\n");
        FileRecord user = extract("c/User.java", """
                package c;
                public class User {
                    void take(Z z) { }
                }
                """);

        // When
        GraphWritePlan plan = planner.plan(List.of(za, zb, user), Map.of(), EmbeddingSet.empty());

        // Then
        List<Map<String, Object>> parameters = rows(plan, GraphWritePlanner.STEP_PARAMETERS);
        assertEquals(1, parameters.size());
        assertEquals("c.User#take(Z):void", parameters.get(0).get("method_signature"));
        assertEquals(0, parameters.get(0).get("index"));
        assertEquals("Z", parameters.get(0).get("type"));
        assertNull(plan.find(GraphWritePlanner.STEP_PARAMETER_CLASS_TYPE));
        assertNull(plan.find(GraphWritePlanner.STEP_PARAMETER_INTERFACE_TYPE));
    }

    @Test
    @DisplayName("Parameter of a unique type is linked to it")
    void testPlan_UniqueParameterType() {
        FileRecord shape = extract("g/Shape.java", "package g;\npublic interface Shape { }\n");
        FileRecord user = extract("g/Canvas.java", """
                package g;
                public class Canvas {
                    void draw(java.util.List<Shape> all, Shape one) { }
                }
                """);

        GraphWritePlan plan = planner.plan(List.of(shape, user), Map.of(), EmbeddingSet.empty());

        List<Map<String, Object>> edges = rows(plan, GraphWritePlanner.STEP_PARAMETER_INTERFACE_TYPE);
        assertEquals(1, edges.size());
        assertEquals(1, edges.get(0).get("index"));
        assertEquals("Shape", edges.get(0).get("type_name"));
        assertEquals("g/Shape.java", edges.get(0).get("type_file"));
    }

    @Test
    @DisplayName("External import is linked to a versioned dependency")
    void testPlan_ImportDependency() {
        // Given
        FileRecord file = extract("Json.java", """
                import com.fasterxml.jackson.core.JsonFactory;
                import java.util.List;
                import com.acme.Util;
                class Json { }
                """);

        // When
        GraphWritePlan plan = planner.plan(List.of(file),
                Map.of("com.fasterxml.jackson.core", "2.15.0"), EmbeddingSet.empty());

        // Then
        assertEquals(3, rows(plan, GraphWritePlanner.STEP_IMPORTS).size());
        List<Map<String, Object>> dependencies = rows(plan, GraphWritePlanner.STEP_DEPENDENCIES);
        assertEquals(1, dependencies.size());
        assertEquals("com.fasterxml.jackson.core.JsonFactory", dependencies.get(0).get("import_path"));
        assertEquals("com.fasterxml.jackson.core", dependencies.get(0).get("package"));
        assertEquals("2.15.0", dependencies.get(0).get("version"));
        assertEquals("java", dependencies.get(0).get("language"));
        assertEquals("maven", dependencies.get(0).get("ecosystem"));
    }

    @Test
    @DisplayName("Import of a package declared in the run is internal without configured prefixes")
    void testPlan_ImportOfIndexedPackage() {
        // Given
        JavaDeclarationExtractor unconfigured = new JavaDeclarationExtractor(new CallResolver(), new ImportClassifier(List.of()));
        FileRecord a = ((FileOutcome.Parsed) unconfigured.extract("com/acme/a/A.java", """
                package com.acme.a;
                import com.acme.b.B;
                import com.acme.b.*;
                import org.slf4j.Logger;
                class A { }
                """)).record();
        FileRecord b = ((FileOutcome.Parsed) unconfigured.extract("com/acme/b/B.java", """
                package com.acme.b;
                public class B { }
                """)).record();

        // When
        GraphWritePlan plan = planner.plan(List.of(a, b), Map.of(), EmbeddingSet.empty());

        // Then
        List<Map<String, Object>> imports = rows(plan, GraphWritePlanner.STEP_IMPORTS);
        assertEquals(List.of("internal", "internal", "external"),
                imports.stream().map(row -> row.get("import_type")).toList());
        List<Map<String, Object>> dependencies = rows(plan, GraphWritePlanner.STEP_DEPENDENCIES);
        assertEquals(List.of("org.slf4j.Logger"), dependencies.stream().map(row -> row.get("import_path")).toList());
    }

    @Test
    @DisplayName("A run whose imports all stay inside the tree plans no dependency rows")
    void testPlan_NoExternalImports() {
        extractor = new JavaDeclarationExtractor(new CallResolver(), new ImportClassifier(List.of()));
        FileRecord a = extract("com/acme/a/A.java", """
                package com.acme.a;
                import com.acme.b.B;
                class A { }
                """);
        FileRecord b = extract("com/acme/b/B.java", "package com.acme.b;\npublic class B { }\n");

        GraphWritePlan plan = planner.plan(List.of(a, b), Map.of(), EmbeddingSet.empty());

        assertNull(plan.find(GraphWritePlanner.STEP_DEPENDENCIES));
    }

    @Test
    @DisplayName("A method without signature rejects the whole input")
    void testPlan_MissingSignature() {
        FileRecord file = extract("A.java", "class A { void a() { } }");
        MethodRecord broken = file.getMethods().get(0);
        broken.setMethodSignature(null);

        GraphConstraintViolationException e = assertThrows(GraphConstraintViolationException.class,
                () -> planner.plan(List.of(file), Map.of(), EmbeddingSet.empty()));

        assertEquals("method_signature_exists", e.getConstraintName());
    }

    @Test
    @DisplayName("Planning the same input twice yields identical statements")
    void testPlan_Deterministic() {
        List<FileRecord> files = List.of(
                extract("src/a/Base.java", "package a;\npublic class Base { protected void init() { } }\n"),
                extract("src/a/Child.java", """
                        package a;
                        /** Child. */
                        public class Child extends Base implements Runnable {
                            public void run() { super.init(); helper(); }
                            private void helper() { }
                        }
                        """));

        GraphWritePlan first = planner.plan(files, Map.of("org.slf4j", "2.0.9"), EmbeddingSet.empty());
        GraphWritePlan second = planner.plan(files, Map.of("org.slf4j", "2.0.9"), EmbeddingSet.empty());

        assertEquals(first.getStatements(), second.getStatements());
        assertTrue(first.getStatements().stream().allMatch(s -> s.cypher().contains("MERGE")));
    }

    @Test
    @DisplayName("Inheritance edges are written only for resolvable targets of the right kind")
    void testPlan_Inheritance() {
        FileRecord base = extract("x/Base.java", "package x;\npublic abstract class Base { }\n");
        FileRecord api = extract("x/Api.java", "package x;\npublic interface Api { }\n");
        FileRecord ext = extract("x/Ext.java", "package x;\npublic interface Ext extends Api, Unknown { }\n");
        FileRecord impl = extract("x/Impl.java", """
                package x;
                public class Impl extends Base implements Ext, java.io.Serializable { }
                """);
        FileRecord wrong = extract("x/Wrong.java", "package x;\npublic class Wrong extends Api { }\n");

        GraphWritePlan plan = planner.plan(List.of(base, api, ext, impl, wrong), Map.of(), EmbeddingSet.empty());

        List<Map<String, Object>> classExtends = rows(plan, GraphWritePlanner.STEP_CLASS_EXTENDS);
        assertEquals(1, classExtends.size());
        assertEquals("Impl", classExtends.get(0).get("name"));
        assertEquals("Base", classExtends.get(0).get("target_name"));

        List<Map<String, Object>> implementsRows = rows(plan, GraphWritePlanner.STEP_CLASS_IMPLEMENTS);
        assertEquals(1, implementsRows.size());
        assertEquals("Ext", implementsRows.get(0).get("target_name"));

        List<Map<String, Object>> interfaceExtends = rows(plan, GraphWritePlanner.STEP_INTERFACE_EXTENDS);
        assertEquals(1, interfaceExtends.size());
        assertEquals("Api", interfaceExtends.get(0).get("target_name"));
    }

    @Test
    @DisplayName("Static, instance, super and constructor calls resolve to unique targets")
    void testPlan_CallKinds() {
        FileRecord util = extract("s/Util.java", """
                package s;
                public class Util {
                    public static int twice(int x) { return 2 * x; }
                    public void log(String m) { }
                    public void log(Object o) { }
                }
                """);
        FileRecord repo = extract("s/OrderRepository.java", """
                package s;
                public class OrderRepository {
                    public void save(Object o) { }
                }
                """);
        FileRecord base = extract("s/Base.java", "package s;\npublic class Base { void close() { } }\n");
        FileRecord service = extract("s/Service.java", """
                package s;
                public class Service extends Base {
                    void handle(Util util) {
                        Util.twice(1);
                        orderRepository.save(this);
                        util.log("x");
                        super.close();
                        Util u = new Util();
                        Util v = new Util();
                    }
                }
                """);

        GraphWritePlan plan = planner.plan(List.of(util, repo, base, service), Map.of(), EmbeddingSet.empty());

        List<Map<String, Object>> calls = rows(plan, GraphWritePlanner.STEP_CALLS);
        assertEquals(List.of("s.Util#twice(int):int", "s.OrderRepository#save(Object):void", "s.Base#close():void"),
                calls.stream().map(row -> row.get("callee")).toList());
        assertEquals(List.of("static", "instance", "super"),
                calls.stream().map(row -> row.get("type")).toList());
        assertEquals("orderRepository", calls.get(1).get("qualifier"));

        List<Map<String, Object>> instantiates = rows(plan, GraphWritePlanner.STEP_INSTANTIATES);
        assertEquals(1, instantiates.size());
        assertEquals("Util", instantiates.get(0).get("class_name"));
        assertEquals("s/Util.java", instantiates.get(0).get("class_file"));
    }

    @Test
    @DisplayName("Directories include every ancestor and the root")
    void testPlan_Directories() {
        FileRecord file = extract("src/main/A.java", "class A { }");
        FileRecord root = extract("Root.java", "class Root { }");

        GraphWritePlan plan = planner.plan(List.of(file, root), Map.of(), EmbeddingSet.empty());

        assertEquals(List.of("", "src", "src/main"), rows(plan, GraphWritePlanner.STEP_DIRECTORIES).stream()
                .map(row -> row.get("path")).toList());
        assertEquals(List.of(Map.of("parent", "", "path", "src"), Map.of("parent", "src", "path", "src/main")),
                rows(plan, GraphWritePlanner.STEP_DIRECTORY_HIERARCHY));
        assertEquals("src/main", rows(plan, GraphWritePlanner.STEP_FILES).get(0).get("directory"));
        assertEquals("", rows(plan, GraphWritePlanner.STEP_FILES).get(1).get("directory"));
    }

    @Test
    @DisplayName("Aligned embeddings are attached, misaligned ones are ignored")
    void testPlan_Embeddings() {
        List<FileRecord> files = List.of(extract("A.java", "class A { void a() { } void b() { } }"));
        List<Float> vector = List.of(0.1f, 0.2f);

        GraphWritePlan aligned = planner.plan(files, Map.of(),
                new EmbeddingSet(List.of(vector), List.of(vector, vector)));
        GraphWritePlan misaligned = planner.plan(files, Map.of(),
                new EmbeddingSet(List.of(vector, vector), List.of(vector)));

        PlannedStatement fileStatement = aligned.find(GraphWritePlanner.STEP_FILES);
        assertTrue(fileStatement.carriesEmbeddings());
        assertEquals(vector, fileStatement.rows().get(0).get("embedding"));
        assertEquals("unixcoder", fileStatement.rows().get(0).get("embedding_type"));
        assertTrue(fileStatement.cypher().contains("SET f.embedding = row.embedding"));
        assertTrue(aligned.find(GraphWritePlanner.STEP_METHODS).carriesEmbeddings());

        assertFalse(misaligned.find(GraphWritePlanner.STEP_FILES).carriesEmbeddings());
        assertNull(misaligned.find(GraphWritePlanner.STEP_FILES).rows().get(0).get("embedding"));
        assertFalse(misaligned.find(GraphWritePlanner.STEP_METHODS).carriesEmbeddings());
    }

    @Test
    @DisplayName("Docs are planned with owner edges per scope")
    void testPlan_Docs() {
        FileRecord file = extract("D.java", """
                /* File header. */
                package d;

                /** Type doc. */
                public class D {
                    /** Method doc. */
                    void m() {
                        // inline
                        int x = 1;
                    }
                }
                """);

        GraphWritePlan plan = planner.plan(List.of(file), Map.of(), EmbeddingSet.empty());

        assertEquals(4, rows(plan, GraphWritePlanner.STEP_DOCS).size());
        assertEquals(1, rows(plan, GraphWritePlanner.STEP_FILE_DOCS).size());
        assertEquals("D", rows(plan, GraphWritePlanner.STEP_CLASS_DOCS).get(0).get("owner"));
        List<Map<String, Object>> methodDocs = rows(plan, GraphWritePlanner.STEP_METHOD_DOCS);
        assertEquals(2, methodDocs.size());
        assertTrue(methodDocs.stream().allMatch(row -> "d.D#m():void".equals(row.get("owner"))));
    }

    private FileRecord extract(String path, String source) {
        FileOutcome outcome = extractor.extract(path, source);
        assertInstanceOf(FileOutcome.Parsed.class, outcome, () -> "Parse failed: " + outcome);
        return ((FileOutcome.Parsed) outcome).record();
    }

    private static List<Map<String, Object>> rows(GraphWritePlan plan, String step) {
        PlannedStatement statement = plan.find(step);
        assertNotNull(statement, "No statement for step " + step);
        return statement.rows();
    }
}
