package com.purchasingpower.codegraph.extraction;

import com.purchasingpower.codegraph.model.source.CallKind;
import com.purchasingpower.codegraph.model.source.CallSite;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Call Resolver Tests")
class CallResolverTest {

    private CallResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new CallResolver();
    }

    @Test
    @DisplayName("Bare call resolves to same_class with the enclosing type")
    void testClassify_NoQualifier() {
        CallResolver.Classification result = CallResolver.classify(null, "OrderService");

        assertEquals(CallKind.SAME_CLASS, result.kind());
        assertEquals("OrderService", result.targetClass());
    }

    @Test
    @DisplayName("this and super qualifiers resolve to their own kinds")
    void testClassify_ThisAndSuper() {
        assertEquals(CallKind.THIS, CallResolver.classify("this", "A").kind());
        assertEquals("A", CallResolver.classify("this", "A").targetClass());
        assertEquals(CallKind.SUPER, CallResolver.classify("super", "A").kind());
        assertEquals("super", CallResolver.classify("super", "A").targetClass());
    }

    @Test
    @DisplayName("Uppercase qualifier is static, lowercase is instance")
    void testClassify_StaticAndInstance() {
        CallResolver.Classification staticCall = CallResolver.classify("Foo", "A");
        CallResolver.Classification instanceCall = CallResolver.classify("repository", "A");

        assertEquals(CallKind.STATIC, staticCall.kind());
        assertEquals("Foo", staticCall.targetClass());
        assertEquals(CallKind.INSTANCE, instanceCall.kind());
        assertEquals("repository", instanceCall.targetClass());
    }

    @Test
    @DisplayName("Should find calls of every kind in source order")
    void testResolve_AllKinds() {
        // Given
        String body = """
                {
                    validate(order);
                    this.audit();
                    super.close();
                    Objects.requireNonNull(order);
                    repository.save(order);
                    Order copy = new Order(order);
                }""";

        // When
        List<CallSite> calls = resolver.resolve(body, "OrderService");

        // Then
        assertEquals(6, calls.size());
        assertCall(calls.get(0), "validate", CallKind.SAME_CLASS, "OrderService", null);
        assertCall(calls.get(1), "audit", CallKind.THIS, "OrderService", "this");
        assertCall(calls.get(2), "close", CallKind.SUPER, "super", "super");
        assertCall(calls.get(3), "requireNonNull", CallKind.STATIC, "Objects", "Objects");
        assertCall(calls.get(4), "save", CallKind.INSTANCE, "repository", "repository");
        assertCall(calls.get(5), "Order", CallKind.CONSTRUCTOR, "Order", null);
    }

    @Test
    @DisplayName("Should skip control-flow keywords")
    void testResolve_SkipsKeywords() {
        String body = """
                {
                    if (ready()) {
                        for (int i = 0; i < 3; i++) { }
                        while (x) { }
                        synchronized (lock) { }
                        return (compute());
                    }
                    switch (mode) { default: }
                    try { } catch (Exception e) { throw (e); }
                }""";

        List<String> names = resolver.resolve(body, "A").stream().map(CallSite::getMethodName).toList();

        assertEquals(List.of("ready", "compute"), names);
    }

    @Test
    @DisplayName("Should ignore calls inside comments and string literals")
    void testResolve_IgnoresCommentsAndStrings() {
        String body = """
                {
                    // hidden();
                    /* alsoHidden(); */
                    log("format(%s)");
                    char c = '(';
                }""";

        List<CallSite> calls = resolver.resolve(body, "A");

        assertEquals(1, calls.size());
        assertEquals("log", calls.get(0).getMethodName());
    }

    @Test
    @DisplayName("Chained call is an instance call without qualifier")
    void testResolve_ChainedCall() {
        List<CallSite> calls = resolver.resolve("{ builder().name(x).build(); }", "A");

        assertEquals(3, calls.size());
        assertEquals(CallKind.SAME_CLASS, calls.get(0).getCallType());
        assertCall(calls.get(1), "name", CallKind.INSTANCE, null, null);
        assertCall(calls.get(2), "build", CallKind.INSTANCE, null, null);
    }

    @Test
    @DisplayName("Should capture qualified and generic constructor targets")
    void testResolve_Constructors() {
        List<CallSite> calls = resolver.resolve(
                "{ var m = new java.util.HashMap<String, Integer>(); var e = new Outer.Entry(1); }", "A");

        assertEquals(2, calls.size());
        assertCall(calls.get(0), "HashMap", CallKind.CONSTRUCTOR, "java.util.HashMap", null);
        assertCall(calls.get(1), "Entry", CallKind.CONSTRUCTOR, "Outer.Entry", null);
    }

    @Test
    @DisplayName("Empty body has no calls")
    void testResolve_EmptyBody() {
        assertTrue(resolver.resolve("", "A").isEmpty());
        assertTrue(resolver.resolve(null, "A").isEmpty());
    }

    @Test
    @DisplayName("Blanking keeps offsets and line breaks")
    void testBlankLiteralsAndComments_KeepsLayout() {
        String code = "a(\"x\"); // c\nb();";

        String blanked = CallResolver.blankLiteralsAndComments(code);

        assertEquals(code.length(), blanked.length());
        assertEquals("a(   );     \nb();", blanked);
    }

    private static void assertCall(CallSite call, String name, CallKind kind, String target, String qualifier) {
        assertEquals(name, call.getMethodName());
        assertEquals(kind, call.getCallType());
        assertEquals(target, call.getTargetClass());
        assertEquals(qualifier, call.getQualifier());
    }
}
