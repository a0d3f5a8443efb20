package com.purchasingpower.codegraph.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Placeholders Tests")
class PlaceholdersTest {

    @Test
    @DisplayName("Maven placeholders follow chains of properties")
    void testResolve_MavenChain() {
        Map<String, String> properties = Map.of(
                "jackson.version", "${jackson.base}.1",
                "jackson.base", "2.15");

        assertEquals("2.15.1", Placeholders.resolve("${jackson.version}", properties, Placeholders.MAVEN));
        assertEquals("1.0", Placeholders.resolve("1.0", properties, Placeholders.MAVEN));
    }

    @Test
    @DisplayName("Gradle accepts both the braced and the bare form")
    void testResolve_GradleForms() {
        Map<String, String> variables = Map.of("springVersion", "6.1.2");

        assertEquals("6.1.2", Placeholders.resolve("${springVersion}", variables, Placeholders.GRADLE));
        assertEquals("6.1.2", Placeholders.resolve("$springVersion", variables, Placeholders.GRADLE));
    }

    @Test
    @DisplayName("Undeclared variables and cycles resolve to null")
    void testResolve_Unresolvable() {
        Map<String, String> cycle = new HashMap<>();
        cycle.put("a", "${b}");
        cycle.put("b", "${a}");

        assertNull(Placeholders.resolve("${missing}", Map.of(), Placeholders.MAVEN));
        assertNull(Placeholders.resolve("${a}", cycle, Placeholders.MAVEN));
        assertNull(Placeholders.resolve(null, Map.of(), Placeholders.MAVEN));
    }
}
