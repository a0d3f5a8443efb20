package com.purchasingpower.codegraph.dependency.impl;

import com.purchasingpower.codegraph.exception.ManifestParseException;
import com.purchasingpower.codegraph.model.dependency.Coordinate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Maven Manifest Parser Tests")
class MavenManifestParserTest {

    private final MavenManifestParser parser = new MavenManifestParser();

    @Test
    @DisplayName("Should resolve a property reference to its declared value")
    void testParse_ResolvesProperty() {
        // Given
        String pom = pom("""
                <properties><x>2.15.0</x></properties>
                <dependencies>
                  <dependency>
                    <groupId>com.fasterxml.jackson.core</groupId>
                    <artifactId>jackson-databind</artifactId>
                    <version>${x}</version>
                  </dependency>
                </dependencies>
                """);

        // When
        List<Coordinate> coordinates = parser.parse("pom.xml", pom);

        // Then
        assertEquals(List.of(new Coordinate("com.fasterxml.jackson.core", "jackson-databind", "2.15.0")), coordinates);
    }

    @Test
    @DisplayName("Should drop a dependency whose property is undeclared")
    void testParse_DropsUnresolvedProperty() {
        String pom = pom("""
                <dependencies>
                  <dependency>
                    <groupId>com.fasterxml.jackson.core</groupId>
                    <artifactId>jackson-databind</artifactId>
                    <version>${x}</version>
                  </dependency>
                  <dependency>
                    <groupId>org.slf4j</groupId>
                    <artifactId>slf4j-api</artifactId>
                    <version>2.0.9</version>
                  </dependency>
                </dependencies>
                """);

        List<Coordinate> coordinates = parser.parse("pom.xml", pom);

        assertEquals(List.of(new Coordinate("org.slf4j", "slf4j-api", "2.0.9")), coordinates);
    }

    @Test
    @DisplayName("Should resolve nested properties and project coordinates")
    void testParse_NestedAndProjectProperties() {
        String pom = pom("""
                <groupId>com.acme</groupId>
                <artifactId>shop</artifactId>
                <version>1.4.0</version>
                <properties>
                  <netty.major>4.1</netty.major>
                  <netty.version>${netty.major}.100.Final</netty.version>
                </properties>
                <dependencies>
                  <dependency>
                    <groupId>io.netty</groupId>
                    <artifactId>netty-all</artifactId>
                    <version>${netty.version}</version>
                  </dependency>
                  <dependency>
                    <groupId>${project.groupId}</groupId>
                    <artifactId>shop-api</artifactId>
                    <version>${project.version}</version>
                  </dependency>
                </dependencies>
                """);

        List<Coordinate> coordinates = parser.parse("pom.xml", pom);

        assertEquals(List.of(
                new Coordinate("io.netty", "netty-all", "4.1.100.Final"),
                new Coordinate("com.acme", "shop-api", "1.4.0")), coordinates);
    }

    @Test
    @DisplayName("Should take versions of unversioned dependencies from dependencyManagement")
    void testParse_ManagedVersion() {
        String pom = pom("""
                <dependencyManagement>
                  <dependencies>
                    <dependency>
                      <groupId>org.neo4j.driver</groupId>
                      <artifactId>neo4j-java-driver</artifactId>
                      <version>5.19.0</version>
                    </dependency>
                  </dependencies>
                </dependencyManagement>
                <dependencies>
                  <dependency>
                    <groupId>org.neo4j.driver</groupId>
                    <artifactId>neo4j-java-driver</artifactId>
                  </dependency>
                  <dependency>
                    <groupId>org.unmanaged</groupId>
                    <artifactId>lib</artifactId>
                  </dependency>
                </dependencies>
                """);

        List<Coordinate> coordinates = parser.parse("pom.xml", pom);

        assertEquals(2, coordinates.size());
        assertTrue(coordinates.stream().allMatch(c -> c.artifact().equals("neo4j-java-driver")
                && c.version().equals("5.19.0")));
    }

    @Test
    @DisplayName("Should fail on malformed XML")
    void testParse_Malformed() {
        ManifestParseException e = assertThrows(ManifestParseException.class,
                () -> parser.parse("broken/pom.xml", "<project><dependencies>"));

        assertEquals("broken/pom.xml", e.getManifestPath());
    }

    private static String pom(String body) {
        return """
                <?xml version="1.0" encoding="UTF-8"?>
                <project xmlns="http://maven.apache.org/POM/4.0.0">
                  <modelVersion>4.0.0</modelVersion>
                %s</project>
                """.formatted(body);
    }
}
