package com.purchasingpower.codegraph.configuration;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.AuthTokens;
import org.neo4j.driver.Driver;
import org.neo4j.driver.GraphDatabase;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Neo4j driver for the graph writer and schema guard. The driver connects lazily,
 * so the context starts without a reachable database.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class Neo4jConfig {

    private final CodeGraphProperties properties;

    @Bean(destroyMethod = "close")
    public Driver neo4jDriver() {
        Neo4jProperties neo4j = properties.getNeo4j();
        log.info("Initializing Neo4j driver at: {} (database: {})", neo4j.getUri(), neo4j.getDatabase());
        return GraphDatabase.driver(neo4j.getUri(), AuthTokens.basic(neo4j.getUsername(), neo4j.getPassword()));
    }
}
