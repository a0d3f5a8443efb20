package com.purchasingpower.codegraph.storage.impl;

import com.purchasingpower.codegraph.configuration.CodeGraphProperties;
import com.purchasingpower.codegraph.exception.SchemaConstraintMissingException;
import com.purchasingpower.codegraph.storage.ConstraintDefinition;
import com.purchasingpower.codegraph.storage.CypherStatements;
import com.purchasingpower.codegraph.storage.IndexDefinition;
import com.purchasingpower.codegraph.storage.SchemaGuard;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.Driver;
import org.neo4j.driver.Session;
import org.neo4j.driver.SessionConfig;
import org.neo4j.driver.exceptions.ClientException;
import org.neo4j.driver.exceptions.Neo4jException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Neo4j implementation of {@link SchemaGuard}.
 *
 * <p>A missing constraint triggers one attempt to create the whole managed set
 * with {@code CREATE CONSTRAINT ... IF NOT EXISTS}; whatever is still missing
 * afterwards is fatal. The same repair creates the property indexes, whose
 * failure is only logged.
 */
@Slf4j
@Service
public class Neo4jSchemaGuard implements SchemaGuard {

    private final Driver driver;
    private final String database;
    private final List<ConstraintDefinition> constraints;

    @Autowired
    public Neo4jSchemaGuard(Driver driver, CodeGraphProperties properties) {
        this(driver, properties.getNeo4j().getDatabase(), properties.getSchema().isExistenceConstraints());
    }

    public Neo4jSchemaGuard(Driver driver, String database, boolean existenceConstraints) {
        this.driver = driver;
        this.database = database;
        this.constraints = ConstraintDefinition.managed(existenceConstraints);
    }

    @Override
    public void ensureSchema() {
        List<String> missing = missingConstraints();
        if (missing.isEmpty()) {
            log.info("✅ Schema verified: {} constraints present", constraints.size());
            return;
        }

        log.warn("⚠️  Missing constraints {}, creating managed schema", missing);
        createConstraints();
        createIndexes();

        List<String> stillMissing = missingConstraints();
        if (!stillMissing.isEmpty()) {
            log.error("❌ Schema constraints still missing after repair: {}", stillMissing);
            throw new SchemaConstraintMissingException(stillMissing);
        }
        log.info("✅ Created managed schema ({} constraints)", constraints.size());
    }

    @Override
    public List<String> missingConstraints() {
        Set<String> present;
        try (Session session = driver.session(SessionConfig.forDatabase(database))) {
            present = new HashSet<>(session.run(CypherStatements.SHOW_CONSTRAINTS)
                    .list(record -> record.get("name").asString()));
        }
        return constraints.stream()
                .map(ConstraintDefinition::name)
                .filter(name -> !present.contains(name))
                .toList();
    }

    @Override
    public List<ConstraintDefinition> managedConstraints() {
        return constraints;
    }

    private void createConstraints() {
        try (Session session = driver.session(SessionConfig.forDatabase(database))) {
            for (ConstraintDefinition constraint : constraints) {
                try {
                    session.run(constraint.cypher()).consume();
                    log.debug("Created constraint {}", constraint.name());
                } catch (ClientException e) {
                    // reported by the re-check that follows
                    log.warn("⚠️  Failed to create constraint {}: {}", constraint.name(), e.getMessage());
                }
            }
        }
    }

    private void createIndexes() {
        try (Session session = driver.session(SessionConfig.forDatabase(database))) {
            for (IndexDefinition index : IndexDefinition.propertyIndexes()) {
                try {
                    session.run(index.cypher()).consume();
                    log.debug("Created index {}", index.name());
                } catch (Neo4jException e) {
                    log.warn("⚠️  Failed to create index {} (queries will be slower): {}", index.name(), e.getMessage());
                }
            }
        }
    }
}
