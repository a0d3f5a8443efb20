package com.purchasingpower.codegraph.configuration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "codegraph")
public class CodeGraphProperties {

    /**
     * Tree indexed by the startup runner. Blank disables it.
     */
    private String sourceRoot;

    private boolean runOnStartup;

    /**
     * Import prefixes tagged "internal"; java. and javax. are always "standard".
     */
    @NotNull
    private List<String> internalImportPrefixes = new ArrayList<>();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private Neo4jProperties neo4j = new Neo4jProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private ExtractionProperties extraction = new ExtractionProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private WriterProperties writer = new WriterProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private SchemaProperties schema = new SchemaProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private ArtifactProperties artifacts = new ArtifactProperties();
}
