package com.purchasingpower.codegraph.configuration;

import lombok.Data;

@Data
public class ArtifactProperties {

    /**
     * Where extraction artifacts are written after each run. Blank disables writing.
     */
    private String directory;
}
