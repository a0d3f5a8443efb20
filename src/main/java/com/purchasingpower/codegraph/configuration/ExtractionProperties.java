package com.purchasingpower.codegraph.configuration;

import jakarta.validation.constraints.Min;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class ExtractionProperties {

    @Min(1)
    private int workers = 8;

    /**
     * Capacity of the channel between parse workers and the collector.
     */
    @Min(1)
    private int channelCapacity = 256;

    /**
     * Directory names the source walker never descends into.
     */
    private List<String> excludeDirs = new ArrayList<>(
            List.of(".git", "target", "build", "node_modules", ".gradle", ".idea", "out"));
}
