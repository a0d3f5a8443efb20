package com.purchasingpower.codegraph.configuration;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;
import lombok.Data;

@Data
public class WriterProperties {

    @Min(1)
    private int batchSize = 1000;

    /**
     * Smaller batches for steps that carry embedding vectors.
     */
    @Min(1)
    private int batchSizeWithEmbeddings = 600;

    @Pattern(regexp = "[A-Za-z_][A-Za-z0-9_]*")
    private String embeddingProperty = "embedding";

    private String embeddingType = "unixcoder";
}
