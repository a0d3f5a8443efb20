package com.purchasingpower.codegraph.model.source;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImportRecord {
    private String importPath;
    private boolean isStatic;
    private boolean isWildcard;
    private ImportType importType;
    private String file;
}
