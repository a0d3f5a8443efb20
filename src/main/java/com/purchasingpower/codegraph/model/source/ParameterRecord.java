package com.purchasingpower.codegraph.model.source;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ParameterRecord {
    private String name;
    private String type; // null when the declared type is unknown
}
