package com.purchasingpower.codegraph.extraction;

import com.purchasingpower.codegraph.configuration.CodeGraphProperties;
import com.purchasingpower.codegraph.model.source.ImportType;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Tags imports as standard library, internal to the indexed code base, or external.
 */
@Component
public class ImportClassifier {

    private final List<String> internalPrefixes;

    @Autowired
    public ImportClassifier(CodeGraphProperties properties) {
        this(properties.getInternalImportPrefixes());
    }

    public ImportClassifier(List<String> internalPrefixes) {
        this.internalPrefixes = List.copyOf(internalPrefixes);
    }

    public ImportType classify(String importPath) {
        if (importPath.startsWith("java.") || importPath.startsWith("javax.")) {
            return ImportType.STANDARD;
        }
        for (String prefix : internalPrefixes) {
            if (importPath.startsWith(prefix)) {
                return ImportType.INTERNAL;
            }
        }
        return ImportType.EXTERNAL;
    }
}
