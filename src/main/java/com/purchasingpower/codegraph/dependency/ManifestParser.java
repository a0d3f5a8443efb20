package com.purchasingpower.codegraph.dependency;

import com.purchasingpower.codegraph.model.dependency.Coordinate;
import com.purchasingpower.codegraph.model.dependency.ManifestFormat;

import java.util.List;

/**
 * Parser for one manifest format.
 */
public interface ManifestParser {

    ManifestFormat format();

    /**
     * Coordinates with a resolved version, in declaration order.
     *
     * @param manifestPath Path used in error messages
     * @param content Manifest text
     * @throws com.purchasingpower.codegraph.exception.ManifestParseException if the manifest is malformed
     */
    List<Coordinate> parse(String manifestPath, String content);
}
