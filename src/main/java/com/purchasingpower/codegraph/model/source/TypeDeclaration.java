package com.purchasingpower.codegraph.model.source;

import java.util.List;

/**
 * A class or interface declared in a source file.
 *
 * <p>Identity is (name, file). Inheritance references are kept as the
 * identifiers written in source and are only turned into edges once every
 * file has been extracted.
 */
public sealed interface TypeDeclaration permits ClassDeclaration, InterfaceDeclaration {

    String getName();

    String getFile();

    String getPackageName();

    int getLine();

    List<String> getModifiers();

    int getEstimatedLines();

    TypeKind kind();

    default String qualifiedName() {
        String pkg = getPackageName();
        return pkg == null || pkg.isBlank() ? getName() : pkg + "." + getName();
    }
}
