package com.purchasingpower.codegraph.extraction;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Canonical method identifiers.
 *
 * <p>Shape: {@code <package>.<Type>#<method>(<type1>,<type2>):<returnType>}. The
 * package and type segments are dropped when unknown, an unknown parameter type
 * renders as {@code ?}, a missing return type as {@code void}. Parameter types
 * and their order are part of the identifier, so overloads stay distinct.
 */
public final class SignatureBuilder {

    public static final String UNKNOWN_TYPE = "?";
    public static final String VOID = "void";

    private SignatureBuilder() {
    }

    public static String build(String packageName, String declaringType, String methodName,
                               List<String> parameterTypes, String returnType) {
        StringBuilder signature = new StringBuilder();
        boolean hasPackage = !isBlank(packageName);
        boolean hasType = !isBlank(declaringType);

        if (hasPackage && hasType) {
            signature.append(packageName).append('.').append(declaringType).append('#');
        } else if (hasType) {
            signature.append(declaringType).append('#');
        } else if (hasPackage) {
            signature.append(packageName).append('.');
        }

        String params = parameterTypes == null ? "" : parameterTypes.stream()
                .map(type -> isBlank(type) ? UNKNOWN_TYPE : type.strip())
                .collect(Collectors.joining(","));

        return signature.append(methodName)
                .append('(').append(params).append(')')
                .append(':').append(isBlank(returnType) ? VOID : returnType.strip())
                .toString();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
