package com.purchasingpower.codegraph.util;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Variable interpolation for build manifests.
 */
public final class Placeholders {

    /** {@code ${name}} as used in pom.xml. */
    public static final Pattern MAVEN = Pattern.compile("\\$\\{([^}]+)}");

    /** {@code ${name}} or {@code $name} as used in Gradle strings. */
    public static final Pattern GRADLE = Pattern.compile("\\$\\{(\\w+)}|\\$(\\w+)");

    public static final int MAX_DEPTH = 10;

    private Placeholders() {
    }

    /**
     * Substitute placeholders until none remain, following chains up to {@link #MAX_DEPTH}.
     *
     * @return the resolved value, or null when a placeholder names an undeclared
     *         variable or the chain is deeper than the limit
     */
    public static String resolve(String value, Map<String, String> variables, Pattern placeholder) {
        if (value == null) {
            return null;
        }
        String current = value;
        for (int depth = 0; depth <= MAX_DEPTH; depth++) {
            Matcher matcher = placeholder.matcher(current);
            if (!matcher.find()) {
                return current;
            }
            matcher.reset();
            StringBuilder resolved = new StringBuilder();
            while (matcher.find()) {
                String name = matcher.group(1) != null ? matcher.group(1) : matcher.group(2);
                String replacement = variables.get(name);
                if (replacement == null) {
                    return null;
                }
                matcher.appendReplacement(resolved, Matcher.quoteReplacement(replacement));
            }
            matcher.appendTail(resolved);
            current = resolved.toString();
        }
        return null;
    }
}
