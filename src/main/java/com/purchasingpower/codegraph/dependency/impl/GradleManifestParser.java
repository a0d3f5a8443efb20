package com.purchasingpower.codegraph.dependency.impl;

import com.purchasingpower.codegraph.dependency.ManifestParser;
import com.purchasingpower.codegraph.model.dependency.Coordinate;
import com.purchasingpower.codegraph.model.dependency.ManifestFormat;
import com.purchasingpower.codegraph.util.Placeholders;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * build.gradle / build.gradle.kts reader.
 *
 * <p>Recognizes {@code 'group:artifact:version'} string literals (Groovy and
 * Kotlin DSL) and keyed {@code group/name/version} declarations. Versions may
 * reference variables whose name contains "version", declared anywhere in the
 * same file; entries whose version cannot be resolved are dropped.
 */
@Slf4j
@Component
public class GradleManifestParser implements ManifestParser {

    private static final Pattern INLINE = Pattern.compile(
            "['\"]([\\w.\\-]+):([\\w.\\-]+):([^'\"\\s:@]+)(?::[\\w.\\-]+)?(?:@\\w+)?['\"]");

    private static final Pattern KEYED = Pattern.compile(
            "group\\s*[:=]\\s*['\"]([^'\"]+)['\"]\\s*,\\s*"
                    + "name\\s*[:=]\\s*['\"]([^'\"]+)['\"]\\s*,\\s*"
                    + "version\\s*[:=]\\s*['\"]([^'\"]+)['\"]");

    private static final Pattern VARIABLE = Pattern.compile("(\\w+)\\s*=\\s*['\"]([^'\"]+)['\"]");

    @Override
    public ManifestFormat format() {
        return ManifestFormat.GRADLE;
    }

    @Override
    public List<Coordinate> parse(String manifestPath, String content) {
        Map<String, String> variables = readVersionVariables(content);

        List<Declaration> declarations = new ArrayList<>();
        collect(INLINE.matcher(content), declarations);
        collect(KEYED.matcher(content), declarations);
        declarations.sort(Comparator.comparingInt(Declaration::position));

        List<Coordinate> coordinates = new ArrayList<>();
        for (Declaration declaration : declarations) {
            String version = Placeholders.resolve(declaration.version(), variables, Placeholders.GRADLE);
            if (version == null) {
                log.debug("Dropping {}:{} in {}: version {} unresolved",
                        declaration.group(), declaration.artifact(), manifestPath, declaration.version());
                continue;
            }
            coordinates.add(new Coordinate(declaration.group(), declaration.artifact(), version));
        }

        log.debug("📦 {}: {} versioned dependencies, {} version variables",
                manifestPath, coordinates.size(), variables.size());
        return coordinates;
    }

    private Map<String, String> readVersionVariables(String content) {
        Map<String, String> variables = new HashMap<>();
        Matcher matcher = VARIABLE.matcher(content);
        while (matcher.find()) {
            String name = matcher.group(1);
            if (name.toLowerCase().contains("version")) {
                variables.putIfAbsent(name, matcher.group(2));
            }
        }
        return variables;
    }

    private void collect(Matcher matcher, List<Declaration> declarations) {
        while (matcher.find()) {
            declarations.add(new Declaration(matcher.start(), matcher.group(1), matcher.group(2), matcher.group(3)));
        }
    }

    private record Declaration(int position, String group, String artifact, String version) {
    }
}
