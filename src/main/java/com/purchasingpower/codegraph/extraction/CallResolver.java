package com.purchasingpower.codegraph.extraction;

import com.purchasingpower.codegraph.model.source.CallKind;
import com.purchasingpower.codegraph.model.source.CallSite;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds invocations in a method body and classifies them by their qualifier.
 *
 * <p>This is a syntactic heuristic, not a type checker. A lowercase qualifier is
 * taken to be an instance receiver and an uppercase one a type name; neither is
 * checked against declarations. The graph writer only turns a call into an edge
 * when its hint identifies exactly one method, so a wrong hint drops the edge
 * instead of linking the wrong method.
 */
@Slf4j
@Component
public class CallResolver {

    private static final Pattern CALL = Pattern.compile("\\b(?:(\\w+)\\s*\\.\\s*)?(\\w+)\\s*\\(");

    private static final Pattern CONSTRUCTOR =
            Pattern.compile("\\bnew\\s+((?:[a-zA-Z_]\\w*\\s*\\.\\s*)*[A-Z]\\w*)\\s*(?:<.*?>)?\\s*\\(");

    // Text blocks first so their quotes are not read as string literals.
    private static final Pattern LITERALS_AND_COMMENTS = Pattern.compile(
            "\"\"\"[\\s\\S]*?\"\"\""
                    + "|\"(?:\\\\.|[^\"\\\\\\n])*\""
                    + "|'(?:\\\\.|[^'\\\\\\n])+'"
                    + "|//[^\\n]*"
                    + "|/\\*[\\s\\S]*?\\*/");

    private static final Set<String> KEYWORDS = Set.of(
            "if", "for", "while", "switch", "catch", "synchronized", "return",
            "throw", "new", "assert", "super", "this", "try");

    /**
     * Target hint and kind for an invocation.
     */
    public record Classification(String targetClass, CallKind kind) {
    }

    /**
     * Classify an invocation by its qualifier.
     *
     * @param qualifier identifier before the dot, null for a bare call
     * @param enclosingType simple name of the type declaring the calling method
     */
    public static Classification classify(String qualifier, String enclosingType) {
        if (qualifier == null) {
            return new Classification(enclosingType, CallKind.SAME_CLASS);
        }
        if ("this".equals(qualifier)) {
            return new Classification(enclosingType, CallKind.THIS);
        }
        if ("super".equals(qualifier)) {
            return new Classification("super", CallKind.SUPER);
        }
        if (Character.isUpperCase(qualifier.charAt(0))) {
            return new Classification(qualifier, CallKind.STATIC);
        }
        return new Classification(qualifier, CallKind.INSTANCE);
    }

    /**
     * Extract the calls made in a method body.
     *
     * @param body source text of the method body
     * @param enclosingType simple name of the declaring type, may be null
     * @return calls in source order; repeated calls appear repeatedly
     */
    public List<CallSite> resolve(String body, String enclosingType) {
        if (body == null || body.isBlank()) {
            return List.of();
        }

        String code = blankLiteralsAndComments(body);
        List<PositionedCall> found = new ArrayList<>();

        Matcher call = CALL.matcher(code);
        while (call.find()) {
            String qualifier = call.group(1);
            String methodName = call.group(2);

            if (KEYWORDS.contains(methodName.toLowerCase())) {
                continue;
            }
            // Capitalized names are constructor invocations or annotations, handled below
            if (Character.isUpperCase(methodName.charAt(0)) || Character.isDigit(methodName.charAt(0))) {
                continue;
            }

            CallSite site;
            if (qualifier == null && isChained(code, call.start())) {
                // receiver is an expression such as a().b(); nothing to hint with
                site = CallSite.builder()
                        .methodName(methodName)
                        .callType(CallKind.INSTANCE)
                        .build();
            } else {
                Classification classification = classify(qualifier, enclosingType);
                site = CallSite.builder()
                        .methodName(methodName)
                        .targetClass(classification.targetClass())
                        .qualifier(qualifier)
                        .callType(classification.kind())
                        .build();
            }
            found.add(new PositionedCall(call.start(), site));
        }

        Matcher constructor = CONSTRUCTOR.matcher(code);
        while (constructor.find()) {
            String type = constructor.group(1).replaceAll("\\s+", "");
            found.add(new PositionedCall(constructor.start(), CallSite.builder()
                    .methodName(simpleName(type))
                    .targetClass(type)
                    .callType(CallKind.CONSTRUCTOR)
                    .build()));
        }

        found.sort(Comparator.comparingInt(PositionedCall::position));
        log.trace("Resolved {} calls in {}", found.size(), enclosingType);
        return found.stream().map(PositionedCall::site).toList();
    }

    private static boolean isChained(String code, int start) {
        for (int i = start - 1; i >= 0; i--) {
            char c = code.charAt(i);
            if (!Character.isWhitespace(c)) {
                return c == '.';
            }
        }
        return false;
    }

    private static String simpleName(String type) {
        int dot = type.lastIndexOf('.');
        return dot < 0 ? type : type.substring(dot + 1);
    }

    /**
     * Replaces comments and string/char literals with spaces, keeping offsets and line breaks.
     */
    static String blankLiteralsAndComments(String code) {
        StringBuilder blanked = new StringBuilder(code);
        Matcher matcher = LITERALS_AND_COMMENTS.matcher(code);
        while (matcher.find()) {
            for (int i = matcher.start(); i < matcher.end(); i++) {
                if (blanked.charAt(i) != '\n') {
                    blanked.setCharAt(i, ' ');
                }
            }
        }
        return blanked.toString();
    }

    private record PositionedCall(int position, CallSite site) {
    }
}
