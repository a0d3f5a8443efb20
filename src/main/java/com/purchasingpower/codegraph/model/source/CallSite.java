package com.purchasingpower.codegraph.model.source;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One invocation found in a method body, classified syntactically.
 *
 * <p>{@code targetClass} is a hint only. For instance calls it is the
 * receiver variable name, for super calls the literal {@code super}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CallSite {
    private String methodName;
    private String targetClass;
    private String qualifier;
    private CallKind callType;
}
