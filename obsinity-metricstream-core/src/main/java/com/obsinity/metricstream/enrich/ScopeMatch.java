package com.obsinity.metricstream.enrich;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Function names matched inside one instrumentation scope, addressed by position in the request.
 */
public record ScopeMatch(int resourceIndex, int scopeIndex, Set<String> functionNames) {

    public ScopeMatch {
        functionNames = Collections.unmodifiableSet(new LinkedHashSet<>(functionNames));
    }
}
