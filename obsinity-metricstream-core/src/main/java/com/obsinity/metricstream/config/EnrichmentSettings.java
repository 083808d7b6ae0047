package com.obsinity.metricstream.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Immutable enrichment configuration, built once at startup and shared by every invocation.
 *
 * @param targetFunctionNames function names that trigger a synthetic summary metric
 * @param functionNameLabelKey data point label key carrying the function name
 * @param customAttributes labels stamped onto every synthetic metric, in insertion order
 */
public record EnrichmentSettings(
        Set<String> targetFunctionNames, String functionNameLabelKey, Map<String, String> customAttributes) {

    public static final String DEFAULT_FUNCTION_NAME_LABEL_KEY = "FunctionName";

    public EnrichmentSettings {
        functionNameLabelKey = functionNameLabelKey == null ? DEFAULT_FUNCTION_NAME_LABEL_KEY : functionNameLabelKey;
        targetFunctionNames = targetFunctionNames == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(targetFunctionNames));
        customAttributes = customAttributes == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(customAttributes));
    }

    public static EnrichmentSettings disabled() {
        return new EnrichmentSettings(Set.of(), DEFAULT_FUNCTION_NAME_LABEL_KEY, Map.of());
    }

    /**
     * Augmentation only runs when targets, the label key and at least one attribute are present.
     * Anything less is treated as pass-through.
     */
    public boolean isComplete() {
        if (targetFunctionNames.isEmpty() || isBlank(functionNameLabelKey) || customAttributes.isEmpty()) {
            return false;
        }
        for (Map.Entry<String, String> attribute : customAttributes.entrySet()) {
            if (isBlank(attribute.getKey()) || isBlank(attribute.getValue())) {
                return false;
            }
        }
        return true;
    }

    public boolean isTarget(String functionName) {
        return targetFunctionNames.contains(functionName);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
