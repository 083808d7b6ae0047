package com.obsinity.metricstream.config;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;

/** Builds {@link EnrichmentSettings} from Lambda-style environment variables. */
@Slf4j
public final class EnrichmentSettingsLoader {

    public static final String TARGET_FUNCTION_NAMES = "TARGET_FUNCTION_NAMES";
    public static final String ATTRIBUTE_KEY = "ATTRIBUTE_KEY";
    public static final String ATTRIBUTE_VALUE = "ATTRIBUTE_VALUE";
    public static final String FUNCTION_NAME_LABEL_KEY = "FUNCTION_NAME_LABEL_KEY";

    private EnrichmentSettingsLoader() {}

    public static EnrichmentSettings fromEnvironment(Map<String, String> env) {
        Objects.requireNonNull(env, "env");
        Set<String> targets = parseNames(env.get(TARGET_FUNCTION_NAMES));
        String labelKey = trimToNull(env.get(FUNCTION_NAME_LABEL_KEY));
        String attributeKey = trimToNull(env.get(ATTRIBUTE_KEY));
        String attributeValue = env.get(ATTRIBUTE_VALUE);

        Map<String, String> attributes = new LinkedHashMap<>();
        if (attributeKey != null && attributeValue != null && !attributeValue.isEmpty()) {
            attributes.put(attributeKey, attributeValue);
        }

        EnrichmentSettings settings = new EnrichmentSettings(
                targets,
                labelKey != null ? labelKey : EnrichmentSettings.DEFAULT_FUNCTION_NAME_LABEL_KEY,
                attributes);
        log.info(
                "Loaded enrichment settings targets={} labelKey={} attributeKeys={} complete={}",
                settings.targetFunctionNames(),
                settings.functionNameLabelKey(),
                settings.customAttributes().keySet(),
                settings.isComplete());
        return settings;
    }

    /** Splits a comma-separated list, trimming entries and dropping blanks. */
    public static Set<String> parseNames(String raw) {
        if (raw == null || raw.isBlank()) {
            return Set.of();
        }
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(name -> !name.isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    private static String trimToNull(String value) {
        if (value == null) return null;
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
