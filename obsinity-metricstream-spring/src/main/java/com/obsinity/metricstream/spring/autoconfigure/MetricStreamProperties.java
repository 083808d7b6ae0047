package com.obsinity.metricstream.spring.autoconfigure;

import com.obsinity.metricstream.config.EnrichmentSettings;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the metric stream enricher.
 *
 * <h3>Configuration Example:</h3>
 * <pre>{@code
 * obsinity:
 *   metricstream:
 *     enabled: true
 *     target-function-names: orders-api, billing-worker
 *     function-name-label-key: FunctionName
 *     attributes:
 *       team: payments
 *     # single pair, as the Lambda reads it from ATTRIBUTE_KEY / ATTRIBUTE_VALUE
 *     attribute-key: env
 *     attribute-value: prod
 * }</pre>
 */
@ConfigurationProperties(prefix = "obsinity.metricstream")
public class MetricStreamProperties {

    /** Exposes the HTTP transform endpoint. */
    private boolean enabled = true;

    private List<String> targetFunctionNames = new ArrayList<>();

    private String functionNameLabelKey = EnrichmentSettings.DEFAULT_FUNCTION_NAME_LABEL_KEY;

    /** Labels stamped onto every synthetic metric. */
    private Map<String, String> attributes = new LinkedHashMap<>();

    /** Single attribute added after {@link #attributes}; ignored unless both key and value are set. */
    private String attributeKey;

    private String attributeValue;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public List<String> getTargetFunctionNames() {
        return targetFunctionNames;
    }

    public void setTargetFunctionNames(List<String> targetFunctionNames) {
        this.targetFunctionNames = targetFunctionNames;
    }

    public String getFunctionNameLabelKey() {
        return functionNameLabelKey;
    }

    public void setFunctionNameLabelKey(String functionNameLabelKey) {
        this.functionNameLabelKey = functionNameLabelKey;
    }

    public Map<String, String> getAttributes() {
        return attributes;
    }

    public void setAttributes(Map<String, String> attributes) {
        this.attributes = attributes;
    }

    public String getAttributeKey() {
        return attributeKey;
    }

    public void setAttributeKey(String attributeKey) {
        this.attributeKey = attributeKey;
    }

    public String getAttributeValue() {
        return attributeValue;
    }

    public void setAttributeValue(String attributeValue) {
        this.attributeValue = attributeValue;
    }

    public EnrichmentSettings toSettings() {
        Set<String> targets = new LinkedHashSet<>();
        if (targetFunctionNames != null) {
            for (String name : targetFunctionNames) {
                if (name != null && !name.isBlank()) {
                    targets.add(name.trim());
                }
            }
        }
        Map<String, String> merged = new LinkedHashMap<>();
        if (attributes != null) {
            merged.putAll(attributes);
        }
        if (attributeKey != null && !attributeKey.isBlank() && attributeValue != null && !attributeValue.isEmpty()) {
            merged.put(attributeKey.trim(), attributeValue);
        }
        return new EnrichmentSettings(targets, functionNameLabelKey, merged);
    }
}
