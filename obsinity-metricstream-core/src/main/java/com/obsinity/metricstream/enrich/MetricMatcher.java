package com.obsinity.metricstream.enrich;

import com.obsinity.metricstream.config.EnrichmentSettings;
import com.obsinity.metricstream.proto.collector.metrics.v1.ExportMetricsServiceRequest;
import com.obsinity.metricstream.proto.common.v1.StringKeyValue;
import com.obsinity.metricstream.proto.metrics.v1.InstrumentationLibraryMetrics;
import com.obsinity.metricstream.proto.metrics.v1.Metric;
import com.obsinity.metricstream.proto.metrics.v1.ResourceMetrics;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Finds target function names on data point labels.
 *
 * <p>Deduplication is per instrumentation scope: a function name matched once in a scope is
 * ignored for the rest of that scope, whatever metric or data point it shows up on again.
 * The request is only read; callers append synthetic metrics afterwards.
 */
@Slf4j
public class MetricMatcher {

    public List<ScopeMatch> findMatches(ExportMetricsServiceRequest request, EnrichmentSettings settings) {
        List<ScopeMatch> matches = new ArrayList<>();
        String labelKey = settings.functionNameLabelKey();

        for (int r = 0; r < request.getResourceMetricsCount(); r++) {
            ResourceMetrics resourceMetrics = request.getResourceMetrics(r);
            for (int s = 0; s < resourceMetrics.getInstrumentationLibraryMetricsCount(); s++) {
                InstrumentationLibraryMetrics scope = resourceMetrics.getInstrumentationLibraryMetrics(s);
                Set<String> produced = new LinkedHashSet<>();
                for (Metric metric : scope.getMetricsList()) {
                    collect(metric, labelKey, settings, produced);
                }
                if (!produced.isEmpty()) {
                    matches.add(new ScopeMatch(r, s, produced));
                }
            }
        }
        return matches;
    }

    private void collect(Metric metric, String labelKey, EnrichmentSettings settings, Set<String> produced) {
        for (List<StringKeyValue> labels : MetricDataPoints.labelsOf(metric)) {
            for (StringKeyValue label : labels) {
                if (!labelKey.equals(label.getKey()) || !settings.isTarget(label.getValue())) {
                    continue;
                }
                if (produced.add(label.getValue())) {
                    log.info("Match found function={} metric={}", label.getValue(), metric.getName());
                }
            }
        }
    }
}
