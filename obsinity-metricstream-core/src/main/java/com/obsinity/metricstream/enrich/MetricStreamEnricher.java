package com.obsinity.metricstream.enrich;

import com.google.protobuf.ByteString;
import com.obsinity.metricstream.codec.FrameCodec;
import com.obsinity.metricstream.codec.MessageCodec;
import com.obsinity.metricstream.config.EnrichmentSettings;
import com.obsinity.metricstream.proto.collector.metrics.v1.ExportMetricsServiceRequest;
import com.obsinity.metricstream.proto.metrics.v1.InstrumentationLibraryMetrics;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/**
 * Decode, match, augment and encode for one length-delimited payload.
 *
 * <p>Errors from any stage propagate as {@link com.obsinity.metricstream.codec.MetricStreamException}.
 * With incomplete settings every message is still decoded and re-encoded, but nothing is added.
 */
@Slf4j
public class MetricStreamEnricher {

    private final EnrichmentSettings settings;
    private final MetricMatcher matcher;
    private final SummaryMetricFactory factory;

    public MetricStreamEnricher(EnrichmentSettings settings) {
        this(settings, new MetricMatcher(), new SummaryMetricFactory(settings.functionNameLabelKey()));
    }

    public MetricStreamEnricher(EnrichmentSettings settings, MetricMatcher matcher, SummaryMetricFactory factory) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.matcher = Objects.requireNonNull(matcher, "matcher");
        this.factory = Objects.requireNonNull(factory, "factory");
        if (!settings.isComplete()) {
            log.warn("Enrichment settings are incomplete; metric streams will pass through unchanged");
        }
    }

    public EnrichmentOutcome enrich(byte[] payload) {
        List<ByteString> frames = FrameCodec.decodeStream(payload);
        List<ExportMetricsServiceRequest> requests = new ArrayList<>(frames.size());
        for (ByteString frame : frames) {
            requests.add(MessageCodec.decode(frame));
        }

        int added = 0;
        List<ByteString> encoded = new ArrayList<>(requests.size());
        for (ExportMetricsServiceRequest request : requests) {
            if (settings.isComplete()) {
                List<ScopeMatch> matches = matcher.findMatches(request, settings);
                if (!matches.isEmpty()) {
                    request = append(request, matches);
                    added += matches.stream().mapToInt(m -> m.functionNames().size()).sum();
                }
            } else {
                log.debug("Skipping enrichment, settings incomplete");
            }
            encoded.add(MessageCodec.encode(request));
        }
        return new EnrichmentOutcome(ByteString.copyFrom(FrameCodec.encodeStream(encoded)), requests.size(), added);
    }

    private ExportMetricsServiceRequest append(ExportMetricsServiceRequest request, List<ScopeMatch> matches) {
        ExportMetricsServiceRequest.Builder builder = request.toBuilder();
        for (ScopeMatch match : matches) {
            InstrumentationLibraryMetrics.Builder scope = builder.getResourceMetricsBuilder(match.resourceIndex())
                    .getInstrumentationLibraryMetricsBuilder(match.scopeIndex());
            for (String functionName : match.functionNames()) {
                scope.addMetrics(factory.build(functionName, settings.customAttributes()));
            }
        }
        return builder.build();
    }
}
