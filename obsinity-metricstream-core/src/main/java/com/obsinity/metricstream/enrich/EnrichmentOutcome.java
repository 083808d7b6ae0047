package com.obsinity.metricstream.enrich;

import com.google.protobuf.ByteString;

/** Re-encoded stream plus counters for logging. Compares by payload content. */
public record EnrichmentOutcome(ByteString payload, int messageCount, int syntheticMetricCount) {}
