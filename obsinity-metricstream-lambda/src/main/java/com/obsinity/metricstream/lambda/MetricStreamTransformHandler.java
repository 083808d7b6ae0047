package com.obsinity.metricstream.lambda;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.RequestStreamHandler;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.obsinity.metricstream.config.EnrichmentSettings;
import com.obsinity.metricstream.config.EnrichmentSettingsLoader;
import com.obsinity.metricstream.enrich.MetricStreamEnricher;
import com.obsinity.metricstream.firehose.FirehoseRecordProcessor;
import com.obsinity.metricstream.firehose.FirehoseTransformationEvent;
import com.obsinity.metricstream.firehose.FirehoseTransformationResponse;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

/**
 * Firehose data transformation Lambda for CloudWatch Metric Stream (OTLP 0.7) deliveries.
 *
 * <p>Settings are read from the environment once per container. An unreadable event fails the
 * whole invocation so Firehose retries it; individual record failures never do.
 */
@Slf4j
public class MetricStreamTransformHandler implements RequestStreamHandler {

    static final String REQUEST_ID_MDC_KEY = "AWSRequestId";

    private final ObjectMapper mapper;
    private final FirehoseRecordProcessor processor;

    public MetricStreamTransformHandler() {
        this(EnrichmentSettingsLoader.fromEnvironment(System.getenv()));
    }

    public MetricStreamTransformHandler(EnrichmentSettings settings) {
        this(defaultMapper(), new FirehoseRecordProcessor(new MetricStreamEnricher(settings)));
    }

    MetricStreamTransformHandler(ObjectMapper mapper, FirehoseRecordProcessor processor) {
        this.mapper = mapper;
        this.processor = processor;
    }

    @Override
    public void handleRequest(InputStream input, OutputStream output, Context context) throws IOException {
        if (context != null && context.getAwsRequestId() != null) {
            MDC.put(REQUEST_ID_MDC_KEY, context.getAwsRequestId());
        }
        try {
            // a literal JSON null reads as a null event
            FirehoseTransformationEvent event = mapper.readValue(input, FirehoseTransformationEvent.class);
            log.debug("Invocation records={}", event == null ? 0 : event.records().size());
            FirehoseTransformationResponse response = processor.transform(event);
            mapper.writeValue(output, response);
        } finally {
            MDC.remove(REQUEST_ID_MDC_KEY);
        }
    }

    static ObjectMapper defaultMapper() {
        return new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }
}
