package com.obsinity.metricstream.codec;

/** Base type for failures while decoding, enriching or encoding a metric stream payload. */
public class MetricStreamException extends RuntimeException {

    public MetricStreamException(String message) {
        super(message);
    }

    public MetricStreamException(String message, Throwable cause) {
        super(message, cause);
    }
}
