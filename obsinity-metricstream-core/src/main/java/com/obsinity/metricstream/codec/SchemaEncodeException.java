package com.obsinity.metricstream.codec;

public class SchemaEncodeException extends MetricStreamException {

    public SchemaEncodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
