package com.obsinity.metricstream.codec;

public class SchemaDecodeException extends MetricStreamException {

    public SchemaDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
