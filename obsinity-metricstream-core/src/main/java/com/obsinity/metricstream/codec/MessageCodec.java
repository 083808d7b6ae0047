package com.obsinity.metricstream.codec;

import com.google.protobuf.ByteString;
import com.google.protobuf.InvalidProtocolBufferException;
import com.obsinity.metricstream.proto.collector.metrics.v1.ExportMetricsServiceRequest;

/** Protobuf (de)serialization of a single OTLP 0.7 export request. */
public final class MessageCodec {

    private MessageCodec() {}

    public static ExportMetricsServiceRequest decode(ByteString message) {
        try {
            return ExportMetricsServiceRequest.parseFrom(message);
        } catch (InvalidProtocolBufferException ex) {
            throw new SchemaDecodeException("Failed to decode export request: " + ex.getMessage(), ex);
        }
    }

    public static ByteString encode(ExportMetricsServiceRequest request) {
        try {
            return request.toByteString();
        } catch (RuntimeException ex) {
            throw new SchemaEncodeException("Failed to encode export request", ex);
        }
    }
}
