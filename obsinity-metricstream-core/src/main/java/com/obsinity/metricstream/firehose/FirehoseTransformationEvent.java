package com.obsinity.metricstream.firehose;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record FirehoseTransformationEvent(
        String invocationId, String deliveryStreamArn, String region, List<FirehoseRecord> records) {

    public FirehoseTransformationEvent {
        records = records == null ? List.of() : List.copyOf(records);
    }
}
