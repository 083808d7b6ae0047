package com.obsinity.metricstream.firehose;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/** One input record of a Firehose data transformation event. {@code data} is base64. */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FirehoseRecord(String recordId, Long approximateArrivalTimestamp, String data) {

    public FirehoseRecord(String recordId, String data) {
        this(recordId, null, data);
    }
}
