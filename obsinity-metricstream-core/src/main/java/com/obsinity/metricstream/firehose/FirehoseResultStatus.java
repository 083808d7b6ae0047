package com.obsinity.metricstream.firehose;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum FirehoseResultStatus {
    OK("Ok"),
    DROPPED("Dropped"),
    PROCESSING_FAILED("ProcessingFailed");

    private final String wireValue;

    FirehoseResultStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    @JsonCreator
    public static FirehoseResultStatus fromWire(String value) {
        for (FirehoseResultStatus status : values()) {
            if (status.wireValue.equals(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown Firehose result: " + value);
    }
}
