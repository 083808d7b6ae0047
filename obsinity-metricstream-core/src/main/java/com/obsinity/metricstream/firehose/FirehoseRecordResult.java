package com.obsinity.metricstream.firehose;

/** One output record returned to Firehose; {@code data} is base64. */
public record FirehoseRecordResult(String recordId, FirehoseResultStatus result, String data) {

    public static FirehoseRecordResult ok(String recordId, String data) {
        return new FirehoseRecordResult(recordId, FirehoseResultStatus.OK, data);
    }

    public static FirehoseRecordResult failed(FirehoseRecord original) {
        return new FirehoseRecordResult(original.recordId(), FirehoseResultStatus.PROCESSING_FAILED, original.data());
    }
}
