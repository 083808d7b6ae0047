package com.obsinity.metricstream.firehose;

import com.obsinity.metricstream.enrich.EnrichmentOutcome;
import com.obsinity.metricstream.enrich.MetricStreamEnricher;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Applies the {@link MetricStreamEnricher} to every record of a transformation event.
 *
 * <p>Records are independent: a failing record is returned as {@code ProcessingFailed} with its
 * original data and the remaining records are still processed. Output order and count always
 * match the input.
 */
@Slf4j
@RequiredArgsConstructor
public class FirehoseRecordProcessor {

    private final MetricStreamEnricher enricher;

    public FirehoseTransformationResponse transform(FirehoseTransformationEvent event) {
        if (event != null && event.invocationId() != null) {
            log.debug(
                    "Transforming invocation={} stream={} records={}",
                    event.invocationId(),
                    event.deliveryStreamArn(),
                    event.records().size());
        }
        return new FirehoseTransformationResponse(process(event == null ? List.of() : event.records()));
    }

    public List<FirehoseRecordResult> process(List<FirehoseRecord> records) {
        List<FirehoseRecordResult> results = new ArrayList<>(records.size());
        int failed = 0;
        for (FirehoseRecord record : records) {
            FirehoseRecordResult result = processOne(record);
            if (result.result() == FirehoseResultStatus.PROCESSING_FAILED) {
                failed++;
            }
            results.add(result);
        }
        log.info("Successfully processed {} records (failed={})", results.size(), failed);
        return results;
    }

    private FirehoseRecordResult processOne(FirehoseRecord record) {
        try {
            byte[] payload = Base64.getDecoder().decode(record.data());
            EnrichmentOutcome outcome = enricher.enrich(payload);
            if (outcome.syntheticMetricCount() > 0) {
                log.debug(
                        "Record {} enriched messages={} added={}",
                        record.recordId(),
                        outcome.messageCount(),
                        outcome.syntheticMetricCount());
            }
            return FirehoseRecordResult.ok(
                    record.recordId(), Base64.getEncoder().encodeToString(outcome.payload().toByteArray()));
        } catch (Exception ex) {
            log.error("Processing failed for record {}: {}", record.recordId(), ex.getMessage(), ex);
            return FirehoseRecordResult.failed(record);
        }
    }
}
