package com.obsinity.metricstream.firehose;

import static com.obsinity.metricstream.OtlpFixtures.lambdaSummary;
import static com.obsinity.metricstream.OtlpFixtures.request;
import static com.obsinity.metricstream.OtlpFixtures.resource;
import static com.obsinity.metricstream.OtlpFixtures.scope;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.google.protobuf.ByteString;
import com.obsinity.metricstream.codec.FrameCodec;
import com.obsinity.metricstream.codec.MessageCodec;
import com.obsinity.metricstream.config.EnrichmentSettings;
import com.obsinity.metricstream.enrich.EnrichmentOutcome;
import com.obsinity.metricstream.enrich.MetricStreamEnricher;
import com.obsinity.metricstream.proto.collector.metrics.v1.ExportMetricsServiceRequest;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class FirehoseRecordProcessorTest {

    private final FirehoseRecordProcessor processor = new FirehoseRecordProcessor(new MetricStreamEnricher(
            new EnrichmentSettings(Set.of("f1"), "FunctionName", Map.of("env", "prod"))));

    @Test
    void malformedRecordFailsAloneWithOriginalData() {
        String good = encode(request(resource("acct", scope("s", lambdaSummary("Invocations", "f1")))));
        String truncated = Base64.getEncoder().encodeToString(new byte[] {9, 1, 2});
        String notBase64 = "%%not-base64%%";

        List<FirehoseRecordResult> results = processor.process(List.of(
                new FirehoseRecord("r1", good),
                new FirehoseRecord("r2", truncated),
                new FirehoseRecord("r3", notBase64),
                new FirehoseRecord("r4", good)));

        assertThat(results).extracting(FirehoseRecordResult::recordId).containsExactly("r1", "r2", "r3", "r4");
        assertThat(results)
                .extracting(FirehoseRecordResult::result)
                .containsExactly(
                        FirehoseResultStatus.OK,
                        FirehoseResultStatus.PROCESSING_FAILED,
                        FirehoseResultStatus.PROCESSING_FAILED,
                        FirehoseResultStatus.OK);
        assertThat(results.get(1).data()).isEqualTo(truncated);
        assertThat(results.get(2).data()).isEqualTo(notBase64);
    }

    @Test
    void successfulRecordCarriesEnrichedPayload() {
        String good = encode(request(resource("acct", scope("s", lambdaSummary("Invocations", "f1")))));

        FirehoseRecordResult result = processor.process(List.of(new FirehoseRecord("r1", good))).get(0);

        ExportMetricsServiceRequest decoded = MessageCodec.decode(
                FrameCodec.decodeStream(Base64.getDecoder().decode(result.data())).get(0));
        assertThat(decoded.getResourceMetrics(0).getInstrumentationLibraryMetrics(0).getMetricsCount())
                .isEqualTo(2);
    }

    @Test
    void emptyEventYieldsEmptyResponse() {
        assertThat(processor.process(List.of())).isEmpty();
        assertThat(processor.transform(new FirehoseTransformationEvent("inv", "arn", "eu-west-1", null))
                        .records())
                .isEmpty();
    }

    @Test
    void unexpectedEnricherFailureIsIsolated() {
        MetricStreamEnricher enricher = mock(MetricStreamEnricher.class);
        when(enricher.enrich(any()))
                .thenThrow(new IllegalStateException("boom"))
                .thenReturn(new EnrichmentOutcome(ByteString.copyFrom(new byte[] {0}), 1, 0));
        FirehoseRecordProcessor isolated = new FirehoseRecordProcessor(enricher);

        List<FirehoseRecordResult> results =
                isolated.process(List.of(new FirehoseRecord("a", "AA=="), new FirehoseRecord("b", "AA==")));

        assertThat(results.get(0)).isEqualTo(FirehoseRecordResult.failed(new FirehoseRecord("a", "AA==")));
        assertThat(results.get(1)).isEqualTo(FirehoseRecordResult.ok("b", "AA=="));
        verify(enricher, times(2)).enrich(any());
    }

    private static String encode(ExportMetricsServiceRequest request) {
        return Base64.getEncoder().encodeToString(FrameCodec.encodeStream(List.of(MessageCodec.encode(request))));
    }
}
