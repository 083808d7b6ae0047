package com.obsinity.metricstream.firehose;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import org.junit.jupiter.api.Test;

class FirehoseJsonMappingTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Test
    void readsTransformationEventIgnoringUnknownFields() throws Exception {
        String json = """
                {
                  "invocationId": "inv-1",
                  "deliveryStreamArn": "arn:aws:firehose:eu-west-1:123:deliverystream/metrics",
                  "region": "eu-west-1",
                  "sourceKinesisStreamArn": "ignored",
                  "records": [
                    {"recordId": "r1", "approximateArrivalTimestamp": 1700000000000, "data": "AA=="}
                  ]
                }
                """;

        FirehoseTransformationEvent event = MAPPER.readValue(json, FirehoseTransformationEvent.class);

        assertThat(event.invocationId()).isEqualTo("inv-1");
        assertThat(event.records()).containsExactly(new FirehoseRecord("r1", 1700000000000L, "AA=="));
    }

    @Test
    void writesResultsWithFirehoseResultNames() throws Exception {
        FirehoseTransformationResponse response = new FirehoseTransformationResponse(List.of(
                FirehoseRecordResult.ok("r1", "AA=="),
                FirehoseRecordResult.failed(new FirehoseRecord("r2", "Zm9v"))));

        JsonNode tree = MAPPER.readTree(MAPPER.writeValueAsString(response));

        assertThat(tree.path("records").get(0).path("result").asText()).isEqualTo("Ok");
        assertThat(tree.path("records").get(1).path("result").asText()).isEqualTo("ProcessingFailed");
        assertThat(tree.path("records").get(1).path("data").asText()).isEqualTo("Zm9v");
        assertThat(MAPPER.readValue("\"Dropped\"", FirehoseResultStatus.class))
                .isEqualTo(FirehoseResultStatus.DROPPED);
    }
}
