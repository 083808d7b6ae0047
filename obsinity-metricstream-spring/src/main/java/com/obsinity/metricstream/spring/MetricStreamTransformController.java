package com.obsinity.metricstream.spring;

import com.obsinity.metricstream.firehose.FirehoseRecordProcessor;
import com.obsinity.metricstream.firehose.FirehoseTransformationEvent;
import com.obsinity.metricstream.firehose.FirehoseTransformationResponse;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Runs a Firehose transformation event through the enricher over HTTP, e.g. to replay captured batches. */
@RestController
@RequestMapping("/api/metricstream")
@ConditionalOnProperty(prefix = "obsinity.metricstream", name = "enabled", havingValue = "true", matchIfMissing = true)
public class MetricStreamTransformController {

    private final FirehoseRecordProcessor processor;

    public MetricStreamTransformController(FirehoseRecordProcessor processor) {
        this.processor = processor;
    }

    @PostMapping(
            path = "/transform",
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public FirehoseTransformationResponse transform(@RequestBody FirehoseTransformationEvent event) {
        return processor.transform(event);
    }
}
