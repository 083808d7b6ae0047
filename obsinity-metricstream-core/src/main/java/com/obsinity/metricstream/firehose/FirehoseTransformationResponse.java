package com.obsinity.metricstream.firehose;

import java.util.List;

public record FirehoseTransformationResponse(List<FirehoseRecordResult> records) {}
