package com.obsinity.metricstream.enrich;

import com.obsinity.metricstream.proto.common.v1.StringKeyValue;
import com.obsinity.metricstream.proto.metrics.v1.DoubleSummary;
import com.obsinity.metricstream.proto.metrics.v1.DoubleSummaryDataPoint;
import com.obsinity.metricstream.proto.metrics.v1.Metric;
import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Builds the synthetic {@code DoubleSummary} metric that carries custom attributes for a
 * Lambda function. The shape mirrors the AWS/Lambda summaries in the stream; the values are
 * constants.
 */
public class SummaryMetricFactory {

    public static final String METRIC_NAME = "amazonaws.com/AWS/Lambda/Custom";
    public static final String METRIC_UNIT = "{Count}";
    public static final String NAMESPACE_LABEL = "Namespace";
    public static final String NAMESPACE = "AWS/Lambda";
    public static final String METRIC_NAME_LABEL = "MetricName";
    public static final String CUSTOM_METRIC_NAME = "Custom";

    private final Clock clock;
    private final String functionNameLabelKey;

    public SummaryMetricFactory(String functionNameLabelKey) {
        this(Clock.systemUTC(), functionNameLabelKey);
    }

    public SummaryMetricFactory(Clock clock, String functionNameLabelKey) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.functionNameLabelKey = Objects.requireNonNull(functionNameLabelKey, "functionNameLabelKey");
    }

    public Metric build(String functionName, Map<String, String> attributes) {
        // second precision, like the CloudWatch datapoints next to it
        long nowNanos = TimeUnit.SECONDS.toNanos(clock.instant().getEpochSecond());

        DoubleSummaryDataPoint.Builder point = DoubleSummaryDataPoint.newBuilder()
                .addLabels(label(NAMESPACE_LABEL, NAMESPACE))
                .addLabels(label(METRIC_NAME_LABEL, CUSTOM_METRIC_NAME))
                .addLabels(label(functionNameLabelKey, functionName));
        attributes.forEach((key, value) -> point.addLabels(label(key, value)));

        point.setStartTimeUnixNano(nowNanos)
                .setTimeUnixNano(nowNanos)
                .setCount(1)
                .setSum(1.0)
                .addQuantileValues(quantile(0.0, 1.0))
                .addQuantileValues(quantile(1.0, 1.0));

        return Metric.newBuilder()
                .setName(METRIC_NAME)
                .setUnit(METRIC_UNIT)
                .setDoubleSummary(DoubleSummary.newBuilder().addDataPoints(point))
                .build();
    }

    private static StringKeyValue label(String key, String value) {
        return StringKeyValue.newBuilder().setKey(key).setValue(value).build();
    }

    private static DoubleSummaryDataPoint.ValueAtQuantile quantile(double quantile, double value) {
        return DoubleSummaryDataPoint.ValueAtQuantile.newBuilder()
                .setQuantile(quantile)
                .setValue(value)
                .build();
    }
}
