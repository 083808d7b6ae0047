package com.obsinity.metricstream.enrich;

import static com.obsinity.metricstream.OtlpFixtures.label;
import static org.assertj.core.api.Assertions.assertThat;

import com.obsinity.metricstream.proto.common.v1.StringKeyValue;
import com.obsinity.metricstream.proto.metrics.v1.DoubleHistogram;
import com.obsinity.metricstream.proto.metrics.v1.DoubleHistogramDataPoint;
import com.obsinity.metricstream.proto.metrics.v1.IntGauge;
import com.obsinity.metricstream.proto.metrics.v1.IntDataPoint;
import com.obsinity.metricstream.proto.metrics.v1.IntHistogram;
import com.obsinity.metricstream.proto.metrics.v1.IntHistogramDataPoint;
import com.obsinity.metricstream.proto.metrics.v1.Metric;
import java.util.List;
import org.junit.jupiter.api.Test;

class MetricDataPointsTest {

    @Test
    void readsLabelsOfHistogramShapes() {
        Metric intHistogram = Metric.newBuilder()
                .setIntHistogram(IntHistogram.newBuilder()
                        .addDataPoints(IntHistogramDataPoint.newBuilder().addLabels(label("a", "1")))
                        .addDataPoints(IntHistogramDataPoint.newBuilder().addLabels(label("a", "2"))))
                .build();
        Metric doubleHistogram = Metric.newBuilder()
                .setDoubleHistogram(DoubleHistogram.newBuilder()
                        .addDataPoints(DoubleHistogramDataPoint.newBuilder().addLabels(label("b", "1"))))
                .build();

        assertThat(MetricDataPoints.labelsOf(intHistogram))
                .containsExactly(List.of(label("a", "1")), List.of(label("a", "2")));
        assertThat(MetricDataPoints.labelsOf(doubleHistogram)).containsExactly(List.of(label("b", "1")));
    }

    @Test
    void dataPointWithoutLabelsYieldsEmptyList() {
        Metric gauge = Metric.newBuilder()
                .setIntGauge(IntGauge.newBuilder().addDataPoints(IntDataPoint.newBuilder().setValue(1)))
                .build();

        List<List<StringKeyValue>> labels = MetricDataPoints.labelsOf(gauge);

        assertThat(labels).hasSize(1);
        assertThat(labels.get(0)).isEmpty();
    }

    @Test
    void unsetShapeHasNoDataPoints() {
        assertThat(MetricDataPoints.labelsOf(Metric.getDefaultInstance())).isEmpty();
    }
}
