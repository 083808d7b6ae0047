package com.obsinity.metricstream.enrich;

import com.obsinity.metricstream.proto.common.v1.StringKeyValue;
import com.obsinity.metricstream.proto.metrics.v1.DoubleDataPoint;
import com.obsinity.metricstream.proto.metrics.v1.DoubleHistogramDataPoint;
import com.obsinity.metricstream.proto.metrics.v1.DoubleSummaryDataPoint;
import com.obsinity.metricstream.proto.metrics.v1.IntDataPoint;
import com.obsinity.metricstream.proto.metrics.v1.IntHistogramDataPoint;
import com.obsinity.metricstream.proto.metrics.v1.Metric;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/** Uniform access to the data point labels of whichever {@link Metric} shape is populated. */
public final class MetricDataPoints {

    private MetricDataPoints() {}

    /**
     * Label lists of every data point, in data point order. Empty when no shape is set.
     */
    public static List<List<StringKeyValue>> labelsOf(Metric metric) {
        return switch (metric.getDataCase()) {
            case INT_GAUGE -> labels(metric.getIntGauge().getDataPointsList(), IntDataPoint::getLabelsList);
            case DOUBLE_GAUGE -> labels(metric.getDoubleGauge().getDataPointsList(), DoubleDataPoint::getLabelsList);
            case INT_SUM -> labels(metric.getIntSum().getDataPointsList(), IntDataPoint::getLabelsList);
            case DOUBLE_SUM -> labels(metric.getDoubleSum().getDataPointsList(), DoubleDataPoint::getLabelsList);
            case INT_HISTOGRAM -> labels(
                    metric.getIntHistogram().getDataPointsList(), IntHistogramDataPoint::getLabelsList);
            case DOUBLE_HISTOGRAM -> labels(
                    metric.getDoubleHistogram().getDataPointsList(), DoubleHistogramDataPoint::getLabelsList);
            case DOUBLE_SUMMARY -> labels(
                    metric.getDoubleSummary().getDataPointsList(), DoubleSummaryDataPoint::getLabelsList);
            case DATA_NOT_SET -> List.of();
        };
    }

    private static <P> List<List<StringKeyValue>> labels(
            List<P> dataPoints, Function<P, List<StringKeyValue>> accessor) {
        List<List<StringKeyValue>> out = new ArrayList<>(dataPoints.size());
        for (P point : dataPoints) {
            out.add(accessor.apply(point));
        }
        return out;
    }
}
