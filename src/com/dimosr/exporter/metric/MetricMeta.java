package com.dimosr.exporter.metric;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * The metadata of a metric, as listed by the monitoring API for one instance
 */
public final class MetricMeta {
    private final String namespace;
    private final String metricName;
    private final String unit;
    private final ImmutableList<String> dimensions;
    private final ImmutableList<Integer> periods;

    /**
     * @param namespace the namespace of the product
     * @param metricName the name of the metric
     * @param unit the unit of the samples, can be empty
     * @param dimensions the names of the dimensions the metric can be queried with
     * @param periods the aggregation periods (in seconds) supported by the monitoring API for this metric
     */
    public MetricMeta(final String namespace,
                      final String metricName,
                      final String unit,
                      final List<String> dimensions,
                      final List<Integer> periods) {
        Preconditions.checkArgument(metricName != null && !metricName.isEmpty(), "metric name must not be empty");
        this.namespace = Preconditions.checkNotNull(namespace);
        this.metricName = metricName;
        this.unit = unit == null ? "" : unit;
        this.dimensions = ImmutableList.copyOf(dimensions);
        this.periods = ImmutableList.copyOf(periods);
    }

    public String getNamespace() {
        return namespace;
    }

    public String getMetricName() {
        return metricName;
    }

    public String getUnit() {
        return unit;
    }

    public ImmutableList<String> getDimensions() {
        return dimensions;
    }

    public ImmutableList<Integer> getPeriods() {
        return periods;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("namespace", namespace)
                .add("metricName", metricName)
                .add("unit", unit)
                .add("dimensions", dimensions)
                .add("periods", periods)
                .toString();
    }
}
