package com.dimosr.exporter.metric;

import com.dimosr.exporter.config.ProductConfig;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.Collections;

/**
 * The configuration used to query a metric: which period and statistics are requested from the monitoring API
 */
public final class MetricConfig {
    private final String namespace;
    private final String metricName;
    private final String unit;
    private final ImmutableList<String> dimensions;
    private final int periodSeconds;
    private final ImmutableList<String> statisticTypes;

    private MetricConfig(final String namespace,
                         final String metricName,
                         final String unit,
                         final ImmutableList<String> dimensions,
                         final int periodSeconds,
                         final ImmutableList<String> statisticTypes) {
        this.namespace = namespace;
        this.metricName = metricName;
        this.unit = unit;
        this.dimensions = dimensions;
        this.periodSeconds = periodSeconds;
        this.statisticTypes = statisticTypes;
    }

    /**
     * Builds the configuration of a metric, combining the product configuration with the metadata of the metric
     *
     * The period configured for the product is used, if the metric supports it.
     * Otherwise, the smallest period supported by the metric is used.
     *
     * @throws IllegalArgumentException if the period configured for the product is not positive
     */
    public static MetricConfig fromProductConfig(final ProductConfig productConfig, final MetricMeta meta) {
        final int configuredPeriod = productConfig.getPeriodSeconds();
        Preconditions.checkArgument(configuredPeriod > 0,
                "Invalid period %s for metric %s of namespace %s", configuredPeriod, meta.getMetricName(), meta.getNamespace());

        int period = configuredPeriod;
        if (!meta.getPeriods().isEmpty() && !meta.getPeriods().contains(configuredPeriod)) {
            period = Collections.min(meta.getPeriods());
        }

        return new MetricConfig(
                meta.getNamespace(),
                meta.getMetricName(),
                meta.getUnit(),
                meta.getDimensions(),
                period,
                productConfig.getStatisticTypes()
        );
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

    public int getPeriodSeconds() {
        return periodSeconds;
    }

    public ImmutableList<String> getStatisticTypes() {
        return statisticTypes;
    }
}
