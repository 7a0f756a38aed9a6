package com.dimosr.exporter.metric;

import com.dimosr.exporter.instance.Instance;
import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSortedMap;

import java.util.Map;

/**
 * A concrete timeseries selector of a metric: one instance together with one combination of dimension values
 */
public final class Series {
    private static final Joiner.MapJoiner DIMENSION_JOINER = Joiner.on(',').withKeyValueSeparator('=');

    private final String metricName;
    private final Instance instance;
    private final ImmutableSortedMap<String, String> dimensions;
    private final String id;

    public Series(final String metricName, final Instance instance, final Map<String, String> dimensions) {
        this.metricName = Preconditions.checkNotNull(metricName);
        this.instance = Preconditions.checkNotNull(instance);
        this.dimensions = ImmutableSortedMap.copyOf(dimensions);
        this.id = String.format("%s#%s{%s}", metricName, instance.getInstanceId(), DIMENSION_JOINER.join(this.dimensions));
    }

    /**
     * @return an identifier that is equal for two series selecting the same timeseries
     */
    public String getId() {
        return id;
    }

    public String getMetricName() {
        return metricName;
    }

    public Instance getInstance() {
        return instance;
    }

    public ImmutableSortedMap<String, String> getDimensions() {
        return dimensions;
    }

    @Override
    public String toString() {
        return id;
    }
}
