package com.dimosr.exporter.metric;

import com.google.common.base.Preconditions;

import java.util.Objects;

/**
 * Identifies a metric of a single instance.
 * The same metric name on two instances corresponds to two different keys.
 */
public final class MetricKey {
    private final String metricName;
    private final String instanceId;

    public MetricKey(final String metricName, final String instanceId) {
        this.metricName = Preconditions.checkNotNull(metricName);
        this.instanceId = Preconditions.checkNotNull(instanceId);
    }

    public String getMetricName() {
        return metricName;
    }

    public String getInstanceId() {
        return instanceId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MetricKey)) {
            return false;
        }
        MetricKey other = (MetricKey) o;
        return metricName.equals(other.metricName) && instanceId.equals(other.instanceId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(metricName, instanceId);
    }

    @Override
    public String toString() {
        return metricName + "." + instanceId;
    }
}
