package com.dimosr.exporter.metric;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * A sample ready to be published to the consumers of the exporter
 */
public final class PublishableSample {
    private final String name;
    private final ImmutableMap<String, String> labels;
    private final double value;
    private final Instant timestamp;

    public PublishableSample(final String name,
                             final Map<String, String> labels,
                             final double value,
                             final Instant timestamp) {
        this.name = Preconditions.checkNotNull(name);
        this.labels = ImmutableMap.copyOf(labels);
        this.value = value;
        this.timestamp = Preconditions.checkNotNull(timestamp);
    }

    public String getName() {
        return name;
    }

    public ImmutableMap<String, String> getLabels() {
        return labels;
    }

    public double getValue() {
        return value;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PublishableSample)) {
            return false;
        }
        PublishableSample other = (PublishableSample) o;
        return Double.compare(value, other.value) == 0
                && name.equals(other.name)
                && labels.equals(other.labels)
                && timestamp.equals(other.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, labels, value, timestamp);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("name", name)
                .add("labels", labels)
                .add("value", value)
                .add("timestamp", timestamp)
                .toString();
    }
}
