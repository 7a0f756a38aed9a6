package com.dimosr.exporter.instance;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

import java.util.Map;
import java.util.Objects;

/**
 * A discovered monitorable resource of a namespace
 *
 * Instances are rebuilt on every listing, the only identity they carry across listings is their id
 */
public final class Instance {
    private final String instanceId;
    private final ImmutableMap<String, String> attributes;

    public Instance(final String instanceId, final Map<String, String> attributes) {
        Preconditions.checkArgument(instanceId != null && !instanceId.isEmpty(), "instance id must not be empty");
        this.instanceId = instanceId;
        this.attributes = ImmutableMap.copyOf(attributes);
    }

    public static Instance of(final String instanceId) {
        return new Instance(instanceId, ImmutableMap.of());
    }

    public String getInstanceId() {
        return instanceId;
    }

    public ImmutableMap<String, String> getAttributes() {
        return attributes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Instance)) {
            return false;
        }
        Instance other = (Instance) o;
        return instanceId.equals(other.instanceId) && attributes.equals(other.attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(instanceId, attributes);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("instanceId", instanceId)
                .add("attributes", attributes)
                .toString();
    }
}
