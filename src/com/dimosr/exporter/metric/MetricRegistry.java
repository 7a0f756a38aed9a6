package com.dimosr.exporter.metric;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * The metrics of a product, keyed by metric name and instance id.
 *
 * Metrics are created on first sighting and reused afterwards, so that their series cache survives reload cycles.
 * They are never removed, a metric that is not seen again simply stops being fresh.
 *
 * The locks are held only for the map lookups and inserts, never for remote calls.
 */
public class MetricRegistry {
    private final Map<MetricKey, Metric> metrics = new LinkedHashMap<>();

    private final ReentrantReadWriteLock readWriteLock = new ReentrantReadWriteLock();
    private final Lock readLock = readWriteLock.readLock();
    private final Lock writeLock = readWriteLock.writeLock();

    /**
     * Returns the metric registered under the key, or registers the one built by the factory
     *
     * The lookup is first attempted with the read lock and repeated under the write lock before inserting,
     * so the factory is called at most once for each key.
     *
     * @param factory builds the metric, called under the write lock so it must not perform remote calls
     */
    public Metric getOrCreate(final MetricKey key, final Supplier<Metric> factory) {
        readLock.lock();
        try {
            Metric existing = metrics.get(key);
            if (existing != null) {
                return existing;
            }
        } finally {
            readLock.unlock();
        }

        writeLock.lock();
        try {
            Metric existing = metrics.get(key);
            if (existing != null) {
                return existing;
            }
            Metric created = Preconditions.checkNotNull(factory.get(), "metric factory returned null for %s", key);
            metrics.put(key, created);
            return created;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * @return the registered metrics in registration order
     */
    public ImmutableList<Metric> snapshot() {
        readLock.lock();
        try {
            return ImmutableList.copyOf(metrics.values());
        } finally {
            readLock.unlock();
        }
    }

    public int size() {
        readLock.lock();
        try {
            return metrics.size();
        } finally {
            readLock.unlock();
        }
    }
}
