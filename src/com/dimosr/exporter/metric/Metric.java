package com.dimosr.exporter.metric;

import com.dimosr.exporter.exceptions.InvalidSeriesException;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A named telemetry signal of a single instance, together with its configuration
 * and the cache of the series resolved for it so far.
 *
 * A metric is reused across reload cycles, so the series cache is only ever extended.
 * Loading of series is expected to happen from one reload cycle at a time,
 * while the cached series can be read concurrently by scrapes.
 */
public class Metric {
    /**
     * A metric is queried in a cycle only if its series were loaded less than this long before the cycle started
     */
    public static final Duration RECENCY_WINDOW = Duration.ofSeconds(60);

    private final MetricMeta meta;
    private final MetricConfig config;
    private final Map<String, Series> seriesCache = new LinkedHashMap<>();
    private volatile Instant loadTimeAt;

    public Metric(final MetricMeta meta, final MetricConfig config) {
        this.meta = Preconditions.checkNotNull(meta);
        this.config = Preconditions.checkNotNull(config);
    }

    /**
     * Adds the series not already cached and marks the metric as loaded at the given time
     *
     * @return the number of series that were not cached before
     * @throws InvalidSeriesException if any of the series belongs to a different metric, in which case nothing is loaded
     */
    public int loadSeries(final List<Series> series, final Instant loadedAt) {
        for (Series s : series) {
            if (!s.getMetricName().equals(getName())) {
                throw new InvalidSeriesException(String.format(
                        "Series %s cannot be loaded into metric %s", s.getId(), getName()));
            }
        }

        int added = 0;
        synchronized (seriesCache) {
            for (Series s : series) {
                if (seriesCache.putIfAbsent(s.getId(), s) == null) {
                    added++;
                }
            }
        }
        loadTimeAt = loadedAt;
        return added;
    }

    /**
     * @return true if the series of this metric were loaded within the recency window before the given cycle start
     */
    public boolean isFresh(final Instant cycleStart) {
        final Instant loaded = loadTimeAt;
        if (loaded == null) {
            return false;
        }
        return Duration.between(loaded, cycleStart).compareTo(RECENCY_WINDOW) < 0;
    }

    public ImmutableList<Series> getSeries() {
        synchronized (seriesCache) {
            return ImmutableList.copyOf(seriesCache.values());
        }
    }

    public int getSeriesCount() {
        synchronized (seriesCache) {
            return seriesCache.size();
        }
    }

    public String getName() {
        return meta.getMetricName();
    }

    public MetricMeta getMeta() {
        return meta;
    }

    public MetricConfig getConfig() {
        return config;
    }

    /**
     * @return the time the series of this metric were last loaded, or null if they were never loaded
     */
    public Instant getLoadTimeAt() {
        return loadTimeAt;
    }

    @Override
    public String toString() {
        return "Metric(" + meta.getNamespace() + "/" + getName() + ")";
    }
}
