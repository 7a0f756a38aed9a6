package com.dimosr.exporter.config;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import java.time.Duration;
import java.util.Arrays;
import java.util.Collection;
import java.util.Locale;

/**
 * The static configuration of the collection of a single product (namespace).
 * Instances are immutable and built through {@link Builder}.
 *
 * Metric name lists are normalised to lower case, so that filtering is case-insensitive.
 */
public final class ProductConfig {
    public static final int DEFAULT_MAX_INSTANCES = 100;
    public static final int DEFAULT_QUERY_BATCH_SIZE = 100;
    public static final int DEFAULT_PERIOD_SECONDS = 60;
    public static final Duration DEFAULT_RELOAD_INTERVAL = Duration.ofMinutes(10);
    public static final String DEFAULT_STATISTIC_TYPE = "Average";

    private final String namespace;
    private final ImmutableSet<String> excludeMetrics;
    private final ImmutableSet<String> onlyIncludeMetrics;
    private final ImmutableSet<String> onlyIncludeInstances;
    private final ImmutableSet<String> excludeInstances;
    private final ImmutableList<String> customInstances;
    private final boolean instanceDiscovery;
    private final boolean multiDimension;
    private final int maxInstances;
    private final Duration reloadInterval;
    private final int queryBatchSize;
    private final int periodSeconds;
    private final ImmutableList<String> statisticTypes;

    private ProductConfig(final Builder builder) {
        this.namespace = builder.namespace;
        this.excludeMetrics = lowerCase(builder.excludeMetrics);
        this.onlyIncludeMetrics = lowerCase(builder.onlyIncludeMetrics);
        this.onlyIncludeInstances = ImmutableSet.copyOf(builder.onlyIncludeInstances);
        this.excludeInstances = ImmutableSet.copyOf(builder.excludeInstances);
        this.customInstances = ImmutableList.copyOf(builder.customInstances);
        this.instanceDiscovery = builder.instanceDiscovery;
        this.multiDimension = builder.multiDimension;
        this.maxInstances = builder.maxInstances;
        this.reloadInterval = builder.reloadInterval;
        this.queryBatchSize = builder.queryBatchSize;
        this.periodSeconds = builder.periodSeconds;
        this.statisticTypes = builder.statisticTypes.isEmpty()
                ? ImmutableList.of(DEFAULT_STATISTIC_TYPE)
                : ImmutableList.copyOf(builder.statisticTypes);
    }

    public static Builder builder(final String namespace) {
        return new Builder(namespace);
    }

    private static ImmutableSet<String> lowerCase(final Collection<String> names) {
        ImmutableSet.Builder<String> normalised = ImmutableSet.builder();
        for (String name : names) {
            normalised.add(name.toLowerCase(Locale.ROOT));
        }
        return normalised.build();
    }

    /**
     * A metric is excluded when its name is in the exclusion list,
     * or when an allow list is configured and the name is not in it
     */
    public boolean isMetricExcluded(final String metricName) {
        String normalised = metricName.toLowerCase(Locale.ROOT);
        if (excludeMetrics.contains(normalised)) {
            return true;
        }
        return !onlyIncludeMetrics.isEmpty() && !onlyIncludeMetrics.contains(normalised);
    }

    public boolean isInstanceIncluded(final String instanceId) {
        if (excludeInstances.contains(instanceId)) {
            return false;
        }
        return onlyIncludeInstances.isEmpty() || onlyIncludeInstances.contains(instanceId);
    }

    public String getNamespace() {
        return namespace;
    }

    public ImmutableSet<String> getExcludeMetrics() {
        return excludeMetrics;
    }

    public ImmutableSet<String> getOnlyIncludeMetrics() {
        return onlyIncludeMetrics;
    }

    public ImmutableList<String> getCustomInstances() {
        return customInstances;
    }

    public boolean isInstanceDiscovery() {
        return instanceDiscovery;
    }

    public boolean isMultiDimension() {
        return multiDimension;
    }

    public int getMaxInstances() {
        return maxInstances;
    }

    public Duration getReloadInterval() {
        return reloadInterval;
    }

    public int getQueryBatchSize() {
        return queryBatchSize;
    }

    public int getPeriodSeconds() {
        return periodSeconds;
    }

    public ImmutableList<String> getStatisticTypes() {
        return statisticTypes;
    }

    public static class Builder {
        private final String namespace;
        private Collection<String> excludeMetrics = ImmutableSet.of();
        private Collection<String> onlyIncludeMetrics = ImmutableSet.of();
        private Collection<String> onlyIncludeInstances = ImmutableSet.of();
        private Collection<String> excludeInstances = ImmutableSet.of();
        private Collection<String> customInstances = ImmutableList.of();
        private boolean instanceDiscovery = true;
        private boolean multiDimension = false;
        private int maxInstances = DEFAULT_MAX_INSTANCES;
        private Duration reloadInterval = DEFAULT_RELOAD_INTERVAL;
        private int queryBatchSize = DEFAULT_QUERY_BATCH_SIZE;
        private int periodSeconds = DEFAULT_PERIOD_SECONDS;
        private Collection<String> statisticTypes = ImmutableList.of();

        private Builder(final String namespace) {
            Preconditions.checkArgument(namespace != null && !namespace.isEmpty(), "namespace must not be empty");
            this.namespace = namespace;
        }

        /**
         * @param metricNames the metrics that will not be collected, compared case-insensitively
         */
        public Builder withExcludeMetrics(final String... metricNames) {
            this.excludeMetrics = Arrays.asList(metricNames);
            return this;
        }

        /**
         * @param metricNames if not empty, only these metrics will be collected, compared case-insensitively
         */
        public Builder withOnlyIncludeMetrics(final String... metricNames) {
            this.onlyIncludeMetrics = Arrays.asList(metricNames);
            return this;
        }

        public Builder withOnlyIncludeInstances(final String... instanceIds) {
            this.onlyIncludeInstances = Arrays.asList(instanceIds);
            return this;
        }

        public Builder withExcludeInstances(final String... instanceIds) {
            this.excludeInstances = Arrays.asList(instanceIds);
            return this;
        }

        /**
         * Disables instance discovery, the provided instance ids will be monitored instead
         */
        public Builder withCustomInstances(final String... instanceIds) {
            this.instanceDiscovery = false;
            this.customInstances = Arrays.asList(instanceIds);
            return this;
        }

        /**
         * Enables multi-dimension monitoring, where at most {@code maxInstances} instances are loaded per cycle
         */
        public Builder withMultiDimension(final int maxInstances) {
            Preconditions.checkArgument(maxInstances > 0, "max instances has to be positive, but it was: %s", maxInstances);
            this.multiDimension = true;
            this.maxInstances = maxInstances;
            return this;
        }

        public Builder withReloadInterval(final Duration reloadInterval) {
            Preconditions.checkArgument(!reloadInterval.isNegative() && !reloadInterval.isZero(), "reload interval has to be positive");
            this.reloadInterval = reloadInterval;
            return this;
        }

        public Builder withQueryBatchSize(final int queryBatchSize) {
            Preconditions.checkArgument(queryBatchSize > 0, "query batch size has to be positive, but it was: %s", queryBatchSize);
            this.queryBatchSize = queryBatchSize;
            return this;
        }

        public Builder withPeriodSeconds(final int periodSeconds) {
            this.periodSeconds = periodSeconds;
            return this;
        }

        public Builder withStatisticTypes(final String... statisticTypes) {
            this.statisticTypes = Arrays.asList(statisticTypes);
            return this;
        }

        public ProductConfig build() {
            return new ProductConfig(this);
        }
    }
}
