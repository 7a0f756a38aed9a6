package com.dimosr.exporter;

import com.dimosr.exporter.config.ExporterConfig;
import com.dimosr.exporter.config.ProductConfig;
import com.dimosr.exporter.core.ExporterStats;
import com.dimosr.exporter.core.MetricRepository;
import com.dimosr.exporter.core.ProductHandler;
import com.dimosr.exporter.core.ProjectContextRefresher;
import com.dimosr.exporter.core.SampleSink;
import com.dimosr.exporter.instance.Instance;
import com.dimosr.exporter.instance.InstanceCache;
import com.dimosr.exporter.metric.Metric;
import com.dimosr.exporter.metric.MetricConfig;
import com.dimosr.exporter.metric.MetricKey;
import com.dimosr.exporter.metric.MetricMeta;
import com.dimosr.exporter.metric.MetricRegistry;
import com.dimosr.exporter.metric.PublishableSample;
import com.dimosr.exporter.metric.Query;
import com.dimosr.exporter.metric.QueryBatch;
import com.dimosr.exporter.metric.QuerySet;
import com.dimosr.exporter.metric.Series;
import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Collects the metrics of a single product (namespace).
 *
 * The collection is split in two parts that run independently of each other:
 * - {@link #loadMetricsByProductConf()} discovers the instances and their metrics and materialises the queries
 *   of the cycle. It is called once on construction and then periodically by a {@link CollectorReloader}.
 * - {@link #collect(SampleSink)} fetches the samples of the latest queries, on every scrape.
 *
 * Failures of single instances, metrics or batches are logged and skipped,
 * so that they never starve the rest of the namespace of monitoring coverage.
 * Only structural failures (missing configuration, instances that cannot be listed) are propagated.
 */
public class ProductCollector {
    private static final Logger log = LoggerFactory.getLogger(ProductCollector.class);

    private static final String METRIC_TEMPLATE = "ProductCollector.%s.%s";

    private final String namespace;
    private final ExporterConfig exporterConfig;
    private final MetricRepository metricRepository;
    private final ProductHandler handler;
    private final Optional<InstanceCache> instanceCache;
    private final ProjectContextRefresher projectContextRefresher;
    private final ExporterStats stats;
    private final ExecutorService scrapeExecutor;
    private final boolean ownsScrapeExecutor;
    private final Clock clock;

    private final MetricRegistry registry = new MetricRegistry();

    private volatile ProductConfig productConfig;
    private volatile QuerySet queries = QuerySet.empty();

    ProductCollector(final String namespace,
                     final ExporterConfig exporterConfig,
                     final ProductConfig productConfig,
                     final MetricRepository metricRepository,
                     final ProductHandler handler,
                     final Optional<InstanceCache> instanceCache,
                     final ProjectContextRefresher projectContextRefresher,
                     final ExporterStats stats,
                     final ExecutorService scrapeExecutor,
                     final boolean ownsScrapeExecutor,
                     final Clock clock) {
        this.namespace = namespace;
        this.exporterConfig = exporterConfig;
        this.productConfig = productConfig;
        this.metricRepository = metricRepository;
        this.handler = handler;
        this.instanceCache = instanceCache;
        this.projectContextRefresher = projectContextRefresher;
        this.stats = stats;
        this.scrapeExecutor = scrapeExecutor;
        this.ownsScrapeExecutor = ownsScrapeExecutor;
        this.clock = clock;
    }

    /**
     * Fetches the samples of all the queries of the latest cycle and hands them to the sink as they arrive.
     *
     * The queries are split in batches, which are all fetched concurrently.
     * A batch that fails is logged and contributes no samples, without affecting the other batches.
     * The call returns only after every batch has completed.
     *
     * @return the number of samples handed to the sink
     */
    public int collect(final SampleSink sink) {
        final QuerySet current = queries;
        final List<QueryBatch> batches = current.splitByBatch(productConfig.getQueryBatchSize());

        final Object sinkLock = new Object();
        final AtomicInteger emitted = new AtomicInteger();
        final AtomicInteger failedBatches = new AtomicInteger();

        List<Callable<Void>> tasks = new ArrayList<>(batches.size());
        for (QueryBatch batch : batches) {
            tasks.add(() -> {
                fetchAndEmit(batch, sink, sinkLock, emitted, failedBatches);
                return null;
            });
        }

        try {
            for (Future<Void> result : scrapeExecutor.invokeAll(tasks)) {
                awaitBatch(result, failedBatches);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(String.format("Scrape of namespace %s was interrupted", namespace), e);
        }

        log.debug("{}: Collected {} samples from {} batches, {} batches failed",
                namespace, emitted.get(), batches.size(), failedBatches.get());
        recordStat("Samples", emitted.get());
        recordStat("FailedBatches", failedBatches.get());
        return emitted.get();
    }

    private void fetchAndEmit(final QueryBatch batch,
                              final SampleSink sink,
                              final Object sinkLock,
                              final AtomicInteger emitted,
                              final AtomicInteger failedBatches) {
        try {
            List<PublishableSample> samples = batch.fetch();
            synchronized (sinkLock) {
                for (PublishableSample sample : samples) {
                    sink.accept(sample);
                    emitted.incrementAndGet();
                }
            }
        } catch (RuntimeException e) {
            failedBatches.incrementAndGet();
            log.error("{}: Failed to get the samples of a batch of {} queries", namespace, batch.size(), e);
        }
    }

    private void awaitBatch(final Future<Void> result, final AtomicInteger failedBatches) throws InterruptedException {
        try {
            result.get();
        } catch (ExecutionException e) {
            failedBatches.incrementAndGet();
            log.error("{}: A batch of the scrape failed unexpectedly", namespace, e.getCause());
        }
    }

    /**
     * Runs a reload cycle: discovers the instances of the product and their metrics,
     * and replaces the queries used by the scrapes with the ones of the metrics loaded recently.
     *
     * @throws com.dimosr.exporter.exceptions.ProductConfigNotFoundException if the product is no longer configured
     * @throws RuntimeException if the instances of the product cannot be listed
     */
    public void loadMetricsByProductConf() {
        final Instant cycleStart = clock.instant();
        log.info("{}: Start loading metrics", namespace);

        reloadProjectContext();

        final ProductConfig cycleConfig = exporterConfig.getProductConfig(namespace);
        final List<Instance> instances = limitInstances(handler.getInstances(), cycleConfig);

        loadMetrics(instances, cycleConfig);

        final QuerySet newQueries = buildQueries(cycleStart);
        this.productConfig = cycleConfig;
        this.queries = newQueries;

        final int seriesCount = newQueries.getSeriesCount();
        log.info("{}: Loaded {} metrics, {} of them will be queried with {} series",
                namespace, registry.size(), newQueries.size(), seriesCount);
        recordStat("Metrics", registry.size());
        recordStat("Queries", newQueries.size());
        recordStat("Series", seriesCount);
        recordStat("ReloadLatency", Duration.between(cycleStart, clock.instant()).toMillis());
    }

    /**
     * Failures are only logged, discovery proceeds with whatever context is currently available
     */
    private void reloadProjectContext() {
        try {
            projectContextRefresher.reload();
        } catch (RuntimeException e) {
            log.warn("{}: Failed to reload the project context, discovery will use the current one", namespace, e);
        }
    }

    /**
     * Multi-dimension products are bounded to a maximum number of instances per cycle.
     * The bound keeps a prefix of the listing order, which is decided by the remote API
     * and is not guaranteed to be the same across cycles.
     */
    private List<Instance> limitInstances(final List<Instance> instances, final ProductConfig cycleConfig) {
        final int maxInstances = cycleConfig.getMaxInstances();
        if (cycleConfig.isMultiDimension() && instances.size() > maxInstances) {
            log.warn("{}: Loaded {} instances, which exceeds the maximum load of a single product, only the first {} will be loaded",
                    namespace, instances.size(), maxInstances);
            return instances.subList(0, maxInstances);
        }
        return instances;
    }

    private void loadMetrics(final List<Instance> instances, final ProductConfig cycleConfig) {
        for (Instance instance : instances) {
            final List<MetricMeta> metas;
            try {
                metas = metricRepository.listMetrics(namespace, instance.getInstanceId());
            } catch (RuntimeException e) {
                log.warn("{}: Failed to list the metrics of instance {}, the instance will be skipped",
                        namespace, instance.getInstanceId(), e);
                continue;
            }

            for (MetricMeta meta : metas) {
                if (cycleConfig.isMetricExcluded(meta.getMetricName())) {
                    log.debug("{}: Metric {} is excluded", namespace, meta.getMetricName());
                    continue;
                }
                loadMetric(meta, instance, cycleConfig);
            }
        }
    }

    private void loadMetric(final MetricMeta meta, final Instance instance, final ProductConfig cycleConfig) {
        final MetricKey key = new MetricKey(meta.getMetricName(), instance.getInstanceId());

        final Metric metric;
        try {
            metric = registry.getOrCreate(key, () -> new Metric(meta, MetricConfig.fromProductConfig(cycleConfig, meta)));
        } catch (RuntimeException e) {
            log.warn("{}: Failed to create metric {} of instance {}", namespace, meta.getMetricName(), instance.getInstanceId(), e);
            return;
        }

        final List<Series> series;
        try {
            series = handler.resolveSeries(metric, ImmutableList.of(instance));
        } catch (RuntimeException e) {
            log.error("{}: Failed to resolve the series of metric {} of instance {}", namespace, metric.getName(), instance.getInstanceId(), e);
            return;
        }

        try {
            int added = metric.loadSeries(series, clock.instant());
            log.debug("{}: Found {} series for metric {} of instance {}, {} of them new",
                    namespace, series.size(), metric.getName(), instance.getInstanceId(), added);
        } catch (RuntimeException e) {
            log.error("{}: Failed to load the series of metric {} of instance {}", namespace, metric.getName(), instance.getInstanceId(), e);
        }
    }

    /**
     * Builds the queries of the cycle in a new set, so that scrapes never observe a partially built one
     */
    private QuerySet buildQueries(final Instant cycleStart) {
        ImmutableList.Builder<Query> fresh = ImmutableList.builder();
        for (Metric metric : registry.snapshot()) {
            if (metric.isFresh(cycleStart)) {
                fresh.add(Query.of(metric, metricRepository));
            }
        }
        return new QuerySet(fresh.build());
    }

    private void recordStat(final String stat, final double value) {
        stats.record(String.format(METRIC_TEMPLATE, namespace, stat), value, clock.instant());
    }

    /**
     * Stops refreshing the cached instances and releases the threads owned by the collector
     */
    public void close() {
        instanceCache.ifPresent(InstanceCache::close);
        if (ownsScrapeExecutor) {
            scrapeExecutor.shutdownNow();
        }
    }

    public String getNamespace() {
        return namespace;
    }

    public ProductConfig getProductConfig() {
        return productConfig;
    }

    /**
     * @return the queries of the latest reload cycle
     */
    public QuerySet getQueries() {
        return queries;
    }

    /**
     * @return all the metrics loaded so far, including the ones that are not fresh anymore
     */
    public ImmutableList<Metric> getMetrics() {
        return registry.snapshot();
    }
}
