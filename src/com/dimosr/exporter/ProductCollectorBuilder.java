package com.dimosr.exporter;

import com.dimosr.exporter.config.ExporterConfig;
import com.dimosr.exporter.config.ProductConfig;
import com.dimosr.exporter.core.ExporterStats;
import com.dimosr.exporter.core.InstanceRepository;
import com.dimosr.exporter.core.MetricRepository;
import com.dimosr.exporter.core.ProductHandler;
import com.dimosr.exporter.core.ProjectContextRefresher;
import com.dimosr.exporter.instance.InstanceCache;
import com.dimosr.exporter.util.DaemonThreadFactory;
import com.google.common.base.Preconditions;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * A builder used to assemble the collector of a product.
 *
 * The mandatory parts are the exporter configuration, the metric repository and the handler registry.
 * Products that discover their instances also need an instance repository,
 * which is wrapped in an {@link InstanceCache} refreshed on the reload interval of the product.
 *
 * Building the collector also runs its first reload cycle, so that it can serve scrapes right away.
 * Any structural failure (missing handler, missing configuration, instances that cannot be listed)
 * fails the build.
 */
public class ProductCollectorBuilder {
    private static final ExporterStats NULL_EXPORTER_STATS = (name, value, timestamp) -> {};
    private static final ProjectContextRefresher NULL_PROJECT_CONTEXT_REFRESHER = () -> {};

    private final String namespace;

    private ExporterConfig exporterConfig;
    private MetricRepository metricRepository;
    private InstanceRepository instanceRepository;
    private ProductHandlerRegistry handlerRegistry;

    private ProjectContextRefresher projectContextRefresher = NULL_PROJECT_CONTEXT_REFRESHER;
    private ExporterStats stats = NULL_EXPORTER_STATS;
    private ExecutorService scrapeExecutor;
    private Clock clock = Clock.systemUTC();

    public ProductCollectorBuilder(final String namespace) {
        this.namespace = Preconditions.checkNotNull(namespace);
    }

    public ProductCollectorBuilder withExporterConfig(final ExporterConfig exporterConfig) {
        this.exporterConfig = exporterConfig;
        return this;
    }

    public ProductCollectorBuilder withMetricRepository(final MetricRepository metricRepository) {
        this.metricRepository = metricRepository;
        return this;
    }

    /**
     * @param instanceRepository the repository listing the instances remotely, it will be cached by the collector
     */
    public ProductCollectorBuilder withInstanceRepository(final InstanceRepository instanceRepository) {
        this.instanceRepository = instanceRepository;
        return this;
    }

    public ProductCollectorBuilder withHandlerRegistry(final ProductHandlerRegistry handlerRegistry) {
        this.handlerRegistry = handlerRegistry;
        return this;
    }

    /**
     * @param projectContextRefresher called at the start of every reload cycle, its failures are only logged
     */
    public ProductCollectorBuilder withProjectContextRefresher(final ProjectContextRefresher projectContextRefresher) {
        this.projectContextRefresher = projectContextRefresher;
        return this;
    }

    /**
     * Enables recording of the operational statistics of the collector (queries, series, failed batches etc.)
     */
    public ProductCollectorBuilder withStats(final ExporterStats stats) {
        this.stats = stats;
        return this;
    }

    /**
     * @param scrapeExecutor the executor fetching the batches of a scrape concurrently.
     *                       If not provided, the collector uses (and owns) a cached thread pool of daemon threads.
     *
     * Attention: batches are fetched concurrently only if the executor is multi-threaded
     */
    public ProductCollectorBuilder withScrapeExecutor(final ExecutorService scrapeExecutor) {
        this.scrapeExecutor = scrapeExecutor;
        return this;
    }

    public ProductCollectorBuilder withClock(final Clock clock) {
        this.clock = clock;
        return this;
    }

    public ProductCollector build() {
        Preconditions.checkState(exporterConfig != null, "An exporter configuration is required");
        Preconditions.checkState(metricRepository != null, "A metric repository is required");
        Preconditions.checkState(handlerRegistry != null, "A product handler registry is required");

        final ProductHandlerFactory factory = handlerRegistry.getFactory(namespace);
        final ProductConfig productConfig = exporterConfig.getProductConfig(namespace);

        InstanceCache instanceCache = null;
        if (productConfig.isInstanceDiscovery()) {
            Preconditions.checkState(instanceRepository != null,
                    "Namespace %s discovers its instances, but no instance repository was provided", namespace);
            instanceCache = new InstanceCache(instanceRepository, namespace, productConfig.getReloadInterval());
        }

        final boolean ownsScrapeExecutor = scrapeExecutor == null;
        final ExecutorService executor = ownsScrapeExecutor
                ? Executors.newCachedThreadPool(DaemonThreadFactory.create("product-collector-" + namespace + "-%d"))
                : scrapeExecutor;

        final Optional<InstanceCache> cache = Optional.ofNullable(instanceCache);
        ProductCollector collector = null;
        try {
            ProductHandler handler = factory.create(namespace, productConfig, Optional.ofNullable(instanceCache));
            collector = new ProductCollector(
                    namespace,
                    exporterConfig,
                    productConfig,
                    metricRepository,
                    handler,
                    cache,
                    projectContextRefresher,
                    stats,
                    executor,
                    ownsScrapeExecutor,
                    clock
            );
            collector.loadMetricsByProductConf();
        } catch (RuntimeException e) {
            if (collector != null) {
                collector.close();
            } else {
                cache.ifPresent(InstanceCache::close);
                if (ownsScrapeExecutor) {
                    executor.shutdownNow();
                }
            }
            throw e;
        }

        cache.ifPresent(InstanceCache::start);
        return collector;
    }
}
