package com.dimosr.exporter;

import com.dimosr.exporter.core.SampleSink;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * The collectors of all the products of the exporter, together with their reloaders
 */
public class ExporterCollector {
    private static final Logger log = LoggerFactory.getLogger(ExporterCollector.class);

    private final ImmutableList<ProductCollector> collectors;
    private final Function<ProductCollector, CollectorReloader> reloaderFactory;
    private final List<CollectorReloader> reloaders = new ArrayList<>();

    private boolean started = false;
    private boolean closed = false;

    /**
     * @param collectors the collectors of the products, each one reloaded on the interval of its product configuration
     */
    public ExporterCollector(final List<ProductCollector> collectors) {
        this(collectors, collector -> new CollectorReloader(collector, collector.getProductConfig().getReloadInterval()));
    }

    ExporterCollector(final List<ProductCollector> collectors,
                      final Function<ProductCollector, CollectorReloader> reloaderFactory) {
        this.collectors = ImmutableList.copyOf(collectors);
        this.reloaderFactory = reloaderFactory;
    }

    /**
     * Starts the background reload of every product
     *
     * @throws IllegalStateException if the exporter has already been started or has been closed
     */
    public synchronized void start() {
        Preconditions.checkState(!closed, "Exporter collector has been closed");
        Preconditions.checkState(!started, "Exporter collector has already been started");
        started = true;

        for (ProductCollector collector : collectors) {
            CollectorReloader reloader = reloaderFactory.apply(collector);
            reloader.start();
            reloaders.add(reloader);
        }
        log.info("Started reloading {} products", collectors.size());
    }

    /**
     * Scrapes every product in turn, the batches of each product are fetched concurrently.
     * A product whose scrape fails is logged and contributes no samples, the remaining products are still scraped.
     *
     * @return the total number of samples handed to the sink
     */
    public int collect(final SampleSink sink) {
        int total = 0;
        for (ProductCollector collector : collectors) {
            try {
                total += collector.collect(sink);
            } catch (RuntimeException e) {
                if (Thread.currentThread().isInterrupted()) {
                    throw e;
                }
                log.error("{}: Failed to scrape the product, moving on to the next one", collector.getNamespace(), e);
            }
        }
        return total;
    }

    /**
     * Stops all the reloaders and closes all the collectors
     */
    public synchronized void close() {
        closed = true;
        for (CollectorReloader reloader : reloaders) {
            reloader.stop();
        }
        reloaders.clear();
        for (ProductCollector collector : collectors) {
            collector.close();
        }
    }

    public ImmutableList<ProductCollector> getCollectors() {
        return collectors;
    }
}
