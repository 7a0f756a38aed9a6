package com.dimosr.exporter;

import com.dimosr.exporter.util.DaemonThreadFactory;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Re-runs the discovery of a {@link ProductCollector} periodically in the background.
 *
 * The first reload happens one full interval after {@link #start()},
 * since the collector has already loaded its metrics when it was built.
 * Reloads run on a single thread, one at a time: a reload that takes longer than the interval delays the next one.
 *
 * Stopping is cooperative: a reload in progress always runs to completion, only the following ones are prevented.
 */
public class CollectorReloader {
    private static final Logger log = LoggerFactory.getLogger(CollectorReloader.class);

    private final ProductCollector collector;
    private final Duration reloadInterval;
    private final ScheduledExecutorService scheduler;
    private final boolean ownsScheduler;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private volatile ScheduledFuture<?> scheduledReload;

    public CollectorReloader(final ProductCollector collector, final Duration reloadInterval) {
        this(collector, reloadInterval,
                Executors.newSingleThreadScheduledExecutor(DaemonThreadFactory.create("collector-reloader-" + collector.getNamespace() + "-%d")),
                true);
    }

    @VisibleForTesting
    CollectorReloader(final ProductCollector collector,
                      final Duration reloadInterval,
                      final ScheduledExecutorService scheduler,
                      final boolean ownsScheduler) {
        Preconditions.checkArgument(!reloadInterval.isNegative() && !reloadInterval.isZero(), "reload interval has to be positive");
        this.collector = Preconditions.checkNotNull(collector);
        this.reloadInterval = reloadInterval;
        this.scheduler = Preconditions.checkNotNull(scheduler);
        this.ownsScheduler = ownsScheduler;
    }

    /**
     * Starts reloading periodically
     *
     * @throws IllegalStateException if the reloader has already been started
     */
    public synchronized void start() {
        Preconditions.checkState(started.compareAndSet(false, true),
                "Reloader of namespace %s has already been started", collector.getNamespace());
        if (stopped.get()) {
            log.info("{}: Reloader was stopped before being started, no reload will be scheduled", collector.getNamespace());
            return;
        }

        log.info("{}: Product metadata will be reloaded every {}", collector.getNamespace(), reloadInterval);
        scheduledReload = scheduler.scheduleAtFixedRate(
                this::reload,
                reloadInterval.toMillis(),
                reloadInterval.toMillis(),
                TimeUnit.MILLISECONDS
        );
    }

    @VisibleForTesting
    void reload() {
        if (stopped.get()) {
            return;
        }

        log.info("{}: Start reloading product metadata", collector.getNamespace());
        try {
            collector.loadMetricsByProductConf();
            log.info("{}: Completed reloading product metadata", collector.getNamespace());
        } catch (RuntimeException e) {
            log.error("{}: Failed to reload product metadata, the previous metrics will keep being collected",
                    collector.getNamespace(), e);
        } catch (Error e) {
            log.error("{}: Reloading product metadata failed fatally, no further reload will run",
                    collector.getNamespace(), e);
            throw e;
        }
    }

    /**
     * Prevents any further reload. Calling it more than once has no additional effect.
     */
    public synchronized void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }

        log.info("{}: Stopping reloader", collector.getNamespace());
        ScheduledFuture<?> scheduled = scheduledReload;
        if (scheduled != null) {
            scheduled.cancel(false);
        }
        if (ownsScheduler) {
            scheduler.shutdown();
        }
    }

    public boolean isStopped() {
        return stopped.get();
    }
}
