package com.dimosr.exporter.instance;

import com.dimosr.exporter.core.InstanceRepository;
import com.dimosr.exporter.util.DaemonThreadFactory;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * An InstanceRepository enhanced with a cache, which re-lists the instances of a namespace on a fixed interval
 * and serves the latest listing in between.
 *
 * - the first call to {@link #list(String)} loads the instances synchronously and propagates any failure
 * - afterwards, reads return the latest snapshot and never wait for a refresh in progress
 * - a failed refresh is logged and the previous snapshot keeps being served
 */
public class InstanceCache implements InstanceRepository {
    private static final Logger log = LoggerFactory.getLogger(InstanceCache.class);

    private final InstanceRepository repository;
    private final String namespace;
    private final Duration reloadInterval;
    private final ScheduledExecutorService scheduler;

    private final AtomicReference<ImmutableList<Instance>> snapshot = new AtomicReference<>();
    private final Object initialLoadLock = new Object();

    /**
     * @param repository the underlying repository that lists the instances remotely
     * @param namespace the namespace whose instances are cached
     * @param reloadInterval the interval between two consecutive listings
     */
    public InstanceCache(final InstanceRepository repository, final String namespace, final Duration reloadInterval) {
        this(repository, namespace, reloadInterval,
                Executors.newSingleThreadScheduledExecutor(DaemonThreadFactory.create("instance-cache-" + namespace + "-%d")));
    }

    @VisibleForTesting
    InstanceCache(final InstanceRepository repository,
                  final String namespace,
                  final Duration reloadInterval,
                  final ScheduledExecutorService scheduler) {
        this.repository = Preconditions.checkNotNull(repository);
        this.namespace = Preconditions.checkNotNull(namespace);
        this.reloadInterval = Preconditions.checkNotNull(reloadInterval);
        this.scheduler = Preconditions.checkNotNull(scheduler);
    }

    /**
     * Starts refreshing the cached instances periodically
     */
    public void start() {
        log.info("{}: Instances will be re-listed every {}", namespace, reloadInterval);
        scheduler.scheduleWithFixedDelay(
                this::refreshQuietly,
                reloadInterval.toMillis(),
                reloadInterval.toMillis(),
                TimeUnit.MILLISECONDS
        );
    }

    @Override
    public List<Instance> list(final String namespace) {
        Preconditions.checkArgument(this.namespace.equals(namespace),
                "This cache holds the instances of namespace %s, not of %s", this.namespace, namespace);

        ImmutableList<Instance> current = snapshot.get();
        if (current != null) {
            return current;
        }

        synchronized (initialLoadLock) {
            current = snapshot.get();
            return current != null ? current : refresh();
        }
    }

    /**
     * Lists the instances from the underlying repository and replaces the cached snapshot
     */
    @VisibleForTesting
    ImmutableList<Instance> refresh() {
        ImmutableList<Instance> instances = ImmutableList.copyOf(repository.list(namespace));
        snapshot.set(instances);
        log.info("{}: Loaded {} instances", namespace, instances.size());
        return instances;
    }

    private void refreshQuietly() {
        try {
            refresh();
        } catch (RuntimeException e) {
            ImmutableList<Instance> current = snapshot.get();
            log.warn("{}: Failed to re-list instances, the previous {} instances will keep being served",
                    namespace, current == null ? 0 : current.size(), e);
        } catch (Error e) {
            log.error("{}: Re-listing instances failed fatally, the cached instances will not be refreshed anymore",
                    namespace, e);
            throw e;
        }
    }

    public void close() {
        scheduler.shutdownNow();
    }
}
