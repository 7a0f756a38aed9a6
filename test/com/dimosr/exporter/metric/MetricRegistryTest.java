package com.dimosr.exporter.metric;

import com.dimosr.exporter.config.ProductConfig;
import com.google.common.collect.ImmutableList;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

public class MetricRegistryTest {

    private static final String NAMESPACE = "KEC";

    private MetricRegistry registry;
    private AtomicInteger factoryCalls;

    @Before
    public void setup() {
        registry = new MetricRegistry();
        factoryCalls = new AtomicInteger();
    }

    @Test
    public void whenKeyIsNotRegisteredThenTheFactoryMetricIsRegisteredAndReturned() {
        Metric metric = registry.getOrCreate(new MetricKey("cpu", "i-1"), () -> newMetric("cpu"));

        assertThat(factoryCalls.get()).isEqualTo(1);
        assertThat(registry.snapshot()).containsExactly(metric);
    }

    @Test
    public void whenKeyIsRegisteredThenTheExistingMetricIsReturnedWithoutCallingTheFactory() {
        Metric first = registry.getOrCreate(new MetricKey("cpu", "i-1"), () -> newMetric("cpu"));
        Metric second = registry.getOrCreate(new MetricKey("cpu", "i-1"), () -> newMetric("cpu"));

        assertThat(second).isSameAs(first);
        assertThat(factoryCalls.get()).isEqualTo(1);
        assertThat(registry.size()).isEqualTo(1);
    }

    @Test
    public void sameMetricNameOnDifferentInstancesIsRegisteredTwice() {
        Metric first = registry.getOrCreate(new MetricKey("cpu", "i-1"), () -> newMetric("cpu"));
        Metric second = registry.getOrCreate(new MetricKey("cpu", "i-2"), () -> newMetric("cpu"));

        assertThat(second).isNotSameAs(first);
        assertThat(registry.snapshot()).containsExactly(first, second);
    }

    @Test
    public void whenManyThreadsAskForTheSameKeyThenASingleMetricIsCreated() throws Exception {
        final int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch startSignal = new CountDownLatch(1);
        try {
            List<Callable<Metric>> tasks = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                tasks.add(() -> {
                    startSignal.await();
                    return registry.getOrCreate(new MetricKey("cpu", "i-1"), () -> newMetric("cpu"));
                });
            }
            List<Future<Metric>> results = new ArrayList<>();
            for (Callable<Metric> task : tasks) {
                results.add(executor.submit(task));
            }
            startSignal.countDown();

            Metric expected = results.get(0).get();
            for (Future<Metric> result : results) {
                assertThat(result.get()).isSameAs(expected);
            }
            assertThat(factoryCalls.get()).isEqualTo(1);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    public void snapshotIsNotAffectedBySubsequentRegistrations() {
        registry.getOrCreate(new MetricKey("cpu", "i-1"), () -> newMetric("cpu"));
        ImmutableList<Metric> snapshot = registry.snapshot();

        registry.getOrCreate(new MetricKey("memory", "i-1"), () -> newMetric("memory"));

        assertThat(snapshot).hasSize(1);
        assertThat(registry.snapshot()).hasSize(2);
    }

    private Metric newMetric(final String metricName) {
        factoryCalls.incrementAndGet();
        MetricMeta meta = new MetricMeta(NAMESPACE, metricName, "", ImmutableList.of(), ImmutableList.of());
        return new Metric(meta, MetricConfig.fromProductConfig(ProductConfig.builder(NAMESPACE).build(), meta));
    }
}
