package com.dimosr.exporter.metric;

import com.dimosr.exporter.config.ProductConfig;
import com.dimosr.exporter.exceptions.InvalidSeriesException;
import com.dimosr.exporter.instance.Instance;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.junit.Before;
import org.junit.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.fail;

public class MetricTest {

    private static final String NAMESPACE = "KEC";
    private static final String METRIC_NAME = "cpu.utilizition";
    private static final Instant LOAD_TIME = Instant.parse("2024-01-01T00:00:00Z");

    private Metric metric;

    @Before
    public void setup() {
        MetricMeta meta = new MetricMeta(NAMESPACE, METRIC_NAME, "Percent", ImmutableList.of("InstanceId"), ImmutableList.of(60, 300));
        metric = new Metric(meta, MetricConfig.fromProductConfig(ProductConfig.builder(NAMESPACE).build(), meta));
    }

    @Test
    public void whenSeriesAreLoadedThenTheyAreCachedAndLoadTimeIsSet() {
        int added = metric.loadSeries(ImmutableList.of(series("i-1"), series("i-2")), LOAD_TIME);

        assertThat(added).isEqualTo(2);
        assertThat(metric.getSeries()).extracting(Series::getId)
                .containsExactly(series("i-1").getId(), series("i-2").getId());
        assertThat(metric.getLoadTimeAt()).isEqualTo(LOAD_TIME);
    }

    @Test
    public void whenSameSeriesAreLoadedAgainThenTheyAreNotDuplicatedAndPreviousOnesAreKept() {
        metric.loadSeries(ImmutableList.of(series("i-1"), series("i-2")), LOAD_TIME);

        int added = metric.loadSeries(ImmutableList.of(series("i-2"), series("i-3")), LOAD_TIME.plusSeconds(600));

        assertThat(added).isEqualTo(1);
        assertThat(metric.getSeriesCount()).isEqualTo(3);
        assertThat(metric.getLoadTimeAt()).isEqualTo(LOAD_TIME.plusSeconds(600));
    }

    @Test
    public void whenSeriesOfAnotherMetricIsLoadedThenNothingIsLoaded() {
        Series foreign = new Series("memory.usage", Instance.of("i-1"), ImmutableMap.of("InstanceId", "i-1"));

        try {
            metric.loadSeries(ImmutableList.of(series("i-1"), foreign), LOAD_TIME);
            fail("Expected exception not thrown");
        } catch (InvalidSeriesException e) {
            /* Nothing to do - verified that exception was thrown */
        }

        assertThat(metric.getSeriesCount()).isEqualTo(0);
        assertThat(metric.getLoadTimeAt()).isNull();
    }

    @Test
    public void metricThatWasNeverLoadedIsNotFresh() {
        assertThat(metric.isFresh(LOAD_TIME)).isFalse();
    }

    @Test
    public void metricLoadedWithinTheRecencyWindowIsFresh() {
        metric.loadSeries(ImmutableList.of(series("i-1")), LOAD_TIME);

        assertThat(metric.isFresh(LOAD_TIME)).isTrue();
        assertThat(metric.isFresh(LOAD_TIME.plusSeconds(59))).isTrue();
    }

    @Test
    public void metricLoadedAfterTheCycleStartedIsFresh() {
        metric.loadSeries(ImmutableList.of(series("i-1")), LOAD_TIME);

        assertThat(metric.isFresh(LOAD_TIME.minusSeconds(5))).isTrue();
    }

    @Test
    public void metricLoadedOutsideTheRecencyWindowIsNotFresh() {
        metric.loadSeries(ImmutableList.of(series("i-1")), LOAD_TIME);

        assertThat(metric.isFresh(LOAD_TIME.plusSeconds(60))).isFalse();
        assertThat(metric.isFresh(LOAD_TIME.plusSeconds(61))).isFalse();
    }

    private Series series(final String instanceId) {
        return new Series(METRIC_NAME, Instance.of(instanceId), ImmutableMap.of("InstanceId", instanceId));
    }
}
