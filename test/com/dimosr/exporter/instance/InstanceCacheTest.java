package com.dimosr.exporter.instance;

import com.dimosr.exporter.core.InstanceRepository;
import com.dimosr.exporter.exceptions.RepositoryException;
import com.google.common.collect.ImmutableList;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnitRunner;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@RunWith(MockitoJUnitRunner.class)
public class InstanceCacheTest {

    private static final String NAMESPACE = "KEC";
    private static final Duration RELOAD_INTERVAL = Duration.ofMinutes(5);

    private static final List<Instance> FIRST_LISTING = ImmutableList.of(Instance.of("i-1"), Instance.of("i-2"));
    private static final List<Instance> SECOND_LISTING = ImmutableList.of(Instance.of("i-3"));

    @Mock
    private InstanceRepository repository;
    @Mock
    private ScheduledExecutorService scheduler;

    private InstanceCache instanceCache;

    @Before
    public void setupInstanceCache() {
        instanceCache = new InstanceCache(repository, NAMESPACE, RELOAD_INTERVAL, scheduler);
    }

    @Test
    public void whenListedForTheFirstTimeThenInstancesAreLoadedFromTheRepository() {
        when(repository.list(NAMESPACE))
                .thenReturn(FIRST_LISTING);

        List<Instance> instances = instanceCache.list(NAMESPACE);

        assertThat(instances).containsExactlyElementsOf(FIRST_LISTING);
    }

    @Test
    public void whenListedAgainThenTheCachedSnapshotIsReturnedWithoutCallingTheRepository() {
        when(repository.list(NAMESPACE))
                .thenReturn(FIRST_LISTING);

        List<Instance> first = instanceCache.list(NAMESPACE);
        List<Instance> second = instanceCache.list(NAMESPACE);

        assertThat(second).isSameAs(first);
        verify(repository, times(1)).list(NAMESPACE);
    }

    @Test
    public void whenFirstListingFailsThenTheFailurePropagates() {
        when(repository.list(NAMESPACE))
                .thenThrow(new RepositoryException("listing failed"));

        try {
            instanceCache.list(NAMESPACE);
            fail("Expected exception not thrown");
        } catch (RepositoryException e) {
            /* Nothing to do - verified that exception was thrown */
        }
    }

    @Test
    public void whenRefreshedThenTheNewListingIsServed() {
        when(repository.list(NAMESPACE))
                .thenReturn(FIRST_LISTING)
                .thenReturn(SECOND_LISTING);
        instanceCache.list(NAMESPACE);

        scheduledRefresh().run();

        assertThat(instanceCache.list(NAMESPACE)).containsExactlyElementsOf(SECOND_LISTING);
    }

    @Test
    public void whenRefreshFailsThenThePreviousListingKeepsBeingServed() {
        when(repository.list(NAMESPACE))
                .thenReturn(FIRST_LISTING)
                .thenThrow(new RepositoryException("listing failed"));
        instanceCache.list(NAMESPACE);

        scheduledRefresh().run();

        assertThat(instanceCache.list(NAMESPACE)).containsExactlyElementsOf(FIRST_LISTING);
        verify(repository, times(2)).list(NAMESPACE);
    }

    @Test
    public void refreshIsScheduledOnTheReloadInterval() {
        instanceCache.start();

        verify(scheduler).scheduleWithFixedDelay(
                any(Runnable.class),
                eq(RELOAD_INTERVAL.toMillis()),
                eq(RELOAD_INTERVAL.toMillis()),
                eq(TimeUnit.MILLISECONDS));
    }

    @Test(expected = IllegalArgumentException.class)
    public void cacheCannotBeAskedForTheInstancesOfAnotherNamespace() {
        instanceCache.list("EIP");
    }

    @Test
    public void closingTheCacheStopsTheScheduler() {
        instanceCache.close();

        verify(scheduler).shutdownNow();
    }

    @Test
    public void whenRefreshFailsFatallyThenTheErrorIsPropagatedToTheScheduler() {
        when(repository.list(NAMESPACE))
                .thenReturn(FIRST_LISTING)
                .thenThrow(new OutOfMemoryError("heap exhausted"));
        instanceCache.list(NAMESPACE);

        try {
            scheduledRefresh().run();
            fail("Expected error not thrown");
        } catch (OutOfMemoryError e) {
            /* Nothing to do - verified that error was thrown */
        }

        assertThat(instanceCache.list(NAMESPACE)).containsExactlyElementsOf(FIRST_LISTING);
    }

    private Runnable scheduledRefresh() {
        instanceCache.start();
        ArgumentCaptor<Runnable> refresh = ArgumentCaptor.forClass(Runnable.class);
        verify(scheduler).scheduleWithFixedDelay(refresh.capture(), anyLong(), anyLong(), any(TimeUnit.class));
        return refresh.getValue();
    }
}
