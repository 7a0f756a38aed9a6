package com.dimosr.exporter;

import com.dimosr.exporter.core.SampleSink;
import com.dimosr.exporter.exceptions.RepositoryException;
import com.google.common.collect.ImmutableList;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnitRunner;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.fail;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@RunWith(MockitoJUnitRunner.class)
public class ExporterCollectorTest {

    @Mock
    private ProductCollector computeCollector;
    @Mock
    private ProductCollector loadBalancerCollector;
    @Mock
    private CollectorReloader computeReloader;
    @Mock
    private CollectorReloader loadBalancerReloader;
    @Mock
    private SampleSink sink;

    private final AtomicInteger reloadersCreated = new AtomicInteger();
    private ExporterCollector exporterCollector;

    @Before
    public void setupExporterCollector() {
        exporterCollector = new ExporterCollector(
                ImmutableList.of(computeCollector, loadBalancerCollector),
                collector -> {
                    reloadersCreated.incrementAndGet();
                    return collector == computeCollector ? computeReloader : loadBalancerReloader;
                }
        );
    }

    @Test
    public void collectReturnsTheSamplesOfAllProducts() {
        when(computeCollector.collect(sink)).thenReturn(3);
        when(loadBalancerCollector.collect(sink)).thenReturn(4);

        int emitted = exporterCollector.collect(sink);

        assertThat(emitted).isEqualTo(7);
    }

    @Test
    public void startStartsTheReloaderOfEveryProduct() {
        exporterCollector.start();

        verify(computeReloader).start();
        verify(loadBalancerReloader).start();
    }

    @Test
    public void closeStopsTheReloadersBeforeClosingTheCollectors() {
        exporterCollector.start();

        exporterCollector.close();

        InOrder inOrder = inOrder(computeReloader, loadBalancerReloader, computeCollector, loadBalancerCollector);
        inOrder.verify(computeReloader).stop();
        inOrder.verify(loadBalancerReloader).stop();
        inOrder.verify(computeCollector).close();
        inOrder.verify(loadBalancerCollector).close();
    }

    @Test
    public void closeWithoutStartOnlyClosesTheCollectors() {
        exporterCollector.close();

        verify(computeCollector).close();
        verify(loadBalancerCollector).close();
        verifyNoInteractions(computeReloader, loadBalancerReloader);
    }

    @Test
    public void whenOneProductFailsToBeScrapedThenTheOtherProductsAreStillScraped() {
        when(computeCollector.collect(sink)).thenThrow(new RepositoryException("monitoring API unavailable"));
        when(loadBalancerCollector.collect(sink)).thenReturn(4);

        int emitted = exporterCollector.collect(sink);

        assertThat(emitted).isEqualTo(4);
        verify(loadBalancerCollector).collect(sink);
    }

    @Test
    public void whenStartedTwiceThenExceptionIsThrown() {
        exporterCollector.start();

        try {
            exporterCollector.start();
            fail("Expected exception not thrown");
        } catch (IllegalStateException e) {
            /* Nothing to do - verified that exception was thrown */
        }

        assertThat(reloadersCreated.get()).isEqualTo(2);
        verify(computeReloader, times(1)).start();
        verify(loadBalancerReloader, times(1)).start();
    }

    @Test
    public void whenStartedAfterCloseThenExceptionIsThrown() {
        exporterCollector.close();

        try {
            exporterCollector.start();
            fail("Expected exception not thrown");
        } catch (IllegalStateException e) {
            /* Nothing to do - verified that exception was thrown */
        }

        assertThat(reloadersCreated.get()).isEqualTo(0);
    }
}
