package com.dimosr.exporter.core;

import com.dimosr.exporter.metric.MetricMeta;
import com.dimosr.exporter.metric.PublishableSample;
import com.dimosr.exporter.metric.Query;

import java.util.List;

/**
 * An abstraction of the remote monitoring API
 *
 * Any timeout or cancellation of the remote calls is the responsibility of each implementation,
 * the callers do not enforce any deadline
 */
public interface MetricRepository {
    /**
     * @return the metadata of all the metrics available for the given instance of the namespace
     */
    List<MetricMeta> listMetrics(String namespace, String instanceId);

    /**
     * Fetches the latest samples of all the series of the provided queries, in a single remote request
     */
    List<PublishableSample> fetchBatch(List<Query> queries);
}
