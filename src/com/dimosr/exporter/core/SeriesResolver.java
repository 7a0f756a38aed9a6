package com.dimosr.exporter.core;

import com.dimosr.exporter.instance.Instance;
import com.dimosr.exporter.metric.Metric;
import com.dimosr.exporter.metric.Series;

import java.util.List;

/**
 * Resolves the concrete timeseries selectors of a metric for a set of instances
 */
public interface SeriesResolver {
    List<Series> resolveSeries(Metric metric, List<Instance> instances);
}
