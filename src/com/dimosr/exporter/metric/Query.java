package com.dimosr.exporter.metric;

import com.dimosr.exporter.core.MetricRepository;
import com.google.common.base.Preconditions;

/**
 * The unit of work of a scrape: a metric together with the repository that fetches its samples
 */
public final class Query {
    private final Metric metric;
    private final MetricRepository repository;

    private Query(final Metric metric, final MetricRepository repository) {
        this.metric = metric;
        this.repository = repository;
    }

    public static Query of(final Metric metric, final MetricRepository repository) {
        Preconditions.checkNotNull(metric, "a query needs a metric");
        Preconditions.checkNotNull(repository, "a query needs a metric repository");
        return new Query(metric, repository);
    }

    public Metric getMetric() {
        return metric;
    }

    public MetricRepository getRepository() {
        return repository;
    }

    @Override
    public String toString() {
        return "Query(" + metric.getName() + ")";
    }
}
