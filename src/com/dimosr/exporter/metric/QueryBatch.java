package com.dimosr.exporter.metric;

import com.dimosr.exporter.core.MetricRepository;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.Multimaps;

import java.util.List;

/**
 * A bounded group of queries, dispatched together to respect the query-per-request limit of the monitoring API
 */
public final class QueryBatch {
    private final ImmutableList<Query> queries;

    QueryBatch(final List<Query> queries) {
        this.queries = ImmutableList.copyOf(queries);
    }

    /**
     * Fetches the samples of all the queries in the batch,
     * using one request per distinct repository of the queries (normally a single one)
     */
    public List<PublishableSample> fetch() {
        ImmutableListMultimap<MetricRepository, Query> queriesByRepository = Multimaps.index(queries, Query::getRepository);

        ImmutableList.Builder<PublishableSample> samples = ImmutableList.builder();
        for (MetricRepository repository : queriesByRepository.keySet()) {
            samples.addAll(repository.fetchBatch(queriesByRepository.get(repository)));
        }
        return samples.build();
    }

    public ImmutableList<Query> getQueries() {
        return queries;
    }

    public int size() {
        return queries.size();
    }
}
