package com.dimosr.exporter.metric;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import java.util.List;

/**
 * The ordered set of queries of one collection cycle.
 *
 * A query set is immutable: every reload cycle builds a new one,
 * so it can be read by any number of concurrent scrapes.
 */
public final class QuerySet {
    private static final QuerySet EMPTY = new QuerySet(ImmutableList.of());

    private final ImmutableList<Query> queries;

    public QuerySet(final List<Query> queries) {
        this.queries = ImmutableList.copyOf(queries);
    }

    public static QuerySet empty() {
        return EMPTY;
    }

    /**
     * Splits the queries in consecutive batches of the given size, the last batch may be smaller.
     * Concatenating the batches gives back the queries in their original order.
     *
     * @param size the maximum number of queries in each batch
     */
    public List<QueryBatch> splitByBatch(final int size) {
        Preconditions.checkArgument(size > 0, "The batch size has to be a positive number, but it was: %s", size);

        ImmutableList.Builder<QueryBatch> batches = ImmutableList.builder();
        for (List<Query> partition : Lists.partition(queries, size)) {
            batches.add(new QueryBatch(partition));
        }
        return batches.build();
    }

    public ImmutableList<Query> getQueries() {
        return queries;
    }

    public int size() {
        return queries.size();
    }

    public boolean isEmpty() {
        return queries.isEmpty();
    }

    public int getSeriesCount() {
        int count = 0;
        for (Query query : queries) {
            count += query.getMetric().getSeriesCount();
        }
        return count;
    }
}
