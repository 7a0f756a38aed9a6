package com.dimosr.exporter.core;

import com.dimosr.exporter.metric.PublishableSample;

/**
 * The write-only destination of the samples collected during a scrape
 *
 * Samples are handed to the sink by one thread at a time,
 * so implementations do not need to be thread-safe
 */
@FunctionalInterface
public interface SampleSink {
    void accept(PublishableSample sample);
}
