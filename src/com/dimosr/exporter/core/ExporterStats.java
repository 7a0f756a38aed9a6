package com.dimosr.exporter.core;

import java.time.Instant;

/**
 * An abstraction used to record operational statistics of the exporter itself
 * (e.g. number of queries per cycle, failed batches, reload latency)
 *
 * Whether the recording is synchronous or asynchronous depends on each implementation
 * However, note that a synchronous implementation adds latency to reloads and scrapes
 */
@FunctionalInterface
public interface ExporterStats {
    void record(String name, double value, Instant timestamp);
}
