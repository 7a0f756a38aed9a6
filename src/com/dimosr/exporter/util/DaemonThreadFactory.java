package com.dimosr.exporter.util;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ThreadFactory;

/**
 * Thread factories for the background threads of the exporter.
 * Threads are daemons, so they never keep the process alive, and uncaught exceptions are logged.
 */
public final class DaemonThreadFactory {
    private static final Logger log = LoggerFactory.getLogger(DaemonThreadFactory.class);

    private DaemonThreadFactory() {
    }

    /**
     * @param nameFormat a {@link String#format(String, Object...)} format with a single %d for the thread index
     */
    public static ThreadFactory create(final String nameFormat) {
        return new ThreadFactoryBuilder()
                .setNameFormat(nameFormat)
                .setDaemon(true)
                .setUncaughtExceptionHandler((thread, e) -> log.error("Uncaught exception in thread '{}':", thread.getName(), e))
                .build();
    }
}
