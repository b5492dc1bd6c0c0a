package com.wikisqldump;

import java.util.function.LongConsumer;

/**
 * Run options for {@link DumpConverter}.
 *
 * @param maxStatements    stop after this many INSERT statements, 0 for no limit
 * @param progressInterval tuples between progress log lines
 * @param progressListener receives the number of characters consumed so far
 */
public record ConverterOptions(
        int maxStatements,
        long progressInterval,
        LongConsumer progressListener) {

    public static final long DEFAULT_PROGRESS_INTERVAL = 500_000L;
    static final long LISTENER_INTERVAL = 1_000L;

    public ConverterOptions {
        if (maxStatements < 0) {
            throw new ConfigurationException("max statements must not be negative: " + maxStatements);
        }
        if (progressInterval <= 0) {
            throw new ConfigurationException("progress interval must be positive: " + progressInterval);
        }
        if (progressListener == null) {
            progressListener = chars -> {
            };
        }
    }

    public static ConverterOptions defaults() {
        return new ConverterOptions(0, DEFAULT_PROGRESS_INTERVAL, null);
    }

    public ConverterOptions withMaxStatements(int limit) {
        return new ConverterOptions(limit, progressInterval, progressListener);
    }

    public ConverterOptions withProgressListener(LongConsumer listener) {
        return new ConverterOptions(maxStatements, progressInterval, listener);
    }
}
