package com.subreq.config;

/**
 * Batch evaluation settings.
 *
 * @param parallelism Worker threads evaluating requirement-year batches
 */
public record BatchConfig(int parallelism) {

    public static BatchConfig defaults() {
        return new BatchConfig(Runtime.getRuntime().availableProcessors());
    }
}
