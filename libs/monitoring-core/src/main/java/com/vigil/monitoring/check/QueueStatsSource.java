package com.vigil.monitoring.check;

/**
 * Reads job counts of a named queue from the queue backend.
 */
@FunctionalInterface
public interface QueueStatsSource {

    QueueStats stats(String queueName) throws Exception;
}
