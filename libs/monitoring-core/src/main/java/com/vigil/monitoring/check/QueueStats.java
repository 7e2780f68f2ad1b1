package com.vigil.monitoring.check;

/**
 * Job counts of one background queue.
 */
public record QueueStats(long waiting, long active, long completed, long failed, long delayed) {
}
