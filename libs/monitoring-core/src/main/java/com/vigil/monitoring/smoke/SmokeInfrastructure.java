package com.vigil.monitoring.smoke;

import java.util.Map;

/**
 * Shared infrastructure reached by the infrastructure smoke tests.
 */
public interface SmokeInfrastructure {

    /** Returns the cache's reply to PING; expected {@code PONG}. */
    String pingCache() throws Exception;

    /** Statistics of the document store database; must contain a truthy {@code ok}. */
    Map<String, Object> documentStoreStats() throws Exception;

    /** Number of repeatable scheduled jobs registered with the job queue. */
    long scheduledJobCount() throws Exception;
}
