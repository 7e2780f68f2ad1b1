package com.vigil.monitoring.check;

/**
 * Native liveness call of a storage backend (JDBC validation, MongoDB ping, Redis PING).
 */
@FunctionalInterface
public interface StorageProbe {

    /**
     * Returns normally when the backend answered; throws otherwise.
     */
    void ping() throws Exception;
}
