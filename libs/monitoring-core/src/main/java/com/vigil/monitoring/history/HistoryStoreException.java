package com.vigil.monitoring.history;

/**
 * Raised when a history store cannot read or write.
 */
public class HistoryStoreException extends RuntimeException {

    public HistoryStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
