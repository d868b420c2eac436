package com.simtrade.sync;

/**
 * A remote copy of a transaction could not be written.
 */
public class SyncException extends RuntimeException {
    private final int statusCode;

    public SyncException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public SyncException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * HTTP status of the failed call, or -1 when no response arrived.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
