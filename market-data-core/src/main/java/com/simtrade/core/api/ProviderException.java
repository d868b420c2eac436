package com.simtrade.core.api;

/**
 * Transport or protocol failure talking to an upstream feed.
 * Retryable failures (timeouts, 5xx, 429, malformed bodies) are retried with backoff.
 */
public class ProviderException extends RuntimeException {

    private final String providerId;
    private final boolean retryable;
    private final int statusCode;

    public ProviderException(String providerId, String message, boolean retryable) {
        this(providerId, message, retryable, -1, null);
    }

    public ProviderException(String providerId, String message, boolean retryable, Throwable cause) {
        this(providerId, message, retryable, -1, cause);
    }

    public ProviderException(String providerId, String message, boolean retryable, int statusCode, Throwable cause) {
        super(providerId + ": " + message, cause);
        this.providerId = providerId;
        this.retryable = retryable;
        this.statusCode = statusCode;
    }

    /**
     * Classify an HTTP status. 429 and 5xx are transient.
     */
    public static ProviderException forStatus(String providerId, int statusCode) {
        boolean retryable = statusCode == 429 || statusCode >= 500;
        String message = statusCode == 429 ? "rate limited (HTTP 429)" : "HTTP " + statusCode;
        return new ProviderException(providerId, message, retryable, statusCode, null);
    }

    public String getProviderId() {
        return providerId;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
