package com.simtrade.core.cache;

/**
 * Failure reading or writing a persistent cache tier.
 */
public class QuoteCacheException extends RuntimeException {

    public QuoteCacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
