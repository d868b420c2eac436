package com.simtrade.sync;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.simtrade.trading.Transaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * Sends transactions to {@code {backend}/api/stock-transactions} as JSON.
 */
public final class HttpTransactionSync implements TransactionSync {
    private static final Logger logger = LoggerFactory.getLogger(HttpTransactionSync.class);

    public static final String PATH = "/api/stock-transactions";

    private final JsonHttpPublisher publisher;

    public HttpTransactionSync(HttpClient httpClient, ObjectMapper objectMapper, String backendBaseUrl, Duration timeout) {
        this.publisher = new JsonHttpPublisher(httpClient, objectMapper, stripTrailingSlash(backendBaseUrl) + PATH, timeout);
        logger.info("Transaction sync target: {}", publisher.endpoint());
    }

    @Override
    public void persist(Transaction transaction) {
        publisher.post(transaction);
        logger.debug("✅ Transaction {} synced to backend", transaction.id());
    }

    static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
