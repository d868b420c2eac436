package com.simtrade.sync;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.simtrade.trading.Transaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * Appends transactions to the audit trail at {@code {auditUrl}/transactions}.
 */
public final class HttpAuditRecorder implements AuditRecorder {
    private static final Logger logger = LoggerFactory.getLogger(HttpAuditRecorder.class);

    public static final String PATH = "/transactions";

    private final JsonHttpPublisher publisher;

    public HttpAuditRecorder(HttpClient httpClient, ObjectMapper objectMapper, String auditBaseUrl, Duration timeout) {
        this.publisher = new JsonHttpPublisher(httpClient, objectMapper,
            HttpTransactionSync.stripTrailingSlash(auditBaseUrl) + PATH, timeout);
        logger.info("Audit recorder target: {}", publisher.endpoint());
    }

    @Override
    public void record(Transaction transaction) {
        publisher.post(transaction);
        logger.debug("✅ Transaction {} recorded in audit trail", transaction.id());
    }
}
