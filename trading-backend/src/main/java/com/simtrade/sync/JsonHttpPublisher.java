package com.simtrade.sync;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

/**
 * POSTs a JSON body and treats anything but 2xx as a {@link SyncException}.
 */
final class JsonHttpPublisher {

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final URI endpoint;
    private final Duration timeout;

    JsonHttpPublisher(HttpClient httpClient, ObjectMapper objectMapper, String endpoint, Duration timeout) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.endpoint = URI.create(endpoint);
        this.timeout = timeout;
    }

    URI endpoint() {
        return endpoint;
    }

    void post(Object payload) {
        String body;
        try {
            body = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new SyncException("Cannot serialize payload for " + endpoint, e);
        }

        var request = HttpRequest.newBuilder()
            .uri(endpoint)
            .header("Content-Type", "application/json")
            .timeout(timeout)
            .POST(HttpRequest.BodyPublishers.ofString(body))
            .build();

        try {
            var response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() / 100 != 2) {
                throw new SyncException("POST " + endpoint + " failed: HTTP " + response.statusCode(),
                    response.statusCode(), null);
            }
        } catch (HttpTimeoutException e) {
            throw new SyncException("POST " + endpoint + " timed out", e);
        } catch (IOException e) {
            throw new SyncException("POST " + endpoint + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SyncException("Interrupted while posting to " + endpoint, e);
        }
    }
}
