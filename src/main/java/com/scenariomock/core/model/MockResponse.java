package com.scenariomock.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * The canned reply of a {@link MockRequest}.
 */
public class MockResponse {

    private final long id;
    private final long requestId;
    private final int statusCode;
    private final String headers;
    private final String body;
    private final Integer delayMs;
    private final Instant createdAt;

    @JsonCreator
    public MockResponse(
            @JsonProperty("id") long id,
            @JsonProperty("requestId") long requestId,
            @JsonProperty("statusCode") int statusCode,
            @JsonProperty("headers") String headers,
            @JsonProperty("body") String body,
            @JsonProperty("delayMs") Integer delayMs,
            @JsonProperty("createdAt") Instant createdAt) {
        this.id = id;
        this.requestId = requestId;
        this.statusCode = statusCode;
        this.headers = headers;
        this.body = body;
        this.delayMs = delayMs;
        this.createdAt = createdAt;
    }

    public long getId() {
        return id;
    }

    public long getRequestId() {
        return requestId;
    }

    public int getStatusCode() {
        return statusCode;
    }

    /**
     * @return JSON object of response headers, or null
     */
    public String getHeaders() {
        return headers;
    }

    public String getBody() {
        return body;
    }

    /**
     * @return simulated latency in milliseconds, or null for none
     */
    public Integer getDelayMs() {
        return delayMs;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    @Override
    public String toString() {
        return "MockResponse{" +
                "id=" + id +
                ", requestId=" + requestId +
                ", statusCode=" + statusCode +
                ", delayMs=" + delayMs +
                ", bodyLength=" + (body != null ? body.length() : 0) +
                '}';
    }
}
