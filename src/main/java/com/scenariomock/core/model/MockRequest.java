package com.scenariomock.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.scenariomock.core.http.HttpMethod;

import java.time.Instant;

/**
 * One expected call within a scenario.
 */
public class MockRequest {

    private final long id;
    private final long scenarioId;
    private final HttpMethod method;
    private final String pathPattern;
    private final String bodyPattern;
    private final String headersPattern;
    private final int sequenceOrder;
    private final int timesMatched;
    private final Instant createdAt;

    @JsonCreator
    public MockRequest(
            @JsonProperty("id") long id,
            @JsonProperty("scenarioId") long scenarioId,
            @JsonProperty("method") HttpMethod method,
            @JsonProperty("pathPattern") String pathPattern,
            @JsonProperty("bodyPattern") String bodyPattern,
            @JsonProperty("headersPattern") String headersPattern,
            @JsonProperty("sequenceOrder") int sequenceOrder,
            @JsonProperty("timesMatched") int timesMatched,
            @JsonProperty("createdAt") Instant createdAt) {
        this.id = id;
        this.scenarioId = scenarioId;
        this.method = method;
        this.pathPattern = pathPattern;
        this.bodyPattern = bodyPattern;
        this.headersPattern = headersPattern;
        this.sequenceOrder = sequenceOrder;
        this.timesMatched = timesMatched;
        this.createdAt = createdAt;
    }

    public MockRequest withTimesMatched(int count) {
        return new MockRequest(id, scenarioId, method, pathPattern, bodyPattern, headersPattern,
                sequenceOrder, count, createdAt);
    }

    public long getId() {
        return id;
    }

    public long getScenarioId() {
        return scenarioId;
    }

    public HttpMethod getMethod() {
        return method;
    }

    public String getPathPattern() {
        return pathPattern;
    }

    public String getBodyPattern() {
        return bodyPattern;
    }

    public String getHeadersPattern() {
        return headersPattern;
    }

    public int getSequenceOrder() {
        return sequenceOrder;
    }

    /**
     * Total matches since the mock was registered. Unlike the registry's counters this is not
     * reset when a scenario is re-activated.
     */
    public int getTimesMatched() {
        return timesMatched;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    @Override
    public String toString() {
        return "MockRequest{" +
                "id=" + id +
                ", " + method + " " + pathPattern +
                ", sequenceOrder=" + sequenceOrder +
                '}';
    }
}
