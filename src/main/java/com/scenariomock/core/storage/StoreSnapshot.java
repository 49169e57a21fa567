package com.scenariomock.core.storage;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.scenariomock.core.model.MockRequest;
import com.scenariomock.core.model.MockResponse;
import com.scenariomock.core.model.Scenario;

import java.util.List;

/**
 * Full content of a record store, including its id sequences. This is the on-disk format of
 * {@link JsonFileRecordStore}.
 */
public class StoreSnapshot {

    private final List<Scenario> scenarios;
    private final List<MockRequest> requests;
    private final List<MockResponse> responses;
    private final long nextScenarioId;
    private final long nextRequestId;
    private final long nextResponseId;

    @JsonCreator
    public StoreSnapshot(
            @JsonProperty("scenarios") List<Scenario> scenarios,
            @JsonProperty("requests") List<MockRequest> requests,
            @JsonProperty("responses") List<MockResponse> responses,
            @JsonProperty("nextScenarioId") long nextScenarioId,
            @JsonProperty("nextRequestId") long nextRequestId,
            @JsonProperty("nextResponseId") long nextResponseId) {
        this.scenarios = scenarios != null ? List.copyOf(scenarios) : List.of();
        this.requests = requests != null ? List.copyOf(requests) : List.of();
        this.responses = responses != null ? List.copyOf(responses) : List.of();
        this.nextScenarioId = nextScenarioId;
        this.nextRequestId = nextRequestId;
        this.nextResponseId = nextResponseId;
    }

    public List<Scenario> getScenarios() {
        return scenarios;
    }

    public List<MockRequest> getRequests() {
        return requests;
    }

    public List<MockResponse> getResponses() {
        return responses;
    }

    public long getNextScenarioId() {
        return nextScenarioId;
    }

    public long getNextRequestId() {
        return nextRequestId;
    }

    public long getNextResponseId() {
        return nextResponseId;
    }
}
