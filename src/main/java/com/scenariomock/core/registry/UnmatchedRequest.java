package com.scenariomock.core.registry;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.scenariomock.core.http.HttpRequest;

import java.time.Instant;

/**
 * A call that no mock of the active scenario answered, kept for diagnostics.
 */
public class UnmatchedRequest {

    private final String timestamp;
    private final String scenario;
    private final String method;
    private final String url;
    private final String body;

    @JsonCreator
    public UnmatchedRequest(
            @JsonProperty("timestamp") String timestamp,
            @JsonProperty("scenario") String scenario,
            @JsonProperty("method") String method,
            @JsonProperty("url") String url,
            @JsonProperty("body") String body) {
        this.timestamp = timestamp;
        this.scenario = scenario;
        this.method = method;
        this.url = url;
        this.body = body;
    }

    public static UnmatchedRequest of(String scenario, HttpRequest request) {
        return new UnmatchedRequest(Instant.now().toString(), scenario, request.getMethod().name(),
                request.getUrl(), request.getBody());
    }

    public String getTimestamp() {
        return timestamp;
    }

    /**
     * @return the scenario active when the call was made, or null if none was
     */
    public String getScenario() {
        return scenario;
    }

    public String getMethod() {
        return method;
    }

    public String getUrl() {
        return url;
    }

    public String getBody() {
        return body;
    }

    @Override
    public String toString() {
        return "UnmatchedRequest{" +
                "scenario='" + scenario + '\'' +
                ", method='" + method + '\'' +
                ", url='" + url + '\'' +
                ", bodyLength=" + (body != null ? body.length() : 0) +
                '}';
    }
}
