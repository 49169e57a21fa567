package com.scenariomock.core.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scenariomock.core.error.BackendException;
import com.scenariomock.core.http.HttpMethod;

import java.util.Map;
import java.util.Objects;

/**
 * Input for registering a {@link MockRequest}. Leaving the sequence unset appends the mock after
 * the scenario's existing ones.
 */
public class CreateMockRequest {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private final HttpMethod method;
    private final String pathPattern;
    private String bodyPattern;
    private String headersPattern;
    private Integer sequenceOrder;

    public CreateMockRequest(HttpMethod method, String pathPattern) {
        this.method = Objects.requireNonNull(method, "method");
        this.pathPattern = Objects.requireNonNull(pathPattern, "pathPattern");
    }

    public static CreateMockRequest get(String pathPattern) {
        return new CreateMockRequest(HttpMethod.GET, pathPattern);
    }

    public static CreateMockRequest post(String pathPattern) {
        return new CreateMockRequest(HttpMethod.POST, pathPattern);
    }

    public static CreateMockRequest put(String pathPattern) {
        return new CreateMockRequest(HttpMethod.PUT, pathPattern);
    }

    public static CreateMockRequest patch(String pathPattern) {
        return new CreateMockRequest(HttpMethod.PATCH, pathPattern);
    }

    public static CreateMockRequest delete(String pathPattern) {
        return new CreateMockRequest(HttpMethod.DELETE, pathPattern);
    }

    public CreateMockRequest withBodyPattern(String pattern) {
        this.bodyPattern = pattern;
        return this;
    }

    public CreateMockRequest withHeadersPattern(String pattern) {
        this.headersPattern = pattern;
        return this;
    }

    /**
     * Sets the headers pattern from a map of header names to expected values.
     *
     * @throws BackendException of kind CONFIGURATION if the map cannot be serialized
     */
    public CreateMockRequest withHeaders(Map<String, String> expected) throws BackendException {
        try {
            this.headersPattern = objectMapper.writeValueAsString(expected);
        } catch (JsonProcessingException e) {
            throw BackendException.configuration("Failed to serialize headers pattern: " + e.getOriginalMessage(), e);
        }
        return this;
    }

    public CreateMockRequest withSequence(int order) {
        this.sequenceOrder = order;
        return this;
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

    public Integer getSequenceOrder() {
        return sequenceOrder;
    }
}
