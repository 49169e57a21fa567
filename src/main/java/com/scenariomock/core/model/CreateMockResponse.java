package com.scenariomock.core.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scenariomock.core.error.BackendException;

import java.util.Map;

/**
 * Input for the canned reply of a mock.
 */
public class CreateMockResponse {

    public static final String JSON_CONTENT_TYPE = "{\"Content-Type\":\"application/json\"}";

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private int statusCode;
    private String headers;
    private final String body;
    private Integer delayMs;

    public CreateMockResponse(int statusCode, String body) {
        this.statusCode = statusCode;
        this.body = body == null ? "" : body;
    }

    public static CreateMockResponse ok(String body) {
        return new CreateMockResponse(200, body);
    }

    public static CreateMockResponse created(String body) {
        return new CreateMockResponse(201, body);
    }

    public static CreateMockResponse noContent() {
        return new CreateMockResponse(204, "");
    }

    public static CreateMockResponse badRequest(String body) {
        return new CreateMockResponse(400, body);
    }

    public static CreateMockResponse unauthorized(String body) {
        return new CreateMockResponse(401, body);
    }

    public static CreateMockResponse notFound(String body) {
        return new CreateMockResponse(404, body);
    }

    public static CreateMockResponse internalError(String body) {
        return new CreateMockResponse(500, body);
    }

    public static CreateMockResponse rateLimited() {
        return new CreateMockResponse(429, "{\"error\": \"rate_limited\", \"message\": \"Too many requests\"}");
    }

    /**
     * A 200 response whose body is {@code data} serialized with Jackson.
     *
     * @throws BackendException of kind CONFIGURATION if {@code data} cannot be serialized
     */
    public static CreateMockResponse json(Object data) throws BackendException {
        try {
            return ok(objectMapper.writeValueAsString(data)).withHeaders(JSON_CONTENT_TYPE);
        } catch (JsonProcessingException e) {
            throw BackendException.configuration("Failed to serialize response body: " + e.getOriginalMessage(), e);
        }
    }

    public CreateMockResponse withStatus(int newStatusCode) {
        this.statusCode = newStatusCode;
        return this;
    }

    /**
     * @param json JSON object of header names to values
     */
    public CreateMockResponse withHeaders(String json) {
        this.headers = json;
        return this;
    }

    /**
     * @throws BackendException of kind CONFIGURATION if the map cannot be serialized
     */
    public CreateMockResponse withHeaders(Map<String, String> headerMap) throws BackendException {
        try {
            this.headers = objectMapper.writeValueAsString(headerMap);
        } catch (JsonProcessingException e) {
            throw BackendException.configuration("Failed to serialize response headers: " + e.getOriginalMessage(), e);
        }
        return this;
    }

    public CreateMockResponse withDelay(int newDelayMs) {
        this.delayMs = newDelayMs;
        return this;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getHeaders() {
        return headers;
    }

    public String getBody() {
        return body;
    }

    public Integer getDelayMs() {
        return delayMs;
    }
}
