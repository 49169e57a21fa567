package com.scenariomock.core.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A response handed back to a provider client.
 */
public final class HttpResponse {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private final int status;
    private final Map<String, String> headers;
    private final String body;

    public HttpResponse(int status, Map<String, String> headers, String body) {
        this.status = status;
        this.headers = headers == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        this.body = body == null ? "" : body;
    }

    public static HttpResponse ok(String body) {
        return new HttpResponse(200, null, body);
    }

    public static HttpResponse created(String body) {
        return new HttpResponse(201, null, body);
    }

    public static HttpResponse noContent() {
        return new HttpResponse(204, null, "");
    }

    public static HttpResponse error(int status, String body) {
        return new HttpResponse(status, null, body);
    }

    public int getStatus() {
        return status;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    public String getBody() {
        return body;
    }

    public boolean isSuccess() {
        return status >= 200 && status < 300;
    }

    /**
     * Binds the body to the given type.
     *
     * @throws JsonProcessingException if the body is not JSON or does not fit {@code type}
     */
    public <T> T json(Class<T> type) throws JsonProcessingException {
        return objectMapper.readValue(body, type);
    }

    /**
     * Parses the body as a JSON tree.
     *
     * @throws JsonProcessingException if the body is not JSON
     */
    public JsonNode jsonTree() throws JsonProcessingException {
        return objectMapper.readTree(body);
    }

    @Override
    public String toString() {
        return "HttpResponse{" +
                "status=" + status +
                ", headers=" + headers +
                ", bodyLength=" + body.length() +
                '}';
    }
}
