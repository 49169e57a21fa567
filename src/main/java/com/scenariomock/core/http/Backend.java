package com.scenariomock.core.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scenariomock.core.error.BackendException;

import java.util.Map;

/**
 * The transport seam provider clients program against. A real implementation talks HTTP; the
 * {@link com.scenariomock.MockBackend} answers from scripted scenarios.
 */
public interface Backend {

    /**
     * Executes a single call.
     *
     * @param request the outbound call
     * @return the response for the call
     * @throws BackendException if the call cannot be answered
     */
    HttpResponse execute(HttpRequest request) throws BackendException;

    default HttpResponse get(String url) throws BackendException {
        return execute(HttpRequest.get(url));
    }

    default HttpResponse getWithHeaders(String url, Map<String, String> headers) throws BackendException {
        return execute(new HttpRequest(HttpMethod.GET, url, headers, null));
    }

    default HttpResponse post(String url, String body) throws BackendException {
        return execute(HttpRequest.post(url, body));
    }

    default HttpResponse postWithHeaders(String url, String body, Map<String, String> headers)
            throws BackendException {
        return execute(new HttpRequest(HttpMethod.POST, url, headers, body));
    }

    /**
     * Serializes {@code payload} with Jackson and posts it.
     */
    default HttpResponse postJson(String url, Object payload) throws BackendException {
        return post(url, BackendJson.write(payload));
    }

    default HttpResponse put(String url, String body) throws BackendException {
        return execute(HttpRequest.put(url, body));
    }

    default HttpResponse delete(String url) throws BackendException {
        return execute(HttpRequest.delete(url));
    }

    default HttpResponse deleteWithHeaders(String url, Map<String, String> headers) throws BackendException {
        return execute(new HttpRequest(HttpMethod.DELETE, url, headers, null));
    }

    /**
     * Shared mapper for the default helpers.
     */
    final class BackendJson {

        private static final ObjectMapper objectMapper = new ObjectMapper();

        private BackendJson() {
            // utility class
        }

        static String write(Object payload) throws BackendException {
            try {
                return objectMapper.writeValueAsString(payload);
            } catch (JsonProcessingException e) {
                throw BackendException.configuration("Failed to serialize request body: " + e.getMessage(), e);
            }
        }
    }
}
