package com.scenariomock.core.http;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An outbound HTTP call as issued by a provider client.
 */
public final class HttpRequest {

    private final HttpMethod method;
    private final String url;
    private final Map<String, String> headers;
    private final String body;

    public HttpRequest(HttpMethod method, String url, Map<String, String> headers, String body) {
        this.method = Objects.requireNonNull(method, "method");
        this.url = Objects.requireNonNull(url, "url");
        this.headers = headers == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        this.body = body;
    }

    public static HttpRequest get(String url) {
        return new HttpRequest(HttpMethod.GET, url, null, null);
    }

    public static HttpRequest post(String url, String body) {
        return new HttpRequest(HttpMethod.POST, url, null, body);
    }

    public static HttpRequest put(String url, String body) {
        return new HttpRequest(HttpMethod.PUT, url, null, body);
    }

    public static HttpRequest patch(String url, String body) {
        return new HttpRequest(HttpMethod.PATCH, url, null, body);
    }

    public static HttpRequest delete(String url) {
        return new HttpRequest(HttpMethod.DELETE, url, null, null);
    }

    /**
     * Returns a copy of this request with one more header.
     */
    public HttpRequest withHeader(String name, String value) {
        Map<String, String> copy = new LinkedHashMap<>(headers);
        copy.put(name, value);
        return new HttpRequest(method, url, copy, body);
    }

    /**
     * Returns a copy of this request with the given body.
     */
    public HttpRequest withBody(String newBody) {
        return new HttpRequest(method, url, headers, newBody);
    }

    public HttpMethod getMethod() {
        return method;
    }

    public String getUrl() {
        return url;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    /**
     * @return the request body, or {@code null} when the call has none
     */
    public String getBody() {
        return body;
    }

    @Override
    public String toString() {
        return "HttpRequest{" +
                "method=" + method +
                ", url='" + url + '\'' +
                ", headers=" + headers.keySet() +
                ", bodyLength=" + (body != null ? body.length() : 0) +
                '}';
    }
}
