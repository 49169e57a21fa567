package com.scenariomock.core.http;

import java.util.Locale;

/**
 * HTTP verbs understood by the mock backend. Stored and matched by exact name.
 */
public enum HttpMethod {
    GET,
    POST,
    PUT,
    PATCH,
    DELETE;

    /**
     * Parses a verb case-insensitively.
     *
     * @param value verb such as {@code "get"} or {@code "POST"}
     * @return the matching method
     * @throws IllegalArgumentException if the verb is not supported
     */
    public static HttpMethod parse(String value) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException("HTTP method must not be empty");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported HTTP method: " + value, e);
        }
    }
}
