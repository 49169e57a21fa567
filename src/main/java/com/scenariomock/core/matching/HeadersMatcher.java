package com.scenariomock.core.matching;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.scenariomock.core.error.BackendException;

import java.util.Map;

/**
 * Matches request headers against a JSON header pattern such as
 * {@code {"Authorization":"*","Plaid-Version":"2020-09-14"}}.
 *
 * <p>Every header named in the pattern must be present. Its value must be equal unless the
 * pattern value is {@code "*"}. Header names are compared case-insensitively; headers not named
 * in the pattern are ignored.
 */
public final class HeadersMatcher {

    private static final String ANY = "*";

    private HeadersMatcher() {
        // utility class
    }

    /**
     * @param headersPattern JSON object pattern, or null when headers are unconstrained
     * @param headers        actual request headers
     * @throws BackendException of kind CONFIGURATION if the pattern is not a JSON string map
     */
    public static boolean matches(String headersPattern, Map<String, String> headers) throws BackendException {
        if (headersPattern == null) {
            return true;
        }
        Map<String, String> expected = parsePattern(headersPattern);
        for (Map.Entry<String, String> entry : expected.entrySet()) {
            String actual = findHeader(headers, entry.getKey());
            if (actual == null) {
                return false;
            }
            if (!ANY.equals(entry.getValue()) && !actual.equals(entry.getValue())) {
                return false;
            }
        }
        return true;
    }

    /**
     * Parses a header pattern.
     *
     * @throws BackendException of kind CONFIGURATION if the pattern is not a JSON string map
     */
    public static Map<String, String> parsePattern(String headersPattern) throws BackendException {
        try {
            return JsonBodyParser.parseStringMap(headersPattern);
        } catch (JsonProcessingException e) {
            throw BackendException.configuration(
                    "Invalid headers pattern '" + headersPattern + "': " + e.getOriginalMessage(), e);
        }
    }

    private static String findHeader(Map<String, String> headers, String name) {
        if (headers == null) {
            return null;
        }
        String exact = headers.get(name);
        if (exact != null) {
            return exact;
        }
        for (Map.Entry<String, String> entry : headers.entrySet()) {
            if (entry.getKey() != null && entry.getKey().equalsIgnoreCase(name)) {
                return entry.getValue();
            }
        }
        return null;
    }
}
