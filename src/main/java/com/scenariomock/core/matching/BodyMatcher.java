package com.scenariomock.core.matching;

import com.fasterxml.jackson.databind.JsonNode;
import com.scenariomock.core.error.BackendException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Matches request bodies against body patterns.
 *
 * <p>A pattern is one of:
 * <ul>
 *   <li>absent: any body, including none</li>
 *   <li>{@code "*"}: any body, including none</li>
 *   <li>JSON: a subset of the body's JSON, where the string {@code "*"} matches any value</li>
 *   <li>anything else: a regular expression searched for in the raw body</li>
 * </ul>
 */
public final class BodyMatcher {

    public static final String ANY = "*";

    private static final Logger logger = LoggerFactory.getLogger(BodyMatcher.class);

    private static final Map<String, Pattern> compiled = new ConcurrentHashMap<>();

    private BodyMatcher() {
        // utility class
    }

    /**
     * @param bodyPattern pattern, or null when the body is unconstrained
     * @param body        request body, or null when the call has none
     * @throws BackendException of kind CONFIGURATION if a non-JSON pattern is not a valid regex
     */
    public static boolean matches(String bodyPattern, String body) throws BackendException {
        if (bodyPattern == null || ANY.equals(bodyPattern)) {
            return true;
        }
        if (body == null) {
            return false;
        }

        JsonNode patternJson = JsonBodyParser.parseJson(bodyPattern);
        JsonNode bodyJson = JsonBodyParser.parseJson(body);
        if (patternJson != null && bodyJson != null) {
            return jsonMatches(patternJson, bodyJson);
        }

        if (patternJson != null) {
            // JSON pattern against a non-JSON body: only a literal regex reading can still match
            Pattern regex = tryCompile(bodyPattern);
            return regex != null && regex.matcher(body).find();
        }
        return compile(bodyPattern).matcher(body).find();
    }

    /**
     * Rejects patterns that could only fail at match time.
     *
     * @throws BackendException of kind CONFIGURATION for a non-JSON pattern that is not a regex
     */
    public static void validate(String bodyPattern) throws BackendException {
        if (bodyPattern == null || ANY.equals(bodyPattern) || JsonBodyParser.parseJson(bodyPattern) != null) {
            return;
        }
        compile(bodyPattern);
    }

    /**
     * Subset comparison: every part of {@code pattern} must be present in {@code value}.
     */
    public static boolean jsonMatches(JsonNode pattern, JsonNode value) {
        if (pattern.isTextual() && ANY.equals(pattern.textValue())) {
            return true;
        }
        if (pattern.isObject()) {
            if (!value.isObject()) {
                return false;
            }
            Iterator<Map.Entry<String, JsonNode>> fields = pattern.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                JsonNode actual = value.get(field.getKey());
                if (actual == null || !jsonMatches(field.getValue(), actual)) {
                    return false;
                }
            }
            return true;
        }
        if (pattern.isArray()) {
            if (!value.isArray() || pattern.size() != value.size()) {
                return false;
            }
            for (int i = 0; i < pattern.size(); i++) {
                if (!jsonMatches(pattern.get(i), value.get(i))) {
                    return false;
                }
            }
            return true;
        }
        if (pattern.isNumber() && value.isNumber()) {
            return pattern.decimalValue().compareTo(value.decimalValue()) == 0;
        }
        return pattern.equals(value);
    }

    private static Pattern compile(String bodyPattern) throws BackendException {
        Pattern cached = compiled.get(bodyPattern);
        if (cached != null) {
            return cached;
        }
        try {
            Pattern pattern = Pattern.compile(bodyPattern);
            compiled.putIfAbsent(bodyPattern, pattern);
            return pattern;
        } catch (PatternSyntaxException e) {
            throw BackendException.configuration(
                    "Invalid body pattern '" + bodyPattern + "': " + e.getDescription(), e);
        }
    }

    private static Pattern tryCompile(String bodyPattern) {
        try {
            return compile(bodyPattern);
        } catch (BackendException e) {
            logger.debug("JSON body pattern is not usable as a regex: {}", e.getMessage());
            return null;
        }
    }
}
