package com.scenariomock.core.matching;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Utility class for parsing request bodies and header patterns.
 */
public final class JsonBodyParser {

    private static final Logger logger = LoggerFactory.getLogger(JsonBodyParser.class);
    private static final ObjectMapper objectMapper = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    private static final TypeReference<LinkedHashMap<String, String>> STRING_MAP =
            new TypeReference<>() {
            };

    private JsonBodyParser() {
        // utility class
    }

    /**
     * Parses a JSON string into a JsonNode.
     *
     * @param json The JSON string to parse
     * @return The parsed JsonNode, or null if the text is blank or not a single JSON value
     */
    public static JsonNode parseJson(String json) {
        if (json == null || json.trim().isEmpty()) {
            return null;
        }

        try {
            return objectMapper.readTree(json);
        } catch (Exception e) {
            logger.debug("Failed to parse JSON: {}", e.getMessage());
            return null;
        }
    }

    /**
     * Parses a JSON object of string values, as used by header patterns and response headers.
     *
     * @param json JSON object text
     * @return the parsed map, in document order
     * @throws JsonProcessingException if the text is not a JSON object of scalar values
     */
    public static Map<String, String> parseStringMap(String json) throws JsonProcessingException {
        Map<String, String> parsed = objectMapper.readValue(json, STRING_MAP);
        return parsed != null ? parsed : new LinkedHashMap<>();
    }
}
