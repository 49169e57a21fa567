package com.scenariomock.core.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scenariomock.core.error.BackendException;
import com.scenariomock.core.error.ErrorKind;
import com.scenariomock.core.http.HttpMethod;
import com.scenariomock.core.model.CreateMockRequest;
import com.scenariomock.core.model.CreateMockResponse;
import com.scenariomock.core.model.MockMapping;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Registers recorded WireMock stub mappings as mocks of a scenario.
 *
 * <p>Reads every {@code *.json} file of {@code <dir>/mappings} (or of {@code dir} itself when it
 * has no {@code mappings} subdirectory) in file name order. A file holds one mapping or a
 * {@code {"mappings": [...]}} list. Response bodies referenced by {@code bodyFileName} are read
 * from {@code <dir>/__files}.
 *
 * <p>Only the matchers with an equivalent here are translated: URL equality and patterns, the
 * first body pattern ({@code equalToJson}, {@code equalTo}, {@code contains}, {@code matches}) and
 * header presence or equality. Mappings for {@code ANY} method are skipped.
 */
public final class WireMockMappingImporter {

    private static final Logger logger = LoggerFactory.getLogger(WireMockMappingImporter.class);

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private static final String ANY_PATH = "{*}";

    private WireMockMappingImporter() {
        // utility class
    }

    /**
     * @param store        store receiving the mocks
     * @param scenarioName existing scenario to add the mocks to
     * @param dir          WireMock root or mappings directory
     * @return the created mocks in import order
     * @throws BackendException STORAGE if the directory or a file cannot be read, CONFIGURATION if a
     *                          translated pattern is rejected or the scenario does not exist
     */
    public static List<MockMapping> importMappings(RecordStore store, String scenarioName, Path dir)
            throws BackendException {
        if (!Files.isDirectory(dir)) {
            throw new BackendException(ErrorKind.STORAGE, "Mapping directory not found: " + dir);
        }
        Path mappingsDir = Files.isDirectory(dir.resolve("mappings")) ? dir.resolve("mappings") : dir;
        Path filesDir = dir.resolve("__files");

        List<MockMapping> created = new ArrayList<>();
        for (Path file : listMappingFiles(mappingsDir)) {
            JsonNode root = readTree(file);
            JsonNode mappings = root.has("mappings") ? root.get("mappings") : root;
            if (mappings.isArray()) {
                for (JsonNode mapping : mappings) {
                    importMapping(store, scenarioName, mapping, filesDir, file, created);
                }
            } else {
                importMapping(store, scenarioName, mappings, filesDir, file, created);
            }
        }
        logger.info("Imported {} WireMock mapping(s) from {} into scenario {}", created.size(), mappingsDir,
                scenarioName);
        return created;
    }

    private static void importMapping(RecordStore store, String scenarioName, JsonNode mapping, Path filesDir,
                                      Path file, List<MockMapping> created) throws BackendException {
        JsonNode request = mapping.path("request");
        String method = request.path("method").asText("ANY");
        HttpMethod httpMethod;
        try {
            httpMethod = HttpMethod.parse(method);
        } catch (IllegalArgumentException e) {
            logger.warn("Skipping mapping with method {} in {}", method, file.getFileName());
            return;
        }

        CreateMockRequest mockRequest = new CreateMockRequest(httpMethod, toPathPattern(request));
        String bodyPattern = toBodyPattern(request.path("bodyPatterns"), file);
        if (bodyPattern != null) {
            mockRequest.withBodyPattern(bodyPattern);
        }
        Map<String, String> headers = toHeaderPattern(request.path("headers"));
        if (!headers.isEmpty()) {
            mockRequest.withHeaders(headers);
        }
        if (mapping.has("priority")) {
            mockRequest.withSequence(mapping.get("priority").asInt());
        }

        created.add(store.addMock(scenarioName, mockRequest, toResponse(mapping.path("response"), filesDir)));
    }

    static String toPathPattern(JsonNode request) {
        if (request.hasNonNull("url")) {
            return quote(stripQuery(request.get("url").asText()));
        }
        if (request.hasNonNull("urlPath")) {
            return quote(request.get("urlPath").asText());
        }
        if (request.hasNonNull("urlPattern")) {
            return request.get("urlPattern").asText();
        }
        if (request.hasNonNull("urlPathPattern")) {
            return request.get("urlPathPattern").asText();
        }
        return ANY_PATH;
    }

    private static String toBodyPattern(JsonNode bodyPatterns, Path file) throws BackendException {
        if (!bodyPatterns.isArray() || bodyPatterns.isEmpty()) {
            return null;
        }
        if (bodyPatterns.size() > 1) {
            logger.debug("Only the first of {} body patterns is used ({})", bodyPatterns.size(), file.getFileName());
        }
        JsonNode pattern = bodyPatterns.get(0);
        if (pattern.has("equalToJson")) {
            JsonNode expected = pattern.get("equalToJson");
            return expected.isTextual() ? expected.asText() : write(expected);
        }
        if (pattern.has("equalTo")) {
            return quote(pattern.get("equalTo").asText());
        }
        if (pattern.has("contains")) {
            return quote(pattern.get("contains").asText());
        }
        if (pattern.has("matches")) {
            return pattern.get("matches").asText();
        }
        logger.warn("Unsupported body pattern {} in {}, body is not constrained", pattern.fieldNames().next(),
                file.getFileName());
        return null;
    }

    private static Map<String, String> toHeaderPattern(JsonNode headers) {
        Map<String, String> result = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = headers.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode equalTo = field.getValue().get("equalTo");
            result.put(field.getKey(), equalTo != null && equalTo.isTextual() ? equalTo.asText() : "*");
        }
        return result;
    }

    private static CreateMockResponse toResponse(JsonNode response, Path filesDir) throws BackendException {
        String body;
        if (response.hasNonNull("body")) {
            body = response.get("body").asText();
        } else if (response.hasNonNull("jsonBody")) {
            body = write(response.get("jsonBody"));
        } else if (response.hasNonNull("bodyFileName")) {
            body = readBodyFile(filesDir.resolve(response.get("bodyFileName").asText()));
        } else {
            body = "";
        }

        CreateMockResponse mockResponse = new CreateMockResponse(response.path("status").asInt(200), body);
        Map<String, String> headers = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = response.path("headers").fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            headers.put(field.getKey(), headerValue(field.getValue()));
        }
        if (!headers.isEmpty()) {
            mockResponse.withHeaders(headers);
        }
        if (response.has("fixedDelayMilliseconds")) {
            mockResponse.withDelay(response.get("fixedDelayMilliseconds").asInt());
        }
        return mockResponse;
    }

    private static String headerValue(JsonNode value) {
        if (!value.isArray()) {
            return value.asText();
        }
        List<String> values = new ArrayList<>();
        value.forEach(v -> values.add(v.asText()));
        return String.join(",", values);
    }

    private static List<Path> listMappingFiles(Path mappingsDir) throws BackendException {
        try (Stream<Path> files = Files.list(mappingsDir)) {
            return files
                    .filter(p -> Files.isRegularFile(p) && p.getFileName().toString().toLowerCase().endsWith(".json"))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw BackendException.storage("Failed to list mapping files in " + mappingsDir, e);
        }
    }

    private static JsonNode readTree(Path file) throws BackendException {
        try {
            return objectMapper.readTree(file.toFile());
        } catch (IOException e) {
            throw BackendException.storage("Failed to read mapping file " + file, e);
        }
    }

    private static String readBodyFile(Path bodyFile) throws BackendException {
        try {
            return Files.readString(bodyFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw BackendException.storage("Failed to read body file " + bodyFile, e);
        }
    }

    private static String write(JsonNode node) throws BackendException {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw BackendException.configuration("Failed to serialize JSON: " + e.getOriginalMessage(), e);
        }
    }

    private static String stripQuery(String url) {
        int query = url.indexOf('?');
        return query >= 0 ? url.substring(0, query) : url;
    }

    /**
     * Escapes regex metacharacters and braces so the text matches literally as a path pattern.
     */
    static String quote(String literal) {
        StringBuilder sb = new StringBuilder(literal.length() + 8);
        for (char c : literal.toCharArray()) {
            if ("\\.[]{}()<>*+-=!?^$|".indexOf(c) >= 0) {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.toString();
    }
}
