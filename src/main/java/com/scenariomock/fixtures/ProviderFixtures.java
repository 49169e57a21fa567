package com.scenariomock.fixtures;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scenariomock.MockBackend;
import com.scenariomock.core.error.BackendException;
import com.scenariomock.core.http.HttpMethod;
import com.scenariomock.core.model.CreateMockRequest;
import com.scenariomock.core.model.CreateMockResponse;
import com.scenariomock.core.model.CreateScenario;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Ready-made scenarios with sandbox-style responses for the supported banking providers.
 *
 * <p>Fixtures live on the classpath under {@code /fixtures/<provider>.json}:
 * <pre>{@code
 * {"provider": "plaid",
 *  "variants": {"happy_path": [{"method": "POST", "path": "/accounts/get", "status": 200, "body": {...}}]}}
 * }</pre>
 * Scenarios created here are named {@code <provider>_<variant>}, e.g. {@code plaid_happy_path}.
 */
public final class ProviderFixtures {

    private static final Logger logger = LoggerFactory.getLogger(ProviderFixtures.class);

    public static final String HAPPY_PATH = "happy_path";
    public static final String ERROR = "error";
    public static final String RATE_LIMITED = "rate_limited";

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private ProviderFixtures() {
        // utility class
    }

    public static String scenarioName(Provider provider, String variant) {
        return provider.id() + "_" + variant;
    }

    /**
     * A fresh in-memory backend with {@code <provider>_happy_path} created and active.
     */
    public static MockBackend happyPath(Provider provider) throws BackendException {
        return variant(provider, HAPPY_PATH);
    }

    /**
     * Plaid scenario in which {@code /accounts/get} fails with {@code ITEM_LOGIN_REQUIRED}.
     */
    public static MockBackend errorScenario() throws BackendException {
        return variant(Provider.PLAID, ERROR);
    }

    /**
     * Plaid scenario in which {@code /accounts/get} answers 429.
     */
    public static MockBackend rateLimitedScenario() throws BackendException {
        return variant(Provider.PLAID, RATE_LIMITED);
    }

    /**
     * A backend holding the happy path of every provider. None of them is active.
     */
    public static MockBackend allProvidersHappyPath() throws BackendException {
        MockBackend backend = MockBackend.inMemory();
        for (Provider provider : Provider.values()) {
            createVariant(backend, provider, HAPPY_PATH);
        }
        return backend;
    }

    /**
     * Creates {@code <provider>_<variant>} on a new backend and activates it.
     */
    public static MockBackend variant(Provider provider, String variant) throws BackendException {
        MockBackend backend = MockBackend.inMemory();
        String scenario = createVariant(backend, provider, variant);
        backend.activateScenario(scenario);
        return backend;
    }

    /**
     * Creates the scenario {@code <provider>_<variant>} on {@code backend} and fills it.
     *
     * @return the scenario name
     */
    public static String createVariant(MockBackend backend, Provider provider, String variant)
            throws BackendException {
        String scenario = scenarioName(provider, variant);
        backend.createScenario(new CreateScenario(scenario, provider.id())
                .withDescription(provider.id() + " " + variant.replace('_', ' ')));
        addFixtures(backend, scenario, provider, variant);
        return scenario;
    }

    /**
     * Adds the mocks of a fixture variant to an existing scenario.
     *
     * @throws BackendException CONFIGURATION if the scenario or the variant does not exist,
     *                          STORAGE if the fixture resource cannot be read
     */
    public static void addFixtures(MockBackend backend, String scenarioName, Provider provider, String variant)
            throws BackendException {
        JsonNode entries = loadVariants(provider).get(variant);
        if (entries == null || !entries.isArray()) {
            throw BackendException.configuration("No fixture variant '" + variant + "' for provider " + provider.id());
        }
        for (JsonNode entry : entries) {
            backend.addMock(scenarioName, toRequest(entry), toResponse(entry));
        }
        logger.debug("Added {} {} fixture(s) to scenario {}", entries.size(), provider.id(), scenarioName);
    }

    /**
     * @return the variant names bundled for {@code provider}
     */
    public static List<String> variants(Provider provider) throws BackendException {
        List<String> names = new ArrayList<>();
        Iterator<String> it = loadVariants(provider).fieldNames();
        while (it.hasNext()) {
            names.add(it.next());
        }
        return names;
    }

    private static JsonNode loadVariants(Provider provider) throws BackendException {
        String resource = "/fixtures/" + provider.id() + ".json";
        try (InputStream in = ProviderFixtures.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw BackendException.configuration("Fixture resource not found: " + resource);
            }
            JsonNode variants = objectMapper.readTree(in).path("variants");
            if (!variants.isObject()) {
                throw BackendException.configuration("Fixture resource has no variants: " + resource);
            }
            return variants;
        } catch (IOException e) {
            throw BackendException.storage("Failed to read fixture resource " + resource, e);
        }
    }

    private static CreateMockRequest toRequest(JsonNode entry) throws BackendException {
        String method = entry.path("method").asText(null);
        String path = entry.path("path").asText(null);
        if (method == null || path == null) {
            throw BackendException.configuration("Fixture entry needs method and path: " + entry);
        }
        CreateMockRequest request;
        try {
            request = new CreateMockRequest(HttpMethod.parse(method), path);
        } catch (IllegalArgumentException e) {
            throw BackendException.configuration("Invalid fixture entry " + entry + ": " + e.getMessage(), e);
        }
        if (entry.hasNonNull("bodyPattern")) {
            request.withBodyPattern(entry.get("bodyPattern").asText());
        }
        return request;
    }

    private static CreateMockResponse toResponse(JsonNode entry) throws BackendException {
        int status = entry.path("status").asInt(200);
        JsonNode body = entry.get("body");
        if (body == null || body.isNull()) {
            return new CreateMockResponse(status, "");
        }
        try {
            return new CreateMockResponse(status, objectMapper.writeValueAsString(body))
                    .withHeaders(CreateMockResponse.JSON_CONTENT_TYPE);
        } catch (JsonProcessingException e) {
            throw BackendException.configuration("Failed to serialize fixture body: " + e.getOriginalMessage(), e);
        }
    }
}
