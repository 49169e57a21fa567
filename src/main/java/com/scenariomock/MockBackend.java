package com.scenariomock;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.scenariomock.core.config.ScenarioMockConfig;
import com.scenariomock.core.engine.Match;
import com.scenariomock.core.engine.MatchingEngine;
import com.scenariomock.core.error.BackendException;
import com.scenariomock.core.http.Backend;
import com.scenariomock.core.http.HttpRequest;
import com.scenariomock.core.http.HttpResponse;
import com.scenariomock.core.matching.JsonBodyParser;
import com.scenariomock.core.model.CreateMockRequest;
import com.scenariomock.core.model.CreateMockResponse;
import com.scenariomock.core.model.CreateScenario;
import com.scenariomock.core.model.MockMapping;
import com.scenariomock.core.model.MockRequest;
import com.scenariomock.core.model.MockResponse;
import com.scenariomock.core.model.Scenario;
import com.scenariomock.core.registry.ScenarioRegistry;
import com.scenariomock.core.registry.UnmatchedRequest;
import com.scenariomock.core.storage.InMemoryRecordStore;
import com.scenariomock.core.storage.JsonFileRecordStore;
import com.scenariomock.core.storage.RecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A {@link Backend} that answers calls from scripted scenarios instead of the network.
 *
 * <p>Typical use:
 * <pre>{@code
 * MockBackend backend = MockBackend.inMemory();
 * backend.createScenario(new CreateScenario("happy-path", "plaid"));
 * backend.addMock("happy-path", CreateMockRequest.get("/accounts/{id}"),
 *         CreateMockResponse.ok("{\"balance\":100}"));
 * backend.activateScenario("happy-path");
 * HttpResponse response = backend.get("https://api.example.com/accounts/42");
 * }</pre>
 *
 * <p>Calls that match no mock of the active scenario fail with a {@code NO_MATCH}
 * {@link BackendException}; there is no fallback response. Instances are safe for concurrent use.
 */
public class MockBackend implements Backend {

    private static final Logger logger = LoggerFactory.getLogger(MockBackend.class);

    private final RecordStore store;
    private final ScenarioRegistry registry;
    private final MatchingEngine engine;
    private final boolean delaysEnabled;

    public MockBackend(RecordStore store, ScenarioRegistry registry, boolean delaysEnabled) {
        this.store = store;
        this.registry = registry;
        this.engine = new MatchingEngine(store, registry);
        this.delaysEnabled = delaysEnabled;
    }

    /**
     * Creates a backend on the store selected by {@code scenariomock.store}.
     *
     * @throws BackendException STORAGE if the file store cannot be opened
     */
    public static MockBackend create() throws BackendException {
        if (ScenarioMockConfig.isFileStore()) {
            return withStore(new JsonFileRecordStore(ScenarioMockConfig.getStoreFile()));
        }
        return inMemory();
    }

    public static MockBackend inMemory() {
        return withStore(new InMemoryRecordStore());
    }

    public static MockBackend withStore(RecordStore store) {
        return new MockBackend(store, new ScenarioRegistry(store), ScenarioMockConfig.isDelaysEnabled());
    }

    @Override
    public HttpResponse execute(HttpRequest request) throws BackendException {
        Optional<Match> match = engine.findMatch(request);
        if (match.isEmpty()) {
            registry.recordUnmatched(request);
            logger.warn("No mock found for {} {} (active scenario: {})", request.getMethod(), request.getUrl(),
                    registry.active().orElse("none"));
            throw BackendException.noMatch("No mock found for " + request.getMethod() + " " + request.getUrl());
        }

        MockRequest mock = match.get().request();
        MockResponse response = match.get().response();
        if (delaysEnabled && response.getDelayMs() != null && response.getDelayMs() > 0) {
            simulateDelay(response.getDelayMs());
        }
        store.incrementTimesMatched(mock.getId());
        registry.recordMatch(mock.getId(), match.get().generation());

        return new HttpResponse(response.getStatusCode(), parseHeaders(response), response.getBody());
    }

    public Scenario createScenario(CreateScenario scenario) throws BackendException {
        return store.createScenario(scenario);
    }

    public MockMapping addMock(String scenarioName, CreateMockRequest request, CreateMockResponse response)
            throws BackendException {
        return store.addMock(scenarioName, request, response);
    }

    public void activateScenario(String name) throws BackendException {
        registry.activate(name);
    }

    public void deactivateScenario() throws BackendException {
        registry.deactivate();
    }

    public Optional<String> activeScenario() {
        return registry.active();
    }

    public List<Scenario> listScenarios() throws BackendException {
        return store.listScenarios();
    }

    public Optional<Scenario> getScenario(String name) throws BackendException {
        return store.findScenarioByName(name);
    }

    /**
     * Deletes the scenario with all its mocks. Deleting the active scenario deactivates it.
     *
     * @throws BackendException CONFIGURATION if no scenario has that name
     */
    public void deleteScenario(String name) throws BackendException {
        if (registry.active().filter(name::equals).isPresent()) {
            registry.deactivate();
        }
        store.deleteScenario(name);
    }

    /**
     * @return the scenario's mocks in matching order
     * @throws BackendException CONFIGURATION if no scenario has that name
     */
    public List<MockMapping> listMocks(String scenarioName) throws BackendException {
        Scenario scenario = store.findScenarioByName(scenarioName)
                .orElseThrow(() -> BackendException.configuration("Scenario not found: " + scenarioName));
        List<MockMapping> mappings = new ArrayList<>();
        for (MockRequest request : store.listRequests(scenario.getId())) {
            Optional<MockResponse> response = store.findResponse(request.getId());
            response.ifPresent(r -> mappings.add(new MockMapping(request, r)));
        }
        return mappings;
    }

    /**
     * @return matches of the mock since the current scenario was activated
     */
    public int matchCount(long requestId) {
        return registry.matchCount(requestId);
    }

    public Map<Long, Integer> matchCounts() {
        return registry.matchCounts();
    }

    /**
     * @return lifetime matches of the mock as persisted in the store, 0 for an unknown id
     */
    public int timesMatched(long requestId) throws BackendException {
        for (Scenario scenario : store.listScenarios()) {
            for (MockRequest request : store.listRequests(scenario.getId())) {
                if (request.getId() == requestId) {
                    return request.getTimesMatched();
                }
            }
        }
        return 0;
    }

    public List<UnmatchedRequest> unmatchedRequests() {
        return registry.unmatchedRequests();
    }

    /**
     * Removes every scenario, mock and response and deactivates the active scenario.
     */
    public void reset() throws BackendException {
        registry.deactivate();
        store.reset();
        logger.info("Mock backend reset");
    }

    /**
     * Persists match counts the store has not written yet.
     *
     * @throws BackendException STORAGE if the store cannot be written
     */
    public void flush() throws BackendException {
        store.flush();
    }

    public RecordStore getStore() {
        return store;
    }

    private static Map<String, String> parseHeaders(MockResponse response) throws BackendException {
        if (response.getHeaders() == null || response.getHeaders().isBlank()) {
            return Map.of();
        }
        try {
            return JsonBodyParser.parseStringMap(response.getHeaders());
        } catch (JsonProcessingException e) {
            throw BackendException.configuration("Invalid headers on response " + response.getId() + ": "
                    + e.getOriginalMessage(), e);
        }
    }

    private static void simulateDelay(int delayMs) {
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.debug("Simulated delay of {} ms interrupted", delayMs);
        }
    }
}
