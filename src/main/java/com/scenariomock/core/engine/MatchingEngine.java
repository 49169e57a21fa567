package com.scenariomock.core.engine;

import com.scenariomock.core.error.BackendException;
import com.scenariomock.core.http.HttpRequest;
import com.scenariomock.core.matching.RequestMatcher;
import com.scenariomock.core.model.MockMapping;
import com.scenariomock.core.model.MockRequest;
import com.scenariomock.core.model.MockResponse;
import com.scenariomock.core.model.Scenario;
import com.scenariomock.core.registry.Activation;
import com.scenariomock.core.registry.ScenarioRegistry;
import com.scenariomock.core.storage.RecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Finds the mock of the active scenario that answers a request.
 *
 * <p>Candidates are tried in ascending sequence order and the first one whose path, body and
 * headers all match wins. Matching does not consume a mock; the same mock answers every
 * identical call.
 */
public class MatchingEngine {

    private static final Logger logger = LoggerFactory.getLogger(MatchingEngine.class);

    private final RecordStore store;
    private final ScenarioRegistry registry;

    public MatchingEngine(RecordStore store, ScenarioRegistry registry) {
        this.store = store;
        this.registry = registry;
    }

    /**
     * @return the matching request/response pair with the activation generation it was found
     *         under, or empty if no scenario is active or nothing matches
     * @throws BackendException CONFIGURATION if a stored pattern is invalid, STORAGE on store
     *         failures
     */
    public Optional<Match> findMatch(HttpRequest request) throws BackendException {
        Activation activation = registry.activation();
        Optional<String> active = activation.activeScenario();
        if (active.isEmpty()) {
            logger.debug("No active scenario for {} {}", request.getMethod(), request.getUrl());
            return Optional.empty();
        }
        Optional<Scenario> scenario = store.findScenarioByName(active.get());
        if (scenario.isEmpty()) {
            logger.debug("Active scenario {} is no longer stored", active.get());
            return Optional.empty();
        }

        List<MockRequest> candidates = store.findRequests(scenario.get().getId(), request.getMethod());
        for (MockRequest candidate : candidates) {
            if (!RequestMatcher.matches(candidate, request)) {
                continue;
            }
            Optional<MockResponse> response = store.findResponse(candidate.getId());
            if (response.isEmpty()) {
                logger.warn("Mock {} matched but has no response, skipping", candidate.getId());
                continue;
            }
            logger.debug("{} {} matched mock {} ({})", request.getMethod(), request.getUrl(),
                    candidate.getId(), candidate.getPathPattern());
            MockMapping mapping = new MockMapping(candidate, response.get());
            return Optional.of(new Match(mapping, activation.generation()));
        }
        logger.debug("{} {} matched none of {} candidate(s) in {}", request.getMethod(), request.getUrl(),
                candidates.size(), active.get());
        return Optional.empty();
    }
}
