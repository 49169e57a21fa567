package com.scenariomock.core.storage;

import com.scenariomock.core.error.BackendException;
import com.scenariomock.core.http.HttpMethod;
import com.scenariomock.core.model.CreateMockRequest;
import com.scenariomock.core.model.CreateMockResponse;
import com.scenariomock.core.model.CreateScenario;
import com.scenariomock.core.model.MockMapping;
import com.scenariomock.core.model.MockRequest;
import com.scenariomock.core.model.MockResponse;
import com.scenariomock.core.model.Scenario;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for scenarios, mocked requests and their responses.
 *
 * <p>Implementations must be safe for concurrent reads. Writes may serialize. Request lists are
 * always ordered by ascending sequence order, ties by ascending id (insertion order).
 */
public interface RecordStore {

    /**
     * @throws BackendException CONFIGURATION if the name is taken
     */
    Scenario createScenario(CreateScenario scenario) throws BackendException;

    Optional<Scenario> findScenario(long id) throws BackendException;

    Optional<Scenario> findScenarioByName(String name) throws BackendException;

    /**
     * @return all scenarios ordered by name
     */
    List<Scenario> listScenarios() throws BackendException;

    /**
     * Deletes a scenario with its requests and responses in one step.
     *
     * @throws BackendException CONFIGURATION if no scenario has that name
     */
    void deleteScenario(String name) throws BackendException;

    /**
     * Sets the informational active flag on {@code name} and clears it on every other scenario.
     *
     * @param name scenario to flag, or null to clear all flags
     */
    void markActive(String name) throws BackendException;

    /**
     * Stores a request/response pair under the named scenario.
     *
     * @throws BackendException CONFIGURATION if the scenario is unknown or a pattern is invalid
     */
    MockMapping addMock(String scenarioName, CreateMockRequest request, CreateMockResponse response)
            throws BackendException;

    /**
     * @return the scenario's requests for {@code method}, in matching order
     */
    List<MockRequest> findRequests(long scenarioId, HttpMethod method) throws BackendException;

    /**
     * @return all of the scenario's requests, in matching order
     */
    List<MockRequest> listRequests(long scenarioId) throws BackendException;

    Optional<MockResponse> findResponse(long requestId) throws BackendException;

    /**
     * Removes a request and its response.
     *
     * @return false if no request had that id
     */
    boolean deleteMock(long requestId) throws BackendException;

    /**
     * Adds one to the lifetime match count of a request. Runs on every matched call, so durable
     * stores may defer persisting the count until the next write or {@link #flush()}.
     */
    void incrementTimesMatched(long requestId) throws BackendException;

    /**
     * Persists pending match counts. A no-op for stores without durable state.
     *
     * @throws BackendException STORAGE if the counts cannot be written
     */
    void flush() throws BackendException;

    /**
     * Removes every scenario, request and response.
     */
    void reset() throws BackendException;
}
