package com.scenariomock.core.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.scenariomock.core.error.BackendException;
import com.scenariomock.core.http.HttpMethod;
import com.scenariomock.core.matching.JsonBodyParser;
import com.scenariomock.core.matching.RequestMatcher;
import com.scenariomock.core.model.CreateMockRequest;
import com.scenariomock.core.model.CreateMockResponse;
import com.scenariomock.core.model.CreateScenario;
import com.scenariomock.core.model.MockMapping;
import com.scenariomock.core.model.MockRequest;
import com.scenariomock.core.model.MockResponse;
import com.scenariomock.core.model.Scenario;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Record store held in memory. Reads share a read lock; every write, including the cascading
 * scenario delete, runs under the write lock as one step.
 *
 * <p>Subclasses persist the tables by overriding {@link #afterWrite(StoreSnapshot)}. If that hook
 * fails the tables are rolled back to their state before the write. Match count increments do not
 * call the hook; they are persisted with the next write or on {@link #flush()}.
 */
public class InMemoryRecordStore implements RecordStore {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryRecordStore.class);

    private static final Comparator<MockRequest> MATCHING_ORDER = Comparator
            .comparingInt(MockRequest::getSequenceOrder)
            .thenComparingLong(MockRequest::getId);

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private final Map<Long, Scenario> scenarios = new LinkedHashMap<>();
    private final Map<Long, MockRequest> requests = new LinkedHashMap<>();
    private final Map<Long, MockResponse> responsesByRequest = new LinkedHashMap<>();
    private long nextScenarioId = 1;
    private long nextRequestId = 1;
    private long nextResponseId = 1;
    private boolean countsPending;

    @Override
    public Scenario createScenario(CreateScenario create) throws BackendException {
        return write(() -> {
            if (findByName(create.getName()) != null) {
                throw BackendException.configuration("Scenario already exists: " + create.getName());
            }
            Instant now = Instant.now();
            Scenario scenario = new Scenario(nextScenarioId++, create.getName(), create.getProvider(),
                    create.getDescription(), false, now, now);
            scenarios.put(scenario.getId(), scenario);
            logger.debug("Created scenario {} ({})", scenario.getName(), scenario.getProvider());
            return scenario;
        });
    }

    @Override
    public Optional<Scenario> findScenario(long id) {
        return read(() -> Optional.ofNullable(scenarios.get(id)));
    }

    @Override
    public Optional<Scenario> findScenarioByName(String name) {
        return read(() -> Optional.ofNullable(findByName(name)));
    }

    @Override
    public List<Scenario> listScenarios() {
        return read(() -> {
            List<Scenario> result = new ArrayList<>(scenarios.values());
            result.sort(Comparator.comparing(Scenario::getName));
            return result;
        });
    }

    @Override
    public void deleteScenario(String name) throws BackendException {
        write(() -> {
            Scenario scenario = requireScenario(name);
            List<Long> requestIds = new ArrayList<>();
            for (MockRequest request : requests.values()) {
                if (request.getScenarioId() == scenario.getId()) {
                    requestIds.add(request.getId());
                }
            }
            for (Long requestId : requestIds) {
                responsesByRequest.remove(requestId);
                requests.remove(requestId);
            }
            scenarios.remove(scenario.getId());
            logger.debug("Deleted scenario {} with {} mock(s)", name, requestIds.size());
            return null;
        });
    }

    @Override
    public void markActive(String name) throws BackendException {
        write(() -> {
            Instant now = Instant.now();
            for (Scenario scenario : new ArrayList<>(scenarios.values())) {
                boolean active = scenario.getName().equals(name);
                if (scenario.isActive() != active) {
                    scenarios.put(scenario.getId(), scenario.withActive(active, now));
                }
            }
            return null;
        });
    }

    @Override
    public MockMapping addMock(String scenarioName, CreateMockRequest create, CreateMockResponse createResponse)
            throws BackendException {
        RequestMatcher.validate(create);
        validateResponse(createResponse);
        return write(() -> {
            Scenario scenario = requireScenario(scenarioName);
            int sequenceOrder = create.getSequenceOrder() != null
                    ? create.getSequenceOrder()
                    : maxSequenceOrder(scenario.getId()) + 1;
            Instant now = Instant.now();

            MockRequest request = new MockRequest(nextRequestId++, scenario.getId(), create.getMethod(),
                    create.getPathPattern(), create.getBodyPattern(), create.getHeadersPattern(),
                    sequenceOrder, 0, now);
            MockResponse response = new MockResponse(nextResponseId++, request.getId(),
                    createResponse.getStatusCode(), createResponse.getHeaders(), createResponse.getBody(),
                    createResponse.getDelayMs(), now);
            requests.put(request.getId(), request);
            responsesByRequest.put(request.getId(), response);

            logger.debug("Added mock {} {} (seq {}) to scenario {}", request.getMethod(),
                    request.getPathPattern(), sequenceOrder, scenarioName);
            return new MockMapping(request, response);
        });
    }

    @Override
    public List<MockRequest> findRequests(long scenarioId, HttpMethod method) {
        return read(() -> {
            List<MockRequest> result = new ArrayList<>();
            for (MockRequest request : requests.values()) {
                if (request.getScenarioId() == scenarioId && request.getMethod() == method) {
                    result.add(request);
                }
            }
            result.sort(MATCHING_ORDER);
            return result;
        });
    }

    @Override
    public List<MockRequest> listRequests(long scenarioId) {
        return read(() -> {
            List<MockRequest> result = new ArrayList<>();
            for (MockRequest request : requests.values()) {
                if (request.getScenarioId() == scenarioId) {
                    result.add(request);
                }
            }
            result.sort(MATCHING_ORDER);
            return result;
        });
    }

    @Override
    public Optional<MockResponse> findResponse(long requestId) {
        return read(() -> Optional.ofNullable(responsesByRequest.get(requestId)));
    }

    @Override
    public boolean deleteMock(long requestId) throws BackendException {
        return write(() -> {
            MockRequest removed = requests.remove(requestId);
            responsesByRequest.remove(requestId);
            return removed != null;
        });
    }

    @Override
    public void incrementTimesMatched(long requestId) throws BackendException {
        lock.writeLock().lock();
        try {
            MockRequest request = requests.get(requestId);
            if (request != null) {
                requests.put(requestId, request.withTimesMatched(request.getTimesMatched() + 1));
                countsPending = true;
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void flush() throws BackendException {
        lock.writeLock().lock();
        try {
            if (countsPending) {
                afterWrite(copyTables());
                countsPending = false;
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void reset() throws BackendException {
        write(() -> {
            responsesByRequest.clear();
            requests.clear();
            scenarios.clear();
            logger.debug("Record store reset");
            return null;
        });
    }

    /**
     * Called under the write lock after each successful mutation.
     *
     * @param snapshot the tables after the write
     * @throws BackendException to reject the write; the tables are rolled back
     */
    protected void afterWrite(StoreSnapshot snapshot) throws BackendException {
        // in-memory only
    }

    /**
     * Replaces all tables. Used when loading persisted content.
     */
    protected void restore(StoreSnapshot snapshot) {
        lock.writeLock().lock();
        try {
            load(snapshot);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * @return a consistent copy of all tables
     */
    public StoreSnapshot snapshot() {
        return read(this::copyTables);
    }

    private <T> T read(Supplier<T> action) {
        lock.readLock().lock();
        try {
            return action.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    private <T> T write(Mutation<T> mutation) throws BackendException {
        lock.writeLock().lock();
        try {
            StoreSnapshot before = copyTables();
            T result;
            try {
                result = mutation.apply();
                afterWrite(copyTables());
                countsPending = false;
            } catch (BackendException e) {
                load(before);
                throw e;
            }
            return result;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private StoreSnapshot copyTables() {
        return new StoreSnapshot(new ArrayList<>(scenarios.values()), new ArrayList<>(requests.values()),
                new ArrayList<>(responsesByRequest.values()), nextScenarioId, nextRequestId, nextResponseId);
    }

    private void load(StoreSnapshot snapshot) {
        scenarios.clear();
        requests.clear();
        responsesByRequest.clear();
        for (Scenario scenario : snapshot.getScenarios()) {
            scenarios.put(scenario.getId(), scenario);
        }
        for (MockRequest request : snapshot.getRequests()) {
            requests.put(request.getId(), request);
        }
        for (MockResponse response : snapshot.getResponses()) {
            responsesByRequest.put(response.getRequestId(), response);
        }
        nextScenarioId = snapshot.getNextScenarioId();
        nextRequestId = snapshot.getNextRequestId();
        nextResponseId = snapshot.getNextResponseId();
    }

    private Scenario findByName(String name) {
        for (Scenario scenario : scenarios.values()) {
            if (scenario.getName().equals(name)) {
                return scenario;
            }
        }
        return null;
    }

    private Scenario requireScenario(String name) throws BackendException {
        Scenario scenario = findByName(name);
        if (scenario == null) {
            throw BackendException.configuration("Scenario not found: " + name);
        }
        return scenario;
    }

    private int maxSequenceOrder(long scenarioId) {
        int max = 0;
        for (MockRequest request : requests.values()) {
            if (request.getScenarioId() == scenarioId && request.getSequenceOrder() > max) {
                max = request.getSequenceOrder();
            }
        }
        return max;
    }

    private static void validateResponse(CreateMockResponse response) throws BackendException {
        if (response.getDelayMs() != null && response.getDelayMs() < 0) {
            throw BackendException.configuration("Response delay must not be negative: " + response.getDelayMs());
        }
        if (response.getHeaders() != null) {
            try {
                JsonBodyParser.parseStringMap(response.getHeaders());
            } catch (JsonProcessingException e) {
                throw BackendException.configuration(
                        "Invalid response headers '" + response.getHeaders() + "': " + e.getOriginalMessage(), e);
            }
        }
    }

    @FunctionalInterface
    private interface Mutation<T> {
        T apply() throws BackendException;
    }
}
