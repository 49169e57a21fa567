package com.scenariomock.core.registry;

import com.scenariomock.core.config.ScenarioMockConfig;
import com.scenariomock.core.error.BackendException;
import com.scenariomock.core.http.HttpRequest;
import com.scenariomock.core.storage.RecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Execution state of a backend: which scenario is active, how often each mock matched since it
 * was activated, and the most recent calls that matched nothing.
 *
 * <p>Lookups take the read lock. Activation, deactivation and counter updates take the write
 * lock, so a reader never sees a new active scenario together with the previous counts.
 */
public class ScenarioRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ScenarioRegistry.class);

    private final RecordStore store;
    private final int unmatchedLimit;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private String activeScenario;
    private long generation;
    private final Map<Long, Integer> matchCounts = new HashMap<>();
    private final Deque<UnmatchedRequest> unmatched = new ArrayDeque<>();

    public ScenarioRegistry(RecordStore store) {
        this(store, ScenarioMockConfig.getUnmatchedHistory());
    }

    public ScenarioRegistry(RecordStore store, int unmatchedLimit) {
        this.store = store;
        this.unmatchedLimit = Math.max(0, unmatchedLimit);
    }

    /**
     * Makes {@code name} the only active scenario and clears the counters.
     *
     * @throws BackendException CONFIGURATION if no such scenario is stored
     */
    public void activate(String name) throws BackendException {
        if (store.findScenarioByName(name).isEmpty()) {
            throw BackendException.configuration("Scenario not found: " + name);
        }
        lock.writeLock().lock();
        try {
            store.markActive(name);
            activeScenario = name;
            generation++;
            matchCounts.clear();
            unmatched.clear();
        } finally {
            lock.writeLock().unlock();
        }
        logger.info("Activated scenario {}", name);
    }

    /**
     * Clears the active scenario and the counters. A no-op when nothing is active.
     */
    public void deactivate() throws BackendException {
        String previous;
        lock.writeLock().lock();
        try {
            previous = activeScenario;
            if (previous != null) {
                store.markActive(null);
            }
            activeScenario = null;
            generation++;
            matchCounts.clear();
            unmatched.clear();
        } finally {
            lock.writeLock().unlock();
        }
        if (previous != null) {
            logger.info("Deactivated scenario {}", previous);
        }
    }

    public Optional<String> active() {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(activeScenario);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return the active scenario together with the current generation
     */
    public Activation activation() {
        lock.readLock().lock();
        try {
            return new Activation(activeScenario, generation);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Counts a match found under {@code matchedGeneration}. A match from before the latest
     * activation or deactivation is not counted.
     *
     * @return whether the match was counted
     */
    public boolean recordMatch(long requestId, long matchedGeneration) {
        lock.writeLock().lock();
        try {
            if (matchedGeneration != generation) {
                logger.debug("Dropping match of mock {} from generation {} (now {})", requestId,
                        matchedGeneration, generation);
                return false;
            }
            matchCounts.merge(requestId, 1, Integer::sum);
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * @return matches of the mock since the last activation, 0 if it never matched
     */
    public int matchCount(long requestId) {
        lock.readLock().lock();
        try {
            return matchCounts.getOrDefault(requestId, 0);
        } finally {
            lock.readLock().unlock();
        }
    }

    public Map<Long, Integer> matchCounts() {
        lock.readLock().lock();
        try {
            return Map.copyOf(matchCounts);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Remembers a call that matched nothing. The oldest entry is dropped once the history is full.
     */
    public void recordUnmatched(HttpRequest request) {
        lock.writeLock().lock();
        try {
            if (unmatchedLimit == 0) {
                return;
            }
            if (unmatched.size() >= unmatchedLimit) {
                unmatched.removeFirst();
            }
            unmatched.addLast(UnmatchedRequest.of(activeScenario, request));
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * @return unmatched calls since the last activation, oldest first
     */
    public List<UnmatchedRequest> unmatchedRequests() {
        lock.readLock().lock();
        try {
            return List.copyOf(unmatched);
        } finally {
            lock.readLock().unlock();
        }
    }
}
