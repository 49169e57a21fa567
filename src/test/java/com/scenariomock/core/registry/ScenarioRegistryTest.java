package com.scenariomock.core.registry;

import com.scenariomock.core.error.BackendException;
import com.scenariomock.core.error.ErrorKind;
import com.scenariomock.core.http.HttpRequest;
import com.scenariomock.core.model.CreateScenario;
import com.scenariomock.core.storage.InMemoryRecordStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ScenarioRegistryTest {

    private InMemoryRecordStore store;
    private ScenarioRegistry registry;

    @BeforeEach
    void setUp() throws BackendException {
        store = new InMemoryRecordStore();
        store.createScenario(new CreateScenario("a", "plaid"));
        store.createScenario(new CreateScenario("b", "plaid"));
        registry = new ScenarioRegistry(store, 3);
    }

    @Test
    void testActivate_UnknownScenarioRejected() {
        BackendException e = assertThrows(BackendException.class, () -> registry.activate("missing"));
        assertEquals(ErrorKind.CONFIGURATION, e.getKind());
        assertTrue(registry.active().isEmpty());
    }

    @Test
    void testActivate_SetsActiveAndStoreFlag() throws BackendException {
        registry.activate("a");

        assertEquals("a", registry.active().orElseThrow());
        assertTrue(store.findScenarioByName("a").orElseThrow().isActive());

        registry.activate("b");
        assertEquals("b", registry.active().orElseThrow());
        assertFalse(store.findScenarioByName("a").orElseThrow().isActive());
    }

    @Test
    void testActivate_ResetsCountersAndHistory() throws BackendException {
        registry.activate("a");
        registry.recordMatch(1, registry.activation().generation());
        registry.recordMatch(1, registry.activation().generation());
        registry.recordUnmatched(HttpRequest.get("/x"));
        assertEquals(2, registry.matchCount(1));

        registry.activate("a");

        assertEquals(0, registry.matchCount(1));
        assertTrue(registry.matchCounts().isEmpty());
        assertTrue(registry.unmatchedRequests().isEmpty());
    }

    @Test
    void testRecordMatch_CountsOnlyThatMock() throws BackendException {
        registry.activate("a");
        registry.recordMatch(7, registry.activation().generation());

        assertEquals(1, registry.matchCount(7));
        assertEquals(0, registry.matchCount(8));
        assertEquals(1, registry.matchCounts().size());
    }

    @Test
    void testActivation_GenerationChangesOnEveryActivation() throws BackendException {
        long initial = registry.activation().generation();

        registry.activate("a");
        Activation first = registry.activation();
        registry.activate("a");
        Activation second = registry.activation();
        registry.deactivate();

        assertEquals("a", first.scenario());
        assertNotEquals(initial, first.generation());
        assertNotEquals(first.generation(), second.generation());
        assertNotEquals(second.generation(), registry.activation().generation());
        assertTrue(registry.activation().activeScenario().isEmpty());
    }

    @Test
    void testRecordMatch_StaleGenerationIgnored() throws BackendException {
        registry.activate("a");
        long matchedUnderA = registry.activation().generation();

        registry.activate("b");

        assertFalse(registry.recordMatch(1, matchedUnderA));
        assertTrue(registry.matchCounts().isEmpty());
        assertTrue(registry.recordMatch(1, registry.activation().generation()));
        assertEquals(1, registry.matchCount(1));
    }

    @Test
    void testDeactivate_ClearsEverything() throws BackendException {
        registry.activate("a");
        registry.recordMatch(1, registry.activation().generation());

        registry.deactivate();

        assertTrue(registry.active().isEmpty());
        assertEquals(0, registry.matchCount(1));
        assertFalse(store.findScenarioByName("a").orElseThrow().isActive());

        registry.deactivate();
        assertTrue(registry.active().isEmpty());
    }

    @Test
    void testRecordUnmatched_KeepsMostRecent() throws BackendException {
        registry.activate("a");
        for (int i = 1; i <= 5; i++) {
            registry.recordUnmatched(HttpRequest.get("/call/" + i));
        }

        List<UnmatchedRequest> unmatched = registry.unmatchedRequests();
        assertEquals(3, unmatched.size());
        assertEquals("/call/3", unmatched.get(0).getUrl());
        assertEquals("/call/5", unmatched.get(2).getUrl());
        assertEquals("a", unmatched.get(0).getScenario());
        assertEquals("GET", unmatched.get(0).getMethod());
    }

    @Test
    void testConcurrentRecordMatch_CountsExactly() throws Exception {
        registry.activate("a");
        int threads = 8;
        int perThread = 500;
        long generation = registry.activation().generation();
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        registry.recordMatch(42, generation);
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(threads * perThread, registry.matchCount(42));
    }
}
