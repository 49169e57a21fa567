package com.scenariomock.junit;

import com.scenariomock.MockBackend;
import com.scenariomock.MockBuilder;
import com.scenariomock.core.error.BackendException;
import com.scenariomock.core.error.ErrorKind;
import com.scenariomock.core.http.Backend;
import com.scenariomock.core.model.CreateScenario;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@MockScenario(providers = "plaid")
class MockBackendExtensionTest {

    private MockBackend fromBeforeEach;

    @BeforeEach
    void captureBackend(MockBackend backend) {
        fromBeforeEach = backend;
    }

    @Test
    void testSingleProvider_HappyPathActivated(MockBackend backend) throws BackendException {
        assertEquals("plaid_happy_path", backend.activeScenario().orElseThrow());
        assertEquals(200, backend.post("/accounts/get", "{}").getStatus());
    }

    @Test
    void testSameBackendForLifecycleAndTest(MockBackend backend, Backend asInterface, MockBuilder builder)
            throws BackendException {
        assertSame(fromBeforeEach, backend);
        assertSame(backend, asInterface);

        builder.inScenario("plaid_happy_path").onGet("/custom").respondOk("extra");
        assertEquals("extra", backend.get("/custom").getBody());
    }

    @Test
    void testFreshBackendPerTest_First(MockBackend backend) throws BackendException {
        backend.createScenario(new CreateScenario("per-test", "plaid"));
        assertEquals(2, backend.listScenarios().size());
    }

    @Test
    void testFreshBackendPerTest_Second(MockBackend backend) throws BackendException {
        assertTrue(backend.getScenario("per-test").isEmpty());
        assertEquals(1, backend.listScenarios().size());
    }

    @Test
    @MockScenario(providers = {"teller", "mx"})
    void testMethodAnnotation_ReplacesClassAnnotation(MockBackend backend) throws BackendException {
        assertEquals(2, backend.listScenarios().size());
        assertTrue(backend.getScenario("plaid_happy_path").isEmpty());
        assertTrue(backend.activeScenario().isEmpty());
    }

    @Test
    @MockScenario(providers = {"teller", "mx"}, activate = "mx_happy_path")
    void testExplicitActivation(MockBackend backend) throws BackendException {
        assertEquals("mx_happy_path", backend.activeScenario().orElseThrow());
        BackendException e = assertThrows(BackendException.class, () -> backend.get("/accounts"));
        assertEquals(ErrorKind.NO_MATCH, e.getKind());
    }

    @Nested
    class InheritedFromEnclosingClass {

        @Test
        void testEnclosingAnnotationApplies(MockBackend backend) {
            assertEquals("plaid_happy_path", backend.activeScenario().orElseThrow());
        }
    }

    @Nested
    class WithoutProviders {

        @Test
        @MockScenario
        void testEmptyAnnotation_EmptyBackend(MockBackend backend) throws BackendException {
            assertTrue(backend.listScenarios().isEmpty());
            assertTrue(backend.activeScenario().isEmpty());
        }
    }
}
