package com.scenariomock;

import com.scenariomock.core.error.BackendException;
import com.scenariomock.core.model.CreateMockRequest;
import com.scenariomock.core.model.CreateScenario;

/**
 * Fluent setup for a {@link MockBackend}:
 * <pre>{@code
 * MockBackend backend = MockBuilder.create()
 *         .scenario("happy-path", "plaid")
 *         .onGet("/accounts/{id}").respondOk("{\"balance\":100}")
 *         .onPost("/transfers").withBodyContaining("\"amount\"").respondCreated("{\"id\":\"t-1\"}")
 *         .activate("happy-path");
 * }</pre>
 * Each terminal call on {@link MockRequestBuilder} stores the mock right away.
 */
public class MockBuilder {

    private final MockBackend backend;
    private String currentScenario;

    public MockBuilder(MockBackend backend) {
        this.backend = backend;
    }

    /**
     * Starts a builder on a fresh in-memory backend.
     */
    public static MockBuilder create() {
        return new MockBuilder(MockBackend.inMemory());
    }

    /**
     * Creates a scenario and makes it the target of the following mocks.
     *
     * @throws BackendException CONFIGURATION if the name is taken
     */
    public MockBuilder scenario(String name, String provider) throws BackendException {
        backend.createScenario(new CreateScenario(name, provider));
        currentScenario = name;
        return this;
    }

    /**
     * Targets an existing scenario with the following mocks.
     */
    public MockBuilder inScenario(String name) throws BackendException {
        if (backend.getScenario(name).isEmpty()) {
            throw BackendException.configuration("Scenario not found: " + name);
        }
        currentScenario = name;
        return this;
    }

    public MockRequestBuilder onGet(String path) {
        return new MockRequestBuilder(this, CreateMockRequest.get(path));
    }

    public MockRequestBuilder onPost(String path) {
        return new MockRequestBuilder(this, CreateMockRequest.post(path));
    }

    public MockRequestBuilder onPut(String path) {
        return new MockRequestBuilder(this, CreateMockRequest.put(path));
    }

    public MockRequestBuilder onPatch(String path) {
        return new MockRequestBuilder(this, CreateMockRequest.patch(path));
    }

    public MockRequestBuilder onDelete(String path) {
        return new MockRequestBuilder(this, CreateMockRequest.delete(path));
    }

    /**
     * Activates {@code scenario} and hands out the backend.
     */
    public MockBackend activate(String scenario) throws BackendException {
        backend.activateScenario(scenario);
        return backend;
    }

    /**
     * Hands out the backend without activating anything.
     */
    public MockBackend build() {
        return backend;
    }

    MockBackend backend() {
        return backend;
    }

    String currentScenario() {
        return currentScenario;
    }
}
