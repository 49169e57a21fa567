package com.scenariomock;

import com.scenariomock.core.error.BackendException;
import com.scenariomock.core.model.CreateMockRequest;
import com.scenariomock.core.model.CreateMockResponse;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The request half of a mock under construction. Obtained from {@code MockBuilder.onGet(..)} and
 * friends; a {@code respond*} call stores the mock and returns to the {@link MockBuilder}.
 */
public class MockRequestBuilder {

    private final MockBuilder builder;
    private final CreateMockRequest request;
    private final Map<String, String> headers = new LinkedHashMap<>();

    MockRequestBuilder(MockBuilder builder, CreateMockRequest request) {
        this.builder = builder;
        this.request = request;
    }

    /**
     * @param pattern JSON subset pattern, {@code "*"}, or a regular expression searched in the body
     */
    public MockRequestBuilder withBodyContaining(String pattern) {
        request.withBodyPattern(pattern);
        return this;
    }

    /**
     * Requires a header. Use {@code "*"} as value to accept any value.
     */
    public MockRequestBuilder withHeader(String name, String value) {
        headers.put(name, value);
        return this;
    }

    public MockRequestBuilder withHeaders(Map<String, String> expected) {
        headers.putAll(expected);
        return this;
    }

    public MockRequestBuilder withSequence(int order) {
        request.withSequence(order);
        return this;
    }

    /**
     * @throws BackendException CONFIGURATION if no scenario was selected or a pattern is invalid
     */
    public MockBuilder respond(CreateMockResponse response) throws BackendException {
        String scenario = builder.currentScenario();
        if (scenario == null) {
            throw BackendException.configuration("No scenario selected; call scenario(name, provider) first");
        }
        if (!headers.isEmpty()) {
            request.withHeaders(headers);
        }
        builder.backend().addMock(scenario, request, response);
        return builder;
    }

    public MockBuilder respondOk(String body) throws BackendException {
        return respond(CreateMockResponse.ok(body));
    }

    public MockBuilder respondCreated(String body) throws BackendException {
        return respond(CreateMockResponse.created(body));
    }

    /**
     * Responds 200 with {@code data} serialized as JSON.
     */
    public MockBuilder respondJson(Object data) throws BackendException {
        return respond(CreateMockResponse.json(data));
    }

    public MockBuilder respondError(int status, String body) throws BackendException {
        return respond(CreateMockResponse.ok(body).withStatus(status));
    }
}
