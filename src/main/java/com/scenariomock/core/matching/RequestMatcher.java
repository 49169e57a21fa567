package com.scenariomock.core.matching;

import com.scenariomock.core.error.BackendException;
import com.scenariomock.core.http.HttpRequest;
import com.scenariomock.core.model.CreateMockRequest;
import com.scenariomock.core.model.MockRequest;

/**
 * Combines the path, body and header predicates. The HTTP method is filtered by the caller
 * (the candidate query) and re-checked here.
 */
public final class RequestMatcher {

    private RequestMatcher() {
        // utility class
    }

    /**
     * @throws BackendException of kind CONFIGURATION if one of the mock's patterns is invalid
     */
    public static boolean matches(MockRequest mock, HttpRequest request) throws BackendException {
        return mock.getMethod() == request.getMethod()
                && PathMatcher.matches(mock.getPathPattern(), request.getUrl())
                && BodyMatcher.matches(mock.getBodyPattern(), request.getBody())
                && HeadersMatcher.matches(mock.getHeadersPattern(), request.getHeaders());
    }

    /**
     * Checks all patterns of a mock before it is stored.
     *
     * @throws BackendException of kind CONFIGURATION naming the first invalid pattern
     */
    public static void validate(CreateMockRequest request) throws BackendException {
        PathMatcher.compile(request.getPathPattern());
        BodyMatcher.validate(request.getBodyPattern());
        if (request.getHeadersPattern() != null) {
            HeadersMatcher.parsePattern(request.getHeadersPattern());
        }
    }
}
