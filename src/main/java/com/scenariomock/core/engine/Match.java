package com.scenariomock.core.engine;

import com.scenariomock.core.model.MockMapping;
import com.scenariomock.core.model.MockRequest;
import com.scenariomock.core.model.MockResponse;

/**
 * A mock that answered a request, with the activation generation it was found under.
 */
public record Match(MockMapping mapping, long generation) {

    public MockRequest request() {
        return mapping.request();
    }

    public MockResponse response() {
        return mapping.response();
    }
}
