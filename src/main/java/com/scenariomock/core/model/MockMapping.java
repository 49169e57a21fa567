package com.scenariomock.core.model;

/**
 * A registered mock: the expected request and its response.
 */
public record MockMapping(MockRequest request, MockResponse response) {
}
