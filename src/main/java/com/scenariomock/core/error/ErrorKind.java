package com.scenariomock.core.error;

/**
 * Failure categories reported by the mock backend.
 */
public enum ErrorKind {

    /**
     * Invalid mock definition: malformed path/body/header pattern, unknown or duplicate scenario,
     * builder used without a scenario.
     */
    CONFIGURATION,

    /**
     * No scenario is active, or no mock of the active scenario satisfies the call.
     */
    NO_MATCH,

    /**
     * The record store (or a file it reads/writes) failed.
     */
    STORAGE
}
