package com.scenariomock.fixtures;

import java.util.Locale;

/**
 * Banking providers with bundled fixtures.
 */
public enum Provider {
    PLAID,
    TRUELAYER,
    TELLER,
    GOCARDLESS,
    YAPILY,
    MX;

    /**
     * @return the lower-case id used for scenario names, provider tags and resource names
     */
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Provider fromId(String id) {
        for (Provider provider : values()) {
            if (provider.id().equalsIgnoreCase(id)) {
                return provider;
            }
        }
        throw new IllegalArgumentException("Unknown provider: " + id);
    }
}
