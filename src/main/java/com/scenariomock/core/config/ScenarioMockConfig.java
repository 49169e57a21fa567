package com.scenariomock.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Settings read from system properties, e.g. {@code -Dscenariomock.store=file}.
 */
public final class ScenarioMockConfig {

    private static final Logger logger = LoggerFactory.getLogger(ScenarioMockConfig.class);

    public static final String STORE_PROPERTY = "scenariomock.store";
    public static final String STORE_FILE_PROPERTY = "scenariomock.storeFile";
    public static final String DELAYS_PROPERTY = "scenariomock.delays";
    public static final String REPORT_DIR_PROPERTY = "scenariomock.reportDir";
    public static final String UNMATCHED_HISTORY_PROPERTY = "scenariomock.unmatchedHistory";

    public static final String STORE_MEMORY = "memory";
    public static final String STORE_FILE = "file";

    public static final String DEFAULT_STORE = STORE_MEMORY;
    public static final String DEFAULT_STORE_FILE = "target/scenariomock/store.json";
    public static final String DEFAULT_REPORT_DIR = "target/scenariomock-reports";
    public static final int DEFAULT_UNMATCHED_HISTORY = 50;

    private ScenarioMockConfig() {
        // utility class
    }

    public static String getStore() {
        return System.getProperty(STORE_PROPERTY, DEFAULT_STORE);
    }

    public static boolean isFileStore() {
        return STORE_FILE.equalsIgnoreCase(getStore());
    }

    public static Path getStoreFile() {
        return Paths.get(System.getProperty(STORE_FILE_PROPERTY, DEFAULT_STORE_FILE));
    }

    /**
     * @return false when simulated response delays should be skipped
     */
    public static boolean isDelaysEnabled() {
        return !"false".equalsIgnoreCase(System.getProperty(DELAYS_PROPERTY, "true"));
    }

    public static Path getReportDir() {
        return Paths.get(System.getProperty(REPORT_DIR_PROPERTY, DEFAULT_REPORT_DIR));
    }

    /**
     * @return how many unmatched calls are kept for diagnostics; never negative
     */
    public static int getUnmatchedHistory() {
        String value = System.getProperty(UNMATCHED_HISTORY_PROPERTY);
        if (value == null || value.isBlank()) {
            return DEFAULT_UNMATCHED_HISTORY;
        }
        try {
            return Math.max(0, Integer.parseInt(value.trim()));
        } catch (NumberFormatException e) {
            logger.warn("Ignoring invalid {}={}, using {}", UNMATCHED_HISTORY_PROPERTY, value,
                    DEFAULT_UNMATCHED_HISTORY);
            return DEFAULT_UNMATCHED_HISTORY;
        }
    }
}
