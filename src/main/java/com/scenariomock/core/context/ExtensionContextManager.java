package com.scenariomock.core.context;

import com.scenariomock.MockBackend;
import org.junit.jupiter.api.extension.ExtensionContext;

/**
 * Keeps per-test state of the JUnit extension in the {@link ExtensionContext.Store}.
 */
public final class ExtensionContextManager {

    private ExtensionContextManager() {
        // utility class
    }

    public static class MethodLevelStore {
        private final ExtensionContext.Store store;

        public MethodLevelStore(ExtensionContext context) {
            this.store = context.getStore(ExtensionContext.Namespace.create(context.getUniqueId()));
        }

        public void putBackend(MockBackend backend) {
            store.put("mockBackend", backend);
        }

        public MockBackend getBackend() {
            return store.get("mockBackend", MockBackend.class);
        }

        public void removeBackend() {
            store.remove("mockBackend");
        }

        public void putReportEnabled(boolean enabled) {
            store.put("reportEnabled", enabled);
        }

        public boolean isReportEnabled() {
            return Boolean.TRUE.equals(store.get("reportEnabled", Boolean.class));
        }
    }
}
