package com.scenariomock.junit;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scenariomock.MockBackend;
import com.scenariomock.MockBuilder;
import com.scenariomock.core.config.ScenarioMockConfig;
import com.scenariomock.core.context.ExtensionContextManager;
import com.scenariomock.core.error.BackendException;
import com.scenariomock.core.http.Backend;
import com.scenariomock.core.registry.UnmatchedRequest;
import com.scenariomock.core.reporting.MatchReportGenerator;
import com.scenariomock.core.resolver.TestContextResolver;
import com.scenariomock.fixtures.Provider;
import com.scenariomock.fixtures.ProviderFixtures;
import org.junit.jupiter.api.extension.AfterEachCallback;
import org.junit.jupiter.api.extension.BeforeEachCallback;
import org.junit.jupiter.api.extension.ExtensionConfigurationException;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.junit.jupiter.api.extension.ParameterContext;
import org.junit.jupiter.api.extension.ParameterResolutionException;
import org.junit.jupiter.api.extension.ParameterResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;

/**
 * JUnit 5 extension behind {@link MockScenario}: one backend per test, prepared before the test
 * and reported on after it. Tests with their own {@code @ExtendWith(MockBackendExtension.class)}
 * and no annotation get an empty backend.
 */
public class MockBackendExtension implements BeforeEachCallback, AfterEachCallback, ParameterResolver {

    private static final Logger logger = LoggerFactory.getLogger(MockBackendExtension.class);

    @Override
    public void beforeEach(ExtensionContext context) {
        prepareBackend(context);
    }

    @Override
    public void afterEach(ExtensionContext context) throws Exception {
        ExtensionContextManager.MethodLevelStore methodStore = new ExtensionContextManager.MethodLevelStore(context);
        MockBackend backend = methodStore.getBackend();
        if (backend == null) {
            return;
        }

        try {
            List<UnmatchedRequest> unmatched = backend.unmatchedRequests();
            if (!unmatched.isEmpty()) {
                logger.warn("{} call(s) in {}.{} matched no mock:", unmatched.size(),
                        TestContextResolver.getTestClassName(context),
                        TestContextResolver.getTestMethodName(context));
                for (UnmatchedRequest request : unmatched) {
                    logger.warn("  {} {}", request.getMethod(), request.getUrl());
                }
            }

            if (methodStore.isReportEnabled()) {
                ObjectNode report = MatchReportGenerator.generateReport(backend);
                report.put("testClass", TestContextResolver.getTestClassName(context));
                report.put("testMethod", TestContextResolver.getTestMethodName(context));
                MatchReportGenerator.saveReport(report, reportFile(context));
            }
        } finally {
            methodStore.removeBackend();
        }
    }

    @Override
    public boolean supportsParameter(ParameterContext parameterContext, ExtensionContext extensionContext)
            throws ParameterResolutionException {
        Class<?> parameterType = parameterContext.getParameter().getType();
        return parameterType == MockBackend.class || parameterType == Backend.class
                || parameterType == MockBuilder.class;
    }

    @Override
    public Object resolveParameter(ParameterContext parameterContext, ExtensionContext extensionContext)
            throws ParameterResolutionException {
        if (extensionContext.getTestMethod().isEmpty()) {
            throw new ParameterResolutionException(
                    "MockBackend can only be injected into test methods and per-test lifecycle methods");
        }
        MockBackend backend = prepareBackend(extensionContext);
        Class<?> parameterType = parameterContext.getParameter().getType();
        if (parameterType == MockBuilder.class) {
            return new MockBuilder(backend);
        }
        return backend;
    }

    /**
     * Returns the test's backend, creating and preparing it on first use.
     */
    private static MockBackend prepareBackend(ExtensionContext context) {
        ExtensionContextManager.MethodLevelStore methodStore = new ExtensionContextManager.MethodLevelStore(context);
        MockBackend existing = methodStore.getBackend();
        if (existing != null) {
            return existing;
        }

        MockScenario annotation = TestContextResolver.findMockScenario(context);
        MockBackend backend = MockBackend.inMemory();
        if (annotation != null) {
            try {
                loadFixtures(backend, annotation);
            } catch (BackendException e) {
                throw new ExtensionConfigurationException("Failed to prepare mock backend: " + e.getMessage(), e);
            } catch (IllegalArgumentException e) {
                throw new ExtensionConfigurationException("Invalid @MockScenario: " + e.getMessage(), e);
            }
            methodStore.putReportEnabled(annotation.report());
        }
        methodStore.putBackend(backend);
        logger.debug("Prepared mock backend for {}.{}", TestContextResolver.getTestClassName(context),
                TestContextResolver.getTestMethodName(context));
        return backend;
    }

    private static void loadFixtures(MockBackend backend, MockScenario annotation) throws BackendException {
        String[] providers = annotation.providers();
        for (String providerId : providers) {
            ProviderFixtures.createVariant(backend, Provider.fromId(providerId), ProviderFixtures.HAPPY_PATH);
        }

        String toActivate = annotation.activate();
        if (toActivate.isEmpty() && providers.length == 1) {
            toActivate = ProviderFixtures.scenarioName(Provider.fromId(providers[0]), ProviderFixtures.HAPPY_PATH);
        }
        if (!toActivate.isEmpty()) {
            backend.activateScenario(toActivate);
        }
    }

    private static Path reportFile(ExtensionContext context) {
        return ScenarioMockConfig.getReportDir()
                .resolve(TestContextResolver.getTestClassName(context))
                .resolve(TestContextResolver.getTestMethodName(context) + ".json");
    }
}
