package com.scenariomock.core.resolver;

import com.scenariomock.junit.MockScenario;
import org.junit.jupiter.api.extension.ExtensionContext;

import java.lang.reflect.Method;

/**
 * Resolves annotations and names from the JUnit test context.
 */
public final class TestContextResolver {

    private TestContextResolver() {
        // utility class
    }

    /**
     * @return the method-level annotation if present, else the one on the test class or an
     *         enclosing class, else null
     */
    public static MockScenario findMockScenario(ExtensionContext context) {
        MockScenario methodAnnotation = context.getTestMethod()
                .map(method -> method.getAnnotation(MockScenario.class))
                .orElse(null);
        if (methodAnnotation != null) {
            return methodAnnotation;
        }

        Class<?> testClass = context.getTestClass().orElse(null);
        while (testClass != null) {
            MockScenario classAnnotation = testClass.getAnnotation(MockScenario.class);
            if (classAnnotation != null) {
                return classAnnotation;
            }
            testClass = testClass.getEnclosingClass();
        }
        return null;
    }

    public static String getTestClassName(ExtensionContext context) {
        return context.getRequiredTestClass().getSimpleName();
    }

    public static String getTestMethodName(ExtensionContext context) {
        return context.getTestMethod().map(Method::getName).orElse("unknown");
    }
}
