package com.scenariomock.junit;

import org.junit.jupiter.api.extension.ExtendWith;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Gives each test a fresh in-memory {@link com.scenariomock.MockBackend}, injectable as a test
 * method parameter together with a {@link com.scenariomock.MockBuilder} on the same backend.
 *
 * <pre>{@code
 * @MockScenario(providers = "plaid")
 * class PlaidClientTest {
 *     @Test
 *     void listsAccounts(MockBackend backend) throws Exception {
 *         HttpResponse response = backend.post("https://sandbox.plaid.com/accounts/get", "{}");
 *         assertEquals(200, response.getStatus());
 *     }
 * }
 * }</pre>
 *
 * A method-level annotation replaces the class-level one.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.TYPE, ElementType.METHOD})
@ExtendWith(MockBackendExtension.class)
public @interface MockScenario {

    /**
     * Providers whose happy-path fixtures are loaded, e.g. {@code {"plaid", "teller"}}. Each one
     * becomes a scenario named {@code <provider>_happy_path}.
     */
    String[] providers() default {};

    /**
     * Scenario to activate before the test. When empty and exactly one provider is listed, that
     * provider's happy path is activated; otherwise nothing is.
     */
    String activate() default "";

    /**
     * Write a match report after the test to
     * {@code <scenariomock.reportDir>/<test class>/<test method>.json}.
     */
    boolean report() default false;
}
