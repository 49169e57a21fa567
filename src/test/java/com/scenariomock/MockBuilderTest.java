package com.scenariomock;

import com.scenariomock.core.error.BackendException;
import com.scenariomock.core.error.ErrorKind;
import com.scenariomock.core.http.HttpMethod;
import com.scenariomock.core.http.HttpRequest;
import com.scenariomock.core.http.HttpResponse;
import com.scenariomock.core.model.CreateMockResponse;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MockBuilderTest {

    @Test
    void testBuilder_RegistersAndActivates() throws Exception {
        MockBackend backend = MockBuilder.create()
                .scenario("happy-path", "plaid")
                .onGet("/accounts/{id}").respondOk("{\"balance\":100}")
                .onPost("/transfers").respondCreated("{\"id\":\"t1\"}")
                .activate("happy-path");

        assertEquals("happy-path", backend.activeScenario().orElseThrow());
        assertEquals(100, backend.get("/accounts/42").jsonTree().get("balance").asInt());
        assertEquals(201, backend.post("/transfers", "{}").getStatus());
    }

    @Test
    void testBuilder_RespondWithoutScenarioFails() {
        BackendException e = assertThrows(BackendException.class,
                () -> MockBuilder.create().onGet("/accounts").respondOk("[]"));
        assertEquals(ErrorKind.CONFIGURATION, e.getKind());
    }

    @Test
    void testBuilder_DuplicateScenarioFails() throws BackendException {
        MockBuilder builder = MockBuilder.create().scenario("s", "plaid");

        BackendException e = assertThrows(BackendException.class, () -> builder.scenario("s", "plaid"));
        assertEquals(ErrorKind.CONFIGURATION, e.getKind());
    }

    @Test
    void testBuilder_InScenarioTargetsExisting() throws BackendException {
        MockBuilder builder = MockBuilder.create().scenario("a", "plaid").scenario("b", "plaid");

        MockBackend backend = builder.inScenario("a")
                .onGet("/x").respondOk("from-a")
                .activate("a");

        assertEquals("from-a", backend.get("/x").getBody());
        assertTrue(backend.listMocks("b").isEmpty());
        assertThrows(BackendException.class, () -> builder.inScenario("missing"));
    }

    @Test
    void testBuilder_BodyAndHeaderConstraints() throws BackendException {
        MockBackend backend = MockBuilder.create()
                .scenario("s", "truelayer")
                .onPost("/payments").withBodyContaining("\"currency\":\"GBP\"").withHeader("Authorization", "*")
                .respondJson(Map.of("status", "accepted"))
                .activate("s");

        HttpResponse accepted = backend.execute(new HttpRequest(HttpMethod.POST, "/payments",
                Map.of("authorization", "Bearer x"), "{\"currency\":\"GBP\"}"));
        assertEquals(200, accepted.getStatus());

        BackendException noHeader = assertThrows(BackendException.class,
                () -> backend.post("/payments", "{\"currency\":\"GBP\"}"));
        assertEquals(ErrorKind.NO_MATCH, noHeader.getKind());
    }

    @Test
    void testBuilder_RespondErrorAndSequence() throws BackendException {
        MockBackend backend = MockBuilder.create()
                .scenario("s", "plaid")
                .onGet("/items/{*}").withSequence(10).respondOk("item")
                .onGet("/items/broken").withSequence(1).respondError(400, "{\"error_code\":\"ITEM_LOGIN_REQUIRED\"}")
                .activate("s");

        assertEquals(400, backend.get("/items/broken").getStatus());
        assertEquals("item", backend.get("/items/other").getBody());
    }

    @Test
    void testBuild_LeavesScenarioInactive() throws BackendException {
        MockBackend backend = MockBuilder.create()
                .scenario("s", "plaid")
                .onDelete("/items/{id}").respond(CreateMockResponse.noContent())
                .build();

        assertTrue(backend.activeScenario().isEmpty());
        assertEquals(1, backend.listMocks("s").size());
    }
}
