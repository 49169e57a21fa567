package com.scenariomock.core.http;

import com.scenariomock.core.error.BackendException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BackendTest {

    private final List<HttpRequest> executed = new ArrayList<>();
    private final Backend recording = request -> {
        executed.add(request);
        return HttpResponse.ok("{\"id\":\"acc_1\",\"balance\":12.5}");
    };

    @Test
    void testHelpers_BuildExpectedRequests() throws BackendException {
        recording.get("/accounts");
        recording.postWithHeaders("/payments", "{}", Map.of("Idempotency-Key", "k1"));
        recording.deleteWithHeaders("/items/1", Map.of("Authorization", "Bearer t"));

        assertEquals(HttpMethod.GET, executed.get(0).getMethod());
        assertNull(executed.get(0).getBody());
        assertEquals("k1", executed.get(1).getHeaders().get("Idempotency-Key"));
        assertEquals(HttpMethod.DELETE, executed.get(2).getMethod());
        assertEquals("/items/1", executed.get(2).getUrl());
    }

    @Test
    void testPostJson_SerializesPayload() throws BackendException {
        recording.postJson("/link/token/create", Map.of("client_name", "demo"));

        assertEquals(HttpMethod.POST, executed.get(0).getMethod());
        assertEquals("{\"client_name\":\"demo\"}", executed.get(0).getBody());
    }

    @Test
    void testResponse_BindsJson() throws Exception {
        HttpResponse response = recording.get("/accounts/acc_1");

        assertTrue(response.isSuccess());
        Account account = response.json(Account.class);
        assertEquals("acc_1", account.id);
        assertEquals(12.5, account.balance);
    }

    @Test
    void testHttpMethod_Parse() {
        assertEquals(HttpMethod.PATCH, HttpMethod.parse(" patch "));
        assertThrows(IllegalArgumentException.class, () -> HttpMethod.parse("TRACE"));
        assertThrows(IllegalArgumentException.class, () -> HttpMethod.parse(""));
    }

    @Test
    void testRequest_CopiesAreIndependent() {
        HttpRequest original = HttpRequest.get("/a");
        HttpRequest withHeader = original.withHeader("X-Trace", "1");

        assertTrue(original.getHeaders().isEmpty());
        assertEquals("1", withHeader.getHeaders().get("X-Trace"));
        assertEquals("body", withHeader.withBody("body").getBody());
        assertThrows(UnsupportedOperationException.class, () -> withHeader.getHeaders().put("x", "y"));
    }

    static class Account {
        public String id;
        public double balance;
    }
}
