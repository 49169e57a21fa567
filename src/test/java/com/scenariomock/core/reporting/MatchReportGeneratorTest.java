package com.scenariomock.core.reporting;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scenariomock.MockBackend;
import com.scenariomock.MockBuilder;
import com.scenariomock.core.error.BackendException;
import com.scenariomock.core.error.ErrorKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class MatchReportGeneratorTest {

    @TempDir
    Path tempDir;

    @Test
    void testGenerateReport_CountsAndUnmatched() throws BackendException {
        MockBackend backend = MockBuilder.create()
                .scenario("idle", "teller")
                .onGet("/accounts").respondOk("[]")
                .scenario("happy-path", "plaid")
                .onPost("/accounts/get").respondOk("{}")
                .onPost("/transactions/get").respondOk("{}")
                .activate("happy-path");
        backend.post("/accounts/get", "{}");
        backend.post("/accounts/get", "{}");
        assertThrows(BackendException.class, () -> backend.get("/missing"));

        ObjectNode report = MatchReportGenerator.generateReport(backend);

        assertTrue(report.has("generatedAt"));
        assertEquals("happy-path", report.get("activeScenario").asText());

        JsonNode scenarios = report.get("scenarios");
        assertEquals(2, scenarios.size());
        JsonNode happy = scenarios.get(0);
        assertEquals("happy-path", happy.get("name").asText());
        assertTrue(happy.get("active").asBoolean());
        assertEquals(1, happy.get("unusedMocks").asInt());
        JsonNode accountsMock = happy.get("mocks").get(0);
        assertEquals("POST", accountsMock.get("method").asText());
        assertEquals(2, accountsMock.get("matchedSinceActivation").asInt());
        assertEquals(2, accountsMock.get("timesMatched").asInt());

        JsonNode idle = scenarios.get(1);
        assertFalse(idle.get("active").asBoolean());
        assertEquals(1, idle.get("unusedMocks").asInt());

        JsonNode unmatched = report.get("unmatched");
        assertEquals(1, unmatched.size());
        assertEquals("/missing", unmatched.get(0).get("url").asText());
        assertEquals("happy-path", unmatched.get(0).get("scenario").asText());
    }

    @Test
    void testGenerateReport_NoActiveScenario() throws BackendException {
        ObjectNode report = MatchReportGenerator.generateReport(MockBackend.inMemory());

        assertTrue(report.get("activeScenario").isNull());
        assertEquals(0, report.get("scenarios").size());
        assertEquals(0, report.get("unmatched").size());
    }

    @Test
    void testSaveReport_WritesJson() throws BackendException, IOException {
        MockBackend backend = MockBuilder.create()
                .scenario("s", "mx")
                .onGet("/users").respondOk("[]")
                .activate("s");
        ObjectNode report = MatchReportGenerator.generateReport(backend);
        Path file = tempDir.resolve("reports").resolve("report.json");

        MatchReportGenerator.saveReport(report, file);

        JsonNode saved = new ObjectMapper().readTree(file.toFile());
        assertEquals("s", saved.get("activeScenario").asText());
        assertEquals("/users", saved.get("scenarios").get(0).get("mocks").get(0).get("pathPattern").asText());
    }

    @Test
    void testSaveReport_UnwritableTarget() throws BackendException, IOException {
        Path blocker = tempDir.resolve("blocker");
        Files.writeString(blocker, "x");
        ObjectNode report = MatchReportGenerator.generateReport(MockBackend.inMemory());

        BackendException e = assertThrows(BackendException.class,
                () -> MatchReportGenerator.saveReport(report, blocker.resolve("report.json")));
        assertEquals(ErrorKind.STORAGE, e.getKind());
    }
}
