package com.scenariomock.core.reporting;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scenariomock.MockBackend;
import com.scenariomock.core.error.BackendException;
import com.scenariomock.core.model.MockMapping;
import com.scenariomock.core.model.MockRequest;
import com.scenariomock.core.model.Scenario;
import com.scenariomock.core.registry.UnmatchedRequest;
import com.scenariomock.core.util.AtomicFileWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;

/**
 * Summarizes what a backend was asked and what answered: every scenario with its mocks and
 * their match counts, plus the calls nothing answered.
 */
public final class MatchReportGenerator {

    private static final Logger logger = LoggerFactory.getLogger(MatchReportGenerator.class);
    private static final ObjectMapper objectMapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private MatchReportGenerator() {
        // utility class
    }

    /**
     * Builds the report for the current state of {@code backend}.
     *
     * <p>{@code matchedSinceActivation} counts matches since the active scenario was activated and
     * is 0 for inactive scenarios; {@code timesMatched} is the lifetime total kept in the store.
     */
    public static ObjectNode generateReport(MockBackend backend) throws BackendException {
        ObjectNode report = objectMapper.createObjectNode();
        report.put("generatedAt", Instant.now().toString());
        String active = backend.activeScenario().orElse(null);
        if (active != null) {
            report.put("activeScenario", active);
        } else {
            report.putNull("activeScenario");
        }

        Map<Long, Integer> counts = backend.matchCounts();
        ArrayNode scenariosArray = report.putArray("scenarios");
        for (Scenario scenario : backend.listScenarios()) {
            ObjectNode scenarioNode = scenariosArray.addObject();
            scenarioNode.put("name", scenario.getName());
            scenarioNode.put("provider", scenario.getProvider());
            scenarioNode.put("active", scenario.getName().equals(active));

            ArrayNode mocksArray = scenarioNode.putArray("mocks");
            int unused = 0;
            for (MockMapping mapping : backend.listMocks(scenario.getName())) {
                MockRequest request = mapping.request();
                int matched = counts.getOrDefault(request.getId(), 0);
                ObjectNode mockNode = mocksArray.addObject();
                mockNode.put("id", request.getId());
                mockNode.put("method", request.getMethod().name());
                mockNode.put("pathPattern", request.getPathPattern());
                mockNode.put("sequenceOrder", request.getSequenceOrder());
                mockNode.put("status", mapping.response().getStatusCode());
                mockNode.put("matchedSinceActivation", matched);
                mockNode.put("timesMatched", request.getTimesMatched());
                if (matched == 0) {
                    unused++;
                }
            }
            scenarioNode.put("unusedMocks", unused);
        }

        ArrayNode unmatchedArray = report.putArray("unmatched");
        for (UnmatchedRequest request : backend.unmatchedRequests()) {
            unmatchedArray.add(objectMapper.valueToTree(request));
        }
        return report;
    }

    /**
     * Writes the report as indented JSON, replacing {@code file} atomically.
     *
     * @throws BackendException of kind STORAGE if the file cannot be written
     */
    public static void saveReport(ObjectNode report, Path file) throws BackendException {
        try {
            AtomicFileWriter.writeString(file, objectMapper.writeValueAsString(report));
            logger.info("Match report saved to: {}", file.toAbsolutePath());
        } catch (IOException e) {
            throw BackendException.storage("Failed to save match report " + file, e);
        }
    }
}
