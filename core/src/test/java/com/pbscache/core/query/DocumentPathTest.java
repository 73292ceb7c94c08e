package com.pbscache.core.query;

import com.fasterxml.jackson.databind.JsonNode;
import com.pbscache.core.util.JsonUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class DocumentPathTest {

    private JsonNode document;

    @BeforeEach
    void setUp() {
        document = JsonUtils.readTree("{"
                + "\"timestamp\": 1700000000,"
                + "\"Server\": {\"pbs01\": {\"server_state\": \"Active\", \"total_jobs\": 3}},"
                + "\"Queue\": {"
                + "  \"workq\": {\"queue_type\": \"Execution\", \"statistics\": {\"load\": 0.5}},"
                + "  \"gpuq\": {\"queue_type\": \"Execution\", \"statistics\": {\"load\": 1.2}}"
                + "},"
                + "\"Jobs\": {"
                + "  \"1_pbs01\": {\"id\": \"1.pbs01\", \"euser\": \"alice\", \"job_state\": \"R\"},"
                + "  \"2_pbs01\": {\"id\": \"2.pbs01\", \"euser\": \"bob\", \"job_state\": \"Q\"},"
                + "  \"3_pbs01\": {\"id\": \"3.pbs01\", \"euser\": \"alice\", \"job_state\": \"Q\"}"
                + "},"
                + "\"nodes\": {"
                + "  \"cn01_0\": {\"id\": \"cn01[0]\", \"Mom\": \"cn01\"},"
                + "  \"cn01_1\": {\"id\": \"cn01[1]\", \"Mom\": \"cn01\"},"
                + "  \"cn02\": {\"id\": \"cn02\", \"Mom\": \"cn02\"}"
                + "}}");
    }

    @Test
    void fieldAccessWithAndWithoutRoot() {
        assertEquals(0.5, single(".Queue.workq.statistics.load").asDouble());
        assertEquals(0.5, single("$.Queue.workq.statistics.load").asDouble());
    }

    @Test
    void rootOnlyReturnsDocument() {
        assertSame(document, single("$"));
    }

    @Test
    void wildcardOverMappingValues() {
        List<String> types = texts("$.Queue.*.queue_type");
        assertEquals(List.of("Execution", "Execution"), types);
        assertEquals(2, DocumentPath.compile("$.Queue.*").select(document).size());
    }

    @Test
    void equalityFilter() {
        assertEquals(List.of("1.pbs01", "3.pbs01"), texts("$.Jobs[?(@.euser==\"alice\")].id"));
        assertEquals(List.of("cn01[0]", "cn01[1]"), texts("$.nodes[?(@.Mom==\"cn01\")].id"));
        assertTrue(DocumentPath.compile("$.Jobs[?(@.euser==\"carol\")]").select(document).isEmpty());
    }

    @Test
    void filterOnNumbersComparesTextForm() {
        assertEquals(1, DocumentPath.compile("$.Server[?(@.total_jobs==\"3\")]").select(document).size());
    }

    @Test
    void multiFieldSelection() {
        List<JsonNode> values = DocumentPath.compile(".Server.pbs01.[\"server_state\", \"total_jobs\"]")
                .select(document);
        assertEquals(2, values.size());
        assertEquals("Active", values.get(0).asText());
        assertEquals(3, values.get(1).asInt());

        assertEquals(List.of("Active"), texts("$.Server.pbs01['server_state','missing']"));
    }

    @Test
    void missingFieldYieldsNoMatch() {
        assertTrue(DocumentPath.compile(".Queue.nosuch.statistics").select(document).isEmpty());
    }

    @Test
    void malformedExpressionsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> DocumentPath.compile("Queue"));
        assertThrows(IllegalArgumentException.class, () -> DocumentPath.compile("$.Jobs[?(@.euser==alice)]"));
        assertThrows(IllegalArgumentException.class, () -> DocumentPath.compile("$.Jobs[\"a\""));
        assertThrows(IllegalArgumentException.class, () -> DocumentPath.compile("$."));
    }

    private JsonNode single(String path) {
        List<JsonNode> matches = DocumentPath.compile(path).select(document);
        assertEquals(1, matches.size(), path);
        return matches.get(0);
    }

    private List<String> texts(String path) {
        return DocumentPath.compile(path).select(document).stream()
                .map(JsonNode::asText)
                .collect(Collectors.toList());
    }
}
