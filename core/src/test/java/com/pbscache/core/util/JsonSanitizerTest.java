package com.pbscache.core.util;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pbscache.core.error.IngestionException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class JsonSanitizerTest {

    private static final String VALID = String.join("\n",
            "{",
            "  \"Jobs\": {",
            "    \"1.srv\": {",
            "      \"Job_Name\": \"ok\",",
            "      \"job_state\": \"R\"",
            "    }",
            "  }",
            "}");

    private static final String ONE_BAD_LINE = String.join("\n",
            "{",
            "  \"Jobs\": {",
            "    \"1.srv\": {",
            "      \"Job_Name\": \"ok\",",
            "      \"Variable_List\": \"PATH=/bin,MSG=\"hello\"\",",
            "      \"job_state\": \"R\"",
            "    }",
            "  }",
            "}");

    @Test
    void validInputIsParsedUnchanged() {
        JsonSanitizer.Result result = JsonSanitizer.repair("job", VALID);

        assertEquals(0, result.getDroppedLines());
        assertEquals("R", result.getDocument().at("/Jobs/1.srv/job_state").asText());
    }

    @Test
    void malformedLineIsDropped() {
        JsonSanitizer.Result result = JsonSanitizer.repair("job", ONE_BAD_LINE);

        assertEquals(1, result.getDroppedLines());
        assertEquals(JsonUtils.readTree(VALID), result.getDocument());
        assertFalse(result.getDocument().at("/Jobs/1.srv").has("Variable_List"));
    }

    @Test
    void severalMalformedLinesAreDropped() {
        String text = String.join("\n",
                "{",
                "  \"Queue\": {",
                "    \"workq\": {",
                "      \"comment\": \"say \"hi\"\",",
                "      \"queue_type\": \"Execution\",",
                "      \"note\": \"a\"b\",",
                "      \"enabled\": \"True\"",
                "    }",
                "  }",
                "}");

        ObjectNode doc = JsonSanitizer.parse("queue", text);

        assertEquals("Execution", doc.at("/Queue/workq/queue_type").asText());
        assertEquals("True", doc.at("/Queue/workq/enabled").asText());
        assertEquals(2, doc.at("/Queue/workq").size());
    }

    @Test
    void truncatedOutputFailsInsteadOfLooping() {
        String text = "{\n  \"nodes\": {\n    \"cn01\": {\n";

        IngestionException e = assertThrows(IngestionException.class,
                () -> JsonSanitizer.parse("node", text));
        assertTrue(e.getMessage().startsWith("unparseable scheduler output from node"));
    }

    @Test
    void garbageFails() {
        assertThrows(IngestionException.class,
                () -> JsonSanitizer.parse("server", "qstat: cannot connect to server pbs01 (errno=111)"));
    }

    @Test
    void emptyOutputFails() {
        assertThrows(IngestionException.class, () -> JsonSanitizer.parse("server", ""));
        assertThrows(IngestionException.class, () -> JsonSanitizer.parse("server", null));
    }

    @Test
    void nonObjectTopLevelFails() {
        assertThrows(IngestionException.class, () -> JsonSanitizer.parse("server", "[1, 2, 3]"));
    }
}
