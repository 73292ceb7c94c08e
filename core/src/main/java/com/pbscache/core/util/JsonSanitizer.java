package com.pbscache.core.util;

import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pbscache.core.error.IngestionException;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Parses scheduler JSON output, dropping lines the scheduler emits malformed.
 * <p>
 * PBS occasionally prints attribute values with unescaped quotes or control characters,
 * which breaks the surrounding JSON. Each time the parser reports a syntax error on a
 * line, that line is removed and parsing is retried, at most once per input line.
 * </p>
 */
public final class JsonSanitizer {
    private static final Logger log = LoggerFactory.getLogger(JsonSanitizer.class);

    private JsonSanitizer() {
    }

    /**
     * @param source label of the query that produced {@code text}, used in logs and errors
     * @param text   raw command output
     * @return the parsed top-level object
     * @throws IngestionException if no object could be parsed within the retry budget
     */
    public static ObjectNode parse(String source, String text) {
        return repair(source, text).getDocument();
    }

    /**
     * Same as {@link #parse} but also reports how many lines had to be dropped.
     */
    public static Result repair(String source, String text) {
        if (text == null || text.isBlank()) {
            throw new IngestionException("unparseable scheduler output from " + source + ": empty output");
        }
        List<String> lines = new ArrayList<>(Arrays.asList(text.split("\n", -1)));
        int budget = lines.size();
        String current = text;
        for (int attempt = 0; attempt <= budget; attempt++) {
            try {
                JsonNode node = JsonUtils.mapper().readTree(current);
                if (node instanceof ObjectNode) {
                    return new Result((ObjectNode) node, attempt);
                }
                throw new IngestionException("unparseable scheduler output from " + source
                        + ": top-level value is not an object");
            } catch (JsonProcessingException e) {
                int lineNr = lineOf(e);
                if (lineNr < 1 || lineNr > lines.size()) {
                    throw new IngestionException("unparseable scheduler output from " + source
                            + ": " + e.getOriginalMessage(), e);
                }
                String dropped = lines.remove(lineNr - 1);
                log.warn("Dropping malformed line {} from {} output: {}", lineNr, source, abbreviate(dropped));
                current = String.join("\n", lines);
            }
        }
        throw new IngestionException("unparseable scheduler output from " + source
                + ": still invalid after removing " + budget + " lines");
    }

    private static int lineOf(JsonProcessingException e) {
        JsonLocation location = e.getLocation();
        return location == null ? -1 : location.getLineNr();
    }

    /**
     * Parsed document and number of dropped lines.
     */
    @Value
    public static class Result {
        ObjectNode document;
        int droppedLines;
    }

    private static String abbreviate(String line) {
        return line.length() <= 200 ? line : line.substring(0, 200) + "...";
    }
}
