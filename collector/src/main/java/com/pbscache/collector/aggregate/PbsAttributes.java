package com.pbscache.collector.aggregate;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Lenient accessors for scheduler attributes, which arrive as numbers or numeric strings.
 */
final class PbsAttributes {
    private PbsAttributes() {
    }

    static int intValue(JsonNode record, String group, String name) {
        JsonNode value = record.path(group).path(name);
        if (value.isNumber()) {
            return value.asInt();
        }
        if (value.isTextual()) {
            return value.asInt(0);
        }
        return 0;
    }

    static boolean has(JsonNode record, String group, String name) {
        JsonNode value = record.path(group).path(name);
        return !value.isMissingNode() && !value.isNull();
    }

    /**
     * @return the text of the attribute, or {@code null} when absent or blank
     */
    static String text(JsonNode record, String group, String name) {
        JsonNode value = group == null ? record.path(name) : record.path(group).path(name);
        if (!value.isValueNode() || value.isNull()) {
            return null;
        }
        String text = value.asText().trim();
        return text.isEmpty() ? null : text;
    }
}
