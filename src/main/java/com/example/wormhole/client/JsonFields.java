package com.example.wormhole.client;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Optional-field readers for platform API payloads.
 */
final class JsonFields {
    private JsonFields() {}

    static boolean isAbsent(JsonNode node) {
        return node == null || node.isMissingNode() || node.isNull();
    }

    static String text(JsonNode node) {
        return isAbsent(node) ? "" : node.asText();
    }

    static String nullableText(JsonNode node) {
        if (isAbsent(node)) {
            return null;
        }
        String value = node.asText();
        return value.isEmpty() ? null : value;
    }

    /** Numbers may arrive as JSON numbers or as strings (YouTube statistics). */
    static Long nullableLong(JsonNode node) {
        if (isAbsent(node)) {
            return null;
        }
        if (node.isNumber()) {
            return node.asLong();
        }
        String raw = node.asText().trim();
        if (raw.isEmpty()) {
            return null;
        }
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    static long longOrZero(JsonNode node) {
        Long value = nullableLong(node);
        return value == null ? 0L : value;
    }
}
