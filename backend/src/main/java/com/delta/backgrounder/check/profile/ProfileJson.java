package com.delta.backgrounder.check.profile;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Field access for third-party profile payloads, which disagree on key names.
 */
final class ProfileJson {
    private ProfileJson() {
    }

    /**
     * Text of the first key present with a non-blank value, or null.
     */
    static String text(JsonNode node, String... keys) {
        for (String key : keys) {
            JsonNode value = node.path(key);
            if (value.isValueNode() && !value.isNull()) {
                String text = value.asText("").trim();
                if (!text.isEmpty()) {
                    return text;
                }
            }
        }
        return null;
    }

    /**
     * First key holding an array, or an empty node.
     */
    static JsonNode array(JsonNode node, String... keys) {
        for (String key : keys) {
            JsonNode value = node.path(key);
            if (value.isArray()) {
                return value;
            }
        }
        return node.path(keys[0]);
    }

    static List<String> names(JsonNode items) {
        List<String> names = new ArrayList<>();
        for (JsonNode item : items) {
            String value = item.isObject() ? text(item, "name") : item.asText("");
            if (value != null && !value.isBlank()) {
                names.add(value);
            }
        }
        return names;
    }
}
