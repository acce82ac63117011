package com.doks.git;

import java.io.IOException;
import java.util.Arrays;

import com.fasterxml.jackson.databind.JsonNode;

final class JsonPaths {
    private JsonPaths() {
    }

    static JsonNode require(JsonNode root, String... path) throws IOException {
        JsonNode current = root;
        for (String node : path) {
            current = current == null ? null : current.get(node);
            if (current == null || current.isNull()) {
                throw new IOException("Path not found: " + Arrays.toString(path));
            }
        }
        return current;
    }

    static JsonNode requireArray(JsonNode root, String... path) throws IOException {
        JsonNode value = require(root, path);
        if (!value.isArray()) {
            throw new IOException("Expected array at path '" + Arrays.toString(path) + "' but found: " + value);
        }
        return value;
    }

    static String requireText(JsonNode root, String... path) throws IOException {
        JsonNode value = require(root, path);
        if (!value.isTextual()) {
            throw new IOException("Expected string at path '" + Arrays.toString(path) + "' but found: " + value);
        }
        return value.asText();
    }
}
