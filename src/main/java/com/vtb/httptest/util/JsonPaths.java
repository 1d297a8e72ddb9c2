package com.vtb.httptest.util;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Minimal JSON path navigation over Jackson trees.
 * <p>
 * Supported forms: {@code a.b.c}, {@code items[0].id}, {@code [1]}, {@code items.0.id} and an optional
 * leading {@code $} or {@code $.}.
 */
public final class JsonPaths {

    private JsonPaths() {
    }

    /**
     * Node at the path, or {@code null} when any segment is absent. A JSON {@code null} comes back
     * as a {@link com.fasterxml.jackson.databind.node.NullNode}.
     *
     * @throws IllegalArgumentException for malformed paths
     */
    public static JsonNode find(JsonNode root, String path) {
        if (root == null) {
            return null;
        }
        JsonNode current = root;
        for (Object token : tokenize(path)) {
            if (current == null) {
                return null;
            }
            if (token instanceof Integer index) {
                current = current.isArray() && index < current.size() ? current.get(index) : null;
            } else {
                String field = (String) token;
                if (current.isObject()) {
                    current = current.get(field);
                } else if (current.isArray() && isDigits(field)) {
                    int index = Integer.parseInt(field);
                    current = index < current.size() ? current.get(index) : null;
                } else {
                    current = null;
                }
            }
        }
        return current;
    }

    /**
     * String form used for variables and assertions: text as-is, numbers without trailing zeros,
     * {@code true}/{@code false}, {@code null}, containers as compact JSON.
     */
    public static String asText(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return "null";
        }
        if (node.isTextual()) {
            return node.textValue();
        }
        if (node.isIntegralNumber()) {
            return node.bigIntegerValue().toString();
        }
        if (node.isNumber()) {
            return node.decimalValue().stripTrailingZeros().toPlainString();
        }
        if (node.isBoolean()) {
            return String.valueOf(node.booleanValue());
        }
        return node.toString();
    }

    static List<Object> tokenize(String path) {
        List<Object> tokens = new ArrayList<>();
        if (path == null) {
            return tokens;
        }
        String p = path.trim();
        if (p.startsWith("$")) {
            p = p.substring(1);
        }
        StringBuilder name = new StringBuilder();
        for (int i = 0; i < p.length(); i++) {
            char c = p.charAt(i);
            if (c == '.') {
                flush(name, tokens);
            } else if (c == '[') {
                flush(name, tokens);
                int close = p.indexOf(']', i);
                if (close < 0) {
                    throw new IllegalArgumentException("Unclosed '[' in path: " + path);
                }
                String inner = p.substring(i + 1, close).trim();
                if (inner.length() >= 2 && (inner.startsWith("'") || inner.startsWith("\""))) {
                    tokens.add(inner.substring(1, inner.length() - 1));
                } else {
                    try {
                        tokens.add(Integer.parseInt(inner));
                    } catch (NumberFormatException e) {
                        throw new IllegalArgumentException("Invalid array index '" + inner + "' in path: " + path, e);
                    }
                }
                i = close;
            } else {
                name.append(c);
            }
        }
        flush(name, tokens);
        return tokens;
    }

    private static void flush(StringBuilder name, List<Object> tokens) {
        if (name.length() > 0) {
            tokens.add(name.toString());
            name.setLength(0);
        }
    }

    private static boolean isDigits(String value) {
        if (value.isEmpty()) {
            return false;
        }
        for (int i = 0; i < value.length(); i++) {
            if (!Character.isDigit(value.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
