package com.vtb.httptest.snapshot;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.vtb.httptest.models.BodyDiff;
import com.vtb.httptest.models.JsonDiff;
import com.vtb.httptest.models.TypeDiff;
import com.vtb.httptest.models.ValueDiff;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;

/**
 * JSON bodies: re-indented on save, compared structurally on mismatch.
 * <p>
 * Paths in the structural diff use {@code a.b} for fields and {@code a[2]} for array elements.
 * Arrays are compared index by index up to the shorter length; a length mismatch is recorded
 * as a value difference at the array path ({@code array[3]} vs {@code array[2]}).
 */
@Slf4j
public class JsonFormatter implements ResponseFormatter {

    private final ObjectMapper mapper;

    public JsonFormatter() {
        this.mapper = new ObjectMapper();
        this.mapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.mapper.enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
        this.mapper.setNodeFactory(JsonNodeFactory.withExactBigDecimals(true));
    }

    @Override
    public String format(byte[] body) {
        if (body == null || body.length == 0) {
            return "{}";
        }
        try {
            JsonNode node = mapper.readTree(body);
            if (node == null || node.isMissingNode()) {
                return "{}";
            }
            return mapper.writeValueAsString(node);
        } catch (IOException e) {
            log.warn("Body is not valid JSON, storing it verbatim: {}", e.getMessage());
            return new String(body, StandardCharsets.UTF_8);
        }
    }

    @Override
    public BodyDiff compare(String expected, String actual) {
        String exp = expected != null ? expected : "";
        String act = actual != null ? actual : "";
        BodyDiff.BodyDiffBuilder result = BodyDiff.builder()
            .contentType("application/json")
            .expectedSize(exp.getBytes(StandardCharsets.UTF_8).length)
            .actualSize(act.getBytes(StandardCharsets.UTF_8).length)
            .expectedContent(exp)
            .actualContent(act);
        if (exp.equals(act)) {
            return result.equal(true).build();
        }

        JsonNode expectedNode = parse(exp);
        JsonNode actualNode = parse(act);
        if (expectedNode == null || actualNode == null) {
            return result.equal(false).diffContent(TextDiffs.unified(exp, act)).build();
        }

        JsonDiff jsonDiff = diff(expectedNode, actualNode);
        return result
            .equal(jsonDiff.isEqual())
            .jsonDiff(jsonDiff)
            .diffContent(jsonDiff.isEqual() ? null : TextDiffs.unified(exp, act))
            .build();
    }

    /**
     * Structural diff of two parsed documents.
     */
    public JsonDiff diff(JsonNode expected, JsonNode actual) {
        JsonDiff jsonDiff = JsonDiff.builder().build();
        compareNodes("", expected, actual, jsonDiff);
        jsonDiff.setEqual(!jsonDiff.hasDifferences());
        return jsonDiff;
    }

    private void compareNodes(String path, JsonNode expected, JsonNode actual, JsonDiff diff) {
        if (expected.isObject()) {
            if (!actual.isObject()) {
                diff.getDifferentTypes().put(path, new TypeDiff("object", typeName(actual)));
                return;
            }
            Iterator<Map.Entry<String, JsonNode>> fields = expected.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                String fieldPath = child(path, field.getKey());
                JsonNode actualValue = actual.get(field.getKey());
                if (actualValue == null) {
                    diff.getMissingFields().put(fieldPath, toValue(field.getValue()));
                } else {
                    compareNodes(fieldPath, field.getValue(), actualValue, diff);
                }
            }
            Iterator<Map.Entry<String, JsonNode>> actualFields = actual.fields();
            while (actualFields.hasNext()) {
                Map.Entry<String, JsonNode> field = actualFields.next();
                if (!expected.has(field.getKey())) {
                    diff.getExtraFields().put(child(path, field.getKey()), toValue(field.getValue()));
                }
            }
            return;
        }
        if (expected.isArray()) {
            if (!actual.isArray()) {
                diff.getDifferentTypes().put(path, new TypeDiff("array", typeName(actual)));
                return;
            }
            if (expected.size() != actual.size()) {
                diff.getDifferentValues().put(path,
                    new ValueDiff("array[" + expected.size() + "]", "array[" + actual.size() + "]"));
            }
            int shorter = Math.min(expected.size(), actual.size());
            for (int i = 0; i < shorter; i++) {
                compareNodes(path + "[" + i + "]", expected.get(i), actual.get(i), diff);
            }
            return;
        }
        String expectedType = typeName(expected);
        String actualType = typeName(actual);
        if (!expectedType.equals(actualType)) {
            diff.getDifferentTypes().put(path, new TypeDiff(expectedType, actualType));
            return;
        }
        if (!scalarEquals(expected, actual)) {
            diff.getDifferentValues().put(path, new ValueDiff(toValue(expected), toValue(actual)));
        }
    }

    private static boolean scalarEquals(JsonNode expected, JsonNode actual) {
        if (expected.isNumber() && actual.isNumber()) {
            return expected.decimalValue().compareTo(actual.decimalValue()) == 0;
        }
        return expected.equals(actual);
    }

    static String typeName(JsonNode node) {
        if (node == null || node.isNull()) {
            return "null";
        }
        if (node.isObject()) {
            return "object";
        }
        if (node.isArray()) {
            return "array";
        }
        if (node.isTextual()) {
            return "string";
        }
        if (node.isNumber()) {
            return "number";
        }
        if (node.isBoolean()) {
            return "boolean";
        }
        return node.getNodeType().name().toLowerCase(Locale.ROOT);
    }

    private Object toValue(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isTextual()) {
            return node.textValue();
        }
        if (node.isNumber()) {
            return node.numberValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        return mapper.convertValue(node, Object.class);
    }

    private static String child(String path, String key) {
        return path.isEmpty() ? key : path + "." + key;
    }

    private JsonNode parse(String text) {
        try {
            JsonNode node = mapper.readTree(text);
            return node == null || node.isMissingNode() ? null : node;
        } catch (JsonProcessingException e) {
            return null;
        }
    }
}
