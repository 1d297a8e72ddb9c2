package com.vtb.httptest.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonPathsTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void navigatesObjectsAndArrays() throws Exception {
        JsonNode root = mapper.readTree("{\"data\":{\"items\":[{\"id\":7},{\"id\":8}],\"odd key\":true}}");

        assertEquals(7, JsonPaths.find(root, "data.items[0].id").intValue());
        assertEquals(8, JsonPaths.find(root, "$.data.items.1.id").intValue());
        assertTrue(JsonPaths.find(root, "data['odd key']").booleanValue());
        assertEquals(2, JsonPaths.find(root, "data.items").size());
        assertSame(root, JsonPaths.find(root, "$"));
    }

    @Test
    void absentSegmentsGiveNull() throws Exception {
        JsonNode root = mapper.readTree("{\"a\":{\"b\":null},\"list\":[1]}");

        assertNull(JsonPaths.find(root, "a.c"));
        assertNull(JsonPaths.find(root, "list[3]"));
        assertNull(JsonPaths.find(root, "a.b.c"));
        assertTrue(JsonPaths.find(root, "a.b").isNull());
        assertNull(JsonPaths.find(null, "a"));
    }

    @Test
    void malformedPathsAreRejected() throws Exception {
        JsonNode root = mapper.readTree("{}");

        assertThrows(IllegalArgumentException.class, () -> JsonPaths.find(root, "items[0"));
        assertThrows(IllegalArgumentException.class, () -> JsonPaths.find(root, "items[x]"));
    }

    @Test
    void textForms() throws Exception {
        JsonNode root = mapper.readTree("{\"s\":\"x\",\"i\":12,\"d\":1.50,\"b\":false,\"n\":null,\"o\":{\"k\":1}}");

        assertEquals("x", JsonPaths.asText(root.get("s")));
        assertEquals("12", JsonPaths.asText(root.get("i")));
        assertEquals("1.5", JsonPaths.asText(root.get("d")));
        assertEquals("false", JsonPaths.asText(root.get("b")));
        assertEquals("null", JsonPaths.asText(root.get("n")));
        assertEquals("{\"k\":1}", JsonPaths.asText(root.get("o")));
    }

    @Test
    void tokenizesMixedForms() {
        assertEquals(List.of("a", 0, "b", "c d"), JsonPaths.tokenize("$.a[0].b[\"c d\"]"));
    }
}
