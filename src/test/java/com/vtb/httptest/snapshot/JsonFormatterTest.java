package com.vtb.httptest.snapshot;

import com.vtb.httptest.models.BodyDiff;
import com.vtb.httptest.models.JsonDiff;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class JsonFormatterTest {

    private final JsonFormatter formatter = new JsonFormatter();

    private BodyDiff compareRaw(String expected, String actual) {
        return formatter.compare(
            formatter.format(expected.getBytes(StandardCharsets.UTF_8)),
            formatter.format(actual.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void reportsMissingAndExtraFields() {
        BodyDiff diff = compareRaw("{\"a\":1,\"b\":2}", "{\"a\":1,\"c\":3}");

        assertFalse(diff.isEqual());
        JsonDiff json = diff.getJsonDiff();
        assertEquals(1, json.getMissingFields().size());
        assertEquals(2, ((Number) json.getMissingFields().get("b")).intValue());
        assertEquals(1, json.getExtraFields().size());
        assertEquals(3, ((Number) json.getExtraFields().get("c")).intValue());
        assertTrue(json.getDifferentTypes().isEmpty());
        assertTrue(json.getDifferentValues().isEmpty());
        assertNotNull(diff.getDiffContent());
    }

    @Test
    void diffIsSymmetric() {
        JsonDiff forward = compareRaw("{\"a\":1,\"b\":2}", "{\"a\":1,\"c\":3}").getJsonDiff();
        JsonDiff backward = compareRaw("{\"a\":1,\"c\":3}", "{\"a\":1,\"b\":2}").getJsonDiff();

        assertEquals(forward.getMissingFields().keySet(), backward.getExtraFields().keySet());
        assertEquals(forward.getExtraFields().keySet(), backward.getMissingFields().keySet());
    }

    @Test
    void keyOrderAndWhitespaceDoNotMatter() {
        BodyDiff diff = compareRaw("{\"a\":1,\"b\":{\"c\":[1,2]}}", "{ \"b\" : { \"c\" : [1, 2] }, \"a\" : 1 }");

        assertTrue(diff.isEqual());
        assertNull(diff.getDiffContent());
    }

    @Test
    void detectsTypeAndValueChangesInNestedArrays() {
        BodyDiff diff = compareRaw(
            "{\"user\":{\"roles\":[{\"name\":\"admin\"},{\"name\":\"dev\"}],\"age\":30}}",
            "{\"user\":{\"roles\":[{\"name\":\"owner\"}],\"age\":\"30\"}}");

        JsonDiff json = diff.getJsonDiff();
        assertEquals("admin", json.getDifferentValues().get("user.roles[0].name").getExpected());
        assertEquals("owner", json.getDifferentValues().get("user.roles[0].name").getActual());
        assertEquals("array[2]", json.getDifferentValues().get("user.roles").getExpected());
        assertEquals("array[1]", json.getDifferentValues().get("user.roles").getActual());
        assertEquals("number", json.getDifferentTypes().get("user.age").getExpectedType());
        assertEquals("string", json.getDifferentTypes().get("user.age").getActualType());
    }

    @Test
    void numbersCompareByValue() {
        assertTrue(compareRaw("{\"price\":1.0}", "{\"price\":1.00}").isEqual());
        assertFalse(compareRaw("{\"price\":1.0}", "{\"price\":1.01}").isEqual());
    }

    @Test
    void emptyAndInvalidBodies() {
        assertEquals("{}", formatter.format(new byte[0]));
        assertEquals("not json", formatter.format("not json".getBytes(StandardCharsets.UTF_8)));

        BodyDiff diff = formatter.compare("not json", "other text");
        assertFalse(diff.isEqual());
        assertNull(diff.getJsonDiff());
        assertNotNull(diff.getDiffContent());
    }

    @Test
    void formatReindentsConsistently() {
        String formatted = formatter.format("{\"a\":{\"b\":1}}".getBytes(StandardCharsets.UTF_8));
        assertEquals(formatted, formatter.format(formatted.getBytes(StandardCharsets.UTF_8)));
        assertTrue(formatted.contains("\n"));
    }
}
