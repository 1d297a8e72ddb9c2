package com.vtb.httptest.runner;

import com.vtb.httptest.exceptions.VariableExtractionException;
import com.vtb.httptest.models.HttpResponse;
import com.vtb.httptest.models.VariableExtraction;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class VariableExtractorTest {

    private final VariableExtractor extractor = new VariableExtractor();

    private static HttpResponse response() {
        Map<String, List<String>> headers = new LinkedHashMap<>();
        headers.put("Location", List.of("/users/42"));
        headers.put("X-Request-Id", List.of("req-7"));
        return HttpResponse.builder()
            .statusCode(201)
            .headers(headers)
            .contentType("application/json")
            .body("{\"data\":{\"items\":[{\"id\":42,\"email\":\"ann@example.com\"}],\"active\":true}}"
                .getBytes(StandardCharsets.UTF_8))
            .build();
    }

    @Test
    void extractsFromBodyHeaderAndStatus() throws Exception {
        Map<String, String> values = extractor.extract(response(), List.of(
            VariableExtraction.builder().name("userId").source("body").path("data.items[0].id").build(),
            VariableExtraction.builder().name("domain").path("data.items[0].email").regexp("@(.+)$").build(),
            VariableExtraction.builder().name("active").path("data.active").build(),
            VariableExtraction.builder().name("location").source("header").path("location").regexp("/users/(\\d+)").build(),
            VariableExtraction.builder().name("status").source("status").build()));

        assertEquals("42", values.get("userId"));
        assertEquals("example.com", values.get("domain"));
        assertEquals("true", values.get("active"));
        assertEquals("42", values.get("location"));
        assertEquals("201", values.get("status"));
    }

    @Test
    void wholeBodyAndRegexpWithoutGroup() throws Exception {
        HttpResponse response = response();
        assertEquals(response.bodyAsString(),
            extractor.extractValue(response, VariableExtraction.builder().name("raw").build()));
        assertEquals("ann@example.com", extractor.extractValue(response,
            VariableExtraction.builder().name("mail").regexp("[a-z]+@[a-z.]+").build()));
    }

    @Test
    void optionalFailuresUseDefaultOrAreOmitted() throws Exception {
        Map<String, String> values = extractor.extract(response(), List.of(
            VariableExtraction.builder().name("token").path("auth.token").defaultValue("none").build(),
            VariableExtraction.builder().name("missing").source("header").path("X-Missing").build()));

        assertEquals("none", values.get("token"));
        assertFalse(values.containsKey("missing"));
    }

    @Test
    void requiredFailureThrows() {
        VariableExtractionException error = assertThrows(VariableExtractionException.class,
            () -> extractor.extract(response(), List.of(
                VariableExtraction.builder().name("token").path("auth.token").required(true).build())));
        assertTrue(error.getMessage().contains("token"));
    }

    @Test
    void invalidRegexpIsAnExtractionError() {
        assertThrows(VariableExtractionException.class,
            () -> extractor.extractValue(response(), VariableExtraction.builder().name("x").regexp("(").build()));
        assertThrows(VariableExtractionException.class,
            () -> extractor.extractValue(response(), VariableExtraction.builder().name("x").source("cookie").build()));
    }
}
