package com.vtb.httptest.execution;

import com.vtb.httptest.models.AuthDescriptor;
import com.vtb.httptest.models.HttpHeader;
import com.vtb.httptest.models.HttpRequest;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class VariableSubstitutorTest {

    private final VariableSubstitutor substitutor = new VariableSubstitutor();

    @Test
    void replacesBothPlaceholderSyntaxes() {
        Map<String, String> vars = Map.of("host", "api.local", "id", "42");

        assertEquals("http://api.local/users/42",
            substitutor.substitute("http://{{host}}/users/${id}", vars));
        assertEquals("api.local", substitutor.substitute("{{ host }}", vars));
    }

    @Test
    void leavesUnknownPlaceholdersUntouched() {
        assertEquals("/users/{{missing}}/${other}",
            substitutor.substitute("/users/{{missing}}/${other}", Map.of("id", "1")));
    }

    @Test
    void substitutionIsIdempotentForPlainValues() {
        Map<String, String> vars = Map.of("a", "x", "b", "y");
        String once = substitutor.substitute("{{a}}-${b}-{{c}}", vars);
        assertEquals(once, substitutor.substitute(once, vars));
    }

    @Test
    void valuesAreInsertedLiterally() {
        Map<String, String> vars = Map.of("price", "$5 \\ each", "nested", "{{price}}");

        assertEquals("cost: $5 \\ each", substitutor.substitute("cost: {{price}}", vars));
        // single pass: a value that looks like a placeholder is not expanded again
        assertEquals("{{price}}", substitutor.substitute("${nested}", vars));
    }

    @Test
    void substitutesRequestCopyAndKeepsTemplate() {
        HttpRequest template = HttpRequest.builder()
            .method("POST")
            .url("{{base}}/users/${userId}")
            .path("/users/{id}")
            .header(new HttpHeader("X-Trace", "{{trace}}"))
            .body("{\"owner\":\"${userId}\"}")
            .auth(new AuthDescriptor("bearer", "{{token}}"))
            .build();

        HttpRequest resolved = substitutor.substitute(template,
            Map.of("base", "http://localhost:8080", "userId", "7", "trace", "t-1", "token", "secret"));

        assertEquals("http://localhost:8080/users/7", resolved.getUrl());
        assertEquals("t-1", resolved.headerValue("x-trace"));
        assertEquals("{\"owner\":\"7\"}", resolved.getBody());
        assertEquals("secret", resolved.getAuth().getValue());
        assertEquals("/users/{id}", resolved.getPath());
        assertEquals("{{base}}/users/${userId}", template.getUrl());
    }

    @Test
    void restrictedSyntaxIgnoresTheOtherForm() {
        VariableSubstitutor braces = new VariableSubstitutor(EnumSet.of(VariableSubstitutor.PlaceholderSyntax.DOUBLE_BRACE));
        assertEquals("1 ${a}", braces.substitute("{{a}} ${a}", Map.of("a", "1")));
        assertThrows(IllegalArgumentException.class, () -> new VariableSubstitutor(EnumSet.noneOf(
            VariableSubstitutor.PlaceholderSyntax.class)));
    }

    @Test
    void listsPlaceholdersInOrder() {
        assertEquals(List.of("b", "a"), substitutor.placeholders("{{b}}/${a}/{{b}}"));
        assertTrue(substitutor.hasPlaceholders("x ${y}"));
        assertFalse(substitutor.hasPlaceholders("plain"));
    }
}
