package com.vtb.httptest.runner;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vtb.httptest.exceptions.VariableExtractionException;
import com.vtb.httptest.models.HttpResponse;
import com.vtb.httptest.models.VariableExtraction;
import com.vtb.httptest.util.JsonPaths;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Pulls named values out of responses.
 * <p>
 * A required variable that cannot be extracted fails the whole call. Optional ones fall back to their
 * default, or are left out when there is none.
 */
@Slf4j
public class VariableExtractor {

    private final ObjectMapper mapper = new ObjectMapper();

    public Map<String, String> extract(HttpResponse response, List<VariableExtraction> extractions)
        throws VariableExtractionException {
        Map<String, String> values = new LinkedHashMap<>();
        if (extractions == null) {
            return values;
        }
        for (VariableExtraction extraction : extractions) {
            try {
                values.put(extraction.getName(), extractValue(response, extraction));
            } catch (VariableExtractionException e) {
                if (extraction.isRequired()) {
                    throw new VariableExtractionException(
                        "Required variable '" + extraction.getName() + "' not extracted: " + e.getMessage(), e);
                }
                if (extraction.getDefaultValue() != null) {
                    values.put(extraction.getName(), extraction.getDefaultValue());
                } else {
                    log.debug("Optional variable '{}' skipped: {}", extraction.getName(), e.getMessage());
                }
            }
        }
        return values;
    }

    public String extractValue(HttpResponse response, VariableExtraction extraction)
        throws VariableExtractionException {
        String source = extraction.getSource() != null ? extraction.getSource().toLowerCase(Locale.ROOT) : "body";
        return switch (source) {
            case "body" -> fromBody(response, extraction);
            case "header" -> fromHeader(response, extraction);
            case "status" -> String.valueOf(response.getStatusCode());
            default -> throw new VariableExtractionException("Unsupported extraction source: " + extraction.getSource());
        };
    }

    private String fromBody(HttpResponse response, VariableExtraction extraction) throws VariableExtractionException {
        String body = response.bodyAsString();
        if (hasText(extraction.getPath())) {
            JsonNode root;
            try {
                root = mapper.readTree(body);
            } catch (IOException e) {
                throw new VariableExtractionException("Body is not valid JSON", e);
            }
            JsonNode node;
            try {
                node = JsonPaths.find(root, extraction.getPath());
            } catch (IllegalArgumentException e) {
                throw new VariableExtractionException(e.getMessage(), e);
            }
            if (node == null || node.isMissingNode()) {
                throw new VariableExtractionException("Path not found: " + extraction.getPath());
            }
            String value = JsonPaths.asText(node);
            return hasText(extraction.getRegexp()) ? applyRegexp(value, extraction.getRegexp()) : value;
        }
        if (hasText(extraction.getRegexp())) {
            return applyRegexp(body, extraction.getRegexp());
        }
        return body;
    }

    private String fromHeader(HttpResponse response, VariableExtraction extraction) throws VariableExtractionException {
        if (!hasText(extraction.getPath())) {
            throw new VariableExtractionException("Header name (path) is required for header extraction");
        }
        String value = response.header(extraction.getPath());
        if (value == null) {
            throw new VariableExtractionException("Header not found: " + extraction.getPath());
        }
        return hasText(extraction.getRegexp()) ? applyRegexp(value, extraction.getRegexp()) : value;
    }

    /**
     * First capture group when the pattern has one, otherwise the whole match.
     */
    static String applyRegexp(String input, String regexp) throws VariableExtractionException {
        Matcher matcher;
        try {
            matcher = Pattern.compile(regexp).matcher(input);
        } catch (PatternSyntaxException e) {
            throw new VariableExtractionException("Invalid regular expression: " + regexp, e);
        }
        if (!matcher.find()) {
            throw new VariableExtractionException("No match for " + regexp);
        }
        return matcher.groupCount() >= 1 && matcher.group(1) != null ? matcher.group(1) : matcher.group();
    }

    private static boolean hasText(String value) {
        return value != null && !value.isEmpty();
    }
}
