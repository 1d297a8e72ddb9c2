package com.vtb.httptest.runner;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vtb.httptest.exceptions.AssertionEvaluationException;
import com.vtb.httptest.models.AssertionResult;
import com.vtb.httptest.models.HttpResponse;
import com.vtb.httptest.models.TestAssertion;
import com.vtb.httptest.util.JsonPaths;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Evaluates declarative assertions against a response.
 * <p>
 * A value that cannot be found (missing JSON path, absent header) counts as absent: {@code exists}
 * fails, {@code notExists} and {@code null} pass, comparisons fail. Problems with the assertion itself
 * raise {@link AssertionEvaluationException}.
 */
public class AssertionEvaluator {

    private final ObjectMapper mapper = new ObjectMapper();

    public List<AssertionResult> evaluate(HttpResponse response, List<TestAssertion> assertions)
        throws AssertionEvaluationException {
        List<AssertionResult> results = new ArrayList<>();
        if (assertions == null) {
            return results;
        }
        for (TestAssertion assertion : assertions) {
            results.add(evaluate(response, assertion));
        }
        return results;
    }

    public AssertionResult evaluate(HttpResponse response, TestAssertion assertion) throws AssertionEvaluationException {
        String type = assertion.getType() != null ? assertion.getType().toLowerCase(Locale.ROOT) : "";
        String actual = actualValue(response, assertion);
        boolean not = assertion.isNot();
        boolean ignoreCase = assertion.isIgnoreCase();
        String expected = assertion.getValue();

        AssertionResult.AssertionResultBuilder result = AssertionResult.builder()
            .type(assertion.getType())
            .source(assertion.getSource())
            .path(assertion.getPath())
            .actual(actual)
            .expected(expected);

        boolean outcome;
        String message;
        switch (type) {
            case "equals" -> {
                outcome = actual != null && (ignoreCase ? actual.equalsIgnoreCase(expected) : actual.equals(expected));
                message = not ? "Expected value to not equal '" + expected + "'"
                    : "Expected '" + expected + "', got '" + actual + "'";
            }
            case "contains" -> {
                outcome = actual != null && expected != null && (ignoreCase
                    ? actual.toLowerCase(Locale.ROOT).contains(expected.toLowerCase(Locale.ROOT))
                    : actual.contains(expected));
                message = not ? "Expected value to not contain '" + expected + "'"
                    : "Expected to contain '" + expected + "', got '" + actual + "'";
            }
            case "matches" -> {
                Pattern pattern = compile(expected, ignoreCase);
                outcome = actual != null && pattern.matcher(actual).find();
                message = not ? "Expected value to not match pattern '" + expected + "'"
                    : "Expected to match pattern '" + expected + "', got '" + actual + "'";
            }
            case "exists" -> {
                outcome = actual != null && !actual.isEmpty();
                message = not ? "Expected value to not exist" : "Expected value to exist";
            }
            case "notexists" -> {
                outcome = actual == null || actual.isEmpty();
                message = not ? "Expected value to exist" : "Expected value to not exist, got '" + actual + "'";
            }
            case "in" -> {
                List<String> values = assertion.getValues() != null ? assertion.getValues() : List.of();
                result.expected(String.join(", ", values));
                outcome = actual != null && values.stream()
                    .anyMatch(v -> ignoreCase ? v.equalsIgnoreCase(actual) : v.equals(actual));
                message = not ? "Expected value to not be one of [" + String.join(", ", values) + "]"
                    : "Expected value to be one of [" + String.join(", ", values) + "], got '" + actual + "'";
            }
            case "lessthan", "lt" -> {
                BigDecimal limit = number(expected, "expected value");
                outcome = actual != null && number(actual, "actual value").compareTo(limit) < 0;
                message = not ? "Expected value to not be less than " + expected
                    : "Expected value to be less than " + expected + ", got " + actual;
            }
            case "greaterthan", "gt" -> {
                BigDecimal limit = number(expected, "expected value");
                outcome = actual != null && number(actual, "actual value").compareTo(limit) > 0;
                message = not ? "Expected value to not be greater than " + expected
                    : "Expected value to be greater than " + expected + ", got " + actual;
            }
            case "null", "nil" -> {
                outcome = actual == null || actual.isEmpty() || "null".equals(actual);
                message = not ? "Expected value to not be null" : "Expected null, got '" + actual + "'";
            }
            default -> throw new AssertionEvaluationException("Unsupported assertion type: " + assertion.getType());
        }

        boolean succeeded = outcome != not;
        return result
            .succeeded(succeeded)
            .message(succeeded ? null : message)
            .build();
    }

    /**
     * String form of the asserted value, or {@code null} when it is absent.
     */
    String actualValue(HttpResponse response, TestAssertion assertion) throws AssertionEvaluationException {
        String source = assertion.getSource() != null ? assertion.getSource().toLowerCase(Locale.ROOT) : "body";
        String path = assertion.getPath();
        switch (source) {
            case "body" -> {
                if (path == null || path.isEmpty()) {
                    return response.bodyAsString();
                }
                JsonNode root;
                try {
                    root = mapper.readTree(response.bodyAsString());
                } catch (IOException e) {
                    return null;
                }
                try {
                    JsonNode node = JsonPaths.find(root, path);
                    return node == null || node.isMissingNode() ? null : JsonPaths.asText(node);
                } catch (IllegalArgumentException e) {
                    throw new AssertionEvaluationException(e.getMessage(), e);
                }
            }
            case "header" -> {
                if (path == null || path.isEmpty()) {
                    throw new AssertionEvaluationException("Header name (path) is required for header assertions");
                }
                return response.header(path);
            }
            case "status" -> {
                return String.valueOf(response.getStatusCode());
            }
            case "contenttype" -> {
                return response.getContentType();
            }
            default -> throw new AssertionEvaluationException("Unsupported assertion source: " + assertion.getSource());
        }
    }

    private static Pattern compile(String regex, boolean ignoreCase) throws AssertionEvaluationException {
        if (regex == null) {
            throw new AssertionEvaluationException("Pattern is required for 'matches'");
        }
        try {
            return ignoreCase ? Pattern.compile(regex, Pattern.CASE_INSENSITIVE) : Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            throw new AssertionEvaluationException("Invalid regex pattern: " + regex, e);
        }
    }

    private static BigDecimal number(String value, String what) throws AssertionEvaluationException {
        try {
            return new BigDecimal(value.trim());
        } catch (NumberFormatException | NullPointerException e) {
            throw new AssertionEvaluationException("The " + what + " is not a number: " + value, e);
        }
    }
}
