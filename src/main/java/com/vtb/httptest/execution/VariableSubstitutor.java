package com.vtb.httptest.execution;

import com.vtb.httptest.models.AuthDescriptor;
import com.vtb.httptest.models.HttpHeader;
import com.vtb.httptest.models.HttpRequest;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Replaces {@code {{name}}} and {@code ${name}} placeholders in request text.
 * <p>
 * Unknown names are left untouched. Replacement is a single pass, so values that themselves look like
 * placeholders are not expanded again.
 */
public class VariableSubstitutor {

    public enum PlaceholderSyntax {
        DOUBLE_BRACE("\\{\\{\\s*([^{}]+?)\\s*}}"),
        DOLLAR_BRACE("\\$\\{\\s*([^{}]+?)\\s*}");

        private final String regex;

        PlaceholderSyntax(String regex) {
            this.regex = regex;
        }
    }

    private final Pattern pattern;
    private final int groups;

    public VariableSubstitutor() {
        this(EnumSet.allOf(PlaceholderSyntax.class));
    }

    public VariableSubstitutor(Set<PlaceholderSyntax> syntaxes) {
        if (syntaxes == null || syntaxes.isEmpty()) {
            throw new IllegalArgumentException("At least one placeholder syntax is required");
        }
        this.pattern = Pattern.compile(syntaxes.stream()
            .map(s -> s.regex)
            .collect(Collectors.joining("|")));
        this.groups = syntaxes.size();
    }

    public String substitute(String text, Map<String, String> variables) {
        if (text == null || text.isEmpty() || variables == null || variables.isEmpty()) {
            return text;
        }
        Matcher matcher = pattern.matcher(text);
        return matcher.replaceAll(match -> {
            String value = variables.get(keyOf(match));
            return Matcher.quoteReplacement(value != null ? value : match.group());
        });
    }

    /**
     * Returns a substituted copy of the request. URL, header names and values, body and auth value
     * are substituted independently with the same mapping. The path template is kept as-is.
     */
    public HttpRequest substitute(HttpRequest request, Map<String, String> variables) {
        if (request == null) {
            return null;
        }
        List<HttpHeader> headers = new ArrayList<>();
        if (request.getHeaders() != null) {
            for (HttpHeader header : request.getHeaders()) {
                headers.add(new HttpHeader(
                    substitute(header.getName(), variables),
                    substitute(header.getValue(), variables)));
            }
        }
        AuthDescriptor auth = request.getAuth();
        if (auth != null) {
            auth = new AuthDescriptor(auth.getType(), substitute(auth.getValue(), variables));
        }
        return request.toBuilder()
            .url(substitute(request.getUrl(), variables))
            .clearHeaders()
            .headers(headers)
            .body(substitute(request.getBody(), variables))
            .auth(auth)
            .build();
    }

    /**
     * Names referenced by placeholders in the text, in order of first appearance.
     */
    public List<String> placeholders(String text) {
        if (text == null || text.isEmpty()) {
            return Collections.emptyList();
        }
        Set<String> names = new LinkedHashSet<>();
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            names.add(keyOf(matcher));
        }
        return new ArrayList<>(names);
    }

    public boolean hasPlaceholders(String text) {
        return text != null && pattern.matcher(text).find();
    }

    private String keyOf(MatchResult match) {
        for (int i = 1; i <= groups; i++) {
            String group = match.group(i);
            if (group != null) {
                return group.trim();
            }
        }
        return match.group();
    }
}
