package com.vtb.httptest.runner;

import com.vtb.httptest.models.HttpRequest;
import com.vtb.httptest.models.TestFilter;

import java.util.List;
import java.util.Locale;

/**
 * Applies a {@link TestFilter} to requests. A missing or empty filter matches everything.
 */
final class RequestFilter {

    private RequestFilter() {
    }

    static boolean matches(HttpRequest request, TestFilter filter) {
        if (filter == null || filter.isEmpty()) {
            return true;
        }
        if (!filter.getTags().isEmpty()
            && (request.getTag() == null || filter.getTags().stream().noneMatch(t -> t.equalsIgnoreCase(request.getTag())))) {
            return false;
        }
        if (!filter.getMethods().isEmpty()
            && (request.getMethod() == null || filter.getMethods().stream().noneMatch(m -> m.equalsIgnoreCase(request.getMethod())))) {
            return false;
        }
        if (!filter.getPaths().isEmpty()
            && !containsAny(request.getPath(), filter.getPaths()) && !containsAny(request.getUrl(), filter.getPaths())) {
            return false;
        }
        return filter.getNames().isEmpty() || containsAny(request.getName(), filter.getNames());
    }

    private static boolean containsAny(String value, List<String> needles) {
        if (value == null) {
            return false;
        }
        String lower = value.toLowerCase(Locale.ROOT);
        return needles.stream().anyMatch(n -> lower.contains(n.toLowerCase(Locale.ROOT)));
    }
}
