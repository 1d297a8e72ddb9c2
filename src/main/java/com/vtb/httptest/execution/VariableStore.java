package com.vtb.httptest.execution;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe name to value map for run-scoped variables.
 * <p>
 * Layering at the point of use is environment, then run-supplied, then sequence-local, then values
 * extracted by steps; later layers win.
 */
public class VariableStore {

    private final Map<String, String> values = new ConcurrentHashMap<>();

    public VariableStore() {
    }

    public VariableStore(Map<String, String> initial) {
        setAll(initial);
    }

    public void set(String name, String value) {
        if (name == null) {
            return;
        }
        if (value == null) {
            values.remove(name);
        } else {
            values.put(name, value);
        }
    }

    public void setAll(Map<String, String> variables) {
        if (variables != null) {
            variables.forEach(this::set);
        }
    }

    public String get(String name) {
        return name == null ? null : values.get(name);
    }

    public boolean contains(String name) {
        return name != null && values.containsKey(name);
    }

    public void remove(String name) {
        if (name != null) {
            values.remove(name);
        }
    }

    public void clear() {
        values.clear();
    }

    public int size() {
        return values.size();
    }

    /**
     * Copy of the current contents.
     */
    public Map<String, String> asMap() {
        return new LinkedHashMap<>(values);
    }

    /**
     * Current contents overlaid with the given values; the overlay wins.
     */
    public Map<String, String> mergedWith(Map<String, String> overlay) {
        return layer(values, overlay);
    }

    /**
     * Loads every variable whose name starts with the prefix, with the prefix stripped.
     * An empty prefix loads nothing, so the whole process environment is never pulled in by accident.
     */
    public int loadFromEnvironment(String prefix, Map<String, String> environment) {
        if (prefix == null || prefix.isEmpty() || environment == null) {
            return 0;
        }
        int loaded = 0;
        for (Map.Entry<String, String> entry : environment.entrySet()) {
            String key = entry.getKey();
            if (key != null && key.startsWith(prefix) && key.length() > prefix.length()) {
                set(key.substring(prefix.length()), entry.getValue());
                loaded++;
            }
        }
        return loaded;
    }

    /**
     * Merges maps from lowest to highest precedence. Null maps and null values are skipped.
     */
    @SafeVarargs
    public static Map<String, String> layer(Map<String, String>... layers) {
        Map<String, String> merged = new LinkedHashMap<>();
        for (Map<String, String> layer : layers) {
            if (layer == null) {
                continue;
            }
            layer.forEach((k, v) -> {
                if (k != null && v != null) {
                    merged.put(k, v);
                }
            });
        }
        return merged;
    }
}
