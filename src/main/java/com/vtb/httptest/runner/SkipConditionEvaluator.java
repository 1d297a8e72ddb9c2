package com.vtb.httptest.runner;

/**
 * Evaluates {@code left == right} and {@code left != right} after placeholders have been substituted.
 * Surrounding quotes on either side are ignored. Anything else never holds.
 */
public final class SkipConditionEvaluator {

    private SkipConditionEvaluator() {
    }

    public static boolean holds(String condition) {
        if (condition == null || condition.isBlank()) {
            return false;
        }
        int notEquals = condition.indexOf("!=");
        if (notEquals >= 0) {
            return !operand(condition.substring(0, notEquals)).equals(operand(condition.substring(notEquals + 2)));
        }
        int equals = condition.indexOf("==");
        if (equals >= 0) {
            return operand(condition.substring(0, equals)).equals(operand(condition.substring(equals + 2)));
        }
        return false;
    }

    private static String operand(String raw) {
        String value = raw.trim();
        if (value.length() >= 2) {
            char first = value.charAt(0);
            char last = value.charAt(value.length() - 1);
            if ((first == '"' || first == '\'') && first == last) {
                return value.substring(1, value.length() - 1);
            }
        }
        return value;
    }
}
