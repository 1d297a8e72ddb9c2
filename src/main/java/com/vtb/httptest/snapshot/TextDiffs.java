package com.vtb.httptest.snapshot;

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;

import java.util.Arrays;
import java.util.List;

/**
 * Unified diffs for snapshot reports.
 */
final class TextDiffs {

    private static final int CONTEXT_LINES = 3;

    private TextDiffs() {
    }

    static String unified(String expected, String actual) {
        List<String> expectedLines = lines(expected);
        List<String> actualLines = lines(actual);
        Patch<String> patch = DiffUtils.diff(expectedLines, actualLines);
        if (patch.getDeltas().isEmpty()) {
            return "";
        }
        List<String> diff = UnifiedDiffUtils.generateUnifiedDiff(
            "expected", "actual", expectedLines, patch, CONTEXT_LINES);
        return String.join("\n", diff);
    }

    private static List<String> lines(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        return Arrays.asList(text.split("\n", -1));
    }
}
