package com.vtb.httptest.snapshot;

import com.vtb.httptest.models.BodyDiff;

import java.util.Arrays;
import java.util.Base64;
import java.util.HexFormat;

/**
 * Fallback for any content type without a dedicated formatter. Bodies are stored as Base64 and never
 * compared structurally.
 */
public class BinaryFormatter implements ResponseFormatter {

    static final int HEX_DIFF_LIMIT = 1024;

    @Override
    public String format(byte[] body) {
        return Base64.getEncoder().encodeToString(body != null ? body : new byte[0]);
    }

    @Override
    public byte[] restore(String content) {
        if (content == null || content.isEmpty()) {
            return new byte[0];
        }
        try {
            return Base64.getDecoder().decode(content);
        } catch (IllegalArgumentException e) {
            return ResponseFormatter.super.restore(content);
        }
    }

    @Override
    public BodyDiff compare(String expected, String actual) {
        byte[] exp = restore(expected);
        byte[] act = restore(actual);
        boolean equal = Arrays.equals(exp, act);
        BodyDiff.BodyDiffBuilder diff = BodyDiff.builder()
            .contentType("application/octet-stream")
            .expectedSize(exp.length)
            .actualSize(act.length)
            .expectedContent("[Binary data, " + exp.length + " bytes]")
            .actualContent("[Binary data, " + act.length + " bytes]")
            .equal(equal);
        if (!equal) {
            if (exp.length <= HEX_DIFF_LIMIT && act.length <= HEX_DIFF_LIMIT) {
                diff.diffContent(TextDiffs.unified(hexLines(exp), hexLines(act)));
            } else {
                diff.diffContent("Binary content differs (sizes: expected=" + exp.length
                    + " actual=" + act.length + ")");
            }
        }
        return diff.build();
    }

    // 16 bytes per line keeps the unified diff readable
    private static String hexLines(byte[] data) {
        HexFormat hex = HexFormat.of().withUpperCase();
        StringBuilder sb = new StringBuilder();
        for (int offset = 0; offset < data.length; offset += 16) {
            if (offset > 0) {
                sb.append('\n');
            }
            sb.append(hex.formatHex(data, offset, Math.min(data.length, offset + 16)));
        }
        return sb.toString();
    }
}
