package com.vtb.httptest.snapshot;

import com.vtb.httptest.models.BodyDiff;

import java.nio.charset.StandardCharsets;

/**
 * Plain text, XML and HTML. Only line endings (and, for markup, surrounding whitespace) are normalised;
 * no document model is built.
 */
public class TextFormatter implements ResponseFormatter {

    private final String contentType;
    private final boolean trim;

    public TextFormatter(String contentType, boolean trim) {
        this.contentType = contentType;
        this.trim = trim;
    }

    public static TextFormatter xml() {
        return new TextFormatter("application/xml", true);
    }

    public static TextFormatter html() {
        return new TextFormatter("text/html", true);
    }

    public static TextFormatter text() {
        return new TextFormatter("text/plain", false);
    }

    @Override
    public String format(byte[] body) {
        if (body == null || body.length == 0) {
            return "";
        }
        String content = new String(body, StandardCharsets.UTF_8).replace("\r\n", "\n");
        return trim ? content.trim() : content;
    }

    @Override
    public BodyDiff compare(String expected, String actual) {
        String exp = expected != null ? expected : "";
        String act = actual != null ? actual : "";
        boolean equal = exp.equals(act);
        return BodyDiff.builder()
            .contentType(contentType)
            .expectedSize(exp.getBytes(StandardCharsets.UTF_8).length)
            .actualSize(act.getBytes(StandardCharsets.UTF_8).length)
            .expectedContent(exp)
            .actualContent(act)
            .equal(equal)
            .diffContent(equal ? null : TextDiffs.unified(exp, act))
            .build();
    }
}
