package com.vtb.httptest.snapshot;

import com.vtb.httptest.models.BodyDiff;

import java.nio.charset.StandardCharsets;

/**
 * Content-type specific normalisation and comparison of response bodies.
 */
public interface ResponseFormatter {

    /**
     * Normalised body as stored in the snapshot {@code content} field.
     */
    String format(byte[] body);

    /**
     * Compares two normalised bodies.
     */
    BodyDiff compare(String expected, String actual);

    /**
     * Turns stored content back into body bytes.
     */
    default byte[] restore(String content) {
        return content == null ? new byte[0] : content.getBytes(StandardCharsets.UTF_8);
    }
}
