package com.vtb.httptest.models;

import lombok.Builder;
import lombok.Data;

/**
 * Body comparison produced by a formatter. {@code diffContent} holds a human readable diff.
 */
@Data
@Builder
public class BodyDiff {
    private String contentType;
    private int expectedSize;
    private int actualSize;
    private String expectedContent;
    private String actualContent;
    private String diffContent;
    private JsonDiff jsonDiff;
    private boolean equal;
}
