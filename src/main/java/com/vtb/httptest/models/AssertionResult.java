package com.vtb.httptest.models;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class AssertionResult {
    private String type;
    private String source;
    private String path;
    private boolean succeeded;
    private String actual;
    private String expected;
    private String message;
}
