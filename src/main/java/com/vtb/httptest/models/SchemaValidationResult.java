package com.vtb.httptest.models;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
public class SchemaValidationResult {
    private boolean valid;
    @Builder.Default
    private List<ValidationError> errors = new ArrayList<>();
    private String schemaPath;
    private String operation;

    public String firstMessage() {
        return errors.isEmpty() ? null : errors.get(0).toString();
    }
}
