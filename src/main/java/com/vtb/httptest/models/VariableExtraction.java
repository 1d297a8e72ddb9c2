package com.vtb.httptest.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Declares how a named variable is pulled out of a response.
 * <p>
 * Source is {@code body}, {@code header} or {@code status}. For the body, {@code path} is a JSON path
 * ({@code data.items[0].id}); {@code regexp} applies to the raw text and the first capture group wins.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class VariableExtraction {
    private String name;
    private String source;
    private String path;
    private String regexp;
    @JsonProperty("default")
    private String defaultValue;
    private boolean required;
}
