package com.vtb.httptest.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Declarative response check.
 * <p>
 * Types: {@code equals, contains, matches, exists, notExists, in, lessThan (lt), greaterThan (gt), null (nil)}.
 * Sources: {@code body, header, status, contentType}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TestAssertion {
    private String type;
    private String source;
    private String path;
    private String value;
    private List<String> values;
    private boolean not;
    private boolean ignoreCase;
}
