package com.vtb.httptest.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SnapshotMetadata {
    private String requestPath;
    private String requestMethod;
    private String contentType;
    private int statusCode;
    private Map<String, List<String>> headers;
    private Instant createdAt;
}
