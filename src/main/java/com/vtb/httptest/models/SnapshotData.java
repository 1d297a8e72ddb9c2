package com.vtb.httptest.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Persisted snapshot file: {@code {"metadata": {...}, "content": "..."}}.
 * The layout is read by older and newer versions alike and must not change.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SnapshotData {
    private SnapshotMetadata metadata;
    private String content;
}
