package com.vtb.httptest.models;

import lombok.Builder;
import lombok.Data;
import lombok.Singular;

import java.util.List;

/**
 * Named collection of requests, usually backed by one {@code .http} file.
 * The path doubles as the collection identity for snapshot paths.
 */
@Data
@Builder
public class HttpFile {
    private String path;
    @Singular
    private List<HttpRequest> requests;
}
