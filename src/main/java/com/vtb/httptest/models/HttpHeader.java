package com.vtb.httptest.models;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Single request header. Name and value may contain placeholders.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class HttpHeader {
    private String name;
    private String value;
}
