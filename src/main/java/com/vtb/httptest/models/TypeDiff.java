package com.vtb.httptest.models;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class TypeDiff {
    private String expectedType;
    private String actualType;
}
