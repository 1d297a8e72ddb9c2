package com.vtb.httptest.models;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class ValueDiff {
    private Object expected;
    private Object actual;
}
