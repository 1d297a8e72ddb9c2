package com.vtb.httptest.models;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class StatusDiff {
    private int expected;
    private int actual;
    private boolean equal;
}
