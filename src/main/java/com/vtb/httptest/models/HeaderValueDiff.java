package com.vtb.httptest.models;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

@Data
@AllArgsConstructor
public class HeaderValueDiff {
    private List<String> expected;
    private List<String> actual;
}
