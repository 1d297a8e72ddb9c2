package com.vtb.httptest.models;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-request authentication.
 * <p>
 * {@code type} is {@code basic} (value {@code user:password}) or {@code bearer} (value is the token).
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AuthDescriptor {
    private String type;
    private String value;
}
