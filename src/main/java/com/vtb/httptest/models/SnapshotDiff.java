package com.vtb.httptest.models;

import lombok.Builder;
import lombok.Data;

/**
 * Result of comparing a response with a stored snapshot. {@code equal} is the AND of the three parts.
 */
@Data
@Builder
public class SnapshotDiff {
    private boolean equal;
    private StatusDiff statusDiff;
    private HeaderDiff headerDiff;
    private BodyDiff bodyDiff;

    /**
     * One-line description of what differs, for result error text.
     */
    public String describe() {
        if (equal) {
            return "no differences";
        }
        StringBuilder sb = new StringBuilder();
        if (statusDiff != null && !statusDiff.isEqual()) {
            sb.append("status ").append(statusDiff.getExpected()).append(" -> ").append(statusDiff.getActual());
        }
        if (headerDiff != null && !headerDiff.isEqual()) {
            if (sb.length() > 0) {
                sb.append("; ");
            }
            sb.append("headers differ (missing=").append(headerDiff.getMissing().keySet())
                .append(", extra=").append(headerDiff.getExtra().keySet())
                .append(", changed=").append(headerDiff.getDifferentValues().keySet()).append(')');
        }
        if (bodyDiff != null && !bodyDiff.isEqual()) {
            if (sb.length() > 0) {
                sb.append("; ");
            }
            sb.append("body differs");
        }
        return sb.toString();
    }
}
