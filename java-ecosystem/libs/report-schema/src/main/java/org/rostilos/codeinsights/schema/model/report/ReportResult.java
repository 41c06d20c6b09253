package org.rostilos.codeinsights.schema.model.report;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Overall outcome of a Code Insights report.
 */
public enum ReportResult {
    PASS("PASS"),
    FAIL("FAIL");

    private final String token;

    ReportResult(String token) {
        this.token = token;
    }

    @JsonValue
    public String token() {
        return token;
    }

    /**
     * Exact, case-sensitive lookup of a wire token.
     *
     * @throws IllegalArgumentException if the token is not part of the API contract
     */
    public static ReportResult fromToken(String token) {
        for (ReportResult value : values()) {
            if (value.token.equals(token)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown report result: " + token);
    }
}
