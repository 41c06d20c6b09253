package org.rostilos.codeinsights.schema.model.annotation;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Severity of a single annotation.
 */
public enum AnnotationSeverity {
    LOW("LOW"),
    MEDIUM("MEDIUM"),
    HIGH("HIGH");

    private final String token;

    AnnotationSeverity(String token) {
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
    public static AnnotationSeverity fromToken(String token) {
        for (AnnotationSeverity value : values()) {
            if (value.token.equals(token)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown annotation severity: " + token);
    }
}
