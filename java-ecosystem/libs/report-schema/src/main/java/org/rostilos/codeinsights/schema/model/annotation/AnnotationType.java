package org.rostilos.codeinsights.schema.model.annotation;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Category of the finding an annotation describes.
 */
public enum AnnotationType {
    VULNERABILITY("VULNERABILITY"),
    CODE_SMELL("CODE_SMELL"),
    BUG("BUG");

    private final String token;

    AnnotationType(String token) {
        this.token = token;
    }

    @JsonValue
    public String token() {
        return token;
    }

    public static AnnotationType fromToken(String token) {
        for (AnnotationType value : values()) {
            if (value.token.equals(token)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown annotation type: " + token);
    }
}
