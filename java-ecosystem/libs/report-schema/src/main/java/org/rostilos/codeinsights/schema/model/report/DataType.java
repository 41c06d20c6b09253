package org.rostilos.codeinsights.schema.model.report;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Type tag of a report data field. The tag decides how the {@code value} key is read.
 */
public enum DataType {
    BOOLEAN("BOOLEAN"),
    /** Epoch milliseconds. */
    DATE("DATE"),
    /** Milliseconds. */
    DURATION("DURATION"),
    LINK("LINK"),
    NUMBER("NUMBER"),
    PERCENTAGE("PERCENTAGE"),
    TEXT("TEXT");

    private final String token;

    DataType(String token) {
        this.token = token;
    }

    @JsonValue
    public String token() {
        return token;
    }

    public static DataType fromToken(String token) {
        for (DataType type : values()) {
            if (type.token.equals(token)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown data type: " + token);
    }
}
