package org.rostilos.codeinsights.schema.exception;

/**
 * Thrown when a report, annotation or data field is constructed with a value that breaks
 * a structural constraint. Raised at construction time only, never during serialization.
 */
public class ValidationException extends RuntimeException {

    private final String field;

    public ValidationException(String field, String message) {
        super(message);
        this.field = field;
    }

    public static ValidationException fieldTooLong(String field, int length, int limit) {
        return new ValidationException(field, String.format(
                "field '%s' too long, its length %d is longer than the allowed limit %d",
                field, length, limit));
    }

    public static ValidationException required(String field) {
        return new ValidationException(field, String.format("field '%s' is required and must not be blank", field));
    }

    public String getField() {
        return field;
    }
}
