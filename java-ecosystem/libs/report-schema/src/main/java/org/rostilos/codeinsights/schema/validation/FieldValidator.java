package org.rostilos.codeinsights.schema.validation;

import org.rostilos.codeinsights.schema.exception.ValidationException;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Construction-time checks shared by the schema value types.
 */
public final class FieldValidator {

    private FieldValidator() {
    }

    public static String requireNonBlank(String field, String value) {
        if (value == null || value.isBlank()) {
            throw ValidationException.required(field);
        }
        return value;
    }

    public static String requireNonBlank(String field, String value, int limit) {
        return requireMaxLength(field, requireNonBlank(field, value), limit);
    }

    /**
     * Accepts {@code null} so optional fields can be passed straight through.
     */
    public static String requireMaxLength(String field, String value, int limit) {
        if (value != null && value.length() > limit) {
            throw ValidationException.fieldTooLong(field, value.length(), limit);
        }
        return value;
    }

    public static int requirePositive(String field, int value) {
        if (value < 1) {
            throw new ValidationException(field,
                    String.format("field '%s' must be a positive integer, got %d", field, value));
        }
        return value;
    }

    public static long requireNonNegative(String field, long value) {
        if (value < 0) {
            throw new ValidationException(field,
                    String.format("field '%s' must not be negative, got %d", field, value));
        }
        return value;
    }

    /**
     * Epoch milliseconds of {@code value}, for instants the wire format can carry.
     */
    public static long requireEpochMillis(String field, Instant value) {
        if (value == null) {
            throw ValidationException.required(field);
        }
        try {
            return value.toEpochMilli();
        } catch (ArithmeticException e) {
            throw new ValidationException(field,
                    String.format("field '%s' is out of the epoch millisecond range, got %s", field, value));
        }
    }

    public static long requireMillis(String field, Duration value) {
        if (value == null) {
            throw ValidationException.required(field);
        }
        try {
            return value.toMillis();
        } catch (ArithmeticException e) {
            throw new ValidationException(field,
                    String.format("field '%s' is out of the millisecond range, got %s", field, value));
        }
    }

    public static <T extends Collection<?>> T requireMaxSize(String field, T values, int limit) {
        if (values != null && values.size() > limit) {
            throw new ValidationException(field, String.format(
                    "field '%s' has %d entries, more than the allowed limit %d", field, values.size(), limit));
        }
        return values;
    }

    public static <T> List<T> copyWithoutNulls(String field, List<T> values) {
        for (T value : values) {
            if (value == null) {
                throw new ValidationException(field, String.format("field '%s' must not contain null entries", field));
            }
        }
        return List.copyOf(values);
    }
}
