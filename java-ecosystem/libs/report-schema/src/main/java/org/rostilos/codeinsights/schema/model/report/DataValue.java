package org.rostilos.codeinsights.schema.model.report;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;
import org.rostilos.codeinsights.schema.exception.ValidationException;
import org.rostilos.codeinsights.schema.validation.FieldLimits;
import org.rostilos.codeinsights.schema.validation.FieldValidator;

import java.io.Serializable;
import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Value of a report data field. Each variant knows its own {@link DataType}, so a data
 * field can never carry a tag that disagrees with the shape of its value.
 */
public interface DataValue extends Serializable {

    DataType dataType();

    record BooleanValue(boolean value) implements DataValue {
        @Override
        @JsonValue
        public boolean value() {
            return value;
        }

        @Override
        public DataType dataType() {
            return DataType.BOOLEAN;
        }
    }

    record DateValue(long epochMillis) implements DataValue {
        public DateValue {
            FieldValidator.requireNonNegative("value", epochMillis);
        }

        @Override
        @JsonValue
        public long epochMillis() {
            return epochMillis;
        }

        @Override
        public DataType dataType() {
            return DataType.DATE;
        }
    }

    record DurationValue(long millis) implements DataValue {
        public DurationValue {
            FieldValidator.requireNonNegative("value", millis);
        }

        @Override
        @JsonValue
        public long millis() {
            return millis;
        }

        @Override
        public DataType dataType() {
            return DataType.DURATION;
        }
    }

    record Link(String linktext, String href) implements DataValue {
        @JsonCreator
        public Link(@JsonProperty("linktext") String linktext, @JsonProperty("href") String href) {
            this.linktext = FieldValidator.requireNonBlank("value.linktext", linktext);
            this.href = FieldValidator.requireNonBlank("value.href", href);
        }

        @Override
        public DataType dataType() {
            return DataType.LINK;
        }
    }

    /**
     * Integral numbers are held as {@link Long} and decimals as {@link Double}, so that
     * {@code 3} goes over the wire as {@code 3} and {@code 3.5} as {@code 3.5}.
     * Values those two types cannot hold exactly are rejected.
     */
    record NumberValue(Number value) implements DataValue {
        public NumberValue {
            value = normalize("value", value);
        }

        public static NumberValue of(long value) {
            return new NumberValue(value);
        }

        public static NumberValue of(double value) {
            return new NumberValue(value);
        }

        @Override
        @JsonValue
        public Number value() {
            return value;
        }

        @Override
        public DataType dataType() {
            return DataType.NUMBER;
        }
    }

    record Percentage(Number value) implements DataValue {
        public Percentage {
            value = normalize("value", value);
            double asDouble = value.doubleValue();
            if (asDouble < FieldLimits.PERCENTAGE_MIN || asDouble > FieldLimits.PERCENTAGE_MAX) {
                throw new ValidationException("value", String.format(
                        "percentage must be between %d and %d, got %s",
                        FieldLimits.PERCENTAGE_MIN, FieldLimits.PERCENTAGE_MAX, value));
            }
        }

        public static Percentage of(long value) {
            return new Percentage(value);
        }

        public static Percentage of(double value) {
            return new Percentage(value);
        }

        @Override
        @JsonValue
        public Number value() {
            return value;
        }

        @Override
        public DataType dataType() {
            return DataType.PERCENTAGE;
        }
    }

    record Text(String value) implements DataValue {
        public Text {
            if (value == null) {
                throw ValidationException.required("value");
            }
        }

        @Override
        @JsonValue
        public String value() {
            return value;
        }

        @Override
        public DataType dataType() {
            return DataType.TEXT;
        }
    }

    private static Number normalize(String field, Number value) {
        if (value == null) {
            throw new ValidationException(field, String.format("field '%s' must be a number", field));
        }
        if (value instanceof Long) {
            return value;
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return value.longValue();
        }
        if (value instanceof BigInteger) {
            if (((BigInteger) value).bitLength() < Long.SIZE) {
                return value.longValue();
            }
            throw new ValidationException(field, String.format(
                    "field '%s' must fit a 64-bit integer, got %s", field, value));
        }
        if (value instanceof BigDecimal) {
            double asDouble = value.doubleValue();
            if (Double.isFinite(asDouble) && new BigDecimal(asDouble).compareTo((BigDecimal) value) == 0) {
                return asDouble;
            }
            throw new ValidationException(field, String.format(
                    "field '%s' must be exactly representable as a double, got %s", field, value));
        }
        if (value instanceof Double || value instanceof Float) {
            double asDouble = value.doubleValue();
            if (Double.isNaN(asDouble) || Double.isInfinite(asDouble)) {
                throw new ValidationException(field, String.format("field '%s' must be a finite number, got %s", field, value));
            }
            return asDouble;
        }
        throw new ValidationException(field, String.format(
                "field '%s' has unsupported number type %s", field, value.getClass().getSimpleName()));
    }
}
