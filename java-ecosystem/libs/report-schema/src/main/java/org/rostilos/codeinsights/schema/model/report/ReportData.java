package org.rostilos.codeinsights.schema.model.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.jetbrains.annotations.NotNull;
import org.rostilos.codeinsights.schema.exception.ValidationException;
import org.rostilos.codeinsights.schema.validation.FieldValidator;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * A typed key/value entry displayed on a report, e.g. code coverage or the number of
 * linter errors. The {@code type} key is taken from the value, never supplied separately.
 */
@JsonPropertyOrder({"title", "type", "value"})
public final class ReportData {
    private final String title;
    private final DataValue value;

    public ReportData(String title, DataValue value) {
        this.title = FieldValidator.requireNonBlank("title", title);
        if (value == null) {
            throw ValidationException.required("value");
        }
        this.value = value;
    }

    public static ReportData bool(String title, boolean value) {
        return new ReportData(title, new DataValue.BooleanValue(value));
    }

    public static ReportData date(String title, Instant value) {
        return new ReportData(title, new DataValue.DateValue(FieldValidator.requireEpochMillis("value", value)));
    }

    public static ReportData duration(String title, Duration value) {
        return new ReportData(title, new DataValue.DurationValue(FieldValidator.requireMillis("value", value)));
    }

    public static ReportData link(String title, String linktext, String href) {
        return new ReportData(title, new DataValue.Link(linktext, href));
    }

    public static ReportData number(String title, long value) {
        return new ReportData(title, DataValue.NumberValue.of(value));
    }

    public static ReportData number(String title, double value) {
        return new ReportData(title, DataValue.NumberValue.of(value));
    }

    public static ReportData percentage(String title, long value) {
        return new ReportData(title, DataValue.Percentage.of(value));
    }

    public static ReportData percentage(String title, double value) {
        return new ReportData(title, DataValue.Percentage.of(value));
    }

    public static ReportData text(String title, String value) {
        return new ReportData(title, new DataValue.Text(value));
    }

    @NotNull
    @JsonProperty("title")
    public String getTitle() {
        return title;
    }

    @NotNull
    @JsonProperty("type")
    public DataType getType() {
        return value.dataType();
    }

    @NotNull
    @JsonProperty("value")
    public DataValue getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ReportData that)) return false;
        return title.equals(that.title) && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(title, value);
    }

    @Override
    public String toString() {
        return "ReportData{title='" + title + "', type=" + getType() + ", value=" + value + "}";
    }
}
