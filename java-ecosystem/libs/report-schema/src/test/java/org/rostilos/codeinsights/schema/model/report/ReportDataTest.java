package org.rostilos.codeinsights.schema.model.report;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.rostilos.codeinsights.schema.exception.ValidationException;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ReportData")
class ReportDataTest {

    @Nested
    @DisplayName("Type derived from value")
    class TypeTests {

        @Test
        void bool() {
            assertThat(ReportData.bool("Blocking", false).getType()).isEqualTo(DataType.BOOLEAN);
        }

        @Test
        void date() {
            ReportData data = ReportData.date("Analyzed at", Instant.ofEpochMilli(1582841968000L));

            assertThat(data.getType()).isEqualTo(DataType.DATE);
            assertThat(data.getValue()).isEqualTo(new DataValue.DateValue(1582841968000L));
        }

        @Test
        void duration() {
            ReportData data = ReportData.duration("Took", Duration.ofSeconds(90));

            assertThat(data.getType()).isEqualTo(DataType.DURATION);
            assertThat(data.getValue()).isEqualTo(new DataValue.DurationValue(90_000L));
        }

        @Test
        void link() {
            ReportData data = ReportData.link("Details", "Go to CodeCrow", "https://codecrow.example.com");

            assertThat(data.getType()).isEqualTo(DataType.LINK);
            assertThat(data.getValue()).isEqualTo(new DataValue.Link("Go to CodeCrow", "https://codecrow.example.com"));
        }

        @Test
        void number() {
            assertThat(ReportData.number("Errors", 3).getType()).isEqualTo(DataType.NUMBER);
            assertThat(ReportData.number("Ratio", 0.25).getType()).isEqualTo(DataType.NUMBER);
        }

        @Test
        void percentage() {
            assertThat(ReportData.percentage("Coverage", 42).getType()).isEqualTo(DataType.PERCENTAGE);
        }

        @Test
        void text() {
            assertThat(ReportData.text("Quality gate", "passed").getType()).isEqualTo(DataType.TEXT);
        }
    }

    @Nested
    @DisplayName("Date and duration conversion")
    class TimeConversionTests {

        @Test
        @DisplayName("should reject null date")
        void shouldRejectNullDate() {
            assertThatThrownBy(() -> ReportData.date("Analyzed at", null))
                    .isInstanceOf(ValidationException.class)
                    .hasMessage("field 'value' is required and must not be blank");
        }

        @Test
        @DisplayName("should reject date beyond epoch milliseconds")
        void shouldRejectDateBeyondEpochMillis() {
            assertThatThrownBy(() -> ReportData.date("Analyzed at", Instant.MAX))
                    .isInstanceOf(ValidationException.class)
                    .extracting(e -> ((ValidationException) e).getField())
                    .isEqualTo("value");
        }

        @Test
        @DisplayName("should reject null duration")
        void shouldRejectNullDuration() {
            assertThatThrownBy(() -> ReportData.duration("Took", null))
                    .isInstanceOf(ValidationException.class)
                    .extracting(e -> ((ValidationException) e).getField())
                    .isEqualTo("value");
        }

        @Test
        @DisplayName("should reject duration beyond milliseconds")
        void shouldRejectDurationBeyondMillis() {
            assertThatThrownBy(() -> ReportData.duration("Took", Duration.ofSeconds(Long.MAX_VALUE)))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageStartingWith("field 'value' is out of the millisecond range");
        }
    }

    @Test
    @DisplayName("should reject blank title")
    void shouldRejectBlankTitle() {
        assertThatThrownBy(() -> ReportData.number("", 1))
                .isInstanceOf(ValidationException.class)
                .extracting(e -> ((ValidationException) e).getField())
                .isEqualTo("title");
    }

    @Test
    @DisplayName("should reject null value")
    void shouldRejectNullValue() {
        assertThatThrownBy(() -> new ReportData("Errors", null))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("'value'");
    }

    @Test
    @DisplayName("percentage 150 should fail and 42 should succeed")
    void percentageShouldBeRangeChecked() {
        assertThatThrownBy(() -> ReportData.percentage("Coverage", 150))
                .isInstanceOf(ValidationException.class)
                .hasMessage("percentage must be between 0 and 100, got 150");

        assertThat(ReportData.percentage("Coverage", 42).getValue()).isEqualTo(DataValue.Percentage.of(42));
    }
}
