package org.rostilos.codeinsights.schema.model.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.rostilos.codeinsights.schema.model.json.EpochMillisSerializer;
import org.rostilos.codeinsights.schema.validation.FieldLimits;
import org.rostilos.codeinsights.schema.validation.FieldValidator;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A Bitbucket Server <a href="https://confluence.atlassian.com/bitbucketserver/code-insights-966660485.html">Code Insights</a>
 * report: the summary of one analysis run attached to a commit.
 * <p>
 * Only {@code title} is required. Every other field is omitted from the JSON document when it
 * has not been set; the API treats a {@code null} value differently from a missing key.
 * Annotations are not part of the report and are submitted separately, see
 * {@link org.rostilos.codeinsights.schema.model.annotation.AnnotationBatch}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"title", "details", "result", "data", "reporter", "link", "logoUrl", "createdDate"})
public final class Report {

    private final String title;
    private final String details;
    private final ReportResult result;
    private final List<ReportData> data;
    private final String reporter;
    private final String link;
    private final String logoUrl;
    private final Instant createdDate;

    private Report(Builder builder) {
        this.title = FieldValidator.requireNonBlank("title", builder.title, FieldLimits.REPORT_TITLE_MAX_LENGTH);
        this.details = FieldValidator.requireMaxLength("details", builder.details, FieldLimits.REPORT_DETAILS_MAX_LENGTH);
        this.result = builder.result;
        this.data = builder.data == null ? null
                : FieldValidator.copyWithoutNulls("data",
                        FieldValidator.requireMaxSize("data", builder.data, FieldLimits.REPORT_MAX_DATA_FIELDS));
        this.reporter = FieldValidator.requireMaxLength("reporter", builder.reporter, FieldLimits.REPORT_REPORTER_MAX_LENGTH);
        this.link = builder.link;
        this.logoUrl = builder.logoUrl;
        // the wire carries epoch milliseconds
        if (builder.createdDate != null) {
            FieldValidator.requireEpochMillis("createdDate", builder.createdDate);
            this.createdDate = builder.createdDate.truncatedTo(ChronoUnit.MILLIS);
        } else {
            this.createdDate = null;
        }
    }

    public static Builder builder(String title) {
        return new Builder(title);
    }

    /**
     * A short string representing the name of the report.
     */
    @NotNull
    @JsonProperty("title")
    public String getTitle() {
        return title;
    }

    /**
     * Describes the purpose of the report. May contain escaped newlines, which Bitbucket renders.
     */
    @Nullable
    @JsonProperty("details")
    public String getDetails() {
        return details;
    }

    @Nullable
    @JsonProperty("result")
    public ReportResult getResult() {
        return result;
    }

    /**
     * Data fields in display order, or {@code null} when none were set. An explicitly set empty
     * list is kept and serialized as {@code []}.
     */
    @Nullable
    @JsonProperty("data")
    public List<ReportData> getData() {
        return data;
    }

    @Nullable
    @JsonProperty("reporter")
    public String getReporter() {
        return reporter;
    }

    /**
     * A URL linking to the results of the report in an external tool.
     */
    @Nullable
    @JsonProperty("link")
    public String getLink() {
        return link;
    }

    @Nullable
    @JsonProperty("logoUrl")
    public String getLogoUrl() {
        return logoUrl;
    }

    @Nullable
    @JsonProperty("createdDate")
    @JsonSerialize(using = EpochMillisSerializer.class)
    public Instant getCreatedDate() {
        return createdDate;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Report report)) return false;
        return title.equals(report.title)
                && Objects.equals(details, report.details)
                && result == report.result
                && Objects.equals(data, report.data)
                && Objects.equals(reporter, report.reporter)
                && Objects.equals(link, report.link)
                && Objects.equals(logoUrl, report.logoUrl)
                && Objects.equals(createdDate, report.createdDate);
    }

    @Override
    public int hashCode() {
        return Objects.hash(title, details, result, data, reporter, link, logoUrl, createdDate);
    }

    @Override
    public String toString() {
        return "Report{title='" + title + "', result=" + result + ", data=" + data + ", reporter='" + reporter + "'}";
    }

    public static class Builder {
        private final String title;
        private String details;
        private ReportResult result;
        private List<ReportData> data;
        private String reporter;
        private String link;
        private String logoUrl;
        private Instant createdDate;

        private Builder(String title) {
            this.title = title;
        }

        public Builder withDetails(String details) {
            this.details = details;
            return this;
        }

        public Builder withResult(ReportResult result) {
            this.result = result;
            return this;
        }

        public Builder withData(List<ReportData> data) {
            this.data = data;
            return this;
        }

        public Builder withData(ReportData... data) {
            this.data = Arrays.asList(data);
            return this;
        }

        public Builder withReporter(String reporter) {
            this.reporter = reporter;
            return this;
        }

        public Builder withLink(String link) {
            this.link = link;
            return this;
        }

        public Builder withLogoUrl(String logoUrl) {
            this.logoUrl = logoUrl;
            return this;
        }

        public Builder withCreatedDate(Instant createdDate) {
            this.createdDate = createdDate;
            return this;
        }

        /**
         * @throws org.rostilos.codeinsights.schema.exception.ValidationException if a field breaks
         *         a length limit, the title is blank or more than six data fields were given
         */
        public Report build() {
            return new Report(this);
        }
    }
}
