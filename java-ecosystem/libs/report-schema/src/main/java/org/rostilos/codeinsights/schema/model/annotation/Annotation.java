package org.rostilos.codeinsights.schema.model.annotation;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.rostilos.codeinsights.schema.validation.FieldLimits;
import org.rostilos.codeinsights.schema.validation.FieldValidator;

import java.util.Objects;

/**
 * A single finding of a report, placed on one line of one file.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"path", "line", "message", "severity", "type", "link", "externalId"})
public final class Annotation {
    private final String path;
    private final int line;
    private final String message;
    private final AnnotationSeverity severity;
    private final AnnotationType type;
    private final String link;
    private final String externalId;

    private Annotation(Builder builder) {
        this.path = FieldValidator.requireNonBlank("path", builder.path);
        this.line = FieldValidator.requirePositive("line", builder.line);
        this.message = FieldValidator.requireNonBlank("message", builder.message, FieldLimits.ANNOTATION_MESSAGE_MAX_LENGTH);
        this.severity = builder.severity;
        this.type = builder.type;
        this.link = builder.link;
        this.externalId = FieldValidator.requireMaxLength("externalId", builder.externalId, FieldLimits.ANNOTATION_EXTERNAL_ID_MAX_LENGTH);
    }

    public static Builder builder(String path, int line, String message) {
        return new Builder(path, line, message);
    }

    /**
     * Path of the file relative to the root of the repository.
     */
    @NotNull
    @JsonProperty("path")
    public String getPath() {
        return path;
    }

    /**
     * 1-based line number.
     */
    @JsonProperty("line")
    public int getLine() {
        return line;
    }

    @NotNull
    @JsonProperty("message")
    public String getMessage() {
        return message;
    }

    @Nullable
    @JsonProperty("severity")
    public AnnotationSeverity getSeverity() {
        return severity;
    }

    @Nullable
    @JsonProperty("type")
    public AnnotationType getType() {
        return type;
    }

    /**
     * An http or https URL of this finding in the external tool.
     */
    @Nullable
    @JsonProperty("link")
    public String getLink() {
        return link;
    }

    /**
     * Identifier chosen by the annotation creator so it can later update or delete this
     * annotation. Bitbucket itself does not use it.
     */
    @Nullable
    @JsonProperty("externalId")
    public String getExternalId() {
        return externalId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Annotation that)) return false;
        return line == that.line
                && path.equals(that.path)
                && message.equals(that.message)
                && severity == that.severity
                && type == that.type
                && Objects.equals(link, that.link)
                && Objects.equals(externalId, that.externalId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(path, line, message, severity, type, link, externalId);
    }

    @Override
    public String toString() {
        return "Annotation{" + path + ":" + line + ", severity=" + severity + ", type=" + type + ", message='" + message + "'}";
    }

    public static class Builder {
        private final String path;
        private final int line;
        private final String message;
        private AnnotationSeverity severity;
        private AnnotationType type;
        private String link;
        private String externalId;

        private Builder(String path, int line, String message) {
            this.path = path;
            this.line = line;
            this.message = message;
        }

        public Builder withSeverity(AnnotationSeverity severity) {
            this.severity = severity;
            return this;
        }

        public Builder withType(AnnotationType type) {
            this.type = type;
            return this;
        }

        public Builder withLink(String link) {
            this.link = link;
            return this;
        }

        public Builder withExternalId(String externalId) {
            this.externalId = externalId;
            return this;
        }

        public Annotation build() {
            return new Annotation(this);
        }
    }
}
