package org.rostilos.codeinsights.schema.exception;

/**
 * Thrown when an incoming JSON document does not match the Code Insights schema.
 * The offending field is reported as a JSON path, e.g. {@code data[0].value}.
 */
public class SchemaException extends RuntimeException {

    public enum Kind {
        MISSING("missing required key"),
        WRONG_TYPE("wrong JSON type"),
        UNRECOGNIZED_TOKEN("unrecognized token"),
        INVALID_VALUE("invalid value"),
        MALFORMED_JSON("malformed JSON");

        private final String description;

        Kind(String description) {
            this.description = description;
        }

        public String getDescription() {
            return description;
        }
    }

    private final String field;
    private final Kind kind;

    public SchemaException(String field, Kind kind, String detail) {
        this(field, kind, detail, null);
    }

    public SchemaException(String field, Kind kind, String detail, Throwable cause) {
        super(String.format("field '%s': %s%s", field, kind.getDescription(),
                detail == null ? "" : " (" + detail + ")"), cause);
        this.field = field;
        this.kind = kind;
    }

    public String getField() {
        return field;
    }

    public Kind getKind() {
        return kind;
    }
}
