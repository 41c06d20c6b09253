package org.rostilos.codeinsights.schema.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.rostilos.codeinsights.schema.exception.SchemaException;
import org.rostilos.codeinsights.schema.exception.SchemaException.Kind;
import org.rostilos.codeinsights.schema.model.annotation.Annotation;
import org.rostilos.codeinsights.schema.model.annotation.AnnotationBatch;
import org.rostilos.codeinsights.schema.model.report.Report;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.function.Function;

/**
 * Converts Code Insights values to and from their JSON wire form.
 * <p>
 * Serialization never emits a {@code null}-valued key: unset optional fields are left out of
 * the document. Deserialization walks the JSON tree explicitly and fails with a
 * {@link SchemaException} naming the offending field. The codec holds no mutable state and
 * is safe to share between threads.
 */
public class CodeInsightsJsonCodec {
    private static final Logger LOGGER = LoggerFactory.getLogger(CodeInsightsJsonCodec.class);

    private final ObjectMapper objectMapper;
    private final ReportJsonReader reportReader = new ReportJsonReader();
    private final AnnotationJsonReader annotationReader = new AnnotationJsonReader();

    public CodeInsightsJsonCodec() {
        this(new ObjectMapper());
    }

    public CodeInsightsJsonCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String serialize(Report report) {
        return write(report, "report");
    }

    public String serialize(Annotation annotation) {
        return write(annotation, "annotation");
    }

    public String serialize(AnnotationBatch batch) {
        return write(batch, "annotation batch");
    }

    /**
     * UTF-8 request body for the report PUT call.
     */
    public byte[] toBytes(Report report) {
        return serialize(report).getBytes(StandardCharsets.UTF_8);
    }

    public byte[] toBytes(Annotation annotation) {
        return serialize(annotation).getBytes(StandardCharsets.UTF_8);
    }

    /**
     * UTF-8 request body for the bulk annotations POST call.
     */
    public byte[] toBytes(AnnotationBatch batch) {
        return serialize(batch).getBytes(StandardCharsets.UTF_8);
    }

    public JsonNode toJsonTree(Report report) {
        return objectMapper.valueToTree(report);
    }

    public JsonNode toJsonTree(Annotation annotation) {
        return objectMapper.valueToTree(annotation);
    }

    public JsonNode toJsonTree(AnnotationBatch batch) {
        return objectMapper.valueToTree(batch);
    }

    public Report deserializeReport(String json) {
        return deserializeReport(parse(json));
    }

    public Report deserializeReport(JsonNode node) {
        return read(node, "report", reportReader::read);
    }

    public Annotation deserializeAnnotation(String json) {
        return deserializeAnnotation(parse(json));
    }

    public Annotation deserializeAnnotation(JsonNode node) {
        return read(node, "annotation", n -> annotationReader.read(n, ""));
    }

    public AnnotationBatch deserializeAnnotationBatch(String json) {
        return deserializeAnnotationBatch(parse(json));
    }

    public AnnotationBatch deserializeAnnotationBatch(JsonNode node) {
        return read(node, "annotation batch", annotationReader::readBatch);
    }

    private String write(Object value, String kind) {
        try {
            String body = objectMapper.writeValueAsString(value);
            LOGGER.debug("Serialized {} to {} characters", kind, body.length());
            return body;
        } catch (JsonProcessingException e) {
            LOGGER.error("Failed to serialize {}: {}", kind, e.getMessage(), e);
            throw new IllegalStateException("Failed to serialize " + kind, e);
        }
    }

    private JsonNode parse(String json) {
        if (json == null) {
            throw new SchemaException("$", Kind.MISSING, "no document");
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            LOGGER.warn("Rejected malformed Code Insights document: {}", e.getOriginalMessage());
            throw new SchemaException("$", Kind.MALFORMED_JSON, e.getOriginalMessage(), e);
        }
    }

    private <T> T read(JsonNode node, String kind, Function<JsonNode, T> reader) {
        try {
            T value = reader.apply(node);
            LOGGER.debug("Deserialized {}: {}", kind, value);
            return value;
        } catch (SchemaException e) {
            LOGGER.warn("Rejected {} document: {}", kind, e.getMessage());
            throw e;
        }
    }
}
