package org.rostilos.codeinsights.schema.model.annotation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.rostilos.codeinsights.schema.validation.FieldLimits;
import org.rostilos.codeinsights.schema.validation.FieldValidator;

import java.util.Arrays;
import java.util.List;

/**
 * Request body of the bulk "add annotations" call: {@code {"annotations": [...]}}.
 */
public record AnnotationBatch(List<Annotation> annotations) {

    public AnnotationBatch {
        if (annotations == null) {
            annotations = List.of();
        }
        FieldValidator.requireMaxSize("annotations", annotations, FieldLimits.ANNOTATIONS_PER_REQUEST);
        annotations = FieldValidator.copyWithoutNulls("annotations", annotations);
    }

    public static AnnotationBatch of(Annotation... annotations) {
        return new AnnotationBatch(annotations == null ? null : Arrays.asList(annotations));
    }

    @Override
    @JsonProperty("annotations")
    public List<Annotation> annotations() {
        return annotations;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return annotations.isEmpty();
    }
}
