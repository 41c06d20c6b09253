package org.rostilos.codeinsights.schema.codec;

import com.fasterxml.jackson.databind.JsonNode;
import org.rostilos.codeinsights.schema.model.annotation.Annotation;
import org.rostilos.codeinsights.schema.model.annotation.AnnotationBatch;
import org.rostilos.codeinsights.schema.model.annotation.AnnotationSeverity;
import org.rostilos.codeinsights.schema.model.annotation.AnnotationType;

import java.util.ArrayList;
import java.util.List;

import static org.rostilos.codeinsights.schema.codec.JsonFieldReader.*;

final class AnnotationJsonReader {

    Annotation read(JsonNode node, String path) {
        requireObject(node, path);

        String annotationPath = requireText(node, "path", path);
        int line = requireInt(node, "line", path);
        String message = requireText(node, "message", path);
        AnnotationSeverity severity = optionalEnum(node, "severity", path, AnnotationSeverity::fromToken);
        AnnotationType type = optionalEnum(node, "type", path, AnnotationType::fromToken);
        String link = optionalText(node, "link", path);
        String externalId = optionalText(node, "externalId", path);

        return construct(path, () -> Annotation.builder(annotationPath, line, message)
                .withSeverity(severity)
                .withType(type)
                .withLink(link)
                .withExternalId(externalId)
                .build());
    }

    AnnotationBatch readBatch(JsonNode node) {
        requireObject(node, "");
        JsonNode array = requireArray(require(node, "annotations", ""), "annotations");

        List<Annotation> annotations = new ArrayList<>(array.size());
        for (int i = 0; i < array.size(); i++) {
            annotations.add(read(array.get(i), element("annotations", i)));
        }
        return construct("", () -> new AnnotationBatch(annotations));
    }
}
