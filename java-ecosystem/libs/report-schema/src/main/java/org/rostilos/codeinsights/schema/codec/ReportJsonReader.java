package org.rostilos.codeinsights.schema.codec;

import com.fasterxml.jackson.databind.JsonNode;
import org.rostilos.codeinsights.schema.model.report.DataType;
import org.rostilos.codeinsights.schema.model.report.DataValue;
import org.rostilos.codeinsights.schema.model.report.Report;
import org.rostilos.codeinsights.schema.model.report.ReportData;
import org.rostilos.codeinsights.schema.model.report.ReportResult;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.rostilos.codeinsights.schema.codec.JsonFieldReader.*;

/**
 * Rebuilds a {@link Report} from its JSON tree. Keys the schema does not know about, such as
 * the {@code key} Bitbucket adds to its responses, are ignored.
 */
final class ReportJsonReader {

    Report read(JsonNode node) {
        requireObject(node, "");

        String title = requireText(node, "title", "");
        Report.Builder builder = Report.builder(title)
                .withDetails(optionalText(node, "details", ""))
                .withResult(optionalEnum(node, "result", "", ReportResult::fromToken))
                .withReporter(optionalText(node, "reporter", ""))
                .withLink(optionalText(node, "link", ""))
                .withLogoUrl(optionalText(node, "logoUrl", ""));

        JsonNode createdDate = optional(node, "createdDate");
        if (createdDate != null) {
            builder.withCreatedDate(Instant.ofEpochMilli(integral(createdDate, "createdDate")));
        }

        JsonNode data = optional(node, "data");
        if (data != null) {
            builder.withData(readData(data));
        }

        return construct("", builder::build);
    }

    private List<ReportData> readData(JsonNode data) {
        requireArray(data, "data");
        List<ReportData> entries = new ArrayList<>(data.size());
        for (int i = 0; i < data.size(); i++) {
            entries.add(readDataField(data.get(i), element("data", i)));
        }
        return entries;
    }

    ReportData readDataField(JsonNode node, String path) {
        requireObject(node, path);

        String title = requireText(node, "title", path);
        DataType type = token(requireText(node, "type", path), child(path, "type"), DataType::fromToken);
        JsonNode value = require(node, "value", path);
        String valuePath = child(path, "value");

        return construct(path, () -> new ReportData(title, readValue(type, value, valuePath)));
    }

    private DataValue readValue(DataType type, JsonNode value, String valuePath) {
        return switch (type) {
            case BOOLEAN -> new DataValue.BooleanValue(bool(value, valuePath));
            case DATE -> new DataValue.DateValue(integral(value, valuePath));
            case DURATION -> new DataValue.DurationValue(integral(value, valuePath));
            case LINK -> {
                requireObject(value, valuePath);
                yield new DataValue.Link(
                        requireText(value, "linktext", valuePath),
                        requireText(value, "href", valuePath));
            }
            case NUMBER -> new DataValue.NumberValue(number(value, valuePath));
            case PERCENTAGE -> new DataValue.Percentage(number(value, valuePath));
            case TEXT -> new DataValue.Text(text(value, valuePath));
        };
    }
}
