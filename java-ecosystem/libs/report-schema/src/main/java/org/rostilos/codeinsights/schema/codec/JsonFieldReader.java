package org.rostilos.codeinsights.schema.codec;

import com.fasterxml.jackson.databind.JsonNode;
import org.rostilos.codeinsights.schema.exception.SchemaException;
import org.rostilos.codeinsights.schema.exception.SchemaException.Kind;
import org.rostilos.codeinsights.schema.exception.ValidationException;

import java.util.Locale;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Typed access to the keys of a {@link JsonNode}. Every failure is reported as a
 * {@link SchemaException} carrying the JSON path of the key.
 * An explicit {@code null} is treated like a missing key.
 */
final class JsonFieldReader {

    private JsonFieldReader() {
    }

    static String child(String path, String key) {
        return path.isEmpty() ? key : path + "." + key;
    }

    static String element(String path, int index) {
        return path + "[" + index + "]";
    }

    static JsonNode requireObject(JsonNode node, String path) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            throw new SchemaException(path.isEmpty() ? "$" : path, Kind.MISSING, null);
        }
        if (!node.isObject()) {
            throw wrongType(path.isEmpty() ? "$" : path, "object", node);
        }
        return node;
    }

    static JsonNode requireArray(JsonNode node, String path) {
        if (!node.isArray()) {
            throw wrongType(path, "array", node);
        }
        return node;
    }

    static JsonNode require(JsonNode parent, String key, String path) {
        JsonNode value = parent.get(key);
        if (value == null || value.isNull()) {
            throw new SchemaException(child(path, key), Kind.MISSING, null);
        }
        return value;
    }

    static JsonNode optional(JsonNode parent, String key) {
        JsonNode value = parent.get(key);
        return value == null || value.isNull() ? null : value;
    }

    static String requireText(JsonNode parent, String key, String path) {
        return text(require(parent, key, path), child(path, key));
    }

    static String optionalText(JsonNode parent, String key, String path) {
        JsonNode value = optional(parent, key);
        return value == null ? null : text(value, child(path, key));
    }

    static String text(JsonNode value, String fieldPath) {
        if (!value.isTextual()) {
            throw wrongType(fieldPath, "string", value);
        }
        return value.textValue();
    }

    static int requireInt(JsonNode parent, String key, String path) {
        JsonNode value = require(parent, key, path);
        if (!value.isIntegralNumber() || !value.canConvertToInt()) {
            throw wrongType(child(path, key), "integer", value);
        }
        return value.intValue();
    }

    static long integral(JsonNode value, String fieldPath) {
        if (!value.isIntegralNumber() || !value.canConvertToLong()) {
            throw wrongType(fieldPath, "integer", value);
        }
        return value.longValue();
    }

    /**
     * Integral JSON numbers become {@link Long}, decimals become {@link Double}. Integers
     * beyond the {@code long} range are returned as {@link java.math.BigInteger} and left to
     * the value constructor to reject.
     */
    static Number number(JsonNode value, String fieldPath) {
        if (value.isIntegralNumber()) {
            return value.canConvertToLong() ? value.longValue() : value.bigIntegerValue();
        }
        if (value.isFloatingPointNumber()) {
            return value.doubleValue();
        }
        throw wrongType(fieldPath, "number", value);
    }

    static boolean bool(JsonNode value, String fieldPath) {
        if (!value.isBoolean()) {
            throw wrongType(fieldPath, "boolean", value);
        }
        return value.booleanValue();
    }

    static <E extends Enum<E>> E optionalEnum(JsonNode parent, String key, String path, Function<String, E> fromToken) {
        String token = optionalText(parent, key, path);
        return token == null ? null : token(token, child(path, key), fromToken);
    }

    static <E extends Enum<E>> E token(String token, String fieldPath, Function<String, E> fromToken) {
        try {
            return fromToken.apply(token);
        } catch (IllegalArgumentException e) {
            throw new SchemaException(fieldPath, Kind.UNRECOGNIZED_TOKEN, "'" + token + "'", e);
        }
    }

    /**
     * Runs a constructor and reports its {@link ValidationException} against the JSON path
     * of the object being built.
     */
    static <T> T construct(String path, Supplier<T> constructor) {
        try {
            return constructor.get();
        } catch (ValidationException e) {
            String field = e.getField() == null ? path : child(path, e.getField());
            throw new SchemaException(field, Kind.INVALID_VALUE, e.getMessage(), e);
        }
    }

    private static SchemaException wrongType(String fieldPath, String expected, JsonNode actual) {
        return new SchemaException(fieldPath, Kind.WRONG_TYPE,
                String.format("expected %s, got %s", expected, actual.getNodeType().name().toLowerCase(Locale.ENGLISH)));
    }
}
