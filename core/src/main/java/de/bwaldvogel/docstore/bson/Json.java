package de.bwaldvogel.docstore.bson;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collection;
import java.util.Map.Entry;
import java.util.stream.Collectors;

public final class Json {

    private Json() {
    }

    public static String toJsonValue(Object value) {
        return toJsonValue(value, false, "{", "}");
    }

    public static String toJsonValue(Object value, boolean compactKey, String jsonPrefix, String jsonSuffix) {
        if (Missing.isNullOrMissing(value)) {
            return "null";
        }
        if (value instanceof Number || value instanceof Boolean) {
            return value.toString();
        }
        if (value instanceof String string) {
            return "\"" + escapeJson(string) + "\"";
        }
        if (value instanceof Document document) {
            if (document.isEmpty()) {
                return "{}";
            }
            return document.toString(compactKey, jsonPrefix, jsonSuffix);
        }
        if (value instanceof Instant instant) {
            return toJsonValue(instant.toString());
        }
        if (value instanceof Collection<?> collection) {
            if (collection.isEmpty()) {
                return "[]";
            }
            return collection.stream()
                .map(v -> toJsonValue(v, compactKey, jsonPrefix, jsonSuffix))
                .collect(Collectors.joining(", ", "[ ", " ]"));
        }
        if (value instanceof ObjectId objectId) {
            return objectId.getHexData();
        }
        if (value instanceof BsonRegularExpression regularExpression) {
            return regularExpression.toString();
        }
        return toJsonValue(value.toString());
    }

    /**
     * Renders a value in the compact form used in error messages, e.g. {@code { a: 1, b: [ "x", 42.0 ] }}.
     */
    public static String toCompactJsonValue(Object value) {
        if (Missing.isNullOrMissing(value)) {
            return "null";
        }
        if (value instanceof Double doubleValue) {
            return formatDouble(doubleValue);
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Boolean) {
            return value.toString();
        }
        if (value instanceof Decimal128 decimal) {
            return "NumberDecimal(\"" + decimal + "\")";
        }
        if (value instanceof String string) {
            return "\"" + escapeJson(string) + "\"";
        }
        if (value instanceof Document document) {
            if (document.isEmpty()) {
                return "{}";
            }
            return document.entrySet().stream()
                .map(entry -> entry.getKey() + ": " + toCompactJsonValue(entry.getValue()))
                .collect(Collectors.joining(", ", "{ ", " }"));
        }
        if (value instanceof Collection<?> collection) {
            if (collection.isEmpty()) {
                return "[]";
            }
            return collection.stream()
                .map(Json::toCompactJsonValue)
                .collect(Collectors.joining(", ", "[ ", " ]"));
        }
        if (value instanceof ObjectId objectId) {
            return "ObjectId('" + objectId.getHexData() + "')";
        }
        if (value instanceof BsonRegularExpression regularExpression) {
            return "/" + regularExpression.getPattern() + "/" + regularExpression.getOptions();
        }
        if (value instanceof Instant instant) {
            return "new Date(" + instant.toEpochMilli() + ")";
        }
        return value.toString();
    }

    /**
     * Renders a single field as it is quoted by document validation errors, e.g. {@code { "foo": +Inf }}.
     */
    public static String toValidationJson(String key, Object value) {
        return "{ \"" + escapeJson(key) + "\": " + toValidationJsonValue(value) + " }";
    }

    private static String toValidationJsonValue(Object value) {
        if (value instanceof Double doubleValue) {
            if (doubleValue.isNaN()) {
                return "NaN";
            }
            if (doubleValue.isInfinite()) {
                return doubleValue > 0 ? "+Inf" : "-Inf";
            }
            return formatDouble(doubleValue);
        }
        if (value instanceof Document document) {
            if (document.isEmpty()) {
                return "{}";
            }
            return document.entrySet().stream()
                .map(Json::toValidationEntry)
                .collect(Collectors.joining(", ", "{ ", " }"));
        }
        if (value instanceof Collection<?> collection) {
            if (collection.isEmpty()) {
                return "[]";
            }
            return collection.stream()
                .map(Json::toValidationJsonValue)
                .collect(Collectors.joining(", ", "[ ", " ]"));
        }
        return toCompactJsonValue(value);
    }

    private static String toValidationEntry(Entry<String, Object> entry) {
        return "\"" + escapeJson(entry.getKey()) + "\": " + toValidationJsonValue(entry.getValue());
    }

    static String formatDouble(double value) {
        if (Double.isNaN(value)) {
            return "nan.0";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "inf.0" : "-inf.0";
        }
        if (value == Math.rint(value)) {
            if (value == 0 && 1 / value < 0) {
                return "-0.0";
            }
            return new BigDecimal(value).toPlainString() + ".0";
        }
        return BigDecimal.valueOf(value).toPlainString();
    }

    static String escapeJson(String input) {
        String escaped = input;
        escaped = escaped.replace("\\", "\\\\");
        escaped = escaped.replace("\"", "\\\"");
        escaped = escaped.replace("\b", "\\b");
        escaped = escaped.replace("\f", "\\f");
        escaped = escaped.replace("\n", "\\n");
        escaped = escaped.replace("\r", "\\r");
        escaped = escaped.replace("\t", "\\t");
        return escaped;
    }
}
