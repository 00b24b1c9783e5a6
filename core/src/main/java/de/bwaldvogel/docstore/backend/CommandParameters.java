package de.bwaldvogel.docstore.backend;

import java.util.List;

import de.bwaldvogel.docstore.bson.BsonType;
import de.bwaldvogel.docstore.bson.Document;
import de.bwaldvogel.docstore.bson.Missing;
import de.bwaldvogel.docstore.exception.ErrorCode;
import de.bwaldvogel.docstore.exception.InvalidNamespaceError;
import de.bwaldvogel.docstore.exception.ServerError;
import de.bwaldvogel.docstore.exception.TypeMismatchException;

/**
 * Typed access to the fields of a command document.
 */
final class CommandParameters {

    private static final String NUMBER_TYPES = "[long, int, decimal, double]";

    private CommandParameters() {
    }

    static String getCollectionName(String databaseName, String command, Document query) {
        Object value = query.get(command);
        if (!(value instanceof String collectionName)) {
            throw new InvalidNamespaceError("collection name has invalid type " + BsonType.aliasOf(value));
        }
        Utils.validateCollectionName(databaseName, collectionName);
        return collectionName;
    }

    static Document getOptionalDocument(String command, Document query, String field) {
        Object value = query.get(field);
        if (Missing.isNullOrMissing(value)) {
            return null;
        }
        if (!(value instanceof Document document)) {
            throw wrongType(command, field, value, "expected type 'object'");
        }
        return document;
    }

    static Document getRequiredDocument(String command, Document query, String field) {
        Document document = getOptionalDocument(command, query, field);
        if (document == null) {
            throw missingField(command, field);
        }
        return document;
    }

    static Number getRequiredNumber(String command, Document query, String field) {
        Object value = query.get(field);
        if (Missing.isNullOrMissing(value)) {
            throw missingField(command, field);
        }
        if (!BsonType.isNumber(value)) {
            throw wrongType(command, field, value, "expected types '" + NUMBER_TYPES + "'");
        }
        return (Number) value;
    }

    static boolean getOptionalBoolean(String command, Document query, String field, boolean defaultValue) {
        Object value = query.get(field);
        if (Missing.isNullOrMissing(value)) {
            return defaultValue;
        }
        if (!(value instanceof Boolean booleanValue)) {
            throw wrongType(command, field, value, "expected type 'bool'");
        }
        return booleanValue.booleanValue();
    }

    static int getOptionalNonNegativeNumber(String command, Document query, String field) {
        Object value = query.get(field);
        if (Missing.isNullOrMissing(value)) {
            return 0;
        }
        if (!BsonType.isNumber(value)) {
            throw wrongType(command, field, value, "expected types '" + NUMBER_TYPES + "'");
        }
        long number = ((Number) value).longValue();
        if (number < 0) {
            throw new ServerError(ErrorCode._51024, "BSON field '" + field + "' value must be >= 0, actual value '" + number + "'");
        }
        return (int) Math.min(Integer.MAX_VALUE, number);
    }

    @SuppressWarnings("unchecked")
    static List<Document> getRequiredDocuments(String command, Document query, String field) {
        Object value = query.get(field);
        if (Missing.isNullOrMissing(value)) {
            throw missingField(command, field);
        }
        if (!(value instanceof List<?> list)) {
            throw wrongType(command, field, value, "expected type 'array'");
        }
        for (int i = 0; i < list.size(); i++) {
            Object element = list.get(i);
            if (!(element instanceof Document)) {
                throw wrongType(command, field + "." + i, element, "expected type 'object'");
            }
        }
        return (List<Document>) list;
    }

    static ServerError missingField(String command, String field) {
        return new ServerError(ErrorCode._40414, "BSON field '" + command + "." + field + "' is missing but a required field");
    }

    static TypeMismatchException wrongType(String command, String field, Object value, String expected) {
        return new TypeMismatchException("BSON field '" + command + "." + field + "' is the wrong type '"
            + BsonType.aliasOf(value) + "', " + expected);
    }

}
