package de.bwaldvogel.docstore.backend;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import de.bwaldvogel.docstore.bson.Decimal128;
import de.bwaldvogel.docstore.bson.Document;
import de.bwaldvogel.docstore.exception.DocumentValidationError;
import de.bwaldvogel.docstore.exception.DocumentValidationError.Kind;

/**
 * Checks the content of a document before it is stored.
 * <p>
 * The document is walked in key order. For every entry the key is checked first, then its value; the first
 * violation is reported.
 */
public final class DocumentValidator {

    public enum Mode {
        /**
         * Documents as sent by the client. NaN and infinite numbers are rejected.
         */
        INSERT,

        /**
         * Documents produced by update operators. NaN and infinite numbers can be stored that way, e.g. by
         * {@code $set}; {@code $inc} and {@code $mul} check for overflow to infinity themselves.
         */
        UPDATE,
    }

    private DocumentValidator() {
    }

    public static void validate(Document document) {
        validate(document, Mode.INSERT);
    }

    public static void validate(Document document, Mode mode) {
        validateDocument(document, mode);
    }

    private static void validateDocument(Document document, Mode mode) {
        Set<String> seenKeys = new HashSet<>();
        for (String key : document.getDecodedKeys()) {
            validateKey(document, key, seenKeys);
            validateValue(key, document.get(key), mode);
        }
    }

    private static void validateKey(Document document, String key, Set<String> seenKeys) {
        if (document.isMalformedKey(key)) {
            throw new DocumentValidationError(Kind.INVALID_UTF8_KEY, key);
        }
        if (key.startsWith("$")) {
            throw new DocumentValidationError(Kind.DOLLAR_PREFIXED_KEY, key);
        }
        if (key.contains(".")) {
            throw new DocumentValidationError(Kind.DOTTED_KEY, key);
        }
        if (!seenKeys.add(key)) {
            throw new DocumentValidationError(Kind.DUPLICATE_KEY, key);
        }
    }

    private static void validateValue(String key, Object value, Mode mode) {
        if (value instanceof Document subDocument) {
            validateDocument(subDocument, mode);
        } else if (value instanceof List<?> list) {
            for (Object element : list) {
                if (element instanceof List<?>) {
                    throw new DocumentValidationError(Kind.NESTED_ARRAY, key, value);
                }
            }
            for (Object element : list) {
                validateValue(key, element, mode);
            }
        } else if (value instanceof Double doubleValue) {
            if (mode == Mode.UPDATE) {
                return;
            }
            if (doubleValue.isInfinite()) {
                throw new DocumentValidationError(Kind.INFINITY, key, value);
            }
            if (doubleValue.isNaN()) {
                throw new DocumentValidationError(Kind.NAN, key, value);
            }
        } else if (value instanceof Decimal128 decimal) {
            if (mode == Mode.UPDATE) {
                return;
            }
            if (decimal.isInfinite()) {
                throw new DocumentValidationError(Kind.INFINITY, key, value);
            }
            if (decimal.isNaN()) {
                throw new DocumentValidationError(Kind.NAN, key, value);
            }
        }
    }

}
