package de.bwaldvogel.docstore.backend;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

import de.bwaldvogel.docstore.bson.Decimal128;
import de.bwaldvogel.docstore.bson.Document;
import de.bwaldvogel.docstore.bson.Missing;
import de.bwaldvogel.docstore.exception.InvalidNamespaceError;
import de.bwaldvogel.docstore.exception.PathNotViableException;
import de.bwaldvogel.docstore.wire.BsonEncoder;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;

public final class Utils {

    private Utils() {
    }

    public static boolean isNullOrMissing(Object value) {
        return Missing.isNullOrMissing(value);
    }

    public static void markOkay(Document result) {
        result.put("ok", Double.valueOf(1.0));
    }

    public static boolean isTrue(Object value) {
        if (isNullOrMissing(value)) {
            return false;
        }

        if (value instanceof Boolean booleanValue) {
            return booleanValue.booleanValue();
        }

        if (value instanceof Number number) {
            return number.doubleValue() != 0.0;
        }

        return true;
    }

    public static List<String> splitPath(String path) {
        return Arrays.asList(path.split("\\.", -1));
    }

    public static String joinPath(List<String> pathFragments) {
        return String.join(".", pathFragments);
    }

    public static String getHead(String path) {
        int dotPos = path.indexOf('.');
        if (dotPos < 0) {
            return path;
        }
        return path.substring(0, dotPos);
    }

    public static String getTail(String path) {
        int dotPos = path.indexOf('.');
        if (dotPos < 0) {
            return "";
        }
        return path.substring(dotPos + 1);
    }

    public static boolean isArrayIndex(String field) {
        if (field.isEmpty() || field.length() > 9) {
            return false;
        }
        for (int i = 0; i < field.length(); i++) {
            if (!Character.isDigit(field.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Resolves a dotted path. Arrays are only traversed by numeric index.
     */
    public static Object getSubdocumentValue(Document document, String key) {
        Object current = document;
        for (String field : splitPath(key)) {
            current = getFieldValueListSafe(current, field);
            if (current instanceof Missing) {
                return current;
            }
        }
        return current;
    }

    /**
     * Resolves a dotted path like {@link #getSubdocumentValue(Document, String)}, but a non-numeric path element
     * applied to an array is applied to each of its documents. The values found that way are collected in a list.
     */
    public static Object getSubdocumentValueCollectionAware(Object value, String key) {
        String field = getHead(key);
        String subKey = getTail(key);
        Object fieldValue;
        if (value instanceof List<?> list && !isArrayIndex(field)) {
            List<Object> values = new ArrayList<>();
            for (Object element : list) {
                if (element instanceof Document) {
                    Object elementValue = getSubdocumentValueCollectionAware(element, key);
                    if (!(elementValue instanceof Missing)) {
                        values.add(elementValue);
                    }
                }
            }
            if (values.isEmpty()) {
                return Missing.getInstance();
            }
            return values;
        }
        fieldValue = getFieldValueListSafe(value, field);
        if (subKey.isEmpty() || fieldValue instanceof Missing) {
            return fieldValue;
        }
        return getSubdocumentValueCollectionAware(fieldValue, subKey);
    }

    public static Object getFieldValueListSafe(Object value, String field) {
        if (value instanceof Document document) {
            return document.getOrMissing(field);
        } else if (value instanceof List<?> list) {
            if (!isArrayIndex(field)) {
                return Missing.getInstance();
            }
            int pos = Integer.parseInt(field);
            if (pos < list.size()) {
                return list.get(pos);
            }
            return Missing.getInstance();
        } else {
            return Missing.getInstance();
        }
    }

    public static boolean hasSubdocumentValue(Document document, String key) {
        return !(getSubdocumentValue(document, key) instanceof Missing);
    }

    /**
     * Sets the value at the given dotted path, creating intermediate documents as needed. Numeric path elements
     * address array elements; arrays are padded with {@code null}.
     *
     * @throws PathNotViableException if the path runs into a value that cannot hold fields
     */
    public static void changeSubdocumentValue(Document document, String path, Object newValue) {
        List<String> fields = splitPath(path);
        Object current = document;
        for (int i = 0; i < fields.size() - 1; i++) {
            String field = fields.get(i);
            String nextField = fields.get(i + 1);
            Object next = getFieldValueListSafe(current, field);
            if (next instanceof Missing) {
                next = new Document();
                setListSafe(current, field, next);
            } else if (!(next instanceof Document) && !(next instanceof List<?>)) {
                throw new PathNotViableException(nextField, field, next);
            } else if (next instanceof List<?> && !isArrayIndex(nextField)) {
                throw new PathNotViableException(nextField, field, next);
            }
            current = next;
        }
        setListSafe(current, fields.get(fields.size() - 1), newValue);
    }

    private static void setListSafe(Object container, String field, Object value) {
        if (container instanceof List<?>) {
            if (!isArrayIndex(field)) {
                throw new IllegalArgumentException("illegal field: " + field);
            }
            int pos = Integer.parseInt(field);
            @SuppressWarnings("unchecked")
            List<Object> list = (List<Object>) container;
            while (list.size() <= pos) {
                list.add(null);
            }
            list.set(pos, value);
        } else {
            ((Document) container).put(field, value);
        }
    }

    /**
     * Removes the value at the given dotted path. Array elements are replaced by {@code null}.
     *
     * @return the removed value or {@link Missing}
     */
    public static Object removeSubdocumentValue(Document document, String path) {
        String parentPath = path.contains(".") ? path.substring(0, path.lastIndexOf('.')) : null;
        String field = path.contains(".") ? path.substring(path.lastIndexOf('.') + 1) : path;
        Object parent = parentPath == null ? document : getSubdocumentValue(document, parentPath);
        if (parent instanceof Document parentDocument) {
            if (!parentDocument.containsKey(field)) {
                return Missing.getInstance();
            }
            return parentDocument.remove(field);
        } else if (parent instanceof List<?> list && isArrayIndex(field)) {
            int pos = Integer.parseInt(field);
            if (pos < list.size()) {
                @SuppressWarnings("unchecked")
                List<Object> values = (List<Object>) list;
                return values.set(pos, null);
            }
        }
        return Missing.getInstance();
    }

    /**
     * Maps values that compare as equal to the same representation, so that they can be used as hash keys.
     * Numbers become doubles, {@link Missing} becomes {@code null}.
     */
    public static Object normalizeValue(Object value) {
        if (value instanceof Missing) {
            return null;
        }
        if (value instanceof Double doubleValue) {
            // -0.0 and 0.0
            if (doubleValue.doubleValue() == 0.0) {
                return Double.valueOf(0.0);
            }
            return doubleValue;
        }
        if (value instanceof Decimal128 decimal) {
            if (decimal.isNaN() || decimal.isInfinite()) {
                return Double.valueOf(decimal.doubleValue());
            }
            return normalizeValue(Double.valueOf(decimal.toBigDecimal().doubleValue()));
        }
        if (value instanceof Number number) {
            return normalizeValue(Double.valueOf(number.doubleValue()));
        }
        if (value instanceof Document document) {
            Document normalized = new Document();
            for (String key : document.keySet()) {
                normalized.put(key, normalizeValue(document.get(key)));
            }
            return normalized;
        }
        if (value instanceof Collection<?> collection) {
            List<Object> normalized = new ArrayList<>();
            for (Object element : collection) {
                normalized.add(normalizeValue(element));
            }
            return normalized;
        }
        return value;
    }

    public static long calculateSize(Document document) {
        ByteBuf buffer = Unpooled.buffer();
        try {
            new BsonEncoder().encodeDocument(document, buffer);
            return buffer.writerIndex();
        } finally {
            buffer.release();
        }
    }

    /**
     * Equality as used for matching: numbers of different kinds are equal if they have the same value, documents and
     * arrays are compared deeply and {@code null} equals a missing value.
     */
    public static boolean nullAwareEquals(Object a, Object b) {
        if (a == b) {
            return true;
        }
        if (isNullOrMissing(a) && isNullOrMissing(b)) {
            return true;
        }
        if (isNullOrMissing(a) || isNullOrMissing(b)) {
            return false;
        }
        return ValueComparator.asc().compare(a, b) == 0;
    }

    public static boolean containsNullAware(Collection<?> values, Object value) {
        return values.stream().anyMatch(candidate -> nullAwareEquals(candidate, value));
    }

    public static String getDatabaseNameFromFullName(String fullName) {
        int dotPos = fullName.indexOf('.');
        return fullName.substring(0, dotPos);
    }

    public static String getCollectionNameFromFullName(String fullName) {
        int dotPos = fullName.indexOf('.');
        return fullName.substring(dotPos + 1);
    }

    public static void validateCollectionName(String databaseName, String collectionName) {
        if (collectionName.isEmpty()
            || collectionName.startsWith(".")
            || collectionName.contains("$")
            || collectionName.indexOf('\0') >= 0) {
            throw InvalidNamespaceError.invalidCollectionName(collectionName);
        }
        String fullName = databaseName + "." + collectionName;
        if (fullName.getBytes(StandardCharsets.UTF_8).length > Constants.MAX_NS_LENGTH) {
            throw InvalidNamespaceError.invalidCollectionName(collectionName);
        }
    }

}
