package de.bwaldvogel.docstore.backend.update;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import de.bwaldvogel.docstore.backend.Constants;
import de.bwaldvogel.docstore.backend.NumericUtils;
import de.bwaldvogel.docstore.backend.NumericUtils.LongOverflowException;
import de.bwaldvogel.docstore.backend.QueryMatcher;
import de.bwaldvogel.docstore.backend.Utils;
import de.bwaldvogel.docstore.backend.ValueComparator;
import de.bwaldvogel.docstore.bson.BsonTimestamp;
import de.bwaldvogel.docstore.bson.BsonType;
import de.bwaldvogel.docstore.bson.Decimal128;
import de.bwaldvogel.docstore.bson.Document;
import de.bwaldvogel.docstore.bson.Json;
import de.bwaldvogel.docstore.bson.Missing;
import de.bwaldvogel.docstore.exception.BadValueException;
import de.bwaldvogel.docstore.exception.ErrorCode;
import de.bwaldvogel.docstore.exception.FailedToParseException;
import de.bwaldvogel.docstore.exception.PathNotViableException;
import de.bwaldvogel.docstore.exception.ServerError;
import de.bwaldvogel.docstore.exception.TypeMismatchException;

/**
 * Applies the fields of a single update operator, e.g. the {@code {a: 1, b: 2}} of {@code {$inc: {a: 1, b: 2}}},
 * to a document. Fields are applied in sorted path order.
 */
class FieldUpdates {

    private static final AtomicInteger TIMESTAMP_INCREMENT = new AtomicInteger();

    private final Document document;
    private final UpdateOperator updateOperator;
    private final boolean isUpsert;
    private final QueryMatcher matcher;

    FieldUpdates(Document document, UpdateOperator updateOperator, boolean isUpsert, QueryMatcher matcher) {
        this.document = document;
        this.updateOperator = updateOperator;
        this.isUpsert = isUpsert;
        this.matcher = matcher;
    }

    /**
     * @return whether the document was changed
     */
    boolean apply(Document change) {
        List<String> keys = new ArrayList<>(change.keySet());
        if (updateOperator != UpdateOperator.INC && updateOperator != UpdateOperator.MUL) {
            Collections.sort(keys);
        }
        boolean changed = false;
        for (String key : keys) {
            Object value = change.get(key);
            if (applyField(key, value)) {
                changed = true;
            }
        }
        return changed;
    }

    private boolean applyField(String key, Object value) {
        switch (updateOperator) {
            case SET:
                return handleSet(key, value, false);
            case SET_ON_INSERT:
                if (!isUpsert) {
                    return false;
                }
                return handleSet(key, value, true);
            case UNSET:
                return !(Utils.removeSubdocumentValue(document, key) instanceof Missing);
            case INC:
                return handleInc(key, value);
            case MUL:
                return handleMul(key, value);
            case MIN:
                return handleMinMax(key, value, -1);
            case MAX:
                return handleMinMax(key, value, 1);
            case RENAME:
                return handleRename(key, value);
            case CURRENT_DATE:
                return handleCurrentDate(key, value);
            case PUSH:
                return handlePush(key, value, false);
            case ADD_TO_SET:
                return handlePush(key, value, true);
            case POP:
                return handlePop(key, value);
            case PULL:
                return handlePull(key, value);
            case PULL_ALL:
                return handlePullAll(key, value);
            default:
                throw new IllegalArgumentException("unsupported update operator: " + updateOperator);
        }
    }

    private boolean handleSet(String key, Object value, boolean setOnInsert) {
        if (setOnInsert) {
            if (value == null) {
                return false;
            }
            if (value instanceof List<?> list && list.isEmpty()) {
                return false;
            }
        }

        Object oldValue = Utils.getSubdocumentValue(document, key);
        if (!(oldValue instanceof Missing) && isIdentical(oldValue, value)) {
            return false;
        }

        if (setOnInsert && key.contains(".")) {
            return false;
        }

        Utils.changeSubdocumentValue(document, key, Document.cloneValue(value));
        return true;
    }

    private static boolean isIdentical(Object oldValue, Object newValue) {
        if (oldValue == null || newValue == null) {
            return oldValue == newValue;
        }
        return oldValue.equals(newValue);
    }

    private boolean handleInc(String key, Object value) {
        if (!BsonType.isNumber(value)) {
            throw new TypeMismatchException("Cannot increment with non-numeric argument: {" + key + ": " + Json.toCompactJsonValue(value) + "}");
        }
        Number increment = (Number) value;

        Object oldValue = Utils.getSubdocumentValue(document, key);
        if (oldValue instanceof Missing) {
            Utils.changeSubdocumentValue(document, key, increment);
            return true;
        }

        if (!BsonType.isNumber(oldValue)) {
            throw new TypeMismatchException("Cannot apply $inc to a value of non-numeric type. {_id: " + formatId() + "}"
                + " has the field '" + lastPathElement(key) + "' of non-numeric type " + BsonType.aliasOf(oldValue));
        }

        Number oldNumber = (Number) oldValue;
        Number newNumber;
        try {
            newNumber = NumericUtils.addNumbers(oldNumber, increment);
        } catch (LongOverflowException e) {
            throw new BadValueException("Failed to apply $inc operations to current value ((NumberLong)" + oldNumber + ")"
                + " for document {_id: \"" + document.get(Constants.ID_FIELD) + "\"}");
        }
        checkNoInfinityProduced(key, oldNumber, increment, newNumber);
        Utils.changeSubdocumentValue(document, key, newNumber);

        if (NumericUtils.isNaN(oldNumber)) {
            return true;
        }
        return ValueComparator.compareNumbers(oldNumber, newNumber) != 0 || !oldNumber.getClass().equals(newNumber.getClass());
    }

    private boolean handleMul(String key, Object value) {
        if (!BsonType.isNumber(value)) {
            throw new TypeMismatchException("Cannot multiply with non-numeric argument: {" + key + ": " + Json.toCompactJsonValue(value) + "}");
        }
        Number factor = (Number) value;

        Object oldValue = Utils.getSubdocumentValue(document, key);
        if (oldValue instanceof Missing) {
            Utils.changeSubdocumentValue(document, key, NumericUtils.zeroOf(factor));
            return true;
        }

        if (!BsonType.isNumber(oldValue)) {
            throw new TypeMismatchException("Cannot apply $mul to a value of non-numeric type. {_id: " + formatId() + "}"
                + " has the field '" + lastPathElement(key) + "' of non-numeric type " + BsonType.aliasOf(oldValue));
        }

        Number oldNumber = (Number) oldValue;
        Number newNumber;
        try {
            newNumber = NumericUtils.multiplyNumbers(oldNumber, factor);
        } catch (LongOverflowException e) {
            throw new BadValueException("Failed to apply $mul operations to current value ((NumberLong)" + oldNumber + ")"
                + " for document {_id: \"" + document.get(Constants.ID_FIELD) + "\"}");
        }
        checkNoInfinityProduced(key, oldNumber, factor, newNumber);
        Utils.changeSubdocumentValue(document, key, newNumber);

        // int 0 turning into long 0 counts as a change
        return !oldNumber.equals(newNumber);
    }

    private static void checkNoInfinityProduced(String key, Number operand1, Number operand2, Number result) {
        if (isInfinite(result) && !isInfinite(operand1) && !isInfinite(operand2)) {
            throw new BadValueException("update produces invalid value: " + Json.toValidationJson(key, result.doubleValue())
                + " (update operations that produce infinity values are not allowed)");
        }
    }

    private static boolean isInfinite(Number number) {
        if (number instanceof Decimal128 decimal) {
            return decimal.isInfinite();
        }
        return number instanceof Double doubleValue && doubleValue.isInfinite();
    }

    private boolean handleMinMax(String key, Object value, int direction) {
        Object oldValue = Utils.getSubdocumentValue(document, key);
        if (oldValue instanceof Missing) {
            Utils.changeSubdocumentValue(document, key, Document.cloneValue(value));
            return true;
        }
        int cmp = ValueComparator.asc().compare(value, oldValue);
        if (cmp * direction > 0) {
            Utils.changeSubdocumentValue(document, key, Document.cloneValue(value));
            return true;
        }
        return false;
    }

    private boolean handleRename(String key, Object value) {
        if (key.isEmpty() || "".equals(value)) {
            throw new ServerError(ErrorCode.EmptyFieldName, "An empty update path is not valid.");
        }
        String target = (String) value;
        if (Utils.splitPath(key).stream().anyMatch(String::isEmpty)) {
            throw new ServerError(ErrorCode.EmptyFieldName,
                "The update path '" + key + "' contains an empty field name, which is not allowed.");
        }

        Object oldValue = getValueForTraversal(key);
        if (oldValue instanceof Missing) {
            return false;
        }

        Utils.removeSubdocumentValue(document, key);
        Utils.changeSubdocumentValue(document, target, oldValue);
        return true;
    }

    private Object getValueForTraversal(String key) {
        Object current = document;
        for (String field : Utils.splitPath(key)) {
            if (current instanceof List<?> && !Utils.isArrayIndex(field)) {
                throw new PathNotViableException("cannot use path '" + key + "' to traverse the document");
            }
            current = Utils.getFieldValueListSafe(current, field);
            if (current instanceof Missing) {
                return current;
            }
        }
        return current;
    }

    private boolean handleCurrentDate(String key, Object value) {
        Instant now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        if (value instanceof Document typeSpecification && "timestamp".equals(typeSpecification.get("$type"))) {
            Utils.changeSubdocumentValue(document, key, new BsonTimestamp(now, TIMESTAMP_INCREMENT.incrementAndGet()));
        } else {
            Utils.changeSubdocumentValue(document, key, now);
        }
        return true;
    }

    private boolean handlePush(String key, Object value, boolean addToSet) {
        List<?> each = null;
        if (value instanceof Document pushDocument && pushDocument.containsKey("$each")) {
            Object eachValue = pushDocument.get("$each");
            if (!(eachValue instanceof List<?> eachList)) {
                if (addToSet) {
                    throw new TypeMismatchException("The argument to $each in $addToSet must be an array but it was of type "
                        + BsonType.aliasOf(eachValue));
                }
                throw new BadValueException("The argument to $each in $push must be an array but it was of type: "
                    + BsonType.aliasOf(eachValue));
            }
            each = eachList;
        }
        if (each == null) {
            each = Collections.singletonList(value);
        }

        Object oldValue = Utils.getSubdocumentValue(document, key);
        List<Object> array;
        if (oldValue instanceof Missing) {
            array = new ArrayList<>();
            Utils.changeSubdocumentValue(document, key, array);
        } else if (oldValue instanceof List<?>) {
            @SuppressWarnings("unchecked")
            List<Object> existing = (List<Object>) oldValue;
            array = existing;
        } else {
            throw new BadValueException("The field '" + key + "' must be an array but is of type '" + BsonType.aliasOf(oldValue)
                + "' in document {_id: " + formatId() + "}");
        }

        boolean changed = false;
        for (Object element : each) {
            if (addToSet && Utils.containsNullAware(array, element)) {
                continue;
            }
            array.add(Document.cloneValue(element));
            changed = true;
        }
        return changed || oldValue instanceof Missing;
    }

    private boolean handlePop(String key, Object value) {
        if (!BsonType.isNumber(value) || NumericUtils.isNaN(value)
            || ((Number) value).doubleValue() != Math.rint(((Number) value).doubleValue())) {
            throw new FailedToParseException("Expected a number in: " + key + ": \"" + value + "\"");
        }
        long popValue = ((Number) value).longValue();
        if (popValue != 1 && popValue != -1) {
            throw new FailedToParseException("$pop expects 1 or -1, found: " + popValue);
        }

        Object oldValue = Utils.getSubdocumentValue(document, key);
        if (oldValue instanceof Missing) {
            checkTraversable(key);
            return false;
        }
        if (!(oldValue instanceof List<?> array)) {
            throw new TypeMismatchException("Path '" + key + "' contains an element of non-array type '" + BsonType.aliasOf(oldValue) + "'");
        }
        if (array.isEmpty()) {
            return false;
        }
        if (popValue == -1) {
            array.remove(0);
        } else {
            array.remove(array.size() - 1);
        }
        return true;
    }

    private boolean handlePull(String key, Object value) {
        Object oldValue = Utils.getSubdocumentValue(document, key);
        if (oldValue instanceof Missing) {
            checkTraversable(key);
            return false;
        }
        if (!(oldValue instanceof List<?> array)) {
            throw new BadValueException("Cannot apply $pull to a non-array value");
        }
        boolean changed = false;
        for (Iterator<?> iterator = array.iterator(); iterator.hasNext(); ) {
            Object element = iterator.next();
            if (matcher.matchesValue(value, element)) {
                iterator.remove();
                changed = true;
            }
        }
        return changed;
    }

    private boolean handlePullAll(String key, Object value) {
        if (!(value instanceof List<?> pullValues)) {
            throw new BadValueException("The field '" + key + "' must be an array but is of type '" + BsonType.aliasOf(value) + "'");
        }
        Object oldValue = Utils.getSubdocumentValue(document, key);
        if (oldValue instanceof Missing) {
            checkTraversable(key);
            return false;
        }
        if (!(oldValue instanceof List<?> array)) {
            throw new BadValueException("The field '" + key + "' must be an array but is of type '" + BsonType.aliasOf(oldValue)
                + "' in document {_id: " + formatId() + "}");
        }
        return array.removeIf(element -> Utils.containsNullAware(pullValues, element));
    }

    /**
     * A missing array may be ignored, unless the path runs into a value that cannot be traversed.
     */
    private void checkTraversable(String key) {
        List<String> fields = Utils.splitPath(key);
        Object current = document;
        String parentKey = null;
        for (int i = 0; i < fields.size() - 1; i++) {
            String field = fields.get(i);
            if (current instanceof List<?> && !Utils.isArrayIndex(field)) {
                throw unsuitableValue(field, key, parentKey, current);
            }
            Object next = Utils.getFieldValueListSafe(current, field);
            if (next instanceof Missing) {
                return;
            }
            if (!(next instanceof Document) && !(next instanceof List<?>)) {
                throw unsuitableValue(fields.get(i + 1), key, field, next);
            }
            parentKey = field;
            current = next;
        }
    }

    private static PathNotViableException unsuitableValue(String part, String fullPath, String parentKey, Object element) {
        return new PathNotViableException("Cannot use the part (" + part + ") of (" + fullPath + ") to traverse the element"
            + " ({" + parentKey + ": " + Json.toCompactJsonValue(element) + "})");
    }

    private String formatId() {
        return Json.toCompactJsonValue(document.get(Constants.ID_FIELD));
    }

    private static String lastPathElement(String key) {
        int dotPos = key.lastIndexOf('.');
        return dotPos < 0 ? key : key.substring(dotPos + 1);
    }

}
