package de.bwaldvogel.docstore.backend;

import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import de.bwaldvogel.docstore.bson.BsonRegularExpression;
import de.bwaldvogel.docstore.bson.BsonType;
import de.bwaldvogel.docstore.bson.Decimal128;
import de.bwaldvogel.docstore.bson.Document;
import de.bwaldvogel.docstore.bson.Missing;
import de.bwaldvogel.docstore.exception.BadValueException;

public class DefaultQueryMatcher implements QueryMatcher {

    private static final Logger log = LoggerFactory.getLogger(DefaultQueryMatcher.class);

    private static final String COMMENT = "$comment";

    private final ValueComparator comparator = ValueComparator.asc();

    @Override
    public boolean matches(Document document, Document query) {
        for (String key : query.keySet()) {
            Object queryValue = query.get(key);
            if (key.equals(COMMENT)) {
                log.debug("query comment: '{}'", queryValue);
                continue;
            }
            if (QueryFilter.isQueryFilter(key)) {
                if (!checkMatch(queryValue, QueryFilter.fromValue(key), document)) {
                    return false;
                }
                continue;
            }
            if (key.startsWith("$")) {
                throw new BadValueException("unknown top level operator: " + key);
            }
            validateQueryValue(queryValue);
            List<Object> values = collectValues(document, splitKey(key));
            if (!checkMatchesField(queryValue, values)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean matchesValue(Object queryValue, Object value) {
        if (queryValue instanceof Document queryDocument && !isOperatorDocument(queryDocument)
            && value instanceof Document document) {
            return matches(document, queryDocument);
        }
        validateQueryValue(queryValue);
        return checkMatchesField(queryValue, Collections.singletonList(value));
    }

    private static List<String> splitKey(String key) {
        List<String> keys = Utils.splitPath(key);
        for (String subKey : keys) {
            if (subKey.isEmpty()) {
                throw new BadValueException("illegal key: " + key);
            }
        }
        return keys;
    }

    private static boolean isOperatorDocument(Document queryValue) {
        return !queryValue.isEmpty() && queryValue.keySet().iterator().next().startsWith("$");
    }

    private static void validateQueryValue(Object queryValue) {
        if (!(queryValue instanceof Document queryObject) || !isOperatorDocument(queryObject)) {
            return;
        }
        for (String operator : queryObject.keySet()) {
            QueryOperator.fromValue(operator);
        }
        if (queryObject.containsKey(QueryOperator.OPTIONS.getValue()) && !queryObject.containsKey(QueryOperator.REGEX.getValue())) {
            throw new BadValueException("$options needs a $regex");
        }
    }

    /**
     * All values a dotted path refers to. Documents inside arrays are traversed, so {@code a.b} on
     * {@code {a: [{b: 1}, {b: 2}]}} yields {@code 1} and {@code 2}.
     */
    static List<Object> collectValues(Object value, List<String> keys) {
        String key = keys.get(0);
        List<String> subKeys = keys.subList(1, keys.size());
        if (value instanceof Document document) {
            return descend(document.getOrMissing(key), subKeys);
        } else if (value instanceof List<?> list) {
            List<Object> values = new ArrayList<>();
            if (Utils.isArrayIndex(key)) {
                int pos = Integer.parseInt(key);
                if (pos < list.size()) {
                    values.addAll(descend(list.get(pos), subKeys));
                }
            }
            for (Object element : list) {
                if (element instanceof Document) {
                    values.addAll(collectValues(element, keys));
                }
            }
            if (values.isEmpty()) {
                values.add(Missing.getInstance());
            }
            return values;
        } else {
            return Collections.singletonList(Missing.getInstance());
        }
    }

    private static List<Object> descend(Object value, List<String> subKeys) {
        if (subKeys.isEmpty() || value instanceof Missing) {
            return Collections.singletonList(value);
        }
        return collectValues(value, subKeys);
    }

    private boolean checkMatchesField(Object queryValue, List<Object> values) {
        if (queryValue instanceof Document queryObject && isOperatorDocument(queryObject)) {
            for (String operator : queryObject.keySet()) {
                if (!checkExpressionMatch(queryObject, operator, values)) {
                    return false;
                }
            }
            return true;
        }
        if (queryValue instanceof BsonRegularExpression regularExpression) {
            return anyValueOrElement(values, value -> matchesRegex(regularExpression, value));
        }
        return anyValueOrElement(values, value -> Utils.nullAwareEquals(value, queryValue));
    }

    private boolean checkExpressionMatch(Document queryObject, String operator, List<Object> values) {
        Object expressionValue = queryObject.get(operator);
        QueryOperator queryOperator = QueryOperator.fromValue(operator);
        switch (queryOperator) {
            case EQUAL:
                return anyValueOrElement(values, value -> Utils.nullAwareEquals(value, expressionValue));
            case NOT_EQUALS:
                return !anyValueOrElement(values, value -> Utils.nullAwareEquals(value, expressionValue));
            case IN:
                return anyValueOrElement(values, value -> checkIn(requireArray(expressionValue, operator), value));
            case NOT_IN:
                return !anyValueOrElement(values, value -> checkIn(requireArray(expressionValue, operator), value));
            case GREATER_THAN:
            case GREATER_THAN_OR_EQUAL:
            case LESS_THAN:
            case LESS_THAN_OR_EQUAL:
                return anyValueOrElement(values, value -> checkComparison(queryOperator, value, expressionValue));
            case EXISTS:
                boolean exists = values.stream().anyMatch(value -> !(value instanceof Missing));
                return exists == Utils.isTrue(expressionValue);
            case TYPE:
                List<BsonType> types = parseTypes(expressionValue);
                boolean matchesNumber = isNumberAlias(expressionValue);
                return anyValueOrElement(values, value -> checkType(types, matchesNumber, value));
            case MOD:
                List<Number> mod = parseMod(expressionValue);
                return anyValueOrElement(values, value -> checkMod(mod, value));
            case SIZE:
                int size = parseSize(expressionValue);
                return values.stream().anyMatch(value -> value instanceof List<?> list && list.size() == size);
            case ALL:
                return checkAll(requireArray(expressionValue, operator), values);
            case ELEM_MATCH:
                if (!(expressionValue instanceof Document elemMatch)) {
                    throw new BadValueException("$elemMatch needs an Object");
                }
                return values.stream().anyMatch(value -> checkElemMatch(elemMatch, value));
            case REGEX:
                BsonRegularExpression regularExpression = BsonRegularExpression.convertToRegularExpression(queryObject);
                regularExpression.toPattern();
                return anyValueOrElement(values, value -> matchesRegex(regularExpression, value));
            case OPTIONS:
                // evaluated together with $regex
                return true;
            case NOT:
                return !checkMatchesField(parseNot(expressionValue), values);
            default:
                throw new IllegalArgumentException("unhandled query operator: " + queryOperator);
        }
    }

    private static boolean anyValueOrElement(List<Object> values, Predicate<Object> predicate) {
        for (Object value : values) {
            if (predicate.test(value)) {
                return true;
            }
            if (value instanceof List<?> list) {
                for (Object element : list) {
                    if (predicate.test(element)) {
                        return true;
                    }
                }
            }
        }
        return false;
    }

    private static List<?> requireArray(Object expressionValue, String operator) {
        if (!(expressionValue instanceof List<?> list)) {
            throw new BadValueException(operator + " needs an array");
        }
        return list;
    }

    private static boolean checkIn(List<?> queriedObjects, Object value) {
        for (Object queriedObject : queriedObjects) {
            if (queriedObject instanceof BsonRegularExpression regularExpression) {
                if (matchesRegex(regularExpression, value)) {
                    return true;
                }
            } else if (queriedObject instanceof Document queriedDocument && isOperatorDocument(queriedDocument)) {
                throw new BadValueException("cannot nest $ under $in");
            } else if (Utils.nullAwareEquals(queriedObject, value)) {
                return true;
            }
        }
        return false;
    }

    private boolean checkComparison(QueryOperator operator, Object value, Object expressionValue) {
        if (expressionValue == null) {
            boolean inclusive = operator == QueryOperator.GREATER_THAN_OR_EQUAL || operator == QueryOperator.LESS_THAN_OR_EQUAL;
            return inclusive && Missing.isNullOrMissing(value);
        }
        if (!comparableTypes(value, expressionValue)) {
            return false;
        }
        int cmp = comparator.compare(value, expressionValue);
        switch (operator) {
            case GREATER_THAN:
                return cmp > 0;
            case GREATER_THAN_OR_EQUAL:
                return cmp >= 0;
            case LESS_THAN:
                return cmp < 0;
            case LESS_THAN_OR_EQUAL:
                return cmp <= 0;
            default:
                throw new IllegalArgumentException("not a comparison: " + operator);
        }
    }

    private static boolean comparableTypes(Object value1, Object value2) {
        if (Missing.isNullOrMissing(value1) || Missing.isNullOrMissing(value2)) {
            return false;
        }
        return ValueComparator.getTypeOrder(value1) == ValueComparator.getTypeOrder(value2);
    }

    private static boolean matchesRegex(BsonRegularExpression regularExpression, Object value) {
        if (value instanceof String string) {
            return regularExpression.matches(string);
        }
        return regularExpression.equals(value);
    }

    private static boolean isNumberAlias(Object expressionValue) {
        if (expressionValue instanceof List<?> list) {
            return list.stream().anyMatch(DefaultQueryMatcher::isNumberAlias);
        }
        return "number".equals(expressionValue);
    }

    private static List<BsonType> parseTypes(Object expressionValue) {
        List<BsonType> types = new ArrayList<>();
        if (expressionValue instanceof List<?> list) {
            for (Object element : list) {
                types.addAll(parseTypes(element));
            }
        } else if (expressionValue instanceof String alias) {
            if (!alias.equals("number")) {
                BsonType type = BsonType.forAlias(alias);
                if (type == null) {
                    throw new BadValueException("Unknown type name alias: " + alias);
                }
                types.add(type);
            }
        } else if (BsonType.isNumber(expressionValue)) {
            Number number = (Number) expressionValue;
            BsonType type = BsonType.forNumber(number.intValue());
            if (type == null || number.doubleValue() != number.intValue()) {
                throw new BadValueException("Invalid numerical type code: " + number);
            }
            types.add(type);
        } else {
            throw new BadValueException("type must be represented as a number or a string");
        }
        return types;
    }

    private static boolean checkType(List<BsonType> types, boolean matchesNumber, Object value) {
        if (value instanceof Missing) {
            return false;
        }
        if (matchesNumber && BsonType.isNumber(value)) {
            return true;
        }
        return types.stream().anyMatch(type -> type.matches(value));
    }

    private static List<Number> parseMod(Object expressionValue) {
        if (!(expressionValue instanceof List<?> list)) {
            throw new BadValueException("malformed mod, needs to be an array");
        }
        if (list.size() < 2) {
            throw new BadValueException("malformed mod, not enough elements");
        }
        if (list.size() > 2) {
            throw new BadValueException("malformed mod, too many elements");
        }
        if (!BsonType.isNumber(list.get(0))) {
            throw new BadValueException("malformed mod, divisor not a number");
        }
        if (!BsonType.isNumber(list.get(1))) {
            throw new BadValueException("malformed mod, remainder not a number");
        }
        Number divisor = (Number) list.get(0);
        Number remainder = (Number) list.get(1);
        if (NumericUtils.isNaN(divisor) || Double.isInfinite(divisor.doubleValue())) {
            throw new BadValueException("malformed mod, divisor value is invalid :: caused by :: Unable to coerce NaN/Inf to integral type");
        }
        if (NumericUtils.isNaN(remainder) || Double.isInfinite(remainder.doubleValue())) {
            throw new BadValueException("malformed mod, remainder value is invalid :: caused by :: Unable to coerce NaN/Inf to integral type");
        }
        if (divisor.longValue() == 0) {
            throw new BadValueException("divisor cannot be 0");
        }
        return List.of(Long.valueOf(divisor.longValue()), Long.valueOf(remainder.longValue()));
    }

    private static boolean checkMod(List<Number> mod, Object value) {
        if (!BsonType.isNumber(value) || NumericUtils.isNaN(value)) {
            return false;
        }
        Number number = (Number) value;
        if (Double.isInfinite(number.doubleValue())) {
            return false;
        }
        long truncated = number instanceof Decimal128 decimal
            ? decimal.toBigDecimal().setScale(0, RoundingMode.DOWN).longValue()
            : number.longValue();
        return truncated % mod.get(0).longValue() == mod.get(1).longValue();
    }

    private static int parseSize(Object expressionValue) {
        if (!BsonType.isNumber(expressionValue)) {
            throw new BadValueException("$size needs a number");
        }
        Number number = (Number) expressionValue;
        if (NumericUtils.isNaN(number) || number.doubleValue() != Math.rint(number.doubleValue())) {
            throw new BadValueException("$size must be a whole number");
        }
        if (number.doubleValue() < 0) {
            throw new BadValueException("$size may not be negative");
        }
        return number.intValue();
    }

    private boolean checkAll(List<?> queryValues, List<Object> values) {
        if (queryValues.isEmpty()) {
            return false;
        }
        for (Object queryValue : queryValues) {
            if (!checkMatchesField(queryValue, values)) {
                return false;
            }
        }
        return true;
    }

    private boolean checkElemMatch(Document elemMatch, Object value) {
        if (!(value instanceof List<?> list)) {
            return false;
        }
        for (Object element : list) {
            if (isOperatorDocument(elemMatch) && !isLogicalOperatorDocument(elemMatch)) {
                if (checkMatchesField(elemMatch, Collections.singletonList(element))) {
                    return true;
                }
            } else if (element instanceof Document elementDocument && matches(elementDocument, elemMatch)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isLogicalOperatorDocument(Document queryValue) {
        return queryValue.keySet().stream().anyMatch(QueryFilter::isQueryFilter);
    }

    private static Object parseNot(Object expressionValue) {
        if (expressionValue instanceof BsonRegularExpression) {
            return expressionValue;
        }
        if (!(expressionValue instanceof Document notQuery)) {
            throw new BadValueException("$not needs a regex or a document");
        }
        if (notQuery.isEmpty()) {
            throw new BadValueException("$not cannot be empty");
        }
        validateQueryValue(notQuery);
        if (!isOperatorDocument(notQuery)) {
            throw new BadValueException("unknown operator: " + notQuery.keySet().iterator().next());
        }
        return notQuery;
    }

    private boolean checkMatch(Object queryValue, QueryFilter filter, Document document) {
        if (!(queryValue instanceof List<?> list) || list.isEmpty()) {
            throw new BadValueException("$and/$or/$nor must be a nonempty array");
        }

        for (Object subqueryValue : list) {
            if (!(subqueryValue instanceof Document)) {
                throw new BadValueException("$or/$and/$nor entries need to be full objects");
            }
        }

        switch (filter) {
            case AND:
                for (Object subqueryValue : list) {
                    if (!matches(document, (Document) subqueryValue)) {
                        return false;
                    }
                }
                return true;
            case OR:
                for (Object subqueryValue : list) {
                    if (matches(document, (Document) subqueryValue)) {
                        return true;
                    }
                }
                return false;
            case NOR:
                return !checkMatch(queryValue, QueryFilter.OR, document);
            default:
                throw new IllegalArgumentException("illegal query filter: " + filter);
        }
    }

}
