package de.bwaldvogel.docstore.backend;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map.Entry;

import de.bwaldvogel.docstore.bson.BinData;
import de.bwaldvogel.docstore.bson.BsonRegularExpression;
import de.bwaldvogel.docstore.bson.BsonTimestamp;
import de.bwaldvogel.docstore.bson.Decimal128;
import de.bwaldvogel.docstore.bson.Document;
import de.bwaldvogel.docstore.bson.Missing;
import de.bwaldvogel.docstore.bson.ObjectId;

/**
 * Total order over all values.
 * <p>
 * null (and missing) &lt; numbers &lt; string &lt; object &lt; array &lt; binData &lt; objectId &lt; bool &lt;
 * date &lt; timestamp &lt; regex.
 * Numbers of different kinds are compared by value; NaN is lower than every other number.
 */
public class ValueComparator implements Comparator<Object> {

    private static final List<Class<?>> SORT_PRIORITY = new ArrayList<>();

    private static final ValueComparator ASCENDING = new ValueComparator(false);
    private static final ValueComparator DESCENDING = new ValueComparator(true);

    static {
        SORT_PRIORITY.add(Number.class);
        SORT_PRIORITY.add(String.class);
        SORT_PRIORITY.add(Document.class);
        SORT_PRIORITY.add(List.class);
        SORT_PRIORITY.add(BinData.class);
        SORT_PRIORITY.add(ObjectId.class);
        SORT_PRIORITY.add(Boolean.class);
        SORT_PRIORITY.add(Instant.class);
        SORT_PRIORITY.add(BsonTimestamp.class);
        SORT_PRIORITY.add(BsonRegularExpression.class);
    }

    private final boolean reversed;

    private ValueComparator(boolean reversed) {
        this.reversed = reversed;
    }

    public static ValueComparator asc() {
        return ASCENDING;
    }

    public static ValueComparator desc() {
        return DESCENDING;
    }

    @Override
    public int compare(Object value1, Object value2) {
        int cmp = compareAscending(value1, value2);
        return reversed ? -cmp : cmp;
    }

    private static int compareAscending(Object value1, Object value2) {
        if (value1 instanceof Missing) {
            value1 = null;
        }

        if (value2 instanceof Missing) {
            value2 = null;
        }

        // also catches null/null case
        if (value1 == value2) {
            return 0;
        }

        if (value1 == null) {
            return -1;
        } else if (value2 == null) {
            return 1;
        }

        int t1 = getTypeOrder(value1);
        int t2 = getTypeOrder(value2);
        if (t1 != t2) {
            return t1 < t2 ? -1 : +1;
        }

        if (value1 instanceof Number number1) {
            return compareNumbers(number1, (Number) value2);
        }

        if (value1 instanceof String string1) {
            return string1.compareTo((String) value2);
        }

        if (value1 instanceof Document document1) {
            return compareDocuments(document1, (Document) value2);
        }

        if (value1 instanceof List<?> list1) {
            return compareLists(list1, (List<?>) value2);
        }

        if (value1 instanceof BinData binData1) {
            return binData1.compareTo((BinData) value2);
        }

        if (value1 instanceof ObjectId objectId1) {
            return objectId1.compareTo((ObjectId) value2);
        }

        if (value1 instanceof Boolean boolean1) {
            return boolean1.compareTo((Boolean) value2);
        }

        if (value1 instanceof Instant instant1) {
            return instant1.compareTo((Instant) value2);
        }

        if (value1 instanceof BsonTimestamp timestamp1) {
            return timestamp1.compareTo((BsonTimestamp) value2);
        }

        if (value1 instanceof BsonRegularExpression regex1) {
            BsonRegularExpression regex2 = (BsonRegularExpression) value2;
            int cmp = regex1.getPattern().compareTo(regex2.getPattern());
            if (cmp != 0) {
                return cmp;
            }
            return regex1.getOptions().compareTo(regex2.getOptions());
        }

        throw new UnsupportedOperationException("can't compare " + value1.getClass());
    }

    public static int compareNumbers(Number number1, Number number2) {
        boolean nan1 = NumericUtils.isNaN(number1);
        boolean nan2 = NumericUtils.isNaN(number2);
        if (nan1 || nan2) {
            return Boolean.compare(!nan1, !nan2);
        }
        if (isIntegral(number1) && isIntegral(number2)) {
            return Long.compare(number1.longValue(), number2.longValue());
        }
        if (isInfinite(number1) || isInfinite(number2)) {
            return Double.compare(number1.doubleValue(), number2.doubleValue());
        }
        return toBigDecimal(number1).compareTo(toBigDecimal(number2));
    }

    private static boolean isIntegral(Number number) {
        return number instanceof Integer || number instanceof Long;
    }

    private static boolean isInfinite(Number number) {
        if (number instanceof Decimal128 decimal) {
            return decimal.isInfinite();
        }
        return Double.isInfinite(number.doubleValue());
    }

    private static BigDecimal toBigDecimal(Number number) {
        if (number instanceof Decimal128 decimal) {
            return decimal.toBigDecimal();
        }
        if (isIntegral(number)) {
            return BigDecimal.valueOf(number.longValue());
        }
        return new BigDecimal(number.doubleValue());
    }

    private static int compareDocuments(Document document1, Document document2) {
        Iterator<Entry<String, Object>> iterator2 = document2.entrySet().iterator();
        for (Entry<String, Object> entry1 : document1.entrySet()) {
            if (!iterator2.hasNext()) {
                return 1;
            }
            Entry<String, Object> entry2 = iterator2.next();
            int typeCmp = Integer.compare(getTypeOrderNullAware(entry1.getValue()), getTypeOrderNullAware(entry2.getValue()));
            if (typeCmp != 0) {
                return typeCmp;
            }
            int keyCmp = entry1.getKey().compareTo(entry2.getKey());
            if (keyCmp != 0) {
                return keyCmp;
            }
            int valueCmp = compareAscending(entry1.getValue(), entry2.getValue());
            if (valueCmp != 0) {
                return valueCmp;
            }
        }
        return iterator2.hasNext() ? -1 : 0;
    }

    private static int compareLists(List<?> list1, List<?> list2) {
        for (int i = 0; i < Math.min(list1.size(), list2.size()); i++) {
            int cmp = compareAscending(list1.get(i), list2.get(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(list1.size(), list2.size());
    }

    private static int getTypeOrderNullAware(Object value) {
        if (Missing.isNullOrMissing(value)) {
            return -1;
        }
        return getTypeOrder(value);
    }

    static int getTypeOrder(Object obj) {
        for (int idx = 0; idx < SORT_PRIORITY.size(); idx++) {
            if (SORT_PRIORITY.get(idx).isAssignableFrom(obj.getClass())) {
                return idx;
            }
        }
        throw new UnsupportedOperationException("can't sort " + obj.getClass());
    }

}
