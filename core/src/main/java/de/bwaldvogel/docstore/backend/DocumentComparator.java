package de.bwaldvogel.docstore.backend;

import java.util.Comparator;
import java.util.List;

import de.bwaldvogel.docstore.bson.Document;
import de.bwaldvogel.docstore.bson.Missing;

/**
 * Orders documents by a sort specification such as {@code {a: 1, b: -1}}. An array field sorts by its smallest
 * element in ascending order and by its largest element in descending order.
 */
public class DocumentComparator implements Comparator<Document> {

    private final Document orderBy;

    public DocumentComparator(Document orderBy) {
        if (orderBy == null || orderBy.keySet().isEmpty()) {
            throw new IllegalArgumentException();
        }
        this.orderBy = orderBy;
    }

    @Override
    public int compare(Document document1, Document document2) {
        for (String sortKey : orderBy.keySet()) {
            boolean descending = ((Number) orderBy.get(sortKey)).intValue() < 0;
            ValueComparator valueComparator = descending ? ValueComparator.desc() : ValueComparator.asc();
            Object value1 = sortValue(document1, sortKey, valueComparator);
            Object value2 = sortValue(document2, sortKey, valueComparator);
            int cmp = valueComparator.compare(value1, value2);
            if (cmp != 0) {
                return cmp;
            }
        }
        return 0;
    }

    private static Object sortValue(Document document, String sortKey, ValueComparator valueComparator) {
        Object value = Utils.getSubdocumentValueCollectionAware(document, sortKey);
        if (value instanceof List<?> list) {
            return list.stream()
                .min(valueComparator)
                .map(Object.class::cast)
                .orElse(Missing.getInstance());
        }
        return value;
    }

}
