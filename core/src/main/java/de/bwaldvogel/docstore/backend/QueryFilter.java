package de.bwaldvogel.docstore.backend;

import java.util.HashMap;
import java.util.Map;

enum QueryFilter {

    AND("$and"),
    OR("$or"),
    NOR("$nor"),
    ;

    private final String value;

    QueryFilter(String value) {
        this.value = value;
    }

    String getValue() {
        return value;
    }

    private static final Map<String, QueryFilter> MAP = new HashMap<>();

    static {
        for (QueryFilter filter : QueryFilter.values()) {
            MAP.put(filter.getValue(), filter);
        }
    }

    static boolean isQueryFilter(String value) {
        return MAP.containsKey(value);
    }

    static QueryFilter fromValue(String value) {
        QueryFilter filter = MAP.get(value);
        if (filter == null) {
            throw new IllegalArgumentException("unknown query filter: " + value);
        }
        return filter;
    }

    @Override
    public String toString() {
        return value;
    }

}
