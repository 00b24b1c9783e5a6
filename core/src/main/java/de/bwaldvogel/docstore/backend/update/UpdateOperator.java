package de.bwaldvogel.docstore.backend.update;

import java.util.HashMap;
import java.util.Map;

public enum UpdateOperator {

    SET("$set"),
    SET_ON_INSERT("$setOnInsert"),
    UNSET("$unset"),
    INC("$inc"),
    MUL("$mul"),
    MIN("$min"),
    MAX("$max"),
    RENAME("$rename"),
    CURRENT_DATE("$currentDate"),
    PUSH("$push"),
    ADD_TO_SET("$addToSet"),
    POP("$pop"),
    PULL("$pull"),
    PULL_ALL("$pullAll"),
    ;

    private static final Map<String, UpdateOperator> MAP = new HashMap<>();

    static {
        for (UpdateOperator operator : UpdateOperator.values()) {
            UpdateOperator old = MAP.put(operator.getValue(), operator);
            if (old != null) {
                throw new IllegalStateException("Duplicate operator value: " + operator.getValue());
            }
        }
    }

    private final String value;

    UpdateOperator(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static UpdateOperator fromValue(String value) {
        UpdateOperator op = MAP.get(value);
        if (op == null) {
            throw new IllegalArgumentException("illegal operator: " + value);
        }
        return op;
    }

    public static boolean isUpdateOperator(String value) {
        return MAP.containsKey(value);
    }

    @Override
    public String toString() {
        return value;
    }

}
