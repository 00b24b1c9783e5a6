package de.bwaldvogel.docstore.bson;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The closed set of value kinds a document may hold, with the aliases used by {@code $type} and by error messages.
 */
public enum BsonType {

    DOUBLE(1, "double", Double.class),
    STRING(2, "string", String.class),
    OBJECT(3, "object", Document.class),
    ARRAY(4, "array", List.class),
    BINARY_DATA(5, "binData", BinData.class),
    OBJECT_ID(7, "objectId", ObjectId.class),
    BOOL(8, "bool", Boolean.class),
    DATE(9, "date", Instant.class),
    NULL(10, "null", null),
    REGEX(11, "regex", BsonRegularExpression.class),
    INT(16, "int", Integer.class),
    TIMESTAMP(17, "timestamp", BsonTimestamp.class),
    LONG(18, "long", Long.class),
    DECIMAL128(19, "decimal", Decimal128.class),
    ;

    private static final Map<String, BsonType> ALIASES = Arrays.stream(values())
        .collect(Collectors.toMap(BsonType::getAlias, Function.identity()));

    private static final Map<Integer, BsonType> NUMBERS = Arrays.stream(values())
        .collect(Collectors.toMap(BsonType::getNumber, Function.identity()));

    private final int number;
    private final String alias;
    private final Class<?> javaClass;

    BsonType(int number, String alias, Class<?> javaClass) {
        this.number = number;
        this.alias = alias;
        this.javaClass = javaClass;
    }

    public int getNumber() {
        return number;
    }

    public String getAlias() {
        return alias;
    }

    public boolean matches(Object value) {
        if (value == null) {
            return this == NULL;
        }
        return javaClass != null && javaClass.isInstance(value);
    }

    public static BsonType forAlias(String alias) {
        return ALIASES.get(alias);
    }

    public static BsonType forNumber(int number) {
        return NUMBERS.get(number);
    }

    public static Optional<BsonType> of(Object value) {
        return Arrays.stream(values())
            .filter(type -> type.matches(value))
            .findFirst();
    }

    /**
     * The alias of the value's kind, as quoted in type-related error messages.
     */
    public static String aliasOf(Object value) {
        if (value instanceof Missing) {
            return "missing";
        }
        return of(value)
            .map(BsonType::getAlias)
            .orElseThrow(() -> new IllegalArgumentException("Unexpected value of " + value.getClass()));
    }

    public static boolean isNumber(Object value) {
        return value instanceof Double || value instanceof Integer || value instanceof Long || value instanceof Decimal128;
    }

}
