package de.bwaldvogel.docstore.backend;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import de.bwaldvogel.docstore.bson.BsonType;
import de.bwaldvogel.docstore.bson.Document;
import de.bwaldvogel.docstore.exception.ErrorCode;
import de.bwaldvogel.docstore.exception.InvalidOptionsException;
import de.bwaldvogel.docstore.exception.ServerError;
import de.bwaldvogel.docstore.exception.TypeMismatchException;

public final class CollectionOptions {

    private static final Logger log = LoggerFactory.getLogger(CollectionOptions.class);

    private static final boolean DEFAULT_CAPPED = false;

    private static final long CAPPED_SIZE_GRANULARITY = 256;
    private static final long MIN_CAPPED_SIZE = CAPPED_SIZE_GRANULARITY;

    private final boolean capped;
    private final Long cappedSize;
    private final Long cappedMax;

    private CollectionOptions(boolean capped, Long cappedSize, Long cappedMax) {
        this.capped = capped;
        this.cappedSize = capped ? calculateCappedSize(cappedSize) : null;
        this.cappedMax = capped && cappedMax != null && cappedMax.longValue() > 0 ? cappedMax : null;
    }

    static Long calculateCappedSize(Long cappedSize) {
        if (cappedSize == null) {
            return null;
        }
        long value = cappedSize.longValue();
        if (value <= MIN_CAPPED_SIZE) {
            log.info("Using minimum capped size of {} bytes", MIN_CAPPED_SIZE);
            return MIN_CAPPED_SIZE;
        }
        long mod = value % CAPPED_SIZE_GRANULARITY;
        if (mod == 0) {
            return value;
        }
        long raisedCappedSize = value + (CAPPED_SIZE_GRANULARITY - mod);
        log.info("Raised capped size to {} bytes", raisedCappedSize);
        return raisedCappedSize;
    }

    public static CollectionOptions withDefaults() {
        return new CollectionOptions(DEFAULT_CAPPED, null, null);
    }

    public static CollectionOptions capped(long size, Long max) {
        return new CollectionOptions(true, Long.valueOf(size), max);
    }

    /**
     * Parses and validates the options of a {@code create} command.
     */
    public static CollectionOptions fromQuery(Document query) {
        boolean capped = toBoolean(query, "capped");
        Number size = toNumber(query, "size");
        Number max = toNumber(query, "max");

        if (capped) {
            if (size == null) {
                throw new InvalidOptionsException("the 'size' field is required when 'capped' is true");
            }
            if (!(size.doubleValue() >= 1)) {
                throw new ServerError(ErrorCode._51024, "BSON field 'size' value must be >= 1, actual value '" + size + "'");
            }
        } else {
            if (max != null) {
                throw new InvalidOptionsException("the 'max' field requires 'capped' to be true");
            }
            if (size != null) {
                log.warn("Ignoring 'size' of non-capped collection {}", query.get("create"));
            }
        }
        return new CollectionOptions(capped, toLong(size), toLong(max));
    }

    private static boolean toBoolean(Document query, String field) {
        Object value = query.get(field);
        if (value == null) {
            return DEFAULT_CAPPED;
        }
        if (!(value instanceof Boolean booleanValue)) {
            throw new TypeMismatchException("BSON field 'create." + field + "' is the wrong type '"
                + BsonType.aliasOf(value) + "', expected type 'bool'");
        }
        return booleanValue.booleanValue();
    }

    private static Number toNumber(Document query, String field) {
        Object value = query.get(field);
        if (value == null) {
            return null;
        }
        if (!BsonType.isNumber(value)) {
            throw new TypeMismatchException("BSON field 'create." + field + "' is the wrong type '"
                + BsonType.aliasOf(value) + "', expected types '[long, int, decimal, double]'");
        }
        return (Number) value;
    }

    private static Long toLong(Number number) {
        if (number == null) {
            return null;
        }
        return Long.valueOf(number.longValue());
    }

    public boolean isCapped() {
        return capped;
    }

    public Long getCappedSize() {
        return cappedSize;
    }

    public Long getCappedMax() {
        return cappedMax;
    }

    public Document toDocument() {
        Document document = new Document();
        if (capped) {
            document.put("capped", Boolean.TRUE);
            document.put("size", cappedSize);
            document.putIfNotNull("max", cappedMax);
        }
        return document;
    }

}
