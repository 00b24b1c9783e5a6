package de.bwaldvogel.docstore.backend;

import java.math.BigDecimal;

import de.bwaldvogel.docstore.bson.BsonType;
import de.bwaldvogel.docstore.bson.Decimal128;
import de.bwaldvogel.docstore.bson.Missing;
import de.bwaldvogel.docstore.exception.ErrorCode;
import de.bwaldvogel.docstore.exception.ServerError;
import de.bwaldvogel.docstore.exception.TypeMismatchException;

/**
 * The {@code scale} argument of {@code collStats} and {@code dbStats}.
 */
final class StatsScale {

    private static final int DEFAULT_SCALE = 1;

    private StatsScale() {
    }

    static int parse(String command, Object value) {
        if (Missing.isNullOrMissing(value)) {
            return DEFAULT_SCALE;
        }
        if (!BsonType.isNumber(value)) {
            throw new TypeMismatchException("BSON field '" + command + ".scale' is the wrong type '"
                + BsonType.aliasOf(value) + "', expected types '[long, int, decimal, double]'");
        }
        if (NumericUtils.isNaN(value)) {
            return DEFAULT_SCALE;
        }
        int scale = toInt(value);
        if (scale < 1) {
            throw new ServerError(ErrorCode._51024, "BSON field 'scale' value must be >= 1, actual value '" + scale + "'");
        }
        return scale;
    }

    private static int toInt(Object value) {
        if (value instanceof Integer integer) {
            return integer.intValue();
        }
        if (value instanceof Long longValue) {
            return clamp(longValue.longValue());
        }
        if (value instanceof Decimal128 decimal) {
            if (decimal.isInfinite()) {
                return decimal.isNegative() ? Integer.MIN_VALUE : Integer.MAX_VALUE;
            }
            BigDecimal truncated = decimal.toBigDecimal().setScale(0, java.math.RoundingMode.DOWN);
            return truncated.max(BigDecimal.valueOf(Integer.MIN_VALUE)).min(BigDecimal.valueOf(Integer.MAX_VALUE)).intValue();
        }
        // narrowing a double to int truncates toward zero and saturates
        return (int) ((Number) value).doubleValue();
    }

    private static int clamp(long value) {
        return (int) Math.max(Integer.MIN_VALUE, Math.min(Integer.MAX_VALUE, value));
    }

}
