package de.bwaldvogel.docstore.backend.projection;

import java.util.ArrayList;
import java.util.List;

import de.bwaldvogel.docstore.bson.BsonType;
import de.bwaldvogel.docstore.bson.Json;
import de.bwaldvogel.docstore.exception.ErrorCode;
import de.bwaldvogel.docstore.exception.ServerError;

/**
 * The argument of a {@code $slice} projection: either a single count or a {@code [skip, limit]} pair.
 */
final class Slice {

    /**
     * Negative values count from the end of the array.
     */
    private final long start;
    private final long limit;

    private Slice(long start, long limit) {
        this.start = start;
        this.limit = limit;
    }

    static Slice parse(Object argument) {
        if (BsonType.isNumber(argument)) {
            return fromCount(((Number) argument).doubleValue());
        }
        if (argument instanceof List<?> arguments) {
            return fromSkipAndLimit(arguments);
        }
        throw invalidSyntax(argument, "Location31273: $slice only supports numbers and [skip, limit] arrays", 1);
    }

    private static Slice fromCount(double count) {
        if (Double.isNaN(count)) {
            return new Slice(0, 0);
        }
        if (count >= 0) {
            return new Slice(0, truncate(count));
        }
        return new Slice(-truncate(-count), Long.MAX_VALUE);
    }

    private static Slice fromSkipAndLimit(List<?> arguments) {
        if (arguments.size() < 2 || arguments.size() > 3) {
            throw invalidSyntax(arguments, "Location31272: $slice array argument should be of form [skip, limit]", arguments.size());
        }

        Object skipArgument = arguments.get(0);
        if (arguments.size() == 3 || !BsonType.isNumber(skipArgument)) {
            throw firstArgumentNotAnArray(skipArgument);
        }

        Object limitArgument = arguments.get(1);
        long limit;
        if (limitArgument == null) {
            limit = Long.MAX_VALUE;
        } else if (!BsonType.isNumber(limitArgument)) {
            throw firstArgumentNotAnArray(skipArgument);
        } else {
            double limitValue = ((Number) limitArgument).doubleValue();
            if (limitValue < 0) {
                throw firstArgumentNotAnArray(skipArgument);
            }
            limit = Double.isNaN(limitValue) ? 0 : truncate(limitValue);
        }

        double skipValue = ((Number) skipArgument).doubleValue();
        if (Double.isNaN(skipValue)) {
            return new Slice(0, limit);
        }
        if (skipValue < 0) {
            return new Slice(-truncate(-skipValue), limit);
        }
        return new Slice(truncate(skipValue), limit);
    }

    private static long truncate(double value) {
        if (value >= Long.MAX_VALUE) {
            return Long.MAX_VALUE;
        }
        return (long) value;
    }

    /**
     * The message names the type of the skip argument.
     */
    private static ServerError firstArgumentNotAnArray(Object skipArgument) {
        return new ServerError(ErrorCode._28724, "First argument to $slice must be an array, but is of type: "
            + BsonType.aliasOf(skipArgument));
    }

    private static ServerError invalidSyntax(Object argument, String reason, int numberOfArguments) {
        return new ServerError(ErrorCode._28667, "Invalid $slice syntax. The given syntax { $slice: "
            + Json.toCompactJsonValue(argument) + " } did not match the find() syntax because :: " + reason
            + " :: The given syntax did not match the expression $slice syntax. :: caused by :: "
            + "Expression $slice takes at least 2 arguments, and at most 3, but " + numberOfArguments
            + " were passed in.");
    }

    List<Object> apply(List<?> values) {
        int size = values.size();
        long fromIndex = start < 0 ? Math.max(0, size + start) : Math.min(size, start);
        long toIndex = limit >= size - fromIndex ? size : fromIndex + limit;
        return new ArrayList<>(values.subList((int) fromIndex, (int) toIndex));
    }

}
