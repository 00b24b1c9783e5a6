package de.bwaldvogel.docstore.backend;

import java.math.BigDecimal;

import de.bwaldvogel.docstore.bson.Decimal128;

public final class NumericUtils {

    private NumericUtils() {
    }

    @FunctionalInterface
    public interface DoubleCalculation {
        double apply(double a, double b);
    }

    @FunctionalInterface
    public interface LongCalculation {
        long apply(long a, long b);
    }

    @FunctionalInterface
    public interface DecimalCalculation {
        BigDecimal apply(BigDecimal a, BigDecimal b);
    }

    /**
     * Thrown when an operation on two 64-bit integers leaves the 64-bit range.
     */
    public static class LongOverflowException extends ArithmeticException {

        private static final long serialVersionUID = 1L;

        LongOverflowException(long value) {
            super("long overflow: " + value);
        }
    }

    private static Number calculate(Number a, Number b, LongCalculation longCalculation,
                                    DoubleCalculation doubleCalculation, DecimalCalculation decimalCalculation) {
        if (a instanceof Decimal128 || b instanceof Decimal128) {
            Decimal128 decimalA = toDecimal128(a);
            Decimal128 decimalB = toDecimal128(b);
            if (decimalA.isNaN() || decimalB.isNaN() || decimalA.isInfinite() || decimalB.isInfinite()) {
                double result = doubleCalculation.apply(decimalA.doubleValue(), decimalB.doubleValue());
                return toDecimal128(Double.valueOf(result));
            }
            return new Decimal128(decimalCalculation.apply(decimalA.toBigDecimal(), decimalB.toBigDecimal()));
        } else if (a instanceof Double || b instanceof Double) {
            return Double.valueOf(doubleCalculation.apply(a.doubleValue(), b.doubleValue()));
        } else if (a instanceof Long || b instanceof Long) {
            return Long.valueOf(longCalculation.apply(a.longValue(), b.longValue()));
        } else if (a instanceof Integer && b instanceof Integer) {
            long result = longCalculation.apply(a.longValue(), b.longValue());
            int intResult = (int) result;
            if (intResult == result) {
                return Integer.valueOf(intResult);
            } else {
                return Long.valueOf(result);
            }
        } else {
            throw new UnsupportedOperationException("cannot calculate on " + a + " and " + b);
        }
    }

    private static Decimal128 toDecimal128(Number number) {
        if (number instanceof Decimal128 decimal) {
            return decimal;
        }
        if (number instanceof Double doubleValue) {
            if (doubleValue.isNaN()) {
                return Decimal128.NaN;
            }
            if (doubleValue.isInfinite()) {
                return doubleValue > 0 ? Decimal128.POSITIVE_INFINITY : Decimal128.NEGATIVE_INFINITY;
            }
            return new Decimal128(BigDecimal.valueOf(doubleValue));
        }
        return new Decimal128(BigDecimal.valueOf(number.longValue()));
    }

    public static Number addNumbers(Number one, Number other) {
        return calculate(one, other, NumericUtils::addExact, Double::sum, BigDecimal::add);
    }

    public static Number multiplyNumbers(Number one, Number other) {
        return calculate(one, other, NumericUtils::multiplyExact, (a, b) -> a * b, BigDecimal::multiply);
    }

    private static long addExact(long a, long b) {
        try {
            return Math.addExact(a, b);
        } catch (ArithmeticException e) {
            throw new LongOverflowException(a);
        }
    }

    private static long multiplyExact(long a, long b) {
        try {
            return Math.multiplyExact(a, b);
        } catch (ArithmeticException e) {
            throw new LongOverflowException(a);
        }
    }

    /**
     * Zero of the same numeric kind as the given value.
     */
    public static Number zeroOf(Number number) {
        if (number instanceof Double) {
            return Double.valueOf(0.0);
        } else if (number instanceof Long) {
            return Long.valueOf(0L);
        } else if (number instanceof Decimal128) {
            return Decimal128.POSITIVE_ZERO;
        } else {
            return Integer.valueOf(0);
        }
    }

    public static boolean isNaN(Object value) {
        if (value instanceof Double doubleValue) {
            return doubleValue.isNaN();
        }
        if (value instanceof Decimal128 decimal) {
            return decimal.isNaN();
        }
        return false;
    }

}
