package de.bwaldvogel.docstore.bson;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;

/**
 * IEEE 754-2008 128-bit decimal in binary integer decimal (BID) encoding.
 */
public final class Decimal128 extends Number implements Comparable<Decimal128>, Bson {

    private static final long serialVersionUID = 1L;

    private static final long INFINITY_MASK = 0x7800000000000000L;
    private static final long NaN_MASK = 0x7c00000000000000L;
    private static final long SIGN_BIT_MASK = 1L << 63;

    private static final int EXPONENT_OFFSET = 6176;
    private static final int MIN_EXPONENT = -6176;
    private static final int MAX_EXPONENT = 6111;
    private static final int MAX_BIT_LENGTH = 113;

    private static final BigInteger BIG_INT_ONE = BigInteger.ONE;
    private static final BigInteger BIG_INT_ZERO = BigInteger.ZERO;

    public static final Decimal128 ONE = new Decimal128(0x3040000000000000L, 0x0000000000000001L);
    public static final Decimal128 POSITIVE_ZERO = new Decimal128(0x3040000000000000L, 0x0000000000000000L);
    public static final Decimal128 NEGATIVE_ZERO = new Decimal128(0xb040000000000000L, 0x0000000000000000L);
    public static final Decimal128 NaN = new Decimal128(NaN_MASK, 0);
    public static final Decimal128 POSITIVE_INFINITY = new Decimal128(INFINITY_MASK, 0);
    public static final Decimal128 NEGATIVE_INFINITY = new Decimal128(INFINITY_MASK | SIGN_BIT_MASK, 0);

    private final long high;
    private final long low;

    public Decimal128(long high, long low) {
        this.high = high;
        this.low = low;
    }

    public Decimal128(BigDecimal value) {
        this(value, value.signum() == -1);
    }

    private Decimal128(BigDecimal initialValue, boolean isNegative) {
        BigDecimal value = clampAndRound(initialValue);

        long exponent = -value.scale();
        if (exponent < MIN_EXPONENT || exponent > MAX_EXPONENT) {
            throw new NumberFormatException("Exponent is out of range for Decimal128 encoding of " + initialValue);
        }

        BigInteger significand = value.unscaledValue().abs();
        if (significand.bitLength() > MAX_BIT_LENGTH) {
            throw new NumberFormatException("Unscaled roundedValue is out of range for Decimal128 encoding:" + significand);
        }

        long localHigh = 0;
        long localLow = 0;
        for (int i = 0; i < Math.min(64, significand.bitLength()); i++) {
            if (significand.testBit(i)) {
                localLow |= 1L << i;
            }
        }
        for (int i = 64; i < significand.bitLength(); i++) {
            if (significand.testBit(i)) {
                localHigh |= 1L << (i - 64);
            }
        }

        long biasedExponent = exponent + EXPONENT_OFFSET;
        localHigh |= biasedExponent << 49;

        if (isNegative) {
            localHigh |= SIGN_BIT_MASK;
        }

        this.high = localHigh;
        this.low = localLow;
    }

    private static BigDecimal clampAndRound(BigDecimal initialValue) {
        BigDecimal value;
        if (-initialValue.scale() > MAX_EXPONENT) {
            int diff = -initialValue.scale() - MAX_EXPONENT;
            if (initialValue.unscaledValue().equals(BIG_INT_ZERO)) {
                value = new BigDecimal(initialValue.unscaledValue(), -MAX_EXPONENT);
            } else if (diff + initialValue.precision() > 34) {
                throw new NumberFormatException("Exponent is out of range for Decimal128 encoding of " + initialValue);
            } else {
                BigInteger multiplier = BigInteger.TEN.pow(diff);
                value = new BigDecimal(initialValue.unscaledValue().multiply(multiplier), initialValue.scale() + diff);
            }
        } else if (-initialValue.scale() < MIN_EXPONENT) {
            int diff = initialValue.scale() + MIN_EXPONENT;
            int undiscardedPrecision = ensureExactRounding(initialValue, diff);
            BigInteger divisor = undiscardedPrecision == 0 ? BIG_INT_ONE : BigInteger.TEN.pow(diff);
            value = new BigDecimal(initialValue.unscaledValue().divide(divisor), initialValue.scale() - diff);
        } else {
            value = initialValue.round(MathContext.DECIMAL128);
            int extraPrecision = initialValue.precision() - value.precision();
            if (extraPrecision > 0) {
                ensureExactRounding(initialValue, extraPrecision);
            }
        }
        return value;
    }

    private static int ensureExactRounding(BigDecimal value, int extraPrecision) {
        String significand = value.unscaledValue().abs().toString();
        int undiscardedPrecision = Math.max(0, significand.length() - extraPrecision);
        for (int i = undiscardedPrecision; i < significand.length(); i++) {
            if (significand.charAt(i) != '0') {
                throw new NumberFormatException("Conversion to Decimal128 would require inexact rounding of " + value);
            }
        }
        return undiscardedPrecision;
    }

    public long getHigh() {
        return high;
    }

    public long getLow() {
        return low;
    }

    public boolean isNegative() {
        return (high & SIGN_BIT_MASK) == SIGN_BIT_MASK;
    }

    public boolean isInfinite() {
        return (high & INFINITY_MASK) == INFINITY_MASK && !isNaN();
    }

    public boolean isNaN() {
        return (high & NaN_MASK) == NaN_MASK;
    }

    public BigDecimal toBigDecimal() {
        if (isNaN()) {
            throw new IllegalArgumentException("NaN cannot be converted to BigDecimal");
        }
        if (isInfinite()) {
            throw new IllegalArgumentException((isNegative() ? "-" : "") + "Infinity cannot be converted to BigDecimal");
        }
        BigDecimal bigDecimal = bigDecimalValueNoNegativeZeroCheck();
        if (isNegative() && bigDecimal.signum() == 0) {
            return bigDecimal.abs();
        }
        return bigDecimal;
    }

    private BigDecimal bigDecimalValueNoNegativeZeroCheck() {
        int scale = -getExponent();
        if (twoHighestCombinationBitsAreSet()) {
            return BigDecimal.valueOf(0, scale);
        }
        return new BigDecimal(new BigInteger(isNegative() ? -1 : 1, getBytes()), scale);
    }

    private byte[] getBytes() {
        byte[] bytes = new byte[15];
        long mask = 0x00000000000000ff;
        for (int i = 14; i >= 7; i--) {
            bytes[i] = (byte) ((low & mask) >>> ((14 - i) << 3));
            mask = mask << 8;
        }
        mask = 0x00000000000000ff;
        for (int i = 6; i >= 1; i--) {
            bytes[i] = (byte) ((high & mask) >>> ((6 - i) << 3));
            mask = mask << 8;
        }
        mask = 0x0001000000000000L;
        bytes[0] = (byte) ((high & mask) >>> 48);
        return bytes;
    }

    private int getExponent() {
        if (twoHighestCombinationBitsAreSet()) {
            return (int) ((high & 0x1fffe00000000000L) >>> 47) - EXPONENT_OFFSET;
        }
        return (int) ((high & 0x7fffe00000000000L) >>> 49) - EXPONENT_OFFSET;
    }

    private boolean twoHighestCombinationBitsAreSet() {
        return (high & 0x6000000000000000L) == 0x6000000000000000L;
    }

    @Override
    public int intValue() {
        return toBigDecimal().intValue();
    }

    @Override
    public long longValue() {
        return toBigDecimal().longValue();
    }

    @Override
    public float floatValue() {
        return (float) doubleValue();
    }

    @Override
    public double doubleValue() {
        if (isNaN()) {
            return Double.NaN;
        }
        if (isInfinite()) {
            return isNegative() ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
        }
        return toBigDecimal().doubleValue();
    }

    @Override
    public int compareTo(Decimal128 other) {
        if (isNaN() || other.isNaN()) {
            return Boolean.compare(!isNaN(), !other.isNaN());
        }
        if (isInfinite() || other.isInfinite()) {
            return Double.compare(doubleValue(), other.doubleValue());
        }
        return toBigDecimal().compareTo(other.toBigDecimal());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Decimal128 other = (Decimal128) o;
        return high == other.high && low == other.low;
    }

    @Override
    public int hashCode() {
        return 31 * Long.hashCode(high) + Long.hashCode(low);
    }

    @Override
    public String toString() {
        if (isNaN()) {
            return "NaN";
        }
        if (isInfinite()) {
            return isNegative() ? "-Infinity" : "Infinity";
        }
        return toBigDecimal().toString();
    }

}
