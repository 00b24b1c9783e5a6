package de.bwaldvogel.docstore.bson;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;

import java.math.BigDecimal;

import org.junit.jupiter.api.Test;

class Decimal128Test {

    @Test
    void testFromBigDecimal() {
        Decimal128 decimal = new Decimal128(new BigDecimal("1.5"));

        assertThat(decimal.toBigDecimal()).isEqualTo(new BigDecimal("1.5"));
        assertThat(decimal.doubleValue()).isEqualTo(1.5);
        assertThat(decimal.intValue()).isEqualTo(1);
        assertThat(decimal).hasToString("1.5");
        assertThat(decimal.isNegative()).isFalse();
    }

    @Test
    void testConstants() {
        assertThat(Decimal128.ONE.toBigDecimal()).isEqualTo(BigDecimal.ONE);
        assertThat(Decimal128.POSITIVE_ZERO.doubleValue()).isZero();
        assertThat(Decimal128.NEGATIVE_ZERO.isNegative()).isTrue();
        assertThat(Decimal128.NaN.isNaN()).isTrue();
        assertThat(Decimal128.NaN.doubleValue()).isNaN();
        assertThat(Decimal128.POSITIVE_INFINITY.isInfinite()).isTrue();
        assertThat(Decimal128.NEGATIVE_INFINITY.doubleValue()).isEqualTo(Double.NEGATIVE_INFINITY);
        assertThat(Decimal128.NaN).hasToString("NaN");
        assertThat(Decimal128.NEGATIVE_INFINITY).hasToString("-Infinity");
    }

    @Test
    void testCompareTo() {
        Decimal128 one = new Decimal128(new BigDecimal("1"));
        Decimal128 oneAndAHalf = new Decimal128(new BigDecimal("1.5"));

        assertThat(one).isLessThan(oneAndAHalf);
        assertThat(Decimal128.NEGATIVE_INFINITY).isLessThan(one);
        assertThat(Decimal128.POSITIVE_INFINITY).isGreaterThan(oneAndAHalf);
        assertThat(Decimal128.NaN).isLessThan(Decimal128.NEGATIVE_INFINITY);
        assertThat(new Decimal128(new BigDecimal("1.0")).compareTo(one)).isZero();
    }

    @Test
    void testSpecialValuesCannotBeConverted() {
        assertThatExceptionOfType(IllegalArgumentException.class)
            .isThrownBy(Decimal128.NaN::toBigDecimal)
            .withMessage("NaN cannot be converted to BigDecimal");
        assertThatExceptionOfType(IllegalArgumentException.class)
            .isThrownBy(Decimal128.NEGATIVE_INFINITY::toBigDecimal)
            .withMessage("-Infinity cannot be converted to BigDecimal");
    }

    @Test
    void testInexactRounding() {
        assertThatExceptionOfType(NumberFormatException.class)
            .isThrownBy(() -> new Decimal128(new BigDecimal("1234567890123456789012345678901234567")));
    }

}
