package de.bwaldvogel.docstore.backend;

import static de.bwaldvogel.docstore.TestDocuments.json;
import static de.bwaldvogel.docstore.TestDocuments.list;
import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

import de.bwaldvogel.docstore.bson.Decimal128;
import de.bwaldvogel.docstore.bson.Missing;
import de.bwaldvogel.docstore.bson.ObjectId;

class ValueComparatorTest {

    private final ValueComparator comparator = ValueComparator.asc();

    @Test
    void testNullAndMissingSortFirst() {
        assertThat(comparator.compare(null, null)).isZero();
        assertThat(comparator.compare(null, Missing.getInstance())).isZero();
        assertThat(comparator.compare(null, 1)).isNegative();
        assertThat(comparator.compare("a", Missing.getInstance())).isPositive();
    }

    @Test
    void testNumbersOfDifferentKinds() {
        assertThat(comparator.compare(1, 1.0)).isZero();
        assertThat(comparator.compare(1L, 2)).isNegative();
        assertThat(comparator.compare(2.5, 2)).isPositive();
        assertThat(comparator.compare(new Decimal128(new BigDecimal("1.5")), 1.5)).isZero();
        assertThat(comparator.compare(Long.MAX_VALUE, Long.MAX_VALUE - 1)).isPositive();
        assertThat(comparator.compare(Double.NaN, Double.NEGATIVE_INFINITY)).isNegative();
        assertThat(comparator.compare(Double.NaN, Decimal128.NaN)).isZero();
    }

    @Test
    void testTypeOrder() {
        List<Object> values = new ArrayList<>(Arrays.asList(
            true, Instant.ofEpochMilli(0), new ObjectId("000000000000000000000001"), list(1), json("a: 1"), "x", 42, null));

        values.sort(comparator);

        assertThat(values).containsExactly(
            null, 42, "x", json("a: 1"), list(1), new ObjectId("000000000000000000000001"), true, Instant.ofEpochMilli(0));
    }

    @Test
    void testCompareDocuments() {
        assertThat(comparator.compare(json("a: 1"), json("a: 1"))).isZero();
        assertThat(comparator.compare(json("a: 1"), json("a: 2"))).isNegative();
        assertThat(comparator.compare(json("a: 1"), json("b: 1"))).isNegative();
        assertThat(comparator.compare(json("a: 1, b: 1"), json("a: 1"))).isPositive();
        assertThat(comparator.compare(json("a: 'x'"), json("a: 1"))).isPositive();
    }

    @Test
    void testCompareLists() {
        assertThat(comparator.compare(list(1, 2), list(1, 2))).isZero();
        assertThat(comparator.compare(list(1, 2), list(1, 3))).isNegative();
        assertThat(comparator.compare(list(1, 2, 3), list(1, 2))).isPositive();
    }

    @Test
    void testDescending() {
        assertThat(ValueComparator.desc().compare(1, 2)).isPositive();
        assertThat(ValueComparator.desc().compare("b", "a")).isNegative();
    }

}
