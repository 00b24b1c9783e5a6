package de.bwaldvogel.docstore.backend;

import static de.bwaldvogel.docstore.TestDocuments.json;
import static de.bwaldvogel.docstore.TestDocuments.list;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;

import java.math.BigDecimal;

import org.junit.jupiter.api.Test;

import de.bwaldvogel.docstore.bson.Decimal128;
import de.bwaldvogel.docstore.bson.Document;
import de.bwaldvogel.docstore.bson.Missing;
import de.bwaldvogel.docstore.exception.InvalidNamespaceError;
import de.bwaldvogel.docstore.exception.PathNotViableException;

class UtilsTest {

    @Test
    void testSplitPath() {
        assertThat(Utils.splitPath("a")).containsExactly("a");
        assertThat(Utils.splitPath("a.b.c")).containsExactly("a", "b", "c");
        assertThat(Utils.splitPath("a..b")).containsExactly("a", "", "b");
        assertThat(Utils.splitPath("a.")).containsExactly("a", "");
    }

    @Test
    void testHeadAndTail() {
        assertThat(Utils.getHead("a.b.c")).isEqualTo("a");
        assertThat(Utils.getTail("a.b.c")).isEqualTo("b.c");
        assertThat(Utils.getHead("a")).isEqualTo("a");
        assertThat(Utils.getTail("a")).isEmpty();
    }

    @Test
    void testIsArrayIndex() {
        assertThat(Utils.isArrayIndex("0")).isTrue();
        assertThat(Utils.isArrayIndex("12")).isTrue();
        assertThat(Utils.isArrayIndex("")).isFalse();
        assertThat(Utils.isArrayIndex("-1")).isFalse();
        assertThat(Utils.isArrayIndex("a1")).isFalse();
        assertThat(Utils.isArrayIndex("1234567890")).isFalse();
    }

    @Test
    void testIsTrue() {
        assertThat(Utils.isTrue(null)).isFalse();
        assertThat(Utils.isTrue(Missing.getInstance())).isFalse();
        assertThat(Utils.isTrue(Boolean.FALSE)).isFalse();
        assertThat(Utils.isTrue(0)).isFalse();
        assertThat(Utils.isTrue(0.0)).isFalse();
        assertThat(Utils.isTrue(Boolean.TRUE)).isTrue();
        assertThat(Utils.isTrue(2)).isTrue();
        assertThat(Utils.isTrue("")).isTrue();
    }

    @Test
    void testGetSubdocumentValue() {
        Document document = json("a: {b: {c: 1}}, list: [{x: 1}, {x: 2}], value: 'v'");

        assertThat(Utils.getSubdocumentValue(document, "a.b.c")).isEqualTo(1);
        assertThat(Utils.getSubdocumentValue(document, "a.b")).isEqualTo(json("c: 1"));
        assertThat(Utils.getSubdocumentValue(document, "list.1.x")).isEqualTo(2);
        assertThat(Utils.getSubdocumentValue(document, "list.x")).isInstanceOf(Missing.class);
        assertThat(Utils.getSubdocumentValue(document, "list.5")).isInstanceOf(Missing.class);
        assertThat(Utils.getSubdocumentValue(document, "value.x")).isInstanceOf(Missing.class);
        assertThat(Utils.getSubdocumentValue(document, "missing")).isInstanceOf(Missing.class);

        assertThat(Utils.hasSubdocumentValue(document, "a.b")).isTrue();
        assertThat(Utils.hasSubdocumentValue(document, "a.x")).isFalse();
    }

    @Test
    void testGetSubdocumentValueCollectionAware() {
        Document document = json("list: [{x: 1}, {y: 2}, {x: 3}, 4]");

        assertThat(Utils.getSubdocumentValueCollectionAware(document, "list.x")).isEqualTo(list(1, 3));
        assertThat(Utils.getSubdocumentValueCollectionAware(document, "list.0.x")).isEqualTo(1);
        assertThat(Utils.getSubdocumentValueCollectionAware(document, "list.z")).isInstanceOf(Missing.class);
    }

    @Test
    void testChangeSubdocumentValue() {
        Document document = json("a: {b: 1}, list: [1, 2]");

        Utils.changeSubdocumentValue(document, "a.b", 2);
        Utils.changeSubdocumentValue(document, "x.y.z", "new");
        Utils.changeSubdocumentValue(document, "list.4", 5);

        assertThat(document).isEqualTo(json("a: {b: 2}, list: [1, 2, null, null, 5], x: {y: {z: 'new'}}"));
    }

    @Test
    void testChangeSubdocumentValueThroughScalar() {
        Document document = json("a: 1, list: [1]");

        assertThatExceptionOfType(PathNotViableException.class)
            .isThrownBy(() -> Utils.changeSubdocumentValue(document, "a.b", 2))
            .withMessageEndingWith("Cannot create field 'b' in element {a: 1}");

        assertThatExceptionOfType(PathNotViableException.class)
            .isThrownBy(() -> Utils.changeSubdocumentValue(document, "list.x.y", 2))
            .withMessageEndingWith("Cannot create field 'x' in element {list: [ 1 ]}");
    }

    @Test
    void testRemoveSubdocumentValue() {
        Document document = json("a: {b: 1, c: 2}, list: [1, 2]");

        assertThat(Utils.removeSubdocumentValue(document, "a.b")).isEqualTo(1);
        assertThat(Utils.removeSubdocumentValue(document, "list.0")).isEqualTo(1);
        assertThat(Utils.removeSubdocumentValue(document, "a.x")).isInstanceOf(Missing.class);
        assertThat(Utils.removeSubdocumentValue(document, "x.y")).isInstanceOf(Missing.class);

        assertThat(document).isEqualTo(json("a: {c: 2}, list: [null, 2]"));
    }

    @Test
    void testNormalizeValue() {
        assertThat(Utils.normalizeValue(1)).isEqualTo(1.0);
        assertThat(Utils.normalizeValue(1L)).isEqualTo(1.0);
        assertThat(Utils.normalizeValue(-0.0)).isEqualTo(0.0);
        assertThat(Utils.normalizeValue(new Decimal128(new BigDecimal("2.50")))).isEqualTo(2.5);
        assertThat(Utils.normalizeValue(Decimal128.NaN)).isEqualTo(Double.NaN);
        assertThat(Utils.normalizeValue(Missing.getInstance())).isNull();
        assertThat(Utils.normalizeValue("x")).isEqualTo("x");
        assertThat(Utils.normalizeValue(json("a: 1, b: [2, 'c']"))).isEqualTo(json("a: 1.0, b: [2.0, 'c']"));
    }

    @Test
    void testNullAwareEquals() {
        assertThat(Utils.nullAwareEquals(null, Missing.getInstance())).isTrue();
        assertThat(Utils.nullAwareEquals(null, 0)).isFalse();
        assertThat(Utils.nullAwareEquals(1, 1.0)).isTrue();
        assertThat(Utils.nullAwareEquals(1L, new Decimal128(BigDecimal.ONE))).isTrue();
        assertThat(Utils.nullAwareEquals("1", 1)).isFalse();
        assertThat(Utils.nullAwareEquals(json("a: 1"), json("a: 1.0"))).isTrue();
        assertThat(Utils.nullAwareEquals(json("a: 1, b: 2"), json("b: 2, a: 1"))).isFalse();

        assertThat(Utils.containsNullAware(list(1, "x"), 1.0)).isTrue();
        assertThat(Utils.containsNullAware(list(1, "x"), "y")).isFalse();
    }

    @Test
    void testFullNames() {
        assertThat(Utils.getDatabaseNameFromFullName("testdb.some.collection")).isEqualTo("testdb");
        assertThat(Utils.getCollectionNameFromFullName("testdb.some.collection")).isEqualTo("some.collection");
    }

    @Test
    void testValidateCollectionName() {
        Utils.validateCollectionName("testdb", "collection");
        Utils.validateCollectionName("testdb", "some.collection");

        for (String illegalName : new String[] { "", ".collection", "coll$name", "coll\0name", "x".repeat(230) }) {
            assertThatExceptionOfType(InvalidNamespaceError.class)
                .isThrownBy(() -> Utils.validateCollectionName("testdb", illegalName))
                .withMessage("[Error 73] Invalid collection name: " + illegalName);
        }
    }

    @Test
    void testCalculateSize() {
        assertThat(Utils.calculateSize(new Document())).isEqualTo(5);
        assertThat(Utils.calculateSize(new Document("a", 1))).isEqualTo(12);
        assertThat(Utils.calculateSize(new Document("a", "xy"))).isEqualTo(15);
    }

}
