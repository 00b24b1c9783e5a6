package de.bwaldvogel.docstore.backend;

import static de.bwaldvogel.docstore.TestDocuments.json;
import static de.bwaldvogel.docstore.TestDocuments.list;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;

import org.junit.jupiter.api.Test;

import de.bwaldvogel.docstore.backend.DocumentValidator.Mode;
import de.bwaldvogel.docstore.bson.Decimal128;
import de.bwaldvogel.docstore.bson.Document;
import de.bwaldvogel.docstore.exception.DocumentValidationError;
import de.bwaldvogel.docstore.exception.DocumentValidationError.Kind;

class DocumentValidatorTest {

    @Test
    void testValidDocument() {
        assertThatCode(() -> DocumentValidator.validate(json("_id: 1, a: {b: [1, 'x', {c: null}]}, d: 1.5")))
            .doesNotThrowAnyException();
    }

    @Test
    void testDuplicateKey() {
        Document document = new Document();
        document.appendDecoded("foo", "bar", true);
        document.appendDecoded("foo", "baz", true);

        assertThatExceptionOfType(DocumentValidationError.class)
            .isThrownBy(() -> DocumentValidator.validate(document))
            .withMessage("[Error 2] invalid key: \"foo\" (duplicate keys are not allowed)")
            .satisfies(e -> assertThat(e.getKind()).isEqualTo(Kind.DUPLICATE_KEY));
    }

    @Test
    void testDuplicateKeyInNestedDocument() {
        Document nested = new Document();
        nested.appendDecoded("x", 1, true);
        nested.appendDecoded("x", 2, true);

        assertThatExceptionOfType(DocumentValidationError.class)
            .isThrownBy(() -> DocumentValidator.validate(new Document("a", nested)))
            .withMessageEndingWith("invalid key: \"x\" (duplicate keys are not allowed)");
    }

    @Test
    void testInvalidUtf8Key() {
        Document document = new Document();
        document.appendDecoded("a\uFFFD", 1, false);

        assertThatExceptionOfType(DocumentValidationError.class)
            .isThrownBy(() -> DocumentValidator.validate(document))
            .withMessageEndingWith("(not a valid UTF-8 string)");
    }

    @Test
    void testDollarPrefixedKey() {
        assertThatExceptionOfType(DocumentValidationError.class)
            .isThrownBy(() -> DocumentValidator.validate(new Document("$foo", 1)))
            .withMessage("[Error 2] invalid key: \"$foo\" (key must not start with '$' sign)");
    }

    @Test
    void testDottedKey() {
        assertThatExceptionOfType(DocumentValidationError.class)
            .isThrownBy(() -> DocumentValidator.validate(json("a: {'b.c': 1}")))
            .withMessage("[Error 2] invalid key: \"b.c\" (key must not contain '.' sign)");
    }

    @Test
    void testNestedArray() {
        assertThatExceptionOfType(DocumentValidationError.class)
            .isThrownBy(() -> DocumentValidator.validate(new Document("a", list(list(1)))))
            .withMessage("[Error 2] invalid value: { \"a\": [ [ 1 ] ] } (nested arrays are not supported)");
    }

    @Test
    void testInfinity() {
        assertThatExceptionOfType(DocumentValidationError.class)
            .isThrownBy(() -> DocumentValidator.validate(new Document("v", Double.POSITIVE_INFINITY)))
            .withMessage("[Error 2] invalid value: { \"v\": +Inf } (infinity values are not allowed)");
        assertThatExceptionOfType(DocumentValidationError.class)
            .isThrownBy(() -> DocumentValidator.validate(new Document("v", Decimal128.NEGATIVE_INFINITY)))
            .withMessageEndingWith("(infinity values are not allowed)");
    }

    @Test
    void testInfinityInUpdatedDocument() {
        assertThatCode(() -> DocumentValidator.validate(new Document("v", Double.POSITIVE_INFINITY), Mode.UPDATE))
            .doesNotThrowAnyException();
        assertThatCode(() -> DocumentValidator.validate(new Document("v", Decimal128.NEGATIVE_INFINITY), Mode.UPDATE))
            .doesNotThrowAnyException();
    }

    @Test
    void testNaN() {
        Document document = new Document("v", Double.NaN);

        assertThatExceptionOfType(DocumentValidationError.class)
            .isThrownBy(() -> DocumentValidator.validate(document))
            .withMessage("[Error 2] invalid value: { \"v\": NaN } (NaN values are not allowed)");
        assertThatCode(() -> DocumentValidator.validate(document, Mode.UPDATE))
            .doesNotThrowAnyException();
    }

    @Test
    void testKeyIsCheckedBeforeValue() {
        Document document = new Document("$v", Double.NaN);

        assertThatExceptionOfType(DocumentValidationError.class)
            .isThrownBy(() -> DocumentValidator.validate(document))
            .satisfies(e -> assertThat(e.getKind()).isEqualTo(Kind.DOLLAR_PREFIXED_KEY));
    }

    @Test
    void testFirstViolationInKeyOrderIsReported() {
        Document document = new Document("a", Double.NaN).append("$b", 1);

        assertThatExceptionOfType(DocumentValidationError.class)
            .isThrownBy(() -> DocumentValidator.validate(document))
            .satisfies(e -> assertThat(e.getKind()).isEqualTo(Kind.NAN));
    }

}
