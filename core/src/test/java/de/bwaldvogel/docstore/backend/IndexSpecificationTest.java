package de.bwaldvogel.docstore.backend;

import static de.bwaldvogel.docstore.TestDocuments.json;
import static de.bwaldvogel.docstore.TestDocuments.list;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;

import java.util.List;

import org.junit.jupiter.api.Test;

import de.bwaldvogel.docstore.bson.Document;

import de.bwaldvogel.docstore.exception.BadValueException;
import de.bwaldvogel.docstore.exception.CannotCreateIndexException;
import de.bwaldvogel.docstore.exception.FailedToParseException;
import de.bwaldvogel.docstore.exception.IndexAlreadyExistsException;
import de.bwaldvogel.docstore.exception.IndexKeySpecsConflictException;
import de.bwaldvogel.docstore.exception.IndexOptionsConflictException;
import de.bwaldvogel.docstore.exception.ServerError;
import de.bwaldvogel.docstore.exception.TypeMismatchException;

class IndexSpecificationTest {

    @Test
    void testParse() {
        IndexSpecification specification = IndexSpecification.parse(json("key: {a: 1, b: -1.0}, name: 'a_1_b_-1', unique: true, v: 2"));

        assertThat(specification.getName()).isEqualTo("a_1_b_-1");
        assertThat(specification.getKeys()).containsExactly(new IndexKey("a", true), new IndexKey("b", false));
        assertThat(specification.isUnique()).isTrue();
        assertThat(specification.getKeyDocument()).isEqualTo(json("a: 1, b: -1"));
    }

    @Test
    void testParseAllValidatesTheArgument() {
        assertThatExceptionOfType(ServerError.class)
            .isThrownBy(() -> IndexSpecification.parseAll(null))
            .withMessage("[Error 40414] BSON field 'createIndexes.indexes' is missing but a required field");
        assertThatExceptionOfType(TypeMismatchException.class)
            .isThrownBy(() -> IndexSpecification.parseAll("x"))
            .withMessage("[Error 14] BSON field 'createIndexes.indexes' is the wrong type 'string', expected type 'array'");
        assertThatExceptionOfType(BadValueException.class)
            .isThrownBy(() -> IndexSpecification.parseAll(list()))
            .withMessage("[Error 2] Must specify at least one index to create");
        assertThatExceptionOfType(TypeMismatchException.class)
            .isThrownBy(() -> IndexSpecification.parseAll(list(json("key: {a: 1}, name: 'a'"), 1)))
            .withMessage("[Error 14] BSON field 'createIndexes.indexes.1' is the wrong type 'int', expected type 'object'");
    }

    @Test
    void testInvalidSpecifications() {
        assertThatExceptionOfType(FailedToParseException.class)
            .isThrownBy(() -> IndexSpecification.parse(json("")))
            .withMessageEndingWith("The 'key' field is a required property of an index specification");
        assertThatExceptionOfType(CannotCreateIndexException.class)
            .isThrownBy(() -> IndexSpecification.parse(json("key: {}, name: 'x'")))
            .withMessage("[Error 67] Must specify at least one field for the index key");
        assertThatExceptionOfType(FailedToParseException.class)
            .isThrownBy(() -> IndexSpecification.parse(json("key: {a: 1}")))
            .withMessage("[Error 9] Error in specification { key: { a: 1 } } :: caused by :: "
                + "The 'name' field is a required property of an index specification");
        assertThatExceptionOfType(CannotCreateIndexException.class)
            .isThrownBy(() -> IndexSpecification.parse(json("key: {a: 1}, name: ''")))
            .withMessage("[Error 67] Error in specification { key: { a: 1 }, name: \"\", v: 2 } :: caused by :: "
                + "index name cannot be empty");
        assertThatExceptionOfType(BadValueException.class)
            .isThrownBy(() -> IndexSpecification.parse(json("key: {_id: -1}, name: 'x'")))
            .withMessage("[Error 2] The field 'key' for an _id index must be {_id: 1}, but got { _id: -1 }");
        assertThatExceptionOfType(BadValueException.class)
            .isThrownBy(() -> IndexSpecification.parse(json("key: {a: 1}, name: '_id_'")))
            .withMessageStartingWith("[Error 2] The index name '_id_' is reserved for the _id index");
        assertThatExceptionOfType(ServerError.class)
            .isThrownBy(() -> IndexSpecification.parse(json("key: {_id: 1}, name: 'x', unique: true")))
            .satisfies(e -> assertThat(e.getCode()).isEqualTo(197));
    }

    @Test
    void testUnsupportedOptionsAndKeyValues() {
        assertThatExceptionOfType(ServerError.class)
            .isThrownBy(() -> IndexSpecification.parse(json("key: {a: 1}, name: 'x', sparse: true")))
            .withMessage("[Error 238] Index option \"sparse\" is not implemented yet");
        assertThatExceptionOfType(BadValueException.class)
            .isThrownBy(() -> IndexSpecification.parse(json("key: {a: 1}, name: 'x', foo: 1")))
            .withMessage("[Error 2] Index option \"foo\" is unknown");
        assertThatExceptionOfType(ServerError.class)
            .isThrownBy(() -> IndexSpecification.parse(json("key: {a: 'text'}, name: 'x'")))
            .withMessage("[Error 238] Index key value \"text\" is not implemented yet");
        assertThatExceptionOfType(ServerError.class)
            .isThrownBy(() -> IndexSpecification.parse(json("key: {a: 2}, name: 'x'")))
            .withMessage("[Error 238] Index key value 2 is not implemented yet");
        assertThatExceptionOfType(TypeMismatchException.class)
            .isThrownBy(() -> IndexSpecification.parse(json("key: {a: 1}, name: 'x', unique: 1")))
            .withMessage("[Error 14] Error in specification { key: { a: 1 }, name: \"x\", unique: 1 } :: caused by :: "
                + "The field 'unique' has value unique: 1, which is not convertible to bool");
    }

    @Test
    void testFilterNew() {
        NonUniqueIndex<Integer> existing = new NonUniqueIndex<>("a_1", List.of(new IndexKey("a", true)));

        List<IndexSpecification> requested = List.of(
            IndexSpecification.parse(json("key: {a: 1}, name: 'a_1'")),
            IndexSpecification.parse(json("key: {b: 1}, name: 'b_1'")));

        assertThat(IndexSpecification.filterNew(requested, List.of(existing)))
            .extracting(IndexSpecification::getName)
            .containsExactly("b_1");
    }

    @Test
    void testFilterNewConflicts() {
        NonUniqueIndex<Integer> existing = new NonUniqueIndex<>("a_1", List.of(new IndexKey("a", true)));

        assertThatExceptionOfType(IndexKeySpecsConflictException.class)
            .isThrownBy(() -> IndexSpecification.filterNew(
                List.of(IndexSpecification.parse(json("key: {a: -1}, name: 'a_1'"))), List.of(existing)))
            .withMessageEndingWith("Requested index: { key: { a: -1 }, name: \"a_1\" }, existing index: { key: { a: 1 }, name: \"a_1\" }");
        assertThatExceptionOfType(IndexOptionsConflictException.class)
            .isThrownBy(() -> IndexSpecification.filterNew(
                List.of(IndexSpecification.parse(json("key: {a: 1}, name: 'other'"))), List.of(existing)))
            .withMessage("[Error 85] Index already exists with a different name: a_1");
        assertThatExceptionOfType(IndexAlreadyExistsException.class)
            .isThrownBy(() -> IndexSpecification.filterNew(List.of(
                IndexSpecification.parse(json("key: {b: 1}, name: 'b_1'")),
                IndexSpecification.parse(json("key: {b: 1}, name: 'b_1'"))), List.of(existing)))
            .withMessage("[Error 68] Identical index already exists: b_1");
    }

    @Test
    void testParseKeysRejectsRepeatedFields() {
        Document keys = new Document();
        keys.appendDecoded("a", 1, true);
        keys.appendDecoded("a", -1, true);

        assertThatExceptionOfType(BadValueException.class)
            .isThrownBy(() -> IndexSpecification.parseKeys(keys))
            .withMessage("[Error 2] Error in specification { a: 1 }, the field \"a\" appears multiple times");
    }

}
