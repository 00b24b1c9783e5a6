package de.bwaldvogel.docstore.backend.projection;

import static de.bwaldvogel.docstore.TestDocuments.json;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;

import org.junit.jupiter.api.Test;

import de.bwaldvogel.docstore.bson.Document;
import de.bwaldvogel.docstore.exception.BadValueException;
import de.bwaldvogel.docstore.exception.ServerError;

class ProjectionTest {

    private static Document project(String document, String projection) {
        return new Projection(json(projection), "_id").projectDocument(json(document));
    }

    private static Document slice(Object argument) {
        Document projection = new Document("a", new Document("$slice", argument));
        return new Projection(projection, "_id").projectDocument(json("_id: 1, a: [1, 2, 3, 4, 5], b: 'x'"));
    }

    @Test
    void testInclusion() {
        assertThat(project("_id: 1, a: 1, b: 2, c: 3", "a: 1, c: true"))
            .isEqualTo(json("_id: 1, a: 1, c: 3"));
        assertThat(project("_id: 1, a: 1, b: 2", "_id: 0, b: 1"))
            .isEqualTo(json("b: 2"));
        assertThat(project("_id: 1, a: 1", "_id: 1"))
            .isEqualTo(json("_id: 1"));
        assertThat(project("_id: 1, a: 1", "x: 1"))
            .isEqualTo(json("_id: 1"));
    }

    @Test
    void testExclusion() {
        assertThat(project("_id: 1, a: 1, b: 2, c: 3", "b: 0"))
            .isEqualTo(json("_id: 1, a: 1, c: 3"));
        assertThat(project("_id: 1, a: 1, b: 2", "_id: 0"))
            .isEqualTo(json("a: 1, b: 2"));
        assertThat(project("_id: 1, a: 1, b: 2", "_id: 0, a: false"))
            .isEqualTo(json("b: 2"));
    }

    @Test
    void testEmptyProjection() {
        assertThat(project("_id: 1, a: 1", "")).isEqualTo(json("_id: 1, a: 1"));
    }

    @Test
    void testNestedFields() {
        assertThat(project("_id: 1, a: {b: 1, c: 2}, d: 3", "'a.b': 1"))
            .isEqualTo(json("_id: 1, a: {b: 1}"));
        assertThat(project("_id: 1, a: {b: 1, c: 2}, d: 3", "'a.b': 0"))
            .isEqualTo(json("_id: 1, a: {c: 2}, d: 3"));
        assertThat(project("_id: 1, a: [{b: 1, c: 2}, {b: 3}, 7]", "'a.b': 1"))
            .isEqualTo(json("_id: 1, a: [{b: 1}, {b: 3}]"));
        assertThat(project("_id: 1, a: 5", "'a.b': 1"))
            .isEqualTo(json("_id: 1"));
    }

    @Test
    void testMixedInclusionAndExclusion() {
        assertThatExceptionOfType(ServerError.class)
            .isThrownBy(() -> project("_id: 1", "a: 1, b: 0"))
            .withMessage("[Error 31254] Cannot do exclusion on field b in inclusion projection");
        assertThatExceptionOfType(ServerError.class)
            .isThrownBy(() -> project("_id: 1", "a: 0, b: 1"))
            .withMessage("[Error 31253] Cannot do inclusion on field b in exclusion projection");
    }

    @Test
    void testInvalidFieldPaths() {
        assertThatExceptionOfType(ServerError.class)
            .isThrownBy(() -> project("_id: 1", "a: 1, 'a.b': 1"))
            .withMessage("[Error 31249] Path collision at a.b remaining portion b");
        assertThatExceptionOfType(BadValueException.class)
            .isThrownBy(() -> project("_id: 1", "'': 1"))
            .withMessage("[Error 2] FieldPath cannot be constructed with empty string");
        assertThatExceptionOfType(BadValueException.class)
            .isThrownBy(() -> project("_id: 1", "'a..b': 1"))
            .withMessage("[Error 2] FieldPath field names may not be empty strings.");
        assertThatExceptionOfType(BadValueException.class)
            .isThrownBy(() -> project("_id: 1", "'$a': 1"))
            .withMessage("[Error 2] FieldPath field names may not start with '$'.");
        assertThatExceptionOfType(BadValueException.class)
            .isThrownBy(() -> project("_id: 1", "a: {$foo: 1}"))
            .withMessage("[Error 2] Unsupported projection option: a: { $foo: 1 }");
    }

    @Test
    void testSliceWithCount() {
        assertThat(slice(2)).isEqualTo(json("_id: 1, a: [1, 2], b: 'x'"));
        assertThat(slice(-2)).isEqualTo(json("_id: 1, a: [4, 5], b: 'x'"));
        assertThat(slice(0)).isEqualTo(json("_id: 1, a: [], b: 'x'"));
        assertThat(slice(10)).isEqualTo(json("_id: 1, a: [1, 2, 3, 4, 5], b: 'x'"));
        assertThat(slice(-10L)).isEqualTo(json("_id: 1, a: [1, 2, 3, 4, 5], b: 'x'"));
        assertThat(slice(1.9)).isEqualTo(json("_id: 1, a: [1], b: 'x'"));
        assertThat(slice(Double.NaN)).isEqualTo(json("_id: 1, a: [], b: 'x'"));
        assertThat(slice(Double.POSITIVE_INFINITY)).isEqualTo(json("_id: 1, a: [1, 2, 3, 4, 5], b: 'x'"));
    }

    @Test
    void testSliceWithSkipAndLimit() {
        assertThat(slice(json("v: [1, 2]").get("v"))).isEqualTo(json("_id: 1, a: [2, 3], b: 'x'"));
        assertThat(slice(json("v: [-2, 1]").get("v"))).isEqualTo(json("_id: 1, a: [4], b: 'x'"));
        assertThat(slice(json("v: [-10, 2]").get("v"))).isEqualTo(json("_id: 1, a: [1, 2], b: 'x'"));
        assertThat(slice(json("v: [10, 2]").get("v"))).isEqualTo(json("_id: 1, a: [], b: 'x'"));
        assertThat(slice(json("v: [3, null]").get("v"))).isEqualTo(json("_id: 1, a: [4, 5], b: 'x'"));
    }

    @Test
    void testSliceKeepsNonArrayValues() {
        Document projection = new Document("b", new Document("$slice", 1));

        assertThat(new Projection(projection, "_id").projectDocument(json("_id: 1, a: 1, b: 'x'")))
            .isEqualTo(json("_id: 1, a: 1, b: 'x'"));
    }

    @Test
    void testSliceCombinedWithInclusion() {
        assertThat(project("_id: 1, a: [1, 2, 3], b: 2, c: 3", "a: {$slice: 1}, b: 1"))
            .isEqualTo(json("_id: 1, a: [1], b: 2"));
    }

    @Test
    void testIllegalSliceArguments() {
        assertThatExceptionOfType(ServerError.class)
            .isThrownBy(() -> slice("x"))
            .withMessage("[Error 28667] Invalid $slice syntax. The given syntax { $slice: \"x\" } did not match the find() syntax because "
                + ":: Location31273: $slice only supports numbers and [skip, limit] arrays :: "
                + "The given syntax did not match the expression $slice syntax. :: caused by :: "
                + "Expression $slice takes at least 2 arguments, and at most 3, but 1 were passed in.");
        assertThatExceptionOfType(ServerError.class)
            .isThrownBy(() -> slice(json("v: [1]").get("v")))
            .withMessageStartingWith("[Error 28667] Invalid $slice syntax. The given syntax { $slice: [ 1 ] }")
            .withMessageEndingWith("but 1 were passed in.");
        assertThatExceptionOfType(ServerError.class)
            .isThrownBy(() -> slice(json("v: [1, -1]").get("v")))
            .withMessage("[Error 28724] First argument to $slice must be an array, but is of type: int");
        assertThatExceptionOfType(ServerError.class)
            .isThrownBy(() -> slice(json("v: ['a', 1]").get("v")))
            .withMessage("[Error 28724] First argument to $slice must be an array, but is of type: string");
        assertThatExceptionOfType(ServerError.class)
            .isThrownBy(() -> slice(json("v: [1, 2, 3]").get("v")))
            .withMessage("[Error 28724] First argument to $slice must be an array, but is of type: int");
    }

    @Test
    void testElemMatch() {
        assertThat(project("_id: 1, a: [{b: 1}, {b: 2}, {b: 2, c: 1}], d: 1", "a: {$elemMatch: {b: 2}}"))
            .isEqualTo(json("_id: 1, a: [{b: 2}]"));
        assertThat(project("_id: 1, a: [{b: 1}], d: 1", "a: {$elemMatch: {b: 5}}"))
            .isEqualTo(json("_id: 1"));
        assertThat(project("_id: 1, a: [{b: 1}], d: 1", "a: {$elemMatch: {b: 1}}, d: 1"))
            .isEqualTo(json("_id: 1, a: [{b: 1}], d: 1"));
    }

    @Test
    void testIllegalElemMatch() {
        assertThatExceptionOfType(BadValueException.class)
            .isThrownBy(() -> project("_id: 1", "a: {$elemMatch: 1}"))
            .withMessage("[Error 2] elemMatch: Invalid argument, object required, but got int");
        assertThatExceptionOfType(BadValueException.class)
            .isThrownBy(() -> project("_id: 1", "'a.b': {$elemMatch: {c: 1}}"))
            .withMessage("[Error 2] Cannot use $elemMatch projection on a nested field.");
    }

    @Test
    void testProjectNull() {
        assertThat(new Projection(json("a: 1"), "_id").projectDocument(null)).isNull();
    }

}
