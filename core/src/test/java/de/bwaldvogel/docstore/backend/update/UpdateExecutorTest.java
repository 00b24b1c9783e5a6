package de.bwaldvogel.docstore.backend.update;

import static de.bwaldvogel.docstore.TestDocuments.json;
import static de.bwaldvogel.docstore.TestDocuments.list;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;

import java.time.Instant;

import org.junit.jupiter.api.Test;

import de.bwaldvogel.docstore.backend.DefaultQueryMatcher;
import de.bwaldvogel.docstore.bson.Document;
import de.bwaldvogel.docstore.bson.ObjectId;
import de.bwaldvogel.docstore.exception.BadValueException;
import de.bwaldvogel.docstore.exception.ConflictingUpdateOperatorsException;
import de.bwaldvogel.docstore.exception.DocumentValidationError;
import de.bwaldvogel.docstore.exception.FailedToParseException;
import de.bwaldvogel.docstore.exception.ImmutableFieldException;
import de.bwaldvogel.docstore.exception.PathNotViableException;
import de.bwaldvogel.docstore.exception.ServerError;
import de.bwaldvogel.docstore.exception.TypeMismatchException;

class UpdateExecutorTest {

    private final UpdateExecutor updateExecutor = new UpdateExecutor(new DefaultQueryMatcher());

    private UpdateResult update(String document, String update) {
        return updateExecutor.apply(json(document), json(update), false);
    }

    @Test
    void testSet() {
        UpdateResult result = update("_id: 1, a: 1", "$set: {a: 2, 'b.c': 'x'}");

        assertThat(result.isModified()).isTrue();
        assertThat(result.getDocument()).isEqualTo(json("_id: 1, a: 2, b: {c: 'x'}"));
    }

    @Test
    void testSetLeavesOriginalDocumentUntouched() {
        Document document = json("_id: 1, a: {b: 1}");

        updateExecutor.apply(document, json("$set: {'a.b': 2}"), false);

        assertThat(document).isEqualTo(json("_id: 1, a: {b: 1}"));
    }

    @Test
    void testSetWithSameValueIsNoModification() {
        assertThat(update("_id: 1, a: 1", "$set: {a: 1}").isModified()).isFalse();
        assertThat(update("_id: 1, a: 1", "$set: {a: 1.0}").isModified()).isTrue();
    }

    @Test
    void testSetWithEmptyDocument() {
        UpdateResult result = update("_id: 1, a: 1", "$set: {}");

        assertThat(result.isModified()).isFalse();
        assertThat(result.getDocument()).isEqualTo(json("_id: 1, a: 1"));
    }

    @Test
    void testSetInfinity() {
        Document document = new Document("_id", 1).append("a", 0.0);

        UpdateResult result = updateExecutor.apply(document,
            new Document("$set", new Document("a", Double.POSITIVE_INFINITY)), false);

        assertThat(result.isModified()).isTrue();
        assertThat(result.getDocument().get("a")).isEqualTo(Double.POSITIVE_INFINITY);
    }

    @Test
    void testReplacementWithInfinityIsRejected() {
        Document document = new Document("_id", 1).append("a", 0.0);

        assertThatExceptionOfType(DocumentValidationError.class)
            .isThrownBy(() -> updateExecutor.apply(document, new Document("a", Double.NEGATIVE_INFINITY), false))
            .withMessage("[Error 2] invalid value: { \"a\": -Inf } (infinity values are not allowed)");
    }

    @Test
    void testModifierWithNonDocumentArgument() {
        assertThatExceptionOfType(FailedToParseException.class)
            .isThrownBy(() -> update("_id: 1", "$set: 'x'"))
            .withMessage("[Error 9] Modifiers operate on fields but we found type string instead. "
                + "For example: {$mod: {<field>: ...}} not {$set: \"x\"}");
    }

    @Test
    void testUnknownModifier() {
        assertThatExceptionOfType(FailedToParseException.class)
            .isThrownBy(() -> update("_id: 1", "$foo: {a: 1}"))
            .withMessage("[Error 9] Unknown modifier: $foo. "
                + "Expected a valid update modifier or pipeline-style update specified as an array");
    }

    @Test
    void testMixedOperatorsAndFields() {
        assertThatExceptionOfType(ServerError.class)
            .isThrownBy(() -> update("_id: 1", "$set: {a: 1}, b: 2"))
            .withMessage("[Error 52] The dollar ($) prefixed field is not allowed in the context of an update's replacement document.");
    }

    @Test
    void testConflictingPaths() {
        assertThatExceptionOfType(ConflictingUpdateOperatorsException.class)
            .isThrownBy(() -> update("_id: 1", "$set: {a: 1}, $inc: {'a.b': 1}"))
            .withMessageStartingWith("[Error 40] Updating the path 'a' would create a conflict at 'a'");

        assertThatExceptionOfType(ConflictingUpdateOperatorsException.class)
            .isThrownBy(() -> update("_id: 1", "$set: {a: 1}, $unset: {a: ''}"))
            .withMessageStartingWith("[Error 40] ");
    }

    @Test
    void testEmptyFieldNameInPath() {
        assertThatExceptionOfType(ServerError.class)
            .isThrownBy(() -> update("_id: 1", "$set: {'a..b': 1}"))
            .withMessage("[Error 56] The update path 'a..b' contains an empty field name, which is not allowed.");
    }

    @Test
    void testChangingIdIsRejected() {
        assertThatExceptionOfType(ImmutableFieldException.class)
            .isThrownBy(() -> update("_id: 1, a: 1", "$set: {_id: 2}"))
            .withMessage("[Error 66] Performing an update on the path '_id' would modify the immutable field '_id'");

        assertThatExceptionOfType(ImmutableFieldException.class)
            .isThrownBy(() -> update("_id: 1, a: 1", "$set: {_id: 1.0}"));

        assertThat(update("_id: 1, a: 1", "$set: {_id: 1}").isModified()).isFalse();
    }

    @Test
    void testUnset() {
        UpdateResult result = update("_id: 1, a: 1, b: {c: 1, d: 2}", "$unset: {a: '', 'b.c': 1, x: 1}");

        assertThat(result.isModified()).isTrue();
        assertThat(result.getDocument()).isEqualTo(json("_id: 1, b: {d: 2}"));

        assertThat(update("_id: 1", "$unset: {x: 1}").isModified()).isFalse();
    }

    @Test
    void testInc() {
        UpdateResult result = update("_id: 1, a: 1, b: 2.5", "$inc: {a: 2, b: 1, c: 5}");

        assertThat(result.getDocument()).isEqualTo(json("_id: 1, a: 3, b: 3.5, c: 5"));
    }

    @Test
    void testIncWithNonNumericValues() {
        assertThatExceptionOfType(TypeMismatchException.class)
            .isThrownBy(() -> update("_id: 1, a: 1", "$inc: {a: 'x'}"))
            .withMessage("[Error 14] Cannot increment with non-numeric argument: {a: \"x\"}");

        assertThatExceptionOfType(TypeMismatchException.class)
            .isThrownBy(() -> update("_id: 1, a: 'x'", "$inc: {a: 1}"))
            .withMessage("[Error 14] Cannot apply $inc to a value of non-numeric type. "
                + "{_id: 1} has the field 'a' of non-numeric type string");
    }

    @Test
    void testIncIntegerOverflowTurnsIntoLong() {
        Document document = new Document("_id", 1);
        document.put("a", Integer.MAX_VALUE);

        UpdateResult result = updateExecutor.apply(document, json("$inc: {a: 1}"), false);

        assertThat(result.getDocument().get("a")).isEqualTo(Integer.MAX_VALUE + 1L);
    }

    @Test
    void testIncProducingInfinity() {
        Document document = new Document("_id", 1);
        document.put("a", Double.MAX_VALUE);
        Document update = new Document("$inc", new Document("a", Double.MAX_VALUE));

        assertThatExceptionOfType(BadValueException.class)
            .isThrownBy(() -> updateExecutor.apply(document, update, false))
            .withMessageStartingWith("[Error 2] update produces invalid value: ")
            .withMessageEndingWith("(update operations that produce infinity values are not allowed)");
    }

    @Test
    void testMul() {
        UpdateResult result = update("_id: 1, a: 3, b: 1.5", "$mul: {a: 2, b: 2, c: 2.0}");

        assertThat(result.getDocument()).isEqualTo(json("_id: 1, a: 6, b: 3.0, c: 0.0"));
    }

    @Test
    void testMinAndMax() {
        assertThat(update("_id: 1, a: 5", "$min: {a: 3}").getDocument()).isEqualTo(json("_id: 1, a: 3"));
        assertThat(update("_id: 1, a: 5", "$min: {a: 7}").isModified()).isFalse();
        assertThat(update("_id: 1, a: 5", "$max: {a: 7}").getDocument()).isEqualTo(json("_id: 1, a: 7"));
        assertThat(update("_id: 1, a: 5", "$max: {a: 'x'}").getDocument()).isEqualTo(json("_id: 1, a: 'x'"));
        assertThat(update("_id: 1", "$max: {a: 1}").getDocument()).isEqualTo(json("_id: 1, a: 1"));
    }

    @Test
    void testRename() {
        UpdateResult result = update("_id: 1, a: 1, b: {c: 2}", "$rename: {a: 'x', 'b.c': 'y.z'}");

        assertThat(result.getDocument()).isEqualTo(json("_id: 1, b: {}, x: 1, y: {z: 2}"));
        assertThat(update("_id: 1", "$rename: {a: 'b'}").isModified()).isFalse();
    }

    @Test
    void testIllegalRename() {
        assertThatExceptionOfType(BadValueException.class)
            .isThrownBy(() -> update("_id: 1, a: 1", "$rename: {a: 1}"))
            .withMessage("[Error 2] The 'to' field for $rename must be a string: a: 1");
        assertThatExceptionOfType(BadValueException.class)
            .isThrownBy(() -> update("_id: 1, a: 1", "$rename: {a: 'a'}"))
            .withMessage("[Error 2] The source and target field for $rename must differ: a: \"a\"");
        assertThatExceptionOfType(ServerError.class)
            .isThrownBy(() -> update("_id: 1, a: 1", "$rename: {a: ''}"))
            .withMessage("[Error 56] An empty update path is not valid.");
        assertThatExceptionOfType(PathNotViableException.class)
            .isThrownBy(() -> update("_id: 1, a: [{b: 1}]", "$rename: {'a.b': 'c'}"))
            .withMessage("[Error 28] cannot use path 'a.b' to traverse the document");
    }

    @Test
    void testCurrentDate() {
        Document document = update("_id: 1", "$currentDate: {a: true}").getDocument();

        assertThat(document.get("a")).isInstanceOf(Instant.class);

        assertThatExceptionOfType(BadValueException.class)
            .isThrownBy(() -> update("_id: 1", "$currentDate: {a: {$type: 'x'}}"))
            .withMessageStartingWith("[Error 2] The '$type' string field is required to be 'date' or 'timestamp'");
    }

    @Test
    void testPush() {
        assertThat(update("_id: 1, a: [1]", "$push: {a: 2}").getDocument())
            .isEqualTo(json("_id: 1, a: [1, 2]"));
        assertThat(update("_id: 1, a: [1]", "$push: {a: {$each: [1, 3]}}").getDocument())
            .isEqualTo(json("_id: 1, a: [1, 1, 3]"));
        assertThat(update("_id: 1", "$push: {a: 1}").getDocument())
            .isEqualTo(json("_id: 1, a: [1]"));
        assertThat(update("_id: 1, a: [1]", "$push: {a: {$each: []}}").isModified()).isFalse();
    }

    @Test
    void testPushToNonArray() {
        assertThatExceptionOfType(BadValueException.class)
            .isThrownBy(() -> update("_id: 1, a: 'x'", "$push: {a: 1}"))
            .withMessage("[Error 2] The field 'a' must be an array but is of type 'string' in document {_id: 1}");
        assertThatExceptionOfType(BadValueException.class)
            .isThrownBy(() -> update("_id: 1", "$push: {a: {$each: 1}}"))
            .withMessage("[Error 2] The argument to $each in $push must be an array but it was of type: int");
    }

    @Test
    void testAddToSet() {
        assertThat(update("_id: 1, a: [1, 2]", "$addToSet: {a: 2.0}").isModified()).isFalse();
        assertThat(update("_id: 1, a: [1, 2]", "$addToSet: {a: {$each: [2, 3, 3]}}").getDocument())
            .isEqualTo(json("_id: 1, a: [1, 2, 3]"));
    }

    @Test
    void testPop() {
        assertThat(update("_id: 1, a: [1, 2, 3]", "$pop: {a: 1}").getDocument()).isEqualTo(json("_id: 1, a: [1, 2]"));
        assertThat(update("_id: 1, a: [1, 2, 3]", "$pop: {a: -1}").getDocument()).isEqualTo(json("_id: 1, a: [2, 3]"));
        assertThat(update("_id: 1, a: []", "$pop: {a: 1}").isModified()).isFalse();
        assertThat(update("_id: 1", "$pop: {a: 1}").isModified()).isFalse();

        assertThatExceptionOfType(FailedToParseException.class)
            .isThrownBy(() -> update("_id: 1, a: [1]", "$pop: {a: 2}"))
            .withMessage("[Error 9] $pop expects 1 or -1, found: 2");
        assertThatExceptionOfType(TypeMismatchException.class)
            .isThrownBy(() -> update("_id: 1, a: 1", "$pop: {a: 1}"))
            .withMessage("[Error 14] Path 'a' contains an element of non-array type 'int'");
    }

    @Test
    void testPull() {
        assertThat(update("_id: 1, a: [1, 2, 3, 4, 2]", "$pull: {a: 2}").getDocument())
            .isEqualTo(json("_id: 1, a: [1, 3, 4]"));
        assertThat(update("_id: 1, a: [1, 2, 3, 4]", "$pull: {a: {$gte: 3}}").getDocument())
            .isEqualTo(json("_id: 1, a: [1, 2]"));
        assertThat(update("_id: 1, a: [{b: 1, c: 1}, {b: 2}]", "$pull: {a: {b: 1}}").getDocument())
            .isEqualTo(json("_id: 1, a: [{b: 2}]"));
        assertThat(update("_id: 1, a: [1]", "$pull: {a: 5}").isModified()).isFalse();
    }

    @Test
    void testPullThroughScalar() {
        assertThatExceptionOfType(PathNotViableException.class)
            .isThrownBy(() -> update("_id: 1, a: 1", "$pull: {'a.b': 1}"))
            .withMessage("[Error 28] Cannot use the part (b) of (a.b) to traverse the element ({a: 1})");
    }

    @Test
    void testPullAll() {
        assertThat(update("_id: 1, a: [1, 2, 3, 1]", "$pullAll: {a: [1, 3.0]}").getDocument())
            .isEqualTo(json("_id: 1, a: [2]"));

        assertThatExceptionOfType(BadValueException.class)
            .isThrownBy(() -> update("_id: 1, a: [1]", "$pullAll: {a: 1}"))
            .withMessage("[Error 2] The field 'a' must be an array but is of type 'int'");
    }

    @Test
    void testSetOnInsertIsIgnoredWithoutUpsert() {
        assertThat(update("_id: 1", "$setOnInsert: {a: 1}").isModified()).isFalse();
        assertThat(updateExecutor.apply(json("_id: 1"), json("$setOnInsert: {a: 1}"), true).getDocument())
            .isEqualTo(json("_id: 1, a: 1"));
    }

    @Test
    void testReplacement() {
        UpdateResult result = update("_id: 1, a: 1", "b: 2");

        assertThat(result.isModified()).isTrue();
        assertThat(result.getDocument()).isEqualTo(json("_id: 1, b: 2"));

        assertThat(update("_id: 1, a: 1", "a: 1").isModified()).isFalse();
        assertThat(update("_id: 1, a: 1", "_id: 1, a: 1").isModified()).isFalse();
    }

    @Test
    void testReplacementWithOtherId() {
        assertThatExceptionOfType(ImmutableFieldException.class)
            .isThrownBy(() -> update("_id: 1, a: 1", "_id: 2, a: 1"));
    }

    @Test
    void testCreateUpsertDocument() {
        Document document = updateExecutor.createUpsertDocument(
            json("a: 1, b: {$gt: 2}, c: {$eq: 'x'}, $and: [{d: 4}]"),
            json("$set: {e: 1}, $setOnInsert: {f: 2, 'g.h': 3}"));

        assertThat(document.keySet()).containsExactly("_id", "a", "c", "d", "e", "f");
        assertThat(document.get("_id")).isInstanceOf(ObjectId.class);
        assertThat(document.get("a")).isEqualTo(1);
        assertThat(document.get("c")).isEqualTo("x");
        assertThat(document.get("d")).isEqualTo(4);
        assertThat(document.get("e")).isEqualTo(1);
        assertThat(document.get("f")).isEqualTo(2);
    }

    @Test
    void testCreateUpsertDocumentWithIdFromSelector() {
        Document document = updateExecutor.createUpsertDocument(json("_id: 'x', a: 1"), json("b: 2"));

        assertThat(document).isEqualTo(json("_id: 'x', b: 2"));
    }

    @Test
    void testCreateUpsertDocumentAllowsNaN() {
        Document update = new Document("$setOnInsert", new Document("a", Double.valueOf(Double.NaN)));

        Document document = updateExecutor.createUpsertDocument(json("_id: 1"), update);

        assertThat(document).isEqualTo(new Document("_id", 1).append("a", Double.NaN));
    }

    @Test
    void testCreateUpsertDocumentAllowsInfinity() {
        Document update = new Document("$setOnInsert", new Document("a", Double.NEGATIVE_INFINITY));

        Document document = updateExecutor.createUpsertDocument(json("_id: 1"), update);

        assertThat(document).isEqualTo(new Document("_id", 1).append("a", Double.NEGATIVE_INFINITY));
    }

    @Test
    void testValidateUpdate() {
        UpdateExecutor.validateUpdate(json("$set: {a: 1}, $inc: {b: 1}"));

        assertThatExceptionOfType(DocumentValidationError.class)
            .isThrownBy(() -> UpdateExecutor.validateUpdate(json("'a.b': 1")))
            .withMessageContaining("invalid key: \"a.b\"");
    }

    @Test
    void testIsOperatorUpdate() {
        assertThat(UpdateExecutor.isOperatorUpdate(json("$set: {a: 1}"))).isTrue();
        assertThat(UpdateExecutor.isOperatorUpdate(json("a: 1"))).isFalse();
        assertThat(UpdateExecutor.isOperatorUpdate(json(""))).isFalse();
    }

}
