package de.bwaldvogel.docstore.backend.update;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import de.bwaldvogel.docstore.backend.Constants;
import de.bwaldvogel.docstore.backend.DocumentValidator;
import de.bwaldvogel.docstore.backend.QueryMatcher;
import de.bwaldvogel.docstore.backend.Utils;
import de.bwaldvogel.docstore.bson.BsonRegularExpression;
import de.bwaldvogel.docstore.bson.BsonType;
import de.bwaldvogel.docstore.bson.Document;
import de.bwaldvogel.docstore.bson.Json;
import de.bwaldvogel.docstore.bson.Missing;
import de.bwaldvogel.docstore.bson.ObjectId;
import de.bwaldvogel.docstore.exception.BadValueException;
import de.bwaldvogel.docstore.exception.ConflictingUpdateOperatorsException;
import de.bwaldvogel.docstore.exception.ErrorCode;
import de.bwaldvogel.docstore.exception.FailedToParseException;
import de.bwaldvogel.docstore.exception.ImmutableFieldException;
import de.bwaldvogel.docstore.exception.ServerError;

/**
 * Applies an update specification to a document. The specification is either a document of update operators
 * such as {@code {$set: {a: 1}}} or a replacement document.
 */
public class UpdateExecutor {

    /**
     * Operators whose paths must not overlap, in the order they are checked.
     */
    private static final List<UpdateOperator> PATH_CHECKED_OPERATORS = Arrays.asList(
        UpdateOperator.ADD_TO_SET,
        UpdateOperator.CURRENT_DATE,
        UpdateOperator.INC,
        UpdateOperator.MIN,
        UpdateOperator.MAX,
        UpdateOperator.MUL,
        UpdateOperator.POP,
        UpdateOperator.PULL,
        UpdateOperator.PULL_ALL,
        UpdateOperator.PUSH,
        UpdateOperator.SET,
        UpdateOperator.SET_ON_INSERT,
        UpdateOperator.UNSET
    );

    private final QueryMatcher matcher;

    public UpdateExecutor(QueryMatcher matcher) {
        this.matcher = matcher;
    }

    /**
     * @return {@code true} if the update consists of update operators, {@code false} if it is a replacement document
     */
    public static boolean isOperatorUpdate(Document update) {
        int updateOperators = 0;
        for (String key : update.keySet()) {
            if (UpdateOperator.isUpdateOperator(key)) {
                updateOperators++;
            } else if (key.startsWith("$")) {
                throw new FailedToParseException("Unknown modifier: " + key
                    + ". Expected a valid update modifier or pipeline-style update specified as an array");
            }
        }
        if (updateOperators > 0 && updateOperators != update.size()) {
            throw new ServerError(ErrorCode.DollarPrefixedFieldName,
                "The dollar ($) prefixed field is not allowed in the context of an update's replacement document.");
        }
        return updateOperators > 0;
    }

    /**
     * Checks the operator arguments without applying them.
     */
    public static void validateUpdate(Document update) {
        if (!isOperatorUpdate(update)) {
            DocumentValidator.validate(update);
            return;
        }
        for (String key : update.keySet()) {
            getOperatorArgument(update, UpdateOperator.fromValue(key));
        }
        validateOperatorKeys(update);
        validateCurrentDateExpression(update);
        validateRenameExpression(update);
    }

    public UpdateResult apply(Document document, Document update, boolean isUpsert) {
        if (isOperatorUpdate(update)) {
            return applyOperators(document, update, isUpsert);
        } else {
            return applyReplacement(document, update);
        }
    }

    private UpdateResult applyOperators(Document document, Document update, boolean isUpsert) {
        validateUpdate(update);

        Document newDocument = document.cloneDeeply();
        Object oldId = newDocument.getOrMissing(Constants.ID_FIELD);

        boolean modified = false;
        for (String key : update.keySet()) {
            UpdateOperator operator = UpdateOperator.fromValue(key);
            Document change = getOperatorArgument(update, operator);
            FieldUpdates fieldUpdates = new FieldUpdates(newDocument, operator, isUpsert, matcher);
            if (fieldUpdates.apply(change)) {
                modified = true;
            }
        }

        Object newId = newDocument.getOrMissing(Constants.ID_FIELD);
        if (!(oldId instanceof Missing)
            && (!Utils.nullAwareEquals(oldId, newId) || !BsonType.aliasOf(oldId).equals(BsonType.aliasOf(newId)))) {
            throw new ImmutableFieldException(Constants.ID_FIELD);
        }

        if (modified) {
            DocumentValidator.validate(newDocument, DocumentValidator.Mode.UPDATE);
        }
        return new UpdateResult(newDocument, modified);
    }

    private static UpdateResult applyReplacement(Document document, Document replacement) {
        DocumentValidator.validate(replacement);

        Object oldId = document.get(Constants.ID_FIELD);
        Object newId = replacement.get(Constants.ID_FIELD);
        if (oldId != null && newId != null && !Utils.nullAwareEquals(oldId, newId)) {
            throw new ImmutableFieldException(Constants.ID_FIELD);
        }

        Document newDocument = new Document();
        if (document.containsKey(Constants.ID_FIELD)) {
            newDocument.put(Constants.ID_FIELD, document.get(Constants.ID_FIELD));
        }
        for (String key : replacement.keySet()) {
            if (!key.equals(Constants.ID_FIELD) || !newDocument.containsKey(key)) {
                newDocument.put(key, Document.cloneValue(replacement.get(key)));
            }
        }

        if (Utils.nullAwareEquals(document, newDocument)) {
            return new UpdateResult(document.cloneDeeply(), false);
        }
        return new UpdateResult(newDocument, true);
    }

    /**
     * Builds the document inserted by an upsert: the equality conditions of the selector, with the update applied.
     */
    public Document createUpsertDocument(Document selector, Document update) {
        Document seed = new Document();
        seedFromSelector(seed, selector);

        Document newDocument;
        if (isOperatorUpdate(update)) {
            newDocument = applyOperators(seed, update, true).getDocument();
        } else {
            DocumentValidator.validate(update);
            newDocument = update.cloneDeeply();
            if (!newDocument.containsKey(Constants.ID_FIELD) && seed.containsKey(Constants.ID_FIELD)) {
                newDocument = withIdFirst(seed.get(Constants.ID_FIELD), newDocument);
            }
        }

        if (!newDocument.containsKey(Constants.ID_FIELD)) {
            newDocument = withIdFirst(new ObjectId(), newDocument);
        }
        DocumentValidator.validate(newDocument, DocumentValidator.Mode.UPDATE);
        return newDocument;
    }

    private static Document withIdFirst(Object id, Document document) {
        Document result = new Document(Constants.ID_FIELD, id);
        result.putAll(document);
        return result;
    }

    private static void seedFromSelector(Document seed, Document selector) {
        for (String key : selector.keySet()) {
            Object value = selector.get(key);
            if (key.equals("$and") && value instanceof List<?> conditions) {
                for (Object condition : conditions) {
                    if (condition instanceof Document conditionDocument) {
                        seedFromSelector(seed, conditionDocument);
                    }
                }
                continue;
            }
            if (key.startsWith("$")) {
                continue;
            }
            if (value instanceof BsonRegularExpression) {
                continue;
            }
            if (value instanceof Document valueDocument && !valueDocument.isEmpty()
                && valueDocument.keySet().iterator().next().startsWith("$")) {
                if (valueDocument.size() == 1 && valueDocument.containsKey("$eq")) {
                    value = valueDocument.get("$eq");
                } else {
                    continue;
                }
            }
            Utils.changeSubdocumentValue(seed, key, Document.cloneValue(value));
        }
    }

    private static Document getOperatorArgument(Document update, UpdateOperator operator) {
        Object argument = update.get(operator.getValue());
        if (!(argument instanceof Document document)) {
            throw new FailedToParseException("Modifiers operate on fields but we found type " + BsonType.aliasOf(argument)
                + " instead. For example: {$mod: {<field>: ...}} not {" + operator.getValue() + ": "
                + Json.toCompactJsonValue(argument) + "}");
        }
        Set<String> keys = new HashSet<>();
        for (String key : document.getDecodedKeys()) {
            if (!keys.add(key)) {
                throw new ConflictingUpdateOperatorsException(key, key);
            }
        }
        return document;
    }

    private static void validateOperatorKeys(Document update) {
        List<List<String>> visitedPaths = new ArrayList<>();
        for (UpdateOperator operator : PATH_CHECKED_OPERATORS) {
            if (!update.containsKey(operator.getValue())) {
                continue;
            }
            Document change = (Document) update.get(operator.getValue());
            for (String key : change.keySet()) {
                List<String> path = Utils.splitPath(key);
                if (path.stream().anyMatch(String::isEmpty)) {
                    throw new ServerError(ErrorCode.EmptyFieldName,
                        "The update path '" + key + "' contains an empty field name, which is not allowed.");
                }
                for (List<String> visitedPath : visitedPaths) {
                    if (isPrefix(visitedPath, path) || isPrefix(path, visitedPath)) {
                        throw new ConflictingUpdateOperatorsException(key, key);
                    }
                }
                visitedPaths.add(path);
            }
        }
    }

    private static boolean isPrefix(List<String> prefix, List<String> path) {
        return prefix.size() <= path.size() && path.subList(0, prefix.size()).equals(prefix);
    }

    private static void validateCurrentDateExpression(Document update) {
        Document currentDate = (Document) update.get(UpdateOperator.CURRENT_DATE.getValue());
        if (currentDate == null) {
            return;
        }
        for (String field : currentDate.keySet()) {
            Object value = currentDate.get(field);
            if (value instanceof Document typeSpecification) {
                for (String key : typeSpecification.keySet()) {
                    if (!key.equals("$type")) {
                        throw new BadValueException("Unrecognized $currentDate option: " + key);
                    }
                }
                if (!typeSpecification.containsKey("$type")) {
                    continue;
                }
                Object type = typeSpecification.get("$type");
                if (!"date".equals(type) && !"timestamp".equals(type)) {
                    throw new BadValueException("The '$type' string field is required to be 'date' or 'timestamp': "
                        + "{$currentDate: {field : {$type: 'date'}}}");
                }
            } else if (!(value instanceof Boolean)) {
                throw new BadValueException(BsonType.aliasOf(value) + " is not valid type for $currentDate. "
                    + "Please use a boolean ('true') or a $type expression ({$type: 'timestamp/date'}).");
            }
        }
    }

    private static void validateRenameExpression(Document update) {
        Document rename = (Document) update.get(UpdateOperator.RENAME.getValue());
        if (rename == null) {
            return;
        }
        Set<String> keys = new HashSet<>();
        for (String key : rename.keySet()) {
            Object value = rename.get(key);
            if (!(value instanceof String target)) {
                throw new BadValueException("The 'to' field for $rename must be a string: " + key + ": " + Json.toCompactJsonValue(value));
            }
            if (key.equals(target)) {
                throw new BadValueException("The source and target field for $rename must differ: " + key + ": \"" + target + "\"");
            }
            if (!keys.add(key)) {
                throw new ConflictingUpdateOperatorsException(key, key);
            }
            if (!keys.add(target)) {
                throw new ConflictingUpdateOperatorsException(target, target);
            }
        }
    }

}
