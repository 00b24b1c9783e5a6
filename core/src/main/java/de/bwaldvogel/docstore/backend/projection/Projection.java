package de.bwaldvogel.docstore.backend.projection;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map.Entry;
import java.util.Set;

import de.bwaldvogel.docstore.backend.DefaultQueryMatcher;
import de.bwaldvogel.docstore.backend.QueryMatcher;
import de.bwaldvogel.docstore.backend.Utils;
import de.bwaldvogel.docstore.bson.BsonType;
import de.bwaldvogel.docstore.bson.Document;
import de.bwaldvogel.docstore.bson.Json;
import de.bwaldvogel.docstore.bson.Missing;
import de.bwaldvogel.docstore.exception.BadValueException;
import de.bwaldvogel.docstore.exception.ErrorCode;
import de.bwaldvogel.docstore.exception.ServerError;

/**
 * Shapes the documents returned by {@code find}. A projection either lists the fields to include or the fields to
 * exclude; {@code _id} is included unless it is excluded explicitly. Array fields can be narrowed with
 * {@code $slice} and {@code $elemMatch}.
 */
public class Projection {

    private static final String SLICE = "$slice";
    private static final String ELEM_MATCH = "$elemMatch";

    private final Document fields;
    private final String idField;
    private final boolean onlyExclusions;
    private final QueryMatcher matcher = new DefaultQueryMatcher();

    public Projection(Document fields, String idField) {
        validateFields(fields);
        this.fields = fields;
        this.idField = idField;
        this.onlyExclusions = onlyExclusions(fields, idField);
    }

    public Document projectDocument(Document document) {
        if (document == null) {
            return null;
        }

        Document newDocument;
        if (onlyExclusions) {
            newDocument = document.cloneDeeply();
        } else {
            newDocument = new Document();
            // implicitly add _id if not mentioned
            Object idProjection = fields.get(idField);
            if (!fields.containsKey(idField) || (Utils.isTrue(idProjection) && !(idProjection instanceof Document))) {
                Object id = document.getOrMissing(idField);
                if (!(id instanceof Missing)) {
                    newDocument.put(idField, id);
                }
            }
        }

        for (Entry<String, Object> entry : fields.entrySet()) {
            String key = entry.getKey();
            Object value = entry.getValue();
            if (key.equals(idField) && !onlyExclusions && Utils.isTrue(value) && !(value instanceof Document)) {
                continue;
            }
            projectField(document, newDocument, key, value);
        }

        return newDocument;
    }

    private static void validateFields(Document fields) {
        for (String key : fields.keySet()) {
            if (key.isEmpty()) {
                throw new BadValueException("FieldPath cannot be constructed with empty string");
            }
            if (Utils.splitPath(key).stream().anyMatch(String::isEmpty)) {
                throw new BadValueException("FieldPath field names may not be empty strings.");
            }
            if (key.startsWith("$")) {
                throw new BadValueException("FieldPath field names may not start with '$'.");
            }
            for (String otherKey : fields.keySet()) {
                if (key.equals(otherKey) || otherKey.length() < key.length()) {
                    continue;
                }
                if (otherKey.startsWith(key + ".")) {
                    List<String> shorterPathFragments = Utils.splitPath(key);
                    List<String> longerPathFragments = Utils.splitPath(otherKey);
                    String remainingPortion = Utils.joinPath(
                        longerPathFragments.subList(shorterPathFragments.size(), longerPathFragments.size()));
                    throw new ServerError(ErrorCode._31249, "Path collision at " + otherKey + " remaining portion " + remainingPortion);
                }
            }
            Object value = fields.get(key);
            if (value instanceof Document projectionDocument) {
                validateOperator(key, projectionDocument);
            }
        }
    }

    private static void validateOperator(String key, Document projectionDocument) {
        if (projectionDocument.keySet().equals(Set.of(SLICE))) {
            Slice.parse(projectionDocument.get(SLICE));
        } else if (projectionDocument.keySet().equals(Set.of(ELEM_MATCH))) {
            Object elemMatch = projectionDocument.get(ELEM_MATCH);
            if (!(elemMatch instanceof Document)) {
                throw new BadValueException("elemMatch: Invalid argument, object required, but got " + BsonType.aliasOf(elemMatch));
            }
            if (key.contains(".")) {
                throw new BadValueException("Cannot use $elemMatch projection on a nested field.");
            }
        } else {
            throw new BadValueException("Unsupported projection option: " + key + ": " + Json.toCompactJsonValue(projectionDocument));
        }
    }

    private enum Type {
        INCLUSION, EXCLUSION;

        private static Type fromValue(Object value) {
            if (value instanceof Document) {
                return null;
            }
            if (Utils.isTrue(value)) {
                return INCLUSION;
            } else {
                return EXCLUSION;
            }
        }
    }

    private static boolean onlyExclusions(Document fields, String idField) {
        Type projectionType = null;
        boolean hasElemMatch = false;
        for (Entry<String, Object> entry : fields.entrySet()) {
            Object value = entry.getValue();
            if (value instanceof Document projectionDocument && projectionDocument.containsKey(ELEM_MATCH)) {
                hasElemMatch = true;
            }
            Type type = Type.fromValue(value);
            if (type == null || entry.getKey().equals(idField)) {
                continue;
            }
            if (projectionType == null) {
                projectionType = type;
            } else if (projectionType != type) {
                if (projectionType == Type.INCLUSION) {
                    throw new ServerError(ErrorCode._31254, "Cannot do exclusion on field " + entry.getKey() + " in inclusion projection");
                } else {
                    throw new ServerError(ErrorCode._31253, "Cannot do inclusion on field " + entry.getKey() + " in exclusion projection");
                }
            }
        }
        if (projectionType == null) {
            if (hasElemMatch) {
                return false;
            }
            // only _id was mentioned, e.g. {_id: 1} includes nothing else
            Object idValue = fields.get(idField);
            return !(idValue != null && !(idValue instanceof Document) && Utils.isTrue(idValue));
        }
        return projectionType == Type.EXCLUSION;
    }

    private void projectField(Document document, Document newDocument, String key, Object projectionValue) {
        if (key.contains(".")) {
            String mainKey = Utils.getHead(key);
            String subKey = Utils.getTail(key);

            Object object = document.get(mainKey);
            // do not project the subdocument if it is not of type Document
            if (object instanceof Document subDocument) {
                Object existing = newDocument.get(mainKey);
                Document newSubDocument = existing instanceof Document existingDocument ? existingDocument : new Document();
                newDocument.put(mainKey, newSubDocument);
                projectField(subDocument, newSubDocument, subKey, projectionValue);
            } else if (object instanceof List<?> values) {
                projectArrayField(values, newDocument, mainKey, subKey, projectionValue);
            }
        } else {
            Object value = document.getOrMissing(key);

            if (projectionValue instanceof Document projectionDocument) {
                if (projectionDocument.containsKey(ELEM_MATCH)) {
                    Document elemMatch = (Document) projectionDocument.get(ELEM_MATCH);
                    projectElemMatch(newDocument, elemMatch, key, value);
                } else {
                    Slice slice = Slice.parse(projectionDocument.get(SLICE));
                    projectSlice(newDocument, slice, key, value);
                }
            } else if (Utils.isTrue(projectionValue)) {
                if (!(value instanceof Missing)) {
                    newDocument.put(key, value);
                }
            } else {
                newDocument.remove(key);
            }
        }
    }

    @SuppressWarnings("unchecked")
    private void projectArrayField(List<?> values, Document newDocument, String mainKey, String subKey, Object projectionValue) {
        boolean inclusion = !onlyExclusions;
        List<Object> newProjectedValues;
        Object existing = newDocument.get(mainKey);
        if (existing instanceof List<?> && (!inclusion || !((List<?>) existing).isEmpty())) {
            newProjectedValues = (List<Object>) existing;
        } else {
            newProjectedValues = new ArrayList<>();
            // projecting in, so start with empty documents
            for (Object value : values) {
                if (value instanceof Document) {
                    newProjectedValues.add(new Document());
                }
            }
            newDocument.put(mainKey, newProjectedValues);
        }

        int idx = 0;
        for (Object value : values) {
            if (value instanceof Document valueDocument) {
                Document newProjectedDocument = (Document) newProjectedValues.get(idx);
                projectField(valueDocument, newProjectedDocument, subKey, projectionValue);
                idx++;
            } else if (!inclusion) {
                // primitives are kept when projecting away
                idx++;
            }
        }
    }

    private void projectElemMatch(Document newDocument, Document elemMatch, String key, Object value) {
        newDocument.remove(key);
        if (value instanceof List<?> values) {
            values.stream()
                .filter(element -> element instanceof Document)
                .filter(element -> matcher.matches((Document) element, elemMatch))
                .findFirst()
                .ifPresent(element -> newDocument.put(key, new ArrayList<>(Collections.singletonList(element))));
        }
    }

    private static void projectSlice(Document newDocument, Slice slice, String key, Object value) {
        if (value instanceof Missing) {
            return;
        }
        if (!(value instanceof List<?> values)) {
            newDocument.put(key, value);
            return;
        }
        newDocument.put(key, slice.apply(values));
    }

}
