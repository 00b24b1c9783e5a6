package de.bwaldvogel.docstore.backend;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import de.bwaldvogel.docstore.bson.BsonType;
import de.bwaldvogel.docstore.bson.Document;
import de.bwaldvogel.docstore.bson.Json;
import de.bwaldvogel.docstore.exception.BadValueException;
import de.bwaldvogel.docstore.exception.CannotCreateIndexException;
import de.bwaldvogel.docstore.exception.ErrorCode;
import de.bwaldvogel.docstore.exception.FailedToParseException;
import de.bwaldvogel.docstore.exception.IndexAlreadyExistsException;
import de.bwaldvogel.docstore.exception.IndexKeySpecsConflictException;
import de.bwaldvogel.docstore.exception.IndexOptionsConflictException;
import de.bwaldvogel.docstore.exception.ServerError;
import de.bwaldvogel.docstore.exception.TypeMismatchException;

/**
 * One entry of the {@code indexes} array of a {@code createIndexes} command.
 */
public final class IndexSpecification {

    private static final Logger log = LoggerFactory.getLogger(IndexSpecification.class);

    private static final Set<String> NOT_IMPLEMENTED_OPTIONS = Set.of(
        "sparse", "partialFilterExpression", "expireAfterSeconds", "hidden", "storageEngine",
        "weights", "default_language", "language_override", "textIndexVersion", "2dsphereIndexVersion",
        "bits", "min", "max", "bucketSize", "collation", "wildcardProjection");

    private final String name;
    private final List<IndexKey> keys;
    private final boolean unique;

    public IndexSpecification(String name, List<IndexKey> keys, boolean unique) {
        this.name = Objects.requireNonNull(name);
        this.keys = List.copyOf(keys);
        this.unique = unique;
    }

    public String getName() {
        return name;
    }

    public List<IndexKey> getKeys() {
        return keys;
    }

    public boolean isUnique() {
        return unique;
    }

    public Document getKeyDocument() {
        return toKeyDocument(keys);
    }

    static Document toKeyDocument(List<IndexKey> keys) {
        Document key = new Document();
        for (IndexKey indexKey : keys) {
            key.put(indexKey.getKey(), Integer.valueOf(indexKey.isAscending() ? 1 : -1));
        }
        return key;
    }

    Document toShortDescription() {
        Document description = new Document("key", getKeyDocument());
        description.put("name", name);
        return description;
    }

    static String formatKeys(List<IndexKey> keys) {
        return keys.stream()
            .map(key -> key.getKey() + ": " + (key.isAscending() ? 1 : -1))
            .collect(Collectors.joining(", ", "{ ", " }"));
    }

    /**
     * Parses and validates the {@code indexes} argument.
     */
    public static List<IndexSpecification> parseAll(Object indexes) {
        if (indexes == null) {
            throw new ServerError(ErrorCode._40414, "BSON field 'createIndexes.indexes' is missing but a required field");
        }
        if (!(indexes instanceof List<?> indexList)) {
            throw new TypeMismatchException("BSON field 'createIndexes.indexes' is the wrong type '"
                + BsonType.aliasOf(indexes) + "', expected type 'array'");
        }
        if (indexList.isEmpty()) {
            throw new BadValueException("Must specify at least one index to create");
        }
        List<IndexSpecification> specifications = new ArrayList<>();
        for (int i = 0; i < indexList.size(); i++) {
            Object value = indexList.get(i);
            if (!(value instanceof Document indexDocument)) {
                throw new TypeMismatchException("BSON field 'createIndexes.indexes." + i + "' is the wrong type '"
                    + BsonType.aliasOf(value) + "', expected type 'object'");
            }
            specifications.add(parse(indexDocument));
        }
        return specifications;
    }

    static IndexSpecification parse(Document indexDocument) {
        if (indexDocument.isEmpty()) {
            throw new FailedToParseException("Error in specification {} :: caused by :: "
                + "The 'key' field is a required property of an index specification");
        }

        Object key = indexDocument.get("key");
        if (!(key instanceof Document keyDocument)) {
            throw new TypeMismatchException("'key' option must be specified as an object");
        }
        if (keyDocument.isEmpty()) {
            throw new CannotCreateIndexException("Must specify at least one field for the index key");
        }
        if (keyDocument.size() == 1 && keyDocument.containsKey(Constants.ID_FIELD)
            && isWholeNumber(keyDocument.get(Constants.ID_FIELD))
            && ((Number) keyDocument.get(Constants.ID_FIELD)).longValue() == -1) {
            throw new BadValueException("The field 'key' for an _id index must be {_id: 1}, but got { _id: -1 }");
        }

        List<IndexKey> keys = parseKeys(keyDocument);

        Object nameValue = indexDocument.get("name");
        if (nameValue == null) {
            throw new FailedToParseException("Error in specification { key: " + Json.toCompactJsonValue(keyDocument)
                + " } :: caused by :: The 'name' field is a required property of an index specification");
        }
        if (!(nameValue instanceof String name)) {
            throw new TypeMismatchException("'name' option must be specified as a string");
        }
        if (name.isEmpty()) {
            throw new CannotCreateIndexException("Error in specification { key: " + formatKeys(keys)
                + ", name: \"\", v: 2 } :: caused by :: index name cannot be empty");
        }

        boolean unique = false;
        for (String option : indexDocument.keySet()) {
            switch (option) {
                case "key":
                case "name":
                    break;
                case "unique":
                    Object uniqueValue = indexDocument.get(option);
                    if (!(uniqueValue instanceof Boolean uniqueFlag)) {
                        String renderedUnique = Json.toCompactJsonValue(uniqueValue);
                        throw new TypeMismatchException("Error in specification { key: "
                            + Json.toCompactJsonValue(keyDocument) + ", name: \"" + name + "\", unique: "
                            + renderedUnique + " } :: caused by :: The field 'unique' has value unique: "
                            + renderedUnique + ", which is not convertible to bool");
                    }
                    if (keys.size() == 1 && keys.get(0).getKey().equals(Constants.ID_FIELD)) {
                        throw new ServerError(ErrorCode.InvalidIndexSpecificationOption,
                            "The field 'unique' is not valid for an _id index specification. Specification: { key: "
                                + Json.toCompactJsonValue(keyDocument) + ", name: \"" + name + "\", unique: true, v: 2 }");
                    }
                    unique = uniqueFlag.booleanValue();
                    break;
                case "background":
                case "v":
                    log.debug("Ignoring index option '{}'", option);
                    break;
                default:
                    if (NOT_IMPLEMENTED_OPTIONS.contains(option)) {
                        throw new ServerError(ErrorCode.NotImplemented, "Index option \"" + option + "\" is not implemented yet");
                    }
                    throw new BadValueException("Index option \"" + option + "\" is unknown");
            }
        }

        if (name.equals(Constants.PRIMARY_KEY_INDEX_NAME)
            && !(keys.size() == 1 && keys.get(0).equals(new IndexKey(Constants.ID_FIELD, true)))) {
            throw new BadValueException("The index name '_id_' is reserved for the _id index, which must have key "
                + "pattern {_id: 1}, found key: " + formatKeys(keys));
        }

        return new IndexSpecification(name, keys, unique);
    }

    /**
     * Parses an index key document such as {@code {a: 1, b: -1}}.
     */
    public static List<IndexKey> parseKeys(Document keyDocument) {
        List<IndexKey> keys = new ArrayList<>();
        Set<String> fields = new HashSet<>();
        for (String field : keyDocument.getDecodedKeys()) {
            if (!fields.add(field)) {
                throw new BadValueException("Error in specification " + Json.toCompactJsonValue(keyDocument)
                    + ", the field \"" + field + "\" appears multiple times");
            }
            Object order = keyDocument.get(field);
            if (!isWholeNumber(order)) {
                throw new ServerError(ErrorCode.NotImplemented,
                    "Index key value " + Json.toCompactJsonValue(order) + " is not implemented yet");
            }
            long direction = ((Number) order).longValue();
            if (direction != 1 && direction != -1) {
                throw new ServerError(ErrorCode.NotImplemented, "Index key value " + direction + " is not implemented yet");
            }
            keys.add(new IndexKey(field, direction == 1));
        }
        return keys;
    }

    private static boolean isWholeNumber(Object value) {
        if (value instanceof Integer || value instanceof Long) {
            return true;
        }
        if (value instanceof Double doubleValue) {
            double d = doubleValue.doubleValue();
            return !Double.isInfinite(d) && d == Math.rint(d);
        }
        return false;
    }

    /**
     * Checks the requested indexes against each other and against the existing ones.
     *
     * @return the requested indexes that do not exist yet
     */
    public static List<IndexSpecification> filterNew(List<IndexSpecification> requested, List<? extends Index<?>> existing) {
        List<IndexSpecification> toCreate = new ArrayList<>();
        for (int i = 0; i < requested.size(); i++) {
            IndexSpecification specification = requested.get(i);
            for (int j = i - 1; j >= 0; j--) {
                IndexSpecification other = requested.get(j);
                if (other.name.equals(specification.name) && other.keys.equals(specification.keys)) {
                    throw new IndexAlreadyExistsException(other.name);
                }
                if (other.name.equals(specification.name)) {
                    throw new IndexKeySpecsConflictException(specification.toShortDescription(), other.toShortDescription());
                }
                if (other.keys.equals(specification.keys)) {
                    throw new IndexOptionsConflictException(other.name);
                }
            }

            boolean exists = false;
            for (Index<?> index : existing) {
                if (index.getName().equals(specification.name) && index.hasSameKeys(specification.keys)) {
                    exists = true;
                    break;
                }
                if (index.getName().equals(specification.name)) {
                    Document existingDescription = new Document("key", index.getKeyDocument());
                    existingDescription.put("name", index.getName());
                    throw new IndexKeySpecsConflictException(specification.toShortDescription(), existingDescription);
                }
                if (index.hasSameKeys(specification.keys)) {
                    throw new IndexOptionsConflictException(index.getName());
                }
            }
            if (!exists) {
                toCreate.add(specification);
            }
        }
        return toCreate;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[name=" + name + ", keys=" + formatKeys(keys) + ", unique=" + unique + "]";
    }

}
