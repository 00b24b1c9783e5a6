package de.bwaldvogel.docstore.backend;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import de.bwaldvogel.docstore.DocumentBackend;
import de.bwaldvogel.docstore.DocumentCollection;
import de.bwaldvogel.docstore.DocumentDatabase;
import de.bwaldvogel.docstore.backend.update.UpdateExecutor;
import de.bwaldvogel.docstore.bson.BsonType;
import de.bwaldvogel.docstore.bson.Document;
import de.bwaldvogel.docstore.bson.Missing;
import de.bwaldvogel.docstore.exception.ErrorCode;
import de.bwaldvogel.docstore.exception.FailedToParseException;
import de.bwaldvogel.docstore.exception.IndexNotFoundException;
import de.bwaldvogel.docstore.exception.InvalidNamespaceError;
import de.bwaldvogel.docstore.exception.InvalidOptionsException;
import de.bwaldvogel.docstore.exception.NamespaceExistsException;
import de.bwaldvogel.docstore.exception.NoSuchCollectionException;
import de.bwaldvogel.docstore.exception.NoSuchCommandException;
import de.bwaldvogel.docstore.exception.OperationCancelledException;
import de.bwaldvogel.docstore.exception.ServerError;
import de.bwaldvogel.docstore.exception.TypeMismatchException;

public abstract class AbstractDocumentDatabase<P> implements DocumentDatabase {

    private static final Logger log = LoggerFactory.getLogger(AbstractDocumentDatabase.class);

    private static final IndexKey ID_INDEX_KEY = new IndexKey(Constants.ID_FIELD, true);

    protected final String databaseName;
    private final DocumentBackend backend;

    private final Map<String, DocumentCollection<P>> collections = new ConcurrentHashMap<>();

    private final QueryMatcher matcher = new DefaultQueryMatcher();

    protected AbstractDocumentDatabase(String databaseName, DocumentBackend backend) {
        this.databaseName = Objects.requireNonNull(databaseName);
        this.backend = Objects.requireNonNull(backend);
    }

    protected abstract DocumentCollection<P> openOrCreateCollection(String collectionName, CollectionOptions options);

    protected abstract Index<P> openOrCreateUniqueIndex(String collectionName, String indexName, List<IndexKey> keys);

    protected abstract void dropCollectionInternal(DocumentCollection<P> collection);

    protected abstract long getStorageSize();

    protected DocumentBackend getBackend() {
        return backend;
    }

    @Override
    public final String getDatabaseName() {
        return databaseName;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + getDatabaseName() + ")";
    }

    private String getFullName(String collectionName) {
        return databaseName + "." + collectionName;
    }

    @Override
    public Document handleCommand(String command, Document query, CancellationSignal cancellationSignal) {
        switch (Command.parseString(command)) {
            case INSERT:
                return commandInsert(command, query);
            case FIND:
                return commandFind(command, query, cancellationSignal);
            case COUNT:
                return commandCount(command, query, cancellationSignal);
            case UPDATE:
                return commandUpdate(command, query, cancellationSignal);
            case DELETE:
                return commandDelete(command, query, cancellationSignal);
            case CREATE:
                return commandCreate(command, query);
            case DROP:
                return commandDrop(command, query);
            case LIST_COLLECTIONS:
                return commandListCollections(command, query);
            case LIST_INDEXES:
                return commandListIndexes(command, query);
            case CREATE_INDEXES:
                return commandCreateIndexes(command, query);
            case DROP_INDEXES:
                return commandDropIndexes(command, query);
            case COLL_STATS:
                return commandCollectionStats(command, query);
            case DB_STATS:
                return commandDatabaseStats(command, query);
            case DATA_SIZE:
                return commandDataSize(command, query);
            case EXPLAIN:
                return commandExplain(command, query);
            default:
                log.error("unknown query: {}", query);
                throw new NoSuchCommandException(command);
        }
    }

    private Document commandInsert(String command, Document query) {
        String collectionName = CommandParameters.getCollectionName(databaseName, command, query);
        List<Document> documents = CommandParameters.getRequiredDocuments(command, query, "documents");
        boolean isOrdered = CommandParameters.getOptionalBoolean(command, query, "ordered", true);
        log.trace("ordered: {}", isOrdered);

        List<Document> writeErrors = writeToCollection(collectionName, true,
            collection -> collection.insertDocuments(documents, isOrdered));

        int n;
        if (isOrdered && !writeErrors.isEmpty()) {
            n = ((Integer) writeErrors.get(0).get("index")).intValue();
        } else {
            n = documents.size() - writeErrors.size();
        }

        Document response = new Document("n", Integer.valueOf(n));
        if (!writeErrors.isEmpty()) {
            response.put("writeErrors", writeErrors);
        }
        Utils.markOkay(response);
        return response;
    }

    private Document commandFind(String command, Document query, CancellationSignal cancellationSignal) {
        String collectionName = CommandParameters.getCollectionName(databaseName, command, query);
        Document filter = CommandParameters.getOptionalDocument(command, query, "filter");
        Document projection = CommandParameters.getOptionalDocument(command, query, "projection");
        Document sort = CommandParameters.getOptionalDocument(command, query, "sort");
        int skip = CommandParameters.getOptionalNonNegativeNumber(command, query, "skip");
        int limit = CommandParameters.getOptionalNonNegativeNumber(command, query, "limit");
        CommandParameters.getOptionalNonNegativeNumber(command, query, "batchSize");

        Object comment = query.get("comment");
        if (comment != null) {
            log.debug("query comment: {}", comment);
        }

        List<Document> documents;
        DocumentCollection<P> collection = resolveCollection(collectionName, false);
        if (collection == null) {
            documents = Collections.emptyList();
        } else {
            QueryParameters queryParameters = new QueryParameters(filter, sort, skip, limit, projection, cancellationSignal);
            documents = collection.handleQuery(queryParameters).getDocuments();
        }
        return firstBatchCursorResponse(getFullName(collectionName), documents);
    }

    private static Document firstBatchCursorResponse(String namespace, List<Document> firstBatch) {
        Document cursor = new Document();
        cursor.put("firstBatch", firstBatch);
        cursor.put("id", Long.valueOf(0));
        cursor.put("ns", namespace);

        Document response = new Document("cursor", cursor);
        Utils.markOkay(response);
        return response;
    }

    private Document commandCount(String command, Document query, CancellationSignal cancellationSignal) {
        String collectionName = CommandParameters.getCollectionName(databaseName, command, query);
        Document countQuery = CommandParameters.getOptionalDocument(command, query, "query");
        int skip = CommandParameters.getOptionalNonNegativeNumber(command, query, "skip");
        int limit = CommandParameters.getOptionalNonNegativeNumber(command, query, "limit");

        int count = 0;
        DocumentCollection<P> collection = resolveCollection(collectionName, false);
        if (collection != null) {
            cancellationSignal.throwIfCancelled();
            count = collection.count(countQuery, skip, limit);
        }
        Document response = new Document("n", Integer.valueOf(count));
        Utils.markOkay(response);
        return response;
    }

    private Document commandUpdate(String command, Document query, CancellationSignal cancellationSignal) {
        String collectionName = CommandParameters.getCollectionName(databaseName, command, query);
        List<Document> updates = CommandParameters.getRequiredDocuments(command, query, "updates");
        boolean isOrdered = CommandParameters.getOptionalBoolean(command, query, "ordered", true);
        String statementPrefix = command + ".updates";

        int nMatched = 0;
        int nModified = 0;
        List<Document> upserts = new ArrayList<>();
        List<Document> writeErrors = new ArrayList<>();
        for (int i = 0; i < updates.size(); i++) {
            Document updateObj = updates.get(i);
            try {
                Document selector = CommandParameters.getRequiredDocument(statementPrefix, updateObj, "q");
                Document update = CommandParameters.getRequiredDocument(statementPrefix, updateObj, "u");
                boolean multi = CommandParameters.getOptionalBoolean(statementPrefix, updateObj, "multi", false);
                boolean upsert = CommandParameters.getOptionalBoolean(statementPrefix, updateObj, "upsert", false);
                UpdateExecutor.validateUpdate(update);

                Document result = writeToCollection(collectionName, upsert, collection -> collection == null
                    ? null
                    : collection.updateDocuments(selector, update, multi, upsert, cancellationSignal));
                if (result == null) {
                    continue;
                }
                if (result.containsKey("upserted")) {
                    Document upserted = new Document("index", Integer.valueOf(i));
                    upserted.put(Constants.ID_FIELD, result.get("upserted"));
                    upserts.add(upserted);
                    nMatched++;
                }
                nMatched += ((Integer) result.get("n")).intValue();
                nModified += ((Integer) result.get("nModified")).intValue();
            } catch (OperationCancelledException e) {
                throw e;
            } catch (ServerError e) {
                log.debug("update statement {} failed: {}", Integer.valueOf(i), e.getMessage());
                writeErrors.add(AbstractDocumentCollection.toWriteError(i, e));
                if (isOrdered) {
                    break;
                }
            }
        }

        Document response = new Document();
        response.put("n", Integer.valueOf(nMatched));
        response.put("nModified", Integer.valueOf(nModified));
        if (!upserts.isEmpty()) {
            response.put("upserted", upserts);
        }
        if (!writeErrors.isEmpty()) {
            response.put("writeErrors", writeErrors);
        }
        Utils.markOkay(response);
        return response;
    }

    private Document commandDelete(String command, Document query, CancellationSignal cancellationSignal) {
        String collectionName = CommandParameters.getCollectionName(databaseName, command, query);
        List<Document> deletes = CommandParameters.getRequiredDocuments(command, query, "deletes");
        boolean isOrdered = CommandParameters.getOptionalBoolean(command, query, "ordered", true);
        String statementPrefix = command + ".deletes";

        int n = 0;
        List<Document> writeErrors = new ArrayList<>();
        for (int i = 0; i < deletes.size(); i++) {
            Document delete = deletes.get(i);
            try {
                Document selector = CommandParameters.getRequiredDocument(statementPrefix, delete, "q");
                Number limit = CommandParameters.getRequiredNumber(statementPrefix, delete, "limit");
                if (limit.doubleValue() != 0 && limit.doubleValue() != 1) {
                    throw new FailedToParseException("The limit field in delete objects must be 0 or 1. Got " + limit);
                }
                n += writeToCollection(collectionName, false, collection -> collection == null
                    ? Integer.valueOf(0)
                    : Integer.valueOf(collection.deleteDocuments(selector, limit.intValue(), cancellationSignal)))
                    .intValue();
            } catch (OperationCancelledException e) {
                throw e;
            } catch (ServerError e) {
                log.debug("delete statement {} failed: {}", Integer.valueOf(i), e.getMessage());
                writeErrors.add(AbstractDocumentCollection.toWriteError(i, e));
                if (isOrdered) {
                    break;
                }
            }
        }

        Document response = new Document("n", Integer.valueOf(n));
        if (!writeErrors.isEmpty()) {
            response.put("writeErrors", writeErrors);
        }
        Utils.markOkay(response);
        return response;
    }

    private Document commandCreate(String command, Document query) {
        String collectionName = CommandParameters.getCollectionName(databaseName, command, query);
        CollectionOptions options = CollectionOptions.fromQuery(query);

        if (backend.getCreateCollectionSemantics() == CreateCollectionSemantics.LEGACY_NAMESPACE_EXISTS) {
            createCollectionOrThrowIfExists(collectionName, options);
        } else {
            createCollectionIfAbsent(collectionName, options);
        }

        Document response = new Document();
        Utils.markOkay(response);
        return response;
    }

    private Document commandDrop(String command, Document query) {
        String collectionName = CommandParameters.getCollectionName(databaseName, command, query);
        int numIndexesWas = removeAndDropCollection(collectionName);

        Document response = new Document();
        response.put("nIndexesWas", Integer.valueOf(numIndexesWas));
        response.put("ns", getFullName(collectionName));
        Utils.markOkay(response);
        return response;
    }

    private Document commandListCollections(String command, Document query) {
        Document filter = CommandParameters.getOptionalDocument(command, query, "filter");
        boolean nameOnly = CommandParameters.getOptionalBoolean(command, query, "nameOnly", false);

        List<Document> firstBatch = new ArrayList<>();
        for (String collectionName : getCollectionNames()) {
            DocumentCollection<P> collection = collections.get(collectionName);
            if (collection == null) {
                continue;
            }
            Document collectionDescription = new Document("name", collectionName);
            collectionDescription.put("type", "collection");
            collectionDescription.put("options", collection.getOptions().toDocument());
            collectionDescription.put("info", new Document("readOnly", Boolean.FALSE));
            collection.getIndexes().stream()
                .filter(index -> index.getName().equals(Constants.PRIMARY_KEY_INDEX_NAME))
                .findFirst()
                .ifPresent(index -> collectionDescription.put("idIndex", index.toIndexDescription()));

            if (filter != null && !matcher.matches(collectionDescription, filter)) {
                continue;
            }
            if (nameOnly) {
                Document nameAndType = new Document("name", collectionName);
                nameAndType.put("type", "collection");
                firstBatch.add(nameAndType);
            } else {
                firstBatch.add(collectionDescription);
            }
        }
        return firstBatchCursorResponse(databaseName + ".$cmd.listCollections", firstBatch);
    }

    private Document commandListIndexes(String command, Document query) {
        String collectionName = CommandParameters.getCollectionName(databaseName, command, query);
        DocumentCollection<P> collection = resolveCollection(collectionName, false);
        if (collection == null) {
            throw new ServerError(ErrorCode.NamespaceNotFound, "ns does not exist: " + getFullName(collectionName));
        }
        List<Document> firstBatch = new ArrayList<>();
        for (Index<P> index : collection.getIndexes()) {
            firstBatch.add(index.toIndexDescription());
        }
        return firstBatchCursorResponse(collection.getFullName(), firstBatch);
    }

    private Document commandCreateIndexes(String command, Document query) {
        String collectionName = CommandParameters.getCollectionName(databaseName, command, query);
        List<IndexSpecification> specifications = IndexSpecification.parseAll(query.get("indexes"));

        AtomicBoolean created = new AtomicBoolean();
        int numIndexesBefore;
        int numIndexesAfter;
        List<IndexSpecification> newIndexes;
        while (true) {
            DocumentCollection<P> collection = getOrCreateCollection(collectionName, CollectionOptions.withDefaults(), created);
            synchronized (collection) {
                if (collection.isDropped()) {
                    log.debug("{} was dropped concurrently, resolving it again", collection.getFullName());
                    continue;
                }
                numIndexesBefore = Math.max(1, collection.getNumIndexes());
                newIndexes = IndexSpecification.filterNew(specifications, collection.getIndexes());
                for (IndexSpecification specification : newIndexes) {
                    collection.addIndex(createIndex(collectionName, specification));
                }
                numIndexesAfter = Math.max(1, collection.getNumIndexes());
                break;
            }
        }

        Document response = new Document();
        response.put("numIndexesBefore", Integer.valueOf(numIndexesBefore));
        response.put("numIndexesAfter", Integer.valueOf(numIndexesAfter));
        if (newIndexes.isEmpty()) {
            response.put("note", "all indexes already exist");
        } else {
            response.put("createdCollectionAutomatically", Boolean.valueOf(created.get()));
        }
        Utils.markOkay(response);
        return response;
    }

    private Index<P> createIndex(String collectionName, IndexSpecification specification) {
        if (specification.isUnique()) {
            return openOrCreateUniqueIndex(collectionName, specification.getName(), specification.getKeys());
        }
        return new NonUniqueIndex<>(specification.getName(), specification.getKeys());
    }

    private Document commandDropIndexes(String command, Document query) {
        String collectionName = CommandParameters.getCollectionName(databaseName, command, query);
        Object indexSelector = query.get("index");
        if (Missing.isNullOrMissing(indexSelector)) {
            throw CommandParameters.missingField(command, "index");
        }
        return writeToCollection(collectionName, false, collection -> {
            if (collection == null) {
                throw new NoSuchCollectionException(getFullName(collectionName));
            }
            Document response = new Document("nIndexesWas", Integer.valueOf(collection.getNumIndexes()));
            if ("*".equals(indexSelector)) {
                for (Index<P> index : new ArrayList<>(collection.getIndexes())) {
                    if (!index.getName().equals(Constants.PRIMARY_KEY_INDEX_NAME)) {
                        collection.dropIndex(index.getName());
                    }
                }
                response.put("msg", "non-_id indexes dropped for collection");
            } else {
                // all names are resolved first, so that nothing is dropped if one of them is invalid
                for (String indexName : resolveIndexNames(collection, indexSelector)) {
                    collection.dropIndex(indexName);
                }
            }
            Utils.markOkay(response);
            return response;
        });
    }

    private Set<String> resolveIndexNames(DocumentCollection<P> collection, Object indexSelector) {
        Set<String> indexNames = new LinkedHashSet<>();
        if (indexSelector instanceof List<?> selectors) {
            for (Object selector : selectors) {
                if (!(selector instanceof String) && !(selector instanceof Document)) {
                    throw invalidIndexSelector(indexSelector);
                }
                indexNames.add(resolveIndexName(collection, selector));
            }
        } else if (indexSelector instanceof String || indexSelector instanceof Document) {
            indexNames.add(resolveIndexName(collection, indexSelector));
        } else {
            throw invalidIndexSelector(indexSelector);
        }
        return indexNames;
    }

    private static TypeMismatchException invalidIndexSelector(Object indexSelector) {
        return new TypeMismatchException("BSON field 'dropIndexes.index' is the wrong type '"
            + BsonType.aliasOf(indexSelector) + "', expected types '[string, object]'");
    }

    private String resolveIndexName(DocumentCollection<P> collection, Object selector) {
        if (selector instanceof String indexName) {
            if (indexName.equals(Constants.PRIMARY_KEY_INDEX_NAME)) {
                throw new InvalidOptionsException("cannot drop _id index");
            }
            return collection.getIndexes().stream()
                .map(Index::getName)
                .filter(indexName::equals)
                .findFirst()
                .orElseThrow(() -> new IndexNotFoundException(indexName));
        }
        Document keyDocument = (Document) selector;
        List<IndexKey> keys = IndexSpecification.parseKeys(keyDocument);
        if (keys.equals(List.of(ID_INDEX_KEY))) {
            throw new InvalidOptionsException("cannot drop _id index");
        }
        return collection.getIndexes().stream()
            .filter(index -> index.hasSameKeys(keys))
            .map(Index::getName)
            .findFirst()
            .orElseThrow(() -> new IndexNotFoundException(keyDocument));
    }

    private Document commandCollectionStats(String command, Document query) {
        String collectionName = CommandParameters.getCollectionName(databaseName, command, query);
        int scale = StatsScale.parse(command, query.get("scale"));
        DocumentCollection<P> collection = resolveCollection(collectionName, false);
        if (collection == null) {
            throw new NoSuchCollectionException(getFullName(collectionName));
        }
        return collection.getStats(scale);
    }

    private Document commandDatabaseStats(String command, Document query) {
        int scale = StatsScale.parse(command, query.get("scale"));
        boolean freeStorage = Utils.isTrue(query.get("freeStorage"));

        long objects = 0;
        long dataSize = 0;
        long indexes = 0;
        long indexSize = 0;
        for (DocumentCollection<P> collection : collections.values()) {
            objects += collection.count();
            dataSize += collection.getDataSize();
            for (Index<P> index : collection.getIndexes()) {
                indexes++;
                indexSize += index.getDataSize();
            }
        }
        long storageSize = getStorageSize();
        double averageObjectSize = 0;
        if (objects > 0) {
            averageObjectSize = dataSize / ((double) objects);
        }

        Document response = new Document("db", databaseName);
        response.put("collections", Long.valueOf(collections.size()));
        response.put("objects", Long.valueOf(objects));
        response.put("avgObjSize", Double.valueOf(averageObjectSize));
        response.put("dataSize", Long.valueOf(dataSize / scale));
        response.put("storageSize", Long.valueOf(storageSize / scale));
        response.put("indexes", Long.valueOf(indexes));
        response.put("indexSize", Long.valueOf(indexSize / scale));
        response.put("totalSize", Long.valueOf((storageSize + indexSize) / scale));
        response.put("scaleFactor", Integer.valueOf(scale));
        if (freeStorage) {
            response.put("freeStorageSize", Long.valueOf(0));
        }
        Utils.markOkay(response);
        return response;
    }

    private Document commandDataSize(String command, Document query) {
        long start = System.currentTimeMillis();
        Object value = query.get(command);
        if (!(value instanceof String namespace)) {
            throw CommandParameters.wrongType(command, command, value, "expected type 'string'");
        }
        int dotPos = namespace.indexOf('.');
        if (dotPos <= 0 || dotPos == namespace.length() - 1) {
            throw InvalidNamespaceError.invalidNamespace(namespace);
        }
        String namespaceDatabase = Utils.getDatabaseNameFromFullName(namespace);
        String collectionName = Utils.getCollectionNameFromFullName(namespace);

        DocumentCollection<?> collection = null;
        if (namespaceDatabase.equals(databaseName)) {
            collection = resolveCollection(collectionName, false);
        } else if (backend.listDatabaseNames().contains(namespaceDatabase)) {
            collection = backend.resolveDatabase(namespaceDatabase).resolveCollection(collectionName, false);
        }

        long size = 0;
        long numObjects = 0;
        if (collection != null) {
            size = collection.getDataSize();
            numObjects = collection.count();
        }

        Document response = new Document("estimate", Boolean.FALSE);
        response.put("size", Long.valueOf(size));
        response.put("numObjects", Long.valueOf(numObjects));
        response.put("millis", Long.valueOf(System.currentTimeMillis() - start));
        Utils.markOkay(response);
        return response;
    }

    private Document commandExplain(String command, Document query) {
        Object explainValue = query.get(command);
        if (!(explainValue instanceof Document explainedCommand)) {
            throw CommandParameters.wrongType(command, command, explainValue, "expected type 'object'");
        }
        if (explainedCommand.isEmpty()) {
            throw new FailedToParseException("explain command requires a nested object");
        }
        String wrappedCommandName = explainedCommand.keySet().iterator().next();
        Command wrappedCommand = Command.lookup(wrappedCommandName);
        if (wrappedCommand == null) {
            throw new ServerError(ErrorCode.CommandNotFound, "Explain failed due to unknown command: " + wrappedCommandName);
        }

        String collectionName = CommandParameters.getCollectionName(databaseName, wrappedCommandName, explainedCommand);
        Document parsedQuery;
        switch (wrappedCommand) {
            case FIND:
                parsedQuery = CommandParameters.getOptionalDocument(wrappedCommandName, explainedCommand, "filter");
                CommandParameters.getOptionalNonNegativeNumber(wrappedCommandName, explainedCommand, "skip");
                CommandParameters.getOptionalNonNegativeNumber(wrappedCommandName, explainedCommand, "limit");
                break;
            case COUNT:
                parsedQuery = CommandParameters.getOptionalDocument(wrappedCommandName, explainedCommand, "query");
                CommandParameters.getOptionalNonNegativeNumber(wrappedCommandName, explainedCommand, "skip");
                CommandParameters.getOptionalNonNegativeNumber(wrappedCommandName, explainedCommand, "limit");
                break;
            case UPDATE:
                parsedQuery = firstStatementQuery(wrappedCommandName, explainedCommand, "updates");
                break;
            case DELETE:
                parsedQuery = firstStatementQuery(wrappedCommandName, explainedCommand, "deletes");
                break;
            default:
                throw new ServerError(ErrorCode.CommandNotFound, "Explain failed due to unknown command: " + wrappedCommandName);
        }

        Document queryPlanner = new Document("namespace", getFullName(collectionName));
        queryPlanner.put("parsedQuery", parsedQuery != null ? parsedQuery : new Document());
        queryPlanner.put("winningPlan", new Document("stage", "COLLSCAN"));

        Document response = new Document("queryPlanner", queryPlanner);
        response.put("command", explainedCommand);
        Utils.markOkay(response);
        return response;
    }

    private static Document firstStatementQuery(String command, Document query, String statementsField) {
        List<Document> statements = CommandParameters.getRequiredDocuments(command, query, statementsField);
        if (statements.isEmpty()) {
            return null;
        }
        return CommandParameters.getOptionalDocument(command + "." + statementsField, statements.get(0), "q");
    }

    @Override
    public boolean isEmpty() {
        return collections.isEmpty();
    }

    @Override
    public DocumentCollection<P> createCollectionOrThrowIfExists(String collectionName, CollectionOptions options) {
        AtomicBoolean created = new AtomicBoolean();
        DocumentCollection<P> collection = getOrCreateCollection(collectionName, options, created);
        if (!created.get()) {
            throw new NamespaceExistsException(collection.getFullName());
        }
        return collection;
    }

    @Override
    public DocumentCollection<P> createCollectionIfAbsent(String collectionName, CollectionOptions options) {
        return getOrCreateCollection(collectionName, options, new AtomicBoolean());
    }

    private DocumentCollection<P> getOrCreateCollection(String collectionName, CollectionOptions options,
                                                        AtomicBoolean created) {
        Utils.validateCollectionName(databaseName, collectionName);
        return collections.computeIfAbsent(collectionName, name -> {
            created.set(true);
            return createCollection(name, options);
        });
    }

    private DocumentCollection<P> createCollection(String collectionName, CollectionOptions options) {
        DocumentCollection<P> collection = openOrCreateCollection(collectionName, options);
        collection.addIndex(openOrCreateUniqueIndex(collectionName, Constants.PRIMARY_KEY_INDEX_NAME, List.of(ID_INDEX_KEY)));
        log.info("created collection {}", collection.getFullName());
        return collection;
    }

    @Override
    public DocumentCollection<P> resolveCollection(String collectionName, boolean throwIfNotFound) {
        DocumentCollection<P> collection = collections.get(collectionName);
        if (collection == null && throwIfNotFound) {
            throw new NoSuchCollectionException(getFullName(collectionName));
        }
        return collection;
    }

    @Override
    public Collection<String> getCollectionNames() {
        List<String> collectionNames = new ArrayList<>(collections.keySet());
        Collections.sort(collectionNames);
        return collectionNames;
    }

    @Override
    public void drop() {
        log.debug("dropping {}", this);
        for (String collectionName : getCollectionNames()) {
            collections.computeIfPresent(collectionName, (name, collection) -> {
                dropCollectionInternal(collection);
                return null;
            });
        }
    }

    @Override
    public void dropCollection(String collectionName) {
        removeAndDropCollection(collectionName);
    }

    /**
     * Removes the collection and drops it in one step, so that a collection of the same name cannot be created in
     * between.
     *
     * @return the number of indexes the collection had
     */
    private int removeAndDropCollection(String collectionName) {
        AtomicInteger numIndexesWas = new AtomicInteger();
        collections.compute(collectionName, (name, collection) -> {
            if (collection == null) {
                throw new NoSuchCollectionException();
            }
            numIndexesWas.set(collection.getNumIndexes());
            dropCollectionInternal(collection);
            log.info("dropped collection {}", collection.getFullName());
            return null;
        });
        return numIndexesWas.get();
    }

    /**
     * Runs the action while holding the monitor of the collection. A collection that was dropped in the meantime is
     * resolved again, so that writes never end up in a dropped collection. The action gets {@code null} if the
     * collection does not exist and must not be created.
     */
    private <T> T writeToCollection(String collectionName, boolean createIfAbsent,
                                    Function<DocumentCollection<P>, T> action) {
        while (true) {
            DocumentCollection<P> collection = createIfAbsent
                ? createCollectionIfAbsent(collectionName, CollectionOptions.withDefaults())
                : resolveCollection(collectionName, false);
            if (collection == null) {
                return action.apply(null);
            }
            synchronized (collection) {
                if (!collection.isDropped()) {
                    return action.apply(collection);
                }
            }
            log.debug("{} was dropped concurrently, resolving it again", collection.getFullName());
        }
    }

}
