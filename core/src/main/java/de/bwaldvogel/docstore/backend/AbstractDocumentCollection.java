package de.bwaldvogel.docstore.backend;

import static de.bwaldvogel.docstore.backend.Constants.ID_FIELD;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import de.bwaldvogel.docstore.DocumentCollection;
import de.bwaldvogel.docstore.DocumentDatabase;
import de.bwaldvogel.docstore.backend.projection.Projection;
import de.bwaldvogel.docstore.backend.update.UpdateExecutor;
import de.bwaldvogel.docstore.backend.update.UpdateResult;
import de.bwaldvogel.docstore.bson.Document;
import de.bwaldvogel.docstore.bson.ObjectId;
import de.bwaldvogel.docstore.exception.DocumentTooLargeException;
import de.bwaldvogel.docstore.exception.FailedToParseException;
import de.bwaldvogel.docstore.exception.IndexKeySpecsConflictException;
import de.bwaldvogel.docstore.exception.IndexNotFoundException;
import de.bwaldvogel.docstore.exception.InvalidIdFieldError;
import de.bwaldvogel.docstore.exception.ServerError;

public abstract class AbstractDocumentCollection<P> implements DocumentCollection<P> {

    private static final Logger log = LoggerFactory.getLogger(AbstractDocumentCollection.class);

    private final DocumentDatabase database;
    private final String collectionName;
    private final List<Index<P>> indexes = new ArrayList<>();
    private final QueryMatcher matcher = new DefaultQueryMatcher();
    private final UpdateExecutor updateExecutor = new UpdateExecutor(matcher);
    private final int maxDocumentSize;
    protected final CollectionOptions options;
    private volatile boolean dropped;

    protected AbstractDocumentCollection(DocumentDatabase database, String collectionName, CollectionOptions options,
                                         int maxDocumentSize) {
        this.database = Objects.requireNonNull(database);
        this.collectionName = Objects.requireNonNull(collectionName);
        this.options = Objects.requireNonNull(options);
        this.maxDocumentSize = maxDocumentSize;
    }

    protected boolean documentMatchesQuery(Document document, Document query) {
        return matcher.matches(document, query);
    }

    protected abstract void updateDataSize(long sizeDelta);

    protected abstract P addDocumentInternal(Document document);

    protected abstract void removeDocument(P position);

    protected abstract void handleUpdate(P position, Document oldDocument, Document newDocument);

    /**
     * Streams the stored documents in natural order. For capped collections the natural order must be the insertion
     * order.
     */
    protected abstract Stream<DocumentWithPosition<P>> streamAllDocumentsWithPosition();

    @Override
    public DocumentDatabase getDatabase() {
        return database;
    }

    @Override
    public String getCollectionName() {
        return collectionName;
    }

    @Override
    public CollectionOptions getOptions() {
        return options;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + getFullName() + ")";
    }

    @Override
    public void addDocument(Document document) {
        if (document.get(ID_FIELD) instanceof Collection) {
            throw new InvalidIdFieldError("The '_id' value cannot be of type array");
        }

        if (!document.containsKey(ID_FIELD)) {
            ObjectId generatedObjectId = new ObjectId();
            log.trace("Generated {} for {} in {}", generatedObjectId, document, this);
            Document fields = new Document(document);
            document.clear();
            document.put(ID_FIELD, generatedObjectId);
            document.putAll(fields);
        }

        long documentSize = checkDocumentSize(document);

        for (Index<P> index : indexes) {
            index.checkAdd(document, this);
        }

        P position = addDocumentInternal(document);

        for (Index<P> index : indexes) {
            index.add(document, position, this);
        }

        updateDataSize(documentSize);

        if (options.isCapped()) {
            evictOldestDocuments();
        }
    }

    private long checkDocumentSize(Document document) {
        long documentSize = Utils.calculateSize(document);
        if (documentSize > maxDocumentSize) {
            throw new DocumentTooLargeException(documentSize, maxDocumentSize);
        }
        return documentSize;
    }

    /**
     * Removes documents in insertion order until the collection fits into its capped limits again. The most recent
     * document is always kept.
     */
    private void evictOldestDocuments() {
        Long cappedMax = options.getCappedMax();
        Long cappedSize = options.getCappedSize();
        while (count() > 1
            && ((cappedMax != null && count() > cappedMax.longValue())
            || (cappedSize != null && getDataSize() > cappedSize.longValue()))) {
            Document oldest = streamAllDocumentsWithPosition()
                .map(DocumentWithPosition::getDocument)
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("No document to evict in " + this));
            log.trace("Evicting {} from capped collection {}", oldest.get(ID_FIELD), getFullName());
            removeDocument(oldest);
        }
    }

    @Override
    public void addIndex(Index<P> index) {
        Index<P> existingIndex = findByName(index.getName());
        if (existingIndex != null) {
            if (!existingIndex.hasSameKeys(index) || existingIndex.isUnique() != index.isUnique()) {
                throw new IndexKeySpecsConflictException(keyAndName(index), keyAndName(existingIndex));
            }
            log.debug("Index with name '{}' already exists", index.getName());
            return;
        }
        streamAllDocumentsWithPosition().forEach(documentWithPosition -> {
            Document document = documentWithPosition.getDocument();
            index.checkAdd(document, this);
        });
        streamAllDocumentsWithPosition().forEach(documentWithPosition -> {
            Document document = documentWithPosition.getDocument();
            P position = documentWithPosition.getPosition();
            index.add(document, position, this);
        });
        indexes.add(index);
        log.info("created index '{}' on {}", index.getName(), getFullName());
    }

    private static Document keyAndName(Index<?> index) {
        Document description = new Document("key", index.getKeyDocument());
        description.put("name", index.getName());
        return description;
    }

    private Index<P> findByName(String indexName) {
        return indexes.stream()
            .filter(index -> index.getName().equals(indexName))
            .findFirst()
            .orElse(null);
    }

    @Override
    public void dropIndex(String indexName) {
        Index<P> indexToDrop = findByName(indexName);
        if (indexToDrop == null) {
            throw new IndexNotFoundException(indexName);
        }
        indexToDrop.drop();
        indexes.remove(indexToDrop);
        log.info("dropped index '{}' of {}", indexName, getFullName());
    }

    @Override
    public void drop() {
        log.debug("Dropping collection {}", getFullName());
        dropped = true;
        for (Index<P> index : indexes) {
            index.drop();
        }
        indexes.clear();
    }

    @Override
    public boolean isDropped() {
        return dropped;
    }

    @Override
    public List<Index<P>> getIndexes() {
        return Collections.unmodifiableList(indexes);
    }

    @Override
    public QueryResult handleQuery(QueryParameters queryParameters) {
        Document projection = queryParameters.getProjection();
        Projection projector = null;
        if (projection != null && !projection.isEmpty()) {
            projector = new Projection(projection, ID_FIELD);
        }

        List<Document> matchedDocuments = matchDocuments(queryParameters.getQuerySelector(),
                queryParameters.getCancellationSignal()).stream()
            .map(DocumentWithPosition::getDocument)
            .collect(Collectors.toList());

        Document orderBy = queryParameters.getOrderBy();
        if (isNaturalDescending(orderBy)) {
            Collections.reverse(matchedDocuments);
        } else if (orderBy != null && !orderBy.isEmpty() && !orderBy.containsKey("$natural")) {
            matchedDocuments.sort(new DocumentComparator(orderBy));
        }

        Stream<Document> documentStream = matchedDocuments.stream();
        if (queryParameters.getNumberToSkip() > 0) {
            documentStream = documentStream.skip(queryParameters.getNumberToSkip());
        }
        if (queryParameters.getLimit() > 0) {
            documentStream = documentStream.limit(queryParameters.getLimit());
        }
        documentStream = documentStream.map(Document::cloneDeeply);
        if (projector != null) {
            documentStream = documentStream.map(projector::projectDocument);
        }
        return new QueryResult(documentStream.collect(Collectors.toList()));
    }

    private static boolean isNaturalDescending(Document orderBy) {
        if (orderBy != null && orderBy.containsKey("$natural")) {
            Object sortValue = orderBy.get("$natural");
            return sortValue instanceof Number number && number.intValue() == -1;
        }
        return false;
    }

    /**
     * Scans the collection and returns the stored documents matching the query. The cancellation signal is polled
     * while scanning.
     */
    protected List<DocumentWithPosition<P>> matchDocuments(Document query, CancellationSignal cancellationSignal) {
        cancellationSignal.throwIfCancelled();
        Document filter = query != null ? query : new Document();
        List<DocumentWithPosition<P>> matches = new ArrayList<>();
        int scanned = 0;
        Iterator<DocumentWithPosition<P>> iterator = streamAllDocumentsWithPosition().iterator();
        while (iterator.hasNext()) {
            DocumentWithPosition<P> documentWithPosition = iterator.next();
            scanned++;
            if (scanned % Constants.CANCELLATION_CHECK_INTERVAL == 0) {
                cancellationSignal.throwIfCancelled();
            }
            if (documentMatchesQuery(documentWithPosition.getDocument(), filter)) {
                matches.add(documentWithPosition);
            }
        }
        log.trace("{} of {} documents in {} match {}", matches.size(), scanned, getFullName(), filter);
        return matches;
    }

    @Override
    public List<Document> insertDocuments(List<Document> documents, boolean isOrdered) {
        int index = 0;
        List<Document> writeErrors = new ArrayList<>();
        for (Document document : documents) {
            try {
                DocumentValidator.validate(document);
                addDocument(document.cloneDeeply());
            } catch (ServerError e) {
                writeErrors.add(toWriteError(index, e));
                if (isOrdered) {
                    break;
                }
            }
            index++;
        }
        return writeErrors;
    }

    static Document toWriteError(int index, ServerError e) {
        Document error = new Document();
        error.put("index", Integer.valueOf(index));
        error.put("code", Integer.valueOf(e.getCode()));
        error.put("errmsg", e.getMessageWithoutErrorCode());
        error.putIfNotNull("codeName", e.getCodeName());
        return error;
    }

    @Override
    public int deleteDocuments(Document selector, int limit, CancellationSignal cancellationSignal) {
        int deleted = 0;
        for (DocumentWithPosition<P> match : matchDocuments(selector, cancellationSignal)) {
            if (limit > 0 && deleted >= limit) {
                break;
            }
            removeDocument(match.getDocument());
            deleted++;
        }
        log.debug("Deleted {} documents from {}", deleted, getFullName());
        return deleted;
    }

    @Override
    public Document updateDocuments(Document selector, Document update, boolean isMulti, boolean isUpsert,
                                    CancellationSignal cancellationSignal) {
        UpdateExecutor.validateUpdate(update);
        if (isMulti && !UpdateExecutor.isOperatorUpdate(update)) {
            throw new FailedToParseException("multi update is not supported for replacement-style update");
        }

        int nMatched = 0;
        int nModified = 0;
        for (DocumentWithPosition<P> match : matchDocuments(selector, cancellationSignal)) {
            if (updateDocument(match, update)) {
                nModified++;
            }
            nMatched++;

            if (!isMulti) {
                break;
            }
        }

        Document result = new Document();

        if (nMatched == 0 && isUpsert) {
            Document newDocument = updateExecutor.createUpsertDocument(selector, update);
            addDocument(newDocument);
            result.put("upserted", newDocument.get(ID_FIELD));
        }

        result.put("n", Integer.valueOf(nMatched));
        result.put("nModified", Integer.valueOf(nModified));
        return result;
    }

    private boolean updateDocument(DocumentWithPosition<P> match, Document update) {
        Document document = match.getDocument();
        UpdateResult updateResult = updateExecutor.apply(document, update, false);
        if (!updateResult.isModified()) {
            return false;
        }

        Document oldDocument = document.cloneDeeply();
        Document newDocument = updateResult.getDocument();
        long newSize = checkDocumentSize(newDocument);

        for (Index<P> index : indexes) {
            index.checkUpdate(oldDocument, newDocument, this);
        }
        P position = match.getPosition();
        for (Index<P> index : indexes) {
            index.updateInPlace(oldDocument, newDocument, position, this);
        }

        updateDataSize(newSize - Utils.calculateSize(oldDocument));

        document.clear();
        document.putAll(newDocument);
        handleUpdate(position, oldDocument, document);
        return true;
    }

    @Override
    public void removeDocument(Document document) {
        P position = null;

        for (Index<P> index : indexes) {
            P indexPosition = index.remove(document);
            if (indexPosition == null) {
                continue;
            }
            if (position != null && !position.equals(indexPosition)) {
                throw new IllegalStateException("Got different positions for " + document);
            }
            position = indexPosition;
        }

        if (position == null) {
            position = findDocumentPosition(document);
        }

        if (position == null) {
            // not found
            return;
        }

        updateDataSize(-Utils.calculateSize(document));

        removeDocument(position);
    }

    protected P findDocumentPosition(Document document) {
        return streamAllDocumentsWithPosition()
            .filter(match -> match.getDocument() == document || Utils.nullAwareEquals(match.getDocument(), document))
            .map(DocumentWithPosition::getPosition)
            .findFirst()
            .orElse(null);
    }

    @Override
    public int count(Document query, int skip, int limit) {
        int count;
        if (query == null || query.isEmpty()) {
            count = count();
        } else {
            count = matchDocuments(query, CancellationSignal.none()).size();
        }
        if (skip > 0) {
            count = Math.max(0, count - skip);
        }
        if (limit > 0) {
            return Math.min(limit, count);
        }
        return count;
    }

    @Override
    public Document getStats(int scale) {
        long dataSize = getDataSize();
        int count = count();

        Document response = new Document("ns", getFullName());
        response.put("size", Long.valueOf(dataSize / scale));
        response.put("count", Long.valueOf(count));
        if (count > 0) {
            response.put("avgObjSize", Long.valueOf(dataSize / count));
        }
        response.put("storageSize", Long.valueOf(dataSize / scale));

        long totalIndexSize = 0;
        Document indexSizes = new Document();
        for (Index<P> index : indexes) {
            long indexSize = index.getDataSize();
            totalIndexSize += indexSize;
            indexSizes.put(index.getName(), Long.valueOf(indexSize / scale));
        }

        response.put("nindexes", Long.valueOf(indexes.size()));
        response.put("totalIndexSize", Long.valueOf(totalIndexSize / scale));
        response.put("totalSize", Long.valueOf((dataSize + totalIndexSize) / scale));
        response.put("indexSizes", indexSizes);
        response.put("scaleFactor", Integer.valueOf(scale));
        response.put("capped", Boolean.valueOf(options.isCapped()));
        if (options.isCapped()) {
            response.putIfNotNull("max", options.getCappedMax());
            response.put("maxSize", Long.valueOf(options.getCappedSize().longValue() / scale));
        }
        Utils.markOkay(response);
        return response;
    }

}
