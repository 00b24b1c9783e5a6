package de.bwaldvogel.docstore.backend;

import java.util.List;

import de.bwaldvogel.docstore.DocumentDatabase;
import de.bwaldvogel.docstore.bson.Document;

public abstract class AbstractSynchronizedDocumentCollection<P> extends AbstractDocumentCollection<P> {

    protected AbstractSynchronizedDocumentCollection(DocumentDatabase database, String collectionName,
                                                     CollectionOptions options, int maxDocumentSize) {
        super(database, collectionName, options, maxDocumentSize);
    }

    @Override
    public synchronized void addDocument(Document document) {
        super.addDocument(document);
    }

    @Override
    public synchronized void addIndex(Index<P> index) {
        super.addIndex(index);
    }

    @Override
    public synchronized void dropIndex(String indexName) {
        super.dropIndex(indexName);
    }

    @Override
    public synchronized List<Index<P>> getIndexes() {
        return List.copyOf(super.getIndexes());
    }

    @Override
    public synchronized QueryResult handleQuery(QueryParameters queryParameters) {
        return super.handleQuery(queryParameters);
    }

    @Override
    public synchronized List<Document> insertDocuments(List<Document> documents, boolean isOrdered) {
        return super.insertDocuments(documents, isOrdered);
    }

    @Override
    public synchronized int deleteDocuments(Document selector, int limit, CancellationSignal cancellationSignal) {
        return super.deleteDocuments(selector, limit, cancellationSignal);
    }

    @Override
    public synchronized Document updateDocuments(Document selector, Document update, boolean isMulti, boolean isUpsert,
                                                 CancellationSignal cancellationSignal) {
        return super.updateDocuments(selector, update, isMulti, isUpsert, cancellationSignal);
    }

    @Override
    public synchronized void removeDocument(Document document) {
        super.removeDocument(document);
    }

    @Override
    public synchronized int count(Document query, int skip, int limit) {
        return super.count(query, skip, limit);
    }

    @Override
    public synchronized Document getStats(int scale) {
        return super.getStats(scale);
    }

    @Override
    public synchronized void drop() {
        super.drop();
    }

}
