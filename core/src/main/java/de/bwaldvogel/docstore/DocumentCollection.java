package de.bwaldvogel.docstore;

import java.util.List;

import de.bwaldvogel.docstore.backend.CancellationSignal;
import de.bwaldvogel.docstore.backend.CollectionOptions;
import de.bwaldvogel.docstore.backend.Index;
import de.bwaldvogel.docstore.backend.QueryParameters;
import de.bwaldvogel.docstore.backend.QueryResult;
import de.bwaldvogel.docstore.bson.Document;

public interface DocumentCollection<P> {

    DocumentDatabase getDatabase();

    default String getDatabaseName() {
        return getDatabase().getDatabaseName();
    }

    default String getFullName() {
        return getDatabaseName() + "." + getCollectionName();
    }

    String getCollectionName();

    CollectionOptions getOptions();

    void addIndex(Index<P> index);

    void dropIndex(String indexName);

    void addDocument(Document document);

    void removeDocument(Document document);

    default Iterable<Document> queryAll() {
        return handleQuery(new Document());
    }

    default QueryResult handleQuery(Document query) {
        return handleQuery(query, 0, 0);
    }

    default QueryResult handleQuery(Document query, int numberToSkip, int limit) {
        return handleQuery(new QueryParameters(query, numberToSkip, limit));
    }

    QueryResult handleQuery(QueryParameters queryParameters);

    default List<Document> insertDocuments(List<Document> documents) {
        return insertDocuments(documents, true);
    }

    /**
     * @return the write errors, empty if all documents were inserted
     */
    List<Document> insertDocuments(List<Document> documents, boolean isOrdered);

    default Document updateDocuments(Document selector, Document update, boolean isMulti, boolean isUpsert) {
        return updateDocuments(selector, update, isMulti, isUpsert, CancellationSignal.none());
    }

    Document updateDocuments(Document selector, Document update, boolean isMulti, boolean isUpsert,
                             CancellationSignal cancellationSignal);

    default int deleteDocuments(Document selector, int limit) {
        return deleteDocuments(selector, limit, CancellationSignal.none());
    }

    int deleteDocuments(Document selector, int limit, CancellationSignal cancellationSignal);

    Document getStats(int scale);

    default Document getStats() {
        return getStats(1);
    }

    int count(Document query, int skip, int limit);

    default boolean isEmpty() {
        return count() == 0;
    }

    int count();

    default int getNumIndexes() {
        return getIndexes().size();
    }

    List<Index<P>> getIndexes();

    long getDataSize();

    void drop();

    /**
     * @return {@code true} once the collection was dropped; it must not be written to anymore
     */
    boolean isDropped();

}
