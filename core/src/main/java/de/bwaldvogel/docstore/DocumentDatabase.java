package de.bwaldvogel.docstore;

import java.util.Collection;

import de.bwaldvogel.docstore.backend.CancellationSignal;
import de.bwaldvogel.docstore.backend.CollectionOptions;
import de.bwaldvogel.docstore.bson.Document;

public interface DocumentDatabase {

    String getDatabaseName();

    Document handleCommand(String command, Document query, CancellationSignal cancellationSignal);

    boolean isEmpty();

    default DocumentCollection<?> createCollectionOrThrowIfExists(String collectionName) {
        return createCollectionOrThrowIfExists(collectionName, CollectionOptions.withDefaults());
    }

    DocumentCollection<?> createCollectionOrThrowIfExists(String collectionName, CollectionOptions options);

    /**
     * Creates the collection unless it exists. Concurrent callers for the same name all get the one collection that
     * was created.
     */
    DocumentCollection<?> createCollectionIfAbsent(String collectionName, CollectionOptions options);

    DocumentCollection<?> resolveCollection(String collectionName, boolean throwIfNotFound);

    Collection<String> getCollectionNames();

    void drop();

    void dropCollection(String collectionName);

}
