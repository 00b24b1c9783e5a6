package de.bwaldvogel.docstore;

import java.util.Collection;

import de.bwaldvogel.docstore.backend.CancellationSignal;
import de.bwaldvogel.docstore.backend.CreateCollectionSemantics;
import de.bwaldvogel.docstore.bson.Document;

public interface DocumentBackend {

    Document handleCommand(String databaseName, String command, Document query, CancellationSignal cancellationSignal);

    DocumentDatabase resolveDatabase(String databaseName);

    void dropDatabase(String databaseName);

    Collection<String> listDatabaseNames();

    CreateCollectionSemantics getCreateCollectionSemantics();

    DocumentBackend createCollectionSemantics(CreateCollectionSemantics createCollectionSemantics);

    int getMaxDocumentSize();

    DocumentBackend maxDocumentSize(int maxDocumentSize);

    void close();

}
