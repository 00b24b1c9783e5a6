package de.bwaldvogel.docstore.backend;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import de.bwaldvogel.docstore.DocumentBackend;
import de.bwaldvogel.docstore.DocumentDatabase;
import de.bwaldvogel.docstore.bson.Document;

public abstract class AbstractDocumentBackend implements DocumentBackend {

    private static final Logger log = LoggerFactory.getLogger(AbstractDocumentBackend.class);

    private final Map<String, DocumentDatabase> databases = new ConcurrentHashMap<>();

    private volatile CreateCollectionSemantics createCollectionSemantics = CreateCollectionSemantics.IDEMPOTENT;

    private volatile int maxDocumentSize = Constants.MAX_BSON_OBJECT_SIZE;

    protected abstract DocumentDatabase openOrCreateDatabase(String databaseName);

    @Override
    public DocumentDatabase resolveDatabase(String databaseName) {
        return databases.computeIfAbsent(databaseName, name -> {
            DocumentDatabase database = openOrCreateDatabase(name);
            log.info("created database {}", database.getDatabaseName());
            return database;
        });
    }

    @Override
    public Document handleCommand(String databaseName, String command, Document query,
                                  CancellationSignal cancellationSignal) {
        switch (Command.parseString(command)) {
            case PING:
                Document pong = new Document();
                Utils.markOkay(pong);
                return pong;
            case DROP_DATABASE:
                return commandDropDatabase(databaseName);
            default:
                return resolveDatabase(databaseName).handleCommand(command, query, cancellationSignal);
        }
    }

    private Document commandDropDatabase(String databaseName) {
        dropDatabase(databaseName);
        Document response = new Document("dropped", databaseName);
        Utils.markOkay(response);
        return response;
    }

    @Override
    public void dropDatabase(String databaseName) {
        DocumentDatabase removedDatabase = databases.remove(databaseName);
        if (removedDatabase != null) {
            removedDatabase.drop();
            log.info("dropped database {}", databaseName);
        }
    }

    @Override
    public Collection<String> listDatabaseNames() {
        List<String> databaseNames = new ArrayList<>(databases.keySet());
        Collections.sort(databaseNames);
        return databaseNames;
    }

    @Override
    public CreateCollectionSemantics getCreateCollectionSemantics() {
        return createCollectionSemantics;
    }

    @Override
    public DocumentBackend createCollectionSemantics(CreateCollectionSemantics createCollectionSemantics) {
        this.createCollectionSemantics = Objects.requireNonNull(createCollectionSemantics);
        return this;
    }

    @Override
    public int getMaxDocumentSize() {
        return maxDocumentSize;
    }

    @Override
    public DocumentBackend maxDocumentSize(int maxDocumentSize) {
        if (maxDocumentSize <= 0) {
            throw new IllegalArgumentException("Illegal max document size: " + maxDocumentSize);
        }
        this.maxDocumentSize = maxDocumentSize;
        return this;
    }

    @Override
    public void close() {
        log.info("closing {}", this);
        databases.clear();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName();
    }

}
