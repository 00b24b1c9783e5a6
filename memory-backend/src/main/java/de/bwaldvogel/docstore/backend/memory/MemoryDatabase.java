package de.bwaldvogel.docstore.backend.memory;

import java.util.List;

import de.bwaldvogel.docstore.DocumentBackend;
import de.bwaldvogel.docstore.DocumentCollection;
import de.bwaldvogel.docstore.backend.AbstractDocumentDatabase;
import de.bwaldvogel.docstore.backend.CollectionOptions;
import de.bwaldvogel.docstore.backend.Index;
import de.bwaldvogel.docstore.backend.IndexKey;
import de.bwaldvogel.docstore.backend.memory.index.MemoryUniqueIndex;

public class MemoryDatabase extends AbstractDocumentDatabase<Integer> {

    public MemoryDatabase(String databaseName, DocumentBackend backend) {
        super(databaseName, backend);
    }

    @Override
    protected MemoryCollection openOrCreateCollection(String collectionName, CollectionOptions options) {
        return new MemoryCollection(this, collectionName, options, getBackend().getMaxDocumentSize());
    }

    @Override
    protected Index<Integer> openOrCreateUniqueIndex(String collectionName, String indexName, List<IndexKey> keys) {
        return new MemoryUniqueIndex(indexName, keys);
    }

    @Override
    protected void dropCollectionInternal(DocumentCollection<Integer> collection) {
        collection.drop();
    }

    @Override
    protected long getStorageSize() {
        return getCollectionNames().stream()
            .map(collectionName -> resolveCollection(collectionName, false))
            .filter(collection -> collection != null)
            .mapToLong(DocumentCollection::getDataSize)
            .sum();
    }

}
