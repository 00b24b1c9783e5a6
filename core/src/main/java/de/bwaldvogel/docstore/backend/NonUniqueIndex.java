package de.bwaldvogel.docstore.backend;

import java.util.List;

import de.bwaldvogel.docstore.DocumentCollection;
import de.bwaldvogel.docstore.bson.Document;

/**
 * An index without constraints. Queries always scan the collection, so nothing needs to be tracked.
 */
public class NonUniqueIndex<P> extends Index<P> {

    public NonUniqueIndex(String name, List<IndexKey> keys) {
        super(name, keys);
    }

    @Override
    public void checkAdd(Document document, DocumentCollection<P> collection) {
        // ignore
    }

    @Override
    public void add(Document document, P position, DocumentCollection<P> collection) {
        // ignore
    }

    @Override
    public P remove(Document document) {
        return null;
    }

    @Override
    public P getPosition(Document document) {
        return null;
    }

    @Override
    public long getCount() {
        return 0;
    }

    @Override
    public long getDataSize() {
        return 0;
    }

    @Override
    public void checkUpdate(Document oldDocument, Document newDocument, DocumentCollection<P> collection) {
        // ignore
    }

    @Override
    public void updateInPlace(Document oldDocument, Document newDocument, P position, DocumentCollection<P> collection) {
        // ignore
    }

    @Override
    public void drop() {
    }

}
