package de.bwaldvogel.docstore.backend;

import java.util.List;
import java.util.Set;

import de.bwaldvogel.docstore.DocumentCollection;
import de.bwaldvogel.docstore.bson.Document;
import de.bwaldvogel.docstore.exception.DuplicateKeyError;

public abstract class AbstractUniqueIndex<P> extends Index<P> {

    protected AbstractUniqueIndex(String name, List<IndexKey> keys) {
        super(name, keys);
    }

    protected abstract P removeDocument(KeyValue keyValue);

    protected abstract boolean containsKey(KeyValue keyValue);

    protected abstract boolean putKeyPosition(KeyValue keyValue, P position);

    protected abstract P getPosition(KeyValue keyValue);

    @Override
    public boolean isUnique() {
        return true;
    }

    @Override
    public synchronized P remove(Document document) {
        P position = null;
        for (KeyValue keyValue : getKeyValues(document)) {
            P removed = removeDocument(keyValue);
            if (removed != null) {
                position = removed;
            }
        }
        return position;
    }

    @Override
    public synchronized P getPosition(Document document) {
        for (KeyValue keyValue : getKeyValues(document)) {
            P position = getPosition(keyValue);
            if (position != null) {
                return position;
            }
        }
        return null;
    }

    @Override
    public synchronized void checkAdd(Document document, DocumentCollection<P> collection) {
        for (KeyValue keyValue : getKeyValues(document, false)) {
            if (containsKey(keyValue.normalized())) {
                throw new DuplicateKeyError(collection.getFullName(), getName(), keys(), keyValue);
            }
        }
    }

    @Override
    public synchronized void add(Document document, P position, DocumentCollection<P> collection) {
        checkAdd(document, collection);
        for (KeyValue keyValue : getKeyValues(document)) {
            boolean added = putKeyPosition(keyValue, position);
            if (!added) {
                throw new IllegalStateException("Key " + keyValue + " already exists. Concurrency issue?");
            }
        }
    }

    @Override
    public synchronized void checkUpdate(Document oldDocument, Document newDocument, DocumentCollection<P> collection) {
        if (nullAwareEqualsKeys(oldDocument, newDocument)) {
            return;
        }
        Set<KeyValue> oldKeyValues = getKeyValues(oldDocument);
        for (KeyValue keyValue : getKeyValues(newDocument, false)) {
            KeyValue normalized = keyValue.normalized();
            if (!oldKeyValues.contains(normalized) && containsKey(normalized)) {
                throw new DuplicateKeyError(collection.getFullName(), getName(), keys(), keyValue);
            }
        }
    }

    @Override
    public synchronized void updateInPlace(Document oldDocument, Document newDocument, P position, DocumentCollection<P> collection) {
        if (!nullAwareEqualsKeys(oldDocument, newDocument)) {
            remove(oldDocument);
            add(newDocument, position, collection);
        }
    }

}
