package de.bwaldvogel.docstore.backend;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import de.bwaldvogel.docstore.DocumentCollection;
import de.bwaldvogel.docstore.bson.Document;

public abstract class Index<P> {

    private final String name;
    private final List<IndexKey> keys;

    protected Index(String name, List<IndexKey> keys) {
        this.name = name;
        this.keys = keys;
    }

    public String getName() {
        return name;
    }

    public List<IndexKey> getKeys() {
        return keys;
    }

    public boolean hasSameKeys(Index<?> other) {
        return keys.equals(other.keys);
    }

    public boolean hasSameKeys(List<IndexKey> otherKeys) {
        return keys.equals(otherKeys);
    }

    protected List<String> keys() {
        return keys.stream()
            .map(IndexKey::getKey)
            .collect(Collectors.toList());
    }

    public boolean isUnique() {
        return false;
    }

    public Set<KeyValue> getKeyValues(Document document) {
        return getKeyValues(document, true);
    }

    /**
     * Array values yield one key value per element (multikey). With several array values the cross product is
     * built.
     */
    Set<KeyValue> getKeyValues(Document document, boolean normalize) {
        List<List<Object>> combinations = new ArrayList<>();
        combinations.add(new ArrayList<>());
        for (String key : keys()) {
            Object value = Utils.getSubdocumentValueCollectionAware(document, key);
            List<Object> candidates = new ArrayList<>();
            if (value instanceof Collection<?> collection && !collection.isEmpty()) {
                candidates.addAll(collection);
            } else {
                candidates.add(value);
            }
            List<List<Object>> extended = new ArrayList<>();
            for (List<Object> combination : combinations) {
                for (Object candidate : candidates) {
                    List<Object> newCombination = new ArrayList<>(combination);
                    if (normalize) {
                        newCombination.add(Utils.normalizeValue(candidate));
                    } else {
                        newCombination.add(Utils.isNullOrMissing(candidate) ? null : candidate);
                    }
                    extended.add(newCombination);
                }
            }
            combinations = extended;
        }
        Set<KeyValue> keyValues = new LinkedHashSet<>();
        for (List<Object> combination : combinations) {
            keyValues.add(new KeyValue(combination));
        }
        return keyValues;
    }

    public abstract void checkAdd(Document document, DocumentCollection<P> collection);

    public abstract void add(Document document, P position, DocumentCollection<P> collection);

    public abstract P remove(Document document);

    public abstract P getPosition(Document document);

    public abstract long getCount();

    public abstract long getDataSize();

    public abstract void checkUpdate(Document oldDocument, Document newDocument, DocumentCollection<P> collection);

    public abstract void updateInPlace(Document oldDocument, Document newDocument, P position, DocumentCollection<P> collection);

    public abstract void drop();

    protected boolean nullAwareEqualsKeys(Document oldDocument, Document newDocument) {
        Set<KeyValue> oldKeyValues = getKeyValues(oldDocument);
        Set<KeyValue> newKeyValues = getKeyValues(newDocument);
        return oldKeyValues.equals(newKeyValues);
    }

    public Document getKeyDocument() {
        return IndexSpecification.toKeyDocument(keys);
    }

    public Document toIndexDescription() {
        Document indexDescription = new Document("v", Integer.valueOf(2));
        indexDescription.put("key", getKeyDocument());
        indexDescription.put("name", getName());
        if (isUnique() && !getName().equals(Constants.PRIMARY_KEY_INDEX_NAME)) {
            indexDescription.put("unique", Boolean.TRUE);
        }
        return indexDescription;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[name=" + getName() + "]";
    }

}
