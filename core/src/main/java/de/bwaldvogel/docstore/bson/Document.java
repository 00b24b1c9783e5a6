package de.bwaldvogel.docstore.bson;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Ordered key/value tree. Two documents are only equal if they hold the same entries in the same order.
 * <p>
 * Documents produced by {@link de.bwaldvogel.docstore.wire.BsonDecoder} remember the raw key sequence as it
 * appeared on the wire, so repeated keys and keys that were not valid UTF-8 can still be reported by the
 * validator although the map itself only keeps the first value of a repeated key.
 */
public final class Document implements Map<String, Object>, Bson {

    private static final long serialVersionUID = 1L;

    private final LinkedHashMap<String, Object> documentAsMap = new LinkedHashMap<>();

    private transient List<String> decodedKeys;
    private transient Set<String> malformedKeys;

    public Document() {
    }

    public Document(String key, Object value) {
        this();
        append(key, value);
    }

    public Document(Map<String, ?> map) {
        this();
        putAll(map);
    }

    public Document cloneDeeply() {
        return cloneDeeply(this);
    }

    /**
     * Deep copy of a value; documents and lists are copied, everything else is immutable.
     */
    public static Object cloneValue(Object value) {
        return cloneDeeply(value);
    }

    @SuppressWarnings("unchecked")
    private static <T> T cloneDeeply(T object) {
        if (object == null) {
            return null;
        } else if (object instanceof Document document) {
            Document clone = document.clone();
            for (String key : document.keySet()) {
                clone.put(key, cloneDeeply(clone.get(key)));
            }
            return (T) clone;
        } else if (object instanceof List<?> list) {
            List<?> result = list.stream()
                .map(Document::cloneDeeply)
                .collect(Collectors.toCollection(ArrayList::new));
            return (T) result;
        } else if (object instanceof Set<?> set) {
            Set<?> result = set.stream()
                .map(Document::cloneDeeply)
                .collect(Collectors.toCollection(LinkedHashSet::new));
            return (T) result;
        } else {
            return object;
        }
    }

    public Document append(String key, Object value) {
        put(key, value);
        return this;
    }

    public Document appendAll(Map<String, Object> map) {
        putAll(map);
        return this;
    }

    /**
     * Appends a key exactly as it was read from the wire. A repeated key keeps its first value.
     */
    public Document appendDecoded(String key, Object value, boolean wellFormedKey) {
        if (decodedKeys == null) {
            decodedKeys = new ArrayList<>(keySet());
        }
        decodedKeys.add(key);
        if (!wellFormedKey) {
            if (malformedKeys == null) {
                malformedKeys = new HashSet<>();
            }
            malformedKeys.add(key);
        }
        documentAsMap.putIfAbsent(key, value);
        return this;
    }

    /**
     * The keys in the order they were decoded, including repetitions.
     */
    public List<String> getDecodedKeys() {
        if (decodedKeys == null) {
            return List.copyOf(keySet());
        }
        return Collections.unmodifiableList(decodedKeys);
    }

    public boolean isMalformedKey(String key) {
        return malformedKeys != null && malformedKeys.contains(key);
    }

    public Object getOrMissing(String key) {
        if (!containsKey(key)) {
            return Missing.getInstance();
        }
        return get(key);
    }

    @Override
    public boolean containsValue(Object value) {
        return documentAsMap.containsValue(value);
    }

    @Override
    public Object get(Object key) {
        return documentAsMap.get(key);
    }

    @Override
    public void clear() {
        forgetDecodedKeys();
        documentAsMap.clear();
    }

    @Override
    public int size() {
        return documentAsMap.size();
    }

    @Override
    public boolean isEmpty() {
        return documentAsMap.isEmpty();
    }

    @Override
    public boolean containsKey(Object key) {
        return documentAsMap.containsKey(key);
    }

    @Override
    public Object put(String key, Object value) {
        forgetDecodedKeys();
        return documentAsMap.put(key, value);
    }

    public void putIfNotNull(String key, Object value) {
        if (value != null) {
            put(key, value);
        }
    }

    @Override
    public void putAll(Map<? extends String, ?> m) {
        forgetDecodedKeys();
        documentAsMap.putAll(m);
    }

    @Override
    public Object remove(Object key) {
        forgetDecodedKeys();
        return documentAsMap.remove(key);
    }

    private void forgetDecodedKeys() {
        decodedKeys = null;
        malformedKeys = null;
    }

    @Override
    @SuppressWarnings("unchecked")
    public Document clone() {
        return new Document((Map<String, Object>) documentAsMap.clone());
    }

    @Override
    public Set<String> keySet() {
        return documentAsMap.keySet();
    }

    @Override
    public Collection<Object> values() {
        return documentAsMap.values();
    }

    @Override
    public Set<Entry<String, Object>> entrySet() {
        return documentAsMap.entrySet();
    }

    @Override
    public boolean equals(Object o) {
        if (o == null) {
            return false;
        }
        if (o == this) {
            return true;
        }
        if (!(o instanceof Document other)) {
            return false;
        }
        if (documentAsMap.size() != other.documentAsMap.size()) {
            return false;
        }
        Iterator<Entry<String, Object>> iterator = other.documentAsMap.entrySet().iterator();
        for (Entry<String, Object> entry : documentAsMap.entrySet()) {
            Entry<String, Object> otherEntry = iterator.next();
            if (!entry.getKey().equals(otherEntry.getKey())) {
                return false;
            }
            if (!Objects.equals(entry.getValue(), otherEntry.getValue())) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        return documentAsMap.hashCode();
    }

    @Override
    public String toString() {
        return toString(false);
    }

    public String toString(boolean compactKey) {
        return toString(compactKey, "{", "}");
    }

    public String toString(boolean compactKey, String jsonPrefix, String jsonSuffix) {
        return documentAsMap.entrySet().stream()
            .map(entry -> writeKey(entry.getKey(), compactKey) + " " + Json.toJsonValue(entry.getValue(), compactKey, jsonPrefix, jsonSuffix))
            .collect(Collectors.joining(", ", jsonPrefix, jsonSuffix));
    }

    private static String writeKey(String key, boolean compactKey) {
        if (compactKey) {
            return Json.escapeJson(key) + ":";
        } else {
            return "\"" + Json.escapeJson(key) + "\" :";
        }
    }

}
