package de.bwaldvogel.docstore.backend;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import de.bwaldvogel.docstore.bson.Json;

/**
 * The values a document holds for the keys of an index, in key order.
 */
public final class KeyValue implements Serializable, Iterable<Object> {

    private static final long serialVersionUID = 1L;

    private final List<Object> values;

    public KeyValue(Object... values) {
        this(Arrays.asList(values));
    }

    public KeyValue(Collection<?> values) {
        this.values = new ArrayList<>(values);
    }

    public int size() {
        return values.size();
    }

    public Object get(int index) {
        return values.get(index);
    }

    @Override
    public Iterator<Object> iterator() {
        return values.iterator();
    }

    public KeyValue normalized() {
        return new KeyValue(values.stream()
            .map(Utils::normalizeValue)
            .collect(Collectors.toList()));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        KeyValue other = (KeyValue) o;
        return Objects.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values);
    }

    /**
     * Renders the values together with the given key names, e.g. {@code { _id: "a" }}.
     */
    public String toString(List<String> keys) {
        List<String> entries = new ArrayList<>();
        for (int i = 0; i < values.size(); i++) {
            String key = i < keys.size() ? keys.get(i) : "";
            entries.add(key + ": " + Json.toCompactJsonValue(values.get(i)));
        }
        return entries.stream().collect(Collectors.joining(", ", "{ ", " }"));
    }

    @Override
    public String toString() {
        return values.stream()
            .map(value -> ": " + Json.toCompactJsonValue(value))
            .collect(Collectors.joining(", ", "{ ", " }"));
    }

}
