package de.bwaldvogel.docstore.backend;

import java.util.Objects;

public class IndexKey {

    private final String key;
    private final boolean ascending;

    public IndexKey(String key, boolean ascending) {
        this.key = Objects.requireNonNull(key);
        this.ascending = ascending;
    }

    public String getKey() {
        return key;
    }

    public boolean isAscending() {
        return ascending;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        IndexKey indexKey = (IndexKey) o;
        return ascending == indexKey.ascending && key.equals(indexKey.key);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, ascending);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[key=" + key + " " + (ascending ? "ASC" : "DESC") + "]";
    }

}
