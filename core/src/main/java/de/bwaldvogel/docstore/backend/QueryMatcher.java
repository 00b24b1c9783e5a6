package de.bwaldvogel.docstore.backend;

import de.bwaldvogel.docstore.bson.Document;

public interface QueryMatcher {

    boolean matches(Document document, Document query);

    /**
     * Matches a single value, e.g. an array element, against a condition such as {@code {$gt: 5}} or a plain value.
     */
    boolean matchesValue(Object queryValue, Object value);

}
