package de.bwaldvogel.docstore.backend;

import java.util.Collections;
import java.util.Iterator;
import java.util.List;

import de.bwaldvogel.docstore.bson.Document;

/**
 * The documents of a query. All results are returned in a single batch, so there is never an open cursor.
 */
public class QueryResult implements Iterable<Document> {

    private final List<Document> documents;

    public QueryResult() {
        this(Collections.emptyList());
    }

    public QueryResult(List<Document> documents) {
        this.documents = documents;
    }

    public List<Document> getDocuments() {
        return documents;
    }

    public int size() {
        return documents.size();
    }

    @Override
    public Iterator<Document> iterator() {
        return documents.iterator();
    }

    public long getCursorId() {
        return 0L;
    }
}
