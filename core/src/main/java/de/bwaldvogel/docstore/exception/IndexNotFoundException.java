package de.bwaldvogel.docstore.exception;

import de.bwaldvogel.docstore.bson.Document;
import de.bwaldvogel.docstore.bson.Json;

public class IndexNotFoundException extends ServerError {

    private static final long serialVersionUID = 1L;

    public IndexNotFoundException(String indexName) {
        super(ErrorCode.IndexNotFound, "index not found with name [" + indexName + "]");
    }

    public IndexNotFoundException(Document keys) {
        super(ErrorCode.IndexNotFound, "can't find index with key: " + Json.toCompactJsonValue(keys));
    }

}
