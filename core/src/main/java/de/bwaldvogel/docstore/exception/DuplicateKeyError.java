package de.bwaldvogel.docstore.exception;

import java.util.List;

import de.bwaldvogel.docstore.backend.KeyValue;

public class DuplicateKeyError extends ServerError {

    private static final long serialVersionUID = 1L;

    public DuplicateKeyError(String collectionFullName, String indexName, List<String> keys, KeyValue keyValue) {
        super(ErrorCode.DuplicateKey,
            "E11000 duplicate key error collection: " + collectionFullName
                + " index: " + indexName + " dup key: " + keyValue.toString(keys));
    }

}
