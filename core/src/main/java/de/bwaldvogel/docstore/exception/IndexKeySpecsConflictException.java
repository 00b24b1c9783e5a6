package de.bwaldvogel.docstore.exception;

import de.bwaldvogel.docstore.bson.Document;
import de.bwaldvogel.docstore.bson.Json;

public class IndexKeySpecsConflictException extends ServerError {

    private static final long serialVersionUID = 1L;

    public IndexKeySpecsConflictException(Document requestedIndex, Document existingIndex) {
        super(ErrorCode.IndexKeySpecsConflict,
            "An existing index has the same name as the requested index. " +
                "When index names are not specified, they are auto generated and can cause conflicts. " +
                "Please refer to our documentation. " +
                "Requested index: " + Json.toCompactJsonValue(requestedIndex) + ", " +
                "existing index: " + Json.toCompactJsonValue(existingIndex));
    }

}
